package sgg.grammars;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;
import com.google.common.io.Resources;

/**
 * The fixed lists and names the generator needs besides the schema itself:
 * type tags, token spellings, lexical rules, major sections and so on.
 * <p>
 * A configuration is usually read from a properties file, see
 * {@link #fromProperties(Properties)}. {@link #csharp()} returns the built-in
 * profile for the C# syntax schema.
 */
public final class GrammarConfiguration {

    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final String TOKEN_KIND_PREFIX = "token.kind.";
    private static final String TOKEN_ALIAS_PREFIX = "token.alias.";
    private static final String LEXICAL_FIELD_PREFIX = "field.lexical.";

    private static final Supplier<GrammarConfiguration> CSHARP =
            Suppliers.memoize(() -> fromResource(Resources.getResource(GrammarConfiguration.class, "csharp.properties")));

    private final String grammarName;
    private final String ruleSuffix;
    private final String boolType;
    private final String tokenType;
    private final String listType;
    private final String separatedListType;
    private final String modifierRule;
    private final String separatorListField;
    private final String separator;
    private final String modifierListField;
    private final ImmutableMap<String, String> lexicalListFields;
    private final ImmutableMap<String, String> tokenAliases;
    private final String eofKind;
    private final ImmutableSet<String> droppedKinds;
    private final ImmutableSet<String> epsilonKinds;
    private final ImmutableList<String> lexicalRules;
    private final ImmutableList<String> majorSections;
    private final ImmutableList<String> declarationModifiers;
    private final ImmutableSortedMap<String, String> tokenKinds;

    private GrammarConfiguration(Builder b) {
        this.grammarName = b.grammarName;
        this.ruleSuffix = b.ruleSuffix;
        this.boolType = b.boolType;
        this.tokenType = b.tokenType;
        this.listType = b.listType;
        this.separatedListType = b.separatedListType;
        this.modifierRule = b.modifierRule;
        this.separatorListField = b.separatorListField;
        this.separator = b.separator;
        this.modifierListField = b.modifierListField;
        this.lexicalListFields = ImmutableMap.copyOf(b.lexicalListFields);
        this.tokenAliases = ImmutableMap.copyOf(b.tokenAliases);
        this.eofKind = b.eofKind;
        this.droppedKinds = ImmutableSet.copyOf(b.droppedKinds);
        this.epsilonKinds = ImmutableSet.copyOf(b.epsilonKinds);
        this.lexicalRules = ImmutableList.copyOf(b.lexicalRules);
        this.majorSections = ImmutableList.copyOf(b.majorSections);
        this.declarationModifiers = ImmutableList.copyOf(b.declarationModifiers);
        this.tokenKinds = ImmutableSortedMap.copyOf(b.tokenKinds);
    }

    /**
     * The profile for the C# syntax schema, read from {@code csharp.properties}
     * next to this class.
     */
    public static GrammarConfiguration csharp() {
        return CSHARP.get();
    }

    public static GrammarConfiguration load(File file) throws IOException {
        Properties props = new Properties();
        try (Reader in = Files.newReader(file, UTF_8)) {
            props.load(in);
        }
        return fromProperties(props);
    }

    private static GrammarConfiguration fromResource(URL resource) {
        Properties props = new Properties();
        try (Reader in = Resources.asCharSource(resource, UTF_8).openStream()) {
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
        return fromProperties(props);
    }

    public static GrammarConfiguration fromProperties(Properties props) {
        Builder b = builder()
                .grammarName(required(props, "grammar.name"))
                .ruleSuffix(props.getProperty("schema.suffix", ""))
                .boolType(required(props, "type.bool"))
                .tokenType(required(props, "type.token"))
                .listType(required(props, "type.list"))
                .separatedListType(required(props, "type.separatedList"))
                .modifierRule(required(props, "rule.modifier"))
                .separatorListField(required(props, "field.separators"))
                .separator(required(props, "separator.text"))
                .modifierListField(required(props, "field.modifiers"))
                .eofKind(required(props, "token.eof"))
                .droppedKinds(list(props, "token.dropped"))
                .epsilonKinds(list(props, "token.epsilon"))
                .lexicalRules(list(props, "lexical"))
                .majorSections(list(props, "sections"))
                .declarationModifiers(list(props, "modifiers"));

        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key).trim();
            if (key.startsWith(TOKEN_KIND_PREFIX)) {
                b.tokenKind(key.substring(TOKEN_KIND_PREFIX.length()), value);
            } else if (key.startsWith(TOKEN_ALIAS_PREFIX)) {
                b.tokenAlias(key.substring(TOKEN_ALIAS_PREFIX.length()), value);
            } else if (key.startsWith(LEXICAL_FIELD_PREFIX)) {
                b.lexicalListField(key.substring(LEXICAL_FIELD_PREFIX.length()), value);
            }
        }
        return b.build();
    }

    private static String required(Properties props, String key) {
        String value = props.getProperty(key);
        Preconditions.checkArgument(value != null && !value.trim().isEmpty(), "Missing configuration key: %s", key);
        return value.trim();
    }

    private static List<String> list(Properties props, String key) {
        return LIST_SPLITTER.splitToList(props.getProperty(key, ""));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Name used in the {@code grammar <name>;} header. */
    public String getGrammarName() {
        return grammarName;
    }

    /** Suffix removed from type names when they become rule names. */
    public String getRuleSuffix() {
        return ruleSuffix;
    }

    public String getBoolType() {
        return boolType;
    }

    public String getTokenType() {
        return tokenType;
    }

    public String getListType() {
        return listType;
    }

    public String getSeparatedListType() {
        return separatedListType;
    }

    public String getModifierRule() {
        return modifierRule;
    }

    public String getSeparatorListField() {
        return separatorListField;
    }

    public String getSeparator() {
        return separator;
    }

    public String getModifierListField() {
        return modifierListField;
    }

    /** Token list fields rendered as a lexical rule, field name to rule name. */
    public ImmutableMap<String, String> getLexicalListFields() {
        return lexicalListFields;
    }

    public ImmutableMap<String, String> getTokenAliases() {
        return tokenAliases;
    }

    public String getEofKind() {
        return eofKind;
    }

    public ImmutableSet<String> getDroppedKinds() {
        return droppedKinds;
    }

    public ImmutableSet<String> getEpsilonKinds() {
        return epsilonKinds;
    }

    public ImmutableList<String> getLexicalRules() {
        return lexicalRules;
    }

    public ImmutableList<String> getMajorSections() {
        return majorSections;
    }

    public ImmutableList<String> getDeclarationModifiers() {
        return declarationModifiers;
    }

    /** All token kinds with their fixed spelling; the spelling is empty when there is none. */
    public ImmutableSortedMap<String, String> getTokenKinds() {
        return tokenKinds;
    }

    public static final class Builder {
        private String grammarName;
        private String ruleSuffix = "";
        private String boolType = "bool";
        private String tokenType;
        private String listType;
        private String separatedListType;
        private String modifierRule = "Modifier";
        private String separatorListField;
        private String separator = ",";
        private String modifierListField;
        private final Map<String, String> lexicalListFields = Maps.newLinkedHashMap();
        private final Map<String, String> tokenAliases = Maps.newLinkedHashMap();
        private String eofKind;
        private List<String> droppedKinds = Lists.newArrayList();
        private List<String> epsilonKinds = Lists.newArrayList();
        private List<String> lexicalRules = Lists.newArrayList();
        private List<String> majorSections = Lists.newArrayList();
        private List<String> declarationModifiers = Lists.newArrayList();
        private final Map<String, String> tokenKinds = Maps.newHashMap();

        private Builder() {
        }

        public Builder grammarName(String grammarName) {
            this.grammarName = grammarName;
            return this;
        }

        public Builder ruleSuffix(String ruleSuffix) {
            this.ruleSuffix = ruleSuffix;
            return this;
        }

        public Builder boolType(String boolType) {
            this.boolType = boolType;
            return this;
        }

        public Builder tokenType(String tokenType) {
            this.tokenType = tokenType;
            return this;
        }

        public Builder listType(String listType) {
            this.listType = listType;
            return this;
        }

        public Builder separatedListType(String separatedListType) {
            this.separatedListType = separatedListType;
            return this;
        }

        public Builder modifierRule(String modifierRule) {
            this.modifierRule = modifierRule;
            return this;
        }

        public Builder separatorListField(String separatorListField) {
            this.separatorListField = separatorListField;
            return this;
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder modifierListField(String modifierListField) {
            this.modifierListField = modifierListField;
            return this;
        }

        public Builder lexicalListField(String fieldName, String lexicalRule) {
            lexicalListFields.put(fieldName, lexicalRule);
            return this;
        }

        public Builder tokenAlias(String name, String kind) {
            tokenAliases.put(name, kind);
            return this;
        }

        public Builder eofKind(String eofKind) {
            this.eofKind = eofKind;
            return this;
        }

        public Builder droppedKinds(List<String> droppedKinds) {
            this.droppedKinds = Lists.newArrayList(droppedKinds);
            return this;
        }

        public Builder epsilonKinds(List<String> epsilonKinds) {
            this.epsilonKinds = Lists.newArrayList(epsilonKinds);
            return this;
        }

        public Builder lexicalRules(List<String> lexicalRules) {
            this.lexicalRules = Lists.newArrayList(lexicalRules);
            return this;
        }

        public Builder majorSections(List<String> majorSections) {
            this.majorSections = Lists.newArrayList(majorSections);
            return this;
        }

        public Builder declarationModifiers(List<String> declarationModifiers) {
            this.declarationModifiers = Lists.newArrayList(declarationModifiers);
            return this;
        }

        public Builder tokenKind(String kind, String text) {
            tokenKinds.put(kind, text);
            return this;
        }

        public GrammarConfiguration build() {
            Preconditions.checkState(grammarName != null, "grammarName not set");
            Preconditions.checkState(tokenType != null, "tokenType not set");
            Preconditions.checkState(listType != null, "listType not set");
            Preconditions.checkState(separatedListType != null, "separatedListType not set");
            Preconditions.checkState(separatorListField != null, "separatorListField not set");
            Preconditions.checkState(modifierListField != null, "modifierListField not set");
            Preconditions.checkState(eofKind != null, "eofKind not set");
            return new GrammarConfiguration(this);
        }
    }
}
