package sgg.grammars;

import java.util.List;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import sgg.schema.Field;
import sgg.schema.SyntaxSchema;
import sgg.schema.TreeType;

/**
 * Generates an ANTLR style grammar from a syntax schema.
 * <p>
 * Every type becomes a rule named after the type. A node's children make up
 * its production, and every type is an alternative of its base type's rule.
 * The output only depends on the schema and the configuration, never on the
 * declaration order of the types.
 */
public class GrammarGenerator {

    private static final Logger log = Logger.getLogger(GrammarGenerator.class.getName());

    static final String LEXICAL_PLACEHOLDER = "/* see lexical specification */";

    private final GrammarConfiguration config;
    private final SyntaxSchema schema;
    private final NameNormalizer normalizer;

    public GrammarGenerator(SyntaxSchema schema, GrammarConfiguration config) {
        this.config = config;
        // modifier keywords are used all over the schema as plain token lists,
        // give them a rule of their own
        this.schema = schema.withType(createModifierType());
        this.normalizer = new NameNormalizer(config.getRuleSuffix());
    }

    private TreeType createModifierType() {
        List<String> keywords = Lists.newArrayList();
        for (String modifier : config.getDeclarationModifiers()) {
            String keyword = modifier + "Keyword";
            if (config.getTokenKinds().containsKey(keyword)) {
                keywords.add(keyword);
            }
        }
        return TreeType.node(config.getModifierRule(), null,
                ImmutableList.of(Field.token(config.getTokenType(), keywords)));
    }

    public String generate() {
        RuleTable rules = buildRules();
        String grammar = new GrammarEmitter(config, rules, normalizer).emit();
        log.fine(() -> "Generated grammar " + config.getGrammarName() + " with " + rules.size() + " rules");
        return grammar;
    }

    RuleTable buildRules() {
        ImmutableList<TreeType> types = schema.getTypes();
        String root = schema.getRootType();

        RuleTable rules = new RuleTable();
        for (TreeType t : types) {
            rules.declare(t.getName());
        }

        ProductionBuilder builder = new ProductionBuilder(config, root, rules, normalizer);
        for (TreeType t : types) {
            // a type is one of the alternatives of its base type
            if (t.hasBase() && !t.getBase().equals(root)) {
                rules.add(t.getBase(), builder.reference(t.getName()));
            }
            if (t.isNode()) {
                rules.addAll(t.getName(), builder.productionsFor(t));
            }
        }

        // the grammar bottoms out in lexical rules that are not generated
        for (String lexical : config.getLexicalRules()) {
            rules.addPlaceholder(lexical, new Production(LEXICAL_PLACEHOLDER));
        }

        rules.checkReferences();
        log.fine(() -> "Built " + rules.size() + " rules from " + types.size() + " types");
        return rules;
    }

    public SyntaxSchema getSchema() {
        return schema;
    }
}
