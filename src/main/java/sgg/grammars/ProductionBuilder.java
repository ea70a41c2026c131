package sgg.grammars;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

import sgg.schema.Child;
import sgg.schema.Choice;
import sgg.schema.Field;
import sgg.schema.Sequence;
import sgg.schema.TreeType;

/**
 * Turns the children of a node type into productions. Referenced rules must
 * already be declared in the rule table.
 */
final class ProductionBuilder {

    private final GrammarConfiguration config;
    private final String rootType;
    private final RuleTable rules;
    private final NameNormalizer normalizer;
    private final TokenLiterals tokens;
    private final String quotedSeparator;

    ProductionBuilder(GrammarConfiguration config, String rootType, RuleTable rules, NameNormalizer normalizer) {
        this.config = config;
        this.rootType = rootType;
        this.rules = rules;
        this.normalizer = normalizer;
        this.tokens = new TokenLiterals(config, normalizer);
        this.quotedSeparator = TokenLiterals.quote(config.getSeparator());
    }

    /**
     * The productions a node contributes to its own rule.
     */
    List<Production> productionsFor(TreeType type) {
        if (type.children.isEmpty()) {
            return ImmutableList.of();
        }

        // a: (x | y | z) becomes a: x | y | z
        if (type.children.size() == 1 && type.children.get(0) instanceof Field) {
            Field field = (Field) type.children.get(0);
            if (isToken(field) && !field.getKinds().isEmpty()) {
                List<Production> result = Lists.newArrayList();
                for (String kind : field.getKinds()) {
                    Production p = new Production(tokens.text(tokens.kind(kind)));
                    if (!p.isEmpty()) {
                        result.add(p);
                    }
                }
                return result;
            }
        }

        Production p = children(type.getName(), type.children, " ");
        return p.isEmpty() ? ImmutableList.of() : ImmutableList.of(p);
    }

    Production reference(String ruleName) {
        if (!rules.contains(ruleName)) {
            throw GrammarGenerationException.unresolvedRule(ruleName);
        }
        return new Production(normalizer.normalize(ruleName), ImmutableSet.of(ruleName));
    }

    private Production children(String owner, List<Child> children, String delim) {
        List<Production> parts = Lists.newArrayList();
        for (Child c : children) {
            parts.add(child(owner, c));
        }
        return Production.join(delim, parts);
    }

    private Production child(String owner, Child child) {
        return child.match(new Child.Matcher<Production>() {
            @Override
            public Production case_Field(Field field) {
                Production p = field(owner, field);
                return field.isOptional() && !p.isEmpty() ? p.withSuffix("?") : p;
            }

            @Override
            public Production case_Choice(Choice choice) {
                return children(owner, choice.children, " | ").parenthesize();
            }

            @Override
            public Production case_Sequence(Sequence sequence) {
                return children(owner, sequence.children, " ").parenthesize();
            }
        });
    }

    private Production field(String owner, Field field) {
        String type = field.getType();
        if (type.equals(config.getBoolType())) {
            // flags on directive trivia, nothing in the grammar
            return Production.EMPTY;
        }
        if (type.equals(rootType)) {
            return rootTypedField(owner, field);
        }
        String element = typeArgument(type, config.getSeparatedListType());
        if (element != null) {
            return separatedList(field, element);
        }
        element = typeArgument(type, config.getListType());
        if (element != null) {
            return list(field, element);
        }
        if (isToken(field)) {
            return token(field);
        }
        return reference(type);
    }

    /**
     * A field typed with the root type names its actual node kind as its only
     * kind.
     */
    private Production rootTypedField(String owner, Field field) {
        if (field.getKinds().size() != 1) {
            throw GrammarGenerationException.invalidField(owner, field.getName(),
                    "a field of type " + rootType + " needs exactly one kind, found " + field.getKinds());
        }
        return reference(field.getKinds().get(0) + config.getRuleSuffix());
    }

    private Production separatedList(Field field, String elementType) {
        Production element = reference(elementType);
        Production result = element.withSuffix(" (" + quotedSeparator + " " + element + ")*");
        if (field.allowsTrailingSeparator()) {
            result = result.withSuffix(" " + quotedSeparator + "?");
        }
        return field.hasMinCount() ? result : result.parenthesize().withSuffix("?");
    }

    private Production list(Field field, String elementType) {
        return listElement(field, elementType).withSuffix(field.hasMinCount() ? "+" : "*");
    }

    /**
     * Token lists get a more precise element than "any token".
     */
    private Production listElement(Field field, String elementType) {
        String name = field.getName();
        if (config.getSeparatorListField().equals(name)) {
            return new Production(quotedSeparator);
        }
        if (config.getModifierListField().equals(name)) {
            return reference(config.getModifierRule());
        }
        String lexicalRule = name == null ? null : config.getLexicalListFields().get(name);
        if (lexicalRule != null) {
            return new Production(normalizer.normalize(lexicalRule));
        }
        return reference(elementType);
    }

    private Production token(Field field) {
        List<String> kinds = field.getKinds();
        if (kinds.isEmpty()) {
            if (field.getName() == null) {
                return Production.EMPTY;
            }
            // the field is named after its token kind
            return new Production(tokens.text(tokens.kind(field.getName())));
        }
        if (kinds.size() == 1) {
            return new Production(tokens.text(tokens.kind(kinds.get(0))));
        }

        List<String> texts = Lists.newArrayList();
        for (String kind : kinds) {
            String text = tokens.text(tokens.kind(kind));
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        if (texts.size() <= 1) {
            return texts.isEmpty() ? Production.EMPTY : new Production(texts.get(0));
        }
        return new Production(Joiner.on(" | ").join(Ordering.<String>natural().sortedCopy(texts))).parenthesize();
    }

    private boolean isToken(Field field) {
        return field.getType().equals(config.getTokenType());
    }

    /**
     * Returns {@code T} for a type written {@code tag<T>}, null for other types.
     */
    private static String typeArgument(String type, String tag) {
        if (type.startsWith(tag + "<") && type.endsWith(">")) {
            return type.substring(tag.length() + 1, type.length() - 1);
        }
        return null;
    }
}
