package sgg.grammars;

/**
 * Renders token kinds as grammar text.
 */
final class TokenLiterals {

    static final String EOF = "EOF";
    static final String EPSILON = "/* epsilon */";

    private final GrammarConfiguration config;
    private final NameNormalizer normalizer;

    TokenLiterals(GrammarConfiguration config, NameNormalizer normalizer) {
        this.config = config;
        this.normalizer = normalizer;
    }

    /**
     * Resolves a token name to a known token kind. Aliases such as
     * {@code Identifier} are applied first.
     */
    String kind(String tokenName) {
        String kind = config.getTokenAliases().getOrDefault(tokenName, tokenName);
        if (!config.getTokenKinds().containsKey(kind)) {
            throw GrammarGenerationException.unknownTokenKind(tokenName);
        }
        return kind;
    }

    /**
     * The grammar text for a token kind; empty when the kind does not show up
     * in productions at all.
     */
    String text(String kind) {
        if (kind.equals(config.getEofKind())) {
            // the whole input has to be consumed
            return EOF;
        }
        if (config.getDroppedKinds().contains(kind)) {
            return "";
        }
        if (config.getEpsilonKinds().contains(kind)) {
            return EPSILON;
        }
        if (config.getLexicalRules().contains(kind)) {
            return normalizer.normalize(kind);
        }

        String spelling = config.getTokenKinds().get(kind);
        if (spelling == null) {
            throw GrammarGenerationException.unknownTokenKind(kind);
        }
        if (spelling.isEmpty()) {
            throw GrammarGenerationException.unmappedTokenKind(kind);
        }
        return quote(spelling);
    }

    static String quote(String spelling) {
        return "'" + spelling.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
