package sgg.grammars;

import java.util.Locale;
import java.util.regex.Pattern;

import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableBiMap;

/**
 * Converts a {@code PascalCased} type name into a {@code snake_cased} rule
 * name, e.g. {@code BreakStatementSyntax} becomes {@code break_statement}.
 */
public final class NameNormalizer {

    private static final Pattern WORD_BOUNDARY = Pattern.compile(
            "(?<=[A-Z])(?=[A-Z][a-z])"
            + "|(?<=[^A-Z])(?=[A-Z])"
            + "|(?<=[A-Za-z])(?=[^A-Za-z])");

    private final String suffix;

    public NameNormalizer(String suffix) {
        this.suffix = suffix == null ? "" : suffix;
    }

    public String normalize(String name) {
        String stem = !suffix.isEmpty() && name.endsWith(suffix)
                ? name.substring(0, name.length() - suffix.length())
                : name;
        return WORD_BOUNDARY.matcher(stem).replaceAll("_").toLowerCase(Locale.ROOT);
    }

    /**
     * Normalizes all names at once.
     *
     * @return raw name to normalized name
     * @throws GrammarGenerationException if two names normalize to the same rule name
     */
    public ImmutableBiMap<String, String> normalizeAll(Iterable<String> names) {
        HashBiMap<String, String> result = HashBiMap.create();
        for (String name : names) {
            String normalized = normalize(name);
            String other = result.inverse().get(normalized);
            if (other != null && !other.equals(name)) {
                throw GrammarGenerationException.nameCollision(normalized, other, name);
            }
            result.put(name, normalized);
        }
        return ImmutableBiMap.copyOf(result);
    }
}
