package sgg.grammars;

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * One alternative of a grammar rule: the text after {@code :} or {@code |},
 * together with the raw names of the rules that text references.
 * <p>
 * Two productions are equal when their texts are equal.
 */
public final class Production {

	public static final Production EMPTY = new Production("");

	private final String text;
	private final ImmutableSet<String> ruleReferences;

	public Production(String text) {
		this(text, ImmutableSet.of());
	}

	public Production(String text, Set<String> ruleReferences) {
		this.text = text;
		this.ruleReferences = ImmutableSet.copyOf(ruleReferences);
	}

	public String getText() {
		return text;
	}

	/** Referenced rule names, in the order they occur in the text. */
	public ImmutableSet<String> getRuleReferences() {
		return ruleReferences;
	}

	public boolean isEmpty() {
		return text.isEmpty();
	}

	public Production withPrefix(String prefix) {
		return new Production(prefix + text, ruleReferences);
	}

	public Production withSuffix(String suffix) {
		return new Production(text + suffix, ruleReferences);
	}

	public Production parenthesize() {
		return withPrefix("(").withSuffix(")");
	}

	/**
	 * Joins the non-empty productions with the given delimiter and merges
	 * their references.
	 */
	public static Production join(String delim, Iterable<Production> parts) {
		StringBuilder sb = new StringBuilder();
		ImmutableSet.Builder<String> references = ImmutableSet.builder();
		for (Production p : parts) {
			if (p.isEmpty()) {
				continue;
			}
			if (sb.length() > 0) {
				sb.append(delim);
			}
			sb.append(p.text);
			references.addAll(p.ruleReferences);
		}
		return new Production(sb.toString(), references.build());
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && text.equals(((Production) obj).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
