package sgg.schema;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

public final class Field implements Child {

	private final String name;
	private final String type;
	private final ImmutableList<String> kinds;
	private final boolean optional;
	private final Integer minCount;
	private final boolean allowTrailingSeparator;

	private Field(String name, String type, List<String> kinds, boolean optional, Integer minCount,
			boolean allowTrailingSeparator) {
		this.name = name;
		this.type = Preconditions.checkNotNull(type, "type");
		this.kinds = ImmutableList.copyOf(kinds);
		this.optional = optional;
		this.minCount = minCount;
		this.allowTrailingSeparator = allowTrailingSeparator;
	}

	/**
	 * A nameless field restricted to the given kinds, as used for synthesized
	 * token fields.
	 */
	public static Field token(String tokenType, List<String> kinds) {
		return new Field(null, tokenType, kinds, false, null, false);
	}

	public static Builder builder(String name, String type) {
		return new Builder(name, type);
	}

	/** The field name, or null for synthesized fields. */
	public String getName() {
		return name;
	}

	public String getType() {
		return type;
	}

	public ImmutableList<String> getKinds() {
		return kinds;
	}

	public boolean isOptional() {
		return optional;
	}

	public boolean hasMinCount() {
		return minCount != null;
	}

	public Integer getMinCount() {
		return minCount;
	}

	public boolean allowsTrailingSeparator() {
		return allowTrailingSeparator;
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Field(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj instanceof Field) {
			Field f = (Field) obj;
			return Objects.equals(name, f.name)
					&& type.equals(f.type)
					&& kinds.equals(f.kinds)
					&& optional == f.optional
					&& Objects.equals(minCount, f.minCount)
					&& allowTrailingSeparator == f.allowTrailingSeparator;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, kinds);
	}

	@Override
	public String toString() {
		StringBuilder result = new StringBuilder(type + " " + name);
		if (!kinds.isEmpty()) {
			result.append(" kinds").append(kinds);
		}
		if (optional) {
			result.append(" optional");
		}
		return result.toString();
	}

	public static final class Builder {
		private final String name;
		private final String type;
		private final List<String> kinds = Lists.newArrayList();
		private boolean optional;
		private Integer minCount;
		private boolean allowTrailingSeparator;

		private Builder(String name, String type) {
			this.name = name;
			this.type = type;
		}

		public Builder kind(String kind) {
			kinds.add(kind);
			return this;
		}

		public Builder optional() {
			optional = true;
			return this;
		}

		public Builder minCount(int count) {
			minCount = count;
			return this;
		}

		public Builder allowTrailingSeparator() {
			allowTrailingSeparator = true;
			return this;
		}

		public Field build() {
			return new Field(name, type, kinds, optional, minCount, allowTrailingSeparator);
		}
	}
}
