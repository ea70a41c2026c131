package sgg.schema;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * One syntax node kind of the schema.
 */
public final class TreeType {

	public enum Kind {
		/** Provided by the runtime, never has children (e.g. the token type). */
		PREDEFINED,
		/** Only reachable through its derived types. */
		ABSTRACT,
		NODE
	}

	private final String name;
	private final String base;
	private final Kind kind;
	public final ImmutableList<Child> children;

	private TreeType(String name, String base, Kind kind, List<Child> children) {
		this.name = Preconditions.checkNotNull(name, "name");
		this.base = base;
		this.kind = kind;
		this.children = ImmutableList.copyOf(children);
	}

	public static TreeType predefined(String name, String base) {
		return new TreeType(name, base, Kind.PREDEFINED, ImmutableList.of());
	}

	public static TreeType abstractNode(String name, String base, List<Child> children) {
		return new TreeType(name, base, Kind.ABSTRACT, children);
	}

	public static TreeType node(String name, String base, List<Child> children) {
		return new TreeType(name, base, Kind.NODE, children);
	}

	public String getName() {
		return name;
	}

	/** Name of the base type, or null. */
	public String getBase() {
		return base;
	}

	public boolean hasBase() {
		return base != null;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isNode() {
		return kind == Kind.NODE;
	}

	@Override
	public String toString() {
		StringBuilder result = new StringBuilder(kind.name().toLowerCase() + " " + name);
		if (base != null) {
			result.append(" : ").append(base);
		}
		result.append(" ").append(children);
		return result.toString();
	}
}
