package sgg.schema;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * An immutable snapshot of a syntax tree schema: the abstract root type and
 * all node types derived from it.
 */
public final class SyntaxSchema {

	private final String rootType;
	private final ImmutableList<TreeType> types;
	private final ImmutableMap<String, TreeType> byName;

	public SyntaxSchema(String rootType, List<TreeType> types) {
		this.rootType = rootType;
		this.types = ImmutableList.copyOf(types);

		Map<String, TreeType> index = Maps.newLinkedHashMap();
		List<String> duplicates = Lists.newArrayList();
		for (TreeType t : types) {
			if (index.put(t.getName(), t) != null) {
				duplicates.add(t.getName());
			}
		}
		if (!duplicates.isEmpty()) {
			throw new InvalidSchemaException("Types declared more than once: " + duplicates);
		}
		this.byName = ImmutableMap.copyOf(index);
	}

	/** Name of the root type, may be null when the schema declares none. */
	public String getRootType() {
		return rootType;
	}

	/**
	 * All types in declaration order, excluding the root type.
	 */
	public ImmutableList<TreeType> getTypes() {
		ImmutableList.Builder<TreeType> result = ImmutableList.builder();
		for (TreeType t : types) {
			if (!t.getName().equals(rootType)) {
				result.add(t);
			}
		}
		return result.build();
	}

	public TreeType getType(String name) {
		return byName.get(name);
	}

	public boolean hasType(String name) {
		return byName.containsKey(name);
	}

	/**
	 * Returns a new schema with the given type appended.
	 */
	public SyntaxSchema withType(TreeType type) {
		return new SyntaxSchema(rootType, ImmutableList.<TreeType>builder().addAll(types).add(type).build());
	}

	@Override
	public String toString() {
		return "SyntaxSchema(root " + rootType + ", " + types.size() + " types)";
	}
}
