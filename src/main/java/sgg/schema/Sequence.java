package sgg.schema;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * All children appear, in order.
 */
public final class Sequence implements Child {

	public final ImmutableList<Child> children;

	public Sequence(List<Child> children) {
		this.children = ImmutableList.copyOf(children);
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Sequence(this);
	}

	@Override
	public String toString() {
		return "sequence(" + Joiner.on(" ").join(children) + ")";
	}
}
