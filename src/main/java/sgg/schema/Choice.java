package sgg.schema;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Exactly one of the children appears.
 */
public final class Choice implements Child {

	public final ImmutableList<Child> children;

	public Choice(List<Child> children) {
		this.children = ImmutableList.copyOf(children);
	}

	@Override
	public <T> T match(Matcher<T> matcher) {
		return matcher.case_Choice(this);
	}

	@Override
	public String toString() {
		return "choice(" + Joiner.on(" | ").join(children) + ")";
	}
}
