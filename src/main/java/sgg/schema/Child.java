package sgg.schema;

/**
 * One constituent of a node: a field, a choice between constituents or a
 * sequence of constituents.
 */
public interface Child {

	<T> T match(Matcher<T> matcher);

	interface Matcher<T> {
		T case_Field(Field field);

		T case_Choice(Choice choice);

		T case_Sequence(Sequence sequence);
	}

}
