package sgg.schema;

import java.util.List;

import com.google.common.collect.ImmutableList;

public class InvalidSchemaException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ImmutableList<String> errors;

	public InvalidSchemaException(String message) {
		super(message);
		this.errors = ImmutableList.of(message);
	}

	public InvalidSchemaException(String source, List<String> errors) {
		super(errors.size() + " error(s) in " + source + ":\n  " + String.join("\n  ", errors));
		this.errors = ImmutableList.copyOf(errors);
	}

	public ImmutableList<String> getErrors() {
		return errors;
	}

}
