package sgg.grammars;

/**
 * Raised when the schema cannot be turned into a consistent grammar. There is
 * no partial output; the schema or configuration has to be fixed.
 */
public class GrammarGenerationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum Reason {
		UNRESOLVED_RULE,
		UNKNOWN_TOKEN_KIND,
		UNMAPPED_TOKEN_KIND,
		EMPTY_RULE,
		NAME_COLLISION,
		INVALID_FIELD
	}

	private final Reason reason;

	public GrammarGenerationException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

	static GrammarGenerationException unresolvedRule(String ruleName) {
		return new GrammarGenerationException(Reason.UNRESOLVED_RULE, "No rule found with name: " + ruleName);
	}

	static GrammarGenerationException unknownTokenKind(String kind) {
		return new GrammarGenerationException(Reason.UNKNOWN_TOKEN_KIND, "Unknown token kind: " + kind);
	}

	static GrammarGenerationException unmappedTokenKind(String kind) {
		return new GrammarGenerationException(Reason.UNMAPPED_TOKEN_KIND, "Unexpected token kind without text: " + kind);
	}

	static GrammarGenerationException emptyRule(String ruleName) {
		return new GrammarGenerationException(Reason.EMPTY_RULE, "Rule didn't have any productions: " + ruleName);
	}

	static GrammarGenerationException nameCollision(String normalized, String first, String second) {
		return new GrammarGenerationException(Reason.NAME_COLLISION,
				"Rules " + first + " and " + second + " both normalize to " + normalized);
	}

	static GrammarGenerationException invalidField(String owner, String field, String problem) {
		return new GrammarGenerationException(Reason.INVALID_FIELD,
				"Field " + owner + "." + field + ": " + problem);
	}
}
