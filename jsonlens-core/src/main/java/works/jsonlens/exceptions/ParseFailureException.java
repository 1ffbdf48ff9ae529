package works.jsonlens.exceptions;

/**
 * The input text is not valid JSON,
 * or is valid JSON without the shape the operation requires.
 */
public final class ParseFailureException extends JsonLensException {
	public ParseFailureException(String message) {
		super(message);
	}

	public ParseFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
