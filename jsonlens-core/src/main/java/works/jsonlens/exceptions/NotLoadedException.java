package works.jsonlens.exceptions;

/**
 * The operation needs a document, and the session has none.
 */
public final class NotLoadedException extends JsonLensException {
	public NotLoadedException(String message) {
		super(message);
	}
}
