package works.jsonlens.exceptions;

/**
 * Root of the errors a session reports to its caller.
 * The hierarchy is closed: every failure is one of the four permitted kinds.
 */
public sealed abstract class JsonLensException extends RuntimeException permits
	NotLoadedException,
	ParseFailureException,
	AddressException,
	IoFailureException
{
	protected JsonLensException(String message) {
		super(message);
	}

	protected JsonLensException(String message, Throwable cause) {
		super(message, cause);
	}
}
