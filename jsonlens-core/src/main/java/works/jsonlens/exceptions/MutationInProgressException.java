package works.jsonlens.exceptions;

/**
 * A second writer tried to change a session while a change was already underway.
 */
public class MutationInProgressException extends IllegalStateException {
	public MutationInProgressException(String s) {
		super(s);
	}
}
