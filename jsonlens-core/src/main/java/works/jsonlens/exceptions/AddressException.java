package works.jsonlens.exceptions;

/**
 * An address could not be used against the current document.
 */
public final class AddressException extends JsonLensException {
	private final String address;
	private final Reason reason;

	public enum Reason {
		/**
		 * The text is not a supported address expression.
		 */
		MALFORMED,
		/**
		 * Nothing in the document lives at the address.
		 */
		NO_MATCH,
		/**
		 * The address matched, but its slot can't be assigned into.
		 */
		NOT_UPDATABLE,
	}

	private AddressException(String address, Reason reason, String message) {
		super(message);
		this.address = address;
		this.reason = reason;
	}

	public static AddressException malformed(String address, String problem) {
		return new AddressException(address, Reason.MALFORMED, "Malformed address \"" + address + "\": " + problem);
	}

	public static AddressException noMatch(String address) {
		return new AddressException(address, Reason.NO_MATCH, "No node matches address \"" + address + "\"");
	}

	public static AddressException notUpdatable(String address) {
		return new AddressException(address, Reason.NOT_UPDATABLE, "Address \"" + address + "\" is not updatable");
	}

	public String address() {
		return address;
	}

	public Reason reason() {
		return reason;
	}
}
