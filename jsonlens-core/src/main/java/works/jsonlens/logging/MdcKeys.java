package works.jsonlens.logging;

public final class MdcKeys {
	private MdcKeys() {}

	public static final String SESSION_NAME = "jsonlens.name";
	public static final String SESSION_INSTANCE_ID = "jsonlens.instanceID";
}
