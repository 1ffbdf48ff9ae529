package works.jsonlens.logging;

import org.slf4j.MDC;

import static works.jsonlens.logging.MdcKeys.SESSION_INSTANCE_ID;
import static works.jsonlens.logging.MdcKeys.SESSION_NAME;

/**
 * Puts session identity into the SLF4J {@link MDC} for the duration of an operation,
 * so log lines (and log filters) can tell sessions apart.
 */
public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	/**
	 * Restores the previous MDC values when closed, so scopes can nest.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String oldName;
		private final String oldInstanceID;

		private MDCScope() {
			this.oldName = MDC.get(SESSION_NAME);
			this.oldInstanceID = MDC.get(SESSION_INSTANCE_ID);
		}

		@Override
		public void close() {
			restore(SESSION_NAME, oldName);
			restore(SESSION_INSTANCE_ID, oldInstanceID);
		}

		private static void restore(String key, String value) {
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}
	}

	public static MDCScope setupMDC(String sessionName, String instanceID) {
		MDCScope result = new MDCScope();
		MDC.put(SESSION_NAME, sessionName);
		MDC.put(SESSION_INSTANCE_ID, instanceID);
		return result;
	}
}
