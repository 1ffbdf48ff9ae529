package works.jsonlens.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.jsonlens.Session;
import works.jsonlens.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static works.jsonlens.logging.MdcKeys.SESSION_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-session logging control.
 * Intended to suppress expected warnings during testing.
 * <p>
 * A log message is associated with a session by the MDC key {@link MdcKeys#SESSION_INSTANCE_ID},
 * which {@link Session} operations set through {@link Session#mdc()}.
 * Work done on other threads is only covered if it sets up the same scope.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message belongs to a session registered with {@link #withController}
 *         and that controller has an override for that specific logger, that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply.
 *     </li>
 * </ol>
 */
public class SessionLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersBySessionID = new ConcurrentHashMap<>();

	/**
	 * Per-logger thresholds: messages at or below a logger's threshold are dropped.
	 * Uses Logback's {@link Level} because SLF4J's has no OFF.
	 */
	public static final class LogController {
		private final Map<String, Level> thresholds = new ConcurrentHashMap<>();

		public void setLogging(Level level, String... loggerNames) {
			for (String name: loggerNames) {
				thresholds.put(name, level);
			}
		}

		boolean suppresses(String loggerName, Level messageLevel) {
			Level threshold = thresholds.get(loggerName);
			return threshold != null && threshold.isGreaterOrEqual(messageLevel);
		}
	}

	/**
	 * Undoes a {@link #withController} registration when closed.
	 */
	public static final class Registration implements AutoCloseable {
		private final String sessionID;
		private final LogController controller;

		private Registration(String sessionID, LogController controller) {
			this.sessionID = sessionID;
			this.controller = controller;
		}

		@Override
		public void close() {
			controllersBySessionID.remove(sessionID, controller);
		}
	}

	/**
	 * Causes the given <code>controller</code> to control logs emitted on behalf of <code>session</code>.
	 *
	 * @throws IllegalStateException if <code>session</code> already has a controller
	 */
	public static Registration withController(Session session, LogController controller) {
		LogController existing = controllersBySessionID.putIfAbsent(session.instanceID(), controller);
		if (existing != null) {
			throw new IllegalStateException("Session \"" + session.name() + "\" already has a log controller");
		}
		return new Registration(session.instanceID(), controller);
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Configured levels take precedence
			return NEUTRAL;
		}
		String sessionID = MDC.get(SESSION_INSTANCE_ID);
		LogController controller = (sessionID == null) ? null : controllersBySessionID.get(sessionID);
		if (controller != null && controller.suppresses(logger.getName(), messageLevel)) {
			return DENY;
		}
		return NEUTRAL;
	}
}
