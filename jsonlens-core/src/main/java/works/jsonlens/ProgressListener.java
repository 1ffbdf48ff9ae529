package works.jsonlens;

/**
 * Receives progress notifications from long-running operations.
 * <p>
 * Notifications arrive at fixed checkpoints rather than in proportion to the work done.
 * Implementations must not assume every checkpoint is delivered.
 */
@FunctionalInterface
public interface ProgressListener {
	/**
	 * @param fraction between 0 and 1
	 * @param phase short human-readable description of what is happening
	 */
	void progress(double fraction, String phase);

	ProgressListener NONE = (fraction, phase) -> {};

	/**
	 * @return a listener that maps its 0..1 range onto <code>from..to</code> of this one,
	 * and prefixes each phase with <code>label</code>.
	 */
	default ProgressListener scaled(double from, double to, String label) {
		return (fraction, phase) -> progress(from + fraction * (to - from), label + phase);
	}
}
