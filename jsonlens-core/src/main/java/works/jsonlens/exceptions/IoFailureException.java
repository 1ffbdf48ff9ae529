package works.jsonlens.exceptions;

import java.io.IOException;
import org.jetbrains.annotations.Nullable;

/**
 * Reading from or writing to an external source failed.
 */
public final class IoFailureException extends JsonLensException {
	@Nullable
	private final String location;

	public IoFailureException(@Nullable String location, String message, @Nullable IOException cause) {
		super(message, cause);
		this.location = location;
	}

	/**
	 * @return a description of the source or sink, if there was one.
	 */
	@Nullable
	public String location() {
		return location;
	}
}
