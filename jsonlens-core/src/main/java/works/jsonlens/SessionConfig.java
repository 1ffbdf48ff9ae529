package works.jsonlens;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.jsonlens.tree.ShadowTreeBuilder;

import static java.util.Objects.requireNonNull;
import static tools.jackson.databind.SerializationFeature.INDENT_OUTPUT;

public final class SessionConfig {
	private final int previewLength;
	private final ObjectMapper mapper;

	private SessionConfig(int previewLength, ObjectMapper mapper) {
		this.previewLength = previewLength;
		this.mapper = mapper;
	}

	public static SessionConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the number of code points of a string value shown in a node preview
	 */
	public int previewLength() {
		return previewLength;
	}

	/**
	 * @return the mapper used to parse documents and to write them as pretty-printed text
	 */
	public ObjectMapper mapper() {
		return mapper;
	}

	/**
	 * @return a mapper that parses JSON and writes it with indentation
	 */
	public static ObjectMapper prettyMapper() {
		return JsonMapper.builder()
			.enable(INDENT_OUTPUT)
			.build();
	}

	public static class Builder {
		private int previewLength;
		private ObjectMapper mapper;

		Builder() {
			previewLength = ShadowTreeBuilder.DEFAULT_PREVIEW_LENGTH;
			mapper = prettyMapper();
		}

		public Builder previewLength(int previewLength) {
			if (previewLength < 0) {
				throw new IllegalArgumentException("previewLength must not be negative: " + previewLength);
			}
			this.previewLength = previewLength;
			return this;
		}

		public Builder mapper(ObjectMapper mapper) {
			this.mapper = requireNonNull(mapper);
			return this;
		}

		public SessionConfig build() {
			return new SessionConfig(previewLength, mapper);
		}

		@Override
		public String toString() {
			return "SessionConfig.Builder(previewLength=" + previewLength + ", mapper=" + mapper + ")";
		}
	}

	private static final SessionConfig DEFAULTS = new Builder().build();
}
