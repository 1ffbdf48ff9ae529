package works.jsonlens.products;

import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.jsonlens.exceptions.ParseFailureException;

/**
 * Reduces an intermediate product to a {@link FinalProduct} mapping each item's
 * <code>seq</code> to its <code>name</code>.
 * <p>
 * Reads leniently: an item without a usable <code>seq</code> counts as zero,
 * and one without a string <code>name</code> maps to empty text.
 * Items sharing a <code>seq</code> collapse to the last one.
 */
public final class ProjectionTransform {
	private final ProductCodec codec;

	public ProjectionTransform(ProductCodec codec) {
		this.codec = codec;
	}

	/**
	 * @throws ParseFailureException if the text isn't JSON
	 */
	public FinalProduct project(String intermediateText) {
		JsonNode root = codec.parse(intermediateText, "intermediate product");
		TreeMap<String, String> entries = new TreeMap<>();
		JsonNode items = root.get("items");
		if (items == null || !items.isArray()) {
			LOGGER.warn("Intermediate product has no items array; final product is empty");
			return new FinalProduct(entries);
		}
		for (int i = 0; i < items.size(); i++) {
			JsonNode item = items.get(i);
			JsonNode seq = item.get("seq");
			long key = (seq != null && seq.isIntegralNumber() && seq.longValue() >= 0) ? seq.longValue() : 0L;
			entries.put(Long.toString(key), ProductCodec.stringField(item, "name"));
		}
		LOGGER.debug("Projected {} items to {} entries", items.size(), entries.size());
		return new FinalProduct(entries);
	}

	public FinalProduct project(IntermediateProduct intermediate) {
		return project(codec.write(intermediate));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ProjectionTransform.class);
}
