package works.jsonlens.products;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.jsonlens.address.Address;
import works.jsonlens.address.DocumentSurgeon;
import works.jsonlens.address.DocumentSurgeon.NodeLocation;
import works.jsonlens.exceptions.JsonLensException;
import works.jsonlens.exceptions.ParseFailureException;
import works.jsonlens.products.IntermediateProduct.Item;
import works.jsonlens.tree.JsonText;
import works.jsonlens.tree.NodeKind;

import static tools.jackson.databind.node.JsonNodeType.OBJECT;

/**
 * Writes a corrected final product back into a document.
 * <p>
 * Each entry of the upload is keyed by a sequence number, which identifies an item of the
 * intermediate product, whose <code>source_path</code> says where the new value goes.
 * Entries that can't be applied are skipped and counted; they never abort the batch.
 */
@RequiredArgsConstructor
public final class CorrectionsApplier {
	private final ProductCodec codec;
	private final DocumentSurgeon surgeon;

	public CorrectionsApplier(ProductCodec codec) {
		this(codec, new DocumentSurgeon());
	}

	/**
	 * @param modified number of entries written to the document
	 * @param skipped number of entries that were not
	 * @param document the resulting document
	 */
	public record Result(int modified, int skipped, JsonNode document) {}

	/**
	 * @param document modified in place where possible; use the returned {@link Result#document()}
	 * @param expectedShape if not null, the upload must have the same keys and value kinds
	 * @throws ParseFailureException if the upload isn't a JSON object, or doesn't match <code>expectedShape</code>
	 */
	public Result apply(JsonNode document, String uploadText, IntermediateProduct intermediate, @Nullable FinalProduct expectedShape) {
		JsonNode upload = codec.parse(uploadText, "corrections");
		if (upload.getNodeType() != OBJECT) {
			throw new ParseFailureException("Corrections must be a JSON object, not " + NodeKind.of(upload));
		}
		if (expectedShape != null) {
			JsonNode expected = codec.parse(codec.write(expectedShape), "final product");
			if (!sameShape(upload, expected)) {
				throw new ParseFailureException("Corrections do not have the same structure as the final product");
			}
		}

		Map<Integer, Item> itemsBySeq = new HashMap<>();
		for (Item item : intermediate.items()) {
			itemsBySeq.put(item.seq(), item);
		}

		JsonNode root = document;
		int modified = 0;
		int skipped = 0;
		for (Map.Entry<String, JsonNode> entry : upload.properties()) {
			String key = entry.getKey();
			Item item = itemFor(key, itemsBySeq);
			if (item == null || item.sourcePath().isEmpty()) {
				LOGGER.warn("Skipping correction \"{}\": no matching item", key);
				skipped++;
				continue;
			}
			String newText = replacementText(entry.getValue());
			if (newText == null) {
				LOGGER.warn("Skipping correction \"{}\": {} value is not applicable", key, NodeKind.of(entry.getValue()));
				skipped++;
				continue;
			}
			try {
				NodeLocation location = surgeon.locate(root, Address.parse(item.sourcePath()));
				root = surgeon.replace(root, location, JsonText.stringNode(newText));
				modified++;
			} catch (JsonLensException e) {
				LOGGER.warn("Skipping correction \"{}\" at {}: {}", key, item.sourcePath(), e.getMessage());
				skipped++;
			}
		}
		LOGGER.info("Applied corrections: {} modified, {} skipped", modified, skipped);
		return new Result(modified, skipped, root);
	}

	@Nullable
	private static Item itemFor(String key, Map<Integer, Item> itemsBySeq) {
		int seq;
		try {
			seq = Integer.parseInt(key);
		} catch (NumberFormatException e) {
			LOGGER.debug("Correction key \"{}\" is not a sequence number", key);
			return null;
		}
		return itemsBySeq.get(seq);
	}

	/**
	 * @return the text to store, or null if the value should be skipped
	 */
	@Nullable
	static String replacementText(JsonNode value) {
		return switch (NodeKind.of(value)) {
			case STRING -> {
				String text = JsonText.stringValue(value);
				yield text.isBlank() ? null : text;
			}
			case NUMBER, BOOL -> value.toString();
			case NULL, OBJECT, ARRAY -> null;
		};
	}

	/**
	 * @return true if both nodes have the same kind and, recursively,
	 * objects have the same keys and arrays have the same length
	 */
	public static boolean sameShape(JsonNode actual, JsonNode expected) {
		NodeKind kind = NodeKind.of(expected);
		if (NodeKind.of(actual) != kind) {
			return false;
		}
		switch (kind) {
			case OBJECT -> {
				if (actual.size() != expected.size()) {
					return false;
				}
				for (Map.Entry<String, JsonNode> member : expected.properties()) {
					JsonNode other = actual.get(member.getKey());
					if (other == null || !sameShape(other, member.getValue())) {
						return false;
					}
				}
				return true;
			}
			case ARRAY -> {
				if (actual.size() != expected.size()) {
					return false;
				}
				Iterator<JsonNode> a = actual.iterator();
				for (JsonNode e : expected) {
					if (!sameShape(a.next(), e)) {
						return false;
					}
				}
				return true;
			}
			default -> {
				return true;
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(CorrectionsApplier.class);
}
