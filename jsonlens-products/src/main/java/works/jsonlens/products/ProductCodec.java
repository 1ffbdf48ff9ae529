package works.jsonlens.products;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.jsonlens.exceptions.ParseFailureException;
import works.jsonlens.products.IntermediateProduct.Item;
import works.jsonlens.tree.JsonText;

import static tools.jackson.databind.node.JsonNodeType.STRING;

/**
 * Converts products to and from their JSON text form.
 */
public final class ProductCodec {
	private final ObjectMapper mapper;

	/**
	 * @param mapper should be configured for indented output
	 */
	public ProductCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public String write(IntermediateProduct product) {
		ObjectNode root = mapper.createObjectNode();
		root.put("stage", IntermediateProduct.STAGE);
		root.put("filter", product.filter());
		root.put("count", product.count());
		ArrayNode items = root.putArray("items");
		for (Item item : product.items()) {
			ObjectNode node = items.addObject();
			node.put("source_path", item.sourcePath());
			node.put("name_path", item.namePath());
			node.put("name", item.name());
			node.put("field_name", item.fieldName());
			node.put("name_field_value", item.nameFieldValue());
			node.put("seq", item.seq());
		}
		return mapper.writeValueAsString(root);
	}

	public String write(FinalProduct product) {
		ObjectNode root = mapper.createObjectNode();
		for (Map.Entry<String, String> entry : product.entries().entrySet()) {
			root.put(entry.getKey(), entry.getValue());
		}
		return mapper.writeValueAsString(root);
	}

	/**
	 * Missing item fields read as empty strings; a missing <code>seq</code> reads as the item's position.
	 *
	 * @throws ParseFailureException if the text isn't JSON or has no <code>items</code> array
	 */
	public IntermediateProduct readIntermediate(String text) {
		JsonNode root = parse(text, "intermediate product");
		JsonNode items = root.get("items");
		if (items == null || !items.isArray()) {
			throw new ParseFailureException("Intermediate product has no items array");
		}
		List<Item> result = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			JsonNode item = items.get(i);
			JsonNode seq = item.get("seq");
			result.add(new Item(
				stringField(item, "source_path"),
				stringField(item, "name_path"),
				stringField(item, "name"),
				stringField(item, "field_name"),
				stringField(item, "name_field_value"),
				(seq != null && seq.isIntegralNumber()) ? (int) seq.longValue() : i));
		}
		JsonNode filter = root.get("filter");
		return new IntermediateProduct(filter == null ? "" : JsonText.plain(filter), result);
	}

	/**
	 * @throws ParseFailureException if the text isn't JSON
	 */
	public JsonNode parse(String text, String description) {
		JsonNode result;
		try {
			result = mapper.readTree(text);
		} catch (JacksonException e) {
			throw new ParseFailureException("Invalid JSON in " + description + ": " + e.getOriginalMessage(), e);
		}
		if (result == null || result.isMissingNode()) {
			throw new ParseFailureException("No JSON value in " + description);
		}
		return result;
	}

	public String pretty(JsonNode node) {
		return mapper.writeValueAsString(node);
	}

	public ObjectMapper mapper() {
		return mapper;
	}

	/**
	 * @return the string value of <code>field</code>, or empty if absent or not a string
	 */
	static String stringField(JsonNode object, String field) {
		JsonNode value = object.get(field);
		if (value != null && value.getNodeType() == STRING) {
			return JsonText.stringValue(value);
		} else {
			return "";
		}
	}
}
