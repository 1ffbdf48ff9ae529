package works.jsonlens.tree;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.StringNode;

import static tools.jackson.databind.node.JsonNodeType.STRING;

/**
 * Renders document nodes as the plain text callers see:
 * strings without their quotes, everything else as compact JSON.
 */
public final class JsonText {
	private JsonText() {}

	public static String plain(JsonNode node) {
		if (node.getNodeType() == STRING) {
			return stringValue(node);
		} else {
			return node.toString();
		}
	}

	/**
	 * @param node must be a string node
	 */
	public static String stringValue(JsonNode node) {
		return node.asString();
	}

	public static JsonNode stringNode(String value) {
		return StringNode.valueOf(value);
	}
}
