package works.jsonlens.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import tools.jackson.databind.JsonNode;
import works.jsonlens.address.Address;

/**
 * Builds the shadow tree: a flat, pre-order index of every node in a document.
 * <p>
 * Each {@link IndexedNode} records where a node is and what it looks like,
 * but never holds the node's value, so the index stays small
 * even when the document holds large strings or containers.
 * <p>
 * The traversal uses an explicit stack, so document depth is limited by heap rather than by the thread stack.
 */
public final class ShadowTreeBuilder {
	private final int previewLength;

	public ShadowTreeBuilder() {
		this(DEFAULT_PREVIEW_LENGTH);
	}

	/**
	 * @param previewLength strings longer than this many code points are truncated in previews
	 */
	public ShadowTreeBuilder(int previewLength) {
		if (previewLength < 0) {
			throw new IllegalArgumentException("previewLength must not be negative: " + previewLength);
		}
		this.previewLength = previewLength;
	}

	public List<IndexedNode> build(JsonNode root) {
		List<IndexedNode> result = new ArrayList<>();
		Deque<Pending> stack = new ArrayDeque<>();
		stack.push(new Pending(root, Address.ROOT, Address.ROOT, 0));
		while (!stack.isEmpty()) {
			Pending p = stack.pop();
			JsonNode node = p.node();
			result.add(new IndexedNode(p.name(), p.address(), NodeKind.of(node), memberCount(node), preview(node), p.depth()));

			// Push in reverse so the first child is popped first
			if (node.isObject()) {
				List<Map.Entry<String, JsonNode>> members = new ArrayList<>(node.properties());
				for (int i = members.size() - 1; i >= 0; i--) {
					Map.Entry<String, JsonNode> member = members.get(i);
					String key = member.getKey();
					stack.push(new Pending(member.getValue(), key, Address.member(p.address(), key), p.depth() + 1));
				}
			} else if (node.isArray()) {
				for (int i = node.size() - 1; i >= 0; i--) {
					stack.push(new Pending(node.get(i), "[" + i + "]", Address.element(p.address(), i), p.depth() + 1));
				}
			}
		}
		return result;
	}

	/**
	 * @return a short description of <code>node</code> that never materializes its full contents
	 */
	public String preview(JsonNode node) {
		return switch (NodeKind.of(node)) {
			case STRING -> "\"" + truncate(JsonText.stringValue(node).trim()) + "\"";
			case NUMBER, BOOL -> node.toString();
			case NULL -> "null";
			case OBJECT -> "{..} (" + node.size() + " keys)";
			case ARRAY -> "[..] (" + node.size() + " items)";
		};
	}

	private String truncate(String s) {
		if (s.codePointCount(0, s.length()) > previewLength) {
			return s.substring(0, s.offsetByCodePoints(0, previewLength)) + ELLIPSIS;
		} else {
			return s;
		}
	}

	private static int memberCount(JsonNode node) {
		if (node.isObject() || node.isArray()) {
			return node.size();
		} else {
			return 0;
		}
	}

	private record Pending(JsonNode node, String name, String address, int depth) {}

	public static final int DEFAULT_PREVIEW_LENGTH = 32;
	public static final String ELLIPSIS = "...";
}
