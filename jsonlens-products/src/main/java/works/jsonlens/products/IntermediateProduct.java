package works.jsonlens.products;

import java.util.List;

/**
 * The ordered listing produced by the {@link DerivationPipeline}:
 * one item per matching node, numbered from zero in document order.
 */
public record IntermediateProduct(String filter, List<Item> items) {
	public static final String STAGE = "intermediate2";

	public IntermediateProduct {
		items = List.copyOf(items);
	}

	public static IntermediateProduct empty(String filter) {
		return new IntermediateProduct(filter, List.of());
	}

	public int count() {
		return items.size();
	}

	/**
	 * @param sourcePath address of the matching node
	 * @param namePath address of its sibling <code>name</code> field, or <code>sourcePath</code> if none could be derived
	 * @param name the matching node's own value, as text
	 * @param fieldName the matching node's key or index token
	 * @param nameFieldValue the value at <code>namePath</code>, as text; empty if unresolved
	 * @param seq position in the listing
	 */
	public record Item(
		String sourcePath,
		String namePath,
		String name,
		String fieldName,
		String nameFieldValue,
		int seq
	) {}
}
