package works.jsonlens.products;

import java.util.Optional;
import works.jsonlens.tree.IndexedNode;

/**
 * Derives the address of the <code>name</code> field that sits beside a given node.
 */
public final class NameAddresses {
	private NameAddresses() {}

	public static final String NAME_FIELD = "name";

	/**
	 * Replaces the last top-level member segment of <code>address</code> with <code>.name</code>.
	 * Dots inside brackets don't count.
	 * <p>
	 * For example, <code>$.items[2].title</code> becomes <code>$.items[2].name</code>.
	 *
	 * @return empty if <code>address</code> has no top-level dot
	 */
	public static Optional<String> derive(String address) {
		int depth = 0;
		int lastDot = -1;
		for (int i = 0; i < address.length(); i++) {
			switch (address.charAt(i)) {
				case '[' -> depth++;
				case ']' -> depth--;
				case '.' -> {
					if (depth == 0) {
						lastDot = i;
					}
				}
				default -> {}
			}
		}
		if (lastDot == -1) {
			return Optional.empty();
		} else {
			return Optional.of(address.substring(0, lastDot) + "." + NAME_FIELD);
		}
	}

	/**
	 * Like {@link #derive}, except that a node already named <code>name</code> is its own name field.
	 */
	public static Optional<String> forNode(IndexedNode node) {
		if (NAME_FIELD.equals(node.name())) {
			return Optional.of(node.address());
		} else {
			return derive(node.address());
		}
	}
}
