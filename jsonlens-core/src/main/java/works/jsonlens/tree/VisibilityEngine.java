package works.jsonlens.tree;

import java.util.List;

/**
 * Maintains the {@link IndexedNode#isExpanded() expanded} and
 * {@link IndexedNode#isVisible() visible} flags of a shadow tree.
 * <p>
 * Visibility comes from one of two mutually overriding sources:
 * expansion state ({@link #recomputeVisibility}) or a text filter ({@link #applyFilter}).
 * Whichever ran last wins; clearing a filter doesn't restore expansion-based visibility
 * until {@link #recomputeVisibility} runs again.
 */
public final class VisibilityEngine {
	private VisibilityEngine() {}

	/**
	 * Flips the expansion of the node at <code>address</code>, if any, then recomputes visibility.
	 *
	 * @return true if a node with that address was found
	 */
	public static boolean toggleExpanded(List<IndexedNode> index, String address) {
		boolean found = false;
		for (IndexedNode node : index) {
			if (node.address().equals(address)) {
				node.setExpanded(!node.isExpanded());
				found = true;
				break;
			}
		}
		recomputeVisibility(index);
		return found;
	}

	/**
	 * Shows the root and the immediate children of every visible expanded node; hides everything else.
	 * <p>
	 * One forward pass suffices: the index is in pre-order,
	 * so each node's visibility is settled before any of its descendants is scanned.
	 */
	public static void recomputeVisibility(List<IndexedNode> index) {
		for (int i = 0; i < index.size(); i++) {
			index.get(i).setVisible(i == 0);
		}
		for (int i = 0; i < index.size(); i++) {
			IndexedNode parent = index.get(i);
			if (parent.isVisible() && parent.isExpanded()) {
				int childDepth = parent.depth() + 1;
				for (int j = i + 1; j < index.size(); j++) {
					IndexedNode candidate = index.get(j);
					if (candidate.depth() <= parent.depth()) {
						break;
					} else if (candidate.depth() == childDepth) {
						candidate.setVisible(true);
					}
				}
			}
		}
	}

	/**
	 * Replaces visibility with a case-sensitive substring match against each node's address and name.
	 * A blank filter makes everything visible.
	 */
	public static void applyFilter(List<IndexedNode> index, String filter) {
		if (filter.isBlank()) {
			index.forEach(n -> n.setVisible(true));
		} else {
			index.forEach(n -> n.setVisible(matches(n, filter)));
		}
	}

	public static boolean matches(IndexedNode node, String filter) {
		return node.address().contains(filter) || node.name().contains(filter);
	}
}
