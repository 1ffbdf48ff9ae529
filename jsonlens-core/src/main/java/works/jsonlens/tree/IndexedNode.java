package works.jsonlens.tree;

import java.util.Objects;

/**
 * One entry of the shadow tree: the structure of a single document node,
 * without its value.
 * <p>
 * Everything but {@link #isExpanded() expanded} and {@link #isVisible() visible}
 * is fixed when the index is built.
 * Those two flags belong to the {@link VisibilityEngine}.
 */
public final class IndexedNode {
	private final String name;
	private final String address;
	private final NodeKind kind;
	private final int children;
	private final String preview;
	private final int depth;
	private boolean expanded = false;
	private boolean visible = true;

	public IndexedNode(String name, String address, NodeKind kind, int children, String preview, int depth) {
		this.name = name;
		this.address = address;
		this.kind = kind;
		this.children = children;
		this.preview = preview;
		this.depth = depth;
	}

	/**
	 * @return the key of this node within its parent object,
	 * an <code>[index]</code> token for an array element,
	 * or <code>$</code> for the root.
	 */
	public String name() {
		return name;
	}

	public String address() {
		return address;
	}

	public NodeKind kind() {
		return kind;
	}

	/**
	 * @return number of immediate members; zero for scalars
	 */
	public int children() {
		return children;
	}

	public String preview() {
		return preview;
	}

	public int depth() {
		return depth;
	}

	public boolean isExpanded() {
		return expanded;
	}

	public void setExpanded(boolean expanded) {
		this.expanded = expanded;
	}

	public boolean isVisible() {
		return visible;
	}

	public void setVisible(boolean visible) {
		this.visible = visible;
	}

	/**
	 * @return a detached copy whose flags can change without affecting this one
	 */
	public IndexedNode copy() {
		IndexedNode result = new IndexedNode(name, address, kind, children, preview, depth);
		result.expanded = this.expanded;
		result.visible = this.visible;
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		IndexedNode that = (IndexedNode) o;
		return children == that.children
			&& depth == that.depth
			&& expanded == that.expanded
			&& visible == that.visible
			&& name.equals(that.name)
			&& address.equals(that.address)
			&& kind == that.kind
			&& preview.equals(that.preview);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, address, kind, children, preview, depth, expanded, visible);
	}

	@Override
	public String toString() {
		return "IndexedNode(" + address + " " + kind + " " + preview + ")";
	}
}
