package works.jsonlens.address;

import java.util.List;
import java.util.Optional;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;
import works.jsonlens.address.Address.Element;
import works.jsonlens.address.Address.Member;
import works.jsonlens.address.Address.Segment;
import works.jsonlens.exceptions.AddressException;

/**
 * Finds and replaces nodes of a {@link JsonNode} tree by {@link Address}.
 * <p>
 * Every supported address denotes at most one node,
 * so "first match" and "only match" coincide.
 */
public final class DocumentSurgeon {

	public sealed interface NodeLocation permits Root, MemberSlot, ElementSlot {}

	/**
	 * The document itself. Replacing it replaces the whole document.
	 */
	public record Root() implements NodeLocation {}

	public record MemberSlot(ObjectNode parent, String key) implements NodeLocation {}

	public record ElementSlot(ArrayNode parent, int index) implements NodeLocation {}

	public Optional<JsonNode> find(JsonNode root, Address address) {
		return Optional.ofNullable(walk(root, address.segments()));
	}

	/**
	 * @throws AddressException with reason {@link AddressException.Reason#NO_MATCH NO_MATCH} if nothing is there
	 */
	public JsonNode valueAt(JsonNode root, Address address) {
		return find(root, address).orElseThrow(() -> AddressException.noMatch(address.text()));
	}

	/**
	 * @return the assignable slot holding the node at <code>address</code>
	 * @throws AddressException if no node is there, or its container can't be modified
	 */
	public NodeLocation locate(JsonNode root, Address address) {
		if (address.isRoot()) {
			return new Root();
		}
		JsonNode parent = walk(root, address.parentSegments());
		if (parent == null) {
			throw AddressException.noMatch(address.text());
		}
		Segment last = address.lastSegment();
		if (last instanceof Member m) {
			if (!parent.isObject() || parent.get(m.key()) == null) {
				throw AddressException.noMatch(address.text());
			} else if (parent instanceof ObjectNode o) {
				return new MemberSlot(o, m.key());
			}
		} else if (last instanceof Element e) {
			if (!parent.isArray() || e.index() >= parent.size()) {
				throw AddressException.noMatch(address.text());
			} else if (parent instanceof ArrayNode a) {
				return new ElementSlot(a, e.index());
			}
		}
		throw AddressException.notUpdatable(address.text());
	}

	/**
	 * Puts <code>replacement</code> into the given slot.
	 *
	 * @return the root of the resulting document: <code>replacement</code> itself
	 * if <code>location</code> is the {@link Root}, and <code>root</code> otherwise.
	 */
	public JsonNode replace(JsonNode root, NodeLocation location, JsonNode replacement) {
		if (location instanceof MemberSlot m) {
			m.parent().set(m.key(), replacement);
			return root;
		} else if (location instanceof ElementSlot e) {
			e.parent().set(e.index(), replacement);
			return root;
		} else {
			return replacement;
		}
	}

	private static JsonNode walk(JsonNode root, List<Segment> segments) {
		JsonNode current = root;
		for (Segment segment : segments) {
			if (segment instanceof Member m) {
				current = current.isObject() ? current.get(m.key()) : null;
			} else {
				int index = ((Element) segment).index();
				current = (current.isArray() && index < current.size()) ? current.get(index) : null;
			}
			if (current == null) {
				return null;
			}
		}
		return current;
	}
}
