package works.jsonlens.products;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.node.ObjectNode;
import works.jsonlens.Snapshot;
import works.jsonlens.address.Address;
import works.jsonlens.address.DocumentSurgeon;
import works.jsonlens.exceptions.JsonLensException;
import works.jsonlens.tree.IndexedNode;
import works.jsonlens.tree.NodeKind;
import works.jsonlens.tree.VisibilityEngine;

/**
 * Gathers the content of every visible node matching a filter into a single text,
 * suitable for copying out of the application in one go.
 */
public final class SearchListing {
	private final ProductCodec codec;
	private final DocumentSurgeon surgeon;

	public SearchListing(ProductCodec codec) {
		this.codec = codec;
		this.surgeon = new DocumentSurgeon();
	}

	/**
	 * @return empty text for a blank filter; <code>{}</code> if nothing matches;
	 * the node itself if exactly one node matches;
	 * otherwise an object listing every match with its content
	 */
	public String list(Snapshot snapshot, String filter) {
		if (filter.isBlank()) {
			return "";
		}
		List<IndexedNode> matches = new ArrayList<>();
		for (IndexedNode node : snapshot.index()) {
			if (node.isVisible() && VisibilityEngine.matches(node, filter)) {
				matches.add(node);
			}
		}
		if (matches.isEmpty()) {
			LOGGER.warn("No visible nodes match \"{}\"", filter);
			return "{}";
		}
		LOGGER.info("{} visible nodes match \"{}\"", matches.size(), filter);
		if (matches.size() == 1) {
			return codec.pretty(surgeon.valueAt(snapshot.document(), Address.parse(matches.get(0).address())));
		}

		ObjectNode root = codec.mapper().createObjectNode();
		root.put("search_filter", filter);
		root.put("total_matches", matches.size());
		root.put("displayed_matches", matches.size());
		root.put("truncated", false);
		ObjectNode results = root.putObject("results");
		for (int i = 0; i < matches.size(); i++) {
			IndexedNode node = matches.get(i);
			String key = "match_" + (i + 1) + "_" + node.name();
			try {
				JsonNode content = surgeon.valueAt(snapshot.document(), Address.parse(node.address()));
				describe(results.putObject(key), node).set("content", content.deepCopy());
			} catch (JsonLensException e) {
				LOGGER.error("Unable to extract {}", node.address(), e);
				describe(results.putObject(key + "_error"), node).put("error", e.getMessage());
			}
		}
		return codec.pretty(root);
	}

	private static ObjectNode describe(ObjectNode entry, IndexedNode node) {
		entry.put("path", node.address());
		entry.put("name", node.name());
		entry.put("type", displayName(node.kind()));
		return entry;
	}

	static String displayName(NodeKind kind) {
		String name = kind.name();
		return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SearchListing.class);
}
