package works.jsonlens.products;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import works.jsonlens.ProgressListener;
import works.jsonlens.Snapshot;
import works.jsonlens.address.Address;
import works.jsonlens.address.DocumentSurgeon;
import works.jsonlens.exceptions.AddressException;
import works.jsonlens.products.IntermediateProduct.Item;
import works.jsonlens.tree.IndexedNode;
import works.jsonlens.tree.JsonText;
import works.jsonlens.tree.VisibilityEngine;

/**
 * Turns a filter into an {@link IntermediateProduct}: every indexed node whose address or name
 * contains the filter, paired with the value of the <code>name</code> field beside it.
 * <p>
 * Runs in three stages: selection, resolution, and assembly.
 * Each distinct address is resolved against the document at most once.
 */
@RequiredArgsConstructor
public final class DerivationPipeline {
	private final DocumentSurgeon surgeon;

	public DerivationPipeline() {
		this(new DocumentSurgeon());
	}

	/**
	 * @param leafOnly if true, only scalar nodes whose name contains the filter are selected;
	 * otherwise, any node whose address or name contains it
	 */
	public IntermediateProduct run(Snapshot snapshot, String filter, boolean leafOnly, ProgressListener progress) {
		if (filter.isBlank()) {
			LOGGER.debug("Blank filter; nothing to derive");
			return IntermediateProduct.empty(filter);
		}
		long start = System.nanoTime();

		List<IndexedNode> selected = select(snapshot.index(), filter, leafOnly);
		long selectedAt = System.nanoTime();
		progress.progress(0.1, "Selected " + selected.size() + " nodes");

		List<Optional<String>> nameAddresses = new ArrayList<>(selected.size());
		Set<String> distinct = new LinkedHashSet<>();
		for (IndexedNode node : selected) {
			Optional<String> nameAddress = NameAddresses.forNode(node);
			nameAddresses.add(nameAddress);
			distinct.add(node.address());
			nameAddress.ifPresent(distinct::add);
		}
		Map<String, Optional<JsonNode>> resolved = new HashMap<>();
		for (String address : distinct) {
			resolved.put(address, resolve(snapshot.document(), address));
		}
		long resolvedAt = System.nanoTime();
		progress.progress(0.5, "Resolved " + distinct.size() + " addresses");

		progress.progress(0.9, "Assembling " + selected.size() + " items");
		List<Item> items = new ArrayList<>(selected.size());
		for (int i = 0; i < selected.size(); i++) {
			IndexedNode node = selected.get(i);
			Optional<String> nameAddress = nameAddresses.get(i);
			items.add(new Item(
				node.address(),
				nameAddress.orElse(node.address()),
				textAt(resolved, node.address()),
				node.name(),
				nameAddress.map(a -> textAt(resolved, a)).orElse(""),
				i));
		}
		long end = System.nanoTime();
		progress.progress(1.0, "Done");

		LOGGER.debug("Derived {} items for filter \"{}\": select {}ms, resolve {}ms, assemble {}ms",
			items.size(), filter,
			millis(start, selectedAt), millis(selectedAt, resolvedAt), millis(resolvedAt, end));
		return new IntermediateProduct(filter, items);
	}

	/**
	 * Only visible nodes are candidates.
	 */
	static List<IndexedNode> select(List<IndexedNode> index, String filter, boolean leafOnly) {
		List<IndexedNode> result = new ArrayList<>();
		for (IndexedNode node : index) {
			if (!node.isVisible()) {
				continue;
			}
			boolean selected = leafOnly
				? node.kind().isScalar() && node.name().contains(filter)
				: VisibilityEngine.matches(node, filter);
			if (selected) {
				result.add(node);
			}
		}
		return result;
	}

	private Optional<JsonNode> resolve(JsonNode document, String address) {
		try {
			return surgeon.find(document, Address.parse(address));
		} catch (AddressException e) {
			LOGGER.debug("Unable to resolve {}", address, e);
			return Optional.empty();
		}
	}

	private static String textAt(Map<String, Optional<JsonNode>> resolved, String address) {
		return resolved.getOrDefault(address, Optional.empty()).map(JsonText::plain).orElse("");
	}

	private static long millis(long from, long to) {
		return (to - from) / 1_000_000;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DerivationPipeline.class);
}
