package works.jsonlens.products;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Sequence number to text, as produced by the {@link ProjectionTransform}.
 * <p>
 * Keys are decimal strings ordered as strings, so <code>"10"</code> precedes <code>"2"</code>.
 */
public record FinalProduct(SortedMap<String, String> entries) {
	public FinalProduct {
		entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
	}

	public int size() {
		return entries.size();
	}
}
