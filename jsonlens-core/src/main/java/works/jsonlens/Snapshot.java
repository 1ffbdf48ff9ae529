package works.jsonlens;

import java.nio.file.Path;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import works.jsonlens.tree.IndexedNode;

/**
 * A detached copy of a session's state that can be read, or modified,
 * away from the session's owning thread without affecting the session.
 *
 * @param document a deep copy of the session's document
 * @param index copies of the session's indexed nodes, including their flags
 * @param origin the file the document was loaded from, if any
 */
public record Snapshot(
	JsonNode document,
	List<IndexedNode> index,
	@Nullable Path origin
) {
	public Snapshot {
		index = List.copyOf(index);
	}
}
