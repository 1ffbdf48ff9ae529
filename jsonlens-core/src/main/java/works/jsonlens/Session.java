package works.jsonlens;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import works.jsonlens.address.Address;
import works.jsonlens.address.DocumentSurgeon;
import works.jsonlens.address.DocumentSurgeon.NodeLocation;
import works.jsonlens.exceptions.IoFailureException;
import works.jsonlens.exceptions.MutationInProgressException;
import works.jsonlens.exceptions.NotLoadedException;
import works.jsonlens.exceptions.ParseFailureException;
import works.jsonlens.logging.MappedDiagnosticContext.MDCScope;
import works.jsonlens.tree.IndexedNode;
import works.jsonlens.tree.JsonText;
import works.jsonlens.tree.ShadowTreeBuilder;
import works.jsonlens.tree.VisibilityEngine;

import static java.nio.charset.StandardCharsets.UTF_8;
import static works.jsonlens.logging.MappedDiagnosticContext.setupMDC;

/**
 * Owns one document, its shadow tree index, and the file it came from.
 * <p>
 * A session has a single owner. Reads and visibility changes run synchronously on the caller's thread.
 * Changes to the document ({@link #load}, {@link #mutate}, {@link #install})
 * replace the document and its index together,
 * and a second change attempted while one is underway fails with {@link MutationInProgressException}.
 * Work that must happen elsewhere reserves the session with {@link #beginChange},
 * operates on a {@link #snapshot() snapshot},
 * and hands its result back through {@link PendingChange#install}.
 * <p>
 * The index is always rebuilt from scratch after a change; stale addresses are never served.
 */
public final class Session {
	private final String name;
	private final String instanceID = UUID.randomUUID().toString();
	private final SessionConfig config;
	private final ShadowTreeBuilder treeBuilder;
	private final DocumentSurgeon surgeon = new DocumentSurgeon();
	private final AtomicBoolean mutationInProgress = new AtomicBoolean(false);
	private volatile State state = State.EMPTY;

	/**
	 * The document and its index always change together.
	 * A null document means nothing is loaded.
	 */
	private record State(@Nullable JsonNode document, List<IndexedNode> index, @Nullable Path origin) {
		static final State EMPTY = new State(null, List.of(), null);
	}

	public Session(String name) {
		this(name, SessionConfig.defaults());
	}

	public Session(String name, SessionConfig config) {
		this.name = name;
		this.config = config;
		this.treeBuilder = new ShadowTreeBuilder(config.previewLength());
	}

	public String name() {
		return name;
	}

	public String instanceID() {
		return instanceID;
	}

	public SessionConfig config() {
		return config;
	}

	public boolean isLoaded() {
		return state.document() != null;
	}

	/**
	 * @return the file the document was loaded from, which {@link #save()} writes back to
	 */
	public Optional<Path> origin() {
		return Optional.ofNullable(state.origin());
	}

	/**
	 * @return the live index, in pre-order. Its flags change as visibility operations run.
	 */
	public List<IndexedNode> index() {
		return Collections.unmodifiableList(state.index());
	}

	public void load(Path file) {
		try (MDCScope __ = mdc()) {
			byte[] bytes;
			try {
				bytes = Files.readAllBytes(file);
			} catch (IOException e) {
				throw new IoFailureException(file.toString(), "Unable to read " + file, e);
			}
			LOGGER.debug("Read {} bytes from {}", bytes.length, file);
			JsonNode document = parse(bytes, file.toString());
			replaceState(document, file, "load");
		}
	}

	public void load(String text) {
		load(text, null);
	}

	/**
	 * @param origin where the text came from, for a later {@link #save()}
	 */
	public void load(String text, @Nullable Path origin) {
		try (MDCScope __ = mdc()) {
			JsonNode document = parse(text.getBytes(UTF_8), origin == null ? "text" : origin.toString());
			replaceState(document, origin, "load");
		}
	}

	/**
	 * Replaces the document with one produced elsewhere, typically from a {@link #snapshot()},
	 * keeping the recorded origin.
	 */
	public void install(JsonNode document) {
		try (MDCScope __ = mdc()) {
			replaceState(document, state.origin(), "install");
		}
	}

	/**
	 * Reserves this session for a change that will be computed elsewhere, typically from a {@link #snapshot()}.
	 * Until the returned handle is closed, every other change fails with {@link MutationInProgressException}.
	 *
	 * @throws MutationInProgressException if another change is already underway
	 */
	public PendingChange beginChange(String operation) {
		beginMutation(operation);
		LOGGER.debug("Began {}", operation);
		return new PendingChange(operation);
	}

	/**
	 * The right to change a session, held from {@link #beginChange} until {@link #close()}.
	 */
	public final class PendingChange implements AutoCloseable {
		private final String operation;
		private final AtomicBoolean isOpen = new AtomicBoolean(true);

		private PendingChange(String operation) {
			this.operation = operation;
		}

		/**
		 * Like {@link Session#install}, but under this change's reservation.
		 *
		 * @throws IllegalStateException if this change is already closed
		 */
		public void install(JsonNode document) {
			if (!isOpen.get()) {
				throw new IllegalStateException("Cannot install: " + operation + " is already finished");
			}
			try (MDCScope __ = mdc()) {
				swapState(document, state.origin(), operation);
			}
		}

		@Override
		public void close() {
			if (isOpen.getAndSet(false)) {
				mutationInProgress.set(false);
				LOGGER.debug("Finished {}", operation);
			}
		}
	}

	/**
	 * @return the first node matching <code>address</code>, as pretty-printed JSON
	 */
	public String extract(String address) {
		try (MDCScope __ = mdc()) {
			JsonNode node = surgeon.valueAt(requireDocument(), Address.parse(address));
			return pretty(node);
		}
	}

	/**
	 * Replaces the node at <code>address</code> with a string whose value is <code>newText</code>,
	 * then rebuilds the index.
	 * <p>
	 * The text is stored verbatim; it is never parsed, even if it looks like JSON.
	 * On failure, the document is unchanged.
	 */
	public void mutate(String address, String newText) {
		try (MDCScope __ = mdc()) {
			beginMutation("mutate");
			try {
				State current = state;
				JsonNode document = requireDocument(current);
				NodeLocation location = surgeon.locate(document, Address.parse(address));
				JsonNode newRoot = surgeon.replace(document, location, JsonText.stringNode(newText));
				state = new State(newRoot, treeBuilder.build(newRoot), current.origin());
				LOGGER.debug("Replaced {}; index now has {} nodes", address, state.index().size());
				traceCurrentState("After mutate");
			} finally {
				mutationInProgress.set(false);
			}
		}
	}

	/**
	 * Writes the document back to the file it was loaded from.
	 */
	public void save() {
		Path origin = state.origin();
		if (origin == null) {
			throw new IoFailureException(null, "No file location recorded for session \"" + name + "\"", null);
		}
		save(origin);
	}

	public void save(Path file) {
		try (MDCScope __ = mdc()) {
			String text = pretty(requireDocument());
			try {
				Files.writeString(file, text);
			} catch (IOException e) {
				throw new IoFailureException(file.toString(), "Unable to write " + file, e);
			}
			LOGGER.info("Saved {} characters to {}", text.length(), file);
		}
	}

	/**
	 * Writes the whole document, pretty-printed, to <code>sink</code>. Does not close it.
	 */
	public void writeTo(Writer sink) {
		try (MDCScope __ = mdc()) {
			String text = pretty(requireDocument());
			try {
				sink.write(text);
				sink.flush();
			} catch (IOException e) {
				throw new IoFailureException(sink.toString(), "Unable to write document", e);
			}
		}
	}

	/**
	 * @return true if a node with that address exists
	 * @see VisibilityEngine#toggleExpanded
	 */
	public boolean toggleExpanded(String address) {
		return VisibilityEngine.toggleExpanded(state.index(), address);
	}

	/**
	 * @see VisibilityEngine#recomputeVisibility
	 */
	public void recomputeVisibility() {
		VisibilityEngine.recomputeVisibility(state.index());
	}

	/**
	 * @see VisibilityEngine#applyFilter
	 */
	public void applyFilter(String text) {
		VisibilityEngine.applyFilter(state.index(), text);
	}

	/**
	 * @throws NotLoadedException if there's no document
	 */
	public Snapshot snapshot() {
		State current = state;
		JsonNode document = requireDocument(current);
		return new Snapshot(
			document.deepCopy(),
			current.index().stream().map(IndexedNode::copy).toList(),
			current.origin());
	}

	public String pretty(JsonNode node) {
		return config.mapper().writeValueAsString(node);
	}

	public MDCScope mdc() {
		return setupMDC(name, instanceID);
	}

	private JsonNode parse(byte[] bytes, String source) {
		JsonNode result;
		try {
			result = config.mapper().readTree(bytes);
		} catch (JacksonException e) {
			throw new ParseFailureException("Invalid JSON in " + source + ": " + e.getOriginalMessage(), e);
		}
		if (result == null || result.isMissingNode()) {
			throw new ParseFailureException("No JSON value in " + source);
		}
		return result;
	}

	private void replaceState(JsonNode document, @Nullable Path origin, String operation) {
		beginMutation(operation);
		try {
			swapState(document, origin, operation);
		} finally {
			mutationInProgress.set(false);
		}
	}

	/**
	 * Caller must hold the mutation reservation.
	 */
	private void swapState(JsonNode document, @Nullable Path origin, String operation) {
		long start = System.nanoTime();
		List<IndexedNode> index = treeBuilder.build(document);
		state = new State(document, index, origin);
		LOGGER.debug("{}: indexed {} nodes in {}ms", operation, index.size(), (System.nanoTime() - start) / 1_000_000);
		traceCurrentState("After " + operation);
	}

	private void beginMutation(String operation) {
		if (!mutationInProgress.compareAndSet(false, true)) {
			throw new MutationInProgressException("Cannot " + operation + " session \"" + name + "\" while another change is in progress");
		}
	}

	private JsonNode requireDocument() {
		return requireDocument(state);
	}

	private JsonNode requireDocument(State s) {
		JsonNode document = s.document();
		if (document == null) {
			throw new NotLoadedException("Session \"" + name + "\" has no document loaded");
		}
		return document;
	}

	void traceCurrentState(String description) {
		if (LOGGER.isTraceEnabled()) {
			LOGGER.trace("State {}:\n{}", description, requireDocument().toPrettyString());
		}
	}

	@Override
	public String toString() {
		return "Session(" + name + ", " + instanceID + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Session.class);
}
