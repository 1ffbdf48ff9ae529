package works.jsonlens.products;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.jsonlens.ProgressListener;
import works.jsonlens.Session;
import works.jsonlens.Session.PendingChange;
import works.jsonlens.Snapshot;
import works.jsonlens.exceptions.MutationInProgressException;
import works.jsonlens.logging.MappedDiagnosticContext.MDCScope;

/**
 * Runs a session's long operations on a background thread.
 * <p>
 * Every method must be called on the session's owning context, represented by <code>owner</code>.
 * State is captured there as a {@link Snapshot} before any work is handed off;
 * the worker never touches the session.
 * Results, and any failure, complete the returned future on <code>owner</code>;
 * progress notifications are posted there too, on a best-effort basis.
 */
public final class ProductWorker implements AutoCloseable {
	private final Session session;
	private final Executor owner;
	private final ExecutorService worker;
	private final ProductCodec codec;
	private final DerivationPipeline pipeline;
	private final ProjectionTransform projection;
	private final CorrectionsApplier corrections;
	private final AtomicBoolean isOpen = new AtomicBoolean(true);

	/**
	 * Both artifacts from a one-step derivation.
	 */
	public record Products(IntermediateProduct intermediate, FinalProduct finalProduct) {}

	public ProductWorker(Session session, Executor owner) {
		this.session = session;
		this.owner = owner;
		this.worker = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "jsonlens worker \"" + session.name() + "\" " + session.instanceID());
			t.setDaemon(true);
			return t;
		});
		this.codec = new ProductCodec(session.config().mapper());
		this.pipeline = new DerivationPipeline();
		this.projection = new ProjectionTransform(codec);
		this.corrections = new CorrectionsApplier(codec);
	}

	public ProductCodec codec() {
		return codec;
	}

	/**
	 * A blank filter completes immediately with an empty product, without consulting the session.
	 */
	public CompletableFuture<IntermediateProduct> deriveIntermediate(String filter, boolean leafOnly, ProgressListener progress) {
		if (filter.isBlank()) {
			return CompletableFuture.completedFuture(IntermediateProduct.empty(filter));
		}
		ProgressListener relay = relay(progress);
		return submit(snapshot -> pipeline.run(snapshot, filter, leafOnly, relay));
	}

	public CompletableFuture<FinalProduct> project(String intermediateText, ProgressListener progress) {
		ProgressListener relay = relay(progress);
		return deliver(CompletableFuture.supplyAsync(withMDC(() -> {
			relay.progress(0.0, "Projecting");
			FinalProduct result = projection.project(intermediateText);
			relay.progress(1.0, "Done");
			return result;
		}), worker));
	}

	/**
	 * Derives the intermediate product and projects it in one step.
	 * Derivation reports progress from 10% to 50%, and projection from 50% to 100%.
	 */
	public CompletableFuture<Products> deriveFinalProduct(String filter, boolean leafOnly, ProgressListener progress) {
		ProgressListener relay = relay(progress);
		if (filter.isBlank()) {
			IntermediateProduct empty = IntermediateProduct.empty(filter);
			return CompletableFuture.completedFuture(new Products(empty, projection.project(empty)));
		}
		return submit(snapshot -> {
			relay.progress(0.0, "Starting");
			IntermediateProduct intermediate = pipeline.run(snapshot, filter, leafOnly, relay.scaled(0.1, 0.5, "Deriving: "));
			ProgressListener projecting = relay.scaled(0.5, 1.0, "Projecting: ");
			projecting.progress(0.0, "Started");
			FinalProduct finalProduct = projection.project(intermediate);
			projecting.progress(1.0, "Done");
			return new Products(intermediate, finalProduct);
		});
	}

	/**
	 * Applies an uploaded corrections text to a snapshot of the document on the worker,
	 * then installs the result in the session on the owner.
	 * <p>
	 * The session is reserved from the time of this call until the returned future completes;
	 * meanwhile, any other change to it fails with {@link MutationInProgressException}.
	 *
	 * @param expectedShape if not null, the upload must match its structure
	 * @throws MutationInProgressException if the session is already being changed
	 */
	public CompletableFuture<CorrectionsApplier.Result> applyCorrections(
		String uploadText,
		IntermediateProduct intermediate,
		@Nullable FinalProduct expectedShape,
		ProgressListener progress
	) {
		PendingChange change = session.beginChange("apply corrections");
		ProgressListener relay = relay(progress);
		CompletableFuture<CorrectionsApplier.Result> result;
		try {
			result = submit(snapshot -> {
				relay.progress(0.1, "Applying corrections");
				CorrectionsApplier.Result r = corrections.apply(snapshot.document(), uploadText, intermediate, expectedShape);
				relay.progress(0.9, "Modified " + r.modified() + ", skipped " + r.skipped());
				return r;
			}).thenApply(r -> {
				// Runs on the owner
				change.install(r.document());
				relay.progress(1.0, "Installed");
				return r;
			});
		} catch (RuntimeException e) {
			change.close();
			throw e;
		}
		return result.whenComplete((r, e) -> change.close());
	}

	@Override
	public void close() {
		if (isOpen.getAndSet(false)) {
			LOGGER.debug("Closing");
			worker.shutdown();
		} else {
			LOGGER.debug("Already closed");
		}
	}

	/**
	 * Takes a snapshot now, on the owner, and runs <code>action</code> on it in the worker.
	 * A failure to take the snapshot is reported through the returned future.
	 */
	private <T> CompletableFuture<T> submit(Function<Snapshot, T> action) {
		Snapshot snapshot;
		try {
			snapshot = session.snapshot();
		} catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
		return deliver(CompletableFuture.supplyAsync(withMDC(() -> action.apply(snapshot)), worker));
	}

	/**
	 * Moves completion of <code>work</code> onto the owner.
	 */
	private <T> CompletableFuture<T> deliver(CompletableFuture<T> work) {
		CompletableFuture<T> result = new CompletableFuture<>();
		work.whenComplete((value, error) -> {
			try {
				owner.execute(() -> {
					if (error == null) {
						result.complete(value);
					} else {
						result.completeExceptionally(error);
					}
				});
			} catch (RejectedExecutionException e) {
				LOGGER.warn("Owner rejected the result; completing on the worker", e);
				if (error == null) {
					result.complete(value);
				} else {
					result.completeExceptionally(error);
				}
			}
		});
		return result;
	}

	private <T> Supplier<T> withMDC(Supplier<T> action) {
		return () -> {
			try (MDCScope __ = session.mdc()) {
				return action.get();
			}
		};
	}

	/**
	 * @return a listener that posts each notification to the owner and never throws
	 */
	private ProgressListener relay(ProgressListener listener) {
		return (fraction, phase) -> {
			try {
				owner.execute(() -> {
					try {
						listener.progress(fraction, phase);
					} catch (RuntimeException e) {
						LOGGER.warn("Progress listener failed at {} ({})", fraction, phase, e);
					}
				});
			} catch (RejectedExecutionException e) {
				LOGGER.debug("Dropped progress notification at {} ({}): owner is gone", fraction, phase);
			}
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ProductWorker.class);
}
