package works.jsonlens.products;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import works.jsonlens.ProgressListener;
import works.jsonlens.Session;
import works.jsonlens.exceptions.MutationInProgressException;
import works.jsonlens.exceptions.NotLoadedException;
import works.jsonlens.exceptions.ParseFailureException;
import works.jsonlens.products.ProductWorker.Products;
import works.jsonlens.testing.AbstractSessionTest;
import works.jsonlens.testing.TestDocuments;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.jsonlens.ProgressListener.NONE;

class ProductWorkerTest extends AbstractSessionTest {
	private static final String OWNER_THREAD = "owner";
	private static final String TITLES = """
		{"items": [{"title": "a", "name": "n0"}, {"title": "b", "name": "n1"}, {"title": "c", "name": "n2"}]}
		""";

	private ExecutorService owner;
	private ProductWorker worker;

	@BeforeEach
	void setUp() {
		owner = Executors.newSingleThreadExecutor(r -> new Thread(r, OWNER_THREAD));
		worker = new ProductWorker(session, owner);
	}

	@AfterEach
	void tearDown() {
		worker.close();
		owner.shutdownNow();
	}

	@Test
	void deriveIntermediate_progressOnOwner() throws Exception {
		load(TITLES);
		List<Double> fractions = new CopyOnWriteArrayList<>();
		List<String> threads = new CopyOnWriteArrayList<>();
		ProgressListener listener = (fraction, phase) -> {
			fractions.add(fraction);
			threads.add(Thread.currentThread().getName());
		};
		IntermediateProduct product = worker.deriveIntermediate("title", false, listener).get(10, SECONDS);
		assertEquals(3, product.count());
		assertEquals(List.of(0.1, 0.5, 0.9, 1.0), fractions);
		assertThat(threads, everyItem(startsWith(OWNER_THREAD)));
	}

	@Test
	void deriveIntermediate_completesOnOwner() throws Exception {
		load(TITLES);
		CountDownLatch ownerBusy = new CountDownLatch(1);
		owner.execute(() -> awaitQuietly(ownerBusy));
		CompletableFuture<String> completionThread = worker.deriveIntermediate("title", false, NONE)
			.thenApply(p -> Thread.currentThread().getName());
		ownerBusy.countDown();
		assertEquals(OWNER_THREAD, completionThread.get(10, SECONDS));
	}

	@Test
	void blankFilter_noSessionNeeded() throws Exception {
		IntermediateProduct product = worker.deriveIntermediate("", false, NONE).get(10, SECONDS);
		assertEquals(0, product.count());
	}

	@Test
	void notLoaded_failsFuture() {
		ExecutionException e = assertThrows(ExecutionException.class, () -> worker.deriveIntermediate("x", false, NONE).get(10, SECONDS));
		assertInstanceOf(NotLoadedException.class, e.getCause());
	}

	@Test
	void deriveFinalProduct_progressBands() throws Exception {
		load(TestDocuments.generate(3, 2).toString());
		List<Double> fractions = new CopyOnWriteArrayList<>();
		Products products = worker.deriveFinalProduct("name", true, (fraction, phase) -> fractions.add(fraction)).get(10, SECONDS);
		assertEquals(20, products.intermediate().count());
		assertEquals(20, products.finalProduct().size());
		assertEquals("item_10", products.finalProduct().entries().get("10"));

		assertEquals(1.0, fractions.get(fractions.size() - 1));
		assertThat(fractions, everyItem(greaterThanOrEqualTo(0.0)));
		assertThat(fractions, everyItem(lessThanOrEqualTo(1.0)));
		for (int i = 1; i < fractions.size(); i++) {
			assertTrue(fractions.get(i - 1) <= fractions.get(i), "Progress must not go backward: " + fractions);
		}
	}

	@Test
	void project() throws Exception {
		String text = worker.codec().write(ProjectionTransformTest.productWith(2));
		FinalProduct product = worker.project(text, NONE).get(10, SECONDS);
		assertThat(product.entries().values(), contains("value 0", "value 1"));
	}

	@Test
	void applyCorrections_installsResult() throws Exception {
		load(TITLES);
		IntermediateProduct intermediate = worker.deriveIntermediate("title", false, NONE).get(10, SECONDS);
		CorrectionsApplier.Result result = worker.applyCorrections("{\"1\": \"B\"}", intermediate, null, NONE).get(10, SECONDS);
		assertEquals(1, result.modified());
		assertEquals(0, result.skipped());
		assertEquals("\"B\"", session.extract("$.items[1].title"));
	}

	@Test
	void applyCorrections_secondCallFailsFast() throws Exception {
		load(TITLES);
		IntermediateProduct intermediate = worker.deriveIntermediate("title", false, NONE).get(10, SECONDS);
		CountDownLatch ownerBusy = new CountDownLatch(1);
		owner.execute(() -> awaitQuietly(ownerBusy));

		CompletableFuture<CorrectionsApplier.Result> first = worker.applyCorrections("{\"0\": \"A\"}", intermediate, null, NONE);
		assertThrows(MutationInProgressException.class, () -> worker.applyCorrections("{\"2\": \"C\"}", intermediate, null, NONE));
		ownerBusy.countDown();
		assertEquals(1, first.get(10, SECONDS).modified());

		worker.applyCorrections("{\"2\": \"C\"}", intermediate, null, NONE).get(10, SECONDS);
		assertEquals("\"A\"", session.extract("$.items[0].title"));
		assertEquals("\"C\"", session.extract("$.items[2].title"));
	}

	@Test
	void applyCorrections_blocksSessionChangesUntilInstalled() throws Exception {
		load("""
			{"items": [{"title": "a"}, {"title": "b"}], "other": "orig"}
			""");
		IntermediateProduct intermediate = worker.deriveIntermediate("title", false, NONE).get(10, SECONDS);
		CountDownLatch ownerBusy = new CountDownLatch(1);
		owner.execute(() -> awaitQuietly(ownerBusy));

		CompletableFuture<CorrectionsApplier.Result> pending = worker.applyCorrections("{\"0\": \"A\"}", intermediate, null, NONE);
		assertThrows(MutationInProgressException.class, () -> session.mutate("$.other", "EDITED"));
		assertThrows(MutationInProgressException.class, () -> session.load("{}"));
		assertThrows(MutationInProgressException.class, () -> session.install(session.snapshot().document()));
		ownerBusy.countDown();
		assertEquals(1, pending.get(10, SECONDS).modified());

		session.mutate("$.other", "EDITED");
		assertEquals("\"EDITED\"", session.extract("$.other"));
		assertEquals("\"A\"", session.extract("$.items[0].title"));
	}

	@Test
	void applyCorrections_busySession_failsFast() throws Exception {
		load(TITLES);
		IntermediateProduct intermediate = worker.deriveIntermediate("title", false, NONE).get(10, SECONDS);
		try (Session.PendingChange __ = session.beginChange("test change")) {
			assertThrows(MutationInProgressException.class, () -> worker.applyCorrections("{\"0\": \"A\"}", intermediate, null, NONE));
		}
		worker.applyCorrections("{\"0\": \"A\"}", intermediate, null, NONE).get(10, SECONDS);
		assertEquals("\"A\"", session.extract("$.items[0].title"));
	}

	@Test
	void applyCorrections_failureReleasesGuard() throws Exception {
		load(TITLES);
		IntermediateProduct intermediate = worker.deriveIntermediate("title", false, NONE).get(10, SECONDS);
		ExecutionException e = assertThrows(ExecutionException.class,
			() -> worker.applyCorrections("[1]", intermediate, null, NONE).get(10, SECONDS));
		assertInstanceOf(ParseFailureException.class, e.getCause());
		assertEquals("\"a\"", session.extract("$.items[0].title"));

		worker.applyCorrections("{\"0\": \"A\"}", intermediate, null, NONE).get(10, SECONDS);
		assertEquals("\"A\"", session.extract("$.items[0].title"));
	}

	@Test
	void failingListener_doesNotAffectResult() throws Exception {
		load(TITLES);
		ProgressListener broken = (fraction, phase) -> {
			throw new IllegalStateException("Listener is broken");
		};
		assertEquals(3, worker.deriveIntermediate("title", false, broken).get(10, SECONDS).count());
	}

	@Test
	void ownerGone_resultStillDelivered() throws Exception {
		load(TITLES);
		owner.shutdown();
		List<Double> fractions = new CopyOnWriteArrayList<>();
		IntermediateProduct product = worker.deriveIntermediate("title", false, (fraction, phase) -> fractions.add(fraction)).get(10, SECONDS);
		assertEquals(3, product.count());
		assertTrue(fractions.isEmpty());
	}

	private static void awaitQuietly(CountDownLatch latch) {
		try {
			latch.await(10, SECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
