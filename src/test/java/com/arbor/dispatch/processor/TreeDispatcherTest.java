package com.arbor.dispatch.processor;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.arbor.dispatch.filter.Filter;
import com.arbor.dispatch.filter.FilterFunction;
import com.arbor.dispatch.filter.Filters;
import com.arbor.dispatch.filter.Outcome;
import com.arbor.dispatch.filter.ReservedContextKeyException;
import com.arbor.dispatch.model.DispatchContext;
import com.arbor.dispatch.model.ErrorStack;
import com.arbor.dispatch.tree.Combinator;
import com.arbor.dispatch.tree.DispatchNode;
import com.arbor.dispatch.tree.PathBuilder;
import com.arbor.dispatch.tree.PathStep;
import com.arbor.dispatch.utils.DispatchId;

class TreeDispatcherTest {

	private final TreeDispatcher dispatcher = new TreeDispatcher();

	private static Filter recordInto(List<DispatchContext> seen) {
		return Filters.handler(seen::add);
	}

	private static Filter failWith(Throwable error) {
		return Filters.function(ctx -> CompletableFuture.completedFuture(Outcome.failure(error)));
	}

	private ErrorStack run(DispatchNode tree, Object event) {
		ErrorStack caught = new ErrorStack();
		CompletableFuture<Void> done = dispatcher.dispatch(tree, event, caught);
		assertThat(done).isCompleted();
		return caught;
	}

	/* ===================== AND / OR ===================== */

	@Test
	@DisplayName("AND: a non-matching filter stops the path")
	void andShortCircuits() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(Filters.typeIs(String.class))
			.and(Filters.unit())
			.and(recordInto(seen))
			.build();

		run(tree, 42);

		assertThat(seen).isEmpty();
	}

	@Test
	@DisplayName("AND: deltas are merged into the context seen by the children")
	void andMergesDeltas() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(Filters.function(ctx -> Outcome.proceeding(Map.of("user", "alice", "n", 1))))
			.and(Filters.function(ctx -> Outcome.proceeding(Map.of("n", 2))))
			.and(recordInto(seen))
			.build();

		run(tree, "evt");

		assertThat(seen).singleElement().satisfies(ctx -> {
			assertThat(ctx.event()).isEqualTo("evt");
			assertThat(ctx.get("user")).isEqualTo("alice");
			assertThat(ctx.get("n")).isEqualTo(2);
		});
	}

	@Test
	@DisplayName("OR: reached through its own filter, with only the event, when the parent does not match")
	void orFallback() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		Filter stringsOnly = Filters.function(ctx -> ctx.event() instanceof String
			? Outcome.proceeding(Map.of("fromA", true))
			: Outcome.noMatching());
		DispatchNode tree = PathBuilder.path()
			.and(stringsOnly)
			.or(Filters.unit())
			.and(recordInto(seen))
			.build();

		run(tree, 42);

		assertThat(seen).singleElement().satisfies(ctx -> assertThat(ctx.keys()).containsExactly("event"));
	}

	@Test
	@DisplayName("OR: skipped without evaluation when the parent matches, and the parent's delta flows through")
	void orSkippedWhenParentMatches() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		AtomicInteger orEvaluations = new AtomicInteger();
		Filter stringsOnly = Filters.function(ctx -> ctx.event() instanceof String
			? Outcome.proceeding(Map.of("fromA", true))
			: Outcome.noMatching());
		Filter countingOr = Filters.predicate(ctx -> orEvaluations.incrementAndGet() > 0);
		DispatchNode tree = PathBuilder.path()
			.and(stringsOnly)
			.or(countingOr)
			.and(recordInto(seen))
			.build();

		run(tree, "x");

		assertThat(orEvaluations).hasValue(0);
		assertThat(seen).singleElement().satisfies(ctx -> assertThat(ctx.get("fromA")).isEqualTo(true));
	}

	@Test
	@DisplayName("OR alternatives chain: a match on one alternative enters the rest without evaluating them")
	void orChains() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(Filters.typeIs(String.class))
			.or(Filters.typeIs(Integer.class))
			.or(Filters.typeIs(Double.class))
			.and(recordInto(seen))
			.build();

		run(tree, 1.5d);
		run(tree, 7);
		run(tree, 'c');

		assertThat(seen).extracting(DispatchContext::event).containsExactly(1.5d, 7);
	}

	@Test
	@DisplayName("one handler per path that reaches it; no deduplication at dispatch time")
	void sharedSubtreeRunsOncePerPath() {
		AtomicInteger calls = new AtomicInteger();
		DispatchNode shared = PathBuilder.path().and(Filters.handler(ctx -> calls.incrementAndGet())).build();
		DispatchNode tree = new DispatchNode();
		tree.extend(new PathStep(Combinator.AND, Filters.typeIs(String.class), shared));
		tree.extend(new PathStep(Combinator.AND, Filters.typeIs(CharSequence.class), shared));

		run(tree, "x");

		assertThat(calls).hasValue(2);
	}

	/* ===================== failures ===================== */

	static Stream<Arguments> failingFilters() {
		IllegalStateException boom = new IllegalStateException("boom");
		return Stream.of(
			Arguments.of("outcome", boom, (FilterFunction) ctx -> CompletableFuture.completedFuture(Outcome.failure(boom))),
			Arguments.of("thrown", boom, (FilterFunction) ctx -> {
				throw boom;
			}),
			Arguments.of("failed stage", boom, (FilterFunction) ctx -> CompletableFuture.failedFuture(boom)),
			Arguments.of("async failure", boom, (FilterFunction) ctx -> CompletableFuture.supplyAsync(() -> {
				throw boom;
			})));
	}

	@ParameterizedTest(name = "{0}")
	@MethodSource("failingFilters")
	@DisplayName("every way of failing is recorded the same way, unwrapped")
	void failuresAreRecorded(String kind, Throwable expected, FilterFunction fn) {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path().and(Filters.function(fn)).and(recordInto(seen)).build();

		ErrorStack caught = new ErrorStack();
		dispatcher.dispatch(tree, "x", caught).join();

		assertThat(caught.snapshot()).containsExactly(expected);
		assertThat(seen).singleElement().satisfies(ctx -> assertThat(ctx.error()).isSameAs(expected));
	}

	@Test
	void nullStageIsAFailure() {
		DispatchNode tree = PathBuilder.path().and(Filters.function(ctx -> null)).build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.snapshot()).singleElement().isInstanceOf(NullPointerException.class);
	}

	@Test
	void reservedKeyInDeltaIsAFailure() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(Filters.function(ctx -> Outcome.proceeding(Map.of("event", "forged"))))
			.and(recordInto(seen))
			.build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.snapshot()).singleElement()
			.isInstanceOf(ReservedContextKeyException.class);
		assertThat(seen).singleElement().satisfies(ctx -> assertThat(ctx.event()).isEqualTo("x"));
	}

	@Test
	@DisplayName("failure: AND, OR and CATCH children all see the error")
	void failureFansOutToAllChildren() {
		IllegalStateException boom = new IllegalStateException("boom");
		List<DispatchContext> viaAnd = new CopyOnWriteArrayList<>();
		List<DispatchContext> viaOr = new CopyOnWriteArrayList<>();
		List<DispatchContext> viaCatch = new CopyOnWriteArrayList<>();
		Filter failing = failWith(boom);
		DispatchNode tree = new DispatchNode();
		PathBuilder.path().and(failing).and(recordInto(viaAnd)).end(tree);
		// OR child is entered without evaluation, so the handler sits one AND below it
		PathBuilder.path().and(failing).or(Filters.typeIs(Integer.class)).and(recordInto(viaOr)).end(tree);
		PathBuilder.path().and(failing).onError(Filters.unit()).and(recordInto(viaCatch)).end(tree);

		run(tree, "x");

		assertThat(viaAnd).singleElement().satisfies(ctx -> assertThat(ctx.error()).isSameAs(boom));
		assertThat(viaOr).singleElement().satisfies(ctx -> assertThat(ctx.error()).isSameAs(boom));
		assertThat(viaCatch).singleElement().satisfies(ctx -> assertThat(ctx.error()).isSameAs(boom));
	}

	@Test
	@DisplayName("a matching CATCH edge retracts the error")
	void matchingCatchRetracts() {
		IllegalStateException boom = new IllegalStateException("boom");
		List<DispatchContext> handled = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(failWith(boom))
			.onError(Filters.errorIs(IllegalStateException.class))
			.and(recordInto(handled))
			.build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.isEmpty()).isTrue();
		assertThat(handled).singleElement().satisfies(ctx -> assertThat(ctx.error()).isSameAs(boom));
	}

	@Test
	@DisplayName("a CATCH edge retracts the error by its presence, even when its filter rejects it")
	void catchRetractsByPresence() {
		List<DispatchContext> handled = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path()
			.and(failWith(new IllegalArgumentException("other kind")))
			.onError(Filters.errorIs(IllegalStateException.class))
			.and(recordInto(handled))
			.build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.isEmpty()).isTrue();
		assertThat(handled).isEmpty();
	}

	@Test
	@DisplayName("several CATCH edges on one node pop a single entry")
	void severalCatchEdgesPopOnce() {
		IllegalStateException boom = new IllegalStateException("boom");
		IllegalStateException earlier = new IllegalStateException("earlier");
		Filter failing = failWith(boom);
		DispatchNode tree = new DispatchNode();
		PathBuilder.path().and(failWith(earlier)).end(tree);
		PathBuilder.path().and(failing).onError(Filters.errorIs(IllegalStateException.class)).end(tree);
		PathBuilder.path().and(failing).onError(Filters.errorIs(RuntimeException.class)).end(tree);

		assertThat(tree.edges(Combinator.AND)).hasSize(2);

		ErrorStack caught = run(tree, "x");

		assertThat(caught.snapshot()).containsExactly(earlier);
	}

	@Test
	@DisplayName("a CATCH branch that re-raises loses its own entry and the original stays")
	void reRaiseInsideCatchKeepsOriginal() {
		IllegalStateException boom = new IllegalStateException("boom");
		DispatchNode tree = PathBuilder.path()
			.and(failWith(boom))
			.onError(Filters.errorIs(IllegalArgumentException.class))
			.or(Filters.reRaise())
			.build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.snapshot()).containsExactly(boom);
	}

	@Test
	@DisplayName("a node without CATCH edges leaves the error on the stack")
	void uncaughtStays() {
		IllegalStateException boom = new IllegalStateException("boom");
		DispatchNode tree = PathBuilder.path().and(failWith(boom)).and(Filters.unit()).build();

		ErrorStack caught = run(tree, "x");

		assertThat(caught.snapshot()).containsExactly(boom);
	}

	/* ===================== runCatch ===================== */

	@Test
	@DisplayName("runCatch skips AND/OR evaluation but still reaches CATCH edges further down")
	void runCatchReachesNestedCatchEdges() {
		AtomicInteger andEvaluations = new AtomicInteger();
		List<DispatchContext> handled = new CopyOnWriteArrayList<>();
		Filter countingAnd = Filters.predicate(ctx -> andEvaluations.incrementAndGet() > 0);
		DispatchNode tree = new DispatchNode();
		PathBuilder.path().and(countingAnd).onError(Filters.handler(handled::add)).end(tree);
		PathBuilder.path().or(Filters.typeIs(String.class)).onError(Filters.handler(handled::add)).end(tree);

		IllegalStateException boom = new IllegalStateException();
		ErrorStack caught = new ErrorStack();
		dispatcher.runCatch(tree, DispatchContext.of("x").withError(boom), caught).join();

		assertThat(andEvaluations).hasValue(0);
		assertThat(handled).hasSize(2).allSatisfy(ctx -> assertThat(ctx.error()).isSameAs(boom));
		assertThat(caught.isEmpty()).isTrue();
	}

	@Test
	void runOrOnlyTriesAndChildren() {
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = new DispatchNode();
		PathBuilder.path().and(recordInto(seen)).end(tree);
		PathBuilder.path().or(recordInto(seen)).end(tree);
		PathBuilder.path().onError(recordInto(seen)).end(tree);

		dispatcher.runOr(tree, DispatchContext.of("x"), new ErrorStack()).join();

		assertThat(seen).hasSize(1);
	}

	/* ===================== concurrency ===================== */

	@Test
	@DisplayName("a pending filter does not hold up its siblings")
	void pendingFilterDoesNotBlockSiblings() {
		CompletableFuture<Outcome> gate = new CompletableFuture<>();
		List<String> order = new CopyOnWriteArrayList<>();
		DispatchNode tree = new DispatchNode();
		PathBuilder.path().and(Filters.function(ctx -> gate)).and(Filters.handler(ctx -> order.add("slow"))).end(tree);
		PathBuilder.path().and(Filters.typeIs(String.class)).and(Filters.handler(ctx -> order.add("fast"))).end(tree);

		CompletableFuture<Void> done = dispatcher.dispatch(tree, "x", new ErrorStack());

		assertThat(order).containsExactly("fast");
		assertThat(done).isNotDone();

		gate.complete(Outcome.proceed());

		assertThat(done).isCompleted();
		assertThat(order).containsExactly("fast", "slow");
	}

	@Test
	@DisplayName("siblings run as concurrent tasks on the executor")
	void siblingsRunConcurrently() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			TreeDispatcher concurrent = new TreeDispatcher(pool);
			CyclicBarrier barrier = new CyclicBarrier(3);
			List<Object> reached = new CopyOnWriteArrayList<>();
			DispatchNode tree = new DispatchNode();
			for (int i = 0; i < 3; i++) {
				PathBuilder.path()
					.and(new BarrierFilter(i, barrier))
					.and(Filters.handler(ctx -> reached.add(ctx.event())))
					.end(tree);
			}

			ErrorStack caught = new ErrorStack();
			concurrent.dispatch(tree, "x", caught).get(10, TimeUnit.SECONDS);

			assertThat(caught.snapshot()).isEmpty();
			assertThat(reached).hasSize(3);
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	@DisplayName("concurrent failures are all recorded and none cancels its siblings")
	void concurrentFailuresAreAllRecorded() throws Exception {
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			TreeDispatcher concurrent = new TreeDispatcher(pool);
			List<Throwable> expected = new ArrayList<>();
			DispatchNode tree = new DispatchNode();
			for (int i = 0; i < 50; i++) {
				IllegalStateException e = new IllegalStateException("e" + i);
				expected.add(e);
				PathBuilder.path().and(Filters.function(ctx -> CompletableFuture.supplyAsync(() -> {
					throw e;
				}, pool))).end(tree);
			}

			ErrorStack caught = new ErrorStack();
			concurrent.dispatch(tree, "x", caught).get(10, TimeUnit.SECONDS);

			assertThat(caught.snapshot()).containsExactlyInAnyOrderElementsOf(expected);
		} finally {
			pool.shutdownNow();
		}
	}

	@Test
	@DisplayName("a rejecting executor falls back to running the branch inline")
	void rejectedBranchesRunInline() {
		ExecutorService pool = Executors.newSingleThreadExecutor();
		pool.shutdown();
		List<DispatchContext> seen = new CopyOnWriteArrayList<>();
		DispatchNode tree = PathBuilder.path().and(Filters.unit()).and(recordInto(seen)).build();

		new TreeDispatcher(pool).dispatch(tree, "x", new ErrorStack()).join();

		assertThat(seen).hasSize(1);
	}

	/* ===================== logging ===================== */

	@Test
	@DisplayName("every DISPATCH line carries the dispatch id and the combinator being walked")
	void debugLinesCarryIdAndCombinator() {
		Logger logger = (Logger) LoggerFactory.getLogger(TreeDispatcher.class);
		Level previous = logger.getLevel();
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		logger.setLevel(Level.DEBUG);
		try {
			DispatchNode tree = new DispatchNode();
			PathBuilder.path().and(Filters.typeIs(String.class)).or(Filters.unit()).and(Filters.unit()).end(tree);
			PathBuilder.path().and(failWith(new IllegalStateException("boom"))).onError(Filters.unit()).end(tree);
			DispatchId id = DispatchId.next();

			dispatcher.dispatch(id, tree, "x", new ErrorStack()).join();

			List<String> lines = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
			assertThat(lines).isNotEmpty().allSatisfy(line -> assertThat(line).startsWith("DISPATCH: id=" + id + " "));
			assertThat(lines).anySatisfy(line -> assertThat(line).contains(" AND filter="));
			assertThat(lines).anySatisfy(line -> assertThat(line).contains(" OR entered"));
			assertThat(lines).anySatisfy(line -> assertThat(line).contains(" CATCH filter="));
		} finally {
			logger.detachAppender(appender);
			logger.setLevel(previous);
		}
	}

	/** Blocks until every branch holding the same barrier has reached it. */
	private record BarrierFilter(int branch, CyclicBarrier barrier) implements Filter {
		@Override
		public CompletionStage<Outcome> evaluate(DispatchContext context) {
			try {
				barrier.await(5, TimeUnit.SECONDS);
			} catch (Exception e) {
				return CompletableFuture.failedFuture(e);
			}
			return Outcome.proceeding();
		}
	}
}
