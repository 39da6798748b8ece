package com.arbor.dispatch.processor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.arbor.dispatch.filter.Filter;
import com.arbor.dispatch.filter.Outcome;
import com.arbor.dispatch.filter.UnitFilter;
import com.arbor.dispatch.model.DispatchContext;
import com.arbor.dispatch.model.ErrorStack;
import com.arbor.dispatch.tree.Combinator;
import com.arbor.dispatch.tree.CowCell;
import com.arbor.dispatch.tree.DispatchNode;
import com.arbor.dispatch.utils.DispatchId;
import com.arbor.dispatch.utils.Stages;

/**
 * Walks a {@link DispatchNode} tree for one event.
 *
 * <p>Rules per node, given the outcome of the filter on the edge that led into it:
 *
 * <ul>
 *   <li><b>Continue</b>: AND children are evaluated with the merged context; OR children are entered without
 *       evaluating their edge filter ({@link #runOr}).
 *   <li><b>No match</b>: only OR children are evaluated, with the unchanged context.
 *   <li><b>Failure</b>: the error is pushed on the {@link ErrorStack}; AND, OR and CATCH children all run with
 *       {@code error} in the context. If the node declares any CATCH edge, the last stack entry is popped once every
 *       CATCH branch has finished, whether or not a catch filter matched.
 * </ul>
 *
 * <p>Every sibling branch is started as its own task on the configured {@link Executor} and the parent completes when
 * all of them have. Failures never cancel siblings and never escape: the returned futures always complete normally.
 * The tree is only read here.
 */
public class TreeDispatcher {

	private static final Logger log = LoggerFactory.getLogger(TreeDispatcher.class);

	private final Executor executor;

	/** Branches run on whichever thread completes the parent's stage. */
	public TreeDispatcher() {
		this(Runnable::run);
	}

	public TreeDispatcher(Executor executor) {
		this.executor = Objects.requireNonNull(executor, "executor");
	}

	/** Runs the whole tree for {@code event} under a fresh id. */
	public CompletableFuture<Void> dispatch(DispatchNode tree, Object event, ErrorStack caught) {
		return dispatch(DispatchId.next(), tree, event, caught);
	}

	/** Runs the whole tree for {@code event}, entering the root through an always-continuing edge. */
	public CompletableFuture<Void> dispatch(DispatchId id, DispatchNode tree, Object event, ErrorStack caught) {
		log.debug("DISPATCH: id={} start eventType={}", id, event == null ? "null" : event.getClass().getName());
		return and(new Walk(id, caught), tree, UnitFilter.INSTANCE, DispatchContext.of(event));
	}

	/** Evaluates {@code edgeFilter} and descends into {@code node} according to the outcome. */
	public CompletableFuture<Void> runAnd(DispatchNode node, Filter edgeFilter, DispatchContext ctx, ErrorStack caught) {
		return and(new Walk(DispatchId.next(), caught), node, edgeFilter, ctx);
	}

	/** Enters {@code node} without evaluating anything on it; only its AND children are tried. */
	public CompletableFuture<Void> runOr(DispatchNode node, DispatchContext ctx, ErrorStack caught) {
		return or(new Walk(DispatchId.next(), caught), node, ctx);
	}

	/**
	 * Skips evaluation on AND/OR edges below {@code node} while keeping CATCH edges further down reachable. Only nested
	 * recovery chains (CATCH below CATCH) get here.
	 */
	public CompletableFuture<Void> runCatch(DispatchNode node, DispatchContext ctx, ErrorStack caught) {
		return catchOnly(new Walk(DispatchId.next(), caught), node, ctx);
	}

	/** State shared by every branch of one dispatch. */
	private record Walk(DispatchId id, ErrorStack caught) {}

	private CompletableFuture<Void> and(Walk walk, DispatchNode node, Filter edgeFilter, DispatchContext ctx) {
		return evaluate(edgeFilter, ctx).thenCompose(outcome -> {
			log.debug("DISPATCH: id={} AND filter={} outcome={} node={}", walk.id(), edgeFilter, outcome, node);
			return switch (outcome.kind()) {
				case CONTINUE -> onContinue(walk, node, ctx.merge(outcome.delta()));
				case NO_MATCH -> onNoMatch(walk, node, ctx);
				case FAILURE -> onFailure(walk, node, ctx, outcome.error());
			};
		});
	}

	private CompletableFuture<Void> or(Walk walk, DispatchNode node, DispatchContext ctx) {
		log.debug("DISPATCH: id={} OR entered without evaluation node={}", walk.id(), node);
		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(Combinator.AND).entrySet()) {
			DispatchNode child = e.getValue().view();
			tasks.add(fork(walk, () -> and(walk, child, e.getKey(), ctx)));
		}
		return joinAll(tasks);
	}

	private CompletableFuture<Void> catchOnly(Walk walk, DispatchNode node, DispatchContext ctx) {
		log.debug("DISPATCH: id={} CATCH descent node={}", walk.id(), node);
		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		for (CowCell<DispatchNode> cell : node.edges(Combinator.AND).values()) {
			tasks.add(fork(walk, () -> catchOnly(walk, cell.view(), ctx)));
		}
		for (CowCell<DispatchNode> cell : node.edges(Combinator.OR).values()) {
			tasks.add(fork(walk, () -> catchOnly(walk, cell.view(), ctx)));
		}
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(Combinator.CATCH).entrySet()) {
			DispatchNode child = e.getValue().view();
			tasks.add(fork(walk, () -> and(walk, child, e.getKey(), ctx)));
		}
		return joinAll(tasks);
	}

	// ---- outcome handling ----

	private CompletableFuture<Void> onContinue(Walk walk, DispatchNode node, DispatchContext merged) {
		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(Combinator.AND).entrySet()) {
			DispatchNode child = e.getValue().view();
			tasks.add(fork(walk, () -> and(walk, child, e.getKey(), merged)));
		}
		for (CowCell<DispatchNode> cell : node.edges(Combinator.OR).values()) {
			tasks.add(fork(walk, () -> or(walk, cell.view(), merged)));
		}
		return joinAll(tasks);
	}

	private CompletableFuture<Void> onNoMatch(Walk walk, DispatchNode node, DispatchContext ctx) {
		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(Combinator.OR).entrySet()) {
			DispatchNode child = e.getValue().view();
			tasks.add(fork(walk, () -> and(walk, child, e.getKey(), ctx)));
		}
		return joinAll(tasks);
	}

	private CompletableFuture<Void> onFailure(Walk walk, DispatchNode node, DispatchContext ctx, Throwable error) {
		walk.caught().push(error);
		DispatchContext errCtx = ctx.withError(error);

		// CATCH branches are started first so that, when branches complete inline, the pop below happens before
		// AND/OR descendants can push errors of their own.
		Map<Filter, CowCell<DispatchNode>> catches = node.edges(Combinator.CATCH);
		log.debug("DISPATCH: id={} failure {} catchEdges={}", walk.id(), error, catches.size());
		List<CompletableFuture<Void>> catchTasks = new ArrayList<>();
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : catches.entrySet()) {
			DispatchNode child = e.getValue().view();
			catchTasks.add(fork(walk, () -> {
				log.debug("DISPATCH: id={} CATCH filter={}", walk.id(), e.getKey());
				return and(walk, child, e.getKey(), errCtx);
			}));
		}
		CompletableFuture<Void> caughtJoin = joinAll(catchTasks);
		if (!catches.isEmpty()) {
			caughtJoin = caughtJoin.thenRun(() -> retract(walk, error));
		}

		List<CompletableFuture<Void>> tasks = new ArrayList<>();
		tasks.add(caughtJoin);
		for (Map.Entry<Filter, CowCell<DispatchNode>> e : node.edges(Combinator.AND).entrySet()) {
			DispatchNode child = e.getValue().view();
			tasks.add(fork(walk, () -> and(walk, child, e.getKey(), errCtx)));
		}
		for (CowCell<DispatchNode> cell : node.edges(Combinator.OR).values()) {
			tasks.add(fork(walk, () -> or(walk, cell.view(), errCtx)));
		}
		return joinAll(tasks);
	}

	private static void retract(Walk walk, Throwable handled) {
		Throwable popped = walk.caught().popLast();
		if (popped == null) {
			log.warn("DISPATCH: id={} catch edges finished for {} but the error stack was already empty",
				walk.id(), handled.toString());
		} else {
			log.debug("DISPATCH: id={} catch edges finished for {}; retracted {}", walk.id(), handled, popped);
		}
	}

	// ---- task plumbing ----

	/** Normalizes every way a filter can fail into {@link Outcome#failure}; the result never completes exceptionally. */
	private static CompletableFuture<Outcome> evaluate(Filter filter, DispatchContext ctx) {
		final CompletionStage<Outcome> stage;
		try {
			stage = filter.evaluate(ctx);
		} catch (Throwable t) {
			return CompletableFuture.completedFuture(Outcome.failure(t));
		}
		if (stage == null) {
			return CompletableFuture.completedFuture(
				Outcome.failure(new NullPointerException("Filter " + filter + " returned no stage")));
		}
		CompletableFuture<Outcome> result = new CompletableFuture<>();
		stage.whenComplete((outcome, t) -> {
			if (t != null) {
				result.complete(Outcome.failure(Stages.unwrap(t)));
			} else if (outcome == null) {
				result.complete(Outcome.failure(new NullPointerException("Filter " + filter + " completed with no outcome")));
			} else {
				result.complete(outcome);
			}
		});
		return result;
	}

	/** Starts a sibling branch as its own task. */
	private CompletableFuture<Void> fork(Walk walk, Supplier<CompletableFuture<Void>> branch) {
		CompletableFuture<Void> started;
		try {
			started = CompletableFuture.supplyAsync(branch, executor).thenCompose(f -> f);
		} catch (RejectedExecutionException e) {
			log.warn("DISPATCH: id={} executor rejected branch, running it on the current thread: {}", walk.id(), e.toString());
			started = CompletableFuture.supplyAsync(branch, Runnable::run).thenCompose(f -> f);
		}
		return started.handle((v, t) -> {
			if (t != null) {
				Throwable cause = Stages.unwrap(t);
				log.error("DISPATCH: id={} branch terminated abnormally; recording {}", walk.id(), cause.toString(), cause);
				walk.caught().push(cause);
			}
			return null;
		});
	}

	private static CompletableFuture<Void> joinAll(List<CompletableFuture<Void>> tasks) {
		if (tasks.isEmpty()) return CompletableFuture.completedFuture(null);
		if (tasks.size() == 1) return tasks.get(0);
		return CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0]));
	}
}
