package com.arbor.dispatch.receivers;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.trace.Span;
import com.arbor.dispatch.model.ErrorStack;
import com.arbor.dispatch.processor.DispatchTracing;
import com.arbor.dispatch.processor.TreeDispatcher;
import com.arbor.dispatch.tree.DispatchNode;
import com.arbor.dispatch.utils.DispatchId;
import com.arbor.dispatch.utils.Stages;

/**
 * Entry point for applications: owns one dispatch tree and an optional sink for failures no CATCH edge retracted.
 *
 * <p>The tree is read concurrently by every in-flight publish. Extending it while a publish is running is not
 * supported; register paths before publishing or synchronize externally.
 */
public class EventDispatchBus {

	private static final Logger log = LoggerFactory.getLogger(EventDispatchBus.class);

	private final DispatchNode tree;
	private final UncaughtErrorSink onUncaught; // null = discard
	private final TreeDispatcher dispatcher;
	private final DispatchTracing tracing;

	public EventDispatchBus(DispatchNode tree) {
		this(tree, null);
	}

	public EventDispatchBus(DispatchNode tree, UncaughtErrorSink onUncaught) {
		this(tree, onUncaught, new TreeDispatcher(), DispatchTracing.noop());
	}

	public EventDispatchBus(
		DispatchNode tree, UncaughtErrorSink onUncaught, TreeDispatcher dispatcher, DispatchTracing tracing) {
		this.tree = Objects.requireNonNull(tree, "tree");
		this.onUncaught = onUncaught;
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
		this.tracing = Objects.requireNonNull(tracing, "tracing");
	}

	public DispatchNode tree() {
		return tree;
	}

	/**
	 * Runs the tree for {@code event}, then hands every error left on the stack to the sink, most recent first.
	 *
	 * <p>The future completes once the sink has been called for all of them. If the sink fails, the future completes
	 * exceptionally with that failure and the remaining errors are not delivered.
	 */
	public CompletableFuture<Void> publish(Object event) {
		final DispatchId dispatchId = DispatchId.next();
		final ErrorStack caught = new ErrorStack();
		final Span span = tracing.start(dispatchId, event);

		log.debug("BUS: publish id={} eventType={}", dispatchId, event == null ? "null" : event.getClass().getName());

		CompletableFuture<Void> done = dispatcher.dispatch(dispatchId, tree, event, caught)
			.thenCompose(v -> deliverUncaught(dispatchId, caught.snapshot()));

		return done.whenComplete((v, t) -> {
			int remaining = caught.size();
			log.debug("BUS: publish id={} finished uncaught={}", dispatchId, remaining);
			tracing.finish(span, remaining, t == null ? null : Stages.unwrap(t));
		});
	}

	/** Blocking form of {@link #publish(Object)}; sink failures are rethrown. */
	public void publishAndWait(Object event) {
		try {
			publish(event).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new DispatchException("Interrupted while waiting for dispatch", e);
		} catch (ExecutionException e) {
			Throwable cause = Stages.unwrap(e);
			if (cause instanceof RuntimeException re) throw re;
			if (cause instanceof Error err) throw err;
			throw new DispatchException("Uncaught error sink failed", cause);
		}
	}

	private CompletableFuture<Void> deliverUncaught(DispatchId dispatchId, List<Throwable> errors) {
		if (errors.isEmpty()) return CompletableFuture.completedFuture(null);
		if (onUncaught == null) {
			log.debug("BUS: publish id={} discarding {} uncaught error(s), no sink configured", dispatchId, errors.size());
			return CompletableFuture.completedFuture(null);
		}
		CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
		for (int i = errors.size() - 1; i >= 0; i--) {
			final Throwable error = errors.get(i);
			chain = chain.thenCompose(v -> invokeSink(error));
		}
		return chain;
	}

	private CompletableFuture<Void> invokeSink(Throwable error) {
		final CompletionStage<Void> stage;
		try {
			stage = onUncaught.onUncaught(error);
		} catch (Throwable t) {
			return CompletableFuture.failedFuture(t);
		}
		return (stage == null) ? CompletableFuture.completedFuture(null) : Stages.adapt(stage);
	}
}
