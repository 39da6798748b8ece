package com.arbor.dispatch.tree;

import java.util.ArrayList;
import java.util.List;

import com.arbor.dispatch.filter.Filter;

/**
 * Fluent accumulation of a dispatch path.
 *
 * <pre>{@code
 * DispatchNode tree = PathBuilder.path()
 *     .and(Filters.typeIs(String.class))
 *     .or(Filters.typeIs(Integer.class))
 *     .and(Filters.handler(ctx -> log.info("got {}", ctx.event())))
 *     .end(new DispatchNode());
 * }</pre>
 *
 * <p>A builder only records steps; nothing touches a tree until {@link #end(DispatchNode)}. The same builder can be
 * ended on several trees.
 */
public final class PathBuilder {

	private final List<PathStep> steps = new ArrayList<>();

	public static PathBuilder path() {
		return new PathBuilder();
	}

	public PathBuilder step(Combinator combinator, Filter filter) {
		steps.add(new PathStep(combinator, filter));
		return this;
	}

	/** Adds a step that attaches {@code subtree} (shared) if the edge does not exist yet. */
	public PathBuilder step(Combinator combinator, Filter filter, DispatchNode subtree) {
		steps.add(new PathStep(combinator, filter, subtree));
		return this;
	}

	public PathBuilder and(Filter filter) {
		return step(Combinator.AND, filter);
	}

	public PathBuilder or(Filter filter) {
		return step(Combinator.OR, filter);
	}

	public PathBuilder onError(Filter filter) {
		return step(Combinator.CATCH, filter);
	}

	public List<PathStep> steps() {
		return List.copyOf(steps);
	}

	/** Extends {@code tree} with the recorded path and returns it. */
	public DispatchNode end(DispatchNode tree) {
		return tree.extend(steps());
	}

	/** Extends a new empty root with the recorded path. */
	public DispatchNode build() {
		return end(new DispatchNode());
	}
}
