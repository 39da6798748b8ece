package com.arbor.dispatch.filter;

import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/**
 * Unit of computation on a dispatch path.
 *
 * <p>A filter looks at the current {@link DispatchContext} and decides whether the path continues (optionally adding
 * entries to the context), stops here ({@link Outcome#noMatch()}) or fails. The returned stage may complete later, e.g.
 * after I/O; sibling branches are not held up while it is pending.
 *
 * <p>Filters are keys of the dispatch tree's edge maps, so implementations must define {@code equals} and
 * {@code hashCode} from their constructor arguments (records do this for free). Two equal filters must behave the same
 * for the same context: the tree collapses equal filters declared on the same node into one edge.
 *
 * <p>Throwing from {@link #evaluate}, returning a stage that completes exceptionally and returning
 * {@link Outcome#failure(Throwable)} are all treated identically by the engine.
 */
public interface Filter {

	CompletionStage<Outcome> evaluate(DispatchContext context);
}
