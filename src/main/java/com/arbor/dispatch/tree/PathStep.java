package com.arbor.dispatch.tree;

import java.util.Objects;

import com.arbor.dispatch.filter.Filter;

/**
 * One edge of a dispatch path: combinator, filter, and optionally a prebuilt subtree to hang under the edge when the
 * edge does not exist yet.
 */
public record PathStep(Combinator combinator, Filter filter, DispatchNode subtree) {

	public PathStep {
		Objects.requireNonNull(combinator, "combinator");
		Objects.requireNonNull(filter, "filter");
	}

	public PathStep(Combinator combinator, Filter filter) {
		this(combinator, filter, null);
	}
}
