package com.arbor.dispatch.filter;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/**
 * Delegates to a user function with the full {@link Outcome} contract. Equality is that of the function reference, so
 * registering the same function object twice on one node lands on the same edge.
 */
public record FunctionFilter(FilterFunction function) implements Filter {

	public FunctionFilter {
		Objects.requireNonNull(function, "function");
	}

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		try {
			return function.apply(context);
		} catch (Exception e) {
			return CompletableFuture.failedFuture(e);
		}
	}
}
