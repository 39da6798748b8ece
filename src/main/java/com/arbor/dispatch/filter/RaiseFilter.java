package com.arbor.dispatch.filter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/** Re-raises the error carried by the context, if any; otherwise no match. */
public record RaiseFilter() implements Filter {

	public static final RaiseFilter INSTANCE = new RaiseFilter();

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		Throwable error = context.error();
		if (error != null) {
			return CompletableFuture.completedFuture(Outcome.failure(error));
		}
		return Outcome.noMatching();
	}
}
