package com.arbor.dispatch.filter;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/** Continues when the context carries an error assignable to {@code errorType}. Meant for CATCH edges. */
public record ErrorTypeFilter(Class<? extends Throwable> errorType) implements Filter {

	public ErrorTypeFilter {
		Objects.requireNonNull(errorType, "errorType");
	}

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		return errorType.isInstance(context.error()) ? Outcome.proceeding() : Outcome.noMatching();
	}

	@Override
	public String toString() {
		return "ErrorTypeFilter[" + errorType.getSimpleName() + "]";
	}
}
