package com.arbor.dispatch.filter;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/** Continues when the event is an instance of {@code targetType}. */
public record TypeFilter(Class<?> targetType) implements Filter {

	public TypeFilter {
		Objects.requireNonNull(targetType, "targetType");
	}

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		return targetType.isInstance(context.event()) ? Outcome.proceeding() : Outcome.noMatching();
	}

	@Override
	public String toString() {
		return "TypeFilter[" + targetType.getSimpleName() + "]";
	}
}
