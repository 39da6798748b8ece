package com.arbor.dispatch.filter;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

import com.arbor.dispatch.model.DispatchContext;

/** Continues when a synchronous predicate over the context holds. */
public record PredicateFilter(Predicate<DispatchContext> predicate) implements Filter {

	public PredicateFilter {
		Objects.requireNonNull(predicate, "predicate");
	}

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		return predicate.test(context) ? Outcome.proceeding() : Outcome.noMatching();
	}
}
