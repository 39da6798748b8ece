package com.arbor.dispatch.filter;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

import com.arbor.dispatch.model.DispatchContext;

/**
 * Terminal step of a path: runs the handler for its side effect and yields no match, so the path ends here (any
 * OR-children of the handler's node still get their chance).
 */
public record HandlerFilter(Consumer<DispatchContext> handler) implements Filter {

	public HandlerFilter {
		Objects.requireNonNull(handler, "handler");
	}

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		handler.accept(context);
		return Outcome.noMatching();
	}
}
