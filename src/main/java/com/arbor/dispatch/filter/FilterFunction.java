package com.arbor.dispatch.filter;

import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/** User-supplied asynchronous evaluation, wrapped by {@link FunctionFilter}. */
@FunctionalInterface
public interface FilterFunction {
	CompletionStage<Outcome> apply(DispatchContext context) throws Exception;
}
