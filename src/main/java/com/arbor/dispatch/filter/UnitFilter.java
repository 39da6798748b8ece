package com.arbor.dispatch.filter;

import java.util.concurrent.CompletionStage;

import com.arbor.dispatch.model.DispatchContext;

/** Always continues with an empty delta. Used as the synthetic edge into the root node. */
public record UnitFilter() implements Filter {

	public static final UnitFilter INSTANCE = new UnitFilter();

	@Override
	public CompletionStage<Outcome> evaluate(DispatchContext context) {
		return Outcome.proceeding();
	}
}
