package com.arbor.dispatch.filter;

import java.util.function.Consumer;
import java.util.function.Predicate;

import com.arbor.dispatch.model.DispatchContext;

/** Static factories for the builtin filters. */
public final class Filters {

	public static Filter unit() {
		return UnitFilter.INSTANCE;
	}

	public static Filter typeIs(Class<?> type) {
		return new TypeFilter(type);
	}

	public static Filter function(FilterFunction function) {
		return new FunctionFilter(function);
	}

	public static Filter predicate(Predicate<DispatchContext> predicate) {
		return new PredicateFilter(predicate);
	}

	public static Filter reRaise() {
		return RaiseFilter.INSTANCE;
	}

	public static Filter handler(Consumer<DispatchContext> handler) {
		return new HandlerFilter(handler);
	}

	public static Filter errorIs(Class<? extends Throwable> errorType) {
		return new ErrorTypeFilter(errorType);
	}

	private Filters() {}
}
