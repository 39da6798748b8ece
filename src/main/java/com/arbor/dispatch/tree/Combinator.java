package com.arbor.dispatch.tree;

/** Edge kind: how a child is reached relative to the outcome of its parent's filter. */
public enum Combinator {
	/** Reached when the parent's filter continues; sees the merged context. */
	AND,
	/** Reached when the parent's filter does not match; its own edge filter is evaluated instead. */
	OR,
	/** Reached when the parent's filter fails; sees the context with {@code error} set. */
	CATCH
}
