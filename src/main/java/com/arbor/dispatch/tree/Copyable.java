package com.arbor.dispatch.tree;

/** A structure that can produce a copy of itself for {@link CowCell} to mutate. */
public interface Copyable<T> {
	T copy();
}
