package com.arbor.dispatch.tree;

import java.util.Objects;

/**
 * Copy-on-write reference to a tree node.
 *
 * <p>An <em>owned</em> cell is the only holder of its value and may mutate it in place. A <em>shared</em> cell points to
 * a value that another holder may also reference; mutating through it first copies the value into a fresh owned cell.
 * Nothing enforces the owned flag at runtime: whoever hands out a value must either give up ownership or pass it on via
 * {@link #shareView()}.
 */
public final class CowCell<T extends Copyable<T>> {

	private final T value;
	private final boolean owned;

	private CowCell(T value, boolean owned) {
		this.value = Objects.requireNonNull(value, "value");
		this.owned = owned;
	}

	public static <T extends Copyable<T>> CowCell<T> owned(T value) {
		return new CowCell<>(value, true);
	}

	public static <T extends Copyable<T>> CowCell<T> shared(T value) {
		return new CowCell<>(value, false);
	}

	/** Read-only access, whatever the ownership. Callers must not mutate the returned value. */
	public T view() {
		return value;
	}

	/**
	 * Returns a cell whose value may be mutated: this cell when owned, otherwise a new owned cell around a copy. Callers
	 * must store and use the returned cell from now on.
	 */
	public CowCell<T> makeMutable() {
		return owned ? this : new CowCell<>(value.copy(), true);
	}

	/** New shared cell on the same value; used whenever the value gets a second holder. */
	public CowCell<T> shareView() {
		return new CowCell<>(value, false);
	}

	public boolean isOwned() {
		return owned;
	}

	@Override
	public String toString() {
		return (owned ? "owned:" : "shared:") + value;
	}
}
