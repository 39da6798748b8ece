package com.arbor.dispatch.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-dispatch record of failures not (yet) retracted by a CATCH edge.
 *
 * <p>Shared by every concurrent branch of one dispatch. Appends and pops are linearized on this instance's monitor.
 */
public final class ErrorStack {

	private final List<Throwable> errors = new ArrayList<>();

	public synchronized void push(Throwable error) {
		errors.add(Objects.requireNonNull(error, "error"));
	}

	/**
	 * Removes the most recently pushed error, whichever branch pushed it.
	 *
	 * @return the removed error, or null when the stack was already empty
	 */
	public synchronized Throwable popLast() {
		if (errors.isEmpty()) return null;
		return errors.remove(errors.size() - 1);
	}

	public synchronized boolean isEmpty() {
		return errors.isEmpty();
	}

	public synchronized int size() {
		return errors.size();
	}

	/** Copy in push order (oldest first). */
	public synchronized List<Throwable> snapshot() {
		return List.copyOf(errors);
	}

	@Override
	public synchronized String toString() {
		return "ErrorStack" + errors;
	}
}
