package com.arbor.dispatch.filter;

/** Thrown when a filter tries to contribute one of the engine-owned context keys. */
public final class ReservedContextKeyException extends IllegalArgumentException {

	private final String key;

	public ReservedContextKeyException(String key) {
		super("Context key '" + key + "' is reserved and cannot be set by a filter");
		this.key = key;
	}

	public String key() {
		return key;
	}
}
