package com.arbor.dispatch.receivers;

/** Wraps a checked failure surfaced by {@link EventDispatchBus#publishAndWait(Object)}. */
public class DispatchException extends RuntimeException {
	public DispatchException(String message, Throwable cause) {
		super(message, cause);
	}
}
