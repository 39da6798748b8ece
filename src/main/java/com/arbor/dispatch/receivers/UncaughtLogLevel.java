package com.arbor.dispatch.receivers;

/** Level at which {@link LoggingUncaughtErrorSink} reports, independent of the logging backend. */
public enum UncaughtLogLevel {
	NONE,
	ERROR,
	WARN,
	INFO,
	DEBUG
}
