package com.arbor.dispatch.receivers;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default sink: logs each uncaught failure with its stack trace and completes immediately. */
public class LoggingUncaughtErrorSink implements UncaughtErrorSink {

	private static final Logger log = LoggerFactory.getLogger(LoggingUncaughtErrorSink.class);

	private final UncaughtLogLevel level;

	public LoggingUncaughtErrorSink() {
		this(UncaughtLogLevel.ERROR);
	}

	public LoggingUncaughtErrorSink(UncaughtLogLevel level) {
		this.level = (level != null ? level : UncaughtLogLevel.ERROR);
	}

	public UncaughtLogLevel level() {
		return level;
	}

	@Override
	public CompletionStage<Void> onUncaught(Throwable error) {
		switch (level) {
			case ERROR -> log.error("Uncaught dispatch failure: {}", error.toString(), error);
			case WARN -> log.warn("Uncaught dispatch failure: {}", error.toString(), error);
			case INFO -> log.info("Uncaught dispatch failure: {}", error.toString(), error);
			case DEBUG -> log.debug("Uncaught dispatch failure: {}", error.toString(), error);
			case NONE -> { }
		}
		return CompletableFuture.completedFuture(null);
	}
}
