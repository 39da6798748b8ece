package com.arbor.dispatch.receivers;

import java.util.concurrent.CompletionStage;

/**
 * Receives failures still on the error stack once a publish has walked the whole tree, most recent first. Each call is
 * awaited before the next one starts.
 */
@FunctionalInterface
public interface UncaughtErrorSink {
	CompletionStage<Void> onUncaught(Throwable error);
}
