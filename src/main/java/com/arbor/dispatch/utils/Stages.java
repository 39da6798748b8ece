package com.arbor.dispatch.utils;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

/** Small helpers around {@link CompletionStage}s handed to us by user code. */
public final class Stages {

	/**
	 * Mirrors {@code stage} into a {@link CompletableFuture} without relying on {@code toCompletableFuture()}, which
	 * minimal stages do not support.
	 */
	public static <T> CompletableFuture<T> adapt(CompletionStage<T> stage) {
		CompletableFuture<T> f = new CompletableFuture<>();
		stage.whenComplete((v, t) -> {
			if (t != null) f.completeExceptionally(unwrap(t));
			else f.complete(v);
		});
		return f;
	}

	/** Strips {@link CompletionException}/{@link ExecutionException} wrappers. */
	public static Throwable unwrap(Throwable t) {
		Throwable cur = t;
		while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
			cur = cur.getCause();
		}
		return cur;
	}

	private Stages() {}
}
