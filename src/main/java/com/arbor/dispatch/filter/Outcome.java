package com.arbor.dispatch.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.arbor.dispatch.model.DispatchContext;

/** Result of a single {@link Filter} evaluation. */
public final class Outcome {

	public enum Kind {
		CONTINUE,
		NO_MATCH,
		FAILURE
	}

	private static final Outcome EMPTY_CONTINUE = new Outcome(Kind.CONTINUE, Map.of(), null);
	private static final Outcome NO_MATCH = new Outcome(Kind.NO_MATCH, Map.of(), null);

	private final Kind kind;
	private final Map<String, Object> delta;
	private final Throwable error;

	private Outcome(Kind kind, Map<String, Object> delta, Throwable error) {
		this.kind = kind;
		this.delta = delta;
		this.error = error;
	}

	/** Continue without contributing anything to the context. */
	public static Outcome proceed() {
		return EMPTY_CONTINUE;
	}

	/**
	 * Continue and merge {@code delta} into the context seen by the children (delta keys win on conflict).
	 *
	 * @throws ReservedContextKeyException if the delta tries to set {@code event} or {@code error}
	 */
	public static Outcome proceed(Map<String, ?> delta) {
		if (delta == null || delta.isEmpty()) return EMPTY_CONTINUE;
		for (String key : delta.keySet()) {
			if (DispatchContext.isReserved(key)) {
				throw new ReservedContextKeyException(key);
			}
		}
		return new Outcome(Kind.CONTINUE, Collections.unmodifiableMap(new LinkedHashMap<>(delta)), null);
	}

	public static Outcome noMatch() {
		return NO_MATCH;
	}

	public static Outcome failure(Throwable error) {
		return new Outcome(Kind.FAILURE, Map.of(), Objects.requireNonNull(error, "error"));
	}

	/* ---- stage helpers for synchronous filters ---- */

	public static CompletableFuture<Outcome> proceeding() {
		return CompletableFuture.completedFuture(EMPTY_CONTINUE);
	}

	public static CompletableFuture<Outcome> proceeding(Map<String, ?> delta) {
		return CompletableFuture.completedFuture(proceed(delta));
	}

	public static CompletableFuture<Outcome> noMatching() {
		return CompletableFuture.completedFuture(NO_MATCH);
	}

	public Kind kind() {
		return kind;
	}

	/** Entries to merge into the context; empty unless {@link Kind#CONTINUE}. */
	public Map<String, Object> delta() {
		return delta;
	}

	/** The failure; null unless {@link Kind#FAILURE}. */
	public Throwable error() {
		return error;
	}

	public boolean isContinue() {
		return kind == Kind.CONTINUE;
	}

	public boolean isNoMatch() {
		return kind == Kind.NO_MATCH;
	}

	public boolean isFailure() {
		return kind == Kind.FAILURE;
	}

	@Override
	public String toString() {
		return switch (kind) {
			case CONTINUE -> "Continue" + delta.keySet();
			case NO_MATCH -> "NoMatch";
			case FAILURE -> "Failure(" + error + ")";
		};
	}
}
