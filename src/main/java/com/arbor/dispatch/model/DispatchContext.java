package com.arbor.dispatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mapping threaded along a dispatch path.
 *
 * <ul>
 *   <li>{@value #EVENT_KEY}: the published payload, set once when the dispatch starts.
 *   <li>{@value #ERROR_KEY}: the failure being propagated, present only below a failed filter.
 * </ul>
 *
 * <p>Instances are immutable. Every merge produces a new context, so siblings never see each other's contributions and
 * a filter cannot leak changes back to its caller. {@link #asMap()} hands out a private mutable copy for filters that
 * want to work on a plain map.
 */
public final class DispatchContext {

	public static final String EVENT_KEY = "event";
	public static final String ERROR_KEY = "error";

	private final Map<String, Object> values;

	private DispatchContext(Map<String, Object> values) {
		this.values = Collections.unmodifiableMap(values);
	}

	/** Initial context of a dispatch: only the event. */
	public static DispatchContext of(Object event) {
		Map<String, Object> m = new LinkedHashMap<>();
		m.put(EVENT_KEY, event);
		return new DispatchContext(m);
	}

	public static boolean isReserved(String key) {
		return EVENT_KEY.equals(key) || ERROR_KEY.equals(key);
	}

	public Object event() {
		return values.get(EVENT_KEY);
	}

	public Throwable error() {
		return (Throwable) values.get(ERROR_KEY);
	}

	public boolean hasError() {
		return values.containsKey(ERROR_KEY);
	}

	public boolean contains(String key) {
		return values.containsKey(key);
	}

	public Object get(String key) {
		return values.get(key);
	}

	/** Typed lookup; null when absent. */
	public <T> T get(String key, Class<T> type) {
		Object v = values.get(key);
		if (v == null) return null;
		if (!type.isInstance(v)) {
			throw new ClassCastException(
				"Context value '" + key + "' is " + v.getClass().getName() + ", not " + type.getName());
		}
		return type.cast(v);
	}

	public Set<String> keys() {
		return values.keySet();
	}

	public int size() {
		return values.size();
	}

	/** Right-merge: keys of {@code delta} win on conflict. Returns this instance for an empty delta. */
	public DispatchContext merge(Map<String, ?> delta) {
		if (delta == null || delta.isEmpty()) return this;
		Map<String, Object> m = new LinkedHashMap<>(values);
		m.putAll(delta);
		return new DispatchContext(m);
	}

	public DispatchContext withError(Throwable error) {
		Map<String, Object> m = new LinkedHashMap<>(values);
		m.put(ERROR_KEY, error);
		return new DispatchContext(m);
	}

	/** Fresh mutable copy; changes to it do not affect this context. */
	public Map<String, Object> asMap() {
		return new LinkedHashMap<>(values);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DispatchContext other)) return false;
		return values.equals(other.values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return "DispatchContext" + values.keySet();
	}
}
