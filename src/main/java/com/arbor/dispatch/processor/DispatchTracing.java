package com.arbor.dispatch.processor;

import java.util.Objects;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import com.arbor.dispatch.utils.DispatchId;

/** One INTERNAL span per publish. */
public class DispatchTracing {

	public static final String INSTRUMENTATION_NAME = "com.arbor.dispatch";
	public static final String SPAN_NAME = "arbor.publish";

	public static final AttributeKey<String> DISPATCH_ID = AttributeKey.stringKey("arbor.dispatch.id");
	public static final AttributeKey<String> EVENT_TYPE = AttributeKey.stringKey("arbor.event.type");
	public static final AttributeKey<Long> UNCAUGHT_COUNT = AttributeKey.longKey("arbor.uncaught.count");

	private final Tracer tracer;

	public DispatchTracing(OpenTelemetry openTelemetry) {
		this.tracer = Objects.requireNonNull(openTelemetry, "openTelemetry").getTracer(INSTRUMENTATION_NAME);
	}

	public static DispatchTracing noop() {
		return new DispatchTracing(OpenTelemetry.noop());
	}

	public Span start(DispatchId dispatchId, Object event) {
		return tracer.spanBuilder(SPAN_NAME)
			.setSpanKind(SpanKind.INTERNAL)
			.setAttribute(DISPATCH_ID, dispatchId.toString())
			.setAttribute(EVENT_TYPE, event == null ? "null" : event.getClass().getName())
			.startSpan();
	}

	/**
	 * Ends the span. Leftover uncaught errors mark it ERROR; a failure of the sink itself is recorded as an exception.
	 */
	public void finish(Span span, int uncaught, Throwable sinkFailure) {
		span.setAttribute(UNCAUGHT_COUNT, (long) uncaught);
		if (sinkFailure != null) {
			span.recordException(sinkFailure);
			span.setStatus(StatusCode.ERROR, "uncaught error sink failed");
		} else if (uncaught > 0) {
			span.setStatus(StatusCode.ERROR, uncaught + " uncaught error(s)");
		}
		span.end();
	}
}
