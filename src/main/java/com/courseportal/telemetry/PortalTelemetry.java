package com.courseportal.telemetry;

import com.courseportal.common.exception.CoursePortalException;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Route-level tracing and metrics for the course endpoints.
 *
 * Each instrumented invocation gets one span. Successful invocations count one
 * request and one duration sample for the route; failures count one exception
 * tagged with the error code and are rethrown unchanged.
 */
@Component
public class PortalTelemetry {

    static final String INSTRUMENTATION_SCOPE = "com.courseportal";

    static final AttributeKey<String> ROUTE = AttributeKey.stringKey("route");
    static final AttributeKey<String> ERROR = AttributeKey.stringKey("error");

    private final Tracer tracer;
    private final LongCounter requestCounter;
    private final LongCounter errorCounter;
    private final DoubleHistogram operationDuration;

    public PortalTelemetry(OpenTelemetry openTelemetry) {
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_SCOPE);

        Meter meter = openTelemetry.getMeter(INSTRUMENTATION_SCOPE);
        this.requestCounter = meter.counterBuilder("requests")
            .setDescription("number of requests")
            .build();
        this.errorCounter = meter.counterBuilder("exceptions")
            .setDescription("number of exceptions caught")
            .build();
        this.operationDuration = meter.histogramBuilder("operation_duration")
            .setUnit("ms")
            .setDescription("The duration of operations in milliseconds")
            .build();
    }

    /**
     * Run a route handler inside a span.
     *
     * @param spanName name of the span, e.g. "view_catalog"
     * @param route route label for the metrics, e.g. "/catalog"
     * @param request the HTTP request being served
     * @param body handler logic; may add attributes and events to the span
     * @return whatever the body returns
     */
    public <T> T instrument(String spanName, String route, HttpServletRequest request,
                            Function<Span, T> body) {
        long startNanos = System.nanoTime();
        Span span = tracer.spanBuilder(spanName).startSpan();

        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("http.method", request.getMethod());
            span.setAttribute("user.ip", request.getRemoteAddr());

            T result = body.apply(span);

            Attributes routeAttributes = Attributes.of(ROUTE, route);
            requestCounter.add(1, routeAttributes);
            operationDuration.record((System.nanoTime() - startNanos) / 1_000_000.0, routeAttributes);
            span.setStatus(StatusCode.OK);
            return result;

        } catch (RuntimeException e) {
            String errorCode = e instanceof CoursePortalException
                ? ((CoursePortalException) e).getErrorCode()
                : "unexpected";

            span.setAttribute("error", true);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.addEvent(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            errorCounter.add(1, Attributes.of(ROUTE, route, ERROR, errorCode));
            throw e;

        } finally {
            span.end();
        }
    }
}
