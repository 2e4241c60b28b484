package com.courseportal.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.logging.LoggingMetricExporter;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.SdkMeterProviderBuilder;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;

/**
 * Builds the process-wide OpenTelemetry SDK once at startup.
 *
 * The SDK is not registered as the global instance; handlers receive it through
 * {@link PortalTelemetry}.
 */
@Configuration
@Slf4j
public class TelemetryConfig {

    static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    @Bean(destroyMethod = "close")
    public OpenTelemetrySdk openTelemetry(
            @Value("${course-portal.telemetry.service-name:course_portal_service}") String serviceName,
            @Value("${course-portal.telemetry.exporter:logging}") String exporter,
            @Value("${course-portal.telemetry.metric-interval:60s}") Duration metricInterval) {

        Resource resource = Resource.getDefault()
            .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

        SdkTracerProviderBuilder tracerProvider = SdkTracerProvider.builder().setResource(resource);
        SdkMeterProviderBuilder meterProvider = SdkMeterProvider.builder().setResource(resource);

        switch (exporter.toLowerCase(Locale.ROOT)) {
            case "logging":
                tracerProvider.addSpanProcessor(BatchSpanProcessor.builder(LoggingSpanExporter.create()).build());
                meterProvider.registerMetricReader(PeriodicMetricReader.builder(LoggingMetricExporter.create())
                    .setInterval(metricInterval)
                    .build());
                break;
            case "none":
                break;
            default:
                throw new IllegalArgumentException("Unknown telemetry exporter: " + exporter);
        }

        log.info("OpenTelemetry initialized: service={}, exporter={}", serviceName, exporter);

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider.build())
            .setMeterProvider(meterProvider.build())
            .build();
    }
}
