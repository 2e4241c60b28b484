package com.courseportal.api.controller;

import com.courseportal.catalog.CourseCatalogRepository;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests that each course endpoint records its own span, attributes and route metrics.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CourseControllerTelemetryTest {

    private static final AttributeKey<String> ROUTE = AttributeKey.stringKey("route");
    private static final AttributeKey<String> ERROR = AttributeKey.stringKey("error");

    private static final String CS101_JSON = "{"
        + "\"code\": \"CS101\", \"name\": \"Intro\", \"instructor\": \"A\","
        + " \"semester\": \"Fall\", \"schedule\": \"MWF\", \"classroom\": \"101\","
        + " \"grading\": \"Letter\", \"description\": \"\", \"prerequisites\": \"\""
        + "}";

    @TestConfiguration
    static class InMemoryTelemetryConfig {

        @Bean
        InMemorySpanExporter spanExporter() {
            return InMemorySpanExporter.create();
        }

        @Bean
        InMemoryMetricReader metricReader() {
            return InMemoryMetricReader.createDelta();
        }

        @Bean(destroyMethod = "close")
        @Primary
        OpenTelemetrySdk inMemoryOpenTelemetry(InMemorySpanExporter spanExporter,
                                               InMemoryMetricReader metricReader) {
            return OpenTelemetrySdk.builder()
                .setTracerProvider(SdkTracerProvider.builder()
                    .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                    .build())
                .setMeterProvider(SdkMeterProvider.builder()
                    .registerMetricReader(metricReader)
                    .build())
                .build();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CourseCatalogRepository catalogRepository;

    @Autowired
    private InMemorySpanExporter spanExporter;

    @Autowired
    private InMemoryMetricReader metricReader;

    @BeforeEach
    void setUp() throws Exception {
        Files.deleteIfExists(catalogRepository.getCatalogFile());
        spanExporter.reset();
        metricReader.collectAllMetrics();
    }

    @Test
    void testRequestsAreCountedPerRoute() throws Exception {
        addCS101();
        mockMvc.perform(get("/api/v1/courses")).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/courses")).andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/courses/CS101")).andExpect(status().isOk());

        Collection<MetricData> metrics = metricReader.collectAllMetrics();
        Map<String, Long> requestsByRoute = countsByRoute(metrics, "requests");

        assertEquals(Map.of(
            CourseController.ADD_ROUTE, 1L,
            CourseController.CATALOG_ROUTE, 2L,
            CourseController.DETAILS_ROUTE, 1L
        ), requestsByRoute);

        MetricData duration = findMetric(metrics, "operation_duration");
        assertEquals(3, duration.getHistogramData().getPoints().size());
    }

    @Test
    void testAddCourseSpan() throws Exception {
        addCS101();

        SpanData span = singleSpan("add_course");
        assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
        Attributes attributes = span.getAttributes();
        assertEquals("POST", attributes.get(AttributeKey.stringKey("http.method")));
        assertEquals("CS101", attributes.get(AttributeKey.stringKey("course.code")));
        assertEquals("Intro", attributes.get(AttributeKey.stringKey("course.name")));
        assertEquals("A", attributes.get(AttributeKey.stringKey("course.instructor")));
        assertEquals("Fall", attributes.get(AttributeKey.stringKey("course.semester")));
    }

    @Test
    void testViewCatalogSpan() throws Exception {
        addCS101();
        spanExporter.reset();

        mockMvc.perform(get("/api/v1/courses")).andExpect(status().isOk());

        SpanData span = singleSpan("view_catalog");
        assertEquals(1L, span.getAttributes().get(AttributeKey.longKey("view_catalog.count")));
        assertEquals("GET", span.getAttributes().get(AttributeKey.stringKey("http.method")));
        assertNotNull(span.getAttributes().get(AttributeKey.stringKey("user.ip")));
    }

    @Test
    void testViewCourseDetailsSpan() throws Exception {
        addCS101();
        spanExporter.reset();

        mockMvc.perform(get("/api/v1/courses/CS101")).andExpect(status().isOk());

        SpanData span = singleSpan("view_course_details");
        assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
        assertEquals("CS101", span.getAttributes().get(AttributeKey.stringKey("course_code")));
    }

    @Test
    void testUnknownCourseCountsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/courses/CS999")).andExpect(status().isNotFound());

        SpanData span = singleSpan("view_course_details");
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals("CS999", span.getAttributes().get(AttributeKey.stringKey("course_code")));

        LongPointData errors = singlePoint(findMetric(metricReader.collectAllMetrics(), "exceptions"));
        assertEquals(CourseController.DETAILS_ROUTE, errors.getAttributes().get(ROUTE));
        assertEquals("course_not_found", errors.getAttributes().get(ERROR));
    }

    @Test
    void testInvalidSubmissionCountsMissingFields() throws Exception {
        mockMvc.perform(post("/api/v1/courses")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"code\": \"CS102\", \"name\": \"\"}"))
            .andExpect(status().isBadRequest());

        SpanData span = singleSpan("add_course");
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
        assertEquals(Boolean.TRUE, span.getAttributes().get(AttributeKey.booleanKey("error")));

        Collection<MetricData> metrics = metricReader.collectAllMetrics();
        LongPointData errors = singlePoint(findMetric(metrics, "exceptions"));
        assertEquals(1, errors.getValue());
        assertEquals(CourseController.ADD_ROUTE, errors.getAttributes().get(ROUTE));
        assertEquals("missing_fields", errors.getAttributes().get(ERROR));
        assertTrue(metrics.stream().noneMatch(metric -> metric.getName().equals("requests")));
    }

    private void addCS101() throws Exception {
        mockMvc.perform(post("/api/v1/courses")
                .contentType(MediaType.APPLICATION_JSON)
                .content(CS101_JSON))
            .andExpect(status().isCreated());
    }

    private SpanData singleSpan(String name) {
        List<SpanData> spans = spanExporter.getFinishedSpanItems().stream()
            .filter(span -> span.getName().equals(name))
            .collect(Collectors.toList());
        assertEquals(1, spans.size(), "spans named " + name);
        return spans.get(0);
    }

    private static MetricData findMetric(Collection<MetricData> metrics, String name) {
        return metrics.stream()
            .filter(metric -> metric.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("Missing metric " + name));
    }

    private static LongPointData singlePoint(MetricData metric) {
        Collection<LongPointData> points = metric.getLongSumData().getPoints();
        assertEquals(1, points.size());
        return points.iterator().next();
    }

    private static Map<String, Long> countsByRoute(Collection<MetricData> metrics, String name) {
        return findMetric(metrics, name).getLongSumData().getPoints().stream()
            .collect(Collectors.toMap(point -> point.getAttributes().get(ROUTE), LongPointData::getValue));
    }
}
