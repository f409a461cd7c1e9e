package com.raidxp.infra.telemetry;

import com.raidxp.api.exceptions.ConfigurationException;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Tracing options, read from environment variables or system properties of the same name:
 * <ul>
 *   <li>{@code OTEL_DISABLED}: {@code true} forces {@link Exporter#NONE}</li>
 *   <li>{@code OTEL_EXPORTER_TYPE}: {@code none}, {@code logging} or {@code otlp} (default {@code none})</li>
 *   <li>{@code OTEL_EXPORTER_OTLP_ENDPOINT}: gRPC collector (default {@code http://localhost:4317})</li>
 *   <li>{@code OTEL_TRACE_SAMPLING_RATIO}: between 0 and 1 (default 1)</li>
 *   <li>{@code SERVICE_NAME}, {@code SERVICE_VERSION}: resource attributes</li>
 * </ul>
 */
public record TracingSettings(Exporter exporter, String otlpEndpoint, double samplingRatio,
                              String serviceName, String serviceVersion) {

    public enum Exporter {
        NONE, LOGGING, OTLP
    }

    static final String DEFAULT_ENDPOINT = "http://localhost:4317";
    static final String DEFAULT_SERVICE_NAME = "raidxp-ingestor";

    public TracingSettings {
        if (exporter == null) {
            throw new ConfigurationException("Tracing exporter is required");
        }
        if (!(samplingRatio >= 0.0 && samplingRatio <= 1.0)) {
            throw new ConfigurationException("OTEL_TRACE_SAMPLING_RATIO must be between 0 and 1, got " + samplingRatio);
        }
    }

    public static TracingSettings disabled() {
        return new TracingSettings(Exporter.NONE, DEFAULT_ENDPOINT, 1.0, DEFAULT_SERVICE_NAME, "unknown");
    }

    public static TracingSettings fromEnvironment() {
        return from(System::getenv, System::getProperty);
    }

    public static TracingSettings from(UnaryOperator<String> env, UnaryOperator<String> properties) {
        UnaryOperator<String> lookup = key -> {
            String value = env.apply(key);
            return value == null || value.isBlank() ? properties.apply(key) : value.trim();
        };

        Exporter exporter = Boolean.parseBoolean(lookup.apply("OTEL_DISABLED"))
                ? Exporter.NONE
                : exporter(orDefault(lookup.apply("OTEL_EXPORTER_TYPE"), "none"));

        String ratio = orDefault(lookup.apply("OTEL_TRACE_SAMPLING_RATIO"), "1.0");
        double samplingRatio;
        try {
            samplingRatio = Double.parseDouble(ratio);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("OTEL_TRACE_SAMPLING_RATIO is not a number: " + ratio, e);
        }

        return new TracingSettings(exporter,
                orDefault(lookup.apply("OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT),
                samplingRatio,
                orDefault(lookup.apply("SERVICE_NAME"), DEFAULT_SERVICE_NAME),
                orDefault(lookup.apply("SERVICE_VERSION"), "unknown"));
    }

    private static Exporter exporter(String value) {
        try {
            return Exporter.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown OTEL_EXPORTER_TYPE '" + value + "', expected none, logging or otlp", e);
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
