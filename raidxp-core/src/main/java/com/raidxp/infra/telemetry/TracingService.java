package com.raidxp.infra.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Owns the tracer provider of the ingestion process.
 *
 * <p>Every event application produces a span, so the logging exporter is meant
 * for local debugging only. The provider is not registered globally; components
 * get their {@link Tracer} through their constructor.
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    static final String INSTRUMENTATION_NAME = "com.raidxp.ingestor";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

    private final SdkTracerProvider tracerProvider;
    private final Tracer tracer;
    private final AtomicBoolean stopped = new AtomicBoolean();

    private TracingService(SdkTracerProvider tracerProvider, Tracer tracer) {
        this.tracerProvider = tracerProvider;
        this.tracer = tracer;
    }

    public static TracingService disabled() {
        return new TracingService(null, TracerProvider.noop().get(INSTRUMENTATION_NAME));
    }

    public static TracingService start(TracingSettings settings) {
        if (settings.exporter() == TracingSettings.Exporter.NONE) {
            logger.info("OpenTelemetry tracing is disabled");
            return disabled();
        }

        Resource resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                SERVICE_NAME, settings.serviceName(),
                SERVICE_VERSION, settings.serviceVersion())));
        Sampler sampler = Sampler.parentBased(Sampler.traceIdRatioBased(settings.samplingRatio()));

        SdkTracerProvider provider = SdkTracerProvider.builder()
                .setResource(resource)
                .setSampler(sampler)
                .addSpanProcessor(spanProcessor(settings))
                .build();
        logger.info("OpenTelemetry tracing: exporter=" + settings.exporter() + ", sampler=" + sampler.getDescription());
        return new TracingService(provider, provider.get(INSTRUMENTATION_NAME));
    }

    private static SpanProcessor spanProcessor(TracingSettings settings) {
        if (settings.exporter() == TracingSettings.Exporter.OTLP) {
            logger.info("Exporting spans to " + settings.otlpEndpoint());
            return BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                            .setEndpoint(settings.otlpEndpoint())
                            .setTimeout(30, TimeUnit.SECONDS)
                            .build())
                    .setScheduleDelay(Duration.ofSeconds(5))
                    .build();
        }
        return SimpleSpanProcessor.create(LoggingSpanExporter.create());
    }

    public Tracer getTracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }

    /**
     * Flushes pending spans and closes the exporter. Later calls do nothing.
     */
    public void shutdown() {
        if (tracerProvider == null || !stopped.compareAndSet(false, true)) {
            return;
        }
        CompletableResultCode result = tracerProvider.shutdown().join(30, TimeUnit.SECONDS);
        if (result.isSuccess()) {
            logger.info("OpenTelemetry shutdown complete");
        } else {
            logger.warning("OpenTelemetry did not flush all spans before shutdown");
        }
    }
}
