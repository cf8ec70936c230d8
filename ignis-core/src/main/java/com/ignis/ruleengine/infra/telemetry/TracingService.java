package com.ignis.ruleengine.infra.telemetry;

import com.ignis.ruleengine.config.EngineConfig;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.logging.LoggingSpanExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import io.opentelemetry.sdk.trace.samplers.Sampler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide OpenTelemetry tracer.
 *
 * <p>Configuration via environment variables (or system properties of the same name):
 * <ul>
 *   <li>OTEL_DISABLED: disable tracing entirely (default: false)</li>
 *   <li>OTEL_EXPORTER_TYPE: otlp|logging (default: logging)</li>
 *   <li>OTEL_EXPORTER_OTLP_ENDPOINT: OTLP endpoint (default: http://localhost:4317)</li>
 *   <li>OTEL_TRACE_SAMPLING_RATIO: 0.0-1.0 (default depends on DEPLOYMENT_ENVIRONMENT)</li>
 *   <li>SERVICE_NAME, SERVICE_VERSION, DEPLOYMENT_ENVIRONMENT: resource attributes</li>
 * </ul>
 */
public final class TracingService {
    private static final Logger logger = Logger.getLogger(TracingService.class.getName());

    private static final String INSTRUMENTATION_NAME = "com.ignis.rule-engine";
    private static final String DEFAULT_SERVICE_NAME = "ignis-rule-engine";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");
    private static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT = AttributeKey.stringKey("deployment.environment");

    private static volatile TracingService INSTANCE;
    private static final Object LOCK = new Object();

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final SdkTracerProvider tracerProvider;

    private TracingService(OpenTelemetry openTelemetry, SdkTracerProvider tracerProvider) {
        this.openTelemetry = openTelemetry;
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
        this.tracerProvider = tracerProvider;
    }

    public static TracingService getInstance() {
        TracingService instance = INSTANCE;
        if (instance == null) {
            synchronized (LOCK) {
                instance = INSTANCE;
                if (instance == null) {
                    instance = initialize();
                    INSTANCE = instance;
                }
            }
        }
        return instance;
    }

    private static TracingService initialize() {
        if (Boolean.parseBoolean(EngineConfig.getEnvOrProperty("OTEL_DISABLED", "false"))) {
            logger.info("OpenTelemetry tracing is DISABLED (OTEL_DISABLED=true)");
            return noop();
        }
        try {
            Sampler sampler = configureSampler();
            SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                    .setResource(buildResource())
                    .setSampler(sampler)
                    .addSpanProcessor(BatchSpanProcessor.builder(configureExporter())
                            .setMaxQueueSize(2048)
                            .setScheduleDelay(Duration.ofSeconds(5))
                            .build())
                    .build();

            // Not registered globally so tests can build their own SDK side by side.
            OpenTelemetrySdk sdk = OpenTelemetrySdk.builder()
                    .setTracerProvider(tracerProvider)
                    .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                    .build();

            logger.info(String.format("OpenTelemetry initialized: service=%s, env=%s, sampler=%s",
                    serviceName(), environment(), sampler.getDescription()));

            TracingService service = new TracingService(sdk, tracerProvider);
            Runtime.getRuntime().addShutdownHook(new Thread(service::shutdown, "otel-shutdown-hook"));
            return service;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to initialize OpenTelemetry - falling back to noop", e);
            return noop();
        }
    }

    private static TracingService noop() {
        return new TracingService(OpenTelemetry.noop(), null);
    }

    private static Resource buildResource() {
        return Resource.getDefault().merge(Resource.create(Attributes.builder()
                .put(SERVICE_NAME, serviceName())
                .put(SERVICE_VERSION, EngineConfig.getEnvOrProperty("SERVICE_VERSION", "unknown"))
                .put(DEPLOYMENT_ENVIRONMENT, environment())
                .build()));
    }

    private static Sampler configureSampler() {
        String defaultRatio = switch (environment().toLowerCase()) {
            case "prod", "production" -> "0.1";
            case "staging" -> "0.5";
            default -> "1.0";
        };
        double ratio;
        try {
            ratio = Double.parseDouble(EngineConfig.getEnvOrProperty("OTEL_TRACE_SAMPLING_RATIO", defaultRatio));
            ratio = Math.max(0.0, Math.min(1.0, ratio));
        } catch (NumberFormatException e) {
            logger.warning("Invalid OTEL_TRACE_SAMPLING_RATIO, using " + defaultRatio);
            ratio = Double.parseDouble(defaultRatio);
        }
        return Sampler.parentBasedBuilder(Sampler.traceIdRatioBased(ratio)).build();
    }

    private static SpanExporter configureExporter() {
        String type = EngineConfig.getEnvOrProperty("OTEL_EXPORTER_TYPE", "logging").toLowerCase();
        if ("otlp".equals(type)) {
            String endpoint = EngineConfig.getEnvOrProperty("OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317");
            logger.info("Using OTLP exporter: " + endpoint);
            return OtlpGrpcSpanExporter.builder()
                    .setEndpoint(endpoint)
                    .setTimeout(30, TimeUnit.SECONDS)
                    .build();
        }
        if (!"logging".equals(type)) {
            logger.warning("Unknown exporter type: " + type + ", using logging");
        }
        return LoggingSpanExporter.create();
    }

    private static String serviceName() {
        return EngineConfig.getEnvOrProperty("SERVICE_NAME", DEFAULT_SERVICE_NAME);
    }

    private static String environment() {
        return EngineConfig.getEnvOrProperty("DEPLOYMENT_ENVIRONMENT", "dev");
    }

    /**
     * Drains buffered spans. Safe to call more than once.
     */
    public void shutdown() {
        if (tracerProvider == null) {
            return;
        }
        try {
            tracerProvider.shutdown().join(10, TimeUnit.SECONDS);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error during OpenTelemetry shutdown", e);
        }
    }

    public Tracer getTracer() {
        return tracer;
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    public boolean isEnabled() {
        return tracerProvider != null;
    }
}
