package ca.gc.cra.harvest.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the collector.
 * <p>The exporter comes from collector configuration; the OTLP endpoint from {@code otel.exporter.otlp.endpoint}
 * or {@code OTEL_EXPORTER_OTLP_ENDPOINT}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.harvest";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final String UNKNOWN_VERSION = "0.0.0-dev";
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/harvest/pom.properties";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(60);
  private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize(String exporterSetting) {
    if (ExporterMode.from(exporterSetting) == ExporterMode.NONE) {
      log.info("OpenTelemetry metrics exporter disabled");
      return BootstrapResult.noop();
    }
    String endpoint = otlpEndpoint();
    try {
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      BootstrapResult result = withReader(reader);
      log.info("OpenTelemetry metrics exporting over OTLP to {}", endpoint);
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OTLP metrics export to {}; metrics are dropped", endpoint, ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return withReader(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult withReader(MetricReader reader) {
    String version = serviceVersion();
    Attributes service = Attributes.of(
        AttributeKey.stringKey("service.name"), "harvest",
        AttributeKey.stringKey("service.namespace"), "ca.gc.cra",
        AttributeKey.stringKey("service.version"), version,
        AttributeKey.stringKey("host.name"), hostName());
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(service)))
        .registerMetricReader(reader)
        .build();
    return new BootstrapResult(provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build(),
        provider);
  }

  private static String otlpEndpoint() {
    return Stream.of(System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"))
        .filter(value -> value != null && !value.isBlank())
        .map(String::trim)
        .findFirst()
        .orElse(DEFAULT_ENDPOINT);
  }

  private static String hostName() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable for metrics resource", ex);
      return "unknown";
    }
  }

  private static String serviceVersion() {
    String manifestVersion = Optional.ofNullable(OpenTelemetryBootstrap.class.getPackage())
        .map(Package::getImplementationVersion)
        .orElse(null);
    if (manifestVersion != null) {
      return manifestVersion;
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in == null) {
        return UNKNOWN_VERSION;
      }
      Properties props = new Properties();
      props.load(in);
      return props.getProperty("version", UNKNOWN_VERSION);
    } catch (IOException ex) {
      log.debug("Could not read {}", POM_PROPERTIES, ex);
      return UNKNOWN_VERSION;
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    /** Null, blank and unrecognized settings all disable export. */
    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("otlp")) {
        return OTLP;
      }
      if (!normalized.equals("none")) {
        log.warn("Unknown metrics exporter '{}'; metrics export disabled", raw);
      }
      return NONE;
    }
  }

  /** Meter plus the SDK provider that owns it; the provider is absent for no-op results. */
  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        provider.forceFlush().join(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode shutdown = provider.shutdown().join(FLUSH_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      if (!shutdown.isSuccess()) {
        log.warn("OpenTelemetry meter provider did not shut down within {}", FLUSH_TIMEOUT);
      }
    }
  }
}
