package ca.gc.cra.lazypull.infrastructure.metrics;

import ca.gc.cra.lazypull.application.port.MetricsPort;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that forwards supplement counters and latencies to an
 * OpenTelemetry {@link Meter}.
 * <p>Instruments are created lazily per key and cached. Keys are sanitized into instrument names; the
 * raw key is kept as the {@code lazypull.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.lazypull";
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("lazypull.metric.key");
  private static final String FALLBACK_METRIC_NAME = "lazypull.metric";

  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter bound to the meter of the given OpenTelemetry instance.
   *
   * @param openTelemetry configured OpenTelemetry API entry point
   */
  public OpenTelemetryMetricsAdapter(OpenTelemetry openTelemetry) {
    this(Objects.requireNonNull(openTelemetry, "openTelemetry").getMeter(INSTRUMENTATION_SCOPE));
  }

  /**
   * Creates an adapter bound to an explicit meter.
   *
   * @param meter meter that owns the instruments
   */
  public OpenTelemetryMetricsAdapter(Meter meter) {
    this.meter = Objects.requireNonNull(meter, "meter");
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("lazypull counter for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("lazypull observation for " + key)
        .build();
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
