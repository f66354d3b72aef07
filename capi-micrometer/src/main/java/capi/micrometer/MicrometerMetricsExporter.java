package capi.micrometer;

import capi.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, a timer and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code capi.delivery.sent}: events acknowledged by the destination</li>
 *   <li>{@code capi.delivery.failed}: failed attempts that will be retried</li>
 *   <li>{@code capi.delivery.terminal}: events moved to FAILED</li>
 *   <li>{@code capi.credentials.missing}: tenants skipped for lack of credentials</li>
 * </ul>
 *
 * <h3>Batch metrics</h3>
 * <ul>
 *   <li>{@code capi.batch.duration}: timer of processing pass wall-clock time</li>
 *   <li>{@code capi.batch.size}: distribution of events claimed per pass</li>
 *   <li>{@code capi.batch.last.size}: gauge of events claimed by the latest pass</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter deliverySuccess;
  private final Counter deliveryFailure;
  private final Counter deliveryTerminal;
  private final Counter noCredentials;
  private final Timer passDuration;
  private final DistributionSummary passEvents;
  private final Gauge lastPassGauge;

  private final AtomicInteger lastPassEvents = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "capi"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "capi");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "donations.capi"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.deliverySuccess = Counter.builder(namePrefix + ".delivery.sent")
        .description("Events acknowledged by the destination")
        .register(registry);
    this.deliveryFailure = Counter.builder(namePrefix + ".delivery.failed")
        .description("Failed attempts that will be retried")
        .register(registry);
    this.deliveryTerminal = Counter.builder(namePrefix + ".delivery.terminal")
        .description("Events moved to FAILED")
        .register(registry);
    this.noCredentials = Counter.builder(namePrefix + ".credentials.missing")
        .description("Tenants skipped for lack of credentials")
        .register(registry);
    this.passDuration = Timer.builder(namePrefix + ".batch.duration")
        .description("Processing pass duration")
        .register(registry);
    this.passEvents = DistributionSummary.builder(namePrefix + ".batch.size")
        .description("Events claimed per processing pass")
        .register(registry);
    this.lastPassGauge = Gauge.builder(namePrefix + ".batch.last.size", lastPassEvents, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementDeliverySuccess() {
    if (closed) return;
    deliverySuccess.increment();
  }

  @Override
  public void incrementDeliveryFailure() {
    if (closed) return;
    deliveryFailure.increment();
  }

  @Override
  public void incrementDeliveryTerminal() {
    if (closed) return;
    deliveryTerminal.increment();
  }

  @Override
  public void incrementNoCredentials() {
    if (closed) return;
    noCredentials.increment();
  }

  @Override
  public void recordBatch(int processed, long durationMs) {
    if (closed) return;
    passDuration.record(Duration.ofMillis(durationMs));
    passEvents.record(processed);
    lastPassEvents.set(processed);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the processor is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(deliverySuccess, deliveryFailure, deliveryTerminal,
        noCredentials, passDuration, passEvents, lastPassGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
