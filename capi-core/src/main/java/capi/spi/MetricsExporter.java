package capi.spi;

/**
 * Observability hook for exporting delivery counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events acknowledged by the destination.
     */
    void incrementDeliverySuccess();

    /**
     * Increments the count of failed attempts that will be retried.
     */
    void incrementDeliveryFailure();

    /**
     * Increments the count of events that reached FAILED (no more retries).
     */
    void incrementDeliveryTerminal();

    /**
     * Increments the count of tenants skipped in a pass for lack of credentials.
     */
    default void incrementNoCredentials() {
    }

    /**
     * Records the size and duration of a completed processing pass.
     *
     * @param processed  events claimed in the pass
     * @param durationMs wall-clock duration in milliseconds
     */
    void recordBatch(int processed, long durationMs);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDeliverySuccess() {
        }

        @Override
        public void incrementDeliveryFailure() {
        }

        @Override
        public void incrementDeliveryTerminal() {
        }

        @Override
        public void recordBatch(int processed, long durationMs) {
        }
    }
}
