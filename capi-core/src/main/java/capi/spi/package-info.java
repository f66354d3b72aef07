/**
 * Service provider interfaces: persistence, connections and metrics.
 *
 * @see capi.spi.ConversionEventStore
 * @see capi.spi.ConnectionProvider
 * @see capi.spi.MetricsExporter
 */
package capi.spi;
