/**
 * Micrometer bridge for {@link capi.spi.MetricsExporter}.
 */
package capi.micrometer;
