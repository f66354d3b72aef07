/**
 * Multi-tenant conversion event outbox.
 *
 * <p>Conversion events are written by {@link capi.ingest.ConversionEventWriter} with identity
 * already hashed, then delivered to the destination's conversions API by
 * {@link capi.processor.OutboxProcessor} passes triggered by an external scheduler. Each tenant
 * brings its own destination id, privacy mode and credentials.
 *
 * @see capi.processor.OutboxProcessor
 * @see capi.ingest.ConversionEventWriter
 * @see capi.spi.ConversionEventStore
 */
package capi;
