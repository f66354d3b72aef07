/**
 * Batch processing of due conversion events: claim, group by tenant, send, record outcome.
 *
 * @see capi.processor.OutboxProcessor
 */
package capi.processor;
