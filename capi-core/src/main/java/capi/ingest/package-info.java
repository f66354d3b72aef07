/**
 * Ingestion-side API: hashing raw identity and idempotently queuing conversion events.
 */
package capi.ingest;
