/**
 * Idempotent construction of destination payloads from stored conversion events.
 */
package capi.event;
