/**
 * Per-tenant delivery health counters.
 */
package capi.health;
