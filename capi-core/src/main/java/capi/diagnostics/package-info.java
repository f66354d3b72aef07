/**
 * Dry-run inspection of stored events.
 */
package capi.diagnostics;
