/**
 * Shared utilities: JSON codec and worker thread naming.
 */
package capi.util;
