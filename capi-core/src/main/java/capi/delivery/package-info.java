/**
 * Delivery contract for the destination's conversions API and response classification.
 */
package capi.delivery;
