/**
 * Operator tooling for events that exhausted their retry budget.
 */
package capi.failed;
