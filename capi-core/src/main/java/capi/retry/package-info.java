/**
 * Backoff policy and attempt budget for failed deliveries.
 *
 * @see capi.retry.ExponentialBackoffRetryPolicy
 * @see capi.retry.RetrySchedule
 */
package capi.retry;
