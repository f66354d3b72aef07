/**
 * Identity normalization, hashing and privacy-mode field selection.
 *
 * <p>{@link capi.privacy.IdentityHasher} runs once when an event is written;
 * {@link capi.privacy.PrivacyPolicy} runs when a payload is built and only forwards
 * digests that are already stored.
 */
package capi.privacy;
