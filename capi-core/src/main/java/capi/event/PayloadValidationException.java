package capi.event;

/**
 * Thrown when an event cannot be turned into a valid destination payload.
 * Such events are never sent and never retried.
 */
public final class PayloadValidationException extends RuntimeException {

  public PayloadValidationException(String message) {
    super(message);
  }
}
