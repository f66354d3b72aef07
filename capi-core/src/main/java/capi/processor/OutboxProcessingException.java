package capi.processor;

/**
 * Thrown when a processing pass cannot start because due events cannot be selected.
 */
public final class OutboxProcessingException extends RuntimeException {

  public OutboxProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
