package capi.delivery;

/**
 * Outcome of a single delivery attempt.
 *
 * <ul>
 *   <li>{@link Sent}: the destination acknowledged at least one event</li>
 *   <li>{@link Rejected}: the destination answered but did not accept the event</li>
 *   <li>{@link TransportError}: no usable answer (network failure, timeout, unparseable error)</li>
 * </ul>
 */
public sealed interface DeliveryResult {

  /**
   * Error text recorded on the event, or {@code null} for {@link Sent}.
   */
  String describe();

  /**
   * Raw response metadata worth storing, may be {@code null}.
   */
  String responseBody();

  /**
   * @param eventsReceived events the destination reported as received
   * @param traceId        destination trace id (may be {@code null})
   * @param responseBody   raw response JSON
   */
  record Sent(int eventsReceived, String traceId, String responseBody) implements DeliveryResult {
    @Override
    public String describe() {
      return null;
    }
  }

  /**
   * @param httpStatus   HTTP status of the answer
   * @param message      destination error message
   * @param responseBody raw response body
   */
  record Rejected(int httpStatus, String message, String responseBody) implements DeliveryResult {
    @Override
    public String describe() {
      return "Destination rejected event (HTTP " + httpStatus + "): " + message;
    }
  }

  /**
   * @param httpStatus   HTTP status if a response arrived, else {@code null}
   * @param message      failure description
   * @param responseBody raw response body (may be {@code null})
   */
  record TransportError(Integer httpStatus, String message, String responseBody) implements DeliveryResult {
    @Override
    public String describe() {
      return httpStatus == null
          ? "Transport error: " + message
          : "Transport error (HTTP " + httpStatus + "): " + message;
    }
  }
}
