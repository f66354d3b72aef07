package capi.model;

/**
 * Delivery status of a conversion event with stable integer codes for storage.
 *
 * <p>Lifecycle: PENDING → RETRYING → SENT, or PENDING → RETRYING → PENDING (backoff)
 * until the attempt budget is spent, then FAILED.
 */
public enum EventStatus {
  PENDING(0),
  SENT(1),
  RETRYING(2),
  FAILED(3);

  private final int code;

  EventStatus(int code) {
    this.code = code;
  }

  /**
   * Returns the integer code stored in the database.
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a status from its stored code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static EventStatus fromCode(int code) {
    for (EventStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown event status code: " + code);
  }
}
