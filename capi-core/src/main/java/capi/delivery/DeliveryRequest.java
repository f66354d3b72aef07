package capi.delivery;

import java.util.Map;
import java.util.Objects;

/**
 * One HTTP call to the destination.
 *
 * @param destinationId destination id placed in the URL
 * @param body          JSON-ready request body, including the access token
 */
public record DeliveryRequest(String destinationId, Map<String, Object> body) {

  public DeliveryRequest {
    Objects.requireNonNull(destinationId, "destinationId");
    Objects.requireNonNull(body, "body");
  }

  @Override
  public String toString() {
    return "DeliveryRequest[destinationId=" + destinationId + "]";
  }
}
