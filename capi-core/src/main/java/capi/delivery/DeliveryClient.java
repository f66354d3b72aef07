package capi.delivery;

/**
 * Sends one request to the destination's conversions API.
 *
 * <p>Exactly one attempt per call, with bounded timeouts. Implementations never throw for
 * remote failures; they return {@link DeliveryResult.Rejected} or
 * {@link DeliveryResult.TransportError}. A timeout is never reported as sent.
 *
 * @see capi.spring.RestTemplateDeliveryClient
 */
@FunctionalInterface
public interface DeliveryClient {

    DeliveryResult send(DeliveryRequest request);
}
