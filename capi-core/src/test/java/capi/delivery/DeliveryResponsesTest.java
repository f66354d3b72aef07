package capi.delivery;

import capi.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeliveryResponsesTest {
  private final DeliveryResponses responses = new DeliveryResponses(JsonCodec.getDefault());

  @Test
  void acknowledgedEventIsSent() {
    DeliveryResult result = responses.classify(200, "{\"events_received\":1,\"messages\":[],\"fbtrace_id\":\"AbC123\"}");

    DeliveryResult.Sent sent = assertInstanceOf(DeliveryResult.Sent.class, result);
    assertEquals(1, sent.eventsReceived());
    assertEquals("AbC123", sent.traceId());
    assertNull(sent.describe());
    Map<String, Object> stored = JsonCodec.getDefault().parseObject(sent.responseBody());
    assertEquals(1, ((Number) stored.get("events_received")).intValue());
    assertEquals("AbC123", stored.get("fbtrace_id"));
    assertFalse(stored.containsKey("messages"));
  }

  @Test
  void successWithoutReceivedEventsIsRejected() {
    DeliveryResult result = responses.classify(200, "{\"events_received\":0}");

    DeliveryResult.Rejected rejected = assertInstanceOf(DeliveryResult.Rejected.class, result);
    assertEquals(200, rejected.httpStatus());
  }

  @Test
  void largeReceivedCountsAreNotWrapped() {
    DeliveryResult.Sent sent = assertInstanceOf(DeliveryResult.Sent.class,
        responses.classify(200, "{\"events_received\":3000000000}"));
    assertEquals(Integer.MAX_VALUE, sent.eventsReceived());
    assertEquals(3000000000L,
        ((Number) JsonCodec.getDefault().parseObject(sent.responseBody()).get("events_received")).longValue());

    assertInstanceOf(DeliveryResult.Sent.class, responses.classify(200, "{\"events_received\":4294967296}"));
    assertInstanceOf(DeliveryResult.Sent.class,
        responses.classify(200, "{\"events_received\":123456789012345678901234567890}"));
    assertInstanceOf(DeliveryResult.Sent.class, responses.classify(200, "{\"events_received\":\"2\"}"));
    assertInstanceOf(DeliveryResult.Rejected.class, responses.classify(200, "{\"events_received\":-1}"));
    assertInstanceOf(DeliveryResult.Rejected.class, responses.classify(200, "{\"events_received\":\"many\"}"));
  }

  @Test
  void errorObjectIsRejectionWithDestinationMessage() {
    String body = "{\"error\":{\"message\":\"Invalid parameter\",\"type\":\"OAuthException\",\"code\":100}}";

    DeliveryResult result = responses.classify(400, body);

    DeliveryResult.Rejected rejected = assertInstanceOf(DeliveryResult.Rejected.class, result);
    assertEquals("Invalid parameter", rejected.message());
    assertEquals("Destination rejected event (HTTP 400): Invalid parameter", rejected.describe());
    assertEquals(body, rejected.responseBody());
  }

  @Test
  void nonJsonErrorIsTransportError() {
    DeliveryResult result = responses.classify(502, "<html>Bad Gateway</html>");

    DeliveryResult.TransportError error = assertInstanceOf(DeliveryResult.TransportError.class, result);
    assertEquals(502, error.httpStatus());
    assertTrue(error.describe().startsWith("Transport error (HTTP 502)"));
  }

  @Test
  void unparseableSuccessIsTransportError() {
    assertInstanceOf(DeliveryResult.TransportError.class, responses.classify(200, "ok"));
    assertInstanceOf(DeliveryResult.TransportError.class, responses.classify(200, null));
  }

  @Test
  void longBodiesAreTruncated() {
    String body = "x".repeat(5000);

    DeliveryResult result = responses.classify(503, body);

    assertEquals(1000, result.responseBody().length());
    assertTrue(result.responseBody().endsWith("..."));
    assertNull(DeliveryResponses.truncate(null));
    assertEquals("short", DeliveryResponses.truncate("short"));
  }
}
