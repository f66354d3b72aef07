package capi.delivery;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class ConversionsEndpointTest {

  @Test
  void defaultsPointAtGraphApi() {
    assertEquals(URI.create("https://graph.facebook.com/v22.0/123456/events"),
        ConversionsEndpoint.defaults().eventsUri("123456"));
  }

  @Test
  void trailingSlashesAreStripped() {
    ConversionsEndpoint endpoint = new ConversionsEndpoint("http://localhost:8089//", "v19.0");

    assertEquals(URI.create("http://localhost:8089/v19.0/px/events"), endpoint.eventsUri("px"));
  }

  @Test
  void rejectsEmptyParts() {
    assertThrows(IllegalArgumentException.class, () -> new ConversionsEndpoint("/", "v22.0"));
    assertThrows(IllegalArgumentException.class, () -> new ConversionsEndpoint("http://h", " "));
  }
}
