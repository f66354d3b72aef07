package capi.delivery;

import java.net.URI;
import java.util.Objects;

/**
 * Location of the destination's conversions API.
 *
 * @param baseUrl    API host, e.g. {@code https://graph.facebook.com}
 * @param apiVersion path version segment, e.g. {@code v22.0}
 */
public record ConversionsEndpoint(String baseUrl, String apiVersion) {
  public static final String DEFAULT_BASE_URL = "https://graph.facebook.com";
  public static final String DEFAULT_API_VERSION = "v22.0";

  public ConversionsEndpoint {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(apiVersion, "apiVersion");
    while (baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
    if (baseUrl.isEmpty() || apiVersion.isBlank()) {
      throw new IllegalArgumentException("baseUrl and apiVersion must not be empty");
    }
  }

  public static ConversionsEndpoint defaults() {
    return new ConversionsEndpoint(DEFAULT_BASE_URL, DEFAULT_API_VERSION);
  }

  /**
   * {@code {baseUrl}/{apiVersion}/{destinationId}/events}
   */
  public URI eventsUri(String destinationId) {
    Objects.requireNonNull(destinationId, "destinationId");
    return URI.create(baseUrl + "/" + apiVersion + "/" + destinationId + "/events");
  }
}
