package capi.spring;

import capi.delivery.ConversionsEndpoint;
import capi.delivery.DeliveryClient;
import capi.delivery.DeliveryRequest;
import capi.delivery.DeliveryResponses;
import capi.delivery.DeliveryResult;
import capi.util.JsonCodec;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliveryClient} that posts to the conversions API with Spring's {@link RestTemplate}.
 *
 * <p>One POST per call, no client-side retries. Non-2xx answers and I/O failures are
 * classified into {@link DeliveryResult}s instead of thrown. The access token travels
 * only in the request body and is never logged.
 */
public final class RestTemplateDeliveryClient implements DeliveryClient {
  private static final Logger logger = Logger.getLogger(RestTemplateDeliveryClient.class.getName());

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

  private final RestTemplate restTemplate;
  private final ConversionsEndpoint endpoint;
  private final JsonCodec jsonCodec;
  private final DeliveryResponses responses;

  public RestTemplateDeliveryClient(RestTemplate restTemplate, ConversionsEndpoint endpoint, JsonCodec jsonCodec) {
    this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.responses = new DeliveryResponses(jsonCodec);
  }

  /**
   * Creates a client with its own {@link RestTemplate} bounded by the given timeouts.
   */
  public static RestTemplateDeliveryClient create(ConversionsEndpoint endpoint, Duration connectTimeout,
      Duration readTimeout) {
    return new RestTemplateDeliveryClient(restTemplate(connectTimeout, readTimeout), endpoint, JsonCodec.getDefault());
  }

  /**
   * Builds a {@link RestTemplate} whose connections time out after the given durations.
   */
  public static RestTemplate restTemplate(Duration connectTimeout, Duration readTimeout) {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(readTimeout, "readTimeout");
    if (connectTimeout.isNegative() || connectTimeout.isZero() || readTimeout.isNegative() || readTimeout.isZero()) {
      throw new IllegalArgumentException("timeouts must be > 0");
    }
    SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(Math.toIntExact(connectTimeout.toMillis()));
    factory.setReadTimeout(Math.toIntExact(readTimeout.toMillis()));
    return new RestTemplate(factory);
  }

  @Override
  public DeliveryResult send(DeliveryRequest request) {
    URI uri = endpoint.eventsUri(request.destinationId());
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    HttpEntity<String> entity = new HttpEntity<>(jsonCodec.toJson(request.body()), headers);

    try {
      ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.POST, entity, String.class);
      return responses.classify(response.getStatusCode().value(), response.getBody());
    } catch (HttpStatusCodeException e) {
      logger.log(Level.FINE, "Destination {0} answered HTTP {1}",
          new Object[]{request.destinationId(), e.getStatusCode().value()});
      return responses.classify(e.getStatusCode().value(), e.getResponseBodyAsString());
    } catch (RestClientException e) {
      logger.log(Level.WARNING, "Delivery to destination " + request.destinationId() + " failed", e);
      return new DeliveryResult.TransportError(null, describe(e), null);
    }
  }

  private static String describe(RestClientException e) {
    Throwable cause = e.getMostSpecificCause();
    return cause.getClass().getSimpleName() + ": " + cause.getMessage();
  }
}
