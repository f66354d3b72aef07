package capi.diagnostics;

import capi.credential.CredentialResolutionException;
import capi.credential.CredentialResolver;
import capi.credential.ResolvedCredentials;
import capi.delivery.ConversionsEndpoint;
import capi.event.ConversionPayload;
import capi.event.EventBuilder;
import capi.event.PayloadValidationException;
import capi.model.ConversionEvent;
import capi.privacy.MatchScore;
import capi.spi.ConnectionProvider;
import capi.spi.ConversionEventStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only inspection of stored events: builds the payload a pass would send without
 * sending it or touching the event's state.
 */
public final class EventDiagnostics {
  private static final Logger logger = Logger.getLogger(EventDiagnostics.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ConversionEventStore eventStore;
  private final CredentialResolver credentialResolver;
  private final EventBuilder eventBuilder;
  private final ConversionsEndpoint endpoint;

  public EventDiagnostics(ConnectionProvider connectionProvider, ConversionEventStore eventStore,
      CredentialResolver credentialResolver, EventBuilder eventBuilder, ConversionsEndpoint endpoint) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
    this.eventBuilder = Objects.requireNonNull(eventBuilder, "eventBuilder");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
  }

  /**
   * Builds the payload for an event without sending it.
   *
   * @param id internal event id
   * @return the report, or empty if the event does not exist
   * @throws SQLException if the event cannot be loaded
   */
  public Optional<DryRunReport> dryRun(String id) throws SQLException {
    ConversionEvent event;
    try (Connection conn = connectionProvider.getConnection()) {
      Optional<ConversionEvent> found = eventStore.findById(conn, id);
      if (found.isEmpty()) {
        return Optional.empty();
      }
      event = found.get();
    }

    ResolvedCredentials credentials;
    try {
      credentials = credentialResolver.resolve(event.organizationId());
    } catch (CredentialResolutionException e) {
      return Optional.of(failed(event, null, e.getMessage()));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING, "Dry run could not read configuration for organization "
          + event.organizationId(), e);
      return Optional.of(failed(event, null, "Tenant configuration unavailable: " + e.getMessage()));
    }

    ConversionPayload payload;
    try {
      payload = eventBuilder.build(event, credentials);
    } catch (PayloadValidationException e) {
      return Optional.of(failed(event, credentials, e.getMessage()));
    }
    MatchScore score = MatchScore.of(payload.userData());
    return Optional.of(new DryRunReport(event.id(), event.organizationId(), statusName(event),
        event.retryCount(), endpoint.eventsUri(payload.destinationId()).toString(),
        credentials.privacyMode().storageName(), credentials.tokenSource().name(),
        credentials.testEventCode(), payload.event(), score.score(), score.quality().label(), null));
  }

  private static DryRunReport failed(ConversionEvent event, ResolvedCredentials credentials, String error) {
    return new DryRunReport(event.id(), event.organizationId(), statusName(event), event.retryCount(),
        null,
        credentials == null ? null : credentials.privacyMode().storageName(),
        credentials == null ? null : credentials.tokenSource().name(),
        credentials == null ? null : credentials.testEventCode(),
        null, null, null, error);
  }

  private static String statusName(ConversionEvent event) {
    return event.status().name().toLowerCase(Locale.ROOT);
  }
}
