package capi.ingest;

import capi.event.EventIds;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import capi.privacy.IdentityHasher;
import capi.spi.ConversionEventStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for queuing conversion events, used by upstream ingestion (webhooks, backfills).
 *
 * <p>Raw identity is hashed here, once; only digests are stored. Writes are idempotent per
 * {@code (organizationId, eventId)} and per dedupe key: writing the same transaction again
 * refreshes the stored payload and keeps its {@code eventId} and delivery state.
 */
public final class ConversionEventWriter {
    private static final Logger logger = Logger.getLogger(ConversionEventWriter.class.getName());

    private final ConversionEventStore eventStore;
    private final IdentityHasher hasher;
    private final Clock clock;

    public ConversionEventWriter(ConversionEventStore eventStore, IdentityHasher hasher) {
        this(eventStore, hasher, Clock.systemUTC());
    }

    public ConversionEventWriter(ConversionEventStore eventStore, IdentityHasher hasher, Clock clock) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Queues a conversion event on the caller's connection (and transaction).
     *
     * @param conn    the JDBC connection
     * @param request the transaction to queue
     * @return the stored {@code eventId}
     */
    public String enqueue(Connection conn, ConversionRequest request) {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(request, "request");

        String eventId;
        if (request.enrichmentOnly()) {
            eventId = EventIds.enrichment(request.organizationId(), request.sourceId());
        } else {
            eventId = request.eventId() != null ? request.eventId() : EventIds.primary();
        }

        Map<String, Object> customData = new LinkedHashMap<>(request.customData());
        customData.put("value", request.value());
        if (request.currency() != null && !request.currency().isBlank()) {
            customData.put("currency", request.currency().trim().toUpperCase(Locale.ROOT));
        }

        Instant now = clock.instant();
        ConversionEvent event = new ConversionEvent(
            EventIds.recordId(),
            request.organizationId(),
            eventId,
            EventIds.dedupeKey(request.eventName(), request.organizationId(), request.sourceId()),
            request.sourceId(),
            request.eventName(),
            request.eventTime(),
            request.eventSourceUrl(),
            hasher.hashForStorage(request.identity()),
            customData,
            request.fbp(),
            request.fbc(),
            request.externalId(),
            request.clientIpAddress(),
            request.clientUserAgent(),
            request.destinationId(),
            request.enrichmentOnly(),
            EventStatus.PENDING,
            0,
            now,
            null,
            null,
            null,
            now);

        String stored = eventStore.upsert(conn, event);
        if (!stored.equals(eventId)) {
            logger.log(Level.FINE, "Refreshed existing event " + stored + " for " + event.dedupeKey());
        }
        return stored;
    }
}
