package capi.spi;

import capi.model.ConversionEvent;
import capi.model.EventStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for conversion events, managing status transitions through
 * the lifecycle: PENDING → RETRYING → SENT, PENDING → RETRYING → PENDING (backoff),
 * or PENDING → RETRYING → FAILED.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code capi-jdbc} module.
 *
 * @see capi.jdbc.store.AbstractJdbcConversionEventStore
 */
public interface ConversionEventStore {

    /**
     * Inserts an event, or refreshes the payload fields of the existing row for the same
     * tenant with the same {@code eventId} or the same {@code dedupeKey}. Delivery state,
     * internal id and {@code eventId} of an existing row are never touched.
     *
     * @param conn  the JDBC connection
     * @param event the event to write
     * @return the {@code eventId} now stored for the event (the existing one on refresh)
     */
    String upsert(Connection conn, ConversionEvent event);

    /**
     * Loads an event by its internal id.
     */
    Optional<ConversionEvent> findById(Connection conn, String id);

    /**
     * Claims due events for one processing pass.
     *
     * <p>A row is due when its status is PENDING, RETRYING (expired lease) or FAILED,
     * {@code retry_count < maxAttempts}, and {@code next_retry_at} is null or not after
     * {@code now}. Claimed rows are stamped RETRYING with {@code locked_by = ownerId}
     * and {@code next_retry_at = leaseUntil}, so concurrent passes cannot claim them
     * until the lease expires.
     *
     * @param conn        the JDBC connection
     * @param ownerId     unique id of the claiming pass
     * @param now         current time
     * @param leaseUntil  lease expiry written to {@code next_retry_at}
     * @param maxAttempts attempt budget; rows at or above it are never claimed
     * @param limit       maximum number of rows to claim
     * @return claimed events, earliest {@code next_retry_at} first
     */
    List<ConversionEvent> claimDue(Connection conn, String ownerId, Instant now,
            Instant leaseUntil, int maxAttempts, int limit);

    /**
     * Records a confirmed delivery. Only applies while the row is still leased by {@code ownerId}.
     *
     * @param conn        the JDBC connection
     * @param id          internal event id
     * @param ownerId     owner of the lease
     * @param deliveredAt acknowledgement time
     * @param response    raw response metadata (may be {@code null})
     * @return the number of rows updated (0 or 1)
     */
    int markSent(Connection conn, String id, String ownerId, Instant deliveredAt, String response);

    /**
     * Records a failed attempt. Only applies while the row is still leased by {@code ownerId}.
     *
     * @param conn        the JDBC connection
     * @param id          internal event id
     * @param ownerId     owner of the lease
     * @param status      {@link EventStatus#PENDING} or {@link EventStatus#FAILED}
     * @param retryCount  new retry count
     * @param nextRetryAt next eligible time (may be {@code null} for terminal failures)
     * @param error       error text (may be {@code null})
     * @param response    raw response metadata (may be {@code null})
     * @return the number of rows updated (0 or 1)
     */
    int markFailed(Connection conn, String id, String ownerId, EventStatus status, int retryCount,
            Instant nextRetryAt, String error, String response);

    /**
     * Queries events in FAILED status, optionally for one tenant.
     *
     * @param conn           the JDBC connection
     * @param organizationId optional tenant filter ({@code null} for all)
     * @param limit          maximum number of events to return
     * @return failed events, oldest first
     */
    List<ConversionEvent> queryFailed(Connection conn, String organizationId, int limit);

    /**
     * Counts events in FAILED status, optionally for one tenant.
     */
    int countFailed(Connection conn, String organizationId);

    /**
     * Re-queues a FAILED event: status PENDING, retry count 0, eligible immediately.
     *
     * @return the number of rows updated (0 if not found or not FAILED)
     */
    int requeue(Connection conn, String id, Instant now);
}
