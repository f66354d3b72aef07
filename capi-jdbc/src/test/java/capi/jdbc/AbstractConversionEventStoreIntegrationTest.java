package capi.jdbc;

import capi.jdbc.store.AbstractJdbcConversionEventStore;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store contract tests run against each supported database.
 * Subclasses provide the DataSource and store instance, starting each test with an empty table.
 */
abstract class AbstractConversionEventStoreIntegrationTest {
    static final Duration LEASE = Duration.ofMinutes(10);
    static final int MAX_ATTEMPTS = 5;

    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);

    abstract DataSource dataSource();

    abstract AbstractJdbcConversionEventStore store();

    private List<ConversionEvent> claim(Connection conn, String owner, Instant at, int limit) {
        return store().claimDue(conn, owner, at, at.plus(LEASE), MAX_ATTEMPTS, limit);
    }

    @Test
    void upsertStoresAllColumns() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            assertEquals(event.eventId(), store().upsert(conn, event));

            ConversionEvent loaded = store().findById(conn, event.id()).orElseThrow();
            assertEquals("org-a", loaded.organizationId());
            assertEquals(event.dedupeKey(), loaded.dedupeKey());
            assertEquals(now, loaded.eventTime());
            assertEquals(event.userDataHashed(), loaded.userDataHashed());
            assertEquals(0, new BigDecimal("25.00").compareTo((BigDecimal) loaded.customData().get("value")));
            assertEquals("USD", loaded.customData().get("currency"));
            assertEquals("donor-txn-1", loaded.externalId());
            assertEquals(EventStatus.PENDING, loaded.status());
            assertNull(loaded.nextRetryAt());
            assertNull(loaded.fbp());
        }
    }

    @Test
    void upsertOfSameTransactionKeepsOriginalIdentity() throws Exception {
        ConversionEvent first = JdbcFixtures.pending("org-a", "txn-1", now);
        ConversionEvent retry = JdbcFixtures.pending("org-a", "txn-1", now.plusSeconds(5));

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, first);
            String stored = store().upsert(conn, retry);

            assertEquals(first.eventId(), stored);
            assertTrue(store().findById(conn, retry.id()).isEmpty());
            ConversionEvent loaded = store().findById(conn, first.id()).orElseThrow();
            assertEquals(now.plusSeconds(5), loaded.eventTime());
        }
    }

    @Test
    void upsertNeverResetsDeliveryState() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);
            claim(conn, "owner-1", now, 10);
            assertEquals(1, store().markSent(conn, event.id(), "owner-1", now, "{\"events_received\":1}"));

            store().upsert(conn, JdbcFixtures.pending("org-a", "txn-1", now));

            ConversionEvent loaded = store().findById(conn, event.id()).orElseThrow();
            assertEquals(EventStatus.SENT, loaded.status());
            assertEquals(now, loaded.deliveredAt());
            assertEquals("{\"events_received\":1}", loaded.destinationResponse());
        }
    }

    @Test
    void sameSourceIdInAnotherTenantIsSeparate() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, JdbcFixtures.pending("org-a", "txn-1", now));
            store().upsert(conn, JdbcFixtures.pending("org-b", "txn-1", now));

            assertEquals(2, claim(conn, "owner-1", now, 10).size());
        }
    }

    @Test
    void claimStampsLeaseAndExcludesOtherOwners() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);

            List<ConversionEvent> claimed = claim(conn, "owner-1", now, 10);
            assertEquals(1, claimed.size());
            assertEquals(EventStatus.RETRYING, claimed.get(0).status());
            assertEquals(now.plus(LEASE), claimed.get(0).nextRetryAt());

            assertTrue(claim(conn, "owner-2", now, 10).isEmpty());
            assertTrue(claim(conn, "owner-2", now.plus(LEASE).minusSeconds(1), 10).isEmpty());
        }
    }

    @Test
    void expiredLeaseIsReclaimedAndStaleOwnerLosesWrites() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);
            claim(conn, "owner-1", now, 10);

            Instant later = now.plus(LEASE).plusSeconds(1);
            assertEquals(1, claim(conn, "owner-2", later, 10).size());

            assertEquals(0, store().markSent(conn, event.id(), "owner-1", later, null));
            assertEquals(0, store().markFailed(conn, event.id(), "owner-1", EventStatus.PENDING, 1,
                    later, "late", null));
            assertEquals(1, store().markSent(conn, event.id(), "owner-2", later, null));
        }
    }

    @Test
    void claimRespectsDueTimeAttemptBudgetAndLimit() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, JdbcFixtures.pending("org-a", "due-1", now.minusSeconds(30)));
            store().upsert(conn, JdbcFixtures.pending("org-a", "due-2", now.minusSeconds(20)));
            store().upsert(conn, JdbcFixtures.event("org-a", "due-3", EventStatus.PENDING, 1,
                    now.minusSeconds(1), now.minusSeconds(10)));
            store().upsert(conn, JdbcFixtures.event("org-a", "future", EventStatus.PENDING, 1,
                    now.plusSeconds(60), now));
            store().upsert(conn, JdbcFixtures.event("org-a", "spent", EventStatus.FAILED, MAX_ATTEMPTS,
                    null, now));

            List<ConversionEvent> first = claim(conn, "owner-1", now, 2);
            assertEquals(2, first.size());

            List<ConversionEvent> rest = claim(conn, "owner-2", now, 10);
            assertEquals(1, rest.size());
        }
    }

    @Test
    void retryableFailedEventIsDue() throws Exception {
        ConversionEvent event = JdbcFixtures.event("org-a", "txn-1", EventStatus.FAILED, 2,
                now.minusSeconds(60), now.minusSeconds(600));

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);

            List<ConversionEvent> claimed = claim(conn, "owner-1", now, 10);
            assertEquals(1, claimed.size());
            assertEquals(2, claimed.get(0).retryCount());
        }
    }

    @Test
    void markFailedSchedulesBackoff() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);
            claim(conn, "owner-1", now, 10);

            Instant next = now.plus(Duration.ofMinutes(5));
            assertEquals(1, store().markFailed(conn, event.id(), "owner-1", EventStatus.PENDING, 1,
                    next, "Transport error: timeout", null));

            ConversionEvent loaded = store().findById(conn, event.id()).orElseThrow();
            assertEquals(EventStatus.PENDING, loaded.status());
            assertEquals(1, loaded.retryCount());
            assertEquals(next, loaded.nextRetryAt());
            assertEquals("Transport error: timeout", loaded.lastError());

            assertTrue(claim(conn, "owner-2", now.plusSeconds(60), 10).isEmpty());
            assertEquals(1, claim(conn, "owner-2", next, 10).size());
        }
    }

    @Test
    void markFailedTruncatesLongErrors() throws Exception {
        ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, event);
            claim(conn, "owner-1", now, 10);
            store().markFailed(conn, event.id(), "owner-1", EventStatus.FAILED, MAX_ATTEMPTS, null,
                    "x".repeat(6000), null);

            assertEquals(4000, store().findById(conn, event.id()).orElseThrow().lastError().length());
        }
    }

    @Test
    void markFailedRejectsNonFailureStatus() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            assertThrows(IllegalArgumentException.class, () ->
                    store().markFailed(conn, "id", "owner", EventStatus.SENT, 0, null, null, null));
        }
    }

    @Test
    void failedEventsCanBeQueriedCountedAndRequeued() throws Exception {
        ConversionEvent a = JdbcFixtures.pending("org-a", "txn-1", now.minusSeconds(10));
        ConversionEvent b = JdbcFixtures.pending("org-b", "txn-2", now);

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, a);
            store().upsert(conn, b);
            claim(conn, "owner-1", now, 10);
            store().markFailed(conn, a.id(), "owner-1", EventStatus.FAILED, MAX_ATTEMPTS, null, "rejected", null);
            store().markFailed(conn, b.id(), "owner-1", EventStatus.FAILED, MAX_ATTEMPTS, null, "rejected", null);

            assertEquals(2, store().countFailed(conn, null));
            assertEquals(1, store().countFailed(conn, "org-a"));
            assertEquals(List.of(a.id(), b.id()),
                    store().queryFailed(conn, null, 10).stream().map(ConversionEvent::id).toList());
            assertEquals(List.of(b.id()),
                    store().queryFailed(conn, "org-b", 10).stream().map(ConversionEvent::id).toList());
            assertTrue(claim(conn, "owner-2", now.plusSeconds(3600), 10).isEmpty());

            assertEquals(1, store().requeue(conn, a.id(), now));
            assertEquals(0, store().requeue(conn, a.id(), now));

            ConversionEvent requeued = store().findById(conn, a.id()).orElseThrow();
            assertEquals(EventStatus.PENDING, requeued.status());
            assertEquals(0, requeued.retryCount());
            assertEquals("rejected", requeued.lastError());
            assertEquals(1, claim(conn, "owner-3", now, 10).size());
        }
    }

    @Test
    void storedCustomDataDropsNullValues() throws Exception {
        try (Connection conn = dataSource().getConnection()) {
            ConversionEvent event = JdbcFixtures.pending("org-a", "txn-1", now);
            store().upsert(conn, event);
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("UPDATE " + TableNames.EVENT_TABLE
                        + " SET custom_data='{\"value\":10,\"campaign\":null}'");
            }

            Map<String, Object> customData = store().findById(conn, event.id()).orElseThrow().customData();
            assertEquals(Map.of("value", 10), customData);
        }
    }

    @Test
    void unreadableRowIsFailedWithoutBlockingTheClaim() throws Exception {
        ConversionEvent good = JdbcFixtures.pending("org-a", "txn-1", now.minusSeconds(2));
        ConversionEvent poisoned = JdbcFixtures.pending("org-b", "txn-2", now.minusSeconds(1));

        try (Connection conn = dataSource().getConnection()) {
            store().upsert(conn, good);
            store().upsert(conn, poisoned);
            try (PreparedStatement ps = conn.prepareStatement("UPDATE " + TableNames.EVENT_TABLE
                    + " SET user_data_hashed='{not json' WHERE id=?")) {
                ps.setString(1, poisoned.id());
                ps.executeUpdate();
            }

            List<ConversionEvent> claimed = claim(conn, "owner-1", now, 10);
            assertEquals(List.of(good.id()), claimed.stream().map(ConversionEvent::id).toList());

            try (PreparedStatement ps = conn.prepareStatement("SELECT status, retry_count, last_error, locked_by"
                    + " FROM " + TableNames.EVENT_TABLE + " WHERE id=?")) {
                ps.setString(1, poisoned.id());
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    assertEquals(EventStatus.FAILED.code(), rs.getInt("status"));
                    assertEquals(MAX_ATTEMPTS, rs.getInt("retry_count"));
                    assertTrue(rs.getString("last_error").startsWith("Unreadable stored event: "));
                    assertNull(rs.getString("locked_by"));
                }
            }

            assertTrue(claim(conn, "owner-2", now.plus(LEASE).plusSeconds(1), 10).stream()
                    .noneMatch(e -> e.id().equals(poisoned.id())));
            assertEquals(1, store().countFailed(conn, "org-b"));
            assertTrue(store().queryFailed(conn, "org-b", 10).isEmpty());
            assertEquals(1, store().requeue(conn, poisoned.id(), now));
        }
    }
}
