package capi.spi;

import capi.model.HealthStats;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for per-tenant delivery health counters.
 */
public interface HealthStore {

    /**
     * Applies one delivery outcome to the tenant's counters, creating the row if needed.
     *
     * @param conn           the JDBC connection
     * @param organizationId tenant id
     * @param success        whether the attempt succeeded
     * @param error          error text for failures (may be {@code null})
     * @param at             time of the outcome
     */
    void record(Connection conn, String organizationId, boolean success, String error, Instant at);

    Optional<HealthStats> find(Connection conn, String organizationId);

    List<HealthStats> findAll(Connection conn);
}
