/**
 * JDBC-based {@link capi.spi.ConversionEventStore} implementations.
 *
 * <p>{@link capi.jdbc.store.AbstractJdbcConversionEventStore} provides shared SQL and row
 * mapping; subclasses supply database-specific claim strategies: H2 (subquery, two-phase)
 * and PostgreSQL ({@code FOR UPDATE SKIP LOCKED ... RETURNING}).
 *
 * @see capi.jdbc.store.AbstractJdbcConversionEventStore
 * @see capi.jdbc.store.H2ConversionEventStore
 * @see capi.jdbc.store.PostgresConversionEventStore
 * @see capi.jdbc.store.JdbcConversionEventStores
 */
package capi.jdbc.store;
