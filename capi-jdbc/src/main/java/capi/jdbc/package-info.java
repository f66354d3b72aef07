/**
 * JDBC implementations of the tenant-facing stores and shared JDBC helpers.
 *
 * <p>Conversion event stores live in {@link capi.jdbc.store}. DDL for H2 and PostgreSQL
 * ships as classpath resources under {@code /schema}.
 */
package capi.jdbc;
