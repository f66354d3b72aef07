package capi.spi;

import capi.model.TenantCapiConfig;

import java.sql.Connection;
import java.util.Optional;

/**
 * Read access to per-tenant destination configuration.
 */
public interface TenantConfigStore {

    Optional<TenantCapiConfig> find(Connection conn, String organizationId);
}
