package capi.spi;

import capi.model.TenantCredential;

import java.sql.Connection;
import java.util.Optional;

/**
 * Read access to stored destination credentials.
 */
public interface CredentialStore {

    /**
     * Finds the active credential for a tenant on the given platform.
     *
     * @param conn           the JDBC connection
     * @param organizationId tenant id
     * @param platform       credential platform key, e.g. {@code meta_capi}
     * @return the credential, or empty if none is active
     */
    Optional<TenantCredential> findActive(Connection conn, String organizationId, String platform);
}
