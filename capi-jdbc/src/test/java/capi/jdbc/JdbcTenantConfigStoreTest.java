package capi.jdbc;

import capi.model.PrivacyMode;
import capi.model.TenantCapiConfig;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTenantConfigStoreTest {

    private JdbcDataSource dataSource;
    private final JdbcTenantConfigStore store = new JdbcTenantConfigStore();

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = JdbcFixtures.h2DataSource();
    }

    @Test
    void missingTenantIsEmpty() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertTrue(store.find(conn, "org-x").isEmpty());
        }
    }

    @Test
    void saveAndFindRoundTrip() throws Exception {
        TenantCapiConfig config = new TenantCapiConfig("org-a", "pixel-1", true, PrivacyMode.STANDARD,
                "TEST123", Set.of("em", "ph"));

        try (Connection conn = dataSource.getConnection()) {
            store.save(conn, config);
            TenantCapiConfig loaded = store.find(conn, "org-a").orElseThrow();

            assertEquals("pixel-1", loaded.destinationId());
            assertTrue(loaded.enabled());
            assertEquals(PrivacyMode.STANDARD, loaded.privacyMode());
            assertEquals("TEST123", loaded.testEventCode());
            assertEquals(Set.of("em", "ph"), loaded.fieldAllowList());
        }
    }

    @Test
    void saveReplacesExistingConfig() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            store.save(conn, new TenantCapiConfig("org-a", "pixel-1", true, PrivacyMode.STANDARD, null, null));
            store.save(conn, new TenantCapiConfig("org-a", "pixel-2", false, PrivacyMode.CONSERVATIVE, null, null));

            TenantCapiConfig loaded = store.find(conn, "org-a").orElseThrow();
            assertEquals("pixel-2", loaded.destinationId());
            assertFalse(loaded.enabled());
            assertNull(loaded.fieldAllowList());
        }
    }

    @Test
    void legacyAndUnknownModesAreMapped() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("INSERT INTO capi_tenant_config (organization_id, destination_id, enabled, privacy_mode,"
                    + " field_allow_list) VALUES ('org-a', 'p', TRUE, 'balanced', ' em , ,ph ')");
            stmt.execute("INSERT INTO capi_tenant_config (organization_id, destination_id, enabled, privacy_mode)"
                    + " VALUES ('org-b', 'p', TRUE, 'aggressive')");

            TenantCapiConfig a = store.find(conn, "org-a").orElseThrow();
            assertEquals(PrivacyMode.STANDARD, a.privacyMode());
            assertEquals(Set.of("em", "ph"), a.fieldAllowList());
            assertEquals(PrivacyMode.CONSERVATIVE, store.find(conn, "org-b").orElseThrow().privacyMode());
        }
    }

    @Test
    void blankAllowListMeansNoOverride() {
        assertNull(JdbcTenantConfigStore.parseAllowList("  "));
        assertNull(JdbcTenantConfigStore.parseAllowList(null));
    }
}
