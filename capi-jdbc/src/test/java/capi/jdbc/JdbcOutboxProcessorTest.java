package capi.jdbc;

import capi.credential.AesGcmCredentialCipher;
import capi.credential.CredentialResolver;
import capi.delivery.DeliveryRequest;
import capi.delivery.DeliveryResult;
import capi.event.EventBuilder;
import capi.failed.FailedEventManager;
import capi.health.HealthTracker;
import capi.ingest.ConversionEventWriter;
import capi.ingest.ConversionRequest;
import capi.jdbc.store.H2ConversionEventStore;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import capi.model.HealthStats;
import capi.model.PrivacyMode;
import capi.model.TenantCapiConfig;
import capi.privacy.IdentityField;
import capi.privacy.IdentityHasher;
import capi.privacy.PrivacyPolicy;
import capi.processor.OutboxProcessor;
import capi.processor.ProcessingSummary;
import capi.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Ingest, delivery, failure and requeue against the H2 stores.
 */
class JdbcOutboxProcessorTest {
    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    private static final byte[] MASTER_KEY = new byte[32];

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final H2ConversionEventStore eventStore = new H2ConversionEventStore();
    private final JdbcTenantConfigStore configStore = new JdbcTenantConfigStore();
    private final JdbcHealthStore healthStore = new JdbcHealthStore();
    private final AesGcmCredentialCipher cipher = new AesGcmCredentialCipher(MASTER_KEY, JsonCodec.getDefault());
    private final List<DeliveryRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicReference<Function<DeliveryRequest, DeliveryResult>> responder =
            new AtomicReference<>(r -> new DeliveryResult.Sent(1, "trace-1", "{\"events_received\":1}"));

    private JdbcDataSource dataSource;
    private DataSourceConnectionProvider connections;
    private OutboxProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = JdbcFixtures.h2DataSource();
        connections = new DataSourceConnectionProvider(dataSource);
        try (Connection conn = dataSource.getConnection()) {
            configStore.save(conn, new TenantCapiConfig("org-a", "pixel-a", true, PrivacyMode.CONSERVATIVE, null, null));
            insertCredential(conn, "org-a", cipher.encrypt("token-a", "org-a"));
        }
        processor = OutboxProcessor.builder()
                .connectionProvider(connections)
                .eventStore(eventStore)
                .credentialResolver(CredentialResolver.builder()
                        .connectionProvider(connections)
                        .configStore(configStore)
                        .credentialStore(new JdbcCredentialStore())
                        .cipher(cipher)
                        .build())
                .eventBuilder(EventBuilder.builder()
                        .privacyPolicy(PrivacyPolicy.builder()
                                .conservative(List.of("em", "ph", "zp", "country", "external_id", "fbp", "fbc"))
                                .standard(List.of("em", "ph", "zp", "country", "external_id", "fbp", "fbc",
                                        "fn", "ln", "ct", "st"))
                                .blocked(List.of("employer", "occupation"))
                                .build())
                        .clock(clock)
                        .build())
                .deliveryClient(request -> {
                    requests.add(request);
                    return responder.get().apply(request);
                })
                .healthTracker(new HealthTracker(connections, healthStore, clock))
                .maxAttempts(1)
                .clock(clock)
                .build();
    }

    @AfterEach
    void tearDown() {
        processor.close();
    }

    private static void insertCredential(Connection conn, String org, String blob) throws Exception {
        try (PreparedStatement ps = conn.prepareStatement("INSERT INTO capi_credential"
                + " (organization_id, platform, encrypted_blob, is_active, created_at) VALUES (?,?,?,?,?)")) {
            ps.setString(1, org);
            ps.setString(2, CredentialResolver.DEFAULT_PLATFORM);
            ps.setString(3, blob);
            ps.setBoolean(4, true);
            ps.setTimestamp(5, Timestamp.from(NOW));
            ps.executeUpdate();
        }
    }

    private String enqueue(String sourceId) throws Exception {
        ConversionEventWriter writer = new ConversionEventWriter(eventStore, new IdentityHasher(), clock);
        try (Connection conn = dataSource.getConnection()) {
            return writer.enqueue(conn, ConversionRequest.builder("org-a", sourceId)
                    .eventTime(NOW.minusSeconds(60))
                    .value(new BigDecimal("42.50"))
                    .currency("usd")
                    .identity(IdentityField.EMAIL, " Donor@Example.com ")
                    .identity(IdentityField.FIRST_NAME, "Ada")
                    .build());
        }
    }

    private ConversionEvent only() throws Exception {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT id FROM capi_conversion_event")) {
            try (var rs = ps.executeQuery()) {
                assertTrue(rs.next());
                return eventStore.findById(conn, rs.getString(1)).orElseThrow();
            }
        }
    }

    @Test
    void enqueuedEventIsDeliveredOnce() throws Exception {
        String eventId = enqueue("txn-1");

        ProcessingSummary summary = processor.process();

        assertEquals(1, summary.sent());
        assertEquals(1, requests.size());
        DeliveryRequest request = requests.get(0);
        assertEquals("pixel-a", request.destinationId());
        assertEquals("token-a", request.body().get("access_token"));
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = ((List<Map<String, Object>>) request.body().get("data")).get(0);
        assertEquals(eventId, payload.get("event_id"));
        @SuppressWarnings("unchecked")
        Map<String, Object> userData = (Map<String, Object>) payload.get("user_data");
        assertTrue(userData.containsKey("em"));
        assertFalse(userData.containsKey("fn"));

        ConversionEvent stored = only();
        assertEquals(EventStatus.SENT, stored.status());
        assertEquals(NOW, stored.deliveredAt());

        assertEquals(0, processor.process().processed());
        assertEquals(1, requests.size());
        HealthStats stats = new HealthTracker(connections, healthStore, clock).stats("org-a");
        assertEquals(1, stats.successCount());
    }

    @Test
    void exhaustedEventCanBeRequeuedAndDelivered() throws Exception {
        responder.set(r -> new DeliveryResult.Rejected(400, "Invalid parameter", "{}"));
        enqueue("txn-1");

        processor.process();

        ConversionEvent failed = only();
        assertEquals(EventStatus.FAILED, failed.status());
        assertTrue(failed.lastError().contains("Invalid parameter"));

        FailedEventManager manager = new FailedEventManager(connections, eventStore, clock);
        assertEquals(1, manager.count("org-a"));
        assertTrue(manager.requeue(failed.id()));

        responder.set(r -> new DeliveryResult.Sent(1, "trace-2", "{\"events_received\":1}"));
        assertEquals(1, processor.process().sent());
        assertEquals(EventStatus.SENT, only().status());
        assertEquals(2, requests.size());
        assertEquals(requests.get(0).body().get("data"), requests.get(1).body().get("data"));

        HealthStats stats = new HealthTracker(connections, healthStore, clock).stats("org-a");
        assertEquals(1, stats.successCount());
        assertEquals(1, stats.failureCount());
        assertEquals(0, stats.consecutiveFailures());
    }
}
