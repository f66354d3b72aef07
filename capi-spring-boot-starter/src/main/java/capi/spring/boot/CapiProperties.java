package capi.spring.boot;

import capi.credential.CredentialResolver;
import capi.delivery.ConversionsEndpoint;
import capi.jdbc.TableNames;
import capi.privacy.IdentityHasher;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for conversion event delivery.
 *
 * @see CapiAutoConfiguration
 */
@ConfigurationProperties(prefix = "capi")
public class CapiProperties {

    /**
     * Database table name for conversion events.
     */
    private String tableName = TableNames.EVENT_TABLE;

    private final Outbox outbox = new Outbox();
    private final Retry retry = new Retry();
    private final Endpoint endpoint = new Endpoint();
    private final Credentials credentials = new Credentials();
    private final Privacy privacy = new Privacy();
    private final Trigger trigger = new Trigger();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public Retry getRetry() {
        return retry;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public Privacy getPrivacy() {
        return privacy;
    }

    public Trigger getTrigger() {
        return trigger;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Outbox {
        private int batchSize = 50;
        private int maxAttempts = 5;
        private Duration leaseTimeout = Duration.ofMinutes(10);
        private int tenantParallelism = 4;
        private int perTenantConcurrency = 2;
        private long drainTimeoutMs = 5000;
        private String instanceId = "";

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getLeaseTimeout() {
            return leaseTimeout;
        }

        public void setLeaseTimeout(Duration leaseTimeout) {
            this.leaseTimeout = leaseTimeout;
        }

        public int getTenantParallelism() {
            return tenantParallelism;
        }

        public void setTenantParallelism(int tenantParallelism) {
            this.tenantParallelism = tenantParallelism;
        }

        public int getPerTenantConcurrency() {
            return perTenantConcurrency;
        }

        public void setPerTenantConcurrency(int perTenantConcurrency) {
            this.perTenantConcurrency = perTenantConcurrency;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public String getInstanceId() {
            return instanceId;
        }

        public void setInstanceId(String instanceId) {
            this.instanceId = instanceId;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofMinutes(5);
        private Duration maxDelay = Duration.ofMinutes(60);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Endpoint {
        private String baseUrl = ConversionsEndpoint.DEFAULT_BASE_URL;
        private String apiVersion = ConversionsEndpoint.DEFAULT_API_VERSION;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiVersion() {
            return apiVersion;
        }

        public void setApiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    public static class Credentials {
        private String platform = CredentialResolver.DEFAULT_PLATFORM;

        /**
         * Token used for tenants without a usable credential of their own.
         */
        private String fallbackToken = "";

        /**
         * Base64 master key (at least 32 bytes) for encrypted credential records.
         */
        private String masterKey = "";

        public String getPlatform() {
            return platform;
        }

        public void setPlatform(String platform) {
            this.platform = platform;
        }

        public String getFallbackToken() {
            return fallbackToken;
        }

        public void setFallbackToken(String fallbackToken) {
            this.fallbackToken = fallbackToken;
        }

        public String getMasterKey() {
            return masterKey;
        }

        public void setMasterKey(String masterKey) {
            this.masterKey = masterKey;
        }
    }

    public static class Privacy {
        private List<String> conservative = new ArrayList<>(
                List.of("em", "ph", "zp", "country", "external_id", "fbp", "fbc"));
        private List<String> standard = new ArrayList<>(
                List.of("em", "ph", "zp", "country", "external_id", "fbp", "fbc", "fn", "ln", "ct", "st"));
        private List<String> blocked = new ArrayList<>(
                List.of("employer", "occupation", "addr1", "address", "street"));
        private String defaultCountry = IdentityHasher.DEFAULT_COUNTRY;
        private Duration maxEventAge = Duration.ofDays(7);

        public List<String> getConservative() {
            return conservative;
        }

        public void setConservative(List<String> conservative) {
            this.conservative = conservative;
        }

        public List<String> getStandard() {
            return standard;
        }

        public void setStandard(List<String> standard) {
            this.standard = standard;
        }

        public List<String> getBlocked() {
            return blocked;
        }

        public void setBlocked(List<String> blocked) {
            this.blocked = blocked;
        }

        public String getDefaultCountry() {
            return defaultCountry;
        }

        public void setDefaultCountry(String defaultCountry) {
            this.defaultCountry = defaultCountry;
        }

        public Duration getMaxEventAge() {
            return maxEventAge;
        }

        public void setMaxEventAge(Duration maxEventAge) {
            this.maxEventAge = maxEventAge;
        }
    }

    public static class Trigger {
        private boolean enabled = true;

        /**
         * Bearer token accepted by the processing trigger only.
         */
        private String schedulerToken = "";

        /**
         * Bearer token accepted by every endpoint.
         */
        private String adminToken = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchedulerToken() {
            return schedulerToken;
        }

        public void setSchedulerToken(String schedulerToken) {
            this.schedulerToken = schedulerToken;
        }

        public String getAdminToken() {
            return adminToken;
        }

        public void setAdminToken(String adminToken) {
            this.adminToken = adminToken;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "capi";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
