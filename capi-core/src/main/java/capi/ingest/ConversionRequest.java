package capi.ingest;

import capi.privacy.IdentityField;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A completed transaction to be queued for delivery, carrying raw identity fields.
 *
 * <p>Raw identity lives only in this object; {@link ConversionEventWriter} hashes it before
 * anything is stored.
 */
public final class ConversionRequest {
    public static final String DEFAULT_EVENT_NAME = "Purchase";

    private final String organizationId;
    private final String sourceId;
    private final String eventName;
    private final String eventId;
    private final Instant eventTime;
    private final BigDecimal value;
    private final String currency;
    private final String eventSourceUrl;
    private final Map<IdentityField, String> identity;
    private final Map<String, Object> customData;
    private final String fbp;
    private final String fbc;
    private final String externalId;
    private final String clientIpAddress;
    private final String clientUserAgent;
    private final String destinationId;
    private final boolean enrichmentOnly;

    private ConversionRequest(Builder builder) {
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId");
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId");
        if (organizationId.isBlank() || sourceId.isBlank()) {
            throw new IllegalArgumentException("organizationId and sourceId cannot be blank");
        }
        this.eventName = builder.eventName == null ? DEFAULT_EVENT_NAME : builder.eventName;
        this.eventId = builder.eventId;
        if (builder.enrichmentOnly && builder.eventId != null) {
            throw new IllegalArgumentException("Enrichment events derive their eventId; do not set one");
        }
        this.eventTime = Objects.requireNonNull(builder.eventTime, "eventTime");
        this.value = Objects.requireNonNull(builder.value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value cannot be negative: " + value);
        }
        this.currency = builder.currency;
        this.eventSourceUrl = builder.eventSourceUrl;
        this.identity = Collections.unmodifiableMap(new EnumMap<>(builder.identity));
        this.customData = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customData));
        this.fbp = builder.fbp;
        this.fbc = builder.fbc;
        this.externalId = builder.externalId;
        this.clientIpAddress = builder.clientIpAddress;
        this.clientUserAgent = builder.clientUserAgent;
        this.destinationId = builder.destinationId;
        this.enrichmentOnly = builder.enrichmentOnly;
    }

    /**
     * Starts a request for one upstream transaction.
     *
     * @param organizationId owning tenant
     * @param sourceId       upstream transaction id
     */
    public static Builder builder(String organizationId, String sourceId) {
        return new Builder(organizationId, sourceId);
    }

    public String organizationId() {
        return organizationId;
    }

    public String sourceId() {
        return sourceId;
    }

    public String eventName() {
        return eventName;
    }

    /**
     * Caller-supplied event id, or {@code null} to have one generated.
     */
    public String eventId() {
        return eventId;
    }

    public Instant eventTime() {
        return eventTime;
    }

    public BigDecimal value() {
        return value;
    }

    public String currency() {
        return currency;
    }

    public String eventSourceUrl() {
        return eventSourceUrl;
    }

    public Map<IdentityField, String> identity() {
        return identity;
    }

    public Map<String, Object> customData() {
        return customData;
    }

    public String fbp() {
        return fbp;
    }

    public String fbc() {
        return fbc;
    }

    public String externalId() {
        return externalId;
    }

    public String clientIpAddress() {
        return clientIpAddress;
    }

    public String clientUserAgent() {
        return clientUserAgent;
    }

    public String destinationId() {
        return destinationId;
    }

    public boolean enrichmentOnly() {
        return enrichmentOnly;
    }

    @Override
    public String toString() {
        return "ConversionRequest{organizationId=" + organizationId + ", sourceId=" + sourceId
                + ", eventName=" + eventName + ", enrichmentOnly=" + enrichmentOnly + "}";
    }

    public static final class Builder {
        private final String organizationId;
        private final String sourceId;
        private String eventName;
        private String eventId;
        private Instant eventTime;
        private BigDecimal value;
        private String currency;
        private String eventSourceUrl;
        private final Map<IdentityField, String> identity = new EnumMap<>(IdentityField.class);
        private final Map<String, Object> customData = new LinkedHashMap<>();
        private String fbp;
        private String fbc;
        private String externalId;
        private String clientIpAddress;
        private String clientUserAgent;
        private String destinationId;
        private boolean enrichmentOnly;

        private Builder(String organizationId, String sourceId) {
            this.organizationId = organizationId;
            this.sourceId = sourceId;
        }

        public Builder eventName(String eventName) {
            this.eventName = eventName;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder eventTime(Instant eventTime) {
            this.eventTime = eventTime;
            return this;
        }

        public Builder value(BigDecimal value) {
            this.value = value;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder eventSourceUrl(String eventSourceUrl) {
            this.eventSourceUrl = eventSourceUrl;
            return this;
        }

        /**
         * Sets one raw identity field. Blank values are ignored.
         */
        public Builder identity(IdentityField field, String raw) {
            Objects.requireNonNull(field, "field");
            if (raw != null && !raw.isBlank()) {
                identity.put(field, raw);
            }
            return this;
        }

        /**
         * Adds extra {@code custom_data} entries such as order or campaign ids.
         * {@code value} and {@code currency} are set through their own methods.
         */
        public Builder customData(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if ("value".equals(key) || "currency".equals(key)) {
                throw new IllegalArgumentException("Use value()/currency() for " + key);
            }
            if (value != null) {
                customData.put(key, value);
            }
            return this;
        }

        public Builder fbp(String fbp) {
            this.fbp = fbp;
            return this;
        }

        public Builder fbc(String fbc) {
            this.fbc = fbc;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder clientIpAddress(String clientIpAddress) {
            this.clientIpAddress = clientIpAddress;
            return this;
        }

        public Builder clientUserAgent(String clientUserAgent) {
            this.clientUserAgent = clientUserAgent;
            return this;
        }

        public Builder destinationId(String destinationId) {
            this.destinationId = destinationId;
            return this;
        }

        public Builder enrichmentOnly(boolean enrichmentOnly) {
            this.enrichmentOnly = enrichmentOnly;
            return this;
        }

        public ConversionRequest build() {
            return new ConversionRequest(this);
        }
    }
}
