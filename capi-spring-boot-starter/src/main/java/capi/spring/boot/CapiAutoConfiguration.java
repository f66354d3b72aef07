package capi.spring.boot;

import capi.credential.AesGcmCredentialCipher;
import capi.credential.CredentialCipher;
import capi.credential.CredentialResolver;
import capi.delivery.ConversionsEndpoint;
import capi.delivery.DeliveryClient;
import capi.diagnostics.EventDiagnostics;
import capi.event.EventBuilder;
import capi.failed.FailedEventManager;
import capi.health.HealthTracker;
import capi.ingest.ConversionEventWriter;
import capi.jdbc.DataSourceConnectionProvider;
import capi.jdbc.JdbcCredentialStore;
import capi.jdbc.JdbcHealthStore;
import capi.jdbc.JdbcTenantConfigStore;
import capi.jdbc.TableNames;
import capi.jdbc.store.AbstractJdbcConversionEventStore;
import capi.jdbc.store.JdbcConversionEventStores;
import capi.privacy.IdentityHasher;
import capi.privacy.PrivacyPolicy;
import capi.processor.OutboxProcessor;
import capi.retry.ExponentialBackoffRetryPolicy;
import capi.retry.RetryPolicy;
import capi.spi.ConnectionProvider;
import capi.spi.CredentialStore;
import capi.spi.HealthStore;
import capi.spi.MetricsExporter;
import capi.spi.TenantConfigStore;
import capi.spring.RestTemplateDeliveryClient;
import capi.spring.SpringConversionEventWriter;
import capi.util.JsonCodec;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for conversion event delivery.
 *
 * <p>Wires the stores, credential resolver, payload builder, delivery client and
 * {@link OutboxProcessor} from a {@link DataSource} and {@link CapiProperties}.
 * Every bean backs off when the application defines its own.
 *
 * @see CapiProperties
 * @see CapiMicrometerAutoConfiguration
 * @see CapiWebAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(OutboxProcessor.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(CapiProperties.class)
public class CapiAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public JsonCodec capiJsonCodec() {
    return JsonCodec.getDefault();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcConversionEventStore conversionEventStore(DataSource dataSource, CapiProperties props,
      JsonCodec jsonCodec) {
    return JdbcConversionEventStores.detect(dataSource, props.getTableName(), jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TenantConfigStore.class)
  public JdbcTenantConfigStore tenantConfigStore() {
    return new JdbcTenantConfigStore();
  }

  @Bean
  @ConditionalOnMissingBean(CredentialStore.class)
  public JdbcCredentialStore credentialStore(JsonCodec jsonCodec) {
    return new JdbcCredentialStore(TableNames.CREDENTIAL_TABLE, jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean(HealthStore.class)
  public JdbcHealthStore healthStore() {
    return new JdbcHealthStore();
  }

  @Bean
  @ConditionalOnMissingBean(CredentialCipher.class)
  @ConditionalOnExpression("'${capi.credentials.master-key:}' != ''")
  public AesGcmCredentialCipher credentialCipher(CapiProperties props, JsonCodec jsonCodec) {
    return AesGcmCredentialCipher.fromBase64(props.getCredentials().getMasterKey(), jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean
  public CredentialResolver credentialResolver(CapiProperties props, ConnectionProvider connectionProvider,
      TenantConfigStore tenantConfigStore, CredentialStore credentialStore,
      ObjectProvider<CredentialCipher> cipherProvider) {
    return CredentialResolver.builder()
        .connectionProvider(connectionProvider)
        .configStore(tenantConfigStore)
        .credentialStore(credentialStore)
        .cipher(cipherProvider.getIfAvailable())
        .platform(props.getCredentials().getPlatform())
        .fallbackToken(props.getCredentials().getFallbackToken())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public PrivacyPolicy privacyPolicy(CapiProperties props) {
    CapiProperties.Privacy privacy = props.getPrivacy();
    return PrivacyPolicy.builder()
        .conservative(privacy.getConservative())
        .standard(privacy.getStandard())
        .blocked(privacy.getBlocked())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public IdentityHasher identityHasher(CapiProperties props) {
    return new IdentityHasher(props.getPrivacy().getDefaultCountry());
  }

  @Bean
  @ConditionalOnMissingBean
  public EventBuilder eventBuilder(PrivacyPolicy privacyPolicy, CapiProperties props) {
    return EventBuilder.builder()
        .privacyPolicy(privacyPolicy)
        .maxEventAge(props.getPrivacy().getMaxEventAge())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public ConversionsEndpoint conversionsEndpoint(CapiProperties props) {
    return new ConversionsEndpoint(props.getEndpoint().getBaseUrl(), props.getEndpoint().getApiVersion());
  }

  @Bean
  @ConditionalOnMissingBean(DeliveryClient.class)
  public RestTemplateDeliveryClient deliveryClient(ConversionsEndpoint endpoint, CapiProperties props,
      JsonCodec jsonCodec) {
    return new RestTemplateDeliveryClient(
        RestTemplateDeliveryClient.restTemplate(
            props.getEndpoint().getConnectTimeout(), props.getEndpoint().getReadTimeout()),
        endpoint, jsonCodec);
  }

  @Bean
  @ConditionalOnMissingBean
  public HealthTracker healthTracker(ConnectionProvider connectionProvider, HealthStore healthStore) {
    return new HealthTracker(connectionProvider, healthStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy retryPolicy(CapiProperties props) {
    return new ExponentialBackoffRetryPolicy(props.getRetry().getBaseDelay(), props.getRetry().getMaxDelay());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public OutboxProcessor outboxProcessor(CapiProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcConversionEventStore eventStore,
      CredentialResolver credentialResolver,
      EventBuilder eventBuilder,
      DeliveryClient deliveryClient,
      HealthTracker healthTracker,
      RetryPolicy retryPolicy,
      ObjectProvider<MetricsExporter> metricsProvider) {

    CapiProperties.Outbox outbox = props.getOutbox();
    var builder = OutboxProcessor.builder()
        .connectionProvider(connectionProvider)
        .eventStore(eventStore)
        .credentialResolver(credentialResolver)
        .eventBuilder(eventBuilder)
        .deliveryClient(deliveryClient)
        .healthTracker(healthTracker)
        .retryPolicy(retryPolicy)
        .maxAttempts(outbox.getMaxAttempts())
        .batchSize(outbox.getBatchSize())
        .leaseTimeout(outbox.getLeaseTimeout())
        .tenantParallelism(outbox.getTenantParallelism())
        .perTenantConcurrency(outbox.getPerTenantConcurrency())
        .drainTimeoutMs(outbox.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (outbox.getInstanceId() != null && !outbox.getInstanceId().isEmpty()) {
      builder.instanceId(outbox.getInstanceId());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventDiagnostics eventDiagnostics(ConnectionProvider connectionProvider,
      AbstractJdbcConversionEventStore eventStore, CredentialResolver credentialResolver,
      EventBuilder eventBuilder, ConversionsEndpoint endpoint) {
    return new EventDiagnostics(connectionProvider, eventStore, credentialResolver, eventBuilder, endpoint);
  }

  @Bean
  @ConditionalOnMissingBean
  public FailedEventManager failedEventManager(ConnectionProvider connectionProvider,
      AbstractJdbcConversionEventStore eventStore) {
    return new FailedEventManager(connectionProvider, eventStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public ConversionEventWriter conversionEventWriter(AbstractJdbcConversionEventStore eventStore,
      IdentityHasher identityHasher) {
    return new ConversionEventWriter(eventStore, identityHasher);
  }

  @Bean
  @ConditionalOnMissingBean
  public SpringConversionEventWriter springConversionEventWriter(DataSource dataSource,
      ConversionEventWriter conversionEventWriter) {
    return new SpringConversionEventWriter(dataSource, conversionEventWriter);
  }
}
