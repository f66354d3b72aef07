package capi.processor;

import capi.credential.CredentialResolutionException;
import capi.credential.CredentialResolver;
import capi.credential.ResolvedCredentials;
import capi.credential.TenantNotConfiguredException;
import capi.delivery.DeliveryClient;
import capi.delivery.DeliveryRequest;
import capi.delivery.DeliveryResult;
import capi.event.ConversionPayload;
import capi.event.EventBuilder;
import capi.event.EventIds;
import capi.event.PayloadValidationException;
import capi.health.HealthTracker;
import capi.model.ConversionEvent;
import capi.model.EventStatus;
import capi.retry.ExponentialBackoffRetryPolicy;
import capi.retry.RetryPolicy;
import capi.retry.RetrySchedule;
import capi.spi.ConnectionProvider;
import capi.spi.ConversionEventStore;
import capi.spi.MetricsExporter;
import capi.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drains due conversion events to the destination, one bounded batch per {@link #process()} call.
 *
 * <p>A pass claims up to {@code batchSize} due events, stamping each RETRYING with a lease that
 * expires after {@code leaseTimeout}. Events are grouped by tenant; tenants run concurrently on
 * a bounded pool and each tenant's sends are limited to {@code perTenantConcurrency} at a time.
 * Credentials are resolved once per tenant. Every claimed event leaves the pass SENT, PENDING
 * with a backoff, or FAILED; a tenant whose configuration cannot be read spends an attempt.
 *
 * <p>Outcome writes only apply while the pass still owns the lease, so a slow pass cannot
 * overwrite the result of a newer one. Scheduling is external: the processor has no timer.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} to release its worker pools.
 */
public final class OutboxProcessor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxProcessor.class.getName());

  static final String INVALID_PAYLOAD_PREFIX = "Invalid payload: ";

  private final ConnectionProvider connectionProvider;
  private final ConversionEventStore eventStore;
  private final CredentialResolver credentialResolver;
  private final EventBuilder eventBuilder;
  private final DeliveryClient deliveryClient;
  private final HealthTracker healthTracker;
  private final RetrySchedule retrySchedule;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int batchSize;
  private final Duration leaseTimeout;
  private final int perTenantConcurrency;
  private final String instanceId;
  private final long drainTimeoutMs;
  private final ExecutorService tenantWorkers;
  private final ExecutorService deliveryWorkers;

  private OutboxProcessor(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.eventStore = Objects.requireNonNull(builder.eventStore, "eventStore");
    this.credentialResolver = Objects.requireNonNull(builder.credentialResolver, "credentialResolver");
    this.eventBuilder = Objects.requireNonNull(builder.eventBuilder, "eventBuilder");
    this.deliveryClient = Objects.requireNonNull(builder.deliveryClient, "deliveryClient");
    this.healthTracker = Objects.requireNonNull(builder.healthTracker, "healthTracker");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.leaseTimeout = Objects.requireNonNull(builder.leaseTimeout, "leaseTimeout");
    this.instanceId = builder.instanceId != null ? builder.instanceId : "capi-" + EventIds.recordId();
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (builder.tenantParallelism < 1 || builder.perTenantConcurrency < 1) {
      throw new IllegalArgumentException("tenantParallelism and perTenantConcurrency must be >= 1");
    }
    if (leaseTimeout.isNegative() || leaseTimeout.isZero()) {
      throw new IllegalArgumentException("leaseTimeout must be > 0");
    }
    this.batchSize = builder.batchSize;
    this.perTenantConcurrency = builder.perTenantConcurrency;
    this.retrySchedule = new RetrySchedule(
        builder.retryPolicy != null ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(),
        builder.maxAttempts, clock);

    this.tenantWorkers = Executors.newFixedThreadPool(builder.tenantParallelism,
        new DaemonThreadFactory("capi-tenant-"));
    this.deliveryWorkers = Executors.newFixedThreadPool(builder.tenantParallelism * builder.perTenantConcurrency,
        new DaemonThreadFactory("capi-delivery-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one processing pass and blocks until every claimed event has an outcome.
   *
   * @return counts for the pass
   * @throws OutboxProcessingException if due events cannot be selected
   */
  public ProcessingSummary process() {
    long startNanos = System.nanoTime();
    Instant now = clock.instant();
    String ownerId = instanceId + ":" + EventIds.recordId();

    List<ConversionEvent> claimed;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      claimed = eventStore.claimDue(conn, ownerId, now, now.plus(leaseTimeout),
          retrySchedule.maxAttempts(), batchSize);
    } catch (SQLException | RuntimeException e) {
      throw new OutboxProcessingException("Failed to select due conversion events", e);
    }
    if (claimed.isEmpty()) {
      Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
      metrics.recordBatch(0, duration.toMillis());
      return ProcessingSummary.empty(duration);
    }

    Map<String, List<ConversionEvent>> byTenant = new LinkedHashMap<>();
    for (ConversionEvent event : claimed) {
      byTenant.computeIfAbsent(event.organizationId(), k -> new ArrayList<>()).add(event);
    }

    PassTally tally = new PassTally();
    List<Future<?>> tenantTasks = new ArrayList<>(byTenant.size());
    byTenant.forEach((organizationId, events) ->
        tenantTasks.add(tenantWorkers.submit(() -> processTenant(organizationId, events, ownerId, tally))));
    awaitAll(tenantTasks, "tenant");

    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
    metrics.recordBatch(claimed.size(), duration.toMillis());
    ProcessingSummary summary = new ProcessingSummary(claimed.size(), tally.sent.get(), tally.failed.get(),
        byTenant.size(), duration);
    logger.log(Level.INFO, "Processed " + summary.processed() + " conversion events for "
        + summary.tenants() + " tenants: sent=" + summary.sent() + ", failed=" + summary.failed()
        + ", durationMs=" + duration.toMillis());
    return summary;
  }

  private void processTenant(String organizationId, List<ConversionEvent> events, String ownerId, PassTally tally) {
    ResolvedCredentials credentials;
    try {
      credentials = credentialResolver.resolve(organizationId);
    } catch (TenantNotConfiguredException e) {
      logger.log(Level.WARNING, e.getMessage() + "; failing " + events.size() + " events");
      for (ConversionEvent event : events) {
        failTerminal(event, ownerId, e.getMessage());
        tally.failed.incrementAndGet();
      }
      healthTracker.recordFailure(organizationId, e.getMessage());
      return;
    } catch (CredentialResolutionException e) {
      noCredentials(organizationId, events, ownerId, tally, e);
      return;
    } catch (SQLException | RuntimeException e) {
      String error = "Credential lookup failed for organization " + organizationId + ": " + e;
      logger.log(Level.SEVERE, error + "; deferring " + events.size() + " events", e);
      for (ConversionEvent event : events) {
        failWithBackoff(event, ownerId, error, null);
        tally.failed.incrementAndGet();
      }
      healthTracker.recordFailure(organizationId, error);
      return;
    }

    Semaphore permits = new Semaphore(perTenantConcurrency);
    List<Future<?>> sends = new ArrayList<>(events.size());
    try {
      for (ConversionEvent event : events) {
        permits.acquire();
        sends.add(deliveryWorkers.submit(() -> {
          try {
            deliver(event, credentials, ownerId, tally);
          } finally {
            permits.release();
          }
        }));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while dispatching events for organization " + organizationId);
    }
    awaitAll(sends, "delivery");
  }

  private void noCredentials(String organizationId, List<ConversionEvent> events, String ownerId,
      PassTally tally, CredentialResolutionException e) {
    logger.log(Level.WARNING, e.getMessage() + "; deferring " + events.size() + " events");
    metrics.incrementNoCredentials();
    for (ConversionEvent event : events) {
      failWithBackoff(event, ownerId, e.getMessage(), null);
      tally.failed.incrementAndGet();
    }
    healthTracker.recordFailure(organizationId, e.getMessage());
  }

  private void deliver(ConversionEvent event, ResolvedCredentials credentials, String ownerId, PassTally tally) {
    ConversionPayload payload;
    try {
      payload = eventBuilder.build(event, credentials);
    } catch (PayloadValidationException e) {
      logger.log(Level.WARNING, "Invalid payload for event " + event.id() + ": " + e.getMessage());
      failTerminal(event, ownerId, INVALID_PAYLOAD_PREFIX + e.getMessage());
      healthTracker.recordFailure(event.organizationId(), e.getMessage());
      tally.failed.incrementAndGet();
      return;
    }

    DeliveryResult result;
    try {
      result = deliveryClient.send(new DeliveryRequest(payload.destinationId(),
          EventBuilder.requestBody(payload, credentials.accessToken(), credentials.testEventCode())));
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Delivery client threw for event " + event.id(), e);
      result = new DeliveryResult.TransportError(null, e.toString(), null);
    }

    if (result instanceof DeliveryResult.Sent sent) {
      Instant deliveredAt = clock.instant();
      withConnection("mark SENT", event.id(),
          conn -> eventStore.markSent(conn, event.id(), ownerId, deliveredAt, sent.responseBody()));
      healthTracker.recordSuccess(event.organizationId());
      metrics.incrementDeliverySuccess();
      tally.sent.incrementAndGet();
      logger.log(Level.FINE, "Sent event " + event.id() + " (event_id=" + payload.eventId() + ")");
    } else {
      failWithBackoff(event, ownerId, result.describe(), result.responseBody());
      healthTracker.recordFailure(event.organizationId(), result.describe());
      tally.failed.incrementAndGet();
    }
  }

  private void failWithBackoff(ConversionEvent event, String ownerId, String error, String response) {
    int attempts = event.retryCount() + 1;
    if (retrySchedule.isTerminal(attempts)) {
      withConnection("mark FAILED", event.id(), conn -> eventStore.markFailed(conn, event.id(), ownerId,
          EventStatus.FAILED, attempts, null, error, response));
      metrics.incrementDeliveryTerminal();
      logger.log(Level.WARNING, "Event " + event.id() + " failed after " + attempts + " attempts: " + error);
    } else {
      Instant nextRetryAt = retrySchedule.nextRetryAt(attempts);
      withConnection("mark PENDING", event.id(), conn -> eventStore.markFailed(conn, event.id(), ownerId,
          EventStatus.PENDING, attempts, nextRetryAt, error, response));
      metrics.incrementDeliveryFailure();
    }
  }

  private void failTerminal(ConversionEvent event, String ownerId, String error) {
    int attempts = Math.max(event.retryCount(), retrySchedule.maxAttempts());
    withConnection("mark FAILED", event.id(), conn -> eventStore.markFailed(conn, event.id(), ownerId,
        EventStatus.FAILED, attempts, null, error, null));
    metrics.incrementDeliveryTerminal();
  }

  private void withConnection(String action, String id, StoreAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      if (op.execute(conn) == 0) {
        logger.log(Level.WARNING, "Lease lost before " + action + " for event " + id + "; outcome discarded");
      }
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for event " + id, e);
    }
  }

  private void awaitAll(List<Future<?>> futures, String kind) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Unexpected " + kind + " task failure", e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while waiting for " + kind + " tasks");
        return;
      }
    }
  }

  @FunctionalInterface
  private interface StoreAction {
    int execute(Connection conn) throws SQLException;
  }

  private static final class PassTally {
    final AtomicInteger sent = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
  }

  /**
   * Stops the worker pools, waiting up to the drain timeout for a running pass to finish.
   */
  @Override
  public void close() {
    tenantWorkers.shutdown();
    deliveryWorkers.shutdown();
    try {
      if (!tenantWorkers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown of tenant workers");
        tenantWorkers.shutdownNow();
      }
      if (!deliveryWorkers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown of delivery workers");
        deliveryWorkers.shutdownNow();
      }
    } catch (InterruptedException e) {
      tenantWorkers.shutdownNow();
      deliveryWorkers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link OutboxProcessor}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private ConversionEventStore eventStore;
    private CredentialResolver credentialResolver;
    private EventBuilder eventBuilder;
    private DeliveryClient deliveryClient;
    private HealthTracker healthTracker;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxAttempts = RetrySchedule.DEFAULT_MAX_ATTEMPTS;
    private int batchSize = 50;
    private Duration leaseTimeout = Duration.ofMinutes(10);
    private int tenantParallelism = 4;
    private int perTenantConcurrency = 2;
    private String instanceId;
    private long drainTimeoutMs = 30_000;

    private Builder() {}

    /**
     * Sets the connection provider used for claims and status updates.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the event store used to claim events and record outcomes.
     *
     * <p><b>Required.</b>
     *
     * @param eventStore the persistence backend
     * @return this builder
     */
    public Builder eventStore(ConversionEventStore eventStore) {
      this.eventStore = eventStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param credentialResolver resolves each tenant's configuration and token
     * @return this builder
     */
    public Builder credentialResolver(CredentialResolver credentialResolver) {
      this.credentialResolver = credentialResolver;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param eventBuilder builds destination payloads
     * @return this builder
     */
    public Builder eventBuilder(EventBuilder eventBuilder) {
      this.eventBuilder = eventBuilder;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param deliveryClient sends payloads to the destination
     * @return this builder
     */
    public Builder deliveryClient(DeliveryClient deliveryClient) {
      this.deliveryClient = deliveryClient;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param healthTracker records per-tenant outcomes
     * @return this builder
     */
    public Builder healthTracker(HealthTracker healthTracker) {
      this.healthTracker = healthTracker;
      return this;
    }

    /**
     * Sets the retry policy that computes the delay after a failed attempt.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 5 minute base
     * and a 60 minute ceiling.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the number of attempts after which an event is marked FAILED.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts per event
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the maximum number of events claimed per pass.
     *
     * <p>Optional. Defaults to {@code 50}.
     *
     * @param batchSize events per pass
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets how long a claimed event stays invisible to other passes.
     * A crashed pass's events become eligible again once this elapses.
     *
     * <p>Optional. Defaults to 10 minutes.
     *
     * @param leaseTimeout lease duration
     * @return this builder
     */
    public Builder leaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = leaseTimeout;
      return this;
    }

    /**
     * Sets how many tenants are processed concurrently.
     *
     * <p>Optional. Defaults to {@code 4}.
     *
     * @param tenantParallelism concurrent tenants
     * @return this builder
     */
    public Builder tenantParallelism(int tenantParallelism) {
      this.tenantParallelism = tenantParallelism;
      return this;
    }

    /**
     * Sets how many of one tenant's events may be in flight at once.
     *
     * <p>Optional. Defaults to {@code 2}. Use {@code 1} for strictly sequential sends per tenant.
     *
     * @param perTenantConcurrency concurrent sends per tenant
     * @return this builder
     */
    public Builder perTenantConcurrency(int perTenantConcurrency) {
      this.perTenantConcurrency = perTenantConcurrency;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to the UTC system clock.
     *
     * @param clock time source for claims, leases and backoff
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the prefix of the lease owner id written by this instance.
     *
     * <p>Optional. Defaults to a random id.
     *
     * @param instanceId instance identifier
     * @return this builder
     */
    public Builder instanceId(String instanceId) {
      this.instanceId = instanceId;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link #close()} waits for a running pass.
     *
     * <p>Optional. Defaults to {@code 30000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the processor and starts its (idle) worker pools.
     *
     * @return a new {@link OutboxProcessor}
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public OutboxProcessor build() {
      return new OutboxProcessor(this);
    }
  }
}
