package capi.spring.boot;

import capi.diagnostics.DryRunReport;
import capi.diagnostics.EventDiagnostics;
import capi.failed.FailedEventManager;
import capi.health.HealthTracker;
import capi.model.HealthStats;
import capi.processor.OutboxProcessingException;
import capi.processor.OutboxProcessor;
import capi.processor.ProcessingSummary;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP surface for schedulers and operators.
 *
 * <ul>
 *   <li>{@code POST /capi/outbox/process}: run one processing pass (scheduler or admin token)</li>
 *   <li>{@code GET /capi/health}, {@code GET /capi/health/{organizationId}}: delivery health (admin)</li>
 *   <li>{@code GET /capi/events/{id}/dry-run}: payload preview without sending (admin)</li>
 *   <li>{@code POST /capi/events/{id}/requeue}: re-queue a FAILED event (admin)</li>
 * </ul>
 */
@RestController
@RequestMapping("/capi")
public class CapiOutboxController {
  private static final Logger logger = Logger.getLogger(CapiOutboxController.class.getName());

  private final OutboxProcessor processor;
  private final HealthTracker healthTracker;
  private final EventDiagnostics diagnostics;
  private final FailedEventManager failedEvents;
  private final TriggerAuthorizer authorizer;

  public CapiOutboxController(OutboxProcessor processor, HealthTracker healthTracker,
      EventDiagnostics diagnostics, FailedEventManager failedEvents, TriggerAuthorizer authorizer) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
    this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    this.failedEvents = Objects.requireNonNull(failedEvents, "failedEvents");
    this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
  }

  @PostMapping("/outbox/process")
  public ResponseEntity<Map<String, Object>> process(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!authorizer.mayTrigger(authorization)) {
      return unauthorized();
    }
    try {
      ProcessingSummary summary = processor.process();
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("success", true);
      body.put("processed", summary.processed());
      body.put("sent", summary.sent());
      body.put("failed", summary.failed());
      body.put("tenants", summary.tenants());
      body.put("duration_ms", summary.duration().toMillis());
      return ResponseEntity.ok(body);
    } catch (OutboxProcessingException e) {
      logger.log(Level.SEVERE, "Processing pass failed", e);
      return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!authorizer.isAdmin(authorization)) {
      return unauthorized();
    }
    List<Map<String, Object>> tenants = healthTracker.allStats().stream()
        .map(CapiOutboxController::healthJson)
        .toList();
    return ResponseEntity.ok(Map.of("tenants", tenants, "failed_events", failedEvents.count(null)));
  }

  @GetMapping("/health/{organizationId}")
  public ResponseEntity<Map<String, Object>> tenantHealth(@PathVariable String organizationId,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!authorizer.isAdmin(authorization)) {
      return unauthorized();
    }
    Map<String, Object> body = healthJson(healthTracker.stats(organizationId));
    body.put("failed_events", failedEvents.count(organizationId));
    return ResponseEntity.ok(body);
  }

  @GetMapping("/events/{id}/dry-run")
  public ResponseEntity<Map<String, Object>> dryRun(@PathVariable String id,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!authorizer.isAdmin(authorization)) {
      return unauthorized();
    }
    Optional<DryRunReport> report;
    try {
      report = diagnostics.dryRun(id);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Dry run failed for event " + id, e);
      return error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to load event " + id);
    }
    return report
        .map(r -> ResponseEntity.ok(dryRunJson(r)))
        .orElseGet(() -> error(HttpStatus.NOT_FOUND, "Event not found: " + id));
  }

  @PostMapping("/events/{id}/requeue")
  public ResponseEntity<Map<String, Object>> requeue(@PathVariable String id,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    if (!authorizer.isAdmin(authorization)) {
      return unauthorized();
    }
    if (!failedEvents.requeue(id)) {
      return error(HttpStatus.CONFLICT, "Event " + id + " is not FAILED or does not exist");
    }
    return ResponseEntity.ok(Map.of("requeued", true, "id", id));
  }

  private static Map<String, Object> healthJson(HealthStats stats) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("organization_id", stats.organizationId());
    json.put("success_count", stats.successCount());
    json.put("failure_count", stats.failureCount());
    json.put("consecutive_failures", stats.consecutiveFailures());
    json.put("failure_rate", stats.failureRate());
    json.put("last_error", stats.lastError());
    json.put("last_success_at", iso(stats.lastSuccessAt()));
    json.put("last_failure_at", iso(stats.lastFailureAt()));
    return json;
  }

  private static Map<String, Object> dryRunJson(DryRunReport report) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("id", report.id());
    json.put("organization_id", report.organizationId());
    json.put("status", report.status());
    json.put("retry_count", report.retryCount());
    json.put("buildable", report.buildable());
    json.put("destination_uri", report.destinationUri());
    json.put("privacy_mode", report.privacyMode());
    json.put("token_source", report.tokenSource());
    json.put("test_event_code", report.testEventCode());
    json.put("payload", report.payload());
    json.put("match_score", report.matchScore());
    json.put("match_quality", report.matchQuality());
    json.put("error", report.error());
    return json;
  }

  private static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }

  private static ResponseEntity<Map<String, Object>> unauthorized() {
    return error(HttpStatus.UNAUTHORIZED, "Unauthorized");
  }

  private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", message);
    return ResponseEntity.status(status).body(body);
  }
}
