package capi.diagnostics;

import java.util.Map;

/**
 * What a processing pass would send for one event. Never contains the access token.
 *
 * @param id             internal event id
 * @param organizationId tenant id
 * @param status         current stored status
 * @param retryCount     current stored retry count
 * @param destinationUri URI the event would be posted to (may be {@code null} on error)
 * @param privacyMode    tenant privacy mode (may be {@code null} on error)
 * @param tokenSource    resolution path of the token (may be {@code null} on error)
 * @param testEventCode  destination test code (may be {@code null})
 * @param payload        built destination event (may be {@code null} on error)
 * @param matchScore     identity match score 0-100 (may be {@code null} on error)
 * @param matchQuality   label for {@code matchScore} (may be {@code null} on error)
 * @param error          why the event could not be built (may be {@code null})
 */
public record DryRunReport(
    String id,
    String organizationId,
    String status,
    int retryCount,
    String destinationUri,
    String privacyMode,
    String tokenSource,
    String testEventCode,
    Map<String, Object> payload,
    Integer matchScore,
    String matchQuality,
    String error) {

  public boolean buildable() {
    return error == null;
  }
}
