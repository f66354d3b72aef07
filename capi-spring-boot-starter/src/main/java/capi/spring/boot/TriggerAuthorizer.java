package capi.spring.boot;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Checks bearer tokens presented to the HTTP endpoints.
 *
 * <p>The scheduler token opens the processing trigger only; the admin token opens every
 * endpoint. An unset token matches nothing, so with neither configured all calls are refused.
 */
public final class TriggerAuthorizer {
  private static final String BEARER = "bearer ";

  private final byte[] schedulerToken;
  private final byte[] adminToken;

  public TriggerAuthorizer(String schedulerToken, String adminToken) {
    this.schedulerToken = bytes(schedulerToken);
    this.adminToken = bytes(adminToken);
  }

  public static TriggerAuthorizer from(CapiProperties.Trigger trigger) {
    return new TriggerAuthorizer(trigger.getSchedulerToken(), trigger.getAdminToken());
  }

  /**
   * Whether the {@code Authorization} header may run a processing pass.
   */
  public boolean mayTrigger(String authorizationHeader) {
    byte[] presented = bearer(authorizationHeader);
    return matches(presented, schedulerToken) || matches(presented, adminToken);
  }

  /**
   * Whether the {@code Authorization} header carries the admin token.
   */
  public boolean isAdmin(String authorizationHeader) {
    return matches(bearer(authorizationHeader), adminToken);
  }

  private static byte[] bearer(String header) {
    if (header == null || header.length() <= BEARER.length()
        || !header.substring(0, BEARER.length()).toLowerCase(Locale.ROOT).equals(BEARER)) {
      return null;
    }
    return bytes(header.substring(BEARER.length()).trim());
  }

  private static boolean matches(byte[] presented, byte[] expected) {
    return presented != null && expected != null && MessageDigest.isEqual(presented, expected);
  }

  private static byte[] bytes(String token) {
    return token == null || token.isBlank() ? null : token.getBytes(StandardCharsets.UTF_8);
  }
}
