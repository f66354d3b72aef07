package capi.privacy;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Heuristic 0-100 estimate of how well a payload's identity fields can be matched.
 * Used for diagnostics only; the destination computes its own match quality.
 *
 * @param score   normalized score
 * @param quality label for the score
 */
public record MatchScore(int score, Quality quality) {

  private static final Map<String, Integer> WEIGHTS = weights();
  private static final int MAX_POSSIBLE = WEIGHTS.values().stream().mapToInt(Integer::intValue).sum();
  private static final int CAP_WITHOUT_PRIMARY_ID = 40;

  public enum Quality {
    POOR, FAIR, GOOD, VERY_GOOD, EXCELLENT;

    public String label() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /**
   * Scores the identity fields of a filtered {@code user_data} map.
   */
  public static MatchScore of(Map<String, String> userData) {
    int raw = 0;
    for (Map.Entry<String, Integer> weight : WEIGHTS.entrySet()) {
      String value = userData.get(weight.getKey());
      if (value != null && !value.isEmpty()) {
        raw += weight.getValue();
      }
    }
    int score = Math.round(raw * 100f / MAX_POSSIBLE);
    boolean primaryId = userData.containsKey("em") || userData.containsKey("ph");
    if (!primaryId) {
      score = Math.min(score, CAP_WITHOUT_PRIMARY_ID);
    }
    return new MatchScore(score, qualityOf(score));
  }

  static Quality qualityOf(int score) {
    if (score >= 81) return Quality.EXCELLENT;
    if (score >= 61) return Quality.VERY_GOOD;
    if (score >= 41) return Quality.GOOD;
    if (score >= 21) return Quality.FAIR;
    return Quality.POOR;
  }

  private static Map<String, Integer> weights() {
    Map<String, Integer> weights = new LinkedHashMap<>();
    weights.put("em", 30);
    weights.put("ph", 25);
    weights.put("external_id", 15);
    weights.put("fbp", 10);
    weights.put("fbc", 10);
    weights.put("fn", 3);
    weights.put("ln", 3);
    weights.put("ct", 2);
    weights.put("st", 2);
    weights.put("zp", 5);
    weights.put("country", 2);
    weights.put("client_ip_address", 3);
    weights.put("client_user_agent", 2);
    return weights;
  }
}
