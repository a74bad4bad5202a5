package senatesim.domain;

import java.util.List;
import java.util.Locale;

/**
 * Topic categories as labelled by the session orchestrator, with the factions that hold a stake in each.
 */
public enum TopicCategory {
  MILITARY_AFFAIRS("Military Affairs", List.of("Military", "Optimates")),
  FOREIGN_POLICY("Foreign Policy", List.of("Military", "Merchant")),
  DOMESTIC_POLICY("Domestic Policy", List.of("Populares", "Optimates")),
  RELIGIOUS_MATTERS("Religious Matters", List.of("Religious", "Optimates")),
  ECONOMIC_POLICY("Economic Policy", List.of("Merchant", "Populares")),
  LEGAL_REFORMS("Legal Reforms", List.of("Optimates", "Populares")),
  GENERAL("General", List.of());

  private final String label;
  private final List<String> stakeholderFactions;

  TopicCategory(String label, List<String> stakeholderFactions) {
    this.label = label;
    this.stakeholderFactions = stakeholderFactions;
  }

  public String label() { return label; }
  public List<String> stakeholderFactions() { return stakeholderFactions; }

  public boolean isStakeholder(String faction) {
    return faction != null && stakeholderFactions.contains(faction);
  }

  /** Accepts labels ("Military Affairs") or constant names ("MILITARY_AFFAIRS"); anything else is GENERAL. */
  public static TopicCategory fromLabel(String raw) {
    if (raw == null || raw.isBlank()) return GENERAL;
    String normalized = raw.trim().replaceAll("[\\s_-]+", " ").toLowerCase(Locale.ROOT);
    for (TopicCategory c : values()) {
      if (c.label.toLowerCase(Locale.ROOT).equals(normalized) || c.name().replace('_', ' ').toLowerCase(Locale.ROOT).equals(normalized)) {
        return c;
      }
    }
    return GENERAL;
  }
}
