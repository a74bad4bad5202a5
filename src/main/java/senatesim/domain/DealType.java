package senatesim.domain;

/**
 * The closed set of backroom deals. Each type carries its draw weight and its chance of
 * hardening into an alliance; effects live in the negotiation engine's dispatch table.
 */
public enum DealType {
  VOTE_EXCHANGE("vote exchange", 0.3),
  AMENDMENT_SUPPORT("amendment support", 0.3),
  SPEAKING_OPPORTUNITY("speaking opportunity", 0.1),
  FAVOR_EXCHANGE("favor exchange", 0.1),
  RESOURCE_ALLOCATION("resource allocation", 0.1);

  private final String label;
  private final double allianceChance;

  DealType(String label, double allianceChance) {
    this.label = label;
    this.allianceChance = allianceChance;
  }

  public String label() { return label; }
  public double allianceChance() { return allianceChance; }

  /** Relative draw weight; corrupt pairs lean toward favors and resource deals. */
  public double weight(TopicCategory category, double avgCorruption) {
    double w = 1.0 + categoryBias(category);
    if (this == FAVOR_EXCHANGE) w += avgCorruption;
    if (this == RESOURCE_ALLOCATION) w += avgCorruption * 2.0;
    return w;
  }

  private double categoryBias(TopicCategory category) {
    if (category == null) return 0.0;
    return switch (category) {
      case MILITARY_AFFAIRS -> this == VOTE_EXCHANGE || this == RESOURCE_ALLOCATION ? 0.5 : 0.0;
      case FOREIGN_POLICY -> this == RESOURCE_ALLOCATION ? 0.5 : this == FAVOR_EXCHANGE ? 0.25 : 0.0;
      case DOMESTIC_POLICY -> this == VOTE_EXCHANGE ? 0.5 : this == SPEAKING_OPPORTUNITY ? 0.25 : 0.0;
      case RELIGIOUS_MATTERS -> this == SPEAKING_OPPORTUNITY ? 0.5 : 0.0;
      case ECONOMIC_POLICY -> this == RESOURCE_ALLOCATION ? 1.0 : 0.0;
      case LEGAL_REFORMS -> this == AMENDMENT_SUPPORT ? 1.0 : 0.0;
      case GENERAL -> 0.0;
    };
  }
}
