package senatesim.domain;

/**
 * An alliance formed in a meeting. {@code relationDelta} is zero when both members share a faction,
 * since a faction holds no relation to itself.
 */
public record AllianceChange(String memberA, String memberB, String factionA, String factionB,
                             double relationDelta, String purpose) {

  public boolean crossFaction() {
    return factionA != null && !factionA.equals(factionB);
  }
}
