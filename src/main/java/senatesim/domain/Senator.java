package senatesim.domain;

import senatesim.core.Bounds;

/**
 * A senator as seen by the negotiation core. Owned by the caller; the core only reads it.
 * Absent traits are kept as null and read back through the documented defaults.
 */
public class Senator {
  public static final String INDEPENDENT = "Independent";
  public static final double DEFAULT_LOYALTY = 0.5;
  public static final double DEFAULT_CORRUPTION = 0.1;
  public static final double DEFAULT_ELOQUENCE = 0.5;
  public static final double DEFAULT_INFLUENCE = 0.5;

  private final String id;
  private final String name;
  private final String faction;
  private final Double loyalty;
  private final Double corruption;
  private final Double eloquence;
  private final Double influence;

  public Senator(String id, String name, String faction,
                 Double loyalty, Double corruption, Double eloquence, Double influence) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Senator id is required");
    }
    this.id = id.trim();
    this.name = name == null || name.isBlank() ? this.id : name.trim();
    this.faction = faction == null || faction.isBlank() ? INDEPENDENT : faction.trim();
    this.loyalty = loyalty;
    this.corruption = corruption;
    this.eloquence = eloquence;
    this.influence = influence;
  }

  public static Senator of(String id, String faction) {
    return new Senator(id, id, faction, null, null, null, null);
  }

  public String id() { return id; }
  public String name() { return name; }
  public String faction() { return faction; }

  public double loyalty() { return trait(loyalty, DEFAULT_LOYALTY); }
  public double corruption() { return trait(corruption, DEFAULT_CORRUPTION); }
  public double eloquence() { return trait(eloquence, DEFAULT_ELOQUENCE); }
  public double influence() { return trait(influence, DEFAULT_INFLUENCE); }

  public boolean hasCorruption() { return corruption != null; }

  public Senator withCorruption(double value) {
    return new Senator(id, name, faction, loyalty, Bounds.unit(value), eloquence, influence);
  }

  public Senator withInfluence(double value) {
    return new Senator(id, name, faction, loyalty, corruption, eloquence, Bounds.unit(value));
  }

  public boolean sameFaction(Senator other) {
    return other != null && faction.equals(other.faction);
  }

  private static double trait(Double value, double fallback) {
    return value == null || value.isNaN() ? fallback : Bounds.unit(value);
  }

  @Override
  public String toString() {
    return name + " (" + faction + ")";
  }
}
