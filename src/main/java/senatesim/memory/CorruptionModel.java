package senatesim.memory;

import senatesim.core.Bounds;
import senatesim.domain.Factions;
import senatesim.domain.Senator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * CorruptionModel samples corruption from per-faction priors.
 *
 * {@link #sample(String)} is a pure draw; {@link #assign(List)} and {@link #factionLevel(String)}
 * memoize per session so a senator or faction is sampled at most once.
 */
public class CorruptionModel {
  public record Range(double min, double max) {
    public Range {
      if (min > max) {
        double tmp = min;
        min = max;
        max = tmp;
      }
      min = Bounds.unit(min);
      max = Bounds.unit(max);
    }
  }

  public static final Range DEFAULT_RANGE = new Range(0.1, 0.5);

  private static final Map<String, Range> PRIORS = Map.of(
      Factions.OPTIMATES, new Range(0.2, 0.6),
      Factions.POPULARES, new Range(0.1, 0.5),
      Factions.MILITARY, new Range(0.3, 0.8),
      Factions.RELIGIOUS, new Range(0.1, 0.4),
      Factions.MERCHANT, new Range(0.4, 0.9)
  );

  private final Random rng;
  private final Map<String, Double> sampledBySenatorId = new HashMap<>();
  private final Map<String, Double> levelByFaction = new HashMap<>();

  public CorruptionModel(Random rng) {
    if (rng == null) {
      throw new IllegalArgumentException("CorruptionModel needs a random source");
    }
    this.rng = rng;
  }

  public static Range rangeFor(String faction) {
    if (faction == null) return DEFAULT_RANGE;
    return PRIORS.getOrDefault(faction, DEFAULT_RANGE);
  }

  public double sample(String faction) {
    Range r = rangeFor(faction);
    return Bounds.unit(r.min() + rng.nextDouble() * (r.max() - r.min()));
  }

  /** The faction's overall tendency toward bribery, drawn once per session. */
  public double factionLevel(String faction) {
    String key = faction == null ? Senator.INDEPENDENT : faction;
    return levelByFaction.computeIfAbsent(key, this::sample);
  }

  /**
   * Returns the roster with every missing corruption trait filled in. Senators who already carry
   * a trait are passed through untouched; others reuse their first sample for the rest of the session.
   */
  public List<Senator> assign(List<Senator> roster) {
    List<Senator> out = new ArrayList<>();
    if (roster == null) return out;
    for (Senator s : roster) {
      if (s == null) continue;
      if (s.hasCorruption()) {
        out.add(s);
        continue;
      }
      double value = sampledBySenatorId.computeIfAbsent(s.id(), ignored -> sample(s.faction()));
      out.add(s.withCorruption(value));
    }
    return out;
  }

  public boolean hasSampled(String senatorId) {
    return sampledBySenatorId.containsKey(senatorId);
  }
}
