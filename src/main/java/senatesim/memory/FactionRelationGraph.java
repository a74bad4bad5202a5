package senatesim.memory;

import senatesim.core.Bounds;
import senatesim.domain.Factions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * FactionRelationGraph is the sparse, symmetric relation matrix between named factions.
 *
 * Each pair holds a baseline (historical priors and period bias) plus a drift accumulated
 * from alliances. Only the drift is subject to decay. Unknown pairs read as 0.0.
 */
public class FactionRelationGraph {
  static final String KEY_SEPARATOR = "|";

  private final Map<String, Double> baseline = new HashMap<>();
  private final Map<String, Double> drift = new HashMap<>();

  /** Seeds the historically-motivated priors; the uncertain pairs are drawn from {@code rng}. */
  public static FactionRelationGraph seeded(Random rng) {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.OPTIMATES, Factions.POPULARES, -0.7);
    graph.setBaseline(Factions.MILITARY, Factions.OPTIMATES, 0.3);
    graph.setBaseline(Factions.MILITARY, Factions.POPULARES, uniform(rng, -0.3, 0.3));
    graph.setBaseline(Factions.RELIGIOUS, Factions.OPTIMATES, 0.5);
    graph.setBaseline(Factions.RELIGIOUS, Factions.POPULARES, -0.2);
    graph.setBaseline(Factions.MERCHANT, Factions.OPTIMATES, uniform(rng, -0.1, 0.4));
    graph.setBaseline(Factions.MERCHANT, Factions.POPULARES, uniform(rng, -0.1, 0.4));
    graph.setBaseline(Factions.MERCHANT, Factions.MILITARY, 0.2);

    for (String a : Factions.KNOWN) {
      for (String b : Factions.KNOWN) {
        if (a.compareTo(b) >= 0) continue;
        if (!graph.baseline.containsKey(key(a, b))) {
          graph.setBaseline(a, b, uniform(rng, -0.2, 0.2));
        }
      }
    }
    return graph;
  }

  public double get(String factionA, String factionB) {
    String k = keyOrNull(factionA, factionB);
    if (k == null) return 0.0;
    return Bounds.relation(baseline.getOrDefault(k, 0.0) + drift.getOrDefault(k, 0.0));
  }

  /** Adds {@code delta} to the pair's drift and returns the clamped relation. A non-finite delta is ignored. */
  public double adjust(String factionA, String factionB, double delta) {
    String k = keyOrNull(factionA, factionB);
    if (k == null) return 0.0;
    if (!Double.isFinite(delta)) return get(factionA, factionB);
    double base = baseline.getOrDefault(k, 0.0);
    double next = Bounds.relation(get(factionA, factionB) + delta);
    double d = next - base;
    if (d == 0.0) {
      drift.remove(k);
    } else {
      drift.put(k, d);
    }
    return next;
  }

  public void setBaseline(String factionA, String factionB, double value) {
    String k = keyOrNull(factionA, factionB);
    if (k == null) return;
    baseline.put(k, Bounds.relation(value));
  }

  /** Shifts the baseline itself; used for period bias, never by negotiation. */
  public void shiftBaseline(String factionA, String factionB, double delta) {
    String k = keyOrNull(factionA, factionB);
    if (k == null) return;
    setBaseline(factionA, factionB, baseline.getOrDefault(k, 0.0) + delta);
  }

  public double baseline(String factionA, String factionB) {
    String k = keyOrNull(factionA, factionB);
    return k == null ? 0.0 : baseline.getOrDefault(k, 0.0);
  }

  public double drift(String factionA, String factionB) {
    String k = keyOrNull(factionA, factionB);
    return k == null ? 0.0 : drift.getOrDefault(k, 0.0);
  }

  /** Multiplies every alliance drift by {@code factor}; 1.0 keeps drift, 0.0 erases it. */
  public void decay(double factor) {
    double f = Bounds.unit(factor);
    if (f == 1.0) return;
    var it = drift.entrySet().iterator();
    while (it.hasNext()) {
      var e = it.next();
      double next = e.getValue() * f;
      if (Math.abs(next) < 1e-9) {
        it.remove();
      } else {
        e.setValue(next);
      }
    }
  }

  public Set<String> factions() {
    Set<String> out = new TreeSet<>();
    for (String k : allKeys()) {
      String[] parts = splitKey(k);
      if (parts != null) {
        out.add(parts[0]);
        out.add(parts[1]);
      }
    }
    return out;
  }

  /** Effective relation for every stored pair, keyed {@code "A|B"} with A before B. */
  public Map<String, Double> toMap() {
    Map<String, Double> out = new TreeMap<>();
    for (String k : allKeys()) {
      String[] parts = splitKey(k);
      if (parts == null) continue;
      out.put(k, get(parts[0], parts[1]));
    }
    return Collections.unmodifiableMap(out);
  }

  /** Rebuilds a graph whose baselines are the given effective values. Malformed keys are skipped. */
  public static FactionRelationGraph fromMap(Map<String, Double> values) {
    FactionRelationGraph graph = new FactionRelationGraph();
    if (values == null) return graph;
    for (var entry : values.entrySet()) {
      String[] parts = splitKey(entry.getKey());
      if (parts == null || entry.getValue() == null) continue;
      graph.setBaseline(parts[0], parts[1], entry.getValue());
    }
    return graph;
  }

  private Set<String> allKeys() {
    Set<String> keys = new TreeSet<>(baseline.keySet());
    keys.addAll(drift.keySet());
    return keys;
  }

  static String key(String a, String b) {
    return a.compareTo(b) <= 0 ? a + KEY_SEPARATOR + b : b + KEY_SEPARATOR + a;
  }

  private static String keyOrNull(String a, String b) {
    if (a == null || b == null) return null;
    String x = a.trim();
    String y = b.trim();
    if (x.isEmpty() || y.isEmpty() || x.equals(y)) return null;
    return key(x, y);
  }

  private static String[] splitKey(String k) {
    if (k == null) return null;
    int idx = k.indexOf(KEY_SEPARATOR);
    if (idx <= 0 || idx == k.length() - 1) return null;
    String a = k.substring(0, idx).trim();
    String b = k.substring(idx + 1).trim();
    if (a.isEmpty() || b.isEmpty() || a.equals(b)) return null;
    return new String[] {a, b};
  }

  private static double uniform(Random rng, double min, double max) {
    return min + rng.nextDouble() * (max - min);
  }
}
