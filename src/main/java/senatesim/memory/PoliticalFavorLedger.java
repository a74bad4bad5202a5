package senatesim.memory;

import senatesim.core.Bounds;
import senatesim.core.SimulationLogger;
import senatesim.domain.FavorChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * PoliticalFavorLedger is the directed debt graph between senators: debtor -> benefactor -> intensity.
 *
 * Intensities accumulate and are capped at 1.0; a paid-off debt is dropped from the map.
 * A senator never owes themselves.
 */
public class PoliticalFavorLedger {
  public static final String NO_FAVOR_OWED = "no favor owed";
  public static final double COUNTER_FAVOR_CHANCE = 0.2;
  public static final double COUNTER_FAVOR_RATIO = 0.5;
  public static final double REFUSAL_EROSION = 0.3;
  public static final double REFUSAL_STANDING_PENALTY = 0.2;
  public static final double RELATION_WEIGHT = 0.2;

  private static final double EPSILON = 1e-9;

  private final Map<String, Map<String, Double>> debtsByDebtor = new TreeMap<>();
  private final SocialGraph socialGraph;

  public PoliticalFavorLedger(SocialGraph socialGraph) {
    this.socialGraph = socialGraph == null ? new SocialGraph() : socialGraph;
  }

  public SocialGraph socialGraph() { return socialGraph; }

  /** Adds to the debt owed by {@code debtorId} to {@code benefactorId}; returns the new balance. */
  public double credit(String debtorId, String benefactorId, double intensity) {
    if (!validPair(debtorId, benefactorId)) return 0.0;
    if (Double.isNaN(intensity) || intensity <= 0.0) return balance(debtorId, benefactorId);
    double current = balance(debtorId, benefactorId);
    double next = Bounds.favor(current + Bounds.favor(intensity));
    debtsByDebtor.computeIfAbsent(debtorId, ignored -> new TreeMap<>()).put(benefactorId, next);
    SimulationLogger.log("Favor", debtorId + " now owes " + benefactorId + " " + String.format("%.2f", next));
    return next;
  }

  public double balance(String debtorId, String benefactorId) {
    if (!validPair(debtorId, benefactorId)) return 0.0;
    Map<String, Double> inner = debtsByDebtor.get(debtorId);
    if (inner == null) return 0.0;
    return inner.getOrDefault(benefactorId, 0.0);
  }

  /** Pays down a debt by {@code amount}; never below zero. Returns the remaining balance. */
  public double payDown(String debtorId, String benefactorId, double amount) {
    double current = balance(debtorId, benefactorId);
    if (current <= 0.0 || Double.isNaN(amount) || amount <= 0.0) return current;
    double next = Bounds.favor(current - amount);
    Map<String, Double> inner = debtsByDebtor.get(debtorId);
    if (next <= EPSILON) {
      inner.remove(benefactorId);
      if (inner.isEmpty()) debtsByDebtor.remove(debtorId);
      return 0.0;
    }
    inner.put(benefactorId, next);
    return next;
  }

  public void forgive(String debtorId, String benefactorId) {
    payDown(debtorId, benefactorId, balance(debtorId, benefactorId));
  }

  public void apply(FavorChange change) {
    if (change == null) return;
    if (change.delta() > 0) {
      credit(change.debtorId(), change.benefactorId(), change.delta());
    } else if (change.delta() < 0) {
      payDown(change.debtorId(), change.benefactorId(), -change.delta());
    }
  }

  /** Calls in the whole outstanding debt. */
  public FavorResolution resolve(String debtorId, String benefactorId, double debtorLoyalty,
                                 double relationship, Random rng) {
    return resolve(debtorId, benefactorId, debtorLoyalty, relationship, 0.0, rng);
  }

  public FavorResolution resolve(String debtorId, String benefactorId, double debtorLoyalty,
                                 double relationship, double requested, Random rng) {
    FavorResolution r = assess(debtorId, benefactorId, debtorLoyalty, relationship, requested, rng);
    apply(r);
    if (!r.noFavorOwed()) {
      SimulationLogger.log("Favor", debtorId + (r.honored() ? " honors " : " refuses ") + "the "
          + r.favorSize() + " favor called in by " + benefactorId);
    }
    return r;
  }

  /**
   * Decides whether a favor call is honored without touching the ledger.
   * A non-positive {@code requested} means the full balance.
   */
  public FavorResolution assess(String debtorId, String benefactorId, double debtorLoyalty,
                                double relationship, double requested, Random rng) {
    double balance = balance(debtorId, benefactorId);
    if (balance <= 0.0) {
      return new FavorResolution(debtorId, benefactorId, false, false, 0.0, 0.0, 0.0, 0.0,
          0.0, 0.0, NO_FAVOR_OWED, List.of());
    }

    double ask = requested <= 0.0 || Double.isNaN(requested) ? balance : Bounds.favor(requested);
    double p = complianceProbability(balance, debtorLoyalty, relationship);
    boolean honored = rng.nextDouble() < p;

    List<FavorChange> changes = new ArrayList<>();
    if (honored) {
      double paid = Math.min(ask, balance);
      changes.add(new FavorChange(debtorId, benefactorId, -paid));
      double remaining = Bounds.favor(balance - paid);
      double counter = 0.0;
      if (rng.nextDouble() < COUNTER_FAVOR_CHANCE) {
        counter = Bounds.favor(ask * COUNTER_FAVOR_RATIO);
        changes.add(new FavorChange(benefactorId, debtorId, counter));
      }
      String reason = counter > 0 ? "honored, expects support in return" : "honored";
      return new FavorResolution(debtorId, benefactorId, true, remaining > EPSILON, p, balance, ask,
          remaining, counter, 0.0, reason, changes);
    }

    double erosion = Math.min(balance, ask * REFUSAL_EROSION);
    changes.add(new FavorChange(debtorId, benefactorId, -erosion));
    return new FavorResolution(debtorId, benefactorId, false, false, p, balance, ask,
        Bounds.favor(balance - erosion), 0.0, -REFUSAL_STANDING_PENALTY, "refused", changes);
  }

  public void apply(FavorResolution resolution) {
    if (resolution == null) return;
    for (FavorChange c : resolution.changes()) {
      apply(c);
    }
    if (resolution.standingDelta() != 0.0) {
      socialGraph.adjustStanding(resolution.debtorId(), resolution.benefactorId(), resolution.standingDelta());
    }
  }

  public static double complianceProbability(double balance, double debtorLoyalty, double relationship) {
    return Bounds.unit(Bounds.favor(balance) * (0.5 + Bounds.unit(debtorLoyalty))
        + RELATION_WEIGHT * Bounds.relation(relationship));
  }

  /** Debts owed by {@code debtorId}, keyed by benefactor. */
  public Map<String, Double> debtsOf(String debtorId) {
    Map<String, Double> inner = debtorId == null ? null : debtsByDebtor.get(debtorId);
    if (inner == null) return Map.of();
    return Collections.unmodifiableMap(new TreeMap<>(inner));
  }

  /** Debts owed to {@code benefactorId}, keyed by debtor. */
  public Map<String, Double> owedTo(String benefactorId) {
    Map<String, Double> out = new TreeMap<>();
    if (benefactorId == null) return out;
    for (var entry : debtsByDebtor.entrySet()) {
      Double v = entry.getValue().get(benefactorId);
      if (v != null) out.put(entry.getKey(), v);
    }
    return Collections.unmodifiableMap(out);
  }

  public int size() {
    return debtsByDebtor.values().stream().mapToInt(Map::size).sum();
  }

  public Map<String, Map<String, Double>> toMap() {
    Map<String, Map<String, Double>> out = new TreeMap<>();
    debtsByDebtor.forEach((debtor, inner) -> out.put(debtor, Collections.unmodifiableMap(new TreeMap<>(inner))));
    return Collections.unmodifiableMap(out);
  }

  public static PoliticalFavorLedger fromMap(Map<String, Map<String, Double>> values, SocialGraph socialGraph) {
    PoliticalFavorLedger ledger = new PoliticalFavorLedger(socialGraph);
    if (values == null) return ledger;
    values.forEach((debtor, inner) -> {
      if (inner == null) return;
      inner.forEach((benefactor, intensity) -> {
        if (!validPair(debtor, benefactor) || intensity == null || intensity <= 0.0) return;
        ledger.debtsByDebtor.computeIfAbsent(debtor, ignored -> new TreeMap<>())
            .put(benefactor, Bounds.favor(intensity));
      });
    });
    return ledger;
  }

  private static boolean validPair(String debtorId, String benefactorId) {
    return debtorId != null && benefactorId != null && !debtorId.isBlank() && !debtorId.equals(benefactorId);
  }
}
