package senatesim.config;

import senatesim.domain.Senator;
import senatesim.memory.FactionRelationGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Period-dependent adjustments keyed by year (negative years are BCE). An entry applies once the
 * session year is later than its {@code afterYear}.
 */
public class HistoricalBias {
  public List<RelationShift> relationShifts = new ArrayList<>();
  public List<InfluenceMultiplier> influenceMultipliers = new ArrayList<>();

  public static class RelationShift {
    public int afterYear;
    public String factionA;
    public String factionB;
    public double delta;
    public String note;
  }

  public static class InfluenceMultiplier {
    public String faction;
    public int afterYear;
    public double multiplier = 1.0;
    public String note;
  }

  public static HistoricalBias none() {
    return new HistoricalBias();
  }

  /** Shifts relation baselines for every period the year has entered. Returns how many applied. */
  public int applyTo(FactionRelationGraph graph, int year) {
    return applyBetween(graph, Integer.MIN_VALUE, year);
  }

  /**
   * Applies only the shifts entered between two years: those a graph built at {@code fromYear}
   * has not seen yet but {@code toYear} has. Returns how many applied.
   */
  public int applyBetween(FactionRelationGraph graph, int fromYear, int toYear) {
    int applied = 0;
    for (RelationShift shift : relationShifts == null ? List.<RelationShift>of() : relationShifts) {
      if (shift == null || shift.afterYear < fromYear || toYear <= shift.afterYear) continue;
      graph.shiftBaseline(shift.factionA, shift.factionB, shift.delta);
      applied++;
    }
    return applied;
  }

  /** Average senator influence per faction, scaled by the period multipliers. */
  public Map<String, Double> factionInfluence(List<Senator> roster, int year) {
    Map<String, double[]> sums = new LinkedHashMap<>();
    for (Senator s : roster == null ? List.<Senator>of() : roster) {
      double[] acc = sums.computeIfAbsent(s.faction(), ignored -> new double[2]);
      acc[0] += s.influence();
      acc[1] += 1;
    }
    Map<String, Double> out = new LinkedHashMap<>();
    sums.forEach((faction, acc) -> out.put(faction, acc[0] / acc[1] * multiplierFor(faction, year)));
    return out;
  }

  public double multiplierFor(String faction, int year) {
    double m = 1.0;
    for (InfluenceMultiplier im : influenceMultipliers == null ? List.<InfluenceMultiplier>of() : influenceMultipliers) {
      if (im == null || im.faction == null || !im.faction.equals(faction)) continue;
      if (year > im.afterYear) m *= im.multiplier;
    }
    return m;
  }
}
