package senatesim.negotiation;

import senatesim.core.WeightedDraw;
import senatesim.domain.Factions;
import senatesim.domain.Senator;
import senatesim.domain.Stance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Draws topic stances when the caller has not supplied them.
 * Populares lean toward support, Optimates toward opposition, everyone else splits evenly.
 */
public class StanceModel {
  private static final List<Stance> ORDER = List.of(Stance.SUPPORT, Stance.OPPOSE, Stance.NEUTRAL);

  public Stance drawSenatorStance(Senator senator, Map<String, Stance> factionStances, Random rng) {
    if (factionStances != null && senator != null) {
      Stance given = factionStances.get(senator.faction());
      if (given != null) return given;
    }
    double[] w = senatorWeights(senator == null ? null : senator.faction());
    return WeightedDraw.pick(ORDER, s -> w[ORDER.indexOf(s)], rng);
  }

  /** One stance per known faction, drawn the way the session desk does before amendments. */
  public Map<String, Stance> drawFactionStances(Random rng) {
    Map<String, Stance> out = new LinkedHashMap<>();
    out.put(Factions.OPTIMATES, pickOne(rng, Stance.OPPOSE, Stance.OPPOSE, Stance.NEUTRAL));
    out.put(Factions.POPULARES, pickOne(rng, Stance.SUPPORT, Stance.SUPPORT, Stance.NEUTRAL));
    out.put(Factions.MILITARY, pickOne(rng, Stance.SUPPORT, Stance.OPPOSE, Stance.NEUTRAL));
    out.put(Factions.RELIGIOUS, pickOne(rng, Stance.OPPOSE, Stance.NEUTRAL, Stance.SUPPORT));
    out.put(Factions.MERCHANT, pickOne(rng, Stance.SUPPORT, Stance.NEUTRAL, Stance.OPPOSE));
    return out;
  }

  private static double[] senatorWeights(String faction) {
    if (Factions.POPULARES.equals(faction)) return new double[] {0.6, 0.3, 0.1};
    if (Factions.OPTIMATES.equals(faction)) return new double[] {0.3, 0.6, 0.1};
    return new double[] {0.4, 0.4, 0.2};
  }

  private static Stance pickOne(Random rng, Stance... options) {
    return options[rng.nextInt(options.length)];
  }
}
