package senatesim.voting;

import senatesim.core.Bounds;
import senatesim.domain.Amendment;
import senatesim.domain.Senator;
import senatesim.memory.PoliticalFavorLedger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the round's amendments and the favor ledger into a bounded vote-probability nudge per senator.
 * Contributions of several amendments add up before the final clamp to [-0.5, 0.5].
 */
public class VotingInfluenceCalculator {
  public static final double PROPOSER_BONUS = 0.3;
  public static final double SUPPORT_SCALE = 0.4;
  public static final double FAVOR_SCALE = 0.2;

  private final PoliticalFavorLedger ledger;

  public VotingInfluenceCalculator(PoliticalFavorLedger ledger) {
    this.ledger = ledger;
  }

  /** Deltas keyed by senator id, in roster order. */
  public Map<String, Double> compute(List<Amendment> amendments, List<Senator> senators) {
    Map<String, Double> out = new LinkedHashMap<>();
    if (senators == null) return out;
    for (Senator senator : senators) {
      if (senator == null || out.containsKey(senator.id())) continue;
      double modifier = 0.0;
      if (amendments != null) {
        for (Amendment a : amendments) {
          if (a != null) modifier += contribution(a, senator);
        }
      }
      out.put(senator.id(), Bounds.influenceDelta(modifier));
    }
    return out;
  }

  /** Unclamped pull of a single amendment on a single senator. */
  public double contribution(Amendment amendment, Senator senator) {
    if (senator.id().equals(amendment.proposerId())) {
      return PROPOSER_BONUS;
    }
    double effect = (amendment.supportFrom(senator.faction()) - 0.5) * SUPPORT_SCALE;
    double owed = ledger.balance(senator.id(), amendment.proposerId());
    if (owed > 0.0) {
      effect += owed * FAVOR_SCALE;
    }
    return effect;
  }
}
