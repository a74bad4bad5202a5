package senatesim.nodes;

import senatesim.config.HistoricalBias;
import senatesim.core.Node;
import senatesim.core.RoundPhase;
import senatesim.core.RoundState;
import senatesim.negotiation.BackroomNegotiationEngine;

import java.util.Map;

public class FinalizeOutcomeNode implements Node {
  private final BackroomNegotiationEngine engine;
  private final HistoricalBias bias;

  public FinalizeOutcomeNode(BackroomNegotiationEngine engine, HistoricalBias bias) {
    this.engine = engine;
    this.bias = bias;
  }

  @Override
  public String name() { return "FinalizeOutcome"; }

  @Override
  public RoundPhase produces() { return RoundPhase.OUTCOME_FINALIZED; }

  @Override
  public void run(RoundState state) {
    Map<String, Double> influence = bias == null ? Map.of() : bias.factionInfluence(state.roster, state.year);
    state.outcome = engine.finalizeOutcome(state.topic, state.category, state.actors, state.pendingMeetings, influence);
    state.outcome.summaryLines().forEach(state.interactionLog::add);
  }
}
