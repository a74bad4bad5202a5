package senatesim.nodes;

import senatesim.core.Node;
import senatesim.core.RoundPhase;
import senatesim.core.RoundState;
import senatesim.core.SimulationLogger;
import senatesim.voting.VotingInfluenceCalculator;

public class ComputeInfluenceNode implements Node {
  private final VotingInfluenceCalculator calculator;

  public ComputeInfluenceNode(VotingInfluenceCalculator calculator) {
    this.calculator = calculator;
  }

  @Override
  public String name() { return "ComputeInfluence"; }

  @Override
  public RoundPhase produces() { return RoundPhase.INFLUENCE_COMPUTED; }

  @Override
  public void run(RoundState state) {
    state.influence = calculator.compute(state.amendments, state.roster);
    long nudged = state.influence.values().stream().filter(v -> v != 0.0).count();
    SimulationLogger.log("Vote", nudged + " of " + state.influence.size() + " senators carry an influence delta");
  }
}
