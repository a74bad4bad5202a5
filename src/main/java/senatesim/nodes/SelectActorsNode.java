package senatesim.nodes;

import senatesim.core.Node;
import senatesim.core.RoundPhase;
import senatesim.core.RoundState;
import senatesim.core.SimulationLogger;
import senatesim.domain.Senator;
import senatesim.negotiation.BackroomNegotiationEngine;

public class SelectActorsNode implements Node {
  private final BackroomNegotiationEngine engine;

  public SelectActorsNode(BackroomNegotiationEngine engine) {
    this.engine = engine;
  }

  @Override
  public String name() { return "SelectActors"; }

  @Override
  public RoundPhase produces() { return RoundPhase.ACTORS_SELECTED; }

  @Override
  public void run(RoundState state) {
    state.actors = engine.selectActors(state.roster, state.category);
    if (state.actors.isEmpty()) {
      SimulationLogger.log("Backroom", "No senators available for private meetings.");
      return;
    }
    SimulationLogger.log("== BACKROOM: " + state.topic + " (" + state.category.label() + ") ==");
    SimulationLogger.log("Backroom", "Actors: " + state.actors.stream().map(Senator::name).toList());
  }
}
