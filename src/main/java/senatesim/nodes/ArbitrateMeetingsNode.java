package senatesim.nodes;

import senatesim.core.Node;
import senatesim.core.RoundPhase;
import senatesim.core.RoundState;
import senatesim.domain.MeetingRecord;
import senatesim.negotiation.BackroomNegotiationEngine;

import java.util.Random;

/**
 * ArbitrateMeetingsNode pairs the selected actors and decides each meeting.
 * Nothing is written to the ledger or relation graph here; the records carry staged changes.
 */
public class ArbitrateMeetingsNode implements Node {
  private final BackroomNegotiationEngine engine;
  private final Random rng;

  public ArbitrateMeetingsNode(BackroomNegotiationEngine engine, Random rng) {
    this.engine = engine;
    this.rng = rng;
  }

  @Override
  public String name() { return "ArbitrateMeetings"; }

  @Override
  public RoundPhase produces() { return RoundPhase.MEETINGS_ARBITRATED; }

  @Override
  public void run(RoundState state) {
    state.pendingMeetings = engine.arbitrate(state.actors, state.topic, state.category, state.factionStances, rng);
    for (MeetingRecord m : state.pendingMeetings) {
      state.interactionLog.add("Meet", m.description());
    }
  }
}
