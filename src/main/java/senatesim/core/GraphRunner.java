package senatesim.core;

import java.util.List;

/**
 * Runs the nodes of one negotiation round in order and enforces the round's phase sequence.
 * A node whose phase does not follow the round's current phase is a wiring error.
 */
public class GraphRunner {
  private final List<Node> nodes;

  public GraphRunner(List<Node> nodes) {
    this.nodes = List.copyOf(nodes);
    RoundPhase expected = RoundPhase.IDLE;
    for (Node n : this.nodes) {
      if (n.produces() != expected.next()) {
        throw new IllegalArgumentException("Node " + n.name() + " produces " + n.produces()
            + " but " + expected.next() + " is required after " + expected);
      }
      expected = n.produces();
    }
    if (expected != RoundPhase.INFLUENCE_COMPUTED) {
      throw new IllegalArgumentException("Round pipeline stops at " + expected + " instead of INFLUENCE_COMPUTED");
    }
  }

  public void run(RoundState state) {
    if (state.phase != RoundPhase.IDLE) {
      throw new IllegalStateException("Round " + state.round + " is already at " + state.phase);
    }
    for (Node n : nodes) {
      advance(state, n);
    }
    SimulationLogger.log("==> Round " + state.round + " complete: " + state.influence.size() + " influence deltas");
    state.phase = RoundPhase.IDLE;
  }

  /** Runs a single node; the round must sit in the phase right before the node's. */
  public static void advance(RoundState state, Node n) {
    if (state.phase.next() != n.produces()) {
      throw new IllegalStateException("Cannot run " + n.name() + " while round " + state.round + " is at " + state.phase);
    }
    SimulationLogger.log("==> Running: " + n.name());
    n.run(state);
    state.phase = n.produces();
  }
}
