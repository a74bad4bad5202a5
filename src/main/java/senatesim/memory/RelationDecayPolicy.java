package senatesim.memory;

import senatesim.core.SimulationLogger;

/**
 * Decides how alliance drift in the relation graph fades between rounds. Baselines are never touched.
 */
public interface RelationDecayPolicy {
  void afterRound(FactionRelationGraph graph, long round);

  static RelationDecayPolicy none() {
    return (graph, round) -> { };
  }

  /** Multiplies drift by {@code factor} every {@code everyRounds} rounds. A factor of 1.0 keeps drift forever. */
  static RelationDecayPolicy multiplicative(double factor, int everyRounds) {
    if (factor < 0.0 || factor > 1.0) {
      throw new IllegalArgumentException("decay factor must be within [0,1]: " + factor);
    }
    int period = Math.max(1, everyRounds);
    if (factor == 1.0) return none();
    return (graph, round) -> {
      if (round % period != 0) return;
      graph.decay(factor);
      SimulationLogger.log("Relations", "Alliance drift decayed by " + factor + " after round " + round);
    };
  }
}
