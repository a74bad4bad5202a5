package senatesim.core;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import senatesim.domain.TopicCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GraphRunnerTest {

  @BeforeAll
  static void quiet() {
    SimulationLogger.setEnabled(false);
  }

  @Test
  void runsNodesInOrderAndReturnsToIdle() {
    List<String> visited = new ArrayList<>();
    GraphRunner runner = new GraphRunner(fullChain(visited));
    RoundState state = newState();

    runner.run(state);

    assertEquals(List.of("ACTORS_SELECTED", "MEETINGS_ARBITRATED", "OUTCOME_FINALIZED",
        "AMENDMENTS_GENERATED", "INFLUENCE_COMPUTED"), visited);
    assertEquals(RoundPhase.IDLE, state.phase);
  }

  @Test
  void rejectsOutOfOrderWiring() {
    List<Node> nodes = List.of(
        new RecordingNode(RoundPhase.ACTORS_SELECTED, new ArrayList<>()),
        new RecordingNode(RoundPhase.OUTCOME_FINALIZED, new ArrayList<>()));
    assertThrows(IllegalArgumentException.class, () -> new GraphRunner(nodes));
  }

  @Test
  void rejectsPipelineThatStopsEarly() {
    List<Node> nodes = List.of(
        new RecordingNode(RoundPhase.ACTORS_SELECTED, new ArrayList<>()),
        new RecordingNode(RoundPhase.MEETINGS_ARBITRATED, new ArrayList<>()));
    assertThrows(IllegalArgumentException.class, () -> new GraphRunner(nodes));
  }

  @Test
  void refusesToStartRoundThatIsNotIdle() {
    GraphRunner runner = new GraphRunner(fullChain(new ArrayList<>()));
    RoundState state = newState();
    state.phase = RoundPhase.MEETINGS_ARBITRATED;
    assertThrows(IllegalStateException.class, () -> runner.run(state));
  }

  @Test
  void advanceRejectsSkippedPhase() {
    RoundState state = newState();
    Node finalize = new RecordingNode(RoundPhase.OUTCOME_FINALIZED, new ArrayList<>());

    assertThrows(IllegalStateException.class, () -> GraphRunner.advance(state, finalize));
    assertEquals(RoundPhase.IDLE, state.phase);
  }

  private static RoundState newState() {
    return new RoundState(1L, "Grain dole", TopicCategory.DOMESTIC_POLICY, -100, List.of(), Map.of());
  }

  private static List<Node> fullChain(List<String> visited) {
    List<Node> nodes = new ArrayList<>();
    RoundPhase p = RoundPhase.IDLE;
    do {
      p = p.next();
      nodes.add(new RecordingNode(p, visited));
    } while (p != RoundPhase.INFLUENCE_COMPUTED);
    return nodes;
  }

  private static final class RecordingNode implements Node {
    private final RoundPhase phase;
    private final List<String> visited;

    RecordingNode(RoundPhase phase, List<String> visited) {
      this.phase = phase;
      this.visited = visited;
    }

    @Override
    public String name() { return "Recording-" + phase; }

    @Override
    public RoundPhase produces() { return phase; }

    @Override
    public void run(RoundState state) {
      visited.add(phase.name());
    }
  }
}
