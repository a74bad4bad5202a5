package senatesim.memory;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import senatesim.core.SimulationLogger;
import senatesim.domain.Factions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RelationDecayPolicyTest {

  @BeforeAll
  static void quiet() {
    SimulationLogger.setEnabled(false);
  }

  @Test
  void decaysOnlyOnConfiguredRounds() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.MILITARY, Factions.POPULARES, 0.1);
    graph.adjust(Factions.MILITARY, Factions.POPULARES, 0.2);
    RelationDecayPolicy policy = RelationDecayPolicy.multiplicative(0.5, 2);

    policy.afterRound(graph, 1L);
    assertEquals(0.2, graph.drift(Factions.MILITARY, Factions.POPULARES), 1e-9);

    policy.afterRound(graph, 2L);
    assertEquals(0.1, graph.drift(Factions.MILITARY, Factions.POPULARES), 1e-9);
    assertEquals(0.1, graph.baseline(Factions.MILITARY, Factions.POPULARES), 1e-12);
  }

  @Test
  void noneLeavesDriftAlone() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.adjust(Factions.MERCHANT, Factions.RELIGIOUS, 0.3);

    RelationDecayPolicy.none().afterRound(graph, 1L);
    RelationDecayPolicy.multiplicative(1.0, 1).afterRound(graph, 1L);

    assertEquals(0.3, graph.get(Factions.MERCHANT, Factions.RELIGIOUS), 1e-9);
  }

  @Test
  void rejectsFactorOutsideUnitRange() {
    assertThrows(IllegalArgumentException.class, () -> RelationDecayPolicy.multiplicative(1.5, 1));
    assertThrows(IllegalArgumentException.class, () -> RelationDecayPolicy.multiplicative(-0.1, 1));
  }
}
