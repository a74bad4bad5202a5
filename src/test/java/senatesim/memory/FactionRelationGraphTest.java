package senatesim.memory;

import org.junit.jupiter.api.Test;
import senatesim.domain.Factions;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactionRelationGraphTest {

  @Test
  void relationsAreSymmetric() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.POPULARES, Factions.OPTIMATES, -0.7);

    assertEquals(-0.7, graph.get(Factions.OPTIMATES, Factions.POPULARES), 1e-12);
    assertEquals(-0.7, graph.get(Factions.POPULARES, Factions.OPTIMATES), 1e-12);
    assertEquals("Optimates|Populares", FactionRelationGraph.key(Factions.POPULARES, Factions.OPTIMATES));
  }

  @Test
  void nonFiniteAdjustmentLeavesRelationUntouched() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline("A", "B", 0.4);

    assertEquals(0.4, graph.adjust("A", "B", Double.NaN), 1e-12);
    assertEquals(0.4, graph.adjust("A", "B", Double.POSITIVE_INFINITY), 1e-12);
    assertEquals(0.4, graph.get("A", "B"), 1e-12);
    assertEquals(0.0, graph.drift("A", "B"));
  }

  @Test
  void selfAndUnknownPairsReadZero() {
    FactionRelationGraph graph = FactionRelationGraph.seeded(new Random(4));
    graph.setBaseline(Factions.MILITARY, Factions.MILITARY, 0.9);

    assertEquals(0.0, graph.get(Factions.MILITARY, Factions.MILITARY));
    assertEquals(0.0, graph.get("Equites", "Socii"));
    assertEquals(0.0, graph.get(null, Factions.MILITARY));
  }

  @Test
  void seededPriorsMatchTheRepublicanRivalries() {
    FactionRelationGraph graph = FactionRelationGraph.seeded(new Random(9));

    assertEquals(-0.7, graph.get(Factions.OPTIMATES, Factions.POPULARES), 1e-12);
    assertEquals(0.5, graph.get(Factions.RELIGIOUS, Factions.OPTIMATES), 1e-12);
    double uncertain = graph.get(Factions.MILITARY, Factions.POPULARES);
    assertTrue(uncertain >= -0.3 && uncertain <= 0.3);
    assertEquals(10, graph.toMap().size());
  }

  @Test
  void adjustClampsAndTracksDrift() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.MERCHANT, Factions.MILITARY, 0.9);

    assertEquals(1.0, graph.adjust(Factions.MILITARY, Factions.MERCHANT, 0.5), 1e-12);
    assertEquals(0.9, graph.baseline(Factions.MERCHANT, Factions.MILITARY), 1e-12);
    assertEquals(0.1, graph.drift(Factions.MERCHANT, Factions.MILITARY), 1e-9);
  }

  @Test
  void decayShrinksDriftButNotBaseline() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.OPTIMATES, Factions.MERCHANT, 0.2);
    graph.adjust(Factions.OPTIMATES, Factions.MERCHANT, 0.4);

    graph.decay(0.5);

    assertEquals(0.2, graph.baseline(Factions.OPTIMATES, Factions.MERCHANT), 1e-12);
    assertEquals(0.2, graph.drift(Factions.OPTIMATES, Factions.MERCHANT), 1e-9);
    assertEquals(0.4, graph.get(Factions.OPTIMATES, Factions.MERCHANT), 1e-9);

    graph.decay(0.0);
    assertEquals(0.2, graph.get(Factions.OPTIMATES, Factions.MERCHANT), 1e-9);
  }

  @Test
  void shiftBaselineClampsToRange() {
    FactionRelationGraph graph = new FactionRelationGraph();
    graph.setBaseline(Factions.OPTIMATES, Factions.POPULARES, -0.95);
    graph.shiftBaseline(Factions.OPTIMATES, Factions.POPULARES, -0.1);
    assertEquals(-1.0, graph.get(Factions.OPTIMATES, Factions.POPULARES), 1e-12);
  }

  @Test
  void mapRoundTripPreservesEffectiveValues() {
    FactionRelationGraph graph = FactionRelationGraph.seeded(new Random(21));
    graph.adjust(Factions.MILITARY, Factions.POPULARES, 0.05);

    FactionRelationGraph restored = FactionRelationGraph.fromMap(graph.toMap());

    assertEquals(graph.toMap(), restored.toMap());
    assertEquals(graph.factions(), restored.factions());
  }
}
