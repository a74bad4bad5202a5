package senatesim.memory;

import org.junit.jupiter.api.Test;
import senatesim.domain.Factions;
import senatesim.domain.Senator;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorruptionModelTest {

  @Test
  void fillsMissingCorruptionFromFactionRange() {
    CorruptionModel model = new CorruptionModel(new Random(5));
    Senator crassus = Senator.of("crassus", Factions.MERCHANT);

    Senator assigned = model.assign(List.of(crassus)).get(0);

    assertTrue(assigned.hasCorruption());
    assertTrue(assigned.corruption() >= 0.4 && assigned.corruption() <= 0.9);
    assertTrue(model.hasSampled("crassus"));
  }

  @Test
  void samplesEachSenatorOnlyOnce() {
    CorruptionModel model = new CorruptionModel(new Random(5));
    Senator clodius = Senator.of("clodius", Factions.POPULARES);

    double first = model.assign(List.of(clodius)).get(0).corruption();
    double second = model.assign(List.of(clodius)).get(0).corruption();

    assertEquals(first, second);
  }

  @Test
  void keepsExplicitCorruption() {
    CorruptionModel model = new CorruptionModel(new Random(5));
    Senator cato = Senator.of("cato", Factions.OPTIMATES).withCorruption(0.05);

    assertEquals(0.05, model.assign(List.of(cato)).get(0).corruption(), 1e-12);
    assertFalse(model.hasSampled("cato"));
  }

  @Test
  void factionLevelIsMemoized() {
    CorruptionModel model = new CorruptionModel(new Random(8));
    double level = model.factionLevel(Factions.MILITARY);

    assertEquals(level, model.factionLevel(Factions.MILITARY));
    assertTrue(level >= 0.3 && level <= 0.8);
  }

  @Test
  void unknownFactionsUseDefaultRange() {
    assertEquals(CorruptionModel.DEFAULT_RANGE, CorruptionModel.rangeFor("Equites"));
    assertEquals(CorruptionModel.DEFAULT_RANGE, CorruptionModel.rangeFor(null));
  }

  @Test
  void requiresRandomSource() {
    assertThrows(IllegalArgumentException.class, () -> new CorruptionModel(null));
  }
}
