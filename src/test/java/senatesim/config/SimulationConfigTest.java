package senatesim.config;

import org.junit.jupiter.api.Test;
import senatesim.domain.TopicCategory;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SimulationConfigTest {

  @Test
  void readsPropertiesWithDefaultsForMissingKeys() {
    Properties props = new Properties();
    props.setProperty("session.year", "-63");
    props.setProperty("amendments.max_per_round", "2");
    props.setProperty("relations.decay_factor", "0.9");
    props.setProperty("relations.decay_every_rounds", "0");

    SimulationConfig config = SimulationConfig.fromProperties(props);

    assertEquals(-63, config.year());
    assertEquals(2, config.maxAmendments());
    assertEquals(0.9, config.decayFactor(), 1e-12);
    assertEquals(1, config.decayEveryRounds());
    assertEquals("", config.statePath());
  }

  @Test
  void malformedNumbersFallBackToDefaults() {
    Properties props = new Properties();
    props.setProperty("session.year", "the ides of march");
    assertEquals(-100, SimulationConfig.fromProperties(props).year());
  }

  @Test
  void rejectsDecayFactorAboveOne() {
    Properties props = new Properties();
    props.setProperty("relations.decay_factor", "1.5");
    assertThrows(IllegalStateException.class, () -> SimulationConfig.fromProperties(props));
  }

  @Test
  void parsesTopicList() {
    List<SimulationConfig.TopicSpec> topics =
        SimulationConfig.parseTopics("Command against the pirates::Military Affairs; Games for Jupiter ;;");

    assertEquals(List.of(
        new SimulationConfig.TopicSpec("Command against the pirates", TopicCategory.MILITARY_AFFAIRS),
        new SimulationConfig.TopicSpec("Games for Jupiter", TopicCategory.GENERAL)), topics);
  }
}
