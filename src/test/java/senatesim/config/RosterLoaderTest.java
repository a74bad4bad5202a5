package senatesim.config;

import org.junit.jupiter.api.Test;
import senatesim.domain.Senator;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RosterLoaderTest {
  private final RosterLoader loader = new RosterLoader();

  @Test
  void parsesTraitsAndInfluence() throws IOException {
    List<Senator> roster = loader.parse("""
        [
          {"id": "cato", "name": "Cato", "faction": "Optimates", "influence": 0.8,
           "traits": {"loyalty": 0.9, "corruption": 0.05}, "biography": "ignored"},
          {"id": "rullus", "traits": {"influence": 0.4}}
        ]
        """);

    assertEquals(2, roster.size());
    Senator cato = roster.get(0);
    assertEquals(0.8, cato.influence(), 1e-12);
    assertEquals(0.05, cato.corruption(), 1e-12);
    Senator rullus = roster.get(1);
    assertEquals(Senator.INDEPENDENT, rullus.faction());
    assertEquals(0.4, rullus.influence(), 1e-12);
    assertFalse(rullus.hasCorruption());
  }

  @Test
  void rejectsDuplicateIds() {
    assertThrows(IllegalArgumentException.class,
        () -> loader.parse("[{\"id\": \"cato\"}, {\"id\": \"cato\"}]"));
  }

  @Test
  void fallsBackToBundledRoster() throws IOException {
    List<Senator> roster = loader.load("no/such/roster.json");

    assertThat(roster).hasSize(12);
    assertThat(roster).extracting(Senator::id).contains("cato", "crassus", "cicero");
  }
}
