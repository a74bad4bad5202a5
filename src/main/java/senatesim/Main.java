package senatesim;

import senatesim.config.HistoricalBias;
import senatesim.config.HistoricalBiasLoader;
import senatesim.config.PoliticalStateStore;
import senatesim.config.RosterLoader;
import senatesim.config.SimulationConfig;
import senatesim.core.PoliticalSession;
import senatesim.core.RoundResult;
import senatesim.core.SimulationLogger;
import senatesim.domain.Senator;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class Main {
  public static void main(String[] args) throws Exception {
    SimulationConfig config = SimulationConfig.load();
    List<Senator> roster = new RosterLoader().load(config.rosterPath());
    HistoricalBias bias = new HistoricalBiasLoader().load(config.historicalBiasPath());

    PoliticalStateStore store = new PoliticalStateStore();
    Path statePath = config.statePath().isBlank() ? null : Path.of(config.statePath());
    PoliticalStateStore.Snapshot snapshot = statePath == null ? null : store.load(statePath);

    PoliticalSession session = PoliticalSession.create(config, new Random(config.seed()), bias, snapshot);
    SimulationLogger.log("[Session] " + roster.size() + " senators, year " + config.year()
        + ", seed " + config.seed());

    for (SimulationConfig.TopicSpec topic : config.topics()) {
      RoundResult result = session.runRound(roster, topic.topic(), topic.category(), Map.of());
      result.outcome().summaryLines().forEach(SimulationLogger::log);
      SimulationLogger.log("[Round " + result.round() + "] " + result.outcome().deals().size() + " deals, "
          + result.amendments().size() + " amendments, " + session.ledger().size() + " open favors");
    }

    if (statePath != null) {
      store.save(statePath, session.snapshot());
    }
  }
}
