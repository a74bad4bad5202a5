package senatesim.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import senatesim.core.SimulationLogger;
import senatesim.memory.FactionRelationGraph;
import senatesim.memory.PoliticalFavorLedger;
import senatesim.memory.SocialGraph;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Saves and restores the persistent political memory between sessions: faction relations,
 * favor balances and personal standings.
 */
public class PoliticalStateStore {
  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public static class Snapshot {
    public long rounds;
    /** Session year the snapshot was taken in; null for snapshots written before it was recorded. */
    public Integer year;
    public Map<String, Double> relations = new TreeMap<>();
    public Map<String, Map<String, Double>> favors = new TreeMap<>();
    public Map<String, Double> standings = new TreeMap<>();
  }

  public static Snapshot capture(long rounds, int year, FactionRelationGraph relations,
                                 PoliticalFavorLedger ledger) {
    Snapshot s = new Snapshot();
    s.rounds = rounds;
    s.year = year;
    s.relations = new TreeMap<>(relations.toMap());
    s.favors = new TreeMap<>(ledger.toMap());
    s.standings = new TreeMap<>(ledger.socialGraph().standingsAsMap());
    return s;
  }

  public void save(Path path, Snapshot snapshot) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
      Files.writeString(path, json);
      SimulationLogger.log("State", "Saved political state to " + path);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to write " + path, e);
    }
  }

  /** Returns null when nothing has been saved at {@code path} yet. */
  public Snapshot load(Path path) {
    if (path == null || !Files.exists(path)) return null;
    try {
      String raw = Files.readString(path).trim();
      if (raw.isEmpty()) return null;
      return mapper.readValue(raw, Snapshot.class);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
  }

  public static FactionRelationGraph relationsOf(Snapshot snapshot) {
    return FactionRelationGraph.fromMap(snapshot.relations);
  }

  public static PoliticalFavorLedger ledgerOf(Snapshot snapshot) {
    SocialGraph social = new SocialGraph();
    social.loadStandings(snapshot.standings);
    return PoliticalFavorLedger.fromMap(snapshot.favors, social);
  }
}
