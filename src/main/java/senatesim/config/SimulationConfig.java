package senatesim.config;

import senatesim.domain.TopicCategory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public class SimulationConfig {
  public record TopicSpec(String topic, TopicCategory category) {}

  private final long seed;
  private final int year;
  private final int maxAmendments;
  private final double decayFactor;
  private final int decayEveryRounds;
  private final String rosterPath;
  private final String historicalBiasPath;
  private final String statePath;
  private final List<TopicSpec> topics;

  public SimulationConfig(long seed, int year, int maxAmendments, double decayFactor, int decayEveryRounds,
                          String rosterPath, String historicalBiasPath, String statePath, List<TopicSpec> topics) {
    this.seed = seed;
    this.year = year;
    this.maxAmendments = maxAmendments;
    this.decayFactor = decayFactor;
    this.decayEveryRounds = decayEveryRounds;
    this.rosterPath = rosterPath;
    this.historicalBiasPath = historicalBiasPath;
    this.statePath = statePath;
    this.topics = List.copyOf(topics);
  }

  public long seed() { return seed; }
  public int year() { return year; }
  public int maxAmendments() { return maxAmendments; }
  public double decayFactor() { return decayFactor; }
  public int decayEveryRounds() { return decayEveryRounds; }
  public String rosterPath() { return rosterPath; }
  public String historicalBiasPath() { return historicalBiasPath; }
  public String statePath() { return statePath; }
  public List<TopicSpec> topics() { return topics; }

  public static SimulationConfig defaults() {
    return fromProperties(new Properties());
  }

  public static SimulationConfig load() throws IOException {
    Properties props = new Properties();
    Path path = Path.of("config.properties");
    if (Files.exists(path)) {
      try (InputStream in = Files.newInputStream(path)) {
        props.load(in);
      }
    }
    return fromProperties(props);
  }

  static SimulationConfig fromProperties(Properties props) {
    long seed = getLongValue(props, "negotiation.seed", "SIM_SEED", 42L);
    int year = getIntValue(props, "session.year", "SIM_YEAR", -100);
    int maxAmendments = getIntValue(props, "amendments.max_per_round", "SIM_MAX_AMENDMENTS", 3);
    double decayFactor = getDoubleValue(props, "relations.decay_factor", "SIM_DECAY_FACTOR", 1.0);
    int decayEvery = getIntValue(props, "relations.decay_every_rounds", "SIM_DECAY_EVERY", 1);
    String rosterPath = getValue(props, "roster.path", "SIM_ROSTER_PATH", "config/senators.json");
    String biasPath = getValue(props, "history.bias_path", "SIM_HISTORY_BIAS_PATH", "config/historical_bias.json");
    String statePath = getValue(props, "state.path", "SIM_STATE_PATH", "");
    String topicsRaw = getValue(props, "topics", "SIM_TOPICS",
        "Land redistribution to veterans::Domestic Policy;Grain tax on provincial merchants::Economic Policy");

    if (maxAmendments < 0) {
      throw new IllegalStateException("amendments.max_per_round must not be negative: " + maxAmendments);
    }
    if (decayFactor < 0.0 || decayFactor > 1.0) {
      throw new IllegalStateException("relations.decay_factor must be within [0,1]: " + decayFactor);
    }

    return new SimulationConfig(seed, year, maxAmendments, decayFactor, Math.max(1, decayEvery),
        rosterPath, biasPath, statePath, parseTopics(topicsRaw));
  }

  /** {@code "topic::category;topic::category"}; a missing category is GENERAL. */
  static List<TopicSpec> parseTopics(String raw) {
    List<TopicSpec> out = new ArrayList<>();
    if (raw == null) return out;
    for (String part : raw.split(";")) {
      String trimmed = part.trim();
      if (trimmed.isEmpty()) continue;
      int idx = trimmed.indexOf("::");
      if (idx < 0) {
        out.add(new TopicSpec(trimmed, TopicCategory.GENERAL));
      } else {
        out.add(new TopicSpec(trimmed.substring(0, idx).trim(), TopicCategory.fromLabel(trimmed.substring(idx + 2))));
      }
    }
    return out;
  }

  private static String getValue(Properties props, String key, String envKey, String defaultValue) {
    String env = System.getenv(envKey);
    if (env != null && !env.isBlank()) return env;
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) return value;
    return defaultValue;
  }

  private static int getIntValue(Properties props, String key, String envKey, int defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  private static long getLongValue(Properties props, String key, String envKey, long defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  private static double getDoubleValue(Properties props, String key, String envKey, double defaultValue) {
    String raw = getValue(props, key, envKey, null);
    if (raw == null) return defaultValue;
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }
}
