package senatesim.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class HistoricalBiasLoader {
  static final String DEFAULT_RESOURCE = "/historical_bias.json";

  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  /**
   * Reads the bias table from {@code path} when it exists, otherwise from the bundled resource.
   * An empty file means no period adjustments.
   */
  public HistoricalBias load(String path) throws IOException {
    if (path != null && !path.isBlank()) {
      Path p = Path.of(path);
      if (Files.exists(p)) {
        String raw = Files.readString(p).trim();
        if (raw.isEmpty()) return HistoricalBias.none();
        return mapper.readValue(raw, HistoricalBias.class);
      }
    }
    try (InputStream in = HistoricalBiasLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) return HistoricalBias.none();
      return mapper.readValue(in, HistoricalBias.class);
    }
  }
}
