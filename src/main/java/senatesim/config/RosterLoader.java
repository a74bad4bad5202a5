package senatesim.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import senatesim.domain.Senator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RosterLoader {
  static final String DEFAULT_RESOURCE = "/senators.json";

  private final ObjectMapper mapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public List<Senator> load(String path) throws IOException {
    SenatorConfig[] configs;
    if (path != null && !path.isBlank() && Files.exists(Path.of(path))) {
      configs = mapper.readValue(Files.readString(Path.of(path)), SenatorConfig[].class);
    } else {
      try (InputStream in = RosterLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("No roster at " + path + " and no bundled " + DEFAULT_RESOURCE);
        }
        configs = mapper.readValue(in, SenatorConfig[].class);
      }
    }
    return toSenators(configs);
  }

  public List<Senator> parse(String json) throws IOException {
    return toSenators(mapper.readValue(json, SenatorConfig[].class));
  }

  private static List<Senator> toSenators(SenatorConfig[] configs) {
    List<Senator> out = new ArrayList<>();
    if (configs == null) return out;
    Set<String> seen = new HashSet<>();
    for (SenatorConfig sc : configs) {
      if (sc == null || sc.id == null || sc.id.isBlank()) continue;
      if (!seen.add(sc.id.trim())) {
        throw new IllegalArgumentException("Duplicate senator id " + sc.id);
      }
      Map<String, Double> traits = sc.traits == null ? Map.of() : sc.traits;
      out.add(new Senator(sc.id, sc.name, sc.faction,
          traits.get("loyalty"), traits.get("corruption"), traits.get("eloquence"),
          sc.influence != null ? sc.influence : traits.get("influence")));
    }
    return out;
  }

  private static class SenatorConfig {
    public String id;
    public String name;
    public String faction;
    public Double influence;
    public Map<String, Double> traits;
  }
}
