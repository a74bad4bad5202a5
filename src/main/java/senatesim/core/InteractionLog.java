package senatesim.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * InteractionLog collects the human-readable lines produced during one round
 * (meetings, deals, alliances, amendments). Presentation layers render it; the core only counts it.
 */
public class InteractionLog {
  private final List<String> entries = new ArrayList<>();

  public void add(String entry) {
    if (entry == null || entry.isBlank()) return;
    entries.add(entry.trim());
  }

  public void add(String tag, String entry) {
    if (entry == null || entry.isBlank()) return;
    add("[" + tag + "] " + entry);
  }

  public int size() {
    return entries.size();
  }

  public List<String> entries() {
    return Collections.unmodifiableList(entries);
  }
}
