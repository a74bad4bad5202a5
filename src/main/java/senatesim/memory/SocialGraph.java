package senatesim.memory;

import senatesim.core.Bounds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SocialGraph is the shared in-memory store of who has met whom during the session,
 * along with a personal standing score per pair and a few interaction counters.
 *
 * Standing is symmetric and lives in [-1,1]; it is separate from faction relations so a refused
 * favor strains the two senators without moving their factions.
 */
public class SocialGraph {
  public static final class Relationship {
    public final String otherId;
    public int timesMet = 0;
    public int dealsMade = 0;
    public long lastRound = -1L;
    public String lastInteractionType = "";

    private Relationship(String otherId) {
      this.otherId = otherId;
    }
  }

  private final Map<String, Map<String, Relationship>> relationshipsBySelf = new HashMap<>();
  private final Map<String, Double> standingByPair = new HashMap<>();
  private long currentRound = 0L;

  public void beginRound(long round) {
    this.currentRound = round;
  }

  public void recordMeet(String aId, String bId, boolean dealMade) {
    if (!valid(aId, bId)) return;
    recordInteraction(aId, bId, dealMade ? "deal" : "meet", dealMade);
    recordInteraction(bId, aId, dealMade ? "deal" : "meet", dealMade);
  }

  public double standing(String aId, String bId) {
    if (!valid(aId, bId)) return 0.0;
    return standingByPair.getOrDefault(pairKey(aId, bId), 0.0);
  }

  public double adjustStanding(String aId, String bId, double delta) {
    if (!valid(aId, bId)) return 0.0;
    String key = pairKey(aId, bId);
    double next = Bounds.relation(standingByPair.getOrDefault(key, 0.0) + delta);
    standingByPair.put(key, next);
    return next;
  }

  public List<Relationship> relationshipsFor(String selfId) {
    Map<String, Relationship> map = relationshipsBySelf.getOrDefault(selfId, Map.of());
    if (map.isEmpty()) return List.of();
    List<Relationship> rels = new ArrayList<>(map.values());
    rels.sort(Comparator.comparingLong((Relationship r) -> r.lastRound).reversed()
        .thenComparing(r -> r.otherId));
    return Collections.unmodifiableList(rels);
  }

  public Relationship relationshipFor(String selfId, String otherId) {
    Map<String, Relationship> map = relationshipsBySelf.get(selfId);
    if (map == null) return null;
    return map.get(otherId);
  }

  public Map<String, Double> standingsAsMap() {
    return Collections.unmodifiableMap(new HashMap<>(standingByPair));
  }

  public void loadStandings(Map<String, Double> standings) {
    if (standings == null) return;
    standings.forEach((k, v) -> {
      if (k != null && v != null && k.contains("|")) standingByPair.put(k, Bounds.relation(v));
    });
  }

  private void recordInteraction(String selfId, String otherId, String type, boolean dealMade) {
    Relationship rel = relationshipsBySelf
        .computeIfAbsent(selfId, ignored -> new HashMap<>())
        .computeIfAbsent(otherId, Relationship::new);
    rel.timesMet += 1;
    if (dealMade) rel.dealsMade += 1;
    rel.lastRound = currentRound;
    rel.lastInteractionType = type;
  }

  private static boolean valid(String aId, String bId) {
    return aId != null && bId != null && !aId.isBlank() && !aId.equals(bId);
  }

  private static String pairKey(String a, String b) {
    return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
  }
}
