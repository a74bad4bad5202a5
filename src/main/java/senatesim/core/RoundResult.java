package senatesim.core;

import senatesim.amendments.FactionReaction;
import senatesim.domain.Amendment;
import senatesim.domain.NegotiationOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RoundResult(
    long round,
    NegotiationOutcome outcome,
    List<Amendment> amendments,
    Map<String, Double> influence,
    List<FactionReaction> factionReactions,
    List<String> interactionLog
) {
  public RoundResult {
    amendments = amendments == null ? List.of() : List.copyOf(amendments);
    influence = influence == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(influence));
    factionReactions = factionReactions == null ? List.of() : List.copyOf(factionReactions);
    interactionLog = interactionLog == null ? List.of() : List.copyOf(interactionLog);
  }

  public double influenceOf(String senatorId) {
    return influence.getOrDefault(senatorId, 0.0);
  }
}
