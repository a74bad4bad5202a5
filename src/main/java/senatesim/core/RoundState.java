package senatesim.core;

import senatesim.amendments.FactionReaction;
import senatesim.domain.Amendment;
import senatesim.domain.MeetingRecord;
import senatesim.domain.NegotiationOutcome;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.domain.TopicCategory;

import java.util.List;
import java.util.Map;

public class RoundState {
  public final long round;
  public final String topic;
  public final TopicCategory category;
  public final int year;
  public final List<Senator> roster;

  public Map<String, Stance> factionStances;
  public RoundPhase phase = RoundPhase.IDLE;

  public List<Senator> actors = List.of();
  public List<MeetingRecord> pendingMeetings = List.of();
  public NegotiationOutcome outcome;
  public List<Amendment> amendments = List.of();
  public List<FactionReaction> factionReactions = List.of();
  public Map<String, Double> influence = Map.of();

  public InteractionLog interactionLog = new InteractionLog();

  public RoundState(long round, String topic, TopicCategory category, int year,
                    List<Senator> roster, Map<String, Stance> factionStances) {
    this.round = round;
    this.topic = topic == null ? "" : topic;
    this.category = category == null ? TopicCategory.GENERAL : category;
    this.year = year;
    this.roster = roster == null ? List.of() : List.copyOf(roster);
    this.factionStances = factionStances;
  }
}
