package senatesim.domain;

import java.util.List;

/**
 * The immutable audit trail of one backroom round.
 */
public record NegotiationOutcome(String topic,
                                 TopicCategory category,
                                 List<String> actorIds,
                                 List<String> stakeholderFactions,
                                 List<MeetingRecord> meetings,
                                 List<String> summaryLines) {

  public NegotiationOutcome {
    topic = topic == null ? "" : topic;
    category = category == null ? TopicCategory.GENERAL : category;
    actorIds = actorIds == null ? List.of() : List.copyOf(actorIds);
    stakeholderFactions = stakeholderFactions == null ? List.of() : List.copyOf(stakeholderFactions);
    meetings = meetings == null ? List.of() : List.copyOf(meetings);
    summaryLines = summaryLines == null ? List.of() : List.copyOf(summaryLines);
  }

  public List<MeetingRecord> deals() {
    return meetings.stream().filter(MeetingRecord::successful).toList();
  }

  public List<AllianceChange> alliances() {
    return meetings.stream().filter(MeetingRecord::allianceFormed).map(MeetingRecord::alliance).toList();
  }

  public List<MeetingRecord> commitmentsOf(String senatorId) {
    return meetings.stream().filter(m -> m.isCommitment() && m.involves(senatorId)).toList();
  }

  public boolean isEmpty() {
    return meetings.isEmpty();
  }
}
