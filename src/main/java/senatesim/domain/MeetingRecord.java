package senatesim.domain;

import java.util.List;

/**
 * One private meeting of a negotiation round. Ledger and relation mutations are carried
 * as staged changes and only committed when the round's outcome is finalized.
 */
public record MeetingRecord(int sequence,
                            String initiatorId,
                            String targetId,
                            String initiatorFaction,
                            String targetFaction,
                            boolean stanceAgreement,
                            double dealProbability,
                            boolean successful,
                            DealType dealType,
                            List<FavorChange> favorChanges,
                            AllianceChange alliance,
                            double standingDelta,
                            boolean bribery,
                            String description) {

  public MeetingRecord {
    favorChanges = favorChanges == null ? List.of() : List.copyOf(favorChanges);
    description = description == null ? "" : description;
  }

  public boolean intraFaction() {
    return initiatorFaction != null && initiatorFaction.equals(targetFaction);
  }

  public boolean allianceFormed() {
    return alliance != null;
  }

  /** Vote exchanges and amendment-support deals bind the pair without touching the ledger. */
  public boolean isCommitment() {
    return successful && (dealType == DealType.VOTE_EXCHANGE || dealType == DealType.AMENDMENT_SUPPORT);
  }

  public boolean involves(String senatorId) {
    return senatorId != null && (senatorId.equals(initiatorId) || senatorId.equals(targetId));
  }
}
