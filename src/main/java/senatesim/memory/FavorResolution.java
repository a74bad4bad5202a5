package senatesim.memory;

import senatesim.domain.FavorChange;

import java.util.List;

/**
 * Result of calling in a favor. {@code changes} and {@code standingDelta} are what
 * {@link PoliticalFavorLedger#apply(FavorResolution)} commits.
 */
public record FavorResolution(String debtorId,
                              String benefactorId,
                              boolean honored,
                              boolean partial,
                              double complianceProbability,
                              double balanceBefore,
                              double requested,
                              double remaining,
                              double counterObligation,
                              double standingDelta,
                              String reason,
                              List<FavorChange> changes) {

  public FavorResolution {
    changes = changes == null ? List.of() : List.copyOf(changes);
    reason = reason == null ? "" : reason;
  }

  public boolean noFavorOwed() {
    return PoliticalFavorLedger.NO_FAVOR_OWED.equals(reason);
  }

  public String favorSize() {
    if (requested > 0.6) return "significant";
    if (requested > 0.3) return "moderate";
    return "small";
  }
}
