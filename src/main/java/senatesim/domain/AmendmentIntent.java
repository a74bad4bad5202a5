package senatesim.domain;

import java.util.Locale;

public enum AmendmentIntent {
  STRENGTHEN_WITH_BENEFITS(true),
  STRENGTHEN_BROADLY(false),
  CLARIFY_SUPPORTIVELY(false),
  REDIRECT_BENEFITS(true),
  WEAKEN_SUBSTANTIALLY(false),
  LIMIT_SCOPE(false),
  INSERT_UNRELATED_BENEFITS(true),
  MODERATE_COMPROMISE(false);

  private final boolean selfServing;

  AmendmentIntent(boolean selfServing) {
    this.selfServing = selfServing;
  }

  public boolean selfServing() { return selfServing; }

  public boolean strengthens() {
    return this == STRENGTHEN_WITH_BENEFITS || this == STRENGTHEN_BROADLY;
  }

  public boolean weakens() {
    return this == WEAKEN_SUBSTANTIALLY;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }
}
