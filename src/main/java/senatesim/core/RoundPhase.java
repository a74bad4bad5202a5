package senatesim.core;

public enum RoundPhase {
  IDLE,
  ACTORS_SELECTED,
  MEETINGS_ARBITRATED,
  OUTCOME_FINALIZED,
  AMENDMENTS_GENERATED,
  INFLUENCE_COMPUTED;

  public RoundPhase next() {
    return switch (this) {
      case IDLE -> ACTORS_SELECTED;
      case ACTORS_SELECTED -> MEETINGS_ARBITRATED;
      case MEETINGS_ARBITRATED -> OUTCOME_FINALIZED;
      case OUTCOME_FINALIZED -> AMENDMENTS_GENERATED;
      case AMENDMENTS_GENERATED -> INFLUENCE_COMPUTED;
      case INFLUENCE_COMPUTED -> IDLE;
    };
  }
}
