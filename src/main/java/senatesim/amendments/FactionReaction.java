package senatesim.amendments;

import senatesim.domain.Stance;

import java.util.List;

/**
 * How a faction comes out of the amendment round: its topic bias, the pull of each amendment,
 * and the categorical stance that results.
 */
public record FactionReaction(String faction,
                              double initialStance,
                              double finalStance,
                              Stance stance,
                              List<Effect> effects,
                              String primaryReasoning) {

  public record Effect(String proposerId, double effect, String reasoning) {}

  public FactionReaction {
    effects = effects == null ? List.of() : List.copyOf(effects);
  }
}
