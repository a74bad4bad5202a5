package senatesim.nodes;

import senatesim.amendments.AmendmentEngine;
import senatesim.amendments.FactionReaction;
import senatesim.core.Node;
import senatesim.core.RoundPhase;
import senatesim.core.RoundState;
import senatesim.core.SimulationLogger;
import senatesim.domain.Amendment;
import senatesim.domain.Factions;
import senatesim.domain.Senator;
import senatesim.negotiation.StanceModel;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * GenerateAmendmentsNode lets a handful of senators amend the topic once the backroom round is settled,
 * then records how each faction reads the resulting package.
 */
public class GenerateAmendmentsNode implements Node {
  private final AmendmentEngine engine;
  private final StanceModel stanceModel;
  private final int maxAmendments;
  private final Random rng;

  public GenerateAmendmentsNode(AmendmentEngine engine, StanceModel stanceModel, int maxAmendments, Random rng) {
    this.engine = engine;
    this.stanceModel = stanceModel;
    this.maxAmendments = Math.max(0, maxAmendments);
    this.rng = rng;
  }

  @Override
  public String name() { return "GenerateAmendments"; }

  @Override
  public RoundPhase produces() { return RoundPhase.AMENDMENTS_GENERATED; }

  @Override
  public void run(RoundState state) {
    if (state.factionStances == null || state.factionStances.isEmpty()) {
      state.factionStances = stanceModel.drawFactionStances(rng);
    }

    List<Amendment> amendments = new ArrayList<>();
    for (Senator proposer : engine.selectProposers(state.roster, state.outcome, maxAmendments)) {
      Amendment a = engine.generate(proposer, state.topic, state.factionStances, state.outcome);
      amendments.add(a);
      state.interactionLog.add("Amendment", proposer.name() + " (" + a.intent().label() + "): " + a.rationale());
    }
    state.amendments = List.copyOf(amendments);
    if (amendments.isEmpty()) return;

    Set<String> factions = new LinkedHashSet<>(Factions.KNOWN);
    factions.addAll(state.factionStances.keySet());
    List<FactionReaction> reactions = new ArrayList<>();
    for (String faction : factions) {
      FactionReaction r = engine.processFactionStance(faction, state.topic, amendments);
      reactions.add(r);
      String line = "The " + faction + " faction is " + r.stance().label() + " on the proposal; " + r.primaryReasoning() + ".";
      SimulationLogger.log("Faction", line);
      state.interactionLog.add("Faction", line);
    }
    state.factionReactions = List.copyOf(reactions);
  }
}
