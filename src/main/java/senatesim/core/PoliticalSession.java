package senatesim.core;

import senatesim.amendments.AmendmentEngine;
import senatesim.config.HistoricalBias;
import senatesim.config.PoliticalStateStore;
import senatesim.config.SimulationConfig;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.domain.TopicCategory;
import senatesim.memory.CorruptionModel;
import senatesim.memory.FactionRelationGraph;
import senatesim.memory.PoliticalFavorLedger;
import senatesim.memory.RelationDecayPolicy;
import senatesim.memory.SocialGraph;
import senatesim.negotiation.BackroomNegotiationEngine;
import senatesim.negotiation.StanceModel;
import senatesim.nodes.ArbitrateMeetingsNode;
import senatesim.nodes.ComputeInfluenceNode;
import senatesim.nodes.FinalizeOutcomeNode;
import senatesim.nodes.GenerateAmendmentsNode;
import senatesim.nodes.SelectActorsNode;
import senatesim.voting.VotingInfluenceCalculator;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * PoliticalSession owns the persistent political memory of one senate session and runs
 * negotiation rounds against it, one at a time.
 */
public class PoliticalSession {
  private final int year;
  private final FactionRelationGraph relations;
  private final PoliticalFavorLedger ledger;
  private final CorruptionModel corruption;
  private final AmendmentEngine amendments;
  private final RelationDecayPolicy decayPolicy;
  private final GraphRunner runner;
  private long rounds;

  public PoliticalSession(Random rng, int year, FactionRelationGraph relations, PoliticalFavorLedger ledger,
                          HistoricalBias bias, RelationDecayPolicy decayPolicy, int maxAmendments) {
    if (rng == null) throw new IllegalArgumentException("rng is required");
    this.year = year;
    this.relations = relations;
    this.ledger = ledger;
    this.corruption = new CorruptionModel(rng);
    this.decayPolicy = decayPolicy == null ? RelationDecayPolicy.none() : decayPolicy;

    StanceModel stanceModel = new StanceModel();
    BackroomNegotiationEngine negotiation = new BackroomNegotiationEngine(relations, ledger, stanceModel);
    this.amendments = new AmendmentEngine(relations, corruption, rng);
    this.runner = new GraphRunner(List.of(
        new SelectActorsNode(negotiation),
        new ArbitrateMeetingsNode(negotiation, rng),
        new FinalizeOutcomeNode(negotiation, bias == null ? HistoricalBias.none() : bias),
        new GenerateAmendmentsNode(amendments, stanceModel, maxAmendments, rng),
        new ComputeInfluenceNode(new VotingInfluenceCalculator(ledger))
    ));
  }

  /**
   * Builds a session from config. A saved snapshot restores relations, favors and standings as they were,
   * plus any period shifts entered between the snapshot's year and the configured one; otherwise relations
   * start from the historical priors shifted by the period bias.
   */
  public static PoliticalSession create(SimulationConfig config, Random rng, HistoricalBias bias,
                                        PoliticalStateStore.Snapshot snapshot) {
    HistoricalBias effective = bias == null ? HistoricalBias.none() : bias;
    FactionRelationGraph relations;
    PoliticalFavorLedger ledger;
    long rounds = 0L;
    if (snapshot != null) {
      relations = PoliticalStateStore.relationsOf(snapshot);
      ledger = PoliticalStateStore.ledgerOf(snapshot);
      rounds = snapshot.rounds;
      SimulationLogger.log("Session", "Restored " + relations.toMap().size() + " relations and "
          + ledger.size() + " favors after " + rounds + " rounds");
      if (snapshot.year != null) {
        int shifted = effective.applyBetween(relations, snapshot.year, config.year());
        if (shifted > 0) {
          SimulationLogger.log("Session", "Applied " + shifted + " historical relation shifts from year "
              + snapshot.year + " to " + config.year());
        }
      }
    } else {
      relations = FactionRelationGraph.seeded(rng);
      ledger = new PoliticalFavorLedger(new SocialGraph());
      int shifted = effective.applyTo(relations, config.year());
      SimulationLogger.log("Session", "Applied " + shifted + " historical relation shifts for year " + config.year());
    }
    PoliticalSession session = new PoliticalSession(rng, config.year(), relations, ledger, effective,
        RelationDecayPolicy.multiplicative(config.decayFactor(), config.decayEveryRounds()), config.maxAmendments());
    session.rounds = rounds;
    return session;
  }

  /** Runs one full round: actors, meetings, outcome, amendments, vote influence. */
  public RoundResult runRound(List<Senator> attending, String topic, TopicCategory category,
                              Map<String, Stance> factionStances) {
    List<Senator> roster = corruption.assign(attending == null ? List.of() : attending);
    long round = ++rounds;
    RoundState state = new RoundState(round, topic, category, year, roster, factionStances);
    ledger.socialGraph().beginRound(round);

    runner.run(state);

    amendments.archive(state.amendments);
    decayPolicy.afterRound(relations, round);
    return new RoundResult(round, state.outcome, state.amendments, state.influence,
        state.factionReactions, state.interactionLog.entries());
  }

  public PoliticalStateStore.Snapshot snapshot() {
    return PoliticalStateStore.capture(rounds, year, relations, ledger);
  }

  public long rounds() { return rounds; }
  public int year() { return year; }
  public FactionRelationGraph relations() { return relations; }
  public PoliticalFavorLedger ledger() { return ledger; }
  public CorruptionModel corruption() { return corruption; }
  public AmendmentEngine amendments() { return amendments; }
}
