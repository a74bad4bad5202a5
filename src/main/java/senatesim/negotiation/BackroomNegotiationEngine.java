package senatesim.negotiation;

import senatesim.core.Bounds;
import senatesim.core.InteractionLog;
import senatesim.core.SimulationLogger;
import senatesim.core.WeightedDraw;
import senatesim.domain.AllianceChange;
import senatesim.domain.DealType;
import senatesim.domain.FavorChange;
import senatesim.domain.MeetingRecord;
import senatesim.domain.NegotiationOutcome;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.domain.TopicCategory;
import senatesim.memory.FactionRelationGraph;
import senatesim.memory.FavorResolution;
import senatesim.memory.PoliticalFavorLedger;
import senatesim.memory.SocialGraph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * BackroomNegotiationEngine runs the private meetings that precede a debate.
 *
 * A round is split into three steps so the caller can stop between them:
 * {@link #selectActors}, {@link #arbitrate} and {@link #finalizeOutcome}. Arbitration only reads the
 * ledger and relation graph; every mutation it decides on is staged in the meeting records and
 * committed by {@link #finalizeOutcome}, sorted by initiator id.
 */
public class BackroomNegotiationEngine {
  public static final int MIN_INFLUENTIAL = 3;
  public static final int MAX_STAKEHOLDERS = 5;
  public static final int MAX_MEETINGS = 4;
  public static final double ALLIANCE_RELATION_DELTA = 0.05;
  public static final double SPEAKING_FAVOR = 0.2;
  public static final double NEW_FAVOR = 0.4;
  public static final double BRIBERY_THRESHOLD = 0.5;
  private static final int MAX_NOTABLE_LINES = 5;

  @FunctionalInterface
  interface DealEffect {
    void apply(MeetingContext ctx, MeetingDraft draft);
  }

  record MeetingContext(Senator initiator, Senator target, String topic, double avgCorruption,
                        double relation, Random rng) {}

  static final class MeetingDraft {
    final List<FavorChange> favorChanges = new ArrayList<>();
    double standingDelta = 0.0;
    boolean bribery = false;
    String description = "";
  }

  private final FactionRelationGraph relations;
  private final PoliticalFavorLedger ledger;
  private final StanceModel stanceModel;
  private final Map<DealType, DealEffect> effects = new EnumMap<>(DealType.class);

  public BackroomNegotiationEngine(FactionRelationGraph relations, PoliticalFavorLedger ledger) {
    this(relations, ledger, new StanceModel());
  }

  public BackroomNegotiationEngine(FactionRelationGraph relations, PoliticalFavorLedger ledger, StanceModel stanceModel) {
    this.relations = relations;
    this.ledger = ledger;
    this.stanceModel = stanceModel;
    effects.put(DealType.VOTE_EXCHANGE, this::voteExchange);
    effects.put(DealType.AMENDMENT_SUPPORT, this::amendmentSupport);
    effects.put(DealType.SPEAKING_OPPORTUNITY, this::speakingOpportunity);
    effects.put(DealType.FAVOR_EXCHANGE, this::favorExchange);
    effects.put(DealType.RESOURCE_ALLOCATION, this::resourceAllocation);
  }

  /** Runs all three steps in one go. */
  public NegotiationOutcome negotiate(List<Senator> roster, String topic, TopicCategory category,
                                      Map<String, Stance> factionStances, Random rng) {
    List<Senator> actors = selectActors(roster, category);
    List<MeetingRecord> meetings = arbitrate(actors, topic, category, factionStances, rng);
    return finalizeOutcome(topic, category, actors, meetings, Map.of());
  }

  /**
   * The most influential quarter of the roster (at least {@link #MIN_INFLUENTIAL}) plus up to
   * {@link #MAX_STAKEHOLDERS} members of the category's stakeholder factions. Equal influence keeps roster order.
   */
  public List<Senator> selectActors(List<Senator> roster, TopicCategory category) {
    Map<String, Senator> unique = new LinkedHashMap<>();
    if (roster != null) {
      for (Senator s : roster) {
        if (s != null) unique.putIfAbsent(s.id(), s);
      }
    }
    if (unique.isEmpty()) return List.of();

    List<Senator> attendees = new ArrayList<>(unique.values());
    int top = Math.min(attendees.size(), Math.max(MIN_INFLUENTIAL, attendees.size() / 4));
    List<Senator> byInfluence = new ArrayList<>(attendees);
    byInfluence.sort(Comparator.comparingDouble(Senator::influence).reversed());

    Map<String, Senator> actors = new LinkedHashMap<>();
    for (Senator s : byInfluence.subList(0, top)) {
      actors.put(s.id(), s);
    }
    TopicCategory c = category == null ? TopicCategory.GENERAL : category;
    attendees.stream()
        .filter(s -> c.isStakeholder(s.faction()))
        .limit(MAX_STAKEHOLDERS)
        .forEach(s -> actors.putIfAbsent(s.id(), s));
    return List.copyOf(actors.values());
  }

  /** One to four meetings, growing with influence. */
  public int meetingBudget(Senator initiator) {
    return Math.min(MAX_MEETINGS, 1 + (int) Math.floor(initiator.influence() * 3));
  }

  public double targetWeight(Senator initiator, Senator target) {
    double weight = 1.0;
    if (initiator.sameFaction(target)) weight += 1.0;
    weight += relations.get(initiator.faction(), target.faction()) * 2.0;
    weight += ledger.balance(target.id(), initiator.id()) * 3.0;
    return weight;
  }

  public double dealProbability(Senator initiator, Senator target, boolean stanceAgreement) {
    double p = 0.2;
    p += stanceAgreement ? 0.3 : 0.1;
    p += averageCorruption(initiator, target) * 0.5;
    p += relations.get(initiator.faction(), target.faction()) * 0.2;
    p += ledger.balance(target.id(), initiator.id()) * 0.2;
    return Bounds.unit(p);
  }

  public List<MeetingRecord> arbitrate(List<Senator> actors, String topic, TopicCategory category,
                                       Map<String, Stance> factionStances, Random rng) {
    if (actors == null || actors.size() < 2) return List.of();

    Map<String, Stance> stanceById = new HashMap<>();
    for (Senator s : actors) {
      stanceById.put(s.id(), stanceModel.drawSenatorStance(s, factionStances, rng));
    }

    List<MeetingRecord> records = new ArrayList<>();
    Set<String> metPairs = new HashSet<>();
    int sequence = 0;
    for (Senator initiator : actors) {
      int budget = meetingBudget(initiator);
      for (int i = 0; i < budget; i++) {
        List<Senator> candidates = actors.stream()
            .filter(t -> !t.id().equals(initiator.id()))
            .filter(t -> !metPairs.contains(pairKey(initiator.id(), t.id())))
            .toList();
        if (candidates.isEmpty()) break;

        Senator target = WeightedDraw.pick(candidates, t -> targetWeight(initiator, t), rng);
        if (target == null) break;
        metPairs.add(pairKey(initiator.id(), target.id()));

        boolean agreement = stanceById.get(initiator.id()) == stanceById.get(target.id());
        records.add(meet(sequence++, initiator, target, agreement, topic, category, rng));
      }
    }
    return records;
  }

  private MeetingRecord meet(int sequence, Senator initiator, Senator target, boolean agreement,
                             String topic, TopicCategory category, Random rng) {
    double p = dealProbability(initiator, target, agreement);
    boolean success = rng.nextDouble() < p;
    if (!success) {
      return new MeetingRecord(sequence, initiator.id(), target.id(), initiator.faction(), target.faction(),
          agreement, p, false, null, List.of(), null, 0.0, false,
          initiator.name() + " and " + target.name() + " discuss " + topicLabel(topic) + " but reach no agreement.");
    }

    double avgCorruption = averageCorruption(initiator, target);
    DealType type = WeightedDraw.pick(List.of(DealType.values()), t -> t.weight(category, avgCorruption), rng);
    MeetingContext ctx = new MeetingContext(initiator, target, topic, avgCorruption,
        relations.get(initiator.faction(), target.faction()), rng);
    MeetingDraft draft = new MeetingDraft();
    effects.get(type).apply(ctx, draft);

    AllianceChange alliance = null;
    if (rng.nextDouble() < type.allianceChance()) {
      double delta = initiator.sameFaction(target) ? 0.0 : ALLIANCE_RELATION_DELTA;
      alliance = new AllianceChange(initiator.id(), target.id(), initiator.faction(), target.faction(),
          delta, alliancePurpose(type));
    }

    return new MeetingRecord(sequence, initiator.id(), target.id(), initiator.faction(), target.faction(),
        agreement, p, true, type, draft.favorChanges, alliance, draft.standingDelta, draft.bribery,
        draft.description);
  }

  private void voteExchange(MeetingContext ctx, MeetingDraft draft) {
    draft.description = ctx.initiator().name() + " agrees to back " + ctx.target().name()
        + " on a future matter in exchange for support on " + topicLabel(ctx.topic()) + ".";
  }

  private void amendmentSupport(MeetingContext ctx, MeetingDraft draft) {
    draft.description = ctx.initiator().name() + " and " + ctx.target().name()
        + " agree to cooperate on an amendment to " + topicLabel(ctx.topic()) + ".";
  }

  private void speakingOpportunity(MeetingContext ctx, MeetingDraft draft) {
    draft.favorChanges.add(new FavorChange(ctx.target().id(), ctx.initiator().id(), SPEAKING_FAVOR));
    draft.description = ctx.initiator().name() + " offers " + ctx.target().name()
        + " a prime speaking slot in exchange for adjusting their position.";
  }

  private void favorExchange(MeetingContext ctx, MeetingDraft draft) {
    Senator initiator = ctx.initiator();
    Senator target = ctx.target();
    if (ledger.balance(target.id(), initiator.id()) > 0.0) {
      FavorResolution r = ledger.assess(target.id(), initiator.id(), target.loyalty(), ctx.relation(), 0.0, ctx.rng());
      draft.favorChanges.addAll(r.changes());
      draft.standingDelta = r.standingDelta();
      draft.description = initiator.name() + " calls in a " + r.favorSize() + " favor owed by " + target.name()
          + (r.honored() ? ", and it is honored." : ", who refuses, straining their relationship.");
      return;
    }
    draft.favorChanges.add(new FavorChange(target.id(), initiator.id(), NEW_FAVOR));
    draft.description = initiator.name() + " does a favor for " + target.name() + ", creating a political debt.";
  }

  private void resourceAllocation(MeetingContext ctx, MeetingDraft draft) {
    double corruption = ctx.avgCorruption();
    draft.bribery = corruption > BRIBERY_THRESHOLD;
    if (ctx.rng().nextDouble() < corruption) {
      draft.favorChanges.add(new FavorChange(ctx.target().id(), ctx.initiator().id(), 0.1 + 0.3 * corruption));
    }
    draft.description = ctx.initiator().name() + " and " + ctx.target().name()
        + " negotiate the allocation of resources tied to " + topicLabel(ctx.topic())
        + (draft.bribery ? ", with coin changing hands." : ".");
  }

  /**
   * Commits the staged mutations of every meeting and freezes the round's audit trail.
   * {@code factionInfluence} is optional and only feeds the summary.
   */
  public NegotiationOutcome finalizeOutcome(String topic, TopicCategory category, List<Senator> actors,
                                            List<MeetingRecord> meetings, Map<String, Double> factionInfluence) {
    TopicCategory c = category == null ? TopicCategory.GENERAL : category;
    List<String> actorIds = actors == null ? List.of() : actors.stream().map(Senator::id).toList();
    if (meetings == null || meetings.isEmpty()) {
      return new NegotiationOutcome(topic, c, actorIds, c.stakeholderFactions(), List.of(), List.of());
    }

    List<MeetingRecord> ordered = new ArrayList<>(meetings);
    ordered.sort(Comparator.comparing(MeetingRecord::initiatorId).thenComparingInt(MeetingRecord::sequence));
    SocialGraph social = ledger.socialGraph();
    for (MeetingRecord m : ordered) {
      social.recordMeet(m.initiatorId(), m.targetId(), m.successful());
      for (FavorChange change : m.favorChanges()) {
        ledger.apply(change);
      }
      if (m.standingDelta() != 0.0) {
        social.adjustStanding(m.initiatorId(), m.targetId(), m.standingDelta());
      }
      AllianceChange a = m.alliance();
      if (a != null && a.crossFaction() && a.relationDelta() != 0.0) {
        double next = relations.adjust(a.factionA(), a.factionB(), a.relationDelta());
        SimulationLogger.log("Backroom", "Alliance nudges " + a.factionA() + "/" + a.factionB()
            + " relation to " + String.format("%.2f", next));
      }
    }

    InteractionLog log = new InteractionLog();
    long deals = meetings.stream().filter(MeetingRecord::successful).count();
    long alliances = meetings.stream().filter(MeetingRecord::allianceFormed).count();
    log.add("Backroom", meetings.size() + " meetings, " + deals + " deals, " + alliances + " alliances on "
        + topicLabel(topic));
    meetings.stream()
        .filter(m -> m.successful() || m.allianceFormed())
        .limit(MAX_NOTABLE_LINES)
        .forEach(m -> log.add("Deal", m.description()));
    for (MeetingRecord m : meetings) {
      if (m.allianceFormed()) {
        log.add("Alliance", m.initiatorId() + " & " + m.targetId() + " (" + m.alliance().purpose() + ")");
      }
    }
    for (String faction : c.stakeholderFactions()) {
      Double influence = factionInfluence == null ? null : factionInfluence.get(faction);
      if (influence == null) continue;
      log.add("Interest", "The " + faction + " faction is "
          + (influence > 0.7 ? "strongly interested in" : "concerned with") + " this matter.");
    }
    log.entries().forEach(SimulationLogger::log);

    return new NegotiationOutcome(topic, c, actorIds, c.stakeholderFactions(), meetings, log.entries());
  }

  private static double averageCorruption(Senator a, Senator b) {
    return (a.corruption() + b.corruption()) / 2.0;
  }

  private static String alliancePurpose(DealType type) {
    return switch (type) {
      case VOTE_EXCHANGE -> "short-term cooperation";
      case AMENDMENT_SUPPORT -> "amendment coalition";
      default -> "mutual interest";
    };
  }

  private static String topicLabel(String topic) {
    return topic == null || topic.isBlank() ? "the proposal" : topic;
  }

  private static String pairKey(String a, String b) {
    return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
  }
}
