package senatesim.amendments;

import senatesim.core.Bounds;
import senatesim.core.SimulationLogger;
import senatesim.domain.Amendment;
import senatesim.domain.AmendmentIntent;
import senatesim.domain.DealType;
import senatesim.domain.Factions;
import senatesim.domain.MeetingRecord;
import senatesim.domain.NegotiationOutcome;
import senatesim.domain.Senator;
import senatesim.domain.Stance;
import senatesim.memory.CorruptionModel;
import senatesim.memory.FactionRelationGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * AmendmentEngine drafts amendments to the topic under debate and scores how each faction will
 * receive them. Corrupt proposers drift toward self-serving intents; corrupt factions reward them.
 */
public class AmendmentEngine {
  public static final double PACT_BONUS = 0.1;
  public static final double CORRUPTION_INVOLVED_THRESHOLD = 0.6;
  public static final double PERSONAL_BENEFIT_THRESHOLD = 0.5;
  public static final double CORRUPT_FACTION_THRESHOLD = 0.4;

  private static final List<String> PREFIXES = List.of(
      "provided that",
      "on condition that",
      "with the stipulation that",
      "except that",
      "with the following amendments:"
  );
  private static final List<String> UNRELATED_BENEFITS = List.of(
      "public works", "military provisions", "religious ceremonies", "grain distribution");

  private final FactionRelationGraph relations;
  private final CorruptionModel corruption;
  private final Random rng;
  private final List<Amendment> history = new ArrayList<>();

  public AmendmentEngine(FactionRelationGraph relations, CorruptionModel corruption, Random rng) {
    this.relations = relations;
    this.corruption = corruption;
    this.rng = rng;
  }

  public Amendment generate(Senator senator, String topic, Map<String, Stance> factionStances) {
    return generate(senator, topic, factionStances, null);
  }

  /**
   * Drafts exactly one amendment. When a negotiation outcome is given, factions of the senator's
   * amendment-support partners score it {@link #PACT_BONUS} higher.
   */
  public Amendment generate(Senator senator, String topic, Map<String, Stance> factionStances,
                            NegotiationOutcome outcome) {
    Map<String, Stance> stances = scoredFactions(factionStances);
    Stance own = stances.getOrDefault(senator.faction(), Stance.NEUTRAL);
    AmendmentIntent intent = intentFor(own, senator.corruption(), senator.loyalty());
    String text = rationale(intent, senator.faction());

    Amendment draft = new Amendment(senator.id(), senator.faction(), topic, intent, text, Map.of(),
        senator.corruption() > CORRUPTION_INVOLVED_THRESHOLD, senator.corruption() > PERSONAL_BENEFIT_THRESHOLD);

    Set<String> pactFactions = pactFactions(senator, outcome);
    Map<String, Double> support = new LinkedHashMap<>();
    for (String faction : stances.keySet()) {
      double s = computeFactionSupport(draft, faction, stances);
      if (pactFactions.contains(faction)) s += PACT_BONUS;
      support.put(faction, Bounds.unit(s));
    }

    Amendment amendment = new Amendment(senator.id(), senator.faction(), topic, intent, text, support,
        draft.corruptionInvolved(), draft.personalBenefit());
    SimulationLogger.log("Amendment", senator.name() + " proposes " + intent.label() + ": " + text);
    return amendment;
  }

  public static AmendmentIntent intentFor(Stance stance, double corruption, double loyalty) {
    Stance s = stance == null ? Stance.NEUTRAL : stance;
    return switch (s) {
      case SUPPORT -> corruption > 0.7 ? AmendmentIntent.STRENGTHEN_WITH_BENEFITS
          : loyalty > 0.7 ? AmendmentIntent.STRENGTHEN_BROADLY
          : AmendmentIntent.CLARIFY_SUPPORTIVELY;
      case OPPOSE -> corruption > 0.7 ? AmendmentIntent.REDIRECT_BENEFITS
          : loyalty > 0.7 ? AmendmentIntent.WEAKEN_SUBSTANTIALLY
          : AmendmentIntent.LIMIT_SCOPE;
      case NEUTRAL -> corruption > 0.5 ? AmendmentIntent.INSERT_UNRELATED_BENEFITS
          : AmendmentIntent.MODERATE_COMPROMISE;
    };
  }

  public double computeFactionSupport(Amendment amendment, String faction, Map<String, Stance> factionStances) {
    Map<String, Stance> stances = factionStances == null ? Map.of() : factionStances;
    Stance proposerStance = stances.getOrDefault(amendment.proposerFaction(), Stance.NEUTRAL);
    Stance factionStance = stances.getOrDefault(faction, Stance.NEUTRAL);
    AmendmentIntent intent = amendment.intent();

    double support = 0.5;
    support += relations.get(faction, amendment.proposerFaction()) * 0.2;

    if (factionStance == Stance.SUPPORT) {
      support += proposerStance == Stance.SUPPORT ? 0.2 : -0.2;
    } else if (factionStance == Stance.OPPOSE) {
      support += proposerStance == Stance.OPPOSE ? 0.2 : -0.1;
    }

    if (intent.strengthens() && factionStance == Stance.SUPPORT) {
      support += 0.1;
    } else if (intent.weakens() && factionStance == Stance.OPPOSE) {
      support += 0.1;
    } else if (intent == AmendmentIntent.MODERATE_COMPROMISE) {
      support += 0.05;
    }

    if (intent.selfServing()) {
      double level = corruption.factionLevel(faction);
      if (level > CORRUPT_FACTION_THRESHOLD) support += 0.2 * level;
    }
    return Bounds.unit(support);
  }

  /**
   * Picks who drafts amendments this round: senators bound by an amendment-support pact first
   * (roster order), then a random draw from the rest, up to {@code max}.
   */
  public List<Senator> selectProposers(List<Senator> roster, NegotiationOutcome outcome, int max) {
    if (roster == null || roster.isEmpty() || max <= 0) return List.of();
    Set<String> pactIds = new HashSet<>();
    if (outcome != null) {
      for (MeetingRecord m : outcome.meetings()) {
        if (m.successful() && m.dealType() == DealType.AMENDMENT_SUPPORT) {
          pactIds.add(m.initiatorId());
          pactIds.add(m.targetId());
        }
      }
    }

    Map<String, Senator> chosen = new LinkedHashMap<>();
    for (Senator s : roster) {
      if (chosen.size() >= max) break;
      if (pactIds.contains(s.id())) chosen.putIfAbsent(s.id(), s);
    }
    List<Senator> rest = new ArrayList<>();
    for (Senator s : roster) {
      if (!chosen.containsKey(s.id())) rest.add(s);
    }
    Collections.shuffle(rest, rng);
    for (Senator s : rest) {
      if (chosen.size() >= max) break;
      chosen.putIfAbsent(s.id(), s);
    }
    return List.copyOf(chosen.values());
  }

  /** How a faction reacts to the topic once the given amendments are on the table. */
  public FactionReaction processFactionStance(String faction, String topic, List<Amendment> amendments) {
    double stance = topicBias(faction, topic);
    double initial = stance;

    List<FactionReaction.Effect> effects = new ArrayList<>();
    for (Amendment a : amendments == null ? List.<Amendment>of() : amendments) {
      double effect = relations.get(faction, a.proposerFaction()) * 0.3;
      effect += (a.supportFrom(faction) - 0.5) * 0.5;
      if (a.corruptionInvolved() && corruption.factionLevel(faction) > CORRUPT_FACTION_THRESHOLD) {
        effect += 0.2;
      }
      effects.add(new FactionReaction.Effect(a.proposerId(), effect, reasoning(effect, a.proposerId())));
      stance += effect;
    }

    double finalStance = Bounds.relation(stance);
    Stance category = finalStance > 0.3 ? Stance.SUPPORT : finalStance < -0.3 ? Stance.OPPOSE : Stance.NEUTRAL;
    String primary = effects.stream()
        .max(Comparator.comparingDouble(e -> Math.abs(e.effect())))
        .map(FactionReaction.Effect::reasoning)
        .orElse("based on faction interests");
    return new FactionReaction(faction, initial, finalStance, category, effects, primary);
  }

  public void archive(List<Amendment> amendments) {
    if (amendments == null) return;
    for (Amendment a : amendments) {
      if (a != null) history.add(a);
    }
  }

  public List<Amendment> history() {
    return Collections.unmodifiableList(history);
  }

  static double topicBias(String faction, String topic) {
    String t = topic == null ? "" : topic.toLowerCase(Locale.ROOT);
    if (t.contains("military")) {
      if (Factions.MILITARY.equals(faction)) return 0.6;
      if (Factions.MERCHANT.equals(faction)) return 0.3;
    } else if (t.contains("tax")) {
      if (Factions.MERCHANT.equals(faction)) return -0.4;
      if (Factions.POPULARES.equals(faction)) return 0.3;
    } else if (t.contains("land")) {
      if (Factions.OPTIMATES.equals(faction)) return -0.5;
      if (Factions.POPULARES.equals(faction)) return 0.7;
    } else if (t.contains("religious")) {
      if (Factions.RELIGIOUS.equals(faction)) return 0.6;
    }
    return 0.0;
  }

  private static String reasoning(double effect, String proposerId) {
    if (effect > 0.3) return "strongly supports the amendment by " + proposerId;
    if (effect > 0.1) return "moderately supports the amendment by " + proposerId;
    if (effect < -0.3) return "strongly opposes the amendment by " + proposerId;
    if (effect < -0.1) return "moderately opposes the amendment by " + proposerId;
    return "is neutral toward the amendment by " + proposerId;
  }

  private Set<String> pactFactions(Senator senator, NegotiationOutcome outcome) {
    Set<String> out = new LinkedHashSet<>();
    if (outcome == null) return out;
    for (MeetingRecord m : outcome.commitmentsOf(senator.id())) {
      if (m.dealType() != DealType.AMENDMENT_SUPPORT) continue;
      out.add(senator.id().equals(m.initiatorId()) ? m.targetFaction() : m.initiatorFaction());
    }
    return out;
  }

  private static Map<String, Stance> scoredFactions(Map<String, Stance> factionStances) {
    Map<String, Stance> out = new LinkedHashMap<>();
    if (factionStances == null || factionStances.isEmpty()) {
      Factions.KNOWN.forEach(f -> out.put(f, Stance.NEUTRAL));
      return out;
    }
    factionStances.forEach((f, s) -> {
      if (f != null) out.put(f, s == null ? Stance.NEUTRAL : s);
    });
    return out;
  }

  private String rationale(AmendmentIntent intent, String faction) {
    String prefix = PREFIXES.get(rng.nextInt(PREFIXES.size()));
    return switch (intent) {
      case STRENGTHEN_WITH_BENEFITS -> prefix + " additional provisions be made for " + faction
          + " interests, specifically in areas of oversight and resource allocation";
      case STRENGTHEN_BROADLY -> prefix + " the scope be expanded to include additional " + faction
          + " priorities while maintaining the core proposal";
      case CLARIFY_SUPPORTIVELY -> prefix
          + " specific language be added to clarify implementation procedures to ensure effective execution";
      case REDIRECT_BENEFITS -> prefix + " all benefits and resources provided shall be administered by a committee with "
          + faction + " representation";
      case WEAKEN_SUBSTANTIALLY -> prefix
          + " the proposal's scope be significantly reduced and subject to annual review by the Senate";
      case LIMIT_SCOPE -> prefix
          + " the application be limited to specific regions and circumstances to be determined by Senate committee";
      case INSERT_UNRELATED_BENEFITS -> prefix + " additional funding be allocated for "
          + UNRELATED_BENEFITS.get(rng.nextInt(UNRELATED_BENEFITS.size())) + " in regions supporting the " + faction;
      case MODERATE_COMPROMISE -> prefix
          + " a balanced approach be taken, incorporating reasonable concerns from both supporting and opposing factions";
    };
  }
}
