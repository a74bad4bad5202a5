package senatesim.domain;

import senatesim.core.Bounds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Amendment {
  private final String proposerId;
  private final String proposerFaction;
  private final String topic;
  private final AmendmentIntent intent;
  private final String rationale;
  private final Map<String, Double> factionSupport;
  private final boolean corruptionInvolved;
  private final boolean personalBenefit;

  public Amendment(String proposerId, String proposerFaction, String topic, AmendmentIntent intent,
                   String rationale, Map<String, Double> factionSupport,
                   boolean corruptionInvolved, boolean personalBenefit) {
    this.proposerId = proposerId;
    this.proposerFaction = proposerFaction == null ? Senator.INDEPENDENT : proposerFaction;
    this.topic = topic == null ? "" : topic;
    this.intent = intent;
    this.rationale = rationale == null ? "" : rationale;
    Map<String, Double> support = new LinkedHashMap<>();
    if (factionSupport != null) {
      factionSupport.forEach((faction, value) -> support.put(faction, Bounds.unit(value == null ? 0.5 : value)));
    }
    this.factionSupport = Collections.unmodifiableMap(support);
    this.corruptionInvolved = corruptionInvolved;
    this.personalBenefit = personalBenefit;
  }

  public String proposerId() { return proposerId; }
  public String proposerFaction() { return proposerFaction; }
  public String topic() { return topic; }
  public AmendmentIntent intent() { return intent; }
  public String rationale() { return rationale; }
  public Map<String, Double> factionSupport() { return factionSupport; }
  public boolean corruptionInvolved() { return corruptionInvolved; }
  public boolean personalBenefit() { return personalBenefit; }

  /** Support of a faction; factions not scored read as neutral. */
  public double supportFrom(String faction) {
    Double v = faction == null ? null : factionSupport.get(faction);
    return v == null ? 0.5 : v;
  }

  public double averageSupport() {
    if (factionSupport.isEmpty()) return 0.5;
    return factionSupport.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.5);
  }

  @Override
  public String toString() {
    return "Amendment{" + proposerId + ", " + intent.label() + ", avgSupport=" + String.format("%.2f", averageSupport()) + "}";
  }
}
