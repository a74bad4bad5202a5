package senatesim.memory;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import senatesim.core.ScriptedRandom;
import senatesim.core.SimulationLogger;
import senatesim.domain.FavorChange;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PoliticalFavorLedgerTest {
  private PoliticalFavorLedger ledger;

  @BeforeAll
  static void quiet() {
    SimulationLogger.setEnabled(false);
  }

  @BeforeEach
  void setUp() {
    ledger = new PoliticalFavorLedger(new SocialGraph());
  }

  @Test
  void creditAccumulatesAndSaturatesAtOne() {
    assertEquals(0.4, ledger.credit("clodius", "crassus", 0.4), 1e-12);
    assertEquals(0.8, ledger.credit("clodius", "crassus", 0.4), 1e-12);
    assertEquals(1.0, ledger.credit("clodius", "crassus", 0.9), 1e-12);
    assertEquals(0.0, ledger.balance("crassus", "clodius"));
  }

  @Test
  void ignoresSelfDebtAndNonPositiveAmounts() {
    ledger.credit("cato", "cato", 0.5);
    ledger.credit("cato", "bibulus", -0.2);
    ledger.credit("cato", "bibulus", Double.NaN);
    assertEquals(0, ledger.size());
  }

  @Test
  void callingInWithoutDebtReportsNoFavorOwedAndChangesNothing() {
    ledger.credit("rullus", "cato", 0.3);

    FavorResolution r = ledger.resolve("cato", "rullus", 0.9, 0.5, new Random(1));

    assertTrue(r.noFavorOwed());
    assertEquals(PoliticalFavorLedger.NO_FAVOR_OWED, r.reason());
    assertFalse(r.honored());
    assertTrue(r.changes().isEmpty());
    assertEquals(1, ledger.size());
    assertEquals(0.3, ledger.balance("rullus", "cato"), 1e-12);
    assertEquals(0.0, ledger.socialGraph().standing("cato", "rullus"));
  }

  @Test
  void honoredCallPaysOffTheWholeBalance() {
    ledger.credit("bibulus", "cato", 0.5);

    FavorResolution r = ledger.resolve("bibulus", "cato", 0.9, 0.0, new ScriptedRandom(0.0, 0.99));

    assertTrue(r.honored());
    assertFalse(r.partial());
    assertEquals(0.0, r.counterObligation());
    assertEquals(0.0, ledger.balance("bibulus", "cato"));
    assertEquals(0, ledger.size());
  }

  @Test
  void honoredCallCanCreateCounterObligation() {
    ledger.credit("bibulus", "cato", 0.6);

    FavorResolution r = ledger.resolve("bibulus", "cato", 0.9, 0.0, new ScriptedRandom(0.0, 0.0));

    assertTrue(r.honored());
    assertEquals(0.3, r.counterObligation(), 1e-12);
    assertEquals(0.3, ledger.balance("cato", "bibulus"), 1e-12);
  }

  @Test
  void partialRequestLeavesRemainder() {
    ledger.credit("atticus", "crassus", 0.8);

    FavorResolution r = ledger.resolve("atticus", "crassus", 0.5, 0.0, 0.3, new ScriptedRandom(0.0, 0.99));

    assertTrue(r.honored());
    assertTrue(r.partial());
    assertEquals(0.5, ledger.balance("atticus", "crassus"), 1e-9);
  }

  @Test
  void refusalErodesDebtAndStrainsStanding() {
    ledger.credit("clodius", "cato", 0.4);

    FavorResolution r = ledger.resolve("clodius", "cato", 0.0, -1.0, new ScriptedRandom(0.5));

    assertFalse(r.honored());
    assertEquals(0.0, r.complianceProbability(), 1e-12);
    assertEquals(0.28, ledger.balance("clodius", "cato"), 1e-9);
    assertEquals(-0.2, ledger.socialGraph().standing("clodius", "cato"), 1e-12);
  }

  @Test
  void assessDoesNotTouchTheLedger() {
    ledger.credit("clodius", "cato", 0.7);

    FavorResolution r = ledger.assess("clodius", "cato", 0.5, 0.0, 0.0, new ScriptedRandom(0.0, 0.0));

    assertTrue(r.honored());
    assertEquals(0.7, ledger.balance("clodius", "cato"), 1e-12);
    assertEquals(0.0, ledger.balance("cato", "clodius"));
  }

  @Test
  void loyalDebtorsHonorMoreOften() {
    ledger.credit("loyal", "patron", 0.5);
    ledger.credit("fickle", "patron", 0.5);
    Random rng = new Random(11);

    int loyalHonored = 0;
    int fickleHonored = 0;
    for (int i = 0; i < 2000; i++) {
      if (ledger.assess("loyal", "patron", 0.9, 0.0, 0.0, rng).honored()) loyalHonored++;
      if (ledger.assess("fickle", "patron", 0.1, 0.0, 0.0, rng).honored()) fickleHonored++;
    }

    assertTrue(loyalHonored > fickleHonored, loyalHonored + " vs " + fickleHonored);
  }

  @Test
  void complianceProbabilityFollowsBalanceLoyaltyAndRelation() {
    assertEquals(0.7, PoliticalFavorLedger.complianceProbability(0.5, 0.9, 0.0), 1e-12);
    assertEquals(0.4, PoliticalFavorLedger.complianceProbability(0.5, 0.1, 0.5), 1e-12);
    assertEquals(1.0, PoliticalFavorLedger.complianceProbability(1.0, 1.0, 1.0), 1e-12);
  }

  @Test
  void negativeChangesPayDownWithoutGoingBelowZero() {
    ledger.credit("rullus", "clodius", 0.2);
    ledger.apply(new FavorChange("rullus", "clodius", -0.5));
    assertEquals(0.0, ledger.balance("rullus", "clodius"));
  }

  @Test
  void forgiveClearsTheDebt() {
    ledger.credit("clodius", "crassus", 0.9);
    ledger.forgive("clodius", "crassus");
    assertEquals(0.0, ledger.balance("clodius", "crassus"));
    assertTrue(ledger.debtsOf("clodius").isEmpty());
  }

  @Test
  void mapRoundTripKeepsBalances() {
    ledger.credit("a", "b", 0.3);
    ledger.credit("a", "c", 0.6);
    ledger.credit("c", "a", 0.1);

    PoliticalFavorLedger restored = PoliticalFavorLedger.fromMap(ledger.toMap(), new SocialGraph());

    assertEquals(ledger.toMap(), restored.toMap());
    assertEquals(2, restored.debtsOf("a").size());
    assertEquals(0.6, restored.owedTo("c").get("a"), 1e-12);
  }
}
