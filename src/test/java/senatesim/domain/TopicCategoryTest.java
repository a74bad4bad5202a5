package senatesim.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TopicCategoryTest {

  @ParameterizedTest
  @CsvSource({
      "Military Affairs, MILITARY_AFFAIRS",
      "economic_policy, ECONOMIC_POLICY",
      "  legal   reforms , LEGAL_REFORMS",
      "Chariot racing, GENERAL"
  })
  void parsesLabelsAndConstantNames(String raw, TopicCategory expected) {
    assertEquals(expected, TopicCategory.fromLabel(raw));
  }

  @Test
  void labelsIgnoreTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr"));
    try {
      assertEquals(TopicCategory.MILITARY_AFFAIRS, TopicCategory.fromLabel("MILITARY_AFFAIRS"));
      assertEquals(TopicCategory.RELIGIOUS_MATTERS, TopicCategory.fromLabel("RELIGIOUS MATTERS"));
      assertEquals("limit-scope", AmendmentIntent.LIMIT_SCOPE.label());
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void knowsItsStakeholders() {
    assertTrue(TopicCategory.FOREIGN_POLICY.isStakeholder(Factions.MERCHANT));
    assertFalse(TopicCategory.FOREIGN_POLICY.isStakeholder(Factions.RELIGIOUS));
    assertTrue(TopicCategory.GENERAL.stakeholderFactions().isEmpty());
  }

  @Test
  void corruptPairsLeanTowardResourceDeals() {
    double clean = DealType.RESOURCE_ALLOCATION.weight(TopicCategory.GENERAL, 0.0);
    double dirty = DealType.RESOURCE_ALLOCATION.weight(TopicCategory.GENERAL, 0.8);
    assertEquals(1.0, clean, 1e-12);
    assertEquals(2.6, dirty, 1e-12);
    assertEquals(2.0, DealType.AMENDMENT_SUPPORT.weight(TopicCategory.LEGAL_REFORMS, 0.8), 1e-12);
  }
}
