package senatesim.domain;

import java.util.Locale;

public enum Stance {
  SUPPORT,
  OPPOSE,
  NEUTRAL;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
