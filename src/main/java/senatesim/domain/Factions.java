package senatesim.domain;

import java.util.List;

public final class Factions {
  public static final String OPTIMATES = "Optimates";
  public static final String POPULARES = "Populares";
  public static final String MILITARY = "Military";
  public static final String RELIGIOUS = "Religious";
  public static final String MERCHANT = "Merchant";

  public static final List<String> KNOWN = List.of(OPTIMATES, POPULARES, MILITARY, RELIGIOUS, MERCHANT);

  private Factions() {}
}
