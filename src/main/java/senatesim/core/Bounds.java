package senatesim.core;

/**
 * Clamping helpers for every bounded quantity in the negotiation core.
 * Out-of-range values are pulled back to the nearest bound; NaN collapses to the lower bound.
 */
public final class Bounds {
  public static final double FAVOR_MIN = 0.0;
  public static final double FAVOR_MAX = 1.0;
  public static final double RELATION_MIN = -1.0;
  public static final double RELATION_MAX = 1.0;
  public static final double INFLUENCE_DELTA_MAX = 0.5;

  private Bounds() {}

  public static double clamp(double value, double min, double max) {
    if (Double.isNaN(value)) return min;
    return Math.max(min, Math.min(max, value));
  }

  public static double unit(double value) {
    return clamp(value, 0.0, 1.0);
  }

  public static double favor(double value) {
    return clamp(value, FAVOR_MIN, FAVOR_MAX);
  }

  public static double relation(double value) {
    return clamp(value, RELATION_MIN, RELATION_MAX);
  }

  public static double influenceDelta(double value) {
    return clamp(value, -INFLUENCE_DELTA_MAX, INFLUENCE_DELTA_MAX);
  }
}
