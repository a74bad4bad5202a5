package senatesim.core;

import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

public final class WeightedDraw {
  private WeightedDraw() {}

  /**
   * Picks one item with probability proportional to its weight. Non-positive weights never win.
   * Returns null when nothing carries weight.
   */
  public static <T> T pick(List<T> items, ToDoubleFunction<T> weight, Random rng) {
    if (items == null || items.isEmpty()) return null;
    double total = 0.0;
    double[] weights = new double[items.size()];
    for (int i = 0; i < items.size(); i++) {
      double w = weight.applyAsDouble(items.get(i));
      weights[i] = Double.isNaN(w) || w <= 0.0 ? 0.0 : w;
      total += weights[i];
    }
    if (total <= 0.0) return null;

    double roll = rng.nextDouble() * total;
    double acc = 0.0;
    T last = null;
    for (int i = 0; i < items.size(); i++) {
      if (weights[i] <= 0.0) continue;
      acc += weights[i];
      last = items.get(i);
      if (roll < acc) return last;
    }
    return last;
  }
}
