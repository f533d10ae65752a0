package com.verlumen.evolve.selection;

import java.util.Random;

/** Draws an index with probability proportional to its weight. */
final class WeightedDraw {
  private WeightedDraw() {}

  static boolean isDegenerate(double[] weights) {
    for (double weight : weights) {
      if (weight > 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns an index {@code i} with probability {@code weights[i] / sum(weights)}. Non-positive
   * weights are never drawn.
   *
   * @throws DegenerateDistributionException if no weight is positive
   */
  static int draw(double[] weights, Random random) {
    double total = 0;
    for (double weight : weights) {
      if (weight > 0) {
        total += weight;
      }
    }
    if (!(total > 0)) {
      throw new DegenerateDistributionException(
          "Cannot draw from " + weights.length + " candidates: all weights are zero");
    }

    double target = random.nextDouble() * total;
    double cumulative = 0;
    int lastPositive = -1;
    for (int i = 0; i < weights.length; i++) {
      if (weights[i] <= 0) {
        continue;
      }
      lastPositive = i;
      cumulative += weights[i];
      if (target < cumulative) {
        return i;
      }
    }
    // Rounding can leave target just above the final cumulative sum.
    return lastPositive;
  }
}
