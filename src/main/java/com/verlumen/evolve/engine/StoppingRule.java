package com.verlumen.evolve.engine;

import static com.verlumen.evolve.engine.EvolutionConstants.MINIMUM_GENERATIONS;

/** Convergence test applied after each generation. */
final class StoppingRule {
  private StoppingRule() {}

  /**
   * Returns true once at least {@link EvolutionConstants#MINIMUM_GENERATIONS} generations have
   * completed and the mean fitness moved by less than {@code threshold}, relative to the previous
   * mean.
   */
  static boolean hasConverged(
      int generation, double meanFitness, double previousMeanFitness, double threshold) {
    if (generation < MINIMUM_GENERATIONS) {
      return false;
    }
    // NaN (no previous mean yet) compares false.
    return relativeChange(meanFitness, previousMeanFitness) < threshold;
  }

  static double relativeChange(double meanFitness, double previousMeanFitness) {
    if (previousMeanFitness == 0) {
      return meanFitness == 0 ? 0 : Double.POSITIVE_INFINITY;
    }
    return Math.abs(meanFitness - previousMeanFitness) / Math.abs(previousMeanFitness);
  }
}
