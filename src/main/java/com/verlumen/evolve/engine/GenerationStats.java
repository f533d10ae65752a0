package com.verlumen.evolve.engine;

import com.google.auto.value.AutoValue;
import com.google.common.primitives.ImmutableDoubleArray;
import io.jenetics.stat.DoubleMomentStatistics;

/** Fitness statistics of one evaluated generation. */
@AutoValue
public abstract class GenerationStats {
  static GenerationStats create(
      int generation, ImmutableDoubleArray fitnesses, double previousMeanFitness) {
    DoubleMomentStatistics statistics = new DoubleMomentStatistics();
    fitnesses.forEach(statistics::accept);
    return new AutoValue_GenerationStats(
        generation,
        fitnesses,
        statistics.max(),
        statistics.min(),
        statistics.mean(),
        statistics.variance(),
        previousMeanFitness);
  }

  public abstract int generation();

  /** Fitness of every member, in member order. */
  public abstract ImmutableDoubleArray fitnesses();

  public abstract double bestFitness();

  public abstract double worstFitness();

  public abstract double meanFitness();

  public abstract double fitnessVariance();

  /** Mean fitness of the previous generation, NaN for the first evaluated generation. */
  public abstract double previousMeanFitness();

  public int populationSize() {
    return fitnesses().length();
  }

  /** Relative change of the mean against the previous generation. */
  public double improvement() {
    return (meanFitness() - previousMeanFitness()) / Math.abs(previousMeanFitness());
  }
}
