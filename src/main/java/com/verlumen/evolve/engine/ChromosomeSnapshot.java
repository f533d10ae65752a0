package com.verlumen.evolve.engine;

import com.google.auto.value.AutoValue;
import com.google.common.primitives.ImmutableDoubleArray;

/**
 * Unit of work for an evaluation worker: the position of a chromosome in the population, a copy of
 * its genes, and its provider already configured from those genes. Only the scalar result goes
 * back to the coordinator.
 */
@AutoValue
public abstract class ChromosomeSnapshot {
  static ChromosomeSnapshot create(
      int index, ImmutableDoubleArray genes, FitnessProvider configuredProvider) {
    return new AutoValue_ChromosomeSnapshot(index, genes, configuredProvider);
  }

  public abstract int index();

  public abstract ImmutableDoubleArray genes();

  abstract FitnessProvider configuredProvider();

  /**
   * Evaluates the captured provider.
   *
   * @throws FitnessEvaluationException if the provider fails
   */
  public FitnessResult evaluate() {
    try {
      return FitnessResult.create(index(), configuredProvider().evaluate());
    } catch (RuntimeException e) {
      throw new FitnessEvaluationException(index(), e);
    }
  }
}
