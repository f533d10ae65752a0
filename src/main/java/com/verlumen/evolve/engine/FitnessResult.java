package com.verlumen.evolve.engine;

import com.google.auto.value.AutoValue;

/** Fitness of the chromosome at {@link #index()}, as reported back by an evaluation worker. */
@AutoValue
public abstract class FitnessResult {
  public static FitnessResult create(int index, double fitness) {
    return new AutoValue_FitnessResult(index, fitness);
  }

  public abstract int index();

  public abstract double fitness();
}
