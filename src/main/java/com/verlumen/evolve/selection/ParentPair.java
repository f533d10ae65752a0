package com.verlumen.evolve.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.evolve.engine.Chromosome;

/** Two distinct chromosomes chosen to breed one child. */
@AutoValue
public abstract class ParentPair {
  /**
   * @throws IllegalArgumentException if both parents are the same instance
   */
  public static ParentPair create(Chromosome first, Chromosome second) {
    checkArgument(first != second, "A chromosome cannot be paired with itself");
    return new AutoValue_ParentPair(first, second);
  }

  public abstract Chromosome first();

  public abstract Chromosome second();
}
