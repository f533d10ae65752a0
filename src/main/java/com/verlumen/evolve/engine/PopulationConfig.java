package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Shape of a population: how many chromosomes, each with how many genes. */
@AutoValue
public abstract class PopulationConfig {
  public static PopulationConfig create(int size, int geneCount) {
    checkArgument(size >= 2, "Population needs at least two chromosomes, got %s", size);
    checkArgument(geneCount > 0, "Gene count must be positive, got %s", geneCount);
    return new AutoValue_PopulationConfig(size, geneCount);
  }

  public abstract int size();

  public abstract int geneCount();
}
