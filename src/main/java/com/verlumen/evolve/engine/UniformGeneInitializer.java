package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Draws genes uniformly from {@code [min, max)}. */
public final class UniformGeneInitializer implements GeneInitializer {
  private final double min;
  private final double max;
  private final Random random;

  public UniformGeneInitializer(double min, double max, Random random) {
    checkArgument(min < max, "Gene range is empty: [%s, %s)", min, max);
    this.min = min;
    this.max = max;
    this.random = random;
  }

  @Override
  public double nextGene() {
    return min + (max - min) * random.nextDouble();
  }
}
