package com.verlumen.evolve.crossover;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Random;

/** Takes each gene from either parent with equal probability. */
public final class UniformCrossover implements CrossoverMethod {
  private final Random random;

  public UniformCrossover(Random random) {
    this.random = checkNotNull(random);
  }

  @Override
  public boolean[] inheritanceRule(int geneCount) {
    boolean[] rule = new boolean[geneCount];
    for (int i = 0; i < geneCount; i++) {
      rule[i] = random.nextBoolean();
    }
    return rule;
  }
}
