package com.verlumen.evolve.crossover;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Random;

/**
 * Cuts both parents at one point {@code t} drawn from {@code [0, n)}: genes before {@code t} come
 * from the first parent, the rest from the second.
 */
public final class OnePointCrossover implements CrossoverMethod {
  private final Random random;

  public OnePointCrossover(Random random) {
    this.random = checkNotNull(random);
  }

  @Override
  public boolean[] inheritanceRule(int geneCount) {
    return ruleForCutPoint(geneCount, random.nextInt(geneCount));
  }

  static boolean[] ruleForCutPoint(int geneCount, int cutPoint) {
    boolean[] rule = new boolean[geneCount];
    for (int i = 0; i < cutPoint; i++) {
      rule[i] = true;
    }
    return rule;
  }
}
