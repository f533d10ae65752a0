package com.verlumen.evolve.crossover;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.RandomSampling;
import java.util.Arrays;
import java.util.Random;

/**
 * Cuts both parents at {@code k} distinct points. The child starts with the first parent's genes
 * and switches source parent at every cut point.
 */
public final class KPointCrossover implements CrossoverMethod {
  private final Random random;
  private final int k;

  public KPointCrossover(Random random, int k) {
    checkArgument(k > 0, "Number of cut points must be positive, got %s", k);
    this.random = checkNotNull(random);
    this.k = k;
  }

  public int k() {
    return k;
  }

  @Override
  public boolean[] inheritanceRule(int geneCount) {
    checkArgument(k <= geneCount, "Cannot place %s cut points in %s genes", k, geneCount);
    int[] cutPoints = RandomSampling.sampleWithoutReplacement(geneCount, k, random);
    Arrays.sort(cutPoints);
    return ruleForCutPoints(geneCount, cutPoints);
  }

  /** Builds the rule for distinct, ascending cut points. */
  static boolean[] ruleForCutPoints(int geneCount, int... cutPoints) {
    boolean[] rule = new boolean[geneCount];
    boolean fromFirst = true;
    int next = 0;
    for (int i = 0; i < geneCount; i++) {
      if (next < cutPoints.length && cutPoints[next] == i) {
        fromFirst = !fromFirst;
        next++;
      }
      rule[i] = fromFirst;
    }
    return rule;
  }
}
