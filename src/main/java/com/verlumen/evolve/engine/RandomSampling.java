package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Random;

/** Sampling helpers shared by the selection and crossover strategies. */
public final class RandomSampling {
  private RandomSampling() {}

  /**
   * Draws {@code count} distinct integers uniformly from {@code [0, bound)}, in draw order.
   *
   * @throws IllegalArgumentException if {@code count > bound} or either is negative
   */
  public static int[] sampleWithoutReplacement(int bound, int count, Random random) {
    checkArgument(bound >= 0 && count >= 0, "bound and count must be non-negative");
    checkArgument(count <= bound, "Cannot draw %s distinct values from %s", count, bound);
    int[] pool = new int[bound];
    for (int i = 0; i < bound; i++) {
      pool[i] = i;
    }
    // Partial Fisher-Yates: the first count slots end up holding the sample.
    int[] sample = new int[count];
    for (int i = 0; i < count; i++) {
      int j = i + random.nextInt(bound - i);
      int swap = pool[i];
      pool[i] = pool[j];
      pool[j] = swap;
      sample[i] = pool[i];
    }
    return sample;
  }
}
