package com.verlumen.evolve.mutation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import com.verlumen.evolve.engine.RandomSampling;
import java.util.Random;

/**
 * Exchanges two distinct, uniformly chosen genes. Unlike the per-gene mutations this is a single
 * trial per call, taken with probability {@code 2 * rate}.
 */
public final class SwapMutation implements MutationMethod {
  private final Random random;
  private final double rate;

  public SwapMutation(Random random, double rate) {
    this.random = checkNotNull(random);
    this.rate = MutationRates.checkRate(rate);
  }

  @Override
  public void mutate(Chromosome chromosome) {
    if (chromosome.length() < 2) {
      return;
    }
    if (random.nextDouble() < 2 * rate) {
      int[] positions = RandomSampling.sampleWithoutReplacement(chromosome.length(), 2, random);
      double first = chromosome.getGene(positions[0]);
      chromosome.setGene(positions[0], chromosome.getGene(positions[1]));
      chromosome.setGene(positions[1], first);
    }
  }
}
