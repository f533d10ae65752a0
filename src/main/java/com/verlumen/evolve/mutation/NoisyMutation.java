package com.verlumen.evolve.mutation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import java.util.Random;

/**
 * Scales each gene, with probability {@code rate}, by {@code 1 + volume} or {@code 1 - volume}
 * (chosen with equal probability). The perturbation is relative to the gene's magnitude.
 */
public final class NoisyMutation implements MutationMethod {
  private final Random random;
  private final double rate;
  private final double volume;

  public NoisyMutation(Random random, double rate, double volume) {
    checkArgument(volume >= 0, "Mutation volume must be non-negative, got %s", volume);
    this.random = checkNotNull(random);
    this.rate = MutationRates.checkRate(rate);
    this.volume = volume;
  }

  @Override
  public void mutate(Chromosome chromosome) {
    for (int i = 0; i < chromosome.length(); i++) {
      if (random.nextDouble() < rate) {
        double sign = random.nextBoolean() ? 1 : -1;
        chromosome.setGene(i, (1 + sign * volume) * chromosome.getGene(i));
      }
    }
  }
}
