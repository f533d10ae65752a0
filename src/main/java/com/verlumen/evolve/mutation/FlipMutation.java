package com.verlumen.evolve.mutation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import java.util.Random;

/** Negates each gene independently with probability {@code rate}. */
public final class FlipMutation implements MutationMethod {
  private final Random random;
  private final double rate;

  public FlipMutation(Random random, double rate) {
    this.random = checkNotNull(random);
    this.rate = MutationRates.checkRate(rate);
  }

  @Override
  public void mutate(Chromosome chromosome) {
    for (int i = 0; i < chromosome.length(); i++) {
      if (random.nextDouble() < rate) {
        chromosome.setGene(i, -chromosome.getGene(i));
      }
    }
  }
}
