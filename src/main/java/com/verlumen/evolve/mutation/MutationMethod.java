package com.verlumen.evolve.mutation;

import com.verlumen.evolve.engine.Chromosome;

/**
 * Randomly perturbs a chromosome's genes in place. Never changes the number of genes, and keeps no
 * state between calls.
 */
public interface MutationMethod {
  void mutate(Chromosome chromosome);
}
