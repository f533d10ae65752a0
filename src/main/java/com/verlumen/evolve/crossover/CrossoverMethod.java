package com.verlumen.evolve.crossover;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolve.engine.Chromosome;

/**
 * Recombines two parents into one child.
 *
 * <p>Variants differ only in the inheritance rule: a per-position flag that is {@code true} where
 * the child takes the first parent's gene and {@code false} where it takes the second's. Every
 * child gene is copied from exactly one parent; there is no blending.
 */
public interface CrossoverMethod {
  /** Returns a fresh inheritance rule of length {@code geneCount}. */
  boolean[] inheritanceRule(int geneCount);

  /**
   * Breeds a new chromosome whose genes are assembled position by position from the parents.
   *
   * @throws IllegalArgumentException if the parents have different lengths
   */
  default Chromosome breed(Chromosome parent1, Chromosome parent2) {
    checkArgument(
        parent1.length() == parent2.length(),
        "Parents differ in length: %s vs %s",
        parent1.length(),
        parent2.length());
    int geneCount = parent1.length();
    boolean[] rule = inheritanceRule(geneCount);
    checkState(rule.length == geneCount, "Rule covers %s of %s genes", rule.length, geneCount);

    ImmutableDoubleArray.Builder childGenes = ImmutableDoubleArray.builder(geneCount);
    for (int i = 0; i < geneCount; i++) {
      childGenes.add(rule[i] ? parent1.getGene(i) : parent2.getGene(i));
    }
    return parent1.offspring(childGenes.build());
  }
}
