package com.verlumen.evolve.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.evolve.engine.Chromosome;
import java.util.List;

/**
 * Chooses parents from an evaluated population.
 *
 * <p>Pairs are drawn with replacement across calls: the same chromosome may take part in many
 * pairs, but never twice in the same pair. Implementations must not modify {@code population}.
 */
public interface SelectionMethod {
  /**
   * Draws one pair of distinct parents.
   *
   * @throws IllegalArgumentException if the population has fewer than two members
   */
  ParentPair selectPair(List<Chromosome> population);

  /** Draws {@code count} independent pairs. */
  default ImmutableList<ParentPair> selectParents(List<Chromosome> population, int count) {
    checkArgument(count >= 0, "Pair count must be non-negative, got %s", count);
    ImmutableList.Builder<ParentPair> parents = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      parents.add(selectPair(population));
    }
    return parents.build();
  }
}
