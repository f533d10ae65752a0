package com.verlumen.evolve.selection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Linear rank selection.
 *
 * <p>Members are ranked by ascending fitness (ties keep population order) and the member at rank
 * {@code r} (1-based) is drawn with weight {@code r}. The second parent is drawn from the same
 * weights with the first parent's weight removed.
 */
public final class RankSelection implements SelectionMethod {
  private final Random random;

  public RankSelection(Random random) {
    this.random = checkNotNull(random);
  }

  @Override
  public ParentPair selectPair(List<Chromosome> population) {
    checkArgument(
        population.size() >= 2, "Need at least two chromosomes, got %s", population.size());
    List<Chromosome> ranked = new ArrayList<>(population);
    ranked.sort(Comparator.comparingDouble(Chromosome::fitness));

    double[] weights = rankWeights(ranked.size());
    int first = WeightedDraw.draw(weights, random);
    weights[first] = 0;
    int second = WeightedDraw.draw(weights, random);
    return ParentPair.create(ranked.get(first), ranked.get(second));
  }

  static double[] rankWeights(int size) {
    double[] weights = new double[size];
    for (int i = 0; i < size; i++) {
      weights[i] = i + 1;
    }
    return weights;
  }
}
