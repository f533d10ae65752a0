package com.verlumen.evolve.selection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Fitness-proportionate selection on squared fitness.
 *
 * <p>Each parent is drawn with probability proportional to the square of its fitness, so a negative
 * fitness weighs as much as its magnitude and only a fitness of exactly zero weighs nothing. The
 * second parent is drawn from the candidates left after removing the first.
 */
public final class RouletteSelection implements SelectionMethod {
  /** What to do when every remaining candidate has zero weight. */
  public enum DegenerateWeightPolicy {
    /** Throw {@link DegenerateDistributionException}. */
    FAIL,
    /** Pick uniformly among the remaining candidates. */
    UNIFORM
  }

  private final Random random;
  private final DegenerateWeightPolicy degenerateWeightPolicy;

  public RouletteSelection(Random random) {
    this(random, DegenerateWeightPolicy.FAIL);
  }

  public RouletteSelection(Random random, DegenerateWeightPolicy degenerateWeightPolicy) {
    this.random = checkNotNull(random);
    this.degenerateWeightPolicy = checkNotNull(degenerateWeightPolicy);
  }

  @Override
  public ParentPair selectPair(List<Chromosome> population) {
    checkArgument(
        population.size() >= 2, "Need at least two chromosomes, got %s", population.size());
    List<Chromosome> candidates = new ArrayList<>(population);
    Chromosome first = candidates.remove(drawIndex(candidates));
    Chromosome second = candidates.remove(drawIndex(candidates));
    return ParentPair.create(first, second);
  }

  static double weight(Chromosome chromosome) {
    double fitness = chromosome.fitness();
    return fitness * fitness;
  }

  private int drawIndex(List<Chromosome> candidates) {
    double[] weights = candidates.stream().mapToDouble(RouletteSelection::weight).toArray();
    if (degenerateWeightPolicy == DegenerateWeightPolicy.UNIFORM
        && WeightedDraw.isDegenerate(weights)) {
      return random.nextInt(candidates.size());
    }
    return WeightedDraw.draw(weights, random);
  }
}
