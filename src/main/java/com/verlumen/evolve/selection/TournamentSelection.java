package com.verlumen.evolve.selection;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.evolve.engine.Chromosome;
import com.verlumen.evolve.engine.RandomSampling;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/** Samples a tournament without replacement and returns its two fittest contestants. */
public final class TournamentSelection implements SelectionMethod {
  private final Random random;
  private final int tournamentSize;

  public TournamentSelection(Random random, int tournamentSize) {
    checkArgument(
        tournamentSize >= 2, "Tournament size must be at least 2, got %s", tournamentSize);
    this.random = checkNotNull(random);
    this.tournamentSize = tournamentSize;
  }

  public int tournamentSize() {
    return tournamentSize;
  }

  @Override
  public ParentPair selectPair(List<Chromosome> population) {
    checkArgument(
        tournamentSize <= population.size(),
        "Tournament size %s exceeds population size %s",
        tournamentSize,
        population.size());
    List<Chromosome> contestants = new ArrayList<>(tournamentSize);
    int[] indices =
        RandomSampling.sampleWithoutReplacement(population.size(), tournamentSize, random);
    for (int index : indices) {
      contestants.add(population.get(index));
    }
    contestants.sort(Comparator.comparingDouble(Chromosome::fitness).reversed());
    return ParentPair.create(contestants.get(0), contestants.get(1));
  }
}
