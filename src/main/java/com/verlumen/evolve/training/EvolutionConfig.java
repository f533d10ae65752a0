package com.verlumen.evolve.training;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.evolve.engine.EvolutionConstants;
import com.verlumen.evolve.engine.Verbosity;
import com.verlumen.evolve.selection.RouletteSelection.DegenerateWeightPolicy;
import java.util.Optional;

/** Everything needed to assemble a population and its strategies. */
@AutoValue
public abstract class EvolutionConfig {
  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setPopulationSize(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .setSelectionType(SelectionType.ROULETTE)
        .setTournamentSize(EvolutionConstants.DEFAULT_TOURNAMENT_SIZE)
        .setDegenerateWeightPolicy(DegenerateWeightPolicy.FAIL)
        .setCrossoverType(CrossoverType.UNIFORM)
        .setCrossoverPoints(EvolutionConstants.DEFAULT_CROSSOVER_POINTS)
        .setMutationType(MutationType.NOISY)
        .setMutationRate(EvolutionConstants.DEFAULT_MUTATION_RATE)
        .setMutationVolume(EvolutionConstants.DEFAULT_MUTATION_VOLUME)
        .setInitialGeneMin(EvolutionConstants.DEFAULT_INITIAL_GENE_MIN)
        .setInitialGeneMax(EvolutionConstants.DEFAULT_INITIAL_GENE_MAX)
        .setWorkerCount(Runtime.getRuntime().availableProcessors())
        .setVerbosity(Verbosity.SUMMARY);
  }

  public abstract int populationSize();

  public abstract int geneCount();

  public abstract SelectionType selectionType();

  public abstract int tournamentSize();

  public abstract DegenerateWeightPolicy degenerateWeightPolicy();

  public abstract CrossoverType crossoverType();

  /** Number of cut points for {@link CrossoverType#K_POINT}. */
  public abstract int crossoverPoints();

  public abstract MutationType mutationType();

  public abstract double mutationRate();

  /** Relative perturbation for {@link MutationType#NOISY}. */
  public abstract double mutationVolume();

  public abstract double initialGeneMin();

  public abstract double initialGeneMax();

  /** Seed for the shared random source; unseeded when empty. */
  public abstract Optional<Long> seed();

  public abstract int workerCount();

  public abstract Verbosity verbosity();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setGeneCount(int geneCount);

    public abstract Builder setSelectionType(SelectionType selectionType);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setDegenerateWeightPolicy(DegenerateWeightPolicy policy);

    public abstract Builder setCrossoverType(CrossoverType crossoverType);

    public abstract Builder setCrossoverPoints(int crossoverPoints);

    public abstract Builder setMutationType(MutationType mutationType);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setMutationVolume(double mutationVolume);

    public abstract Builder setInitialGeneMin(double initialGeneMin);

    public abstract Builder setInitialGeneMax(double initialGeneMax);

    public abstract Builder setSeed(long seed);

    public abstract Builder setSeed(Optional<Long> seed);

    public abstract Builder setWorkerCount(int workerCount);

    public abstract Builder setVerbosity(Verbosity verbosity);

    abstract EvolutionConfig autoBuild();

    public EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      checkArgument(config.workerCount() > 0, "Worker count must be positive");
      if (config.selectionType() == SelectionType.TOURNAMENT) {
        checkArgument(
            config.tournamentSize() <= config.populationSize(),
            "Tournament size %s exceeds population size %s",
            config.tournamentSize(),
            config.populationSize());
      }
      if (config.crossoverType() == CrossoverType.K_POINT) {
        checkArgument(
            config.crossoverPoints() <= config.geneCount(),
            "Cannot place %s cut points in %s genes",
            config.crossoverPoints(),
            config.geneCount());
      }
      return config;
    }
  }
}
