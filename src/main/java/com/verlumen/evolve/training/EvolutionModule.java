package com.verlumen.evolve.training;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.multibindings.Multibinder;
import com.verlumen.evolve.crossover.CrossoverMethod;
import com.verlumen.evolve.crossover.KPointCrossover;
import com.verlumen.evolve.crossover.OnePointCrossover;
import com.verlumen.evolve.crossover.UniformCrossover;
import com.verlumen.evolve.engine.FitnessEvaluator;
import com.verlumen.evolve.engine.GeneInitializer;
import com.verlumen.evolve.engine.GenerationListener;
import com.verlumen.evolve.engine.LoggingGenerationListener;
import com.verlumen.evolve.engine.ParallelFitnessEvaluator;
import com.verlumen.evolve.engine.PopulationConfig;
import com.verlumen.evolve.engine.UniformGeneInitializer;
import com.verlumen.evolve.engine.Verbosity;
import com.verlumen.evolve.mutation.FlipMutation;
import com.verlumen.evolve.mutation.MutationMethod;
import com.verlumen.evolve.mutation.NoisyMutation;
import com.verlumen.evolve.mutation.SwapMutation;
import com.verlumen.evolve.selection.RankSelection;
import com.verlumen.evolve.selection.RouletteSelection;
import com.verlumen.evolve.selection.SelectionMethod;
import com.verlumen.evolve.selection.TournamentSelection;
import java.util.Random;

/**
 * Wires a {@link com.verlumen.evolve.engine.Population} and its strategies from an {@link
 * EvolutionConfig}. The {@link com.verlumen.evolve.engine.FitnessProviderFactory} must be bound
 * by another module.
 */
@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  public static EvolutionModule create(EvolutionConfig config) {
    return new AutoValue_EvolutionModule(config);
  }

  abstract EvolutionConfig config();

  @Override
  protected void configure() {
    Multibinder.newSetBinder(binder(), GenerationListener.class)
        .addBinding()
        .to(LoggingGenerationListener.class);
  }

  @Provides
  @Singleton
  Random provideRandom() {
    return config().seed().map(Random::new).orElseGet(Random::new);
  }

  @Provides
  PopulationConfig providePopulationConfig() {
    return PopulationConfig.create(config().populationSize(), config().geneCount());
  }

  @Provides
  Verbosity provideVerbosity() {
    return config().verbosity();
  }

  @Provides
  GeneInitializer provideGeneInitializer(Random random) {
    return new UniformGeneInitializer(config().initialGeneMin(), config().initialGeneMax(), random);
  }

  @Provides
  @Singleton
  FitnessEvaluator provideFitnessEvaluator() {
    return new ParallelFitnessEvaluator(config().workerCount());
  }

  @Provides
  @Singleton
  SelectionMethod provideSelectionMethod(Random random) {
    switch (config().selectionType()) {
      case ROULETTE:
        return new RouletteSelection(random, config().degenerateWeightPolicy());
      case RANK:
        return new RankSelection(random);
      case TOURNAMENT:
        return new TournamentSelection(random, config().tournamentSize());
    }
    throw new IllegalArgumentException("Unsupported selection type: " + config().selectionType());
  }

  @Provides
  @Singleton
  CrossoverMethod provideCrossoverMethod(Random random) {
    switch (config().crossoverType()) {
      case ONE_POINT:
        return new OnePointCrossover(random);
      case K_POINT:
        return new KPointCrossover(random, config().crossoverPoints());
      case UNIFORM:
        return new UniformCrossover(random);
    }
    throw new IllegalArgumentException("Unsupported crossover type: " + config().crossoverType());
  }

  @Provides
  @Singleton
  MutationMethod provideMutationMethod(Random random) {
    switch (config().mutationType()) {
      case NOISY:
        return new NoisyMutation(random, config().mutationRate(), config().mutationVolume());
      case FLIP:
        return new FlipMutation(random, config().mutationRate());
      case SWAP:
        return new SwapMutation(random, config().mutationRate());
    }
    throw new IllegalArgumentException("Unsupported mutation type: " + config().mutationType());
  }
}
