package com.verlumen.evolve.engine;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;

/** Reports per-generation statistics through the log. */
public final class LoggingGenerationListener implements GenerationListener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Verbosity verbosity;

  @Inject
  public LoggingGenerationListener(Verbosity verbosity) {
    this.verbosity = verbosity;
  }

  @Override
  public void onGeneration(GenerationStats stats) {
    if (verbosity == Verbosity.QUIET) {
      return;
    }
    logger.atInfo().log(
        "########## GEN %d, POP SIZE %d ##########", stats.generation(), stats.populationSize());
    if (verbosity == Verbosity.DETAILED) {
      logger.atInfo().log(
          "Fitness: %s, variance: %s", stats.fitnesses(), stats.fitnessVariance());
    }
    logger.atInfo().log(
        "Best score: %s, mean fitness: %s", stats.bestFitness(), stats.meanFitness());
    logger.atInfo().log("Improved by %.5f%%", 100 * stats.improvement());
  }

  @Override
  public void onTrainingComplete(int generations, Chromosome best) {
    if (verbosity == Verbosity.QUIET) {
      return;
    }
    logger.atInfo().log("Training ran for %d generations", generations);
    logger.atInfo().log("Best fitness: %s", best.fitness());
  }
}
