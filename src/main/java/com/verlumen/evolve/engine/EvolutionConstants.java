package com.verlumen.evolve.engine;

/**
 * Constants used throughout the evolution process. Kept in one place so that the command line,
 * the Guice wiring and the engine agree on defaults.
 */
public final class EvolutionConstants {
  /** Convergence is never declared before this many generations have completed. */
  public static final int MINIMUM_GENERATIONS = 10;

  /** Cycle budget meaning "run until convergence". */
  public static final int UNBOUNDED_CYCLES = -1;

  public static final int DEFAULT_POPULATION_SIZE = 128;
  public static final double DEFAULT_ELITISM_FRACTION = 0.1;
  public static final double DEFAULT_STOPPING_THRESHOLD = 0.01;
  public static final double DEFAULT_MUTATION_RATE = 0.1;
  public static final double DEFAULT_MUTATION_VOLUME = 0.05;
  public static final int DEFAULT_TOURNAMENT_SIZE = 3;
  public static final int DEFAULT_CROSSOVER_POINTS = 2;
  public static final double DEFAULT_INITIAL_GENE_MIN = 0.0;
  public static final double DEFAULT_INITIAL_GENE_MAX = 5.0;

  private EvolutionConstants() {}
}
