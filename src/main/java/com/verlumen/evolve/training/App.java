package com.verlumen.evolve.training;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.evolve.benchmark.BenchmarkModule;
import com.verlumen.evolve.engine.Chromosome;
import com.verlumen.evolve.engine.EvolutionConstants;
import com.verlumen.evolve.engine.FitnessEvaluator;
import com.verlumen.evolve.engine.Population;
import com.verlumen.evolve.engine.TrainingOptions;
import com.verlumen.evolve.engine.Verbosity;
import com.verlumen.evolve.persistence.PopulationStore;
import com.verlumen.evolve.selection.RouletteSelection.DegenerateWeightPolicy;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

/** Command-line trainer that evolves parameter vectors against the target-matching benchmark. */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Population population;
  private final PopulationStore populationStore;
  private final FitnessEvaluator fitnessEvaluator;

  @Inject
  App(Population population, PopulationStore populationStore, FitnessEvaluator fitnessEvaluator) {
    this.population = population;
    this.populationStore = populationStore;
    this.fitnessEvaluator = fitnessEvaluator;
  }

  /**
   * Loads {@code populationFile} when it exists, trains, and writes the best chromosome to {@code
   * bestFile} when given. Shuts the evaluation workers down on the way out.
   */
  Chromosome run(TrainingOptions options, Optional<Path> populationFile, Optional<Path> bestFile) {
    try {
      if (populationFile.isPresent() && Files.exists(populationFile.get())) {
        population.load(populationFile.get());
        logger.atInfo().log("Loaded previous results from %s", populationFile.get());
      }
      logger.atInfo().log(
          "Training %d chromosomes of %d genes", population.size(), population.geneCount());
      Chromosome best = population.train(options);
      bestFile.ifPresent(path -> populationStore.saveBest(path, best.genes(), best.fitness()));
      return best;
    } finally {
      fitnessEvaluator.close();
    }
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("Trainer starting up with %d arguments", args.length);
    try {
      Namespace namespace = createParser().parseArgs(args);
      ImmutableDoubleArray target = parseTarget(namespace.getString("target"));
      EvolutionConfig config = toEvolutionConfig(namespace, target.length());
      Optional<Path> populationFile =
          Optional.ofNullable(namespace.getString("populationFile")).map(Path::of);
      Optional<Path> bestFile = Optional.ofNullable(namespace.getString("bestFile")).map(Path::of);
      TrainingOptions options = toTrainingOptions(namespace, populationFile);

      App app =
          Guice.createInjector(
                  EvolutionModule.create(config),
                  BenchmarkModule.create(
                      target, namespace.getDouble("noise"), namespace.getInt("evaluationRounds")))
              .getInstance(App.class);
      logger.atInfo().log("Guice initialization complete, starting training");
      app.run(options, populationFile, bestFile);
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Training failed");
      throw e;
    }
  }

  static EvolutionConfig toEvolutionConfig(Namespace namespace, int geneCount) {
    EvolutionConfig.Builder builder =
        EvolutionConfig.builder()
            .setPopulationSize(namespace.getInt("populationSize"))
            .setGeneCount(geneCount)
            .setSelectionType(SelectionType.valueOf(upperCase(namespace, "selection")))
            .setTournamentSize(namespace.getInt("tournamentSize"))
            .setDegenerateWeightPolicy(
                DegenerateWeightPolicy.valueOf(upperCase(namespace, "degenerateWeights")))
            .setCrossoverType(CrossoverType.valueOf(upperCase(namespace, "crossover")))
            .setCrossoverPoints(namespace.getInt("crossoverPoints"))
            .setMutationType(MutationType.valueOf(upperCase(namespace, "mutation")))
            .setMutationRate(namespace.getDouble("mutationRate"))
            .setMutationVolume(namespace.getDouble("mutationVolume"))
            .setInitialGeneMin(namespace.getDouble("initMin"))
            .setInitialGeneMax(namespace.getDouble("initMax"))
            .setVerbosity(Verbosity.fromLevel(namespace.getInt("verbosity")));
    Integer workers = namespace.getInt("workers");
    if (workers != null) {
      builder.setWorkerCount(workers);
    }
    Long seed = namespace.getLong("seed");
    if (seed != null) {
      builder.setSeed(seed);
    }
    return builder.build();
  }

  private static String upperCase(Namespace namespace, String argument) {
    return Ascii.toUpperCase(namespace.getString(argument));
  }

  static TrainingOptions toTrainingOptions(Namespace namespace, Optional<Path> savePath) {
    return TrainingOptions.builder()
        .setCycleBudget(namespace.getInt("cycles"))
        .setElitismFraction(namespace.getDouble("elitism"))
        .setStoppingThreshold(namespace.getDouble("stoppingThreshold"))
        .setSavePath(savePath)
        .build();
  }

  static ImmutableDoubleArray parseTarget(String target) {
    ImmutableDoubleArray.Builder values = ImmutableDoubleArray.builder();
    for (String value : Splitter.on(',').trimResults().omitEmptyStrings().split(target)) {
      values.add(Double.parseDouble(value));
    }
    ImmutableDoubleArray parsed = values.build();
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException("Target must contain at least one value");
    }
    return parsed;
  }

  static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("EvolveTrainer")
            .build()
            .defaultHelp(true)
            .description("Evolves a population of parameter vectors with a genetic algorithm");

    // Task configuration
    parser.addArgument("--target")
        .required(true)
        .help("Comma-separated target vector; its length is the gene count");

    parser.addArgument("--noise")
        .type(Double.class)
        .setDefault(0.0)
        .help("Standard deviation of the noise added to each evaluation");

    parser.addArgument("--evaluationRounds")
        .type(Integer.class)
        .setDefault(1)
        .help("Number of evaluations averaged into one fitness value");

    // Population configuration
    parser.addArgument("--populationSize")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .help("Number of chromosomes per generation");

    parser.addArgument("--initMin")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_INITIAL_GENE_MIN)
        .help("Lower bound of initial gene values");

    parser.addArgument("--initMax")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_INITIAL_GENE_MAX)
        .help("Upper bound (exclusive) of initial gene values");

    // Strategy configuration
    parser.addArgument("--selection")
        .choices("roulette", "rank", "tournament")
        .setDefault("roulette")
        .help("Parent selection strategy");

    parser.addArgument("--tournamentSize")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_TOURNAMENT_SIZE)
        .help("Contestants per tournament");

    parser.addArgument("--degenerateWeights")
        .choices("fail", "uniform")
        .setDefault("fail")
        .help("Roulette behaviour when every remaining candidate has zero fitness");

    parser.addArgument("--crossover")
        .choices("one_point", "k_point", "uniform")
        .setDefault("uniform")
        .help("Crossover strategy");

    parser.addArgument("--crossoverPoints")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_CROSSOVER_POINTS)
        .help("Cut points for k_point crossover");

    parser.addArgument("--mutation")
        .choices("noisy", "flip", "swap")
        .setDefault("noisy")
        .help("Mutation strategy");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_MUTATION_RATE)
        .help("Mutation probability");

    parser.addArgument("--mutationVolume")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_MUTATION_VOLUME)
        .help("Relative perturbation of noisy mutation");

    // Training configuration
    parser.addArgument("--cycles")
        .type(Integer.class)
        .setDefault(EvolutionConstants.UNBOUNDED_CYCLES)
        .help("Maximum number of generations, -1 to run until convergence");

    parser.addArgument("--elitism")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_ELITISM_FRACTION)
        .help("Fraction of the population carried over unchanged");

    parser.addArgument("--stoppingThreshold")
        .type(Double.class)
        .setDefault(EvolutionConstants.DEFAULT_STOPPING_THRESHOLD)
        .help("Relative change of mean fitness below which training stops");

    parser.addArgument("--seed")
        .type(Long.class)
        .help("Seed for the random source");

    parser.addArgument("--workers")
        .type(Integer.class)
        .help("Fitness evaluation threads (default: available processors)");

    parser.addArgument("--verbosity")
        .type(Integer.class)
        .choices(0, 1, 2)
        .setDefault(1)
        .help("0: quiet, 1: per-generation summary, 2: also every member's fitness");

    // Files
    parser.addArgument("--populationFile")
        .help("Population document loaded before training (if present) and written after");

    parser.addArgument("--bestFile")
        .help("Where to write the best chromosome");

    return parser;
  }
}
