package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.inject.Inject;
import com.verlumen.evolve.crossover.CrossoverMethod;
import com.verlumen.evolve.mutation.MutationMethod;
import com.verlumen.evolve.persistence.PopulationStore;
import com.verlumen.evolve.selection.ParentPair;
import com.verlumen.evolve.selection.SelectionMethod;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * A fixed-size population of chromosomes and the generational loop that evolves it.
 *
 * <p>Each generation runs evaluate, elitism, select, breed, mutate and replace, in that order.
 * Only evaluation is parallel (through the {@link FitnessEvaluator}); everything else runs on the
 * calling thread. The population always holds exactly {@link #size()} members between generations.
 *
 * <p>Instances are not thread-safe.
 */
public final class Population {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final int size;
  private final int geneCount;
  private final SelectionMethod selectionMethod;
  private final CrossoverMethod crossoverMethod;
  private final MutationMethod mutationMethod;
  private final FitnessEvaluator fitnessEvaluator;
  private final PopulationStore populationStore;
  private final ImmutableSet<GenerationListener> listeners;

  private List<Chromosome> members;
  private int generation;
  private Chromosome best;
  private double meanFitness = Double.NaN;
  private double previousMeanFitness = Double.NaN;

  @Inject
  Population(
      PopulationConfig config,
      FitnessProviderFactory providerFactory,
      GeneInitializer geneInitializer,
      SelectionMethod selectionMethod,
      CrossoverMethod crossoverMethod,
      MutationMethod mutationMethod,
      FitnessEvaluator fitnessEvaluator,
      PopulationStore populationStore,
      Set<GenerationListener> listeners) {
    this.size = config.size();
    this.geneCount = config.geneCount();
    this.selectionMethod = selectionMethod;
    this.crossoverMethod = crossoverMethod;
    this.mutationMethod = mutationMethod;
    this.fitnessEvaluator = fitnessEvaluator;
    this.populationStore = populationStore;
    this.listeners = ImmutableSet.copyOf(listeners);
    this.members = initialize(providerFactory, geneInitializer);
  }

  private List<Chromosome> initialize(
      FitnessProviderFactory providerFactory, GeneInitializer geneInitializer) {
    List<Chromosome> initial = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      ImmutableDoubleArray.Builder genes = ImmutableDoubleArray.builder(geneCount);
      for (int j = 0; j < geneCount; j++) {
        genes.add(geneInitializer.nextGene());
      }
      initial.add(Chromosome.create(genes.build(), providerFactory));
    }
    return initial;
  }

  /**
   * Runs the generational loop until the cycle budget is spent or the mean fitness converges, then
   * saves the population if a save path is set.
   *
   * <p>A budget of zero runs no generations; the population is evaluated once so that its best
   * member can be returned.
   *
   * @return the fittest member of the most recently evaluated generation
   * @throws FitnessEvaluationException if a fitness computation fails
   */
  public Chromosome train(TrainingOptions options) {
    int remainingCycles = options.cycleBudget();
    if (remainingCycles == 0) {
      evaluate();
    }
    while (remainingCycles != 0) {
      runGeneration(options.elitismFraction());
      if (remainingCycles > 0) {
        remainingCycles--;
      }
      if (StoppingRule.hasConverged(
          generation, meanFitness, previousMeanFitness, options.stoppingThreshold())) {
        logger.atInfo().log(
            "Mean fitness converged after %d generations (threshold %s)",
            generation, options.stoppingThreshold());
        break;
      }
    }

    listeners.forEach(listener -> listener.onTrainingComplete(generation, best));
    options.savePath().ifPresent(this::save);
    return best;
  }

  /**
   * Runs one full generation and returns the statistics of the generation that was evaluated
   * (the parents, not the children that replace them).
   */
  public GenerationStats runGeneration(double elitismFraction) {
    checkArgument(
        elitismFraction >= 0 && elitismFraction <= 1,
        "Elitism fraction must be in [0, 1], got %s",
        elitismFraction);
    GenerationStats stats = evaluate();

    ImmutableList<Chromosome> elites = selectElites(elitismFraction);
    ImmutableList<ParentPair> parents =
        selectionMethod.selectParents(members, size - elites.size());

    List<Chromosome> children = new ArrayList<>(parents.size());
    for (ParentPair pair : parents) {
      children.add(crossoverMethod.breed(pair.first(), pair.second()));
    }
    children.forEach(mutationMethod::mutate);

    List<Chromosome> next = new ArrayList<>(size);
    next.addAll(elites);
    next.addAll(children);
    checkState(
        next.size() == size,
        "Generation %s produced %s members, expected %s",
        generation,
        next.size(),
        size);
    members = next;
    generation++;
    return stats;
  }

  /**
   * Evaluates every member, records each fitness against the member it belongs to, and updates
   * {@link #best()} and the mean fitness statistics.
   */
  public GenerationStats evaluate() {
    ImmutableList<ChromosomeSnapshot> snapshots =
        IntStream.range(0, members.size())
            .mapToObj(i -> members.get(i).snapshot(i))
            .collect(toImmutableList());
    ImmutableList<FitnessResult> results = fitnessEvaluator.evaluateAll(snapshots);
    checkState(
        results.size() == size, "Expected %s fitness results, got %s", size, results.size());

    boolean[] seen = new boolean[size];
    for (FitnessResult result : results) {
      checkState(!seen[result.index()], "Duplicate fitness result for index %s", result.index());
      seen[result.index()] = true;
      members.get(result.index()).setFitness(result.fitness());
    }

    Chromosome fittest = members.get(0);
    for (Chromosome member : members) {
      if (member.fitness() > fittest.fitness()) {
        fittest = member;
      }
    }
    best = fittest;

    GenerationStats stats = GenerationStats.create(generation, fitnesses(), meanFitness);
    previousMeanFitness = meanFitness;
    meanFitness = stats.meanFitness();
    listeners.forEach(listener -> listener.onGeneration(stats));
    return stats;
  }

  /** The fittest {@code floor(fraction * size)} members, fittest first. */
  ImmutableList<Chromosome> selectElites(double elitismFraction) {
    int eliteCount = (int) (elitismFraction * size);
    return members.stream()
        .sorted(Comparator.comparingDouble(Chromosome::fitness).reversed())
        .limit(eliteCount)
        .collect(toImmutableList());
  }

  /**
   * Writes the current members' genes to {@code path}.
   *
   * @throws com.verlumen.evolve.persistence.PersistenceException if the write fails
   */
  public void save(Path path) {
    populationStore.save(path, members.stream().map(Chromosome::genes).collect(toImmutableList()));
  }

  /**
   * Replaces every member's genes with those saved at {@code path}.
   *
   * @throws com.verlumen.evolve.persistence.PersistenceException if the file cannot be read
   * @throws IllegalArgumentException if the saved population does not match this one's shape
   */
  public void load(Path path) {
    loadGenes(populationStore.load(path));
  }

  /**
   * Replaces every member's genes, by position. Nothing is changed unless every vector fits.
   * Recorded fitness values are stale until the next evaluation.
   */
  public void loadGenes(List<ImmutableDoubleArray> population) {
    checkArgument(
        population.size() == size,
        "Saved population has %s chromosomes, expected %s",
        population.size(),
        size);
    for (int i = 0; i < population.size(); i++) {
      checkArgument(
          population.get(i).length() == geneCount,
          "Saved chromosome %s has %s genes, expected %s",
          i,
          population.get(i).length(),
          geneCount);
    }
    for (int i = 0; i < size; i++) {
      members.get(i).replaceGenes(population.get(i));
    }
  }

  public int size() {
    return size;
  }

  public int geneCount() {
    return geneCount;
  }

  public int generation() {
    return generation;
  }

  public ImmutableList<Chromosome> members() {
    return ImmutableList.copyOf(members);
  }

  /** Fittest member of the most recently evaluated generation; empty before any evaluation. */
  public Optional<Chromosome> best() {
    return Optional.ofNullable(best);
  }

  public double meanFitness() {
    return meanFitness;
  }

  public double previousMeanFitness() {
    return previousMeanFitness;
  }

  private ImmutableDoubleArray fitnesses() {
    ImmutableDoubleArray.Builder fitnesses = ImmutableDoubleArray.builder(size);
    members.forEach(member -> fitnesses.add(member.fitness()));
    return fitnesses.build();
  }
}
