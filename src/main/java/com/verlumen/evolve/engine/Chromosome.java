package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * One candidate solution: a fixed-length gene vector together with the fitness provider configured
 * from it.
 *
 * <p>The provider is created once, exclusively owned by this chromosome, and reconfigured (never
 * replaced) whenever the genes have changed since it was last configured. Evaluation passes hand it
 * to a worker through a {@link ChromosomeSnapshot}. The stored {@link #fitness()} reflects the most
 * recent evaluation pass only; it is zero before the first one.
 */
public final class Chromosome {
  private final double[] genes;
  private final FitnessProviderFactory providerFactory;
  private final FitnessProvider provider;

  private boolean providerStale;
  private double fitness;

  private Chromosome(double[] genes, FitnessProviderFactory providerFactory) {
    this.genes = genes;
    this.providerFactory = providerFactory;
    this.provider =
        checkNotNull(providerFactory.create(), "Fitness provider factory returned null");
    checkArgument(
        provider.parameterCount() == genes.length,
        "Fitness provider expects %s parameters but chromosome has %s genes",
        provider.parameterCount(),
        genes.length);
    this.providerStale = true;
  }

  /**
   * Creates a chromosome holding a copy of {@code genes} and a new provider obtained from {@code
   * providerFactory}.
   *
   * @throws IllegalArgumentException if the provider expects a different number of parameters
   */
  public static Chromosome create(
      ImmutableDoubleArray genes, FitnessProviderFactory providerFactory) {
    checkArgument(!genes.isEmpty(), "A chromosome needs at least one gene");
    return new Chromosome(genes.toArray(), checkNotNull(providerFactory));
  }

  /** Creates a chromosome of the same kind as this one (same provider factory) with new genes. */
  public Chromosome offspring(ImmutableDoubleArray childGenes) {
    checkArgument(
        childGenes.length() == genes.length,
        "Offspring must have %s genes, got %s",
        genes.length,
        childGenes.length());
    return new Chromosome(childGenes.toArray(), providerFactory);
  }

  public int length() {
    return genes.length;
  }

  public double getGene(int position) {
    checkElementIndex(position, genes.length, "gene position");
    return genes[position];
  }

  public void setGene(int position, double value) {
    checkElementIndex(position, genes.length, "gene position");
    genes[position] = value;
    providerStale = true;
  }

  /** Returns an immutable copy of the current genes. */
  public ImmutableDoubleArray genes() {
    return ImmutableDoubleArray.copyOf(genes);
  }

  /** Fitness recorded by the most recent evaluation pass. */
  public double fitness() {
    return fitness;
  }

  void setFitness(double fitness) {
    this.fitness = fitness;
  }

  /**
   * Overwrites every gene. Any previously recorded fitness is stale until the next evaluation.
   *
   * @throws IllegalArgumentException if the length differs from this chromosome's length
   */
  void replaceGenes(ImmutableDoubleArray newGenes) {
    checkArgument(
        newGenes.length() == genes.length,
        "Expected %s genes, got %s",
        genes.length,
        newGenes.length());
    for (int i = 0; i < genes.length; i++) {
      genes[i] = newGenes.get(i);
    }
    providerStale = true;
  }

  /** Computes fitness with this chromosome's own provider. Does not record the result. */
  public double computeFitness() {
    configureProvider();
    return provider.evaluate();
  }

  /**
   * Configures the owned provider with the current genes and captures it, with a copy of the
   * genes, in a snapshot that a worker can evaluate without touching this chromosome. The genes
   * must not change until the snapshot has been evaluated.
   *
   * @throws FitnessEvaluationException if the provider rejects the genes
   */
  ChromosomeSnapshot snapshot(int index) {
    try {
      configureProvider();
    } catch (RuntimeException e) {
      throw new FitnessEvaluationException(index, e);
    }
    return ChromosomeSnapshot.create(index, ImmutableDoubleArray.copyOf(genes), provider);
  }

  private void configureProvider() {
    if (providerStale) {
      provider.configure(ImmutableDoubleArray.copyOf(genes));
      providerStale = false;
    }
  }

  @Override
  public String toString() {
    return "Chromosome{fitness=" + fitness + ", genes=" + genes() + "}";
  }
}
