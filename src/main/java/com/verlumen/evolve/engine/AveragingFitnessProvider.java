package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * Scores a non-deterministic task as the mean of several independent runs of a delegate provider.
 */
public final class AveragingFitnessProvider implements FitnessProvider {
  private final FitnessProvider delegate;
  private final int rounds;

  public AveragingFitnessProvider(FitnessProvider delegate, int rounds) {
    checkArgument(rounds > 0, "Rounds must be positive, got %s", rounds);
    this.delegate = checkNotNull(delegate);
    this.rounds = rounds;
  }

  /** Wraps every provider {@code factory} creates. One round returns {@code factory} itself. */
  public static FitnessProviderFactory averaging(FitnessProviderFactory factory, int rounds) {
    checkArgument(rounds > 0, "Rounds must be positive, got %s", rounds);
    if (rounds == 1) {
      return factory;
    }
    return () -> new AveragingFitnessProvider(factory.create(), rounds);
  }

  @Override
  public int parameterCount() {
    return delegate.parameterCount();
  }

  @Override
  public void configure(ImmutableDoubleArray parameters) {
    delegate.configure(parameters);
  }

  @Override
  public double evaluate() {
    double total = 0;
    for (int round = 0; round < rounds; round++) {
      total += delegate.evaluate();
    }
    return total / rounds;
  }
}
