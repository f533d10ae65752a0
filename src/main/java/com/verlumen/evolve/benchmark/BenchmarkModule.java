package com.verlumen.evolve.benchmark;

import com.google.auto.value.AutoValue;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.evolve.engine.AveragingFitnessProvider;
import com.verlumen.evolve.engine.FitnessProviderFactory;

/** Binds the target-matching task as the fitness provider. */
@AutoValue
public abstract class BenchmarkModule extends AbstractModule {
  public static BenchmarkModule create(ImmutableDoubleArray target, double noise, int rounds) {
    return new AutoValue_BenchmarkModule(target, noise, rounds);
  }

  abstract ImmutableDoubleArray target();

  abstract double noise();

  abstract int rounds();

  @Provides
  FitnessProviderFactory provideFitnessProviderFactory() {
    return AveragingFitnessProvider.averaging(
        () -> new TargetMatchingFitnessProvider(target(), noise()), rounds());
  }
}
