package com.verlumen.evolve.engine;

/** Creates fresh, independently owned {@link FitnessProvider} instances. */
@FunctionalInterface
public interface FitnessProviderFactory {
  FitnessProvider create();
}
