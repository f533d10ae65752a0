package com.verlumen.evolve.engine;

/** Supplies gene values for a freshly initialized population. */
@FunctionalInterface
public interface GeneInitializer {
  double nextGene();
}
