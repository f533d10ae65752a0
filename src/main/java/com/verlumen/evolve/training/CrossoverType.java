package com.verlumen.evolve.training;

/** Crossover strategies available from configuration. */
public enum CrossoverType {
  ONE_POINT,
  K_POINT,
  UNIFORM
}
