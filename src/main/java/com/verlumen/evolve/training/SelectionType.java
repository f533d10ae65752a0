package com.verlumen.evolve.training;

/** Parent selection strategies available from configuration. */
public enum SelectionType {
  ROULETTE,
  RANK,
  TOURNAMENT
}
