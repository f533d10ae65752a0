package com.verlumen.evolve.selection;

/**
 * Thrown when a weighted draw is requested over candidates whose weights are all zero, e.g. a
 * roulette wheel over a population in which every remaining chromosome has zero fitness.
 */
public final class DegenerateDistributionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DegenerateDistributionException(String message) {
    super(message);
  }
}
