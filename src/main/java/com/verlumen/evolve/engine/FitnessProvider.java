package com.verlumen.evolve.engine;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * A task that can be configured from a flat parameter vector and then report how well it performed.
 *
 * <p>Implementations own whatever internal structure the parameters map onto (weights of a model,
 * coefficients of a heuristic, ...). The engine makes no assumption about how fitness is computed.
 */
public interface FitnessProvider {
  /** Number of parameters {@link #configure} expects. */
  int parameterCount();

  /**
   * Binds the given parameters into this provider.
   *
   * @throws IllegalArgumentException if {@code parameters.length() != parameterCount()}
   */
  void configure(ImmutableDoubleArray parameters);

  /**
   * Runs the task with the currently configured parameters and returns its fitness. May be
   * expensive and may be non-deterministic.
   */
  double evaluate();
}
