package com.verlumen.evolve.engine;

import com.google.common.collect.ImmutableList;

/**
 * Evaluates a generation's snapshots and reports one {@link FitnessResult} per snapshot.
 *
 * <p>Results are tagged with the index of the snapshot that produced them; implementations may
 * compute them in any order but must not return until every snapshot has been evaluated.
 */
public interface FitnessEvaluator extends AutoCloseable {
  /**
   * @throws FitnessEvaluationException if any evaluation fails
   */
  ImmutableList<FitnessResult> evaluateAll(ImmutableList<ChromosomeSnapshot> snapshots);

  @Override
  void close();
}
