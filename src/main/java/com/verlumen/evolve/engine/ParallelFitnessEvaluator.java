package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates snapshots on a fixed-size worker pool.
 *
 * <p>Each worker evaluates one snapshot with its own provider instance, so no mutable state crosses
 * the worker boundary except the returned {@link FitnessResult}. The call blocks until every
 * result is in; the first failure aborts the whole batch.
 */
public final class ParallelFitnessEvaluator implements FitnessEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ListeningExecutorService executor;
  private final int workerCount;

  public ParallelFitnessEvaluator(int workerCount) {
    checkArgument(workerCount > 0, "Worker count must be positive, got %s", workerCount);
    this.workerCount = workerCount;
    this.executor =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                workerCount,
                new ThreadFactoryBuilder()
                    .setNameFormat("fitness-worker-%d")
                    .setDaemon(true)
                    .build()));
  }

  /** Creates an evaluator with one worker per available processor. */
  public static ParallelFitnessEvaluator withAvailableProcessors() {
    return new ParallelFitnessEvaluator(Runtime.getRuntime().availableProcessors());
  }

  public int workerCount() {
    return workerCount;
  }

  @Override
  public ImmutableList<FitnessResult> evaluateAll(ImmutableList<ChromosomeSnapshot> snapshots) {
    ImmutableList<ListenableFuture<FitnessResult>> futures =
        snapshots.stream()
            .map(snapshot -> executor.submit(snapshot::evaluate))
            .collect(toImmutableList());
    try {
      List<FitnessResult> results = Futures.allAsList(futures).get();
      return ImmutableList.copyOf(results);
    } catch (InterruptedException e) {
      cancelAll(futures);
      Thread.currentThread().interrupt();
      throw new FitnessEvaluationException("Interrupted while waiting for fitness results", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof FitnessEvaluationException) {
        throw (FitnessEvaluationException) cause;
      }
      throw new FitnessEvaluationException("Fitness evaluation failed", cause);
    }
  }

  @Override
  public void close() {
    logger.atFine().log("Shutting down fitness workers...");
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        logger.atWarning().log("Fitness workers did not terminate in time.");
      }
    } catch (InterruptedException e) {
      logger.atWarning().withCause(e).log("Interrupted while shutting down fitness workers");
      Thread.currentThread().interrupt();
    }
  }

  private static void cancelAll(List<ListenableFuture<FitnessResult>> futures) {
    futures.forEach(future -> future.cancel(true));
  }
}
