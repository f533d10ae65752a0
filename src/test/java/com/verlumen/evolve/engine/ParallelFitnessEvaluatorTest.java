package com.verlumen.evolve.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.util.concurrent.Uninterruptibles;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParallelFitnessEvaluatorTest {
  private final ParallelFitnessEvaluator evaluator = new ParallelFitnessEvaluator(4);

  @After
  public void tearDown() {
    evaluator.close();
  }

  /** Sleeps longer for lower first genes so that results complete in reverse order. */
  private static class SlowIdentityProvider implements FitnessProvider {
    private ImmutableDoubleArray parameters;

    @Override
    public int parameterCount() {
      return 1;
    }

    @Override
    public void configure(ImmutableDoubleArray parameters) {
      this.parameters = parameters;
    }

    @Override
    public double evaluate() {
      double value = parameters.get(0);
      Uninterruptibles.sleepUninterruptibly(Duration.ofMillis((long) (10 * (8 - value))));
      return value;
    }
  }

  private static ImmutableList<ChromosomeSnapshot> snapshots(
      int count, FitnessProviderFactory factory) {
    ImmutableList.Builder<ChromosomeSnapshot> snapshots = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      ImmutableDoubleArray genes = ImmutableDoubleArray.of(i);
      FitnessProvider provider = factory.create();
      provider.configure(genes);
      snapshots.add(ChromosomeSnapshot.create(i, genes, provider));
    }
    return snapshots.build();
  }

  @Test
  public void evaluateAll_resultsCompleteOutOfOrder_keepsIndexAssociation() {
    // Act
    ImmutableList<FitnessResult> results =
        evaluator.evaluateAll(snapshots(8, SlowIdentityProvider::new));

    // Assert
    assertThat(results).hasSize(8);
    for (FitnessResult result : results) {
      assertThat(result.fitness()).isEqualTo((double) result.index());
    }
  }

  @Test
  public void evaluateAll_evaluatesEachSnapshotWithItsOwnProvider() {
    Set<FitnessProvider> evaluated = ConcurrentHashMap.newKeySet();
    FitnessProviderFactory factory =
        () ->
            new SlowIdentityProvider() {
              @Override
              public double evaluate() {
                evaluated.add(this);
                return super.evaluate();
              }
            };
    ImmutableList<ChromosomeSnapshot> snapshots = snapshots(6, factory);

    evaluator.evaluateAll(snapshots);

    assertThat(evaluated).hasSize(6);
    for (ChromosomeSnapshot snapshot : snapshots) {
      assertThat(evaluated).contains(snapshot.configuredProvider());
    }
  }

  @Test
  public void evaluateAll_providerFails_throwsWithFailingIndex() {
    FitnessProviderFactory factory =
        () ->
            new SlowIdentityProvider() {
              @Override
              public double evaluate() {
                if (super.evaluate() == 3) {
                  throw new IllegalStateException("simulation crashed");
                }
                return 0;
              }
            };

    FitnessEvaluationException thrown =
        assertThrows(
            FitnessEvaluationException.class, () -> evaluator.evaluateAll(snapshots(5, factory)));

    assertThat(thrown.index()).isEqualTo(3);
    assertThat(thrown).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void evaluateAll_emptyInput_returnsEmpty() {
    assertThat(evaluator.evaluateAll(ImmutableList.of())).isEmpty();
  }

  @Test
  public void constructor_nonPositiveWorkers_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> new ParallelFitnessEvaluator(0));
  }

  @Test
  public void withAvailableProcessors_sizesPoolToHardware() {
    ParallelFitnessEvaluator defaultEvaluator = ParallelFitnessEvaluator.withAvailableProcessors();
    try {
      assertThat(defaultEvaluator.workerCount())
          .isEqualTo(Runtime.getRuntime().availableProcessors());
    } finally {
      defaultEvaluator.close();
    }
  }
}
