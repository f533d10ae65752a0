package com.verlumen.evolve.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolve.testing.SumFitnessProvider;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class AveragingFitnessProviderTest {
  @Rule public MockitoRule mockitoRule = MockitoJUnit.rule();

  @Mock private FitnessProvider mockDelegate;

  @Test
  public void evaluate_returnsMeanOfDelegateRuns() {
    // Arrange
    when(mockDelegate.evaluate()).thenReturn(1.0, 2.0, 6.0);
    AveragingFitnessProvider provider = new AveragingFitnessProvider(mockDelegate, 3);

    // Act
    double fitness = provider.evaluate();

    // Assert
    assertThat(fitness).isWithin(1e-12).of(3.0);
    verify(mockDelegate, times(3)).evaluate();
  }

  @Test
  public void configure_forwardsToDelegate() {
    AveragingFitnessProvider provider = new AveragingFitnessProvider(mockDelegate, 2);

    provider.configure(ImmutableDoubleArray.of(1, 2));

    verify(mockDelegate).configure(ImmutableDoubleArray.of(1, 2));
  }

  @Test
  public void averaging_singleRound_returnsSameFactory() {
    FitnessProviderFactory factory = SumFitnessProvider.factory(2);

    assertThat(AveragingFitnessProvider.averaging(factory, 1)).isSameInstanceAs(factory);
  }

  @Test
  public void averaging_severalRounds_wrapsProviders() {
    FitnessProvider provider =
        AveragingFitnessProvider.averaging(SumFitnessProvider.factory(2), 4).create();

    assertThat(provider).isInstanceOf(AveragingFitnessProvider.class);
    assertThat(provider.parameterCount()).isEqualTo(2);
  }

  @Test
  public void constructor_nonPositiveRounds_throwsException() {
    assertThrows(
        IllegalArgumentException.class, () -> new AveragingFitnessProvider(mockDelegate, 0));
  }
}
