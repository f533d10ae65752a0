package com.verlumen.evolve.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UniformGeneInitializerTest {

  @Test
  public void nextGene_staysWithinRange() {
    UniformGeneInitializer initializer = new UniformGeneInitializer(-2, 5, new Random(7));

    for (int i = 0; i < 1000; i++) {
      double gene = initializer.nextGene();
      assertThat(gene).isAtLeast(-2.0);
      assertThat(gene).isLessThan(5.0);
    }
  }

  @Test
  public void nextGene_sameSeed_isReproducible() {
    UniformGeneInitializer first = new UniformGeneInitializer(0, 5, new Random(42));
    UniformGeneInitializer second = new UniformGeneInitializer(0, 5, new Random(42));

    for (int i = 0; i < 10; i++) {
      assertThat(first.nextGene()).isEqualTo(second.nextGene());
    }
  }

  @Test
  public void constructor_emptyRange_throwsException() {
    assertThrows(
        IllegalArgumentException.class, () -> new UniformGeneInitializer(1, 1, new Random()));
  }
}
