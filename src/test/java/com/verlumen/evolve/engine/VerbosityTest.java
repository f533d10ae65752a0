package com.verlumen.evolve.engine;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class VerbosityTest {

  @Test
  public void fromLevel_mapsCommandLineLevels() {
    assertThat(Verbosity.fromLevel(0)).isEqualTo(Verbosity.QUIET);
    assertThat(Verbosity.fromLevel(1)).isEqualTo(Verbosity.SUMMARY);
    assertThat(Verbosity.fromLevel(2)).isEqualTo(Verbosity.DETAILED);
  }

  @Test
  public void fromLevel_unknownLevel_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> Verbosity.fromLevel(3));
  }
}
