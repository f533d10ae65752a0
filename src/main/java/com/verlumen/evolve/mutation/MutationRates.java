package com.verlumen.evolve.mutation;

import static com.google.common.base.Preconditions.checkArgument;

final class MutationRates {
  private MutationRates() {}

  static double checkRate(double rate) {
    checkArgument(rate >= 0 && rate <= 1, "Mutation rate must be in [0, 1], got %s", rate);
    return rate;
  }
}
