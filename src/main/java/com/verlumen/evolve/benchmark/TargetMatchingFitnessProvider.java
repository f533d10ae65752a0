package com.verlumen.evolve.benchmark;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.evolve.engine.FitnessProvider;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rewards parameter vectors for being close to a fixed target.
 *
 * <p>Fitness is {@code 1 / (1 + d)} where {@code d} is the squared Euclidean distance to the
 * target, so it is always positive and reaches 1 at the target. With a positive {@code noise}, each
 * evaluation adds Gaussian noise of that standard deviation to the distance, modelling a randomized
 * task.
 */
public final class TargetMatchingFitnessProvider implements FitnessProvider {
  private final ImmutableDoubleArray target;
  private final double noise;
  private ImmutableDoubleArray parameters;

  public TargetMatchingFitnessProvider(ImmutableDoubleArray target, double noise) {
    checkArgument(!target.isEmpty(), "Target must not be empty");
    checkArgument(noise >= 0, "Noise must be non-negative, got %s", noise);
    this.target = target;
    this.noise = noise;
  }

  @Override
  public int parameterCount() {
    return target.length();
  }

  @Override
  public void configure(ImmutableDoubleArray parameters) {
    checkArgument(
        parameters.length() == target.length(),
        "Expected %s parameters, got %s",
        target.length(),
        parameters.length());
    this.parameters = parameters;
  }

  @Override
  public double evaluate() {
    checkState(parameters != null, "Provider has not been configured");
    double distance = 0;
    for (int i = 0; i < target.length(); i++) {
      double delta = parameters.get(i) - target.get(i);
      distance += delta * delta;
    }
    if (noise > 0) {
      distance = Math.abs(distance + noise * ThreadLocalRandom.current().nextGaussian());
    }
    return 1 / (1 + distance);
  }
}
