package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.util.Optional;

/** Parameters of one {@link Population#train} call. */
@AutoValue
public abstract class TrainingOptions {
  public static Builder builder() {
    return new AutoValue_TrainingOptions.Builder()
        .setCycleBudget(EvolutionConstants.UNBOUNDED_CYCLES)
        .setElitismFraction(0)
        .setStoppingThreshold(EvolutionConstants.DEFAULT_STOPPING_THRESHOLD);
  }

  /** Maximum number of generations; negative means no limit, zero means evaluate only. */
  public abstract int cycleBudget();

  /** Fraction of the population carried unchanged into the next generation. */
  public abstract double elitismFraction();

  public abstract double stoppingThreshold();

  /** Where to write the final population, if anywhere. */
  public abstract Optional<Path> savePath();

  public boolean isUnbounded() {
    return cycleBudget() < 0;
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setCycleBudget(int cycleBudget);

    public abstract Builder setElitismFraction(double elitismFraction);

    public abstract Builder setStoppingThreshold(double stoppingThreshold);

    public abstract Builder setSavePath(Path savePath);

    public abstract Builder setSavePath(Optional<Path> savePath);

    abstract TrainingOptions autoBuild();

    public TrainingOptions build() {
      TrainingOptions options = autoBuild();
      checkArgument(
          options.elitismFraction() >= 0 && options.elitismFraction() <= 1,
          "Elitism fraction must be in [0, 1], got %s",
          options.elitismFraction());
      checkArgument(
          options.stoppingThreshold() >= 0,
          "Stopping threshold must be non-negative, got %s",
          options.stoppingThreshold());
      return options;
    }
  }
}
