package com.verlumen.evolve.engine;

import static com.google.common.base.Preconditions.checkArgument;

/** How much {@link LoggingGenerationListener} reports. */
public enum Verbosity {
  QUIET,
  /** Best and mean fitness per generation. */
  SUMMARY,
  /** Everything in {@link #SUMMARY} plus the fitness of every member. */
  DETAILED;

  /** Maps the numeric levels 0, 1 and 2 used on the command line. */
  public static Verbosity fromLevel(int level) {
    checkArgument(level >= 0 && level < values().length, "Unknown verbosity level: %s", level);
    return values()[level];
  }
}
