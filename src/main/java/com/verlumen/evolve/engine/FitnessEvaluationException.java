package com.verlumen.evolve.engine;

/** Thrown when computing a chromosome's fitness fails. The current generation is abandoned. */
public final class FitnessEvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int index;

  public FitnessEvaluationException(int index, Throwable cause) {
    super("Fitness evaluation failed for chromosome " + index, cause);
    this.index = index;
  }

  FitnessEvaluationException(String message, Throwable cause) {
    super(message, cause);
    this.index = -1;
  }

  /** Position of the failing chromosome, or -1 if the failure is not tied to one chromosome. */
  public int index() {
    return index;
  }
}
