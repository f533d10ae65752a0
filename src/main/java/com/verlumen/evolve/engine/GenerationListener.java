package com.verlumen.evolve.engine;

/** Observes the generational loop. Called on the training thread. */
public interface GenerationListener {
  /** Called once per generation, right after every member has been evaluated. */
  void onGeneration(GenerationStats stats);

  /** Called when training stops, with the number of completed generations. */
  default void onTrainingComplete(int generations, Chromosome best) {}
}
