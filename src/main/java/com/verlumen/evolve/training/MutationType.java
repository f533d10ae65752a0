package com.verlumen.evolve.training;

/** Mutation strategies available from configuration. */
public enum MutationType {
  NOISY,
  FLIP,
  SWAP
}
