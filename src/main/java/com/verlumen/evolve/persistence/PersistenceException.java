package com.verlumen.evolve.persistence;

/** Thrown when a population document cannot be written or read. */
public final class PersistenceException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
