/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;

/**
 * Resource limits handed to a {@link Solver}. When a limit is exhausted the solver reports the best known solution as
 * {@link SolverStatus#FEASIBLE}, or {@link SolverStatus#NOT_SOLVED} if it has none.
 */
public final class SolverOptions {
  private final long _timeLimitMs;
  private final long _nodeLimit;

  /**
   * @param timeLimitMs Wall clock limit in milliseconds.
   * @param nodeLimit Maximum number of search nodes (or iterations, depending on the backend).
   */
  public SolverOptions(long timeLimitMs, long nodeLimit) {
    if (timeLimitMs <= 0) {
      throw new IllegalArgumentException(String.format("Time limit must be positive (%d).", timeLimitMs));
    }
    if (nodeLimit <= 0) {
      throw new IllegalArgumentException(String.format("Node limit must be positive (%d).", nodeLimit));
    }
    _timeLimitMs = timeLimitMs;
    _nodeLimit = nodeLimit;
  }

  /**
   * @return Options that never stop the search early.
   */
  public static SolverOptions unlimited() {
    return new SolverOptions(Long.MAX_VALUE, Long.MAX_VALUE);
  }

  public long timeLimitMs() {
    return _timeLimitMs;
  }

  public long nodeLimit() {
    return _nodeLimit;
  }

  @Override
  public String toString() {
    return String.format("SolverOptions{timeLimitMs=%d, nodeLimit=%d}", _timeLimitMs, _nodeLimit);
  }
}
