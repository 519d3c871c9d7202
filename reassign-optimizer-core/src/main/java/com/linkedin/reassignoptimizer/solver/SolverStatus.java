/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;

/**
 * Outcome of a {@link Solver} run.
 *
 * <ul>
 *   <li>{@link #OPTIMAL}: A solution was found and proven optimal.</li>
 *   <li>{@link #FEASIBLE}: A solution satisfying every constraint was found, but the solver stopped (typically on a time
 *   or node limit) before proving it optimal.</li>
 *   <li>{@link #INFEASIBLE}: The solver proved that no assignment satisfies the constraints.</li>
 *   <li>{@link #UNBOUNDED}: The objective is unbounded below.</li>
 *   <li>{@link #NOT_SOLVED}: The solver stopped without a solution and without a proof of infeasibility.</li>
 *   <li>{@link #ERROR}: The solver reported an internal error.</li>
 * </ul>
 */
public enum SolverStatus {
  OPTIMAL, FEASIBLE, INFEASIBLE, UNBOUNDED, NOT_SOLVED, ERROR;

  /**
   * @return {@code true} if a result with this status carries variable values.
   */
  public boolean hasSolution() {
    return this == OPTIMAL || this == FEASIBLE;
  }
}
