/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;

import com.linkedin.reassignoptimizer.exception.SolverException;
import com.linkedin.reassignoptimizer.model.MilpModel;


/**
 * The port to a mixed integer programming backend. Implementations must have a public no-argument constructor so they
 * can be instantiated from configuration.
 */
public interface Solver {

  /**
   * Minimize the objective of the given model subject to its constraints and variable bounds.
   *
   * @param model The model to solve. It is not modified.
   * @param options Resource limits of this run.
   * @return The status and, if {@link SolverStatus#hasSolution()}, a value for every variable of the model.
   * @throws SolverException If the backend fails internally.
   */
  SolveResult solve(MilpModel model, SolverOptions options) throws SolverException;

  /**
   * @return Human readable name of the backend.
   */
  String name();
}
