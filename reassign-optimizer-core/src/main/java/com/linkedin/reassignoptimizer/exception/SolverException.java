/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.exception;

/**
 * Thrown when a solver backend fails internally, e.g. a numerical failure or a model it cannot handle.
 * Infeasible or limit-bounded runs are not failures and are reported through the solve status instead.
 */
public class SolverException extends ReassignOptimizerException {

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }

  public SolverException(String message) {
    super(message);
  }
}
