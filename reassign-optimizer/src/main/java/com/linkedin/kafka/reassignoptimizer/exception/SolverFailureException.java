/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

/**
 * Thrown when the solver fails, or returns a solution that is not a valid binary assignment satisfying the model.
 */
public class SolverFailureException extends KafkaReassignOptimizerException {

  public SolverFailureException(String message, Throwable cause) {
    super(message, cause);
  }

  public SolverFailureException(String message) {
    super(message);
  }
}
