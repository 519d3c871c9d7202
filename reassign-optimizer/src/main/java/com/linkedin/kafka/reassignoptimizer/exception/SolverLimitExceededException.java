/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentResult;
import com.linkedin.reassignoptimizer.solver.SolverStatus;


/**
 * Thrown when the solver hit its time or node limit before proving optimality.
 */
public class SolverLimitExceededException extends KafkaReassignOptimizerException {
  private final SolverStatus _status;
  private final ReassignmentResult _bestKnownResult;

  /**
   * @param message The detail message.
   * @param status {@link SolverStatus#FEASIBLE} if a solution was found, {@link SolverStatus#NOT_SOLVED} otherwise.
   * @param bestKnownResult The best feasible result found before the limit, {@code null} if none.
   */
  public SolverLimitExceededException(String message, SolverStatus status, ReassignmentResult bestKnownResult) {
    super(message);
    _status = status;
    _bestKnownResult = bestKnownResult;
  }

  public SolverStatus status() {
    return _status;
  }

  /**
   * @return The best feasible result found before the limit, which is not proven optimal; {@code null} if none.
   */
  public ReassignmentResult bestKnownResult() {
    return _bestKnownResult;
  }
}
