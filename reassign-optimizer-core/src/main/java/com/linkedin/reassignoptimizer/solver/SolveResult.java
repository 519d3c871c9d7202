/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;


/**
 * The result of a {@link Solver} run: status, and for {@link SolverStatus#hasSolution()} statuses, the value of every
 * variable and of the objective.
 */
public final class SolveResult {
  private static final double[] NO_VALUES = new double[0];
  private final SolverStatus _status;
  private final double[] _values;
  private final double _objectiveValue;
  private final boolean _limitReached;
  private final long _solveTimeMs;

  private SolveResult(SolverStatus status, double[] values, double objectiveValue, boolean limitReached, long solveTimeMs) {
    _status = status;
    _values = values;
    _objectiveValue = objectiveValue;
    _limitReached = limitReached;
    _solveTimeMs = solveTimeMs;
  }

  /**
   * @param status {@link SolverStatus#OPTIMAL} or {@link SolverStatus#FEASIBLE}.
   * @param values Value of each variable, indexed by variable index.
   * @param objectiveValue Objective value of the solution, including the objective constant.
   * @param limitReached {@code true} if a time or node limit stopped the search.
   * @param solveTimeMs Time spent in the solver.
   * @return A result carrying a solution.
   */
  public static SolveResult withSolution(SolverStatus status, double[] values, double objectiveValue, boolean limitReached,
                                         long solveTimeMs) {
    if (!status.hasSolution()) {
      throw new IllegalArgumentException(String.format("Status %s cannot carry a solution.", status));
    }
    return new SolveResult(status, values.clone(), objectiveValue, limitReached, solveTimeMs);
  }

  /**
   * @param status Any status without a solution.
   * @param limitReached {@code true} if a time or node limit stopped the search.
   * @param solveTimeMs Time spent in the solver.
   * @return A result without a solution.
   */
  public static SolveResult withoutSolution(SolverStatus status, boolean limitReached, long solveTimeMs) {
    if (status.hasSolution()) {
      throw new IllegalArgumentException(String.format("Status %s requires a solution.", status));
    }
    return new SolveResult(status, NO_VALUES, Double.NaN, limitReached, solveTimeMs);
  }

  public SolverStatus status() {
    return _status;
  }

  public boolean hasSolution() {
    return _status.hasSolution();
  }

  /**
   * @return A copy of the variable values; empty if there is no solution.
   */
  public double[] values() {
    return _values.clone();
  }

  public double value(int variableIndex) {
    return _values[variableIndex];
  }

  public double objectiveValue() {
    return _objectiveValue;
  }

  public boolean limitReached() {
    return _limitReached;
  }

  public long solveTimeMs() {
    return _solveTimeMs;
  }

  @Override
  public String toString() {
    return String.format("SolveResult{status=%s, objective=%s, limitReached=%s, solveTimeMs=%d, numValues=%d}",
                         _status, _objectiveValue, _limitReached, _solveTimeMs, _values.length);
  }
}
