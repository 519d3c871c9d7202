/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;

import com.linkedin.reassignoptimizer.exception.SolverException;
import com.linkedin.reassignoptimizer.model.DecisionVariable;
import com.linkedin.reassignoptimizer.model.LinearConstraint;
import com.linkedin.reassignoptimizer.model.MilpModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A dependency free depth-first branch and bound {@link Solver} for pure binary models.
 *
 * <p>Variables are branched in model order, trying the value with the lower objective coefficient first. A node is
 * pruned when some constraint can no longer be satisfied by any completion of the partial assignment, or when the
 * objective lower bound of any completion cannot improve on the incumbent. It has no LP relaxation, so it is meant
 * for small models and for cross-checking other backends.
 */
public class BinaryBranchAndBoundSolver implements Solver {
  private static final Logger LOG = LoggerFactory.getLogger(BinaryBranchAndBoundSolver.class);
  static final double FEASIBILITY_TOLERANCE = 1E-9;
  // Stop recursion before it threatens the thread stack.
  static final int MAX_FREE_VARIABLES = 4096;
  private static final int TIME_CHECK_INTERVAL = 1024;

  @Override
  public SolveResult solve(MilpModel model, SolverOptions options) throws SolverException {
    if (model.numFreeVariables() > MAX_FREE_VARIABLES) {
      throw new SolverException(String.format("Model %s has %d free variables, %s supports at most %d.", model.name(),
                                              model.numFreeVariables(), name(), MAX_FREE_VARIABLES));
    }
    Search search = new Search(model, options);
    long startMs = System.currentTimeMillis();
    search.run();
    long solveTimeMs = System.currentTimeMillis() - startMs;
    LOG.debug("{} explored {} nodes of model {} in {}ms (aborted: {}).", name(), search._numNodes, model.name(),
              solveTimeMs, search._aborted);

    if (search._incumbent == null) {
      SolverStatus status = search._aborted ? SolverStatus.NOT_SOLVED : SolverStatus.INFEASIBLE;
      return SolveResult.withoutSolution(status, search._aborted, solveTimeMs);
    }
    SolverStatus status = search._aborted ? SolverStatus.FEASIBLE : SolverStatus.OPTIMAL;
    return SolveResult.withSolution(status, search._incumbent, model.objective().evaluate(search._incumbent),
                                    search._aborted, solveTimeMs);
  }

  @Override
  public String name() {
    return "binary-branch-and-bound";
  }

  /**
   * State of a single search. Constraint activities and the remaining reachable range of every constraint are
   * maintained incrementally while descending and restored while backtracking.
   */
  private static final class Search {
    private final MilpModel _model;
    private final long _deadlineMs;
    private final long _nodeLimit;
    private final int[] _freeVariables;
    private final double[] _objectiveCoefficients;
    // Per variable: the constraints it appears in and its coefficient in each of them.
    private final int[][] _constraintsOfVariable;
    private final double[][] _coefficientsOfVariable;
    private final double[] _lower;
    private final double[] _upper;
    private final double[] _activity;
    private final double[] _remainingMin;
    private final double[] _remainingMax;
    private final double[] _current;
    private double _remainingObjectiveMin;
    private double[] _incumbent;
    private double _incumbentObjective;
    private long _numNodes;
    private boolean _aborted;

    Search(MilpModel model, SolverOptions options) {
      _model = model;
      long now = System.currentTimeMillis();
      _deadlineMs = options.timeLimitMs() > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + options.timeLimitMs();
      _nodeLimit = options.nodeLimit();
      int numVariables = model.variables().size();
      int numConstraints = model.constraints().size();

      _objectiveCoefficients = new double[numVariables];
      for (DecisionVariable variable : model.variables()) {
        _objectiveCoefficients[variable.index()] = model.objective().coefficient(variable);
      }

      List<List<Integer>> constraintIndices = new ArrayList<>(numVariables);
      List<List<Double>> coefficients = new ArrayList<>(numVariables);
      for (int i = 0; i < numVariables; i++) {
        constraintIndices.add(new ArrayList<>());
        coefficients.add(new ArrayList<>());
      }
      _lower = new double[numConstraints];
      _upper = new double[numConstraints];
      for (int c = 0; c < numConstraints; c++) {
        LinearConstraint constraint = model.constraints().get(c);
        _lower[c] = constraint.lower() - constraint.expression().constant();
        _upper[c] = constraint.upper() - constraint.expression().constant();
        for (Map.Entry<Integer, Double> term : constraint.expression().coefficients().entrySet()) {
          constraintIndices.get(term.getKey()).add(c);
          coefficients.get(term.getKey()).add(term.getValue());
        }
      }
      _constraintsOfVariable = new int[numVariables][];
      _coefficientsOfVariable = new double[numVariables][];
      for (int i = 0; i < numVariables; i++) {
        _constraintsOfVariable[i] = constraintIndices.get(i).stream().mapToInt(Integer::intValue).toArray();
        _coefficientsOfVariable[i] = coefficients.get(i).stream().mapToDouble(Double::doubleValue).toArray();
      }

      _activity = new double[numConstraints];
      _remainingMin = new double[numConstraints];
      _remainingMax = new double[numConstraints];
      _current = new double[numVariables];
      List<Integer> freeVariables = new ArrayList<>();
      for (DecisionVariable variable : model.variables()) {
        int v = variable.index();
        if (variable.isFixed()) {
          _current[v] = variable.lower();
          for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
            _activity[_constraintsOfVariable[v][k]] += _coefficientsOfVariable[v][k] * variable.lower();
          }
        } else {
          freeVariables.add(v);
          _remainingObjectiveMin += Math.min(0.0, _objectiveCoefficients[v]);
          for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
            int c = _constraintsOfVariable[v][k];
            _remainingMin[c] += Math.min(0.0, _coefficientsOfVariable[v][k]);
            _remainingMax[c] += Math.max(0.0, _coefficientsOfVariable[v][k]);
          }
        }
      }
      _freeVariables = freeVariables.stream().mapToInt(Integer::intValue).toArray();
      _incumbent = null;
      _incumbentObjective = Double.POSITIVE_INFINITY;
    }

    void run() {
      double fixedObjective = 0.0;
      for (DecisionVariable variable : _model.variables()) {
        if (variable.isFixed()) {
          fixedObjective += _objectiveCoefficients[variable.index()] * variable.lower();
        }
      }
      if (canStillSatisfyAll()) {
        branch(0, fixedObjective);
      }
    }

    private void branch(int depth, double objectiveSoFar) {
      if (_aborted || shouldAbort()) {
        return;
      }
      _numNodes++;
      if (objectiveSoFar + _remainingObjectiveMin >= _incumbentObjective - FEASIBILITY_TOLERANCE) {
        return;
      }
      if (depth == _freeVariables.length) {
        _incumbent = _current.clone();
        _incumbentObjective = objectiveSoFar;
        return;
      }
      int v = _freeVariables[depth];
      double objectiveCoefficient = _objectiveCoefficients[v];
      int firstValue = objectiveCoefficient <= 0.0 ? 1 : 0;

      release(v);
      for (int value : new int[]{firstValue, 1 - firstValue}) {
        if (assign(v, value)) {
          branch(depth + 1, objectiveSoFar + objectiveCoefficient * value);
        }
        unassign(v, value);
      }
      restore(v);
    }

    private boolean shouldAbort() {
      if (_numNodes >= _nodeLimit
          || (_numNodes % TIME_CHECK_INTERVAL == 0 && System.currentTimeMillis() >= _deadlineMs)) {
        _aborted = true;
      }
      return _aborted;
    }

    /**
     * Take the variable out of the remaining ranges before deciding its value.
     */
    private void release(int v) {
      _remainingObjectiveMin -= Math.min(0.0, _objectiveCoefficients[v]);
      for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
        int c = _constraintsOfVariable[v][k];
        _remainingMin[c] -= Math.min(0.0, _coefficientsOfVariable[v][k]);
        _remainingMax[c] -= Math.max(0.0, _coefficientsOfVariable[v][k]);
      }
    }

    private void restore(int v) {
      _remainingObjectiveMin += Math.min(0.0, _objectiveCoefficients[v]);
      for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
        int c = _constraintsOfVariable[v][k];
        _remainingMin[c] += Math.min(0.0, _coefficientsOfVariable[v][k]);
        _remainingMax[c] += Math.max(0.0, _coefficientsOfVariable[v][k]);
      }
    }

    /**
     * @return {@code true} if every constraint touched by the variable can still be satisfied after the assignment.
     */
    private boolean assign(int v, int value) {
      _current[v] = value;
      boolean feasible = true;
      for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
        int c = _constraintsOfVariable[v][k];
        _activity[c] += _coefficientsOfVariable[v][k] * value;
        feasible &= canStillSatisfy(c);
      }
      return feasible;
    }

    private void unassign(int v, int value) {
      _current[v] = 0.0;
      for (int k = 0; k < _constraintsOfVariable[v].length; k++) {
        _activity[_constraintsOfVariable[v][k]] -= _coefficientsOfVariable[v][k] * value;
      }
    }

    private boolean canStillSatisfy(int c) {
      return _activity[c] + _remainingMin[c] <= _upper[c] + FEASIBILITY_TOLERANCE
             && _activity[c] + _remainingMax[c] >= _lower[c] - FEASIBILITY_TOLERANCE;
    }

    private boolean canStillSatisfyAll() {
      for (int c = 0; c < _activity.length; c++) {
        if (!canStillSatisfy(c)) {
          return false;
        }
      }
      return true;
    }
  }
}
