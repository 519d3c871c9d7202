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
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A {@link Solver} backed by the branch and bound integer solver of ojAlgo's {@link ExpressionsBasedModel}.
 */
public class OjAlgoSolver implements Solver {
  private static final Logger LOG = LoggerFactory.getLogger(OjAlgoSolver.class);
  static final double INTEGRALITY_TOLERANCE = 1E-6;

  @Override
  public SolveResult solve(MilpModel model, SolverOptions options) throws SolverException {
    ExpressionsBasedModel ojModel = new ExpressionsBasedModel();
    ojModel.options.time_abort = options.timeLimitMs();
    ojModel.options.iterations_abort = (int) Math.min(Integer.MAX_VALUE, options.nodeLimit());

    List<Variable> ojVariables = new ArrayList<>(model.variables().size());
    for (DecisionVariable variable : model.variables()) {
      Variable ojVariable = Variable.make(variable.name()).lower(variable.lower()).upper(variable.upper()).integer(true);
      double weight = model.objective().coefficient(variable);
      if (weight != 0.0) {
        ojVariable.weight(weight);
      }
      ojModel.addVariable(ojVariable);
      ojVariables.add(ojVariable);
    }

    for (LinearConstraint constraint : model.constraints()) {
      Expression expression = ojModel.addExpression(constraint.name());
      for (Map.Entry<Integer, Double> term : constraint.expression().coefficients().entrySet()) {
        expression.set(ojVariables.get(term.getKey()), term.getValue());
      }
      // ojAlgo expressions have no constant, so it moves to the bounds.
      double constant = constraint.expression().constant();
      if (constraint.isEquality()) {
        expression.level(constraint.lower() - constant);
      } else {
        if (constraint.hasLower()) {
          expression.lower(constraint.lower() - constant);
        }
        if (constraint.hasUpper()) {
          expression.upper(constraint.upper() - constant);
        }
      }
    }

    LOG.debug("Solving model {} with {} variables and {} constraints, {}.", model.name(), ojVariables.size(),
              model.constraints().size(), options);
    long startMs = System.currentTimeMillis();
    Optimisation.Result result;
    try {
      result = ojModel.minimise();
    } catch (RuntimeException e) {
      throw new SolverException(String.format("ojAlgo failed to solve model %s.", model.name()), e);
    }
    long solveTimeMs = System.currentTimeMillis() - startMs;
    Optimisation.State state = result.getState();
    boolean limitReached = solveTimeMs >= options.timeLimitMs()
                           || isIterationsAbort(state, options.nodeLimit() < Integer.MAX_VALUE);
    SolverStatus status = toSolverStatus(state, limitReached);
    LOG.debug("ojAlgo finished model {} in {}ms with state {} (reported as {}).", model.name(), solveTimeMs, state, status);

    if (status == SolverStatus.NOT_SOLVED) {
      // An aborted search may still carry its incumbent.
      double[] incumbent = feasibleValues(model, result);
      if (incumbent != null) {
        return SolveResult.withSolution(SolverStatus.FEASIBLE, incumbent, model.objective().evaluate(incumbent), true,
                                        solveTimeMs);
      }
      return SolveResult.withoutSolution(status, true, solveTimeMs);
    }
    if (!status.hasSolution()) {
      return SolveResult.withoutSolution(status, limitReached, solveTimeMs);
    }
    double[] values = new double[ojVariables.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = result.doubleValue(i);
    }
    return SolveResult.withSolution(status, values, model.objective().evaluate(values),
                                    status == SolverStatus.FEASIBLE, solveTimeMs);
  }

  /**
   * ojAlgo ends a search stopped by {@code iterations_abort} in a failure state, the same way it reports a numerical
   * failure. With a finite iteration limit such a state is read as the limit being hit.
   *
   * @param state ojAlgo state.
   * @param iterationLimited {@code true} if a finite iteration limit was set.
   * @return {@code true} if the state is read as a search stopped at the iteration limit.
   */
  static boolean isIterationsAbort(Optimisation.State state, boolean iterationLimited) {
    return iterationLimited && state.isFailure() && state != Optimisation.State.INFEASIBLE
           && state != Optimisation.State.UNBOUNDED;
  }

  /**
   * @return The values of the result rounded to 0 or 1 if they satisfy every bound and constraint of the model,
   * {@code null} otherwise.
   */
  static double[] feasibleValues(MilpModel model, Optimisation.Result result) {
    int numVariables = model.variables().size();
    if (result.count() != numVariables) {
      return null;
    }
    double[] values = new double[numVariables];
    for (DecisionVariable variable : model.variables()) {
      double value = result.doubleValue(variable.index());
      double rounded = Math.rint(value);
      if (Double.isNaN(value) || Math.abs(value - rounded) > INTEGRALITY_TOLERANCE
          || rounded < variable.lower() || rounded > variable.upper()) {
        return null;
      }
      values[variable.index()] = rounded;
    }
    return model.violations(values, INTEGRALITY_TOLERANCE).isEmpty() ? values : null;
  }

  /**
   * ojAlgo may report an aborted search without an incumbent as infeasible. A run that hit a limit is therefore never
   * trusted as a proof of infeasibility.
   *
   * @param state ojAlgo state.
   * @param limitReached {@code true} if the time limit was consumed or the search stopped at the iteration limit.
   * @return The corresponding solver status.
   */
  static SolverStatus toSolverStatus(Optimisation.State state, boolean limitReached) {
    if (state.isOptimal() && !limitReached) {
      return SolverStatus.OPTIMAL;
    } else if (state.isFeasible() || state == Optimisation.State.APPROXIMATE) {
      return SolverStatus.FEASIBLE;
    } else if (limitReached) {
      return SolverStatus.NOT_SOLVED;
    } else if (state == Optimisation.State.INFEASIBLE) {
      return SolverStatus.INFEASIBLE;
    } else if (state == Optimisation.State.UNBOUNDED) {
      return SolverStatus.UNBOUNDED;
    } else if (state.isFailure()) {
      return SolverStatus.ERROR;
    }
    return SolverStatus.NOT_SOLVED;
  }

  @Override
  public String name() {
    return "ojAlgo";
  }
}
