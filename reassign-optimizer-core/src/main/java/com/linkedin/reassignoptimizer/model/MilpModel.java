/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * A minimization model over binary decision variables with a linear objective and linear constraints. This is the
 * only thing a {@link com.linkedin.reassignoptimizer.solver.Solver} sees; it carries no knowledge of what the variables
 * stand for.
 *
 * <p>Variables are indexed in creation order. A solution is a {@code double[]} whose i-th element is the value of the
 * variable with index i.
 */
public class MilpModel {
  private final String _name;
  private final List<DecisionVariable> _variables;
  private final Map<String, DecisionVariable> _variableByName;
  private final List<LinearConstraint> _constraints;
  private final Set<String> _constraintNames;
  private LinearExpression _objective;

  public MilpModel(String name) {
    _name = name;
    _variables = new ArrayList<>();
    _variableByName = new HashMap<>();
    _constraints = new ArrayList<>();
    _constraintNames = new HashSet<>();
    _objective = new LinearExpression();
  }

  public String name() {
    return _name;
  }

  /**
   * @param name Unique name of the variable.
   * @return A new variable with domain {0, 1}.
   */
  public DecisionVariable addBinaryVariable(String name) {
    return addBinaryVariable(name, 0, 1);
  }

  /**
   * @param name Unique name of the variable.
   * @param lower Lower bound, 0 or 1.
   * @param upper Upper bound, 0 or 1.
   * @return A new variable with domain {@code [lower, upper]}.
   */
  public DecisionVariable addBinaryVariable(String name, int lower, int upper) {
    if (_variableByName.containsKey(name)) {
      throw new IllegalArgumentException(String.format("Variable %s already exists in model %s.", name, _name));
    }
    DecisionVariable variable = new DecisionVariable(name, _variables.size(), lower, upper);
    _variables.add(variable);
    _variableByName.put(name, variable);
    return variable;
  }

  /**
   * Add {@code lower <= expression <= upper}. Use infinite values for an unbounded side.
   *
   * @param name Unique name of the constraint.
   * @param expression Left hand side.
   * @param lower Lower bound.
   * @param upper Upper bound.
   * @return The new constraint.
   */
  public LinearConstraint addConstraint(String name, LinearExpression expression, double lower, double upper) {
    if (!_constraintNames.add(name)) {
      throw new IllegalArgumentException(String.format("Constraint %s already exists in model %s.", name, _name));
    }
    for (Integer index : expression.coefficients().keySet()) {
      if (index >= _variables.size()) {
        throw new IllegalArgumentException(String.format("Constraint %s refers to unknown variable index %d.", name, index));
      }
    }
    LinearConstraint constraint = new LinearConstraint(name, expression, lower, upper);
    _constraints.add(constraint);
    return constraint;
  }

  /**
   * Add {@code expression == value}.
   *
   * @param name Unique name of the constraint.
   * @param expression Left hand side.
   * @param value Right hand side.
   * @return The new constraint.
   */
  public LinearConstraint addEqualityConstraint(String name, LinearExpression expression, double value) {
    return addConstraint(name, expression, value, value);
  }

  /**
   * @param objective Expression to minimize.
   */
  public void minimize(LinearExpression objective) {
    _objective = objective;
  }

  public LinearExpression objective() {
    return _objective;
  }

  public List<DecisionVariable> variables() {
    return Collections.unmodifiableList(_variables);
  }

  public DecisionVariable variable(String name) {
    return _variableByName.get(name);
  }

  public List<LinearConstraint> constraints() {
    return Collections.unmodifiableList(_constraints);
  }

  /**
   * @return Number of variables that are not fixed by their bounds.
   */
  public int numFreeVariables() {
    return (int) _variables.stream().filter(v -> !v.isFixed()).count();
  }

  /**
   * @param values Value of each variable.
   * @param tolerance Absolute tolerance.
   * @return Names of the constraints and variable bounds that the given values violate, empty if none.
   */
  public List<String> violations(double[] values, double tolerance) {
    if (values.length != _variables.size()) {
      throw new IllegalArgumentException(String.format("Expected %d values, received %d.", _variables.size(), values.length));
    }
    List<String> violations = new ArrayList<>();
    for (DecisionVariable variable : _variables) {
      double value = values[variable.index()];
      if (value < variable.lower() - tolerance || value > variable.upper() + tolerance) {
        violations.add(String.format("bound of %s (value %f)", variable.name(), value));
      }
    }
    for (LinearConstraint constraint : _constraints) {
      if (!constraint.isSatisfied(values, tolerance)) {
        violations.add(constraint.name());
      }
    }
    return violations;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(_name).append(String.format("%nMINIMIZE%n  ")).append(_objective.toString(this));
    sb.append(String.format("%nSUBJECT TO%n"));
    for (LinearConstraint constraint : _constraints) {
      sb.append("  ").append(constraint.toString(this)).append(String.format("%n"));
    }
    sb.append(String.format("VARIABLES%n"));
    for (DecisionVariable variable : _variables) {
      sb.append("  ").append(variable).append(String.format("%n"));
    }
    return sb.toString();
  }
}
