/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.model;

import com.linkedin.reassignoptimizer.common.utils.Utils;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;


/**
 * A linear expression {@code constant + sum(coefficient_i * x_i)} over the variables of a {@link MilpModel}.
 * Terms are keyed by variable index; adding the same variable twice accumulates its coefficient.
 */
public class LinearExpression {
  private final SortedMap<Integer, Double> _coefficientByVariableIndex;
  private double _constant;

  public LinearExpression() {
    _coefficientByVariableIndex = new TreeMap<>();
    _constant = 0.0;
  }

  /**
   * Add {@code coefficient * variable} to this expression.
   *
   * @param variable Decision variable.
   * @param coefficient Coefficient of the term.
   * @return This expression.
   */
  public LinearExpression addTerm(DecisionVariable variable, double coefficient) {
    if (!Double.isFinite(coefficient)) {
      throw new IllegalArgumentException(String.format("Coefficient of %s must be finite (%f).", variable.name(), coefficient));
    }
    _coefficientByVariableIndex.merge(variable.index(), coefficient, Double::sum);
    return this;
  }

  /**
   * @param constant Constant to add to this expression.
   * @return This expression.
   */
  public LinearExpression addConstant(double constant) {
    _constant += constant;
    return this;
  }

  /**
   * @return Coefficient by variable index, in ascending index order.
   */
  public Map<Integer, Double> coefficients() {
    return Collections.unmodifiableMap(_coefficientByVariableIndex);
  }

  public double coefficient(DecisionVariable variable) {
    return _coefficientByVariableIndex.getOrDefault(variable.index(), 0.0);
  }

  public double constant() {
    return _constant;
  }

  /**
   * @param values Value of each variable of the model, indexed by {@link DecisionVariable#index()}.
   * @return Value of this expression for the given variable values.
   */
  public double evaluate(double[] values) {
    double result = _constant;
    for (Map.Entry<Integer, Double> term : _coefficientByVariableIndex.entrySet()) {
      result += term.getValue() * values[term.getKey()];
    }
    return result;
  }

  /**
   * @param model The model that owns the variables of this expression.
   * @return Human readable form, e.g. {@code 2 x_1 - x_3 + 4}.
   */
  public String toString(MilpModel model) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<Integer, Double> term : _coefficientByVariableIndex.entrySet()) {
      double coefficient = term.getValue();
      if (sb.length() == 0) {
        sb.append(coefficient < 0 ? "-" : "");
      } else {
        sb.append(coefficient < 0 ? " - " : " + ");
      }
      if (Math.abs(coefficient) != 1.0) {
        sb.append(Utils.formatNumber(Math.abs(coefficient))).append(' ');
      }
      sb.append(model.variables().get(term.getKey()).name());
    }
    if (_constant != 0.0 || sb.length() == 0) {
      if (sb.length() == 0) {
        sb.append(Utils.formatNumber(_constant));
      } else {
        sb.append(_constant < 0 ? " - " : " + ").append(Utils.formatNumber(Math.abs(_constant)));
      }
    }
    return sb.toString();
  }
}
