/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.model;

import com.linkedin.reassignoptimizer.common.utils.Utils;


/**
 * A named constraint {@code lower <= expression <= upper}. An unbounded side is represented by an infinite value, and
 * {@code lower == upper} makes it an equality.
 */
public final class LinearConstraint {
  private final String _name;
  private final LinearExpression _expression;
  private final double _lower;
  private final double _upper;

  LinearConstraint(String name, LinearExpression expression, double lower, double upper) {
    if (Double.isNaN(lower) || Double.isNaN(upper) || lower > upper) {
      throw new IllegalArgumentException(String.format("Invalid bounds [%f, %f] for constraint %s.", lower, upper, name));
    }
    if (lower == Double.NEGATIVE_INFINITY && upper == Double.POSITIVE_INFINITY) {
      throw new IllegalArgumentException(String.format("Constraint %s must bound at least one side.", name));
    }
    _name = name;
    _expression = expression;
    _lower = lower;
    _upper = upper;
  }

  public String name() {
    return _name;
  }

  public LinearExpression expression() {
    return _expression;
  }

  public double lower() {
    return _lower;
  }

  public double upper() {
    return _upper;
  }

  public boolean hasLower() {
    return _lower != Double.NEGATIVE_INFINITY;
  }

  public boolean hasUpper() {
    return _upper != Double.POSITIVE_INFINITY;
  }

  public boolean isEquality() {
    return _lower == _upper;
  }

  /**
   * @param values Value of each variable of the model.
   * @param tolerance Absolute tolerance on both bounds.
   * @return {@code true} if the given values satisfy this constraint.
   */
  public boolean isSatisfied(double[] values, double tolerance) {
    double activity = _expression.evaluate(values);
    return activity >= _lower - tolerance && activity <= _upper + tolerance;
  }

  /**
   * @param model The model that owns this constraint.
   * @return Human readable form of the constraint.
   */
  public String toString(MilpModel model) {
    String expression = _expression.toString(model);
    if (isEquality()) {
      return String.format("%s: %s = %s", _name, expression, Utils.formatNumber(_lower));
    } else if (!hasLower()) {
      return String.format("%s: %s <= %s", _name, expression, Utils.formatNumber(_upper));
    } else if (!hasUpper()) {
      return String.format("%s: %s >= %s", _name, expression, Utils.formatNumber(_lower));
    }
    return String.format("%s: %s <= %s <= %s", _name, Utils.formatNumber(_lower), expression, Utils.formatNumber(_upper));
  }
}
