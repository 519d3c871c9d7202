/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.model;

import java.util.Objects;


/**
 * A binary decision variable of a {@link MilpModel}. The domain is {@code [lower, upper]} restricted to integers, where
 * both bounds are 0 or 1; a variable with {@code lower == upper} is fixed.
 */
public final class DecisionVariable {
  private final String _name;
  private final int _index;
  private final int _lower;
  private final int _upper;

  DecisionVariable(String name, int index, int lower, int upper) {
    if (lower < 0 || upper > 1 || lower > upper) {
      throw new IllegalArgumentException(String.format("Invalid domain [%d, %d] for binary variable %s.", lower, upper, name));
    }
    _name = name;
    _index = index;
    _lower = lower;
    _upper = upper;
  }

  public String name() {
    return _name;
  }

  /**
   * @return Position of the variable in {@link MilpModel#variables()}, also the position of its value in a solution.
   */
  public int index() {
    return _index;
  }

  public int lower() {
    return _lower;
  }

  public int upper() {
    return _upper;
  }

  public boolean isFixed() {
    return _lower == _upper;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    DecisionVariable that = (DecisionVariable) o;
    return _index == that._index && _name.equals(that._name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_name, _index);
  }

  @Override
  public String toString() {
    return isFixed() ? String.format("%s = %d", _name, _lower) : String.format("%d <= %s <= %d", _lower, _name, _upper);
  }
}
