/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.common.utils;

import java.math.BigDecimal;
import java.math.RoundingMode;


public final class Utils {
  public static final double INTEGER_SNAP_TOLERANCE = 1E-9;

  private Utils() {

  }

  /**
   * Checks that the specified object reference is not null and throws a customized IllegalArgumentException if it is.
   *
   * @param obj the object reference to check for nullity
   * @param errorMsg message to be used in the event that a IllegalArgumentException is thrown
   * @param <T> the type of the reference
   * @return obj if not null
   * @throws IllegalArgumentException if obj is null
   */
  public static <T> T validateNotNull(T obj, String errorMsg) {
    if (obj == null) {
      throw new IllegalArgumentException(errorMsg);
    }
    return obj;
  }

  /**
   * Floating point sums of weights pick up noise such as {@code 2.0000000000000004}. Values that are within
   * {@link #INTEGER_SNAP_TOLERANCE} of an integer are replaced by that integer, others are returned as is.
   *
   * @param value The value to snap.
   * @return The nearest integer if the value is close enough to it, the given value otherwise.
   */
  public static double snapToInteger(double value) {
    double nearest = Math.rint(value);
    return Math.abs(value - nearest) <= INTEGER_SNAP_TOLERANCE ? nearest : value;
  }

  /**
   * @param value The value to format.
   * @return The value without a fractional part if it is integral, with up to six decimals otherwise.
   */
  public static String formatNumber(double value) {
    if (Double.isInfinite(value) || Double.isNaN(value)) {
      return String.valueOf(value);
    }
    if (value == Math.rint(value)) {
      return String.valueOf((long) value);
    }
    return BigDecimal.valueOf(value).setScale(6, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
  }
}
