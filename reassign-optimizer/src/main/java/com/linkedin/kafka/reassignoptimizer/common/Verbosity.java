/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.common;

import java.util.Arrays;


/**
 * Verbosity of the {@link DiagnosticReporter}, from least to most verbose.
 */
public enum Verbosity {
  QUIET, INFO, DEBUG;

  private static final String[] NAMES = Arrays.stream(values()).map(Enum::name).toArray(String[]::new);

  /**
   * @return Names of all verbosity levels, least verbose first.
   */
  public static String[] names() {
    return NAMES.clone();
  }

  /**
   * @param other Another verbosity.
   * @return {@code true} if this verbosity writes everything that {@code other} writes.
   */
  public boolean includes(Verbosity other) {
    return compareTo(other) >= 0;
  }
}
