/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.config.constants;

import com.linkedin.kafka.reassignoptimizer.common.Verbosity;
import org.apache.kafka.common.config.ConfigDef;


/**
 * A class to keep the diagnostic output configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class DiagnosticConfig {

  /**
   * <code>diagnostic.verbosity</code>
   */
  public static final String DIAGNOSTIC_VERBOSITY_CONFIG = "diagnostic.verbosity";
  public static final String DEFAULT_DIAGNOSTIC_VERBOSITY = Verbosity.INFO.name();
  public static final String DIAGNOSTIC_VERBOSITY_DOC = "How much the diagnostic reporter writes: QUIET for nothing but "
      + "failures, INFO for the run summary and solver outcome, DEBUG to add the formulated model and the current and "
      + "proposed assignment grids.";

  /**
   * <code>diagnostic.assignment.grid.enabled</code>
   */
  public static final String ASSIGNMENT_GRID_ENABLED_CONFIG = "diagnostic.assignment.grid.enabled";
  public static final boolean DEFAULT_ASSIGNMENT_GRID_ENABLED = false;
  public static final String ASSIGNMENT_GRID_ENABLED_DOC = "True to write the broker by partition grid of the current "
      + "and proposed assignments at INFO verbosity. It is always written at DEBUG verbosity.";

  private DiagnosticConfig() {
  }

  /**
   * Define configs for diagnostics.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for diagnostics.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(DIAGNOSTIC_VERBOSITY_CONFIG,
                            ConfigDef.Type.STRING,
                            DEFAULT_DIAGNOSTIC_VERBOSITY,
                            ConfigDef.CaseInsensitiveValidString.in(Verbosity.names()),
                            ConfigDef.Importance.MEDIUM,
                            DIAGNOSTIC_VERBOSITY_DOC)
                    .define(ASSIGNMENT_GRID_ENABLED_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ASSIGNMENT_GRID_ENABLED,
                            ConfigDef.Importance.LOW,
                            ASSIGNMENT_GRID_ENABLED_DOC);
  }
}
