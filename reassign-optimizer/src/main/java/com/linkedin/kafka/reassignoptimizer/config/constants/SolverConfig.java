/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.config.constants;

import com.linkedin.reassignoptimizer.solver.OjAlgoSolver;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;


/**
 * A class to keep the solver configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class SolverConfig {

  /**
   * <code>solver.class</code>
   */
  public static final String SOLVER_CLASS_CONFIG = "solver.class";
  public static final String DEFAULT_SOLVER_CLASS = OjAlgoSolver.class.getName();
  public static final String SOLVER_CLASS_DOC = "The mixed integer programming backend used to solve the reassignment "
      + "model. It must implement com.linkedin.reassignoptimizer.solver.Solver.";

  /**
   * <code>solver.time.limit.ms</code>
   */
  public static final String SOLVER_TIME_LIMIT_MS_CONFIG = "solver.time.limit.ms";
  public static final long DEFAULT_SOLVER_TIME_LIMIT_MS = TimeUnit.MINUTES.toMillis(5);
  public static final String SOLVER_TIME_LIMIT_MS_DOC = "The wall clock time in milliseconds the solver may spend on a "
      + "single model. A run that hits the limit is reported separately from optimal and infeasible runs.";

  /**
   * <code>solver.node.limit</code>
   */
  public static final String SOLVER_NODE_LIMIT_CONFIG = "solver.node.limit";
  public static final long DEFAULT_SOLVER_NODE_LIMIT = Long.MAX_VALUE;
  public static final String SOLVER_NODE_LIMIT_DOC = "The maximum number of search nodes (or iterations, depending on "
      + "the backend) the solver may explore on a single model.";

  private SolverConfig() {
  }

  /**
   * Define configs for the solver.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the solver.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(SOLVER_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_SOLVER_CLASS,
                            ConfigDef.Importance.HIGH,
                            SOLVER_CLASS_DOC)
                    .define(SOLVER_TIME_LIMIT_MS_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_SOLVER_TIME_LIMIT_MS,
                            atLeast(1),
                            ConfigDef.Importance.HIGH,
                            SOLVER_TIME_LIMIT_MS_DOC)
                    .define(SOLVER_NODE_LIMIT_CONFIG,
                            ConfigDef.Type.LONG,
                            DEFAULT_SOLVER_NODE_LIMIT,
                            atLeast(1),
                            ConfigDef.Importance.LOW,
                            SOLVER_NODE_LIMIT_DOC);
  }
}
