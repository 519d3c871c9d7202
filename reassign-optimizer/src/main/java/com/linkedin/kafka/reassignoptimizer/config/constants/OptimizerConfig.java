/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.config.constants;

import com.linkedin.kafka.reassignoptimizer.analyzer.leader.LeaderSelectionStrategy;
import com.linkedin.kafka.reassignoptimizer.analyzer.leader.RandomLeaderSelectionStrategy;
import org.apache.kafka.common.config.ConfigDef;

import static org.apache.kafka.common.config.ConfigDef.Range.atLeast;
import static org.apache.kafka.common.config.ConfigDef.Range.between;


/**
 * A class to keep the replica assignment optimizer configs and defaults.
 * DO NOT CHANGE EXISTING CONFIG NAMES AS CHANGES WOULD BREAK USER CODE.
 */
public final class OptimizerConfig {

  /**
   * <code>balance.min.factor</code>
   */
  public static final String BALANCE_MIN_FACTOR_CONFIG = "balance.min.factor";
  public static final double DEFAULT_BALANCE_MIN_FACTOR = 0.9;
  public static final String BALANCE_MIN_FACTOR_DOC = "The lower end of the balance band, relative to the mean weighted "
      + "replica load per broker. For example, 0.9 means no broker may carry less than floor(0.9x) of the mean load. "
      + "Used when the input document does not specify balance_parameters.min_factor.";

  /**
   * <code>balance.max.factor</code>
   */
  public static final String BALANCE_MAX_FACTOR_CONFIG = "balance.max.factor";
  public static final double DEFAULT_BALANCE_MAX_FACTOR = 1.1;
  public static final String BALANCE_MAX_FACTOR_DOC = "The upper end of the balance band, relative to the mean weighted "
      + "replica load per broker. For example, 1.1 means no broker may carry more than ceil(1.1x) of the mean load. "
      + "Setting it equal to balance.min.factor requires every broker to carry exactly the same load. Used when the "
      + "input document does not specify balance_parameters.max_factor.";

  /**
   * <code>optimizer.prefer.lower.broker.ids</code>
   */
  public static final String PREFER_LOWER_BROKER_IDS_CONFIG = "optimizer.prefer.lower.broker.ids";
  public static final boolean DEFAULT_PREFER_LOWER_BROKER_IDS = false;
  public static final String PREFER_LOWER_BROKER_IDS_DOC = "True to break ties between assignments with the same number "
      + "of movements in favor of lower broker ids, which makes the proposal deterministic across solver backends. "
      + "False to let the solver pick any of the optimal assignments.";

  /**
   * <code>optimizer.accept.suboptimal.result</code>
   */
  public static final String ACCEPT_SUBOPTIMAL_RESULT_CONFIG = "optimizer.accept.suboptimal.result";
  public static final boolean DEFAULT_ACCEPT_SUBOPTIMAL_RESULT = false;
  public static final String ACCEPT_SUBOPTIMAL_RESULT_DOC = "True to return the best known feasible assignment, flagged "
      + "as not proven optimal, when the solver hits its time or node limit. False to fail the run instead.";

  /**
   * <code>optimizer.integrality.tolerance</code>
   */
  public static final String INTEGRALITY_TOLERANCE_CONFIG = "optimizer.integrality.tolerance";
  public static final double DEFAULT_INTEGRALITY_TOLERANCE = 1.0E-6;
  public static final String INTEGRALITY_TOLERANCE_DOC = "The maximum distance of a solved variable value from 0 or 1. "
      + "A value further away is treated as a solver failure rather than rounded.";

  /**
   * <code>leader.selection.strategy.class</code>
   */
  public static final String LEADER_SELECTION_STRATEGY_CLASS_CONFIG = "leader.selection.strategy.class";
  public static final String DEFAULT_LEADER_SELECTION_STRATEGY_CLASS = RandomLeaderSelectionStrategy.class.getName();
  public static final String LEADER_SELECTION_STRATEGY_CLASS_DOC = "The " + LeaderSelectionStrategy.class.getSimpleName()
      + " that orders the proposed replicas of each partition, preferred leader first.";

  /**
   * <code>leader.selection.random.seed</code>
   */
  public static final String LEADER_SELECTION_RANDOM_SEED_CONFIG = "leader.selection.random.seed";
  public static final String LEADER_SELECTION_RANDOM_SEED_DOC = "The seed of the random leader selection strategy. "
      + "If unset, every run shuffles differently.";

  private OptimizerConfig() {
  }

  /**
   * Define configs for the optimizer.
   *
   * @param configDef Config definition.
   * @return The given ConfigDef after defining the configs for the optimizer.
   */
  public static ConfigDef define(ConfigDef configDef) {
    return configDef.define(BALANCE_MIN_FACTOR_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_BALANCE_MIN_FACTOR,
                            atLeast(0),
                            ConfigDef.Importance.HIGH,
                            BALANCE_MIN_FACTOR_DOC)
                    .define(BALANCE_MAX_FACTOR_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_BALANCE_MAX_FACTOR,
                            atLeast(0),
                            ConfigDef.Importance.HIGH,
                            BALANCE_MAX_FACTOR_DOC)
                    .define(PREFER_LOWER_BROKER_IDS_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_PREFER_LOWER_BROKER_IDS,
                            ConfigDef.Importance.LOW,
                            PREFER_LOWER_BROKER_IDS_DOC)
                    .define(ACCEPT_SUBOPTIMAL_RESULT_CONFIG,
                            ConfigDef.Type.BOOLEAN,
                            DEFAULT_ACCEPT_SUBOPTIMAL_RESULT,
                            ConfigDef.Importance.MEDIUM,
                            ACCEPT_SUBOPTIMAL_RESULT_DOC)
                    .define(INTEGRALITY_TOLERANCE_CONFIG,
                            ConfigDef.Type.DOUBLE,
                            DEFAULT_INTEGRALITY_TOLERANCE,
                            between(0, 0.5),
                            ConfigDef.Importance.LOW,
                            INTEGRALITY_TOLERANCE_DOC)
                    .define(LEADER_SELECTION_STRATEGY_CLASS_CONFIG,
                            ConfigDef.Type.CLASS,
                            DEFAULT_LEADER_SELECTION_STRATEGY_CLASS,
                            ConfigDef.Importance.MEDIUM,
                            LEADER_SELECTION_STRATEGY_CLASS_DOC)
                    .define(LEADER_SELECTION_RANDOM_SEED_CONFIG,
                            ConfigDef.Type.LONG,
                            null,
                            ConfigDef.Importance.LOW,
                            LEADER_SELECTION_RANDOM_SEED_DOC);
  }
}
