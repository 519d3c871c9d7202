/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.config;

import com.linkedin.kafka.reassignoptimizer.analyzer.leader.LeaderSelectionStrategy;
import com.linkedin.kafka.reassignoptimizer.analyzer.leader.RandomLeaderSelectionStrategy;
import com.linkedin.kafka.reassignoptimizer.common.Verbosity;
import com.linkedin.kafka.reassignoptimizer.config.constants.DiagnosticConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.OptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.SolverConfig;
import com.linkedin.reassignoptimizer.solver.OjAlgoSolver;
import com.linkedin.reassignoptimizer.solver.Solver;
import com.linkedin.reassignoptimizer.solver.SolverOptions;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ReassignOptimizerConfigTest {

  @Test
  public void testDefaults() {
    ReassignOptimizerConfig config = new ReassignOptimizerConfig(Collections.emptyMap(), false);
    assertEquals(OptimizerConfig.DEFAULT_BALANCE_MIN_FACTOR, config.getDouble(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG), 0.0);
    assertEquals(OptimizerConfig.DEFAULT_BALANCE_MAX_FACTOR, config.getDouble(OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG), 0.0);
    assertFalse(config.getBoolean(OptimizerConfig.ACCEPT_SUBOPTIMAL_RESULT_CONFIG));
    assertEquals(Verbosity.INFO, config.verbosity());
    SolverOptions options = config.solverOptions();
    assertEquals(SolverConfig.DEFAULT_SOLVER_TIME_LIMIT_MS, options.timeLimitMs());
    assertEquals(SolverConfig.DEFAULT_SOLVER_NODE_LIMIT, options.nodeLimit());
    assertTrue(config.getConfiguredInstance(SolverConfig.SOLVER_CLASS_CONFIG, Solver.class) instanceof OjAlgoSolver);
  }

  @Test
  public void testOverrides() {
    Map<String, Object> props = new HashMap<>();
    props.put(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG, "1.0");
    props.put(OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG, "1.0");
    props.put(SolverConfig.SOLVER_TIME_LIMIT_MS_CONFIG, "1000");
    props.put(SolverConfig.SOLVER_NODE_LIMIT_CONFIG, "50");
    props.put(DiagnosticConfig.DIAGNOSTIC_VERBOSITY_CONFIG, "debug");
    ReassignOptimizerConfig config = new ReassignOptimizerConfig(props, false);
    assertEquals(1.0, config.getDouble(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG), 0.0);
    assertEquals(Verbosity.DEBUG, config.verbosity());
    assertEquals(1000L, config.solverOptions().timeLimitMs());
    assertEquals(50L, config.solverOptions().nodeLimit());
  }

  @Test
  public void testInvalidValues() {
    assertThrows(ConfigException.class, () -> new ReassignOptimizerConfig(
        Map.of(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG, "1.2", OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG, "1.1"), false));
    assertThrows(ConfigException.class, () -> new ReassignOptimizerConfig(
        Map.of(DiagnosticConfig.DIAGNOSTIC_VERBOSITY_CONFIG, "LOUD"), false));
    assertThrows(ConfigException.class, () -> new ReassignOptimizerConfig(
        Map.of(SolverConfig.SOLVER_TIME_LIMIT_MS_CONFIG, "-1"), false));
  }

  @Test
  public void testConfiguredLeaderStrategyUsesSeed() {
    Map<String, Object> props = Map.of(OptimizerConfig.LEADER_SELECTION_RANDOM_SEED_CONFIG, "7");
    LeaderSelectionStrategy first = new ReassignOptimizerConfig(props, false)
        .getConfiguredInstance(OptimizerConfig.LEADER_SELECTION_STRATEGY_CLASS_CONFIG, LeaderSelectionStrategy.class);
    LeaderSelectionStrategy second = new RandomLeaderSelectionStrategy(7L);
    assertTrue(first instanceof RandomLeaderSelectionStrategy);

    TopicPartition tp = new TopicPartition("t1", 0);
    TreeSet<Integer> replicas = new TreeSet<>(List.of(1, 2, 3, 4, 5));
    for (int i = 0; i < 5; i++) {
      assertEquals(second.orderReplicas(tp, replicas, List.of()), first.orderReplicas(tp, replicas, List.of()));
    }
  }
}
