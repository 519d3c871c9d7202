/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer.leader;

import com.linkedin.kafka.reassignoptimizer.config.constants.OptimizerConfig;
import com.linkedin.reassignoptimizer.common.ReassignOptimizerConfigurable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.SortedSet;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.config.ConfigException;


/**
 * Shuffles the proposed replicas of each partition so that preferred leadership spreads over the brokers. The shuffle
 * is reproducible when {@link OptimizerConfig#LEADER_SELECTION_RANDOM_SEED_CONFIG} is set.
 */
public class RandomLeaderSelectionStrategy implements LeaderSelectionStrategy, ReassignOptimizerConfigurable {
  private Random _random;

  public RandomLeaderSelectionStrategy() {
    _random = new Random();
  }

  public RandomLeaderSelectionStrategy(long seed) {
    _random = new Random(seed);
  }

  @Override
  public void configure(Map<String, ?> configs) {
    Object seed = configs.get(OptimizerConfig.LEADER_SELECTION_RANDOM_SEED_CONFIG);
    if (seed == null) {
      return;
    }
    try {
      _random = new Random(seed instanceof Number ? ((Number) seed).longValue() : Long.parseLong(seed.toString().trim()));
    } catch (NumberFormatException e) {
      throw new ConfigException(OptimizerConfig.LEADER_SELECTION_RANDOM_SEED_CONFIG, seed, "Seed must be a long.");
    }
  }

  @Override
  public List<Integer> orderReplicas(TopicPartition tp, SortedSet<Integer> proposedReplicas, List<Integer> currentReplicas) {
    List<Integer> replicas = new ArrayList<>(proposedReplicas);
    Collections.shuffle(replicas, _random);
    return replicas;
  }

  @Override
  public String name() {
    return RandomLeaderSelectionStrategy.class.getSimpleName();
  }
}
