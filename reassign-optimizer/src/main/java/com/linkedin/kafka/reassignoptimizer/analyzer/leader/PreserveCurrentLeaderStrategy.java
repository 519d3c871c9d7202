/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer.leader;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import org.apache.kafka.common.TopicPartition;


/**
 * Keeps the current order of the replicas that survive the reassignment, so the current preferred leader stays the
 * preferred leader whenever it keeps its replica. Replicas on new brokers follow in ascending broker id order.
 */
public class PreserveCurrentLeaderStrategy implements LeaderSelectionStrategy {

  @Override
  public List<Integer> orderReplicas(TopicPartition tp, SortedSet<Integer> proposedReplicas, List<Integer> currentReplicas) {
    List<Integer> replicas = new ArrayList<>(proposedReplicas.size());
    for (Integer broker : currentReplicas) {
      if (proposedReplicas.contains(broker) && !replicas.contains(broker)) {
        replicas.add(broker);
      }
    }
    for (Integer broker : proposedReplicas) {
      if (!replicas.contains(broker)) {
        replicas.add(broker);
      }
    }
    return replicas;
  }

  @Override
  public String name() {
    return PreserveCurrentLeaderStrategy.class.getSimpleName();
  }
}
