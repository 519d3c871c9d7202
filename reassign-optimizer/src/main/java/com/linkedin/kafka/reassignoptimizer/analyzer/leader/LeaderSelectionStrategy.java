/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer.leader;

import java.util.List;
import java.util.SortedSet;
import org.apache.kafka.common.TopicPartition;


/**
 * An interface to enable customization of how the proposed replicas of a partition are ordered. The first replica of
 * the ordered list becomes the preferred leader once the reassignment is executed.
 */
public interface LeaderSelectionStrategy {

  /**
   * Order the proposed replicas of a partition, preferred leader first.
   *
   * @param tp The partition.
   * @param proposedReplicas Brokers hosting a replica of the partition in the proposed assignment.
   * @param currentReplicas Current replica list of the partition, current preferred leader first.
   * @return A permutation of the proposed replicas, preferred leader first.
   */
  List<Integer> orderReplicas(TopicPartition tp, SortedSet<Integer> proposedReplicas, List<Integer> currentReplicas);

  /**
   * @return The name of this strategy in human readable format.
   */
  String name();
}
