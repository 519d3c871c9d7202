/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import java.util.Comparator;
import org.apache.kafka.common.TopicPartition;


public final class ModelUtils {
  /**
   * Orders partitions by topic name, then by partition index.
   */
  public static final Comparator<TopicPartition> TOPIC_PARTITION_COMPARATOR =
      Comparator.comparing(TopicPartition::topic).thenComparingInt(TopicPartition::partition);

  private ModelUtils() {

  }

  /**
   * @param tp Topic partition.
   * @return Compact label of the partition, e.g. {@code t1_0}.
   */
  public static String label(TopicPartition tp) {
    return String.format("%s_%d", tp.topic(), tp.partition());
  }
}
