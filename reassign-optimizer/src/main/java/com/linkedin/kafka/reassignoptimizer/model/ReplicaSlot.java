/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import java.util.Objects;
import org.apache.kafka.common.TopicPartition;


/**
 * A candidate hosting relationship between a partition and a broker. Ordered by topic, partition, then broker id.
 */
public final class ReplicaSlot implements Comparable<ReplicaSlot> {
  private final TopicPartition _tp;
  private final int _brokerId;

  public ReplicaSlot(TopicPartition tp, int brokerId) {
    _tp = Objects.requireNonNull(tp, "Topic partition cannot be null.");
    _brokerId = brokerId;
  }

  public ReplicaSlot(String topic, int partition, int brokerId) {
    this(new TopicPartition(topic, partition), brokerId);
  }

  public TopicPartition topicPartition() {
    return _tp;
  }

  public int brokerId() {
    return _brokerId;
  }

  @Override
  public int compareTo(ReplicaSlot o) {
    int result = ModelUtils.TOPIC_PARTITION_COMPARATOR.compare(_tp, o._tp);
    return result != 0 ? result : Integer.compare(_brokerId, o._brokerId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ReplicaSlot that = (ReplicaSlot) o;
    return _brokerId == that._brokerId && _tp.equals(that._tp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(_tp, _brokerId);
  }

  @Override
  public String toString() {
    return String.format("(%s, %d, broker %d)", _tp.topic(), _tp.partition(), _brokerId);
  }
}
