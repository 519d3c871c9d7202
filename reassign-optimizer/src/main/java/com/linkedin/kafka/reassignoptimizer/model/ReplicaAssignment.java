/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.kafka.common.TopicPartition;


/**
 * An immutable 0/1 assignment over every {@link ReplicaSlot} of a problem, i.e. over all partitions times all brokers.
 * A slot is 1 if the broker hosts a replica of the partition and 0 otherwise, so the value of every slot in the domain
 * is defined.
 */
public final class ReplicaAssignment {
  private final SortedSet<Integer> _brokers;
  private final SortedMap<TopicPartition, SortedSet<Integer>> _replicasByPartition;

  /**
   * @param brokers Brokers of the domain.
   * @param replicasByPartition Brokers hosting a replica of each partition of the domain. Every broker must be in
   *                            the domain.
   */
  public ReplicaAssignment(Collection<Integer> brokers, Map<TopicPartition, ? extends Collection<Integer>> replicasByPartition) {
    _brokers = Collections.unmodifiableSortedSet(new TreeSet<>(brokers));
    SortedMap<TopicPartition, SortedSet<Integer>> replicas = new TreeMap<>(ModelUtils.TOPIC_PARTITION_COMPARATOR);
    for (Map.Entry<TopicPartition, ? extends Collection<Integer>> entry : replicasByPartition.entrySet()) {
      SortedSet<Integer> hosts = new TreeSet<>(entry.getValue());
      if (!_brokers.containsAll(hosts)) {
        throw new IllegalArgumentException(String.format("Replicas %s of %s are not all within brokers %s.", hosts,
                                                         entry.getKey(), _brokers));
      }
      replicas.put(entry.getKey(), Collections.unmodifiableSortedSet(hosts));
    }
    _replicasByPartition = Collections.unmodifiableSortedMap(replicas);
  }

  public SortedSet<Integer> brokers() {
    return _brokers;
  }

  /**
   * @return Partitions of the domain, sorted by topic and partition.
   */
  public SortedSet<TopicPartition> partitions() {
    SortedSet<TopicPartition> partitions = new TreeSet<>(ModelUtils.TOPIC_PARTITION_COMPARATOR);
    partitions.addAll(_replicasByPartition.keySet());
    return partitions;
  }

  /**
   * @param tp Topic partition of the domain.
   * @return Brokers hosting a replica of the partition, ascending.
   */
  public SortedSet<Integer> replicas(TopicPartition tp) {
    SortedSet<Integer> replicas = _replicasByPartition.get(tp);
    if (replicas == null) {
      throw new IllegalArgumentException(String.format("Partition %s is not in the assignment.", tp));
    }
    return replicas;
  }

  /**
   * @param slot Replica slot of the domain.
   * @return 1 if the broker of the slot hosts a replica of its partition, 0 otherwise.
   */
  public int value(ReplicaSlot slot) {
    if (!_brokers.contains(slot.brokerId())) {
      throw new IllegalArgumentException(String.format("Broker of slot %s is not in the assignment.", slot));
    }
    return replicas(slot.topicPartition()).contains(slot.brokerId()) ? 1 : 0;
  }

  public boolean isAssigned(ReplicaSlot slot) {
    return value(slot) == 1;
  }

  /**
   * @return Slots with value 1, sorted.
   */
  public SortedSet<ReplicaSlot> assignedSlots() {
    SortedSet<ReplicaSlot> slots = new TreeSet<>();
    _replicasByPartition.forEach((tp, brokers) -> brokers.forEach(b -> slots.add(new ReplicaSlot(tp, b))));
    return slots;
  }

  /**
   * @param brokerId Broker of the domain.
   * @param weights Weight of each partition.
   * @return Weighted replica load of the broker.
   */
  public double load(int brokerId, Map<TopicPartition, Double> weights) {
    double load = 0.0;
    for (Map.Entry<TopicPartition, SortedSet<Integer>> entry : _replicasByPartition.entrySet()) {
      if (entry.getValue().contains(brokerId)) {
        load += weights.get(entry.getKey());
      }
    }
    return load;
  }

  /**
   * @param weights Weight of each partition.
   * @return Sum of the weight of every assigned slot.
   */
  public double totalWeightedMass(Map<TopicPartition, Double> weights) {
    double mass = 0.0;
    for (Map.Entry<TopicPartition, SortedSet<Integer>> entry : _replicasByPartition.entrySet()) {
      mass += weights.get(entry.getKey()) * entry.getValue().size();
    }
    return mass;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ReplicaAssignment that = (ReplicaAssignment) o;
    return _brokers.equals(that._brokers) && _replicasByPartition.equals(that._replicasByPartition);
  }

  @Override
  public int hashCode() {
    return 31 * _brokers.hashCode() + _replicasByPartition.hashCode();
  }

  @Override
  public String toString() {
    return String.format("ReplicaAssignment{brokers=%s, replicas=%s}", _brokers, _replicasByPartition);
  }
}
