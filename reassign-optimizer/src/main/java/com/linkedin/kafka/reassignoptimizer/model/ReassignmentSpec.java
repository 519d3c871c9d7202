/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.apache.kafka.common.TopicPartition;


/**
 * The canonical reassignment problem: the slot domain (sorted brokers times sorted partitions), the current assignment,
 * partition weights, pins, target replication factors and the derived mass and balance bounds.
 *
 * <p>Replicas currently hosted on brokers outside the broker set (e.g. decommissioned brokers) are outside the slot
 * domain. They are kept in {@link #currentReplicas(TopicPartition)} and count toward {@link #offDomainReplicaWeight()},
 * but not toward the current assignment.
 */
public final class ReassignmentSpec {
  public static final int NO_REPLICATION_FACTOR_OVERRIDE = -1;
  private final SortedSet<Integer> _brokers;
  private final List<TopicPartition> _partitions;
  private final Map<TopicPartition, List<Integer>> _currentReplicas;
  private final ReplicaAssignment _currentAssignment;
  private final Map<TopicPartition, Double> _weights;
  private final SortedSet<ReplicaSlot> _pinnedReplicas;
  private final SortedSet<ReplicaSlot> _droppedPins;
  private final int _newReplicationFactor;
  private final Map<TopicPartition, Integer> _targetReplicationFactor;
  private final double _minFactor;
  private final double _maxFactor;
  private final double _totalWeightedMass;
  private final double _offDomainReplicaWeight;
  private final BalanceBounds _balanceBounds;

  /**
   * @param brokers Brokers that may host replicas.
   * @param partitions Partitions, sorted by topic and partition.
   * @param currentReplicas Current replica list of each partition as given, leader first.
   * @param currentAssignment Current assignment over the slot domain.
   * @param weights Weight of each partition.
   * @param pinnedReplicas Slots of the domain that must be 1 in the proposed assignment.
   * @param droppedPins Pins that were dropped because they are outside the domain.
   * @param newReplicationFactor Uniform replication factor override, or {@link #NO_REPLICATION_FACTOR_OVERRIDE}.
   * @param targetReplicationFactor Replication factor of each partition in the proposed assignment.
   * @param minFactor Lower balance factor.
   * @param maxFactor Upper balance factor.
   * @param totalWeightedMass Weighted replica mass of the proposed assignment.
   * @param balanceBounds Per broker load band.
   */
  public ReassignmentSpec(SortedSet<Integer> brokers,
                          List<TopicPartition> partitions,
                          Map<TopicPartition, List<Integer>> currentReplicas,
                          ReplicaAssignment currentAssignment,
                          Map<TopicPartition, Double> weights,
                          SortedSet<ReplicaSlot> pinnedReplicas,
                          SortedSet<ReplicaSlot> droppedPins,
                          int newReplicationFactor,
                          Map<TopicPartition, Integer> targetReplicationFactor,
                          double minFactor,
                          double maxFactor,
                          double totalWeightedMass,
                          BalanceBounds balanceBounds) {
    _brokers = Collections.unmodifiableSortedSet(new TreeSet<>(brokers));
    _partitions = List.copyOf(partitions);
    _currentReplicas = Collections.unmodifiableMap(currentReplicas);
    _currentAssignment = currentAssignment;
    _weights = Collections.unmodifiableMap(weights);
    _pinnedReplicas = Collections.unmodifiableSortedSet(new TreeSet<>(pinnedReplicas));
    _droppedPins = Collections.unmodifiableSortedSet(new TreeSet<>(droppedPins));
    _newReplicationFactor = newReplicationFactor;
    _targetReplicationFactor = Collections.unmodifiableMap(targetReplicationFactor);
    _minFactor = minFactor;
    _maxFactor = maxFactor;
    _totalWeightedMass = totalWeightedMass;
    _balanceBounds = balanceBounds;
    double offDomainWeight = 0.0;
    for (TopicPartition tp : _partitions) {
      for (Integer broker : _currentReplicas.get(tp)) {
        if (!_brokers.contains(broker)) {
          offDomainWeight += _weights.get(tp);
        }
      }
    }
    _offDomainReplicaWeight = offDomainWeight;
  }

  public SortedSet<Integer> brokers() {
    return _brokers;
  }

  /**
   * @return Partitions, sorted by topic and partition.
   */
  public List<TopicPartition> partitions() {
    return _partitions;
  }

  /**
   * @return Number of partitions of each topic, sorted by topic.
   */
  public SortedMap<String, Integer> numPartitionsByTopic() {
    SortedMap<String, Integer> numPartitionsByTopic = new TreeMap<>();
    _partitions.forEach(tp -> numPartitionsByTopic.merge(tp.topic(), 1, Integer::sum));
    return numPartitionsByTopic;
  }

  /**
   * @param tp Topic partition.
   * @return The current replica list as given in the input, leader first, possibly including brokers outside the domain.
   */
  public List<Integer> currentReplicas(TopicPartition tp) {
    return _currentReplicas.get(tp);
  }

  public ReplicaAssignment currentAssignment() {
    return _currentAssignment;
  }

  public double weight(TopicPartition tp) {
    return _weights.get(tp);
  }

  public Map<TopicPartition, Double> weights() {
    return _weights;
  }

  public double minWeight() {
    return _weights.values().stream().mapToDouble(Double::doubleValue).min().orElse(1.0);
  }

  public SortedSet<ReplicaSlot> pinnedReplicas() {
    return _pinnedReplicas;
  }

  public boolean isPinned(ReplicaSlot slot) {
    return _pinnedReplicas.contains(slot);
  }

  /**
   * @return Pins of the input that refer to a broker or partition outside the domain and were therefore dropped.
   */
  public SortedSet<ReplicaSlot> droppedPins() {
    return _droppedPins;
  }

  /**
   * @return The uniform replication factor override, or {@link #NO_REPLICATION_FACTOR_OVERRIDE}.
   */
  public int newReplicationFactor() {
    return _newReplicationFactor;
  }

  public boolean hasReplicationFactorOverride() {
    return _newReplicationFactor != NO_REPLICATION_FACTOR_OVERRIDE;
  }

  /**
   * @return {@code true} if some partition targets a replication factor other than its current replica count, in which
   * case the movement count mixes true moves with net replica additions or removals.
   */
  public boolean replicationFactorChanges() {
    for (TopicPartition tp : _partitions) {
      if (_targetReplicationFactor.get(tp) != _currentReplicas.get(tp).size()) {
        return true;
      }
    }
    return false;
  }

  public int targetReplicationFactor(TopicPartition tp) {
    return _targetReplicationFactor.get(tp);
  }

  /**
   * @return Number of replicas in the proposed assignment.
   */
  public int totalTargetReplicas() {
    return _targetReplicationFactor.values().stream().mapToInt(Integer::intValue).sum();
  }

  /**
   * @return Number of replicas in the input, including those on brokers outside the domain.
   */
  public int totalCurrentReplicas() {
    return _currentReplicas.values().stream().mapToInt(List::size).sum();
  }

  public double minFactor() {
    return _minFactor;
  }

  public double maxFactor() {
    return _maxFactor;
  }

  /**
   * @return The weighted replica mass the proposed assignment must carry: {@code sum(weight(p) * targetRF(p))}.
   */
  public double totalWeightedMass() {
    return _totalWeightedMass;
  }

  /**
   * @return The weighted replica mass of the current assignment within the domain.
   */
  public double currentWeightedMass() {
    return _currentAssignment.totalWeightedMass(_weights);
  }

  /**
   * @return Total weight of the current replicas hosted on brokers outside the domain. All of them have to move.
   */
  public double offDomainReplicaWeight() {
    return _offDomainReplicaWeight;
  }

  public BalanceBounds balanceBounds() {
    return _balanceBounds;
  }
}
