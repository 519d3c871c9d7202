/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.model.ModelUtils;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaAssignment;
import com.linkedin.reassignoptimizer.common.utils.Utils;
import com.linkedin.reassignoptimizer.solver.SolverStatus;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.kafka.common.TopicPartition;


/**
 * The proposed reassignment of a run.
 */
public class ReassignmentResult {
  private final ReassignmentSpec _spec;
  private final ReplicaAssignment _proposedAssignment;
  private final SortedMap<TopicPartition, List<Integer>> _proposedReplicas;
  private final SolverStatus _status;
  private final double _totalMovements;
  private final String _solverName;
  private final long _solveTimeMs;

  /**
   * @param spec The canonical problem.
   * @param proposedAssignment The proposed assignment.
   * @param proposedReplicas Proposed replica list of each partition, preferred leader first.
   * @param status {@link SolverStatus#OPTIMAL} or {@link SolverStatus#FEASIBLE}.
   * @param totalMovements Weighted movement count from the current to the proposed assignment.
   * @param solverName Name of the solver that produced the assignment.
   * @param solveTimeMs Time spent in the solver.
   */
  public ReassignmentResult(ReassignmentSpec spec,
                            ReplicaAssignment proposedAssignment,
                            Map<TopicPartition, List<Integer>> proposedReplicas,
                            SolverStatus status,
                            double totalMovements,
                            String solverName,
                            long solveTimeMs) {
    if (!status.hasSolution()) {
      throw new IllegalArgumentException(String.format("A result cannot have status %s.", status));
    }
    _spec = spec;
    _proposedAssignment = proposedAssignment;
    SortedMap<TopicPartition, List<Integer>> replicas = new TreeMap<>(ModelUtils.TOPIC_PARTITION_COMPARATOR);
    proposedReplicas.forEach((tp, r) -> replicas.put(tp, List.copyOf(r)));
    _proposedReplicas = Collections.unmodifiableSortedMap(replicas);
    _status = status;
    _totalMovements = totalMovements;
    _solverName = solverName;
    _solveTimeMs = solveTimeMs;
  }

  public ReassignmentSpec spec() {
    return _spec;
  }

  public ReplicaAssignment proposedAssignment() {
    return _proposedAssignment;
  }

  /**
   * @return Proposed replica list of each partition, preferred leader first, sorted by topic and partition.
   */
  public SortedMap<TopicPartition, List<Integer>> proposedReplicas() {
    return _proposedReplicas;
  }

  public SolverStatus status() {
    return _status;
  }

  /**
   * @return {@code true} if the solver proved that no assignment needs fewer movements.
   */
  public boolean isProvenOptimal() {
    return _status == SolverStatus.OPTIMAL;
  }

  /**
   * @return Weighted movement count, i.e. half the weight of every replica that arrives on or leaves a broker.
   */
  public double totalMovements() {
    return _totalMovements;
  }

  /**
   * @return {@code true} if the replication factor of some partition changes, in which case {@link #totalMovements()}
   * counts net replica additions and removals as half moves.
   */
  public boolean isMovementCountApproximate() {
    return _spec.replicationFactorChanges();
  }

  public String solverName() {
    return _solverName;
  }

  public long solveTimeMs() {
    return _solveTimeMs;
  }

  @Override
  public String toString() {
    return String.format("ReassignmentResult{status=%s, totalMovements=%s%s, solver=%s, solveTimeMs=%d}", _status,
                         Utils.formatNumber(_totalMovements), isMovementCountApproximate() ? " (approximate)" : "",
                         _solverName, _solveTimeMs);
  }
}
