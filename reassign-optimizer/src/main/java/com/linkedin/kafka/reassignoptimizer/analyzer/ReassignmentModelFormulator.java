/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.model.BalanceBounds;
import com.linkedin.kafka.reassignoptimizer.model.ModelUtils;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import com.linkedin.reassignoptimizer.model.DecisionVariable;
import com.linkedin.reassignoptimizer.model.LinearExpression;
import com.linkedin.reassignoptimizer.model.MilpModel;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Formulates the minimum movement reassignment as a binary integer program.
 *
 * <p>There is one binary variable {@code x(p, b)} per slot of the domain; a pinned slot has both bounds at 1. The
 * objective is the weighted movement count
 * <pre>
 *   ( sum over current 0 slots of w(p) * x(p, b) + sum over current 1 slots of w(p) * (1 - x(p, b)) + offDomain ) / 2
 * </pre>
 * where {@code offDomain} is the weight of the current replicas on brokers outside the broker set, which leave in any
 * proposal. Subject to:
 * <ul>
 *   <li>{@value #TOTAL_REPLICA_WEIGHT_CONSTRAINT}: {@code sum w(p) * x(p, b)} equals the total weighted mass.</li>
 *   <li>{@value #REPLICATION_FACTOR_CONSTRAINT_PREFIX}p: {@code sum over b of x(p, b)} equals the target replication
 *   factor of p.</li>
 *   <li>{@value #LOAD_CONSTRAINT_PREFIX}b: {@code sum over p of w(p) * x(p, b)} lies within the balance bounds.</li>
 * </ul>
 *
 * <p>With lower broker ids preferred, the objective also gets {@code epsilon * rank(b) * x(p, b)} where rank is the
 * position of b among the sorted brokers. Epsilon keeps the whole term below half the smallest weight, so it only
 * decides between assignments whose movement count is the same.
 */
public class ReassignmentModelFormulator {
  private static final Logger LOG = LoggerFactory.getLogger(ReassignmentModelFormulator.class);
  public static final String MODEL_NAME = "kafka_partition_replica_reassignment";
  public static final String TOTAL_REPLICA_WEIGHT_CONSTRAINT = "total_replica_weight";
  public static final String REPLICATION_FACTOR_CONSTRAINT_PREFIX = "replication_factor_";
  public static final String LOAD_CONSTRAINT_PREFIX = "load_B";
  private final boolean _preferLowerBrokerIds;

  /**
   * @param preferLowerBrokerIds {@code true} to break ties between assignments of equal movement in favor of lower
   *                             broker ids.
   */
  public ReassignmentModelFormulator(boolean preferLowerBrokerIds) {
    _preferLowerBrokerIds = preferLowerBrokerIds;
  }

  /**
   * @param slot A replica slot.
   * @return Name of the decision variable of the slot, e.g. {@code x_t1_0_B3}.
   */
  public static String variableName(ReplicaSlot slot) {
    return String.format("x_%s_B%d", ModelUtils.label(slot.topicPartition()), slot.brokerId());
  }

  /**
   * @param tp A topic partition.
   * @return Name of the replication factor constraint of the partition.
   */
  public static String replicationFactorConstraintName(TopicPartition tp) {
    return REPLICATION_FACTOR_CONSTRAINT_PREFIX + ModelUtils.label(tp);
  }

  /**
   * @param brokerId A broker.
   * @return Name of the load constraint of the broker.
   */
  public static String loadConstraintName(int brokerId) {
    return LOAD_CONSTRAINT_PREFIX + brokerId;
  }

  /**
   * @param spec The canonical problem.
   * @return The weight of one step of the tie-break term, or 0 if lower broker ids are not preferred.
   */
  public double tieBreakEpsilon(ReassignmentSpec spec) {
    if (!_preferLowerBrokerIds) {
      return 0.0;
    }
    return 0.5 * spec.minWeight() / (1.0 + (double) spec.totalTargetReplicas() * spec.brokers().size());
  }

  /**
   * Formulate the model of the given problem.
   *
   * @param spec The canonical problem.
   * @return The formulated model.
   */
  public FormulatedModel formulate(ReassignmentSpec spec) {
    MilpModel model = new MilpModel(MODEL_NAME);
    SortedMap<ReplicaSlot, DecisionVariable> variableBySlot = new TreeMap<>();
    LinearExpression movement = new LinearExpression();
    LinearExpression objective = new LinearExpression();
    double epsilon = tieBreakEpsilon(spec);

    for (TopicPartition tp : spec.partitions()) {
      double weight = spec.weight(tp);
      int rank = 0;
      for (Integer broker : spec.brokers()) {
        ReplicaSlot slot = new ReplicaSlot(tp, broker);
        DecisionVariable x = spec.isPinned(slot) ? model.addBinaryVariable(variableName(slot), 1, 1)
                                                 : model.addBinaryVariable(variableName(slot));
        variableBySlot.put(slot, x);
        if (spec.currentAssignment().isAssigned(slot)) {
          movement.addTerm(x, -weight / 2).addConstant(weight / 2);
          objective.addTerm(x, -weight / 2).addConstant(weight / 2);
        } else {
          movement.addTerm(x, weight / 2);
          objective.addTerm(x, weight / 2);
        }
        if (epsilon > 0.0 && rank > 0) {
          objective.addTerm(x, epsilon * rank);
        }
        rank++;
      }
    }
    movement.addConstant(spec.offDomainReplicaWeight() / 2);
    objective.addConstant(spec.offDomainReplicaWeight() / 2);
    model.minimize(objective);

    // Mass conservation.
    LinearExpression totalWeight = new LinearExpression();
    variableBySlot.forEach((slot, x) -> totalWeight.addTerm(x, spec.weight(slot.topicPartition())));
    model.addEqualityConstraint(TOTAL_REPLICA_WEIGHT_CONSTRAINT, totalWeight, spec.totalWeightedMass());

    // Replication factor of each partition.
    for (TopicPartition tp : spec.partitions()) {
      LinearExpression replicas = new LinearExpression();
      for (Integer broker : spec.brokers()) {
        replicas.addTerm(variableBySlot.get(new ReplicaSlot(tp, broker)), 1.0);
      }
      model.addEqualityConstraint(replicationFactorConstraintName(tp), replicas, spec.targetReplicationFactor(tp));
    }

    // Load band of each broker.
    BalanceBounds bounds = spec.balanceBounds();
    for (Integer broker : spec.brokers()) {
      LinearExpression load = new LinearExpression();
      for (TopicPartition tp : spec.partitions()) {
        load.addTerm(variableBySlot.get(new ReplicaSlot(tp, broker)), spec.weight(tp));
      }
      model.addConstraint(loadConstraintName(broker), load, bounds.minLoad(), bounds.maxLoad());
    }

    LOG.debug("Formulated model {} with {} variables ({} pinned) and {} constraints.", MODEL_NAME, model.variables().size(),
              spec.pinnedReplicas().size(), model.constraints().size());
    return new FormulatedModel(spec, model, variableBySlot, movement);
  }
}
