/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.exception.SolverFailureException;
import com.linkedin.kafka.reassignoptimizer.model.BalanceBounds;
import com.linkedin.kafka.reassignoptimizer.model.ModelUtils;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaAssignment;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import com.linkedin.reassignoptimizer.common.utils.Utils;
import com.linkedin.reassignoptimizer.model.DecisionVariable;
import com.linkedin.reassignoptimizer.solver.SolveResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.apache.kafka.common.TopicPartition;


/**
 * Reads the solved variable values back into a {@link ReplicaAssignment} and checks that the assignment honors the
 * replication factors, the total weighted mass, the balance bounds and the pins.
 */
public class ResultExtractor {
  private final double _integralityTolerance;

  /**
   * @param integralityTolerance Maximum distance of a solved value from 0 or 1.
   */
  public ResultExtractor(double integralityTolerance) {
    if (integralityTolerance < 0.0 || integralityTolerance >= 0.5) {
      throw new IllegalArgumentException(String.format("Integrality tolerance must be in [0, 0.5) (%f).", integralityTolerance));
    }
    _integralityTolerance = integralityTolerance;
  }

  /**
   * Round the solved values to a binary assignment and verify it.
   *
   * @param formulatedModel The solved model.
   * @param solveResult Result of the solver, which must carry a solution.
   * @return The proposed assignment.
   * @throws SolverFailureException If a value is not within tolerance of 0 or 1, or the assignment violates the model.
   */
  public ReplicaAssignment extract(FormulatedModel formulatedModel, SolveResult solveResult) throws SolverFailureException {
    if (!solveResult.hasSolution()) {
      throw new SolverFailureException(String.format("Solver returned no solution (%s).", solveResult.status()));
    }
    double[] values = solveResult.values();
    int numVariables = formulatedModel.model().variables().size();
    if (values.length != numVariables) {
      throw new SolverFailureException(String.format("Solver returned %d values for %d variables.", values.length, numVariables));
    }
    ReassignmentSpec spec = formulatedModel.spec();
    Map<TopicPartition, Set<Integer>> replicas = new HashMap<>();
    spec.partitions().forEach(tp -> replicas.put(tp, new TreeSet<>()));
    for (Map.Entry<ReplicaSlot, DecisionVariable> entry : formulatedModel.variableBySlot().entrySet()) {
      double value = values[entry.getValue().index()];
      long rounded = Math.round(value);
      if (Double.isNaN(value) || Math.abs(value - rounded) > _integralityTolerance || (rounded != 0L && rounded != 1L)) {
        throw new SolverFailureException(String.format("Variable %s has value %s, which is not within %s of 0 or 1.",
                                                       entry.getValue().name(), value, _integralityTolerance));
      }
      if (rounded == 1L) {
        replicas.get(entry.getKey().topicPartition()).add(entry.getKey().brokerId());
      }
    }
    ReplicaAssignment proposed = new ReplicaAssignment(spec.brokers(), replicas);
    List<String> violations = invariantViolations(spec, proposed);
    if (!violations.isEmpty()) {
      throw new SolverFailureException(String.format("Solver returned an assignment that violates: %s.",
                                                     String.join("; ", violations)));
    }
    return proposed;
  }

  /**
   * @param spec The canonical problem.
   * @param proposed A proposed assignment.
   * @return Descriptions of the requirements the assignment violates, empty if none.
   */
  public static List<String> invariantViolations(ReassignmentSpec spec, ReplicaAssignment proposed) {
    List<String> violations = new ArrayList<>();
    for (TopicPartition tp : spec.partitions()) {
      int numReplicas = proposed.replicas(tp).size();
      if (numReplicas != spec.targetReplicationFactor(tp)) {
        violations.add(String.format("partition %s has %d replicas instead of %d", tp, numReplicas, spec.targetReplicationFactor(tp)));
      }
    }
    double mass = proposed.totalWeightedMass(spec.weights());
    if (Math.abs(mass - spec.totalWeightedMass()) > massTolerance(spec.totalWeightedMass())) {
      violations.add(String.format("total replica weight is %s instead of %s", Utils.formatNumber(mass),
                                   Utils.formatNumber(spec.totalWeightedMass())));
    }
    BalanceBounds bounds = spec.balanceBounds();
    for (Integer broker : spec.brokers()) {
      double load = proposed.load(broker, spec.weights());
      if (!bounds.contains(load, massTolerance(bounds.maxLoad()))) {
        violations.add(String.format("broker %d carries load %s outside of %s", broker, Utils.formatNumber(load), bounds));
      }
    }
    for (ReplicaSlot pin : spec.pinnedReplicas()) {
      if (!proposed.isAssigned(pin)) {
        violations.add(String.format("pinned replica %s is not assigned", pin));
      }
    }
    return violations;
  }

  /**
   * The weighted movement count: half the weight of every slot whose value differs between the current and the
   * proposed assignment, plus half the weight of the current replicas on brokers outside the broker set.
   *
   * @param spec The canonical problem.
   * @param proposed A proposed assignment.
   * @return Weighted movement count.
   */
  public static double totalMovements(ReassignmentSpec spec, ReplicaAssignment proposed) {
    double changedWeight = spec.offDomainReplicaWeight();
    ReplicaAssignment current = spec.currentAssignment();
    for (TopicPartition tp : spec.partitions()) {
      for (Integer broker : spec.brokers()) {
        ReplicaSlot slot = new ReplicaSlot(tp, broker);
        if (current.isAssigned(slot) != proposed.isAssigned(slot)) {
          changedWeight += spec.weight(tp);
        }
      }
    }
    return Utils.snapToInteger(changedWeight / 2);
  }

  /**
   * Render the broker by partition grid of an assignment. A cell holds the weight of the partition if the broker hosts
   * one of its replicas and 0 otherwise. The last row holds the load of each broker.
   *
   * @param spec The canonical problem.
   * @param assignment An assignment over the domain of the problem.
   * @return The grid, tab separated.
   */
  public static String gridReport(ReassignmentSpec spec, ReplicaAssignment assignment) {
    StringBuilder sb = new StringBuilder("broker\t\t");
    spec.brokers().forEach(b -> sb.append(b).append('\t'));
    sb.append(String.format("%n"));
    for (TopicPartition tp : spec.partitions()) {
      sb.append(ModelUtils.label(tp)).append('\t');
      for (Integer broker : spec.brokers()) {
        double cell = assignment.isAssigned(new ReplicaSlot(tp, broker)) ? spec.weight(tp) : 0.0;
        sb.append(Utils.formatNumber(cell)).append('\t');
      }
      sb.append(String.format("%n"));
    }
    sb.append("load\t\t");
    spec.brokers().forEach(b -> sb.append(Utils.formatNumber(assignment.load(b, spec.weights()))).append('\t'));
    sb.append(String.format("%n"));
    return sb.toString();
  }

  private static double massTolerance(double magnitude) {
    return 1.0E-6 * Math.max(1.0, Math.abs(magnitude));
  }
}
