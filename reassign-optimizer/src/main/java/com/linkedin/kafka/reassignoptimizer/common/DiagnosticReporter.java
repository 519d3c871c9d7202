/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.common;

import com.linkedin.kafka.reassignoptimizer.analyzer.FormulatedModel;
import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentResult;
import com.linkedin.kafka.reassignoptimizer.analyzer.ResultExtractor;
import com.linkedin.kafka.reassignoptimizer.config.ReassignOptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.DiagnosticConfig;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.reassignoptimizer.common.utils.Utils;
import com.linkedin.reassignoptimizer.solver.SolveResult;
import com.linkedin.reassignoptimizer.solver.SolverStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Writes the diagnostics of a run to a side channel, never to the result document. What is written depends on the
 * {@link Verbosity} fixed at construction:
 * <ul>
 *   <li>{@link Verbosity#QUIET}: only solver outcomes other than optimal.</li>
 *   <li>{@link Verbosity#INFO}: the problem summary, the solver outcome and the movement count; the assignment grids
 *   if enabled.</li>
 *   <li>{@link Verbosity#DEBUG}: in addition, the formulated model and the assignment grids.</li>
 * </ul>
 */
public class DiagnosticReporter {
  private static final Logger LOG = LoggerFactory.getLogger(DiagnosticReporter.class);
  private final Verbosity _verbosity;
  private final boolean _assignmentGridEnabled;
  private final Logger _logger;

  public DiagnosticReporter(ReassignOptimizerConfig config) {
    this(config.verbosity(), config.getBoolean(DiagnosticConfig.ASSIGNMENT_GRID_ENABLED_CONFIG));
  }

  public DiagnosticReporter(Verbosity verbosity, boolean assignmentGridEnabled) {
    this(verbosity, assignmentGridEnabled, LOG);
  }

  /**
   * @param verbosity Verbosity of the reporter.
   * @param assignmentGridEnabled {@code true} to write the assignment grids at {@link Verbosity#INFO}.
   * @param logger Logger to write to.
   */
  public DiagnosticReporter(Verbosity verbosity, boolean assignmentGridEnabled, Logger logger) {
    _verbosity = verbosity;
    _assignmentGridEnabled = assignmentGridEnabled;
    _logger = logger;
  }

  public Verbosity verbosity() {
    return _verbosity;
  }

  /**
   * Write the summary of the canonical problem.
   *
   * @param spec The canonical problem.
   */
  public void reportSpec(ReassignmentSpec spec) {
    if (!_verbosity.includes(Verbosity.INFO)) {
      return;
    }
    _logger.info("# Configurations for reassignment partition replicas");
    _logger.info(String.format("brokers= %s", spec.brokers()));
    if (spec.hasReplicationFactorOverride()) {
      _logger.info(String.format("new_replication_factor= %d", spec.newReplicationFactor()));
    }
    _logger.info(String.format("topics= %s", spec.numPartitionsByTopic().keySet()));
    _logger.info(String.format("partitions= %s", spec.numPartitionsByTopic()));
    _logger.info(String.format("total_partitions= %d", spec.partitions().size()));
    _logger.info(String.format("total_replicas_to_assign= %d", spec.totalTargetReplicas()));
    _logger.info(String.format("total_replica_weight= %s", Utils.formatNumber(spec.totalWeightedMass())));
    if (!spec.pinnedReplicas().isEmpty()) {
      _logger.info(String.format("pinned_replicas= %s", spec.pinnedReplicas()));
    }
    if (!spec.droppedPins().isEmpty()) {
      _logger.info(String.format("dropped_pins= %s", spec.droppedPins()));
    }
    if (spec.balanceBounds().isExact()) {
      _logger.info(String.format("balanced_load= %s", Utils.formatNumber(spec.balanceBounds().minLoad())));
    } else {
      _logger.info(String.format("balanced_load_min= %s", Utils.formatNumber(spec.balanceBounds().minLoad())));
      _logger.info(String.format("balanced_load_max= %s", Utils.formatNumber(spec.balanceBounds().maxLoad())));
    }
  }

  /**
   * Write the formulated model.
   *
   * @param formulatedModel The formulated model.
   */
  public void reportModel(FormulatedModel formulatedModel) {
    if (_verbosity.includes(Verbosity.DEBUG)) {
      _logger.info(String.format("# Binary Integer Programming%n%s", formulatedModel.model()));
    }
  }

  /**
   * Write the outcome of the solver. Outcomes other than optimal are written at every verbosity.
   *
   * @param solverName Name of the solver.
   * @param solveResult Result of the solver.
   */
  public void reportSolveOutcome(String solverName, SolveResult solveResult) {
    String outcome = String.format("Optimizer Status: %s (solver %s, %d ms%s)", solveResult.status(), solverName,
                                   solveResult.solveTimeMs(), solveResult.limitReached() ? ", limit reached" : "");
    if (solveResult.status() != SolverStatus.OPTIMAL) {
      _logger.error(outcome);
    } else if (_verbosity.includes(Verbosity.INFO)) {
      _logger.info("# Result of Optimizing Partition Replica Move");
      _logger.info(outcome);
    }
  }

  /**
   * Write the movement count of a result and, if enabled, the current and proposed assignment grids.
   *
   * @param result The result.
   */
  public void reportResult(ReassignmentResult result) {
    if (!_verbosity.includes(Verbosity.INFO)) {
      return;
    }
    StringBuilder movements = new StringBuilder(String.format("Number of Partition Replica Movements: %s",
                                                              Utils.formatNumber(result.totalMovements())));
    if (result.isMovementCountApproximate()) {
      movements.append(" (approximate: the replication factor changes, so replica additions and removals count as half moves)");
    }
    if (!result.isProvenOptimal()) {
      movements.append(" (not proven optimal)");
    }
    _logger.info(movements.toString());
    if (_verbosity.includes(Verbosity.DEBUG) || _assignmentGridEnabled) {
      ReassignmentSpec spec = result.spec();
      _logger.info(String.format("# CURRENT ASSIGNMENT%n%s", ResultExtractor.gridReport(spec, spec.currentAssignment())));
      _logger.info(String.format("# PROPOSED ASSIGNMENT%n%s", ResultExtractor.gridReport(spec, result.proposedAssignment())));
    }
  }
}
