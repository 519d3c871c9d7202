/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.analyzer.leader.LeaderSelectionStrategy;
import com.linkedin.kafka.reassignoptimizer.common.DiagnosticReporter;
import com.linkedin.kafka.reassignoptimizer.config.ReassignOptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.OptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.SolverConfig;
import com.linkedin.kafka.reassignoptimizer.exception.InfeasibleModelException;
import com.linkedin.kafka.reassignoptimizer.exception.InvalidInputException;
import com.linkedin.kafka.reassignoptimizer.exception.SolverFailureException;
import com.linkedin.kafka.reassignoptimizer.exception.SolverLimitExceededException;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInput;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaAssignment;
import com.linkedin.reassignoptimizer.exception.SolverException;
import com.linkedin.reassignoptimizer.solver.SolveResult;
import com.linkedin.reassignoptimizer.solver.Solver;
import com.linkedin.reassignoptimizer.solver.SolverOptions;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.reassignoptimizer.common.utils.Utils.validateNotNull;


/**
 * Runs the reassignment pipeline once: build the canonical problem, formulate it, solve it and extract the proposed
 * assignment. Every outcome other than a proven optimal assignment surfaces as an exception, except that a feasible
 * assignment found before a solver limit is returned when {@link OptimizerConfig#ACCEPT_SUBOPTIMAL_RESULT_CONFIG} is
 * set. Nothing is retried and no requirement is relaxed.
 */
public class ReassignmentOptimizer {
  private static final Logger LOG = LoggerFactory.getLogger(ReassignmentOptimizer.class);
  private final ReassignmentSpecBuilder _specBuilder;
  private final ReassignmentModelFormulator _formulator;
  private final Solver _solver;
  private final SolverOptions _solverOptions;
  private final ResultExtractor _resultExtractor;
  private final LeaderSelectionStrategy _leaderSelectionStrategy;
  private final DiagnosticReporter _reporter;
  private final boolean _acceptSuboptimalResult;

  public ReassignmentOptimizer(ReassignOptimizerConfig config) {
    this(new ReassignmentSpecBuilder(config),
         new ReassignmentModelFormulator(config.getBoolean(OptimizerConfig.PREFER_LOWER_BROKER_IDS_CONFIG)),
         config.getConfiguredInstance(SolverConfig.SOLVER_CLASS_CONFIG, Solver.class),
         config.solverOptions(),
         new ResultExtractor(config.getDouble(OptimizerConfig.INTEGRALITY_TOLERANCE_CONFIG)),
         config.getConfiguredInstance(OptimizerConfig.LEADER_SELECTION_STRATEGY_CLASS_CONFIG, LeaderSelectionStrategy.class),
         new DiagnosticReporter(config),
         config.getBoolean(OptimizerConfig.ACCEPT_SUBOPTIMAL_RESULT_CONFIG));
  }

  /**
   * Package private for unit tests.
   */
  ReassignmentOptimizer(ReassignmentSpecBuilder specBuilder,
                        ReassignmentModelFormulator formulator,
                        Solver solver,
                        SolverOptions solverOptions,
                        ResultExtractor resultExtractor,
                        LeaderSelectionStrategy leaderSelectionStrategy,
                        DiagnosticReporter reporter,
                        boolean acceptSuboptimalResult) {
    _specBuilder = validateNotNull(specBuilder, "Spec builder cannot be null.");
    _formulator = validateNotNull(formulator, "Model formulator cannot be null.");
    _solver = validateNotNull(solver, "Solver cannot be null.");
    _solverOptions = validateNotNull(solverOptions, "Solver options cannot be null.");
    _resultExtractor = validateNotNull(resultExtractor, "Result extractor cannot be null.");
    _leaderSelectionStrategy = validateNotNull(leaderSelectionStrategy, "Leader selection strategy cannot be null.");
    _reporter = validateNotNull(reporter, "Diagnostic reporter cannot be null.");
    _acceptSuboptimalResult = acceptSuboptimalResult;
  }

  /**
   * Propose the reassignment of the given input with the minimum weighted movement.
   *
   * @param input The raw input.
   * @return The proposed reassignment.
   * @throws InvalidInputException If the input is malformed.
   * @throws InfeasibleModelException If no assignment satisfies the requirements.
   * @throws SolverLimitExceededException If the solver hit a limit before proving optimality.
   * @throws SolverFailureException If the solver failed or returned an invalid assignment.
   */
  public ReassignmentResult optimize(ReassignmentInput input)
      throws InvalidInputException, InfeasibleModelException, SolverLimitExceededException, SolverFailureException {
    return optimize(_specBuilder.build(input));
  }

  /**
   * Propose the reassignment of the given problem with the minimum weighted movement.
   *
   * @param spec The canonical problem.
   * @return The proposed reassignment.
   * @throws InfeasibleModelException If no assignment satisfies the requirements.
   * @throws SolverLimitExceededException If the solver hit a limit before proving optimality.
   * @throws SolverFailureException If the solver failed or returned an invalid assignment.
   */
  public ReassignmentResult optimize(ReassignmentSpec spec)
      throws InfeasibleModelException, SolverLimitExceededException, SolverFailureException {
    _reporter.reportSpec(spec);
    FormulatedModel formulatedModel = _formulator.formulate(spec);
    _reporter.reportModel(formulatedModel);

    SolveResult solveResult;
    try {
      solveResult = _solver.solve(formulatedModel.model(), _solverOptions);
    } catch (SolverException e) {
      throw new SolverFailureException(String.format("Solver %s failed.", _solver.name()), e);
    }
    _reporter.reportSolveOutcome(_solver.name(), solveResult);

    switch (solveResult.status()) {
      case OPTIMAL:
        ReassignmentResult result = toResult(formulatedModel, solveResult);
        _reporter.reportResult(result);
        return result;
      case FEASIBLE:
        ReassignmentResult bestKnownResult = toResult(formulatedModel, solveResult);
        if (_acceptSuboptimalResult) {
          LOG.warn("Returning the best known assignment with {} movements, which is not proven optimal.",
                   bestKnownResult.totalMovements());
          _reporter.reportResult(bestKnownResult);
          return bestKnownResult;
        }
        throw new SolverLimitExceededException(String.format("Solver %s stopped after %d ms with a feasible assignment that "
                                                             + "is not proven optimal (%s).", _solver.name(),
                                                             solveResult.solveTimeMs(), _solverOptions),
                                               solveResult.status(), bestKnownResult);
      case NOT_SOLVED:
        throw new SolverLimitExceededException(String.format("Solver %s stopped after %d ms without a feasible assignment (%s).",
                                                             _solver.name(), solveResult.solveTimeMs(), _solverOptions),
                                               solveResult.status(), null);
      case INFEASIBLE:
        throw new InfeasibleModelException("No assignment satisfies the replication factor, balance and pin requirements.",
                                           InfeasibilityAnalyzer.likelyCauses(spec));
      case UNBOUNDED:
        throw new SolverFailureException(String.format("Solver %s reported an unbounded model, which a model over binary "
                                                       + "variables cannot be.", _solver.name()));
      default:
        throw new SolverFailureException(String.format("Solver %s failed with status %s.", _solver.name(), solveResult.status()));
    }
  }

  private ReassignmentResult toResult(FormulatedModel formulatedModel, SolveResult solveResult) throws SolverFailureException {
    ReassignmentSpec spec = formulatedModel.spec();
    ReplicaAssignment proposed = _resultExtractor.extract(formulatedModel, solveResult);
    Map<TopicPartition, List<Integer>> proposedReplicas = new HashMap<>();
    for (TopicPartition tp : spec.partitions()) {
      proposedReplicas.put(tp, _leaderSelectionStrategy.orderReplicas(tp, proposed.replicas(tp), spec.currentReplicas(tp)));
    }
    return new ReassignmentResult(spec, proposed, proposedReplicas, solveResult.status(),
                                  ResultExtractor.totalMovements(spec, proposed), _solver.name(), solveResult.solveTimeMs());
  }
}
