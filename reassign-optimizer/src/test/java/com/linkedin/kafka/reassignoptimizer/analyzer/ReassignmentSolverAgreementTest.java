/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.exception.InfeasibleModelException;
import com.linkedin.kafka.reassignoptimizer.exception.KafkaReassignOptimizerException;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInput;
import com.linkedin.reassignoptimizer.solver.BinaryBranchAndBoundSolver;
import com.linkedin.reassignoptimizer.solver.OjAlgoSolver;
import com.linkedin.reassignoptimizer.solver.SolverStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;

import static com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentTestUtils.optimizer;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


/**
 * Checks that the ojAlgo backend and the exhaustive branch and bound backend agree on the optimal movement count of
 * weighted instances, including replicas on a broker that leaves the cluster.
 */
public class ReassignmentSolverAgreementTest {
  private static final double DELTA = 1E-6;
  private static final String BROKERS = "1,2,3,4";
  private static final int NUM_INSTANCES = 30;
  private static final int NUM_PARTITIONS = 6;
  private static final long SEED = 20240611L;

  private final ReassignmentOptimizer _ojAlgo = optimizer(new OjAlgoSolver(), false, false);
  private final ReassignmentOptimizer _branchAndBound = optimizer(new BinaryBranchAndBoundSolver(), false, false);

  /**
   * Loads can only land in [6, 11] here. The cheapest plan moves 7 weighted replicas.
   */
  @Test
  public void testWeightedInstanceWithDepartingBroker() throws KafkaReassignOptimizerException {
    ReassignmentInput input = ReassignmentInput.builder().brokers(BROKERS).balanceFactors(0.8, 1.2)
                                               .partition("t", 0, 2, 5).partition("t", 1, 2, 5).partition("t", 2, 4, 3)
                                               .partition("t", 3, 3, 4).partition("t", 4, 2, 3).partition("t", 5, 3, 4)
                                               .weight("t", 0, 1.0).weight("t", 1, 4.0).weight("t", 2, 4.0)
                                               .weight("t", 3, 2.0).weight("t", 4, 2.0).weight("t", 5, 4.0)
                                               .build();
    ReassignmentResult ojAlgoResult = _ojAlgo.optimize(input);
    ReassignmentResult branchAndBoundResult = _branchAndBound.optimize(input);

    assertEquals(SolverStatus.OPTIMAL, branchAndBoundResult.status());
    assertEquals(7.0, branchAndBoundResult.totalMovements(), DELTA);
    assertEquals(SolverStatus.OPTIMAL, ojAlgoResult.status());
    assertEquals(7.0, ojAlgoResult.totalMovements(), DELTA);
    assertTrue(ResultExtractor.invariantViolations(ojAlgoResult.spec(), ojAlgoResult.proposedAssignment()).isEmpty());
  }

  @Test
  public void testRandomWeightedInstances() throws KafkaReassignOptimizerException {
    Random random = new Random(SEED);
    for (int i = 0; i < NUM_INSTANCES; i++) {
      ReassignmentInput input = randomInput(random);
      String description = String.format("instance %d: %s", i, describe(input));
      ReassignmentResult branchAndBoundResult;
      try {
        branchAndBoundResult = _branchAndBound.optimize(input);
      } catch (InfeasibleModelException e) {
        assertThrows(description, InfeasibleModelException.class, () -> _ojAlgo.optimize(input));
        continue;
      }
      ReassignmentResult ojAlgoResult = _ojAlgo.optimize(input);
      assertEquals(description, SolverStatus.OPTIMAL, ojAlgoResult.status());
      assertEquals(description, branchAndBoundResult.totalMovements(), ojAlgoResult.totalMovements(), DELTA);
    }
  }

  /**
   * Two replicas per partition on brokers 1 to 5, weights 1 to 4, balance factors 0.8 and 1.2. Broker 5 is not in
   * the broker set, so its replicas always move.
   */
  private static ReassignmentInput randomInput(Random random) {
    ReassignmentInput.Builder builder = ReassignmentInput.builder().brokers(BROKERS).balanceFactors(0.8, 1.2);
    for (int p = 0; p < NUM_PARTITIONS; p++) {
      List<Integer> hosts = new ArrayList<>(List.of(1, 2, 3, 4, 5));
      Collections.shuffle(hosts, random);
      builder.partition("t", p, hosts.get(0), hosts.get(1)).weight("t", p, 1 + random.nextInt(4));
    }
    return builder.build();
  }

  private static String describe(ReassignmentInput input) {
    StringBuilder sb = new StringBuilder();
    for (int p = 0; p < input.partitions().partitions().size(); p++) {
      sb.append(String.format("t-%d=%s w%s ", p, input.partitions().partitions().get(p).replicas(),
                              input.partitionWeights().get(p).weight()));
    }
    return sb.toString().trim();
  }
}
