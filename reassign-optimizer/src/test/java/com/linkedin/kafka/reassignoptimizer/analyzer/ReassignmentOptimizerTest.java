/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.exception.InfeasibleModelException;
import com.linkedin.kafka.reassignoptimizer.exception.KafkaReassignOptimizerException;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInput;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import com.linkedin.reassignoptimizer.solver.BinaryBranchAndBoundSolver;
import com.linkedin.reassignoptimizer.solver.OjAlgoSolver;
import com.linkedin.reassignoptimizer.solver.Solver;
import com.linkedin.reassignoptimizer.solver.SolverStatus;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.kafka.common.TopicPartition;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import static com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentTestUtils.TOPIC;
import static com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentTestUtils.inputFromResult;
import static com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentTestUtils.spec;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


/**
 * End to end scenarios of {@link ReassignmentOptimizer}, run against every solver backend.
 */
@RunWith(Parameterized.class)
public class ReassignmentOptimizerTest {
  private static final double DELTA = 1E-6;
  private static final TopicPartition T1_0 = new TopicPartition(TOPIC, 0);
  private final Solver _solver;

  public ReassignmentOptimizerTest(String name, Solver solver) {
    _solver = solver;
  }

  /**
   * @return The solver backends.
   */
  @Parameterized.Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[]{"ojAlgo", new OjAlgoSolver()},
                         new Object[]{"binary-branch-and-bound", new BinaryBranchAndBoundSolver()});
  }

  private ReassignmentResult optimize(ReassignmentInput input) throws KafkaReassignOptimizerException {
    return ReassignmentTestUtils.optimizer(_solver, false, false).optimize(input);
  }

  private static void assertSatisfiesInvariants(ReassignmentResult result) {
    ReassignmentSpec spec = result.spec();
    assertTrue(ResultExtractor.invariantViolations(spec, result.proposedAssignment()).isEmpty());
    assertEquals(spec.totalWeightedMass(), result.proposedAssignment().totalWeightedMass(spec.weights()), DELTA);
    for (TopicPartition tp : spec.partitions()) {
      assertEquals(new TreeSet<>(result.proposedReplicas().get(tp)), result.proposedAssignment().replicas(tp));
    }
  }

  @Test
  public void testPlacementThatAlreadyFitsDoesNotMove() throws KafkaReassignOptimizerException {
    ReassignmentResult result = optimize(ReassignmentTestUtils.singlePartitionWithLooseBand().build());
    assertEquals(SolverStatus.OPTIMAL, result.status());
    assertTrue(result.isProvenOptimal());
    assertEquals(0.0, result.totalMovements(), DELTA);
    assertEquals(List.of(1, 2), result.proposedReplicas().get(T1_0));
    assertSatisfiesInvariants(result);
  }

  @Test
  public void testSpreadsColocatedPartitions() throws KafkaReassignOptimizerException {
    ReassignmentResult result = optimize(ReassignmentTestUtils.allOnOneBrokerWithExactBand().build());
    assertEquals(SolverStatus.OPTIMAL, result.status());
    assertEquals(3.0, result.totalMovements(), DELTA);
    assertFalse(result.isMovementCountApproximate());
    for (int broker = 1; broker <= 4; broker++) {
      assertEquals(1.0, result.proposedAssignment().load(broker, result.spec().weights()), DELTA);
    }
    long stayed = result.proposedReplicas().values().stream().filter(r -> r.equals(List.of(1))).count();
    assertEquals(1L, stayed);
    assertSatisfiesInvariants(result);
  }

  @Test
  public void testOddSplitIsInfeasible() {
    InfeasibleModelException e = assertThrows(InfeasibleModelException.class,
                                              () -> optimize(ReassignmentTestUtils.oddSplitWithExactBand().build()));
    assertThat(e.likelyCauses(), hasItem(containsString("exact balance requires load 1.5")));
    assertThat(e.getMessage(), containsString("Likely causes:"));
  }

  @Test
  public void testIdempotence() throws KafkaReassignOptimizerException {
    ReassignmentResult first = optimize(ReassignmentTestUtils.allOnOneBrokerWithExactBand().build());
    ReassignmentResult second = optimize(inputFromResult("1,2,3,4", first).balanceFactors(1.0, 1.0).build());
    assertEquals(0.0, second.totalMovements(), DELTA);
    assertEquals(first.proposedAssignment(), second.proposedAssignment());
  }

  @Test
  public void testTighterBandNeverMovesLess() throws KafkaReassignOptimizerException {
    double[][] factors = {{0.0, 10.0}, {0.5, 1.5}, {0.75, 1.25}, {1.0, 1.0}};
    List<Double> movements = new ArrayList<>();
    for (double[] factor : factors) {
      ReassignmentInput.Builder skewed = ReassignmentInput.builder().brokers("1,2,3,4").balanceFactors(factor[0], factor[1]);
      for (int partition = 0; partition < 6; partition++) {
        skewed.partition(TOPIC, partition, 1, 2);
      }
      ReassignmentResult result = optimize(skewed.build());
      assertSatisfiesInvariants(result);
      movements.add(result.totalMovements());
    }
    for (int i = 1; i < movements.size(); i++) {
      assertThat(movements.get(i), greaterThanOrEqualTo(movements.get(i - 1)));
    }
    assertEquals(0.0, movements.get(0), DELTA);
    // Exact balance needs 3 replicas per broker, so brokers 1 and 2 each hand over 3.
    assertEquals(6.0, movements.get(movements.size() - 1), DELTA);
  }

  @Test
  public void testPinsAreEnforcedAndNeverReduceMovement() throws KafkaReassignOptimizerException {
    ReassignmentResult unpinned = optimize(ReassignmentTestUtils.singlePartitionWithLooseBand().build());
    ReassignmentResult pinned = optimize(ReassignmentTestUtils.singlePartitionWithLooseBand().pin(TOPIC, 0, 3).build());
    assertTrue(pinned.proposedAssignment().isAssigned(new ReplicaSlot(T1_0, 3)));
    assertEquals(1.0, pinned.totalMovements(), DELTA);
    assertThat(pinned.totalMovements(), greaterThanOrEqualTo(unpinned.totalMovements()));
    assertSatisfiesInvariants(pinned);
  }

  @Test
  public void testPinOnUnknownBrokerIsDropped() throws KafkaReassignOptimizerException {
    ReassignmentResult result = optimize(ReassignmentTestUtils.singlePartitionWithLooseBand().pin(TOPIC, 0, 9).build());
    assertThat(result.spec().droppedPins(), contains(new ReplicaSlot(T1_0, 9)));
    assertEquals(0.0, result.totalMovements(), DELTA);
  }

  @Test
  public void testWeightedBalance() throws KafkaReassignOptimizerException {
    // Loads 4, 0 and 0 must end within [floor(4 / 3 * 0.5), ceil(4 / 3 * 1.5)] = [0, 2].
    ReassignmentResult result = optimize(ReassignmentInput.builder().brokers("1,2,3").balanceFactors(0.5, 1.5)
                                                          .partition(TOPIC, 0, 1).partition(TOPIC, 1, 1).partition(TOPIC, 2, 1)
                                                          .weight(TOPIC, 0, 2.0).build());
    assertSatisfiesInvariants(result);
    // Either the weight 2 partition or both unit partitions leave broker 1.
    assertEquals(2.0, result.totalMovements(), DELTA);
  }

  @Test
  public void testReplicationFactorIncrease() throws KafkaReassignOptimizerException {
    ReassignmentResult result = optimize(ReassignmentInput.builder().brokers("1,2,3").newReplicationFactor(2)
                                                          .balanceFactors(0.0, 10.0)
                                                          .partition(TOPIC, 0, 1).partition(TOPIC, 1, 2).build());
    assertSatisfiesInvariants(result);
    assertTrue(result.isMovementCountApproximate());
    // Two new replicas count as two half moves.
    assertEquals(1.0, result.totalMovements(), DELTA);
    assertEquals(Integer.valueOf(1), result.proposedReplicas().get(T1_0).get(0));
    assertEquals(Integer.valueOf(2), result.proposedReplicas().get(new TopicPartition(TOPIC, 1)).get(0));
  }

  @Test
  public void testReplicaOnRemovedBrokerMoves() throws KafkaReassignOptimizerException {
    ReassignmentResult result = optimize(ReassignmentInput.builder().brokers("1,2").balanceFactors(0.0, 10.0)
                                                          .partition(TOPIC, 0, 3, 1).build());
    assertSatisfiesInvariants(result);
    assertEquals(List.of(1, 2), result.proposedReplicas().get(T1_0));
    assertEquals(1.0, result.totalMovements(), DELTA);
  }

  @Test
  public void testPreferLowerBrokerIds() throws KafkaReassignOptimizerException {
    ReassignmentInput input = ReassignmentInput.builder().brokers("1,2,3").newReplicationFactor(2).balanceFactors(0.0, 10.0)
                                               .partition(TOPIC, 0, 1).build();
    ReassignmentResult result = ReassignmentTestUtils.optimizer(_solver, true, false).optimize(input);
    assertEquals(Set.of(1, 2), Set.copyOf(result.proposedAssignment().replicas(T1_0)));
    assertEquals(0.5, result.totalMovements(), DELTA);
  }

  @Test
  public void testOptimizeSpecDirectly() throws KafkaReassignOptimizerException {
    ReassignmentSpec spec = spec(ReassignmentTestUtils.allOnOneBrokerWithExactBand().build());
    ReassignmentResult result = ReassignmentTestUtils.optimizer(_solver, false, false).optimize(spec);
    assertEquals(spec, result.spec());
    assertEquals(_solver.name(), result.solverName());
  }
}
