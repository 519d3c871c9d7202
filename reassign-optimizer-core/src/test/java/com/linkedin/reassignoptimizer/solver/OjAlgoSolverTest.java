/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.solver;

import com.linkedin.reassignoptimizer.exception.SolverException;
import com.linkedin.reassignoptimizer.model.DecisionVariable;
import com.linkedin.reassignoptimizer.model.LinearExpression;
import com.linkedin.reassignoptimizer.model.MilpModel;
import org.junit.Test;
import org.ojalgo.optimisation.Optimisation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;


/**
 * Unit test for the mapping of ojAlgo states to {@link SolverStatus}.
 */
public class OjAlgoSolverTest {
  private static final double DELTA = 1E-6;
  private static final int NUM_BINS = 5;
  private static final int NUM_ITEMS = 10;

  @Test
  public void testOptimalOnlyWithinLimit() {
    assertEquals(SolverStatus.OPTIMAL, OjAlgoSolver.toSolverStatus(Optimisation.State.OPTIMAL, false));
    assertEquals(SolverStatus.FEASIBLE, OjAlgoSolver.toSolverStatus(Optimisation.State.OPTIMAL, true));
    assertEquals(SolverStatus.FEASIBLE, OjAlgoSolver.toSolverStatus(Optimisation.State.FEASIBLE, false));
    assertEquals(SolverStatus.FEASIBLE, OjAlgoSolver.toSolverStatus(Optimisation.State.APPROXIMATE, true));
  }

  @Test
  public void testInfeasibleIsNotTrustedAfterTimeLimit() {
    assertEquals(SolverStatus.INFEASIBLE, OjAlgoSolver.toSolverStatus(Optimisation.State.INFEASIBLE, false));
    assertEquals(SolverStatus.NOT_SOLVED, OjAlgoSolver.toSolverStatus(Optimisation.State.INFEASIBLE, true));
  }

  @Test
  public void testUnboundedAndFailure() {
    assertEquals(SolverStatus.UNBOUNDED, OjAlgoSolver.toSolverStatus(Optimisation.State.UNBOUNDED, false));
    assertEquals(SolverStatus.ERROR, OjAlgoSolver.toSolverStatus(Optimisation.State.FAILED, false));
  }

  @Test
  public void testFailureUnderIterationLimitIsALimit() {
    assertTrue(OjAlgoSolver.isIterationsAbort(Optimisation.State.FAILED, true));
    assertFalse(OjAlgoSolver.isIterationsAbort(Optimisation.State.FAILED, false));
    assertFalse(OjAlgoSolver.isIterationsAbort(Optimisation.State.INFEASIBLE, true));
    assertFalse(OjAlgoSolver.isIterationsAbort(Optimisation.State.UNBOUNDED, true));
    assertEquals(SolverStatus.NOT_SOLVED, OjAlgoSolver.toSolverStatus(Optimisation.State.FAILED, true));
  }

  @Test
  public void testNodeLimitIsReportedAsLimit() throws SolverException {
    MilpModel model = balanceModel();
    SolveResult unlimited = new OjAlgoSolver().solve(model, new SolverOptions(60_000L, Long.MAX_VALUE));
    assertEquals(SolverStatus.OPTIMAL, unlimited.status());
    // Bins 0 and 1 keep four items each, the other twelve current placements leave.
    assertEquals(12.0, unlimited.objectiveValue(), DELTA);

    for (long nodeLimit : new long[]{1L, 2L, 5L}) {
      SolveResult result = new OjAlgoSolver().solve(model, new SolverOptions(60_000L, nodeLimit));
      String message = "node limit " + nodeLimit;
      assertNotEquals(message, SolverStatus.ERROR, result.status());
      if (result.status() == SolverStatus.OPTIMAL) {
        assertEquals(message, unlimited.objectiveValue(), result.objectiveValue(), DELTA);
        continue;
      }
      assertTrue(message, result.limitReached());
      if (result.hasSolution()) {
        assertEquals(message, SolverStatus.FEASIBLE, result.status());
        assertTrue(message, model.violations(result.values(), DELTA).isEmpty());
      } else {
        assertEquals(message, SolverStatus.NOT_SOLVED, result.status());
      }
    }
  }

  /**
   * Every item takes two of the bins and every bin takes exactly four items. All items currently sit in bins 0 and
   * 1, and the objective counts the items that leave their current bins.
   */
  private static MilpModel balanceModel() {
    MilpModel model = new MilpModel("balance");
    DecisionVariable[][] x = new DecisionVariable[NUM_ITEMS][NUM_BINS];
    LinearExpression objective = new LinearExpression();
    for (int item = 0; item < NUM_ITEMS; item++) {
      LinearExpression replicas = new LinearExpression();
      for (int bin = 0; bin < NUM_BINS; bin++) {
        x[item][bin] = model.addBinaryVariable(String.format("x_%d_%d", item, bin));
        replicas.addTerm(x[item][bin], 1.0);
        if (bin < 2) {
          objective.addTerm(x[item][bin], -1.0).addConstant(1.0);
        }
      }
      model.addEqualityConstraint("item_" + item, replicas, 2.0);
    }
    for (int bin = 0; bin < NUM_BINS; bin++) {
      LinearExpression load = new LinearExpression();
      for (int item = 0; item < NUM_ITEMS; item++) {
        load.addTerm(x[item][bin], 1.0);
      }
      model.addEqualityConstraint("bin_" + bin, load, NUM_ITEMS * 2.0 / NUM_BINS);
    }
    model.minimize(objective);
    return model;
  }
}
