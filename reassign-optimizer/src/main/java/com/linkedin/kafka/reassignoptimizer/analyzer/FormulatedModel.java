/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import com.linkedin.reassignoptimizer.model.DecisionVariable;
import com.linkedin.reassignoptimizer.model.LinearExpression;
import com.linkedin.reassignoptimizer.model.MilpModel;
import java.util.Collections;
import java.util.SortedMap;


/**
 * A {@link MilpModel} together with the mapping from each {@link ReplicaSlot} to its decision variable.
 */
public final class FormulatedModel {
  private final ReassignmentSpec _spec;
  private final MilpModel _model;
  private final SortedMap<ReplicaSlot, DecisionVariable> _variableBySlot;
  private final LinearExpression _movement;

  FormulatedModel(ReassignmentSpec spec, MilpModel model, SortedMap<ReplicaSlot, DecisionVariable> variableBySlot,
                  LinearExpression movement) {
    _spec = spec;
    _model = model;
    _variableBySlot = Collections.unmodifiableSortedMap(variableBySlot);
    _movement = movement;
  }

  public ReassignmentSpec spec() {
    return _spec;
  }

  public MilpModel model() {
    return _model;
  }

  /**
   * @return Decision variable of every slot of the domain, sorted by slot.
   */
  public SortedMap<ReplicaSlot, DecisionVariable> variableBySlot() {
    return _variableBySlot;
  }

  public DecisionVariable variable(ReplicaSlot slot) {
    DecisionVariable variable = _variableBySlot.get(slot);
    if (variable == null) {
      throw new IllegalArgumentException(String.format("Slot %s is not in the model.", slot));
    }
    return variable;
  }

  /**
   * @return The weighted movement count as a function of the decision variables. It equals the objective of the model
   * unless a tie-break term was added to the objective.
   */
  public LinearExpression movement() {
    return _movement;
  }
}
