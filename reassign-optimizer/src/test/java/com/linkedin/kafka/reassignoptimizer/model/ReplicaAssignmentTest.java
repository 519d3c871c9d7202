/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.common.TopicPartition;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;


public class ReplicaAssignmentTest {
  private static final TopicPartition A0 = new TopicPartition("a", 0);
  private static final TopicPartition A10 = new TopicPartition("a", 10);
  private static final TopicPartition B2 = new TopicPartition("b", 2);

  private static ReplicaAssignment assignment() {
    return new ReplicaAssignment(List.of(3, 1, 2), Map.of(B2, List.of(3, 1), A10, List.of(2), A0, List.of(1, 2)));
  }

  @Test
  public void testOrderingAndSlots() {
    ReplicaAssignment assignment = assignment();
    assertEquals(List.of(1, 2, 3), List.copyOf(assignment.brokers()));
    assertEquals(List.of(A0, A10, B2), List.copyOf(assignment.partitions()));
    assertEquals(List.of(1, 3), List.copyOf(assignment.replicas(B2)));
    assertEquals(List.of(new ReplicaSlot(A0, 1), new ReplicaSlot(A0, 2), new ReplicaSlot(A10, 2), new ReplicaSlot(B2, 1),
                         new ReplicaSlot(B2, 3)),
                 List.copyOf(assignment.assignedSlots()));
    assertTrue(assignment.isAssigned(new ReplicaSlot("a", 10, 2)));
    assertEquals(0, assignment.value(new ReplicaSlot(A10, 3)));
  }

  @Test
  public void testWeightedLoad() {
    ReplicaAssignment assignment = assignment();
    Map<TopicPartition, Double> weights = Map.of(A0, 1.0, A10, 2.0, B2, 0.5);
    assertEquals(1.5, assignment.load(1, weights), 0.0);
    assertEquals(3.0, assignment.load(2, weights), 0.0);
    assertEquals(0.5, assignment.load(3, weights), 0.0);
    assertEquals(5.0, assignment.totalWeightedMass(weights), 0.0);
  }

  @Test
  public void testOutsideDomain() {
    ReplicaAssignment assignment = assignment();
    assertThrows(IllegalArgumentException.class, () -> assignment.value(new ReplicaSlot(A0, 4)));
    assertThrows(IllegalArgumentException.class, () -> assignment.replicas(new TopicPartition("c", 0)));
    assertThrows(IllegalArgumentException.class, () -> new ReplicaAssignment(Set.of(1), Map.of(A0, List.of(1, 2))));
  }

  @Test
  public void testEquality() {
    assertEquals(assignment(), new ReplicaAssignment(List.of(1, 2, 3),
                                                     Map.of(A0, List.of(2, 1), A10, List.of(2), B2, List.of(1, 3))));
    assertNotEquals(assignment(), new ReplicaAssignment(List.of(1, 2, 3),
                                                        Map.of(A0, List.of(2, 3), A10, List.of(2), B2, List.of(1, 3))));
    assertFalse(assignment().equals(null));
  }
}
