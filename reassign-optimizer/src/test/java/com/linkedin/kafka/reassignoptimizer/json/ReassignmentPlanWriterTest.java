/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentResult;
import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentSpecBuilder;
import com.linkedin.kafka.reassignoptimizer.exception.InvalidInputException;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaAssignment;
import com.linkedin.reassignoptimizer.solver.SolverStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.TopicPartition;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;


public class ReassignmentPlanWriterTest {

  private static ReassignmentResult result() throws InvalidInputException {
    ReassignmentSpec spec = new ReassignmentSpecBuilder(0.0, 2.0).build(
        ReassignmentInput.builder().brokers("1,2,3").partition("b", 0, 1, 2).partition("a", 1, 2, 3).partition("a", 0, 3, 1)
                         .build());
    // Insertion order differs from the topic and partition order on purpose.
    Map<TopicPartition, List<Integer>> replicas = new LinkedHashMap<>();
    replicas.put(new TopicPartition("b", 0), List.of(2, 1));
    replicas.put(new TopicPartition("a", 1), List.of(3, 2));
    replicas.put(new TopicPartition("a", 0), List.of(1, 3));
    return new ReassignmentResult(spec, new ReplicaAssignment(spec.brokers(), replicas), replicas, SolverStatus.OPTIMAL, 0.0,
                                  "mock", 1L);
  }

  @Test
  public void testDocumentLayout() throws InvalidInputException {
    String json = ReassignmentPlanWriter.toJson(result(), false);
    assertFalse(json.contains("\n"));
    JsonObject document = JsonParser.parseString(json).getAsJsonObject();
    assertEquals(ReassignmentPlanWriter.REASSIGNMENT_JSON_VERSION, document.get("version").getAsInt());
    JsonArray partitions = document.getAsJsonArray("partitions");
    assertEquals(3, partitions.size());

    String[] topics = {"a", "a", "b"};
    int[] partitionIds = {0, 1, 0};
    int[][] replicas = {{1, 3}, {3, 2}, {2, 1}};
    for (int i = 0; i < partitions.size(); i++) {
      JsonObject partition = partitions.get(i).getAsJsonObject();
      assertEquals(topics[i], partition.get("topic").getAsString());
      assertEquals(partitionIds[i], partition.get("partition").getAsInt());
      JsonArray replicaArray = partition.getAsJsonArray("replicas");
      assertEquals(replicas[i].length, replicaArray.size());
      for (int j = 0; j < replicas[i].length; j++) {
        assertEquals(replicas[i][j], replicaArray.get(j).getAsInt());
      }
    }
  }

  @Test
  public void testPrettyPrint() throws InvalidInputException {
    String json = ReassignmentPlanWriter.toJson(result(), true);
    assertTrue(json.contains("\n"));
    assertEquals(JsonParser.parseString(ReassignmentPlanWriter.toJson(result(), false)), JsonParser.parseString(json));
  }
}
