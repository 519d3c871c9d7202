/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.kafka.common.TopicPartition;


/**
 * Writes a {@link ReassignmentResult} as the reassignment document accepted by {@code kafka-reassign-partitions.sh}:
 * <pre>
 * {"version": 1, "partitions": [{"topic": "t1", "partition": 0, "replicas": [3, 1, 5]}]}
 * </pre>
 */
public final class ReassignmentPlanWriter {
  public static final int REASSIGNMENT_JSON_VERSION = 1;

  private ReassignmentPlanWriter() {

  }

  /**
   * @param result Result of the optimization.
   * @param prettyPrint {@code true} to indent the document.
   * @return The reassignment document.
   */
  public static String toJson(ReassignmentResult result, boolean prettyPrint) {
    List<PartitionReassignment> partitions = new ArrayList<>();
    for (Map.Entry<TopicPartition, List<Integer>> entry : result.proposedReplicas().entrySet()) {
      partitions.add(new PartitionReassignment(entry.getKey().topic(), entry.getKey().partition(), entry.getValue()));
    }
    GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    Gson gson = builder.create();
    return gson.toJson(new ReassignmentPlan(REASSIGNMENT_JSON_VERSION, partitions));
  }

  private static class ReassignmentPlan {
    private final int version;
    private final List<PartitionReassignment> partitions;

    ReassignmentPlan(int version, List<PartitionReassignment> partitions) {
      this.version = version;
      this.partitions = partitions;
    }
  }

  private static class PartitionReassignment {
    private final String topic;
    private final int partition;
    private final List<Integer> replicas;

    PartitionReassignment(String topic, int partition, List<Integer> replicas) {
      this.topic = topic;
      this.partition = partition;
      this.replicas = replicas;
    }
  }
}
