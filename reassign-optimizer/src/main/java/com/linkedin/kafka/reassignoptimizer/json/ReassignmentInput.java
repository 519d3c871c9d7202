/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.json;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * The raw input document, bound by Gson. Fields are left as given; {@link
 * com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentSpecBuilder} validates and normalizes them.
 *
 * Example:
 * <pre>
 * {
 *   "brokers": "1,2,3,4,5,6",
 *   "new_replication_factor": 3,
 *   "balance_parameters": {"min_factor": 0.5, "max_factor": 1.5},
 *   "partitions": {
 *     "version": 1,
 *     "partitions": [
 *       {"topic": "t1", "partition": 0, "replicas": [1, 3, 5]}
 *     ]
 *   },
 *   "pinned_replicas": [{"topic": "t1", "partition": 0, "replica": 3}],
 *   "partition_weights": [{"topic": "t1", "partition": 0, "weight": 2.0}]
 * }
 * </pre>
 */
public class ReassignmentInput {
  // A comma separated string such as "1,2,3", or a JSON array of broker ids.
  private JsonElement brokers;
  @SerializedName("new_replication_factor")
  private Integer newReplicationFactor;
  @SerializedName("balance_parameters")
  private BalanceParameters balanceParameters;
  private PartitionList partitions;
  @SerializedName("pinned_replicas")
  private List<PinnedReplica> pinnedReplicas;
  @SerializedName("partition_weights")
  private List<PartitionWeight> partitionWeights;

  public JsonElement brokers() {
    return brokers;
  }

  public Integer newReplicationFactor() {
    return newReplicationFactor;
  }

  public BalanceParameters balanceParameters() {
    return balanceParameters;
  }

  public PartitionList partitions() {
    return partitions;
  }

  public List<PinnedReplica> pinnedReplicas() {
    return pinnedReplicas == null ? Collections.emptyList() : pinnedReplicas;
  }

  public List<PartitionWeight> partitionWeights() {
    return partitionWeights == null ? Collections.emptyList() : partitionWeights;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class BalanceParameters {
    @SerializedName("min_factor")
    private Double minFactor;
    @SerializedName("max_factor")
    private Double maxFactor;

    public Double minFactor() {
      return minFactor;
    }

    public Double maxFactor() {
      return maxFactor;
    }
  }

  public static class PartitionList {
    private Integer version;
    private List<PartitionReplicas> partitions;

    public Integer version() {
      return version;
    }

    public List<PartitionReplicas> partitions() {
      return partitions;
    }
  }

  public static class PartitionReplicas {
    private String topic;
    private Integer partition;
    private List<Integer> replicas;

    private PartitionReplicas() {
    }

    public PartitionReplicas(String topic, Integer partition, List<Integer> replicas) {
      this.topic = topic;
      this.partition = partition;
      this.replicas = replicas;
    }

    public String topic() {
      return topic;
    }

    public Integer partition() {
      return partition;
    }

    public List<Integer> replicas() {
      return replicas;
    }
  }

  public static class PinnedReplica {
    private String topic;
    private Integer partition;
    private Integer replica;

    public String topic() {
      return topic;
    }

    public Integer partition() {
      return partition;
    }

    public Integer replica() {
      return replica;
    }
  }

  public static class PartitionWeight {
    private String topic;
    private Integer partition;
    private Double weight;

    public String topic() {
      return topic;
    }

    public Integer partition() {
      return partition;
    }

    public Double weight() {
      return weight;
    }
  }

  /**
   * Builds an input programmatically, e.g. when the optimizer is embedded rather than fed a document.
   */
  public static class Builder {
    private final ReassignmentInput _input;

    private Builder() {
      _input = new ReassignmentInput();
      _input.partitions = new PartitionList();
      _input.partitions.version = 1;
      _input.partitions.partitions = new ArrayList<>();
    }

    /**
     * @param brokers Comma separated broker ids.
     * @return This builder.
     */
    public Builder brokers(String brokers) {
      _input.brokers = new JsonPrimitive(brokers);
      return this;
    }

    public Builder newReplicationFactor(int newReplicationFactor) {
      _input.newReplicationFactor = newReplicationFactor;
      return this;
    }

    public Builder balanceFactors(Double minFactor, Double maxFactor) {
      _input.balanceParameters = new BalanceParameters();
      _input.balanceParameters.minFactor = minFactor;
      _input.balanceParameters.maxFactor = maxFactor;
      return this;
    }

    public Builder partition(String topic, int partition, Integer... replicas) {
      _input.partitions.partitions.add(new PartitionReplicas(topic, partition, Arrays.asList(replicas)));
      return this;
    }

    public Builder pin(String topic, int partition, int replica) {
      PinnedReplica pin = new PinnedReplica();
      pin.topic = topic;
      pin.partition = partition;
      pin.replica = replica;
      if (_input.pinnedReplicas == null) {
        _input.pinnedReplicas = new ArrayList<>();
      }
      _input.pinnedReplicas.add(pin);
      return this;
    }

    public Builder weight(String topic, int partition, double weight) {
      PartitionWeight partitionWeight = new PartitionWeight();
      partitionWeight.topic = topic;
      partitionWeight.partition = partition;
      partitionWeight.weight = weight;
      if (_input.partitionWeights == null) {
        _input.partitionWeights = new ArrayList<>();
      }
      _input.partitionWeights.add(partitionWeight);
      return this;
    }

    public ReassignmentInput build() {
      return _input;
    }
  }
}
