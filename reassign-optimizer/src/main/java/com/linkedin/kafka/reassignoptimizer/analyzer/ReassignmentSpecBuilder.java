/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.linkedin.kafka.reassignoptimizer.config.ReassignOptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.OptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.exception.InvalidInputException;
import com.linkedin.kafka.reassignoptimizer.exception.UnresolvablePinException;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInput;
import com.linkedin.kafka.reassignoptimizer.model.BalanceBounds;
import com.linkedin.kafka.reassignoptimizer.model.ModelUtils;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaAssignment;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec.NO_REPLICATION_FACTOR_OVERRIDE;


/**
 * Normalizes a raw {@link ReassignmentInput} into a canonical {@link ReassignmentSpec}.
 *
 * <ul>
 *   <li>Brokers are deduplicated and sorted; partitions are sorted by topic and partition.</li>
 *   <li>Replicas on brokers outside the broker set stay in the current replica list but not in the slot domain.</li>
 *   <li>Pins outside the slot domain are dropped with a warning. Duplicate pins are merged.</li>
 *   <li>Partitions without a weight weigh {@link #DEFAULT_PARTITION_WEIGHT}.</li>
 *   <li>Balance factors missing from the input fall back to the configured defaults, each on its own.</li>
 * </ul>
 */
public class ReassignmentSpecBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(ReassignmentSpecBuilder.class);
  public static final double DEFAULT_PARTITION_WEIGHT = 1.0;
  private final double _defaultMinFactor;
  private final double _defaultMaxFactor;

  public ReassignmentSpecBuilder(ReassignOptimizerConfig config) {
    this(config.getDouble(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG), config.getDouble(OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG));
  }

  /**
   * @param defaultMinFactor Lower balance factor used when the input does not give one.
   * @param defaultMaxFactor Upper balance factor used when the input does not give one.
   */
  public ReassignmentSpecBuilder(double defaultMinFactor, double defaultMaxFactor) {
    _defaultMinFactor = defaultMinFactor;
    _defaultMaxFactor = defaultMaxFactor;
  }

  /**
   * Build the canonical problem of the given input.
   *
   * @param input The raw input.
   * @return The canonical problem.
   * @throws InvalidInputException If a required field is missing or a field is malformed.
   */
  public ReassignmentSpec build(ReassignmentInput input) throws InvalidInputException {
    SortedSet<Integer> brokers = parseBrokers(input.brokers());
    SortedMap<TopicPartition, List<Integer>> currentReplicas = parsePartitions(input.partitions());
    List<TopicPartition> partitions = new ArrayList<>(currentReplicas.keySet());

    Map<TopicPartition, Set<Integer>> inDomainReplicas = new HashMap<>();
    currentReplicas.forEach((tp, replicas) -> {
      Set<Integer> hosts = new TreeSet<>(replicas);
      hosts.retainAll(brokers);
      inDomainReplicas.put(tp, hosts);
    });
    ReplicaAssignment currentAssignment = new ReplicaAssignment(brokers, inDomainReplicas);
    for (TopicPartition tp : partitions) {
      if (inDomainReplicas.get(tp).size() < currentReplicas.get(tp).size()) {
        LOG.info("Partition {} has replicas on brokers {} which are not in the broker set; they will all move.", tp,
                 currentReplicas.get(tp).stream().filter(b -> !brokers.contains(b)).collect(Collectors.toList()));
      }
    }

    Map<TopicPartition, Double> weights = parseWeights(input.partitionWeights(), currentReplicas);

    int newReplicationFactor = NO_REPLICATION_FACTOR_OVERRIDE;
    if (input.newReplicationFactor() != null && input.newReplicationFactor() > 0) {
      newReplicationFactor = input.newReplicationFactor();
    }
    Map<TopicPartition, Integer> targetReplicationFactor = new HashMap<>();
    double totalWeightedMass = 0.0;
    for (TopicPartition tp : partitions) {
      int rf = newReplicationFactor == NO_REPLICATION_FACTOR_OVERRIDE ? currentReplicas.get(tp).size() : newReplicationFactor;
      targetReplicationFactor.put(tp, rf);
      totalWeightedMass += weights.get(tp) * rf;
    }

    double minFactor = _defaultMinFactor;
    double maxFactor = _defaultMaxFactor;
    ReassignmentInput.BalanceParameters balanceParameters = input.balanceParameters();
    if (balanceParameters != null) {
      if (balanceParameters.minFactor() != null) {
        minFactor = balanceParameters.minFactor();
      }
      if (balanceParameters.maxFactor() != null) {
        maxFactor = balanceParameters.maxFactor();
      }
    }
    validateBalanceFactors(minFactor, maxFactor);

    SortedSet<ReplicaSlot> pinnedReplicas = new TreeSet<>();
    SortedSet<ReplicaSlot> droppedPins = new TreeSet<>();
    for (ReassignmentInput.PinnedReplica pin : input.pinnedReplicas()) {
      try {
        pinnedReplicas.add(resolvePin(pin, brokers, currentReplicas));
      } catch (UnresolvablePinException e) {
        LOG.warn("Dropping pin {}: {}", e.pin(), e.getMessage());
        droppedPins.add(e.pin());
      }
    }

    BalanceBounds balanceBounds = BalanceBounds.fromMeanLoad(totalWeightedMass, brokers.size(), minFactor, maxFactor);
    return new ReassignmentSpec(brokers, partitions, currentReplicas, currentAssignment, weights, pinnedReplicas, droppedPins,
                                newReplicationFactor, targetReplicationFactor, minFactor, maxFactor, totalWeightedMass,
                                balanceBounds);
  }

  /**
   * Parse brokers given either as a comma separated string, e.g. {@code "1,2,3"}, or as a JSON array of integers.
   */
  static SortedSet<Integer> parseBrokers(JsonElement brokersElement) throws InvalidInputException {
    if (brokersElement == null || brokersElement.isJsonNull()) {
      throw new InvalidInputException("Missing required field brokers.");
    }
    SortedSet<Integer> brokers = new TreeSet<>();
    if (brokersElement.isJsonArray()) {
      JsonArray array = brokersElement.getAsJsonArray();
      for (JsonElement element : array) {
        brokers.add(parseBrokerId(element, brokersElement));
      }
    } else if (brokersElement.isJsonPrimitive() && brokersElement.getAsJsonPrimitive().isString()) {
      String brokerList = brokersElement.getAsString();
      if (!brokerList.trim().isEmpty()) {
        for (String token : brokerList.split(",")) {
          try {
            brokers.add(Integer.parseInt(token.trim()));
          } catch (NumberFormatException e) {
            throw new InvalidInputException(String.format("Malformed broker id '%s' in brokers '%s'.", token.trim(), brokerList), e);
          }
        }
      }
    } else {
      brokers.add(parseBrokerId(brokersElement, brokersElement));
    }
    if (brokers.isEmpty()) {
      throw new InvalidInputException("Field brokers must list at least one broker.");
    }
    return brokers;
  }

  private static int parseBrokerId(JsonElement element, JsonElement brokersElement) throws InvalidInputException {
    if (element == null || !element.isJsonPrimitive()) {
      throw new InvalidInputException(String.format("Malformed broker id %s in brokers %s.", element, brokersElement));
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    try {
      if (primitive.isNumber()) {
        return new BigDecimal(primitive.getAsString()).intValueExact();
      }
      return Integer.parseInt(primitive.getAsString().trim());
    } catch (NumberFormatException | ArithmeticException e) {
      throw new InvalidInputException(String.format("Malformed broker id %s in brokers %s.", element, brokersElement), e);
    }
  }

  private static SortedMap<TopicPartition, List<Integer>> parsePartitions(ReassignmentInput.PartitionList partitionList)
      throws InvalidInputException {
    if (partitionList == null || partitionList.partitions() == null) {
      throw new InvalidInputException("Missing required field partitions.partitions.");
    }
    if (partitionList.partitions().isEmpty()) {
      throw new InvalidInputException("Field partitions.partitions must list at least one partition.");
    }
    SortedMap<TopicPartition, List<Integer>> currentReplicas = new TreeMap<>(ModelUtils.TOPIC_PARTITION_COMPARATOR);
    for (ReassignmentInput.PartitionReplicas entry : partitionList.partitions()) {
      if (entry == null) {
        throw new InvalidInputException("Field partitions.partitions contains a null entry.");
      }
      TopicPartition tp = toTopicPartition(entry.topic(), entry.partition(), "partitions.partitions");
      List<Integer> replicas = entry.replicas();
      if (replicas == null || replicas.isEmpty()) {
        throw new InvalidInputException(String.format("Partition %s must list at least one replica.", tp));
      }
      if (replicas.contains(null)) {
        throw new InvalidInputException(String.format("Replicas %s of partition %s contain a null broker id.", replicas, tp));
      }
      if (new LinkedHashSet<>(replicas).size() != replicas.size()) {
        throw new InvalidInputException(String.format("Replicas %s of partition %s contain duplicate brokers.", replicas, tp));
      }
      if (currentReplicas.put(tp, List.copyOf(replicas)) != null) {
        throw new InvalidInputException(String.format("Partition %s is listed more than once.", tp));
      }
    }
    return currentReplicas;
  }

  private static Map<TopicPartition, Double> parseWeights(List<ReassignmentInput.PartitionWeight> partitionWeights,
                                                          Map<TopicPartition, List<Integer>> currentReplicas)
      throws InvalidInputException {
    Map<TopicPartition, Double> weights = new HashMap<>();
    for (ReassignmentInput.PartitionWeight entry : partitionWeights) {
      if (entry == null) {
        throw new InvalidInputException("Field partition_weights contains a null entry.");
      }
      TopicPartition tp = toTopicPartition(entry.topic(), entry.partition(), "partition_weights");
      Double weight = entry.weight();
      if (weight == null || !Double.isFinite(weight) || weight <= 0.0) {
        throw new InvalidInputException(String.format("Weight of partition %s must be a positive number (%s).", tp, weight));
      }
      if (!currentReplicas.containsKey(tp)) {
        LOG.warn("Ignoring weight {} of partition {}, which is not in partitions.", weight, tp);
      } else if (weights.containsKey(tp)) {
        LOG.warn("Ignoring duplicate weight {} of partition {}; keeping {}.", weight, tp, weights.get(tp));
      } else {
        weights.put(tp, weight);
      }
    }
    for (TopicPartition tp : currentReplicas.keySet()) {
      weights.putIfAbsent(tp, DEFAULT_PARTITION_WEIGHT);
    }
    return weights;
  }

  private static void validateBalanceFactors(double minFactor, double maxFactor) throws InvalidInputException {
    if (!Double.isFinite(minFactor) || minFactor < 0.0) {
      throw new InvalidInputException(String.format("Balance min_factor must be a non-negative number (%s).", minFactor));
    }
    if (!Double.isFinite(maxFactor) || maxFactor < 0.0) {
      throw new InvalidInputException(String.format("Balance max_factor must be a non-negative number (%s).", maxFactor));
    }
    if (minFactor > maxFactor) {
      throw new InvalidInputException(String.format("Balance min_factor %s cannot be above max_factor %s.", minFactor, maxFactor));
    }
  }

  private static ReplicaSlot resolvePin(ReassignmentInput.PinnedReplica pin,
                                        Set<Integer> brokers,
                                        Map<TopicPartition, List<Integer>> currentReplicas)
      throws InvalidInputException, UnresolvablePinException {
    if (pin == null) {
      throw new InvalidInputException("Field pinned_replicas contains a null entry.");
    }
    TopicPartition tp = toTopicPartition(pin.topic(), pin.partition(), "pinned_replicas");
    if (pin.replica() == null) {
      throw new InvalidInputException(String.format("Pinned replica of partition %s is missing the replica field.", tp));
    }
    ReplicaSlot slot = new ReplicaSlot(tp, pin.replica());
    if (!brokers.contains(pin.replica())) {
      throw new UnresolvablePinException(slot, String.format("broker %d is not in the broker set %s.", pin.replica(), brokers));
    }
    if (!currentReplicas.containsKey(tp)) {
      throw new UnresolvablePinException(slot, String.format("partition %s is not in partitions.", tp));
    }
    return slot;
  }

  private static TopicPartition toTopicPartition(String topic, Integer partition, String field) throws InvalidInputException {
    if (topic == null || topic.isEmpty()) {
      throw new InvalidInputException(String.format("An entry of %s is missing the topic field.", field));
    }
    if (partition == null || partition < 0) {
      throw new InvalidInputException(String.format("Entry of topic %s in %s must have a non-negative partition (%s).",
                                                    topic, field, partition));
    }
    return new TopicPartition(topic, partition);
  }
}
