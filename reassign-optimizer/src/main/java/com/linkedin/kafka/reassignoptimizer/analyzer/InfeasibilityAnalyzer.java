/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.analyzer;

import com.linkedin.kafka.reassignoptimizer.model.BalanceBounds;
import com.linkedin.kafka.reassignoptimizer.model.ReassignmentSpec;
import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;
import com.linkedin.reassignoptimizer.common.utils.Utils;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.kafka.common.TopicPartition;


/**
 * Explains an infeasible model by checking which requirements of the problem cannot hold together. The checks are
 * necessary conditions only, so a model may be infeasible with none of them firing; the fallback cause then points at
 * the balance band.
 */
public final class InfeasibilityAnalyzer {
  static final int MAX_EXAMPLES = 5;
  static final String BAND_TOO_TIGHT = "the balance band %s is too tight to place replicas of weights %s on %d brokers; "
      + "widen min_factor or max_factor";

  private InfeasibilityAnalyzer() {

  }

  /**
   * @param spec The canonical problem of an infeasible model.
   * @return Likely binding causes, most specific first. Never empty.
   */
  public static List<String> likelyCauses(ReassignmentSpec spec) {
    List<String> causes = new ArrayList<>();
    int numBrokers = spec.brokers().size();
    BalanceBounds bounds = spec.balanceBounds();

    List<TopicPartition> rfAboveBrokers = new ArrayList<>();
    for (TopicPartition tp : spec.partitions()) {
      if (spec.targetReplicationFactor(tp) > numBrokers) {
        rfAboveBrokers.add(tp);
      }
    }
    if (!rfAboveBrokers.isEmpty()) {
      causes.add(String.format("replication factor of %d partition(s) (e.g. %s with %d) exceeds the %d available brokers",
                               rfAboveBrokers.size(), examples(rfAboveBrokers), spec.targetReplicationFactor(rfAboveBrokers.get(0)),
                               numBrokers));
    }

    Map<TopicPartition, Integer> pinsByPartition = new HashMap<>();
    Map<Integer, Double> pinnedLoadByBroker = new HashMap<>();
    for (ReplicaSlot pin : spec.pinnedReplicas()) {
      pinsByPartition.merge(pin.topicPartition(), 1, Integer::sum);
      pinnedLoadByBroker.merge(pin.brokerId(), spec.weight(pin.topicPartition()), Double::sum);
    }
    for (TopicPartition tp : spec.partitions()) {
      int numPins = pinsByPartition.getOrDefault(tp, 0);
      if (numPins > spec.targetReplicationFactor(tp)) {
        causes.add(String.format("partition %s has %d pinned replicas but a replication factor of %d", tp, numPins,
                                 spec.targetReplicationFactor(tp)));
      }
    }
    for (Integer broker : spec.brokers()) {
      double pinnedLoad = Utils.snapToInteger(pinnedLoadByBroker.getOrDefault(broker, 0.0));
      if (pinnedLoad > bounds.maxLoad()) {
        causes.add(String.format("pinned replicas put load %s on broker %d, above the max load %s",
                                 Utils.formatNumber(pinnedLoad), broker, Utils.formatNumber(bounds.maxLoad())));
      }
    }

    double mass = spec.totalWeightedMass();
    if (numBrokers * bounds.maxLoad() < Utils.snapToInteger(mass) || numBrokers * bounds.minLoad() > Utils.snapToInteger(mass)) {
      causes.add(String.format("%d brokers with load in %s cannot carry the total replica weight %s", numBrokers, bounds,
                               Utils.formatNumber(mass)));
    }

    if (bounds.isExact() && allWeightsIntegral(spec) && bounds.minLoad() != Math.rint(bounds.minLoad())) {
      causes.add(String.format("exact balance requires load %s on every broker, which integer replica weights cannot reach",
                               Utils.formatNumber(bounds.minLoad())));
    }

    List<TopicPartition> heavierThanMaxLoad = new ArrayList<>();
    for (TopicPartition tp : spec.partitions()) {
      if (spec.weight(tp) > bounds.maxLoad()) {
        heavierThanMaxLoad.add(tp);
      }
    }
    if (!heavierThanMaxLoad.isEmpty()) {
      causes.add(String.format("%d partition(s) (e.g. %s) weigh more than the max load %s of a broker", heavierThanMaxLoad.size(),
                               examples(heavierThanMaxLoad), Utils.formatNumber(bounds.maxLoad())));
    }

    if (causes.isEmpty()) {
      causes.add(String.format(BAND_TOO_TIGHT, bounds, spec.weights().values().stream().distinct().sorted()
                                                            .map(Utils::formatNumber).collect(Collectors.toList()), numBrokers));
    }
    return causes;
  }

  private static boolean allWeightsIntegral(ReassignmentSpec spec) {
    return spec.weights().values().stream().allMatch(w -> Utils.snapToInteger(w) == Math.rint(w));
  }

  private static String examples(List<TopicPartition> partitions) {
    List<String> examples = new ArrayList<>();
    for (int i = 0; i < Math.min(MAX_EXAMPLES, partitions.size()); i++) {
      examples.add(partitions.get(i).toString());
    }
    return partitions.size() > MAX_EXAMPLES ? String.join(", ", examples) + ", ..." : String.join(", ", examples);
  }
}
