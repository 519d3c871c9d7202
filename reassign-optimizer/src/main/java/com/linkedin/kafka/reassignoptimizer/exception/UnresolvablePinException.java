/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

import com.linkedin.kafka.reassignoptimizer.model.ReplicaSlot;


/**
 * Thrown when a pinned replica refers to a broker or partition outside of the problem. The pin is dropped and the run
 * continues, since brokers legitimately leave the cluster.
 */
public class UnresolvablePinException extends KafkaReassignOptimizerException {
  private final ReplicaSlot _pin;

  public UnresolvablePinException(ReplicaSlot pin, String message) {
    super(message);
    _pin = pin;
  }

  /**
   * @return The pin that could not be resolved.
   */
  public ReplicaSlot pin() {
    return _pin;
  }
}
