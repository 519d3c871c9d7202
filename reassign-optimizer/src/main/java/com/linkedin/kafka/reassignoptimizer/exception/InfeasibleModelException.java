/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

import java.util.List;


/**
 * Thrown when no assignment satisfies the replication factor, balance and pin requirements. The constraints are never
 * relaxed automatically; the likely causes tell the operator what to loosen.
 */
public class InfeasibleModelException extends KafkaReassignOptimizerException {
  private final List<String> _likelyCauses;

  /**
   * @param message The detail message. The likely causes are appended to it.
   * @param likelyCauses Constraints that were likely binding, most specific first.
   */
  public InfeasibleModelException(String message, List<String> likelyCauses) {
    super(String.format("%s Likely causes: %s", message, String.join("; ", likelyCauses)));
    _likelyCauses = List.copyOf(likelyCauses);
  }

  /**
   * @return Constraints that were likely binding, most specific first.
   */
  public List<String> likelyCauses() {
    return _likelyCauses;
  }
}
