/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

/**
 * The parent exception for all the replica assignment optimizer exceptions.
 */
public class KafkaReassignOptimizerException extends Exception {

  public KafkaReassignOptimizerException(String message, Throwable cause) {
    super(message, cause);
  }

  public KafkaReassignOptimizerException(String message) {
    super(message);
  }

  public KafkaReassignOptimizerException(Throwable cause) {
    super(cause);
  }

}
