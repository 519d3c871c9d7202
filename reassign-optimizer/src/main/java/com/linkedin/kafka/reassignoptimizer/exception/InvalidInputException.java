/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.exception;

/**
 * Thrown when the input document lacks a required field or carries a malformed one. The run fails without output.
 */
public class InvalidInputException extends KafkaReassignOptimizerException {

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvalidInputException(String message) {
    super(message);
  }
}
