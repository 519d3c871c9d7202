/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.reassignoptimizer.exception;

public class ReassignOptimizerException extends Exception {

  public ReassignOptimizerException(String message, Throwable cause) {
    super(message, cause);
  }

  public ReassignOptimizerException(String message) {
    super(message);
  }

  public ReassignOptimizerException(Throwable cause) {
    super(cause);
  }
}
