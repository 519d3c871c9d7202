/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.reassignoptimizer.common;

import java.util.Map;


/**
 * A Mix-in style interface for pluggable policies that are instantiated by reflection from the optimizer
 * configuration and need to take configuration parameters.
 */
public interface ReassignOptimizerConfigurable {

  /**
   * Configure this class with the given key-value pairs
   * @param configs Configurations.
   */
  void configure(Map<String, ?> configs);

}
