/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer;

import com.linkedin.kafka.reassignoptimizer.config.ReassignOptimizerConfig;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;


/**
 * Util class for convenience.
 */
public final class ReassignOptimizerUtils {

  private ReassignOptimizerUtils() {

  }

  /**
   * Read the optimizer configuration from the given properties file.
   *
   * @param propertiesFile Path of the properties file.
   * @return The configuration.
   * @throws IOException If the file cannot be read.
   */
  public static ReassignOptimizerConfig readConfig(String propertiesFile) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = new FileInputStream(propertiesFile)) {
      props.load(propStream);
    }
    return new ReassignOptimizerConfig(props);
  }
}
