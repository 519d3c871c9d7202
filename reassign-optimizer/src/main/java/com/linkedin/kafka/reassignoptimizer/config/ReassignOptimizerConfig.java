/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.config;

import com.linkedin.kafka.reassignoptimizer.common.Verbosity;
import com.linkedin.kafka.reassignoptimizer.config.constants.DiagnosticConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.OptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.SolverConfig;
import com.linkedin.reassignoptimizer.common.ReassignOptimizerConfigurable;
import com.linkedin.reassignoptimizer.solver.SolverOptions;
import java.util.Locale;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigException;

/**
 * The configuration class of the replica assignment optimizer.
 *
 * Config names, their defaults, and definitions reside in the relevant classes under
 * {@link com.linkedin.kafka.reassignoptimizer.config.constants}.
 */
public class ReassignOptimizerConfig extends AbstractConfig {
  private static final ConfigDef CONFIG;

  static {
    CONFIG = DiagnosticConfig.define(SolverConfig.define(OptimizerConfig.define(new ConfigDef())));
  }

  public ReassignOptimizerConfig(Map<?, ?> originals) {
    this(originals, true);
  }

  public ReassignOptimizerConfig(Map<?, ?> originals, boolean doLog) {
    super(CONFIG, originals, doLog);
    sanityCheckBalanceFactors();
  }

  /**
   * @return Merged config values.
   */
  public Map<String, Object> mergedConfigValues() {
    Map<String, Object> conf = originals();

    // Use parsed non-null value to overwrite originals.
    // This will keep default values and also keep values that are not defined under ConfigDef.
    values().forEach((k, v) -> {
      if (v != null) {
        conf.put(k, v);
      }
    });
    return conf;
  }

  @Override
  public <T> T getConfiguredInstance(String key, Class<T> t) {
    T o = super.getConfiguredInstance(key, t);
    if (o instanceof ReassignOptimizerConfigurable) {
      ((ReassignOptimizerConfigurable) o).configure(mergedConfigValues());
    }
    return o;
  }

  /**
   * @return Solver limits derived from {@link SolverConfig}.
   */
  public SolverOptions solverOptions() {
    return new SolverOptions(getLong(SolverConfig.SOLVER_TIME_LIMIT_MS_CONFIG), getLong(SolverConfig.SOLVER_NODE_LIMIT_CONFIG));
  }

  /**
   * @return Verbosity of the diagnostic reporter.
   */
  public Verbosity verbosity() {
    return Verbosity.valueOf(getString(DiagnosticConfig.DIAGNOSTIC_VERBOSITY_CONFIG).toUpperCase(Locale.ROOT));
  }

  /**
   * Sanity check to ensure that the default balance band is not empty.
   */
  private void sanityCheckBalanceFactors() {
    double minFactor = getDouble(OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG);
    double maxFactor = getDouble(OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG);
    if (minFactor > maxFactor) {
      throw new ConfigException(String.format("Attempt to configure %s (%f) above %s (%f).",
                                              OptimizerConfig.BALANCE_MIN_FACTOR_CONFIG, minFactor,
                                              OptimizerConfig.BALANCE_MAX_FACTOR_CONFIG, maxFactor));
    }
  }
}
