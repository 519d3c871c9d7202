/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.model;

import com.linkedin.reassignoptimizer.common.utils.Utils;


/**
 * The band {@code [minLoad, maxLoad]} of weighted replica load that every broker must carry in a proposed assignment.
 */
public final class BalanceBounds {
  private final double _minLoad;
  private final double _maxLoad;

  public BalanceBounds(double minLoad, double maxLoad) {
    if (minLoad > maxLoad) {
      throw new IllegalArgumentException(String.format("Min load %f cannot be above max load %f.", minLoad, maxLoad));
    }
    _minLoad = minLoad;
    _maxLoad = maxLoad;
  }

  /**
   * Compute the band around the mean load per broker. Distinct factors give {@code [floor(mean * minFactor),
   * ceil(mean * maxFactor)]}. Equal factors pin both ends to {@code mean * factor} without rounding, so a fractional
   * target makes the model infeasible instead of silently rounding it.
   *
   * @param totalWeightedMass Total weighted replica mass to spread.
   * @param numBrokers Number of brokers.
   * @param minFactor Lower factor around the mean.
   * @param maxFactor Upper factor around the mean.
   * @return Balance bounds.
   */
  public static BalanceBounds fromMeanLoad(double totalWeightedMass, int numBrokers, double minFactor, double maxFactor) {
    double mean = totalWeightedMass / numBrokers;
    if (minFactor == maxFactor) {
      double exactLoad = Utils.snapToInteger(mean * minFactor);
      return new BalanceBounds(exactLoad, exactLoad);
    }
    return new BalanceBounds(Math.floor(Utils.snapToInteger(mean * minFactor)), Math.ceil(Utils.snapToInteger(mean * maxFactor)));
  }

  public double minLoad() {
    return _minLoad;
  }

  public double maxLoad() {
    return _maxLoad;
  }

  /**
   * @return {@code true} if every broker must carry exactly the same load.
   */
  public boolean isExact() {
    return _minLoad == _maxLoad;
  }

  /**
   * @param load Weighted load of a broker.
   * @param tolerance Absolute tolerance.
   * @return {@code true} if the load is within the band.
   */
  public boolean contains(double load, double tolerance) {
    return load >= _minLoad - tolerance && load <= _maxLoad + tolerance;
  }

  @Override
  public String toString() {
    return isExact() ? String.format("[%s]", Utils.formatNumber(_minLoad))
                     : String.format("[%s, %s]", Utils.formatNumber(_minLoad), Utils.formatNumber(_maxLoad));
  }
}
