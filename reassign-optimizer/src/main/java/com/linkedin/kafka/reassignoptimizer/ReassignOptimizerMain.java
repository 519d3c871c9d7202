/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer;

import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentOptimizer;
import com.linkedin.kafka.reassignoptimizer.analyzer.ReassignmentResult;
import com.linkedin.kafka.reassignoptimizer.config.ReassignOptimizerConfig;
import com.linkedin.kafka.reassignoptimizer.exception.InfeasibleModelException;
import com.linkedin.kafka.reassignoptimizer.exception.InvalidInputException;
import com.linkedin.kafka.reassignoptimizer.exception.SolverFailureException;
import com.linkedin.kafka.reassignoptimizer.exception.SolverLimitExceededException;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInput;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentInputParser;
import com.linkedin.kafka.reassignoptimizer.json.ReassignmentPlanWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.linkedin.kafka.reassignoptimizer.ReassignOptimizerUtils.readConfig;

/**
 * The main class to run the replica assignment optimizer. The input document is read from stdin and the reassignment
 * document is written to stdout; diagnostics go to the log.
 */
public final class ReassignOptimizerMain {
  private static final Logger LOG = LoggerFactory.getLogger(ReassignOptimizerMain.class);
  public static final int EXIT_OK = 0;
  public static final int EXIT_INVALID_INPUT = 1;
  public static final int EXIT_INFEASIBLE = 2;
  public static final int EXIT_SOLVER_LIMIT_EXCEEDED = 3;
  public static final int EXIT_SOLVER_FAILURE = 4;

  private ReassignOptimizerMain() { }

  /**
   * The main function to run the optimizer.
   * @param args An optional path to a properties file.
   */
  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out));
  }

  /**
   * Run the optimizer once.
   *
   * @param args An optional path to a properties file.
   * @param in Source of the input document.
   * @param out Destination of the reassignment document.
   * @return The exit code.
   */
  public static int run(String[] args, InputStream in, PrintStream out) {
    if (args.length > 1) {
      LOG.error(String.format("USAGE: java %s [reassign-optimizer.properties] < input.json",
                              ReassignOptimizerMain.class.getSimpleName()));
      return EXIT_INVALID_INPUT;
    }

    ReassignmentOptimizer optimizer;
    try {
      ReassignOptimizerConfig config = args.length == 1 ? readConfig(args[0]) : new ReassignOptimizerConfig(Collections.emptyMap());
      optimizer = new ReassignmentOptimizer(config);
    } catch (IOException | KafkaException e) {
      LOG.error("Invalid configuration.", e);
      return EXIT_INVALID_INPUT;
    }

    try {
      Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
      ReassignmentInput input = ReassignmentInputParser.parse(reader);
      ReassignmentResult result = optimizer.optimize(input);
      LOG.info("# Partition Replica Assignment (copy it and input to kafka-reassign-partitions.sh)");
      out.println(ReassignmentPlanWriter.toJson(result, false));
      out.flush();
      return EXIT_OK;
    } catch (InvalidInputException e) {
      LOG.error("Invalid input.", e);
      return EXIT_INVALID_INPUT;
    } catch (InfeasibleModelException e) {
      LOG.error("The reassignment model is infeasible.", e);
      return EXIT_INFEASIBLE;
    } catch (SolverLimitExceededException e) {
      LOG.error("The solver hit its limit.", e);
      return EXIT_SOLVER_LIMIT_EXCEEDED;
    } catch (SolverFailureException e) {
      LOG.error("The solver failed.", e);
      return EXIT_SOLVER_FAILURE;
    }
  }
}
