/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.linkedin.kafka.reassignoptimizer.config.constants.DiagnosticConfig;
import com.linkedin.kafka.reassignoptimizer.config.constants.SolverConfig;
import com.linkedin.reassignoptimizer.solver.BinaryBranchAndBoundSolver;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;


/**
 * Runs the command line entry point against in-memory streams.
 */
public class ReassignOptimizerMainTest {
  private static final String BALANCED_INPUT =
      "{\"brokers\": \"1,2\", \"partitions\": {\"version\": 1, \"partitions\": ["
      + "{\"topic\": \"t1\", \"partition\": 0, \"replicas\": [1, 2]},"
      + "{\"topic\": \"t1\", \"partition\": 1, \"replicas\": [2, 1]}]}}";

  @Rule
  public TemporaryFolder _folder = new TemporaryFolder();
  private ByteArrayOutputStream _out;
  private String _configPath;

  @Before
  public void setUp() throws IOException {
    _out = new ByteArrayOutputStream();
    File config = _folder.newFile("reassign-optimizer.properties");
    Files.writeString(config.toPath(), String.format("%s=%s%n%s=QUIET%n", SolverConfig.SOLVER_CLASS_CONFIG,
                                                     BinaryBranchAndBoundSolver.class.getName(),
                                                     DiagnosticConfig.DIAGNOSTIC_VERBOSITY_CONFIG));
    _configPath = config.getAbsolutePath();
  }

  private int run(String input, String... args) {
    return ReassignOptimizerMain.run(args, new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                                     new PrintStream(_out, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return _out.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void testBalancedInputIsWrittenBack() {
    assertEquals(ReassignOptimizerMain.EXIT_OK, run(BALANCED_INPUT, _configPath));
    JsonObject document = JsonParser.parseString(output()).getAsJsonObject();
    assertEquals(1, document.get("version").getAsInt());
    assertEquals(2, document.getAsJsonArray("partitions").size());
  }

  @Test
  public void testDefaultConfigurationWithoutArguments() {
    assertEquals(ReassignOptimizerMain.EXIT_OK, run(BALANCED_INPUT));
    assertTrue(output().contains("\"version\":1"));
  }

  @Test
  public void testInvalidInput() {
    assertEquals(ReassignOptimizerMain.EXIT_INVALID_INPUT, run("{\"brokers\": \"1,2\"}", _configPath));
    assertEquals(ReassignOptimizerMain.EXIT_INVALID_INPUT, run("not json", _configPath));
    assertEquals("", output());
  }

  @Test
  public void testInfeasibleInput() {
    String input = "{\"brokers\": \"1,2\", \"new_replication_factor\": 3, \"partitions\": {\"partitions\": ["
                   + "{\"topic\": \"t1\", \"partition\": 0, \"replicas\": [1, 2]}]}}";
    assertEquals(ReassignOptimizerMain.EXIT_INFEASIBLE, run(input, _configPath));
    assertEquals("", output());
  }

  @Test
  public void testBadArguments() throws IOException {
    assertEquals(ReassignOptimizerMain.EXIT_INVALID_INPUT, run(BALANCED_INPUT, _configPath, _configPath));
    assertEquals(ReassignOptimizerMain.EXIT_INVALID_INPUT,
                 run(BALANCED_INPUT, new File(_folder.getRoot(), "missing.properties").getAbsolutePath()));

    File badConfig = _folder.newFile("bad.properties");
    Files.writeString(badConfig.toPath(), DiagnosticConfig.DIAGNOSTIC_VERBOSITY_CONFIG + "=LOUD\n");
    assertEquals(ReassignOptimizerMain.EXIT_INVALID_INPUT, run(BALANCED_INPUT, badConfig.getAbsolutePath()));
  }
}
