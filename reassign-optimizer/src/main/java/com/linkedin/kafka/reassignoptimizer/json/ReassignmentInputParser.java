/*
 * Copyright 2024 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.kafka.reassignoptimizer.json;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.linkedin.kafka.reassignoptimizer.exception.InvalidInputException;
import java.io.Reader;


/**
 * Parses the input document into a {@link ReassignmentInput}.
 */
public final class ReassignmentInputParser {

  private ReassignmentInputParser() {

  }

  /**
   * @param reader Reader of the input document.
   * @return The parsed input.
   * @throws InvalidInputException If the document is not valid JSON, is empty, or has fields of the wrong type.
   */
  public static ReassignmentInput parse(Reader reader) throws InvalidInputException {
    ReassignmentInput input;
    try {
      Gson gson = new Gson();
      input = gson.fromJson(reader, ReassignmentInput.class);
    } catch (JsonParseException e) {
      throw new InvalidInputException(String.format("Malformed input document: %s", e.getMessage()), e);
    }
    if (input == null) {
      throw new InvalidInputException("The input document is empty.");
    }
    return input;
  }
}
