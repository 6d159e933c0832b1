// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.trace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.sosy_lab.verisym.exceptions.TraceFormatException;

/**
 * Reads execution traces written by verification back ends. The format has one record per line:
 *
 * <pre>
 * &lt;line&gt; [assumption=&lt;text&gt;] [control=then|else]
 * </pre>
 *
 * <p>Empty lines and lines starting with {@code #} are ignored.
 */
public final class ExecutionTraceParser {

  private static final Pattern RECORD =
      Pattern.compile(
          "^(?<line>\\S+)(?:\\s+assumption=(?<assumption>.*?))?"
              + "(?:\\s+control=(?<control>\\S+))?\\s*$");

  private ExecutionTraceParser() {}

  public static ExecutionTrace parse(Path pFile) throws TraceFormatException, IOException {
    List<String> lines = Files.readAllLines(pFile, StandardCharsets.UTF_8);
    try {
      return parse(lines);
    } catch (TraceFormatException e) {
      throw new TraceFormatException("Invalid trace file " + pFile + ": " + e.getMessage(), e);
    }
  }

  public static ExecutionTrace parse(List<String> pLines) throws TraceFormatException {
    List<TraceRecord> records = new ArrayList<>();
    int lineNumber = 0;
    for (String rawLine : pLines) {
      lineNumber++;
      String line = rawLine.strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      records.add(parseRecord(line, lineNumber));
    }
    if (records.isEmpty()) {
      throw new TraceFormatException("Execution trace is empty");
    }
    return new ExecutionTrace(records);
  }

  private static TraceRecord parseRecord(String pLine, int pLineNumber)
      throws TraceFormatException {
    Matcher matcher = RECORD.matcher(pLine);
    if (!matcher.matches()) {
      throw new TraceFormatException(
          String.format("Line %d: unexpected content '%s'", pLineNumber, pLine));
    }

    int sourceLine;
    try {
      sourceLine = Integer.parseInt(matcher.group("line"));
    } catch (NumberFormatException e) {
      throw new TraceFormatException(
          String.format(
              "Line %d: '%s' is not a source line number", pLineNumber, matcher.group("line")),
          e);
    }
    if (sourceLine <= 0) {
      throw new TraceFormatException(
          String.format("Line %d: source line %d is not positive", pLineNumber, sourceLine));
    }

    String assumption = matcher.group("assumption");
    if (assumption != null && assumption.isEmpty()) {
      throw new TraceFormatException(
          String.format("Line %d: empty assumption", pLineNumber));
    }

    BranchDirection control = null;
    String controlName = matcher.group("control");
    if (controlName != null) {
      control =
          BranchDirection.fromTraceName(controlName)
              .orElseThrow(
                  () ->
                      new TraceFormatException(
                          String.format(
                              "Line %d: unknown branch direction '%s'",
                              pLineNumber, controlName)));
    }
    return new TraceRecord(sourceLine, assumption, control);
  }
}
