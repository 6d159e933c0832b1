// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.base.Preconditions;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.trace.ExecutionTrace;

/** Verdict of a back-end run together with the raw output it was derived from. */
public final class ToolRunResult {

  private final Verdict verdict;
  private final @Nullable ToolOutput rawOutput;
  private final @Nullable ExecutionTrace trace;

  public ToolRunResult(
      Verdict pVerdict, @Nullable ToolOutput pRawOutput, @Nullable ExecutionTrace pTrace) {
    verdict = Preconditions.checkNotNull(pVerdict);
    rawOutput = pRawOutput;
    trace = pTrace;
  }

  public Verdict getVerdict() {
    return verdict;
  }

  /** Output of the back end, empty if it could not be started. */
  public Optional<ToolOutput> getRawOutput() {
    return Optional.ofNullable(rawOutput);
  }

  /** Path to the property violation, if the back end reported one. */
  public Optional<ExecutionTrace> getTrace() {
    return Optional.ofNullable(trace);
  }
}
