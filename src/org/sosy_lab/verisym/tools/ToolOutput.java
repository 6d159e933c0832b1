// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/** Everything a terminated child process wrote, and its exit code. */
@Immutable
public final class ToolOutput {

  private final int exitCode;
  private final ImmutableList<String> stdout;
  private final ImmutableList<String> stderr;

  public ToolOutput(int pExitCode, List<String> pStdout, List<String> pStderr) {
    exitCode = pExitCode;
    stdout = ImmutableList.copyOf(pStdout);
    stderr = ImmutableList.copyOf(pStderr);
  }

  public int getExitCode() {
    return exitCode;
  }

  public ImmutableList<String> getStdout() {
    return stdout;
  }

  public ImmutableList<String> getStderr() {
    return stderr;
  }

  /** Lines of stdout followed by lines of stderr. */
  public Iterable<String> getAllLines() {
    return Iterables.concat(stdout, stderr);
  }

  @Override
  public String toString() {
    return String.format(
        "exit code %d, %d lines of output, %d lines of errors",
        exitCode, stdout.size(), stderr.size());
  }
}
