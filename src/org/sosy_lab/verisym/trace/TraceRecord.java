// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.trace;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** One program point visited by an execution. */
@Immutable
public final class TraceRecord {

  private final int line;
  private final @Nullable String assumption;
  private final @Nullable BranchDirection control;

  public TraceRecord(int pLine, @Nullable String pAssumption, @Nullable BranchDirection pControl) {
    Preconditions.checkArgument(pLine > 0, "line numbers start at 1, got %s", pLine);
    line = pLine;
    assumption = pAssumption;
    control = pControl;
  }

  public static TraceRecord atLine(int pLine) {
    return new TraceRecord(pLine, null, null);
  }

  /** Source line in the coordinates of the normalized source file. */
  public int getLine() {
    return line;
  }

  /** Value assignment that holds after this point, e.g. {@code x == 5}. */
  public Optional<String> getAssumption() {
    return Optional.ofNullable(assumption);
  }

  public Optional<BranchDirection> getControl() {
    return Optional.ofNullable(control);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof TraceRecord)) {
      return false;
    }
    TraceRecord other = (TraceRecord) pObj;
    return line == other.line
        && Objects.equals(assumption, other.assumption)
        && control == other.control;
  }

  @Override
  public int hashCode() {
    return Objects.hash(line, assumption, control);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("line", line)
        .add("assumption", assumption)
        .add("control", control)
        .omitNullValues()
        .toString();
  }
}
