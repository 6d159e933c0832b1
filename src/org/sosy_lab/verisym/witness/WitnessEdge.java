// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.trace.BranchDirection;

/** Annotation of a witness edge. Line numbers refer to the original source file. */
@Immutable
public final class WitnessEdge {

  private final int startLine;
  private final @Nullable String assumption;
  private final @Nullable BranchDirection control;
  private final @Nullable String sourceCode;

  public WitnessEdge(
      int pStartLine,
      @Nullable String pAssumption,
      @Nullable BranchDirection pControl,
      @Nullable String pSourceCode) {
    Preconditions.checkArgument(pStartLine > 0, "line numbers start at 1, got %s", pStartLine);
    startLine = pStartLine;
    assumption = pAssumption;
    control = pControl;
    sourceCode = pSourceCode;
  }

  public int getStartLine() {
    return startLine;
  }

  public Optional<String> getAssumption() {
    return Optional.ofNullable(assumption);
  }

  public Optional<BranchDirection> getControl() {
    return Optional.ofNullable(control);
  }

  /** Text of the original source line, if requested for the witness. */
  public Optional<String> getSourceCode() {
    return Optional.ofNullable(sourceCode);
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof WitnessEdge)) {
      return false;
    }
    WitnessEdge other = (WitnessEdge) pObj;
    return startLine == other.startLine
        && Objects.equals(assumption, other.assumption)
        && control == other.control
        && Objects.equals(sourceCode, other.sourceCode);
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, assumption, control, sourceCode);
  }

  @Override
  public String toString() {
    return "line " + startLine + (control == null ? "" : " " + control.getTraceName());
  }
}
