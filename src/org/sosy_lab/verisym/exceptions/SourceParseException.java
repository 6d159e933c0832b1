// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.exceptions;

/** Malformed C input found by a source transform. */
public class SourceParseException extends PipelineStageException {

  private static final long serialVersionUID = 2034710922640318211L;

  private final int line;

  public SourceParseException(String pTransformName, int pLine, String pMsg) {
    super(pTransformName, "line " + pLine + ": " + pMsg);
    line = pLine;
  }

  /** The line (in the input of the failing transform) where the problem was detected. */
  public int getLine() {
    return line;
  }
}
