// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.exceptions;

/** Execution trace file produced by a verifier cannot be read. */
public class TraceFormatException extends Exception {

  private static final long serialVersionUID = 6418190475029631773L;

  public TraceFormatException(String pMsg) {
    super(pMsg);
  }

  public TraceFormatException(String pMsg, Throwable pCause) {
    super(pMsg, pCause);
  }
}
