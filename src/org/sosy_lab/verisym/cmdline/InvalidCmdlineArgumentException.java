// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.cmdline;

/** Exception for syntax errors on the command line. */
public class InvalidCmdlineArgumentException extends Exception {

  private static final long serialVersionUID = -6526968677815416436L;

  InvalidCmdlineArgumentException(String pMsg) {
    super(pMsg);
  }
}
