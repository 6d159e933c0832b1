// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.exceptions;

/**
 * Witness could not be built, written, or read back. Never changes the verdict of the run it
 * belongs to.
 */
public class WitnessEncodingException extends Exception {

  private static final long serialVersionUID = -1527762349110963840L;

  public WitnessEncodingException(String pMsg) {
    super(pMsg);
  }

  public WitnessEncodingException(String pMsg, Throwable pCause) {
    super(pMsg, pCause);
  }
}
