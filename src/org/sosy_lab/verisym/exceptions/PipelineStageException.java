// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.exceptions;

import com.google.common.base.Preconditions;

/**
 * Fatal failure of one pipeline stage. A run that hits this exception is aborted before a verdict
 * is reached.
 */
public class PipelineStageException extends Exception {

  private static final long serialVersionUID = -3117468092561530962L;

  private final String stageName;

  public PipelineStageException(String pStageName, String pMsg) {
    super(pMsg);
    stageName = Preconditions.checkNotNull(pStageName);
  }

  public PipelineStageException(String pStageName, String pMsg, Throwable pCause) {
    super(pMsg, pCause);
    stageName = Preconditions.checkNotNull(pStageName);
  }

  public String getStageName() {
    return stageName;
  }

  @Override
  public String getMessage() {
    return stageName + ": " + super.getMessage();
  }
}
