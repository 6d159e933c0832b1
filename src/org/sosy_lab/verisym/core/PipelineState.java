// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * States of a verification run. Every state except the terminal ones may move to {@link
 * #ABORTED}.
 */
public enum PipelineState {
  INIT,
  TRANSFORM,
  SLICE,
  INSTRUMENT,
  LINK,
  EXECUTE,
  CLASSIFY,
  WITNESS,
  DONE,
  ABORTED,
  ;

  /** States that may directly follow this one. */
  public ImmutableSet<PipelineState> getSuccessors() {
    switch (this) {
      case INIT:
        return Sets.immutableEnumSet(TRANSFORM, ABORTED);
      case TRANSFORM:
        return Sets.immutableEnumSet(SLICE, INSTRUMENT, ABORTED);
      case SLICE:
        return Sets.immutableEnumSet(INSTRUMENT, ABORTED);
      case INSTRUMENT:
        return Sets.immutableEnumSet(LINK, ABORTED);
      case LINK:
        // DONE if verification is disabled
        return Sets.immutableEnumSet(EXECUTE, DONE, ABORTED);
      case EXECUTE:
        return Sets.immutableEnumSet(CLASSIFY, ABORTED);
      case CLASSIFY:
        return Sets.immutableEnumSet(WITNESS, DONE, ABORTED);
      case WITNESS:
        return Sets.immutableEnumSet(DONE, ABORTED);
      case DONE:
      case ABORTED:
        return ImmutableSet.of();
      default:
        throw new AssertionError("unhandled state " + this);
    }
  }

  public boolean isTerminal() {
    return this == DONE || this == ABORTED;
  }
}
