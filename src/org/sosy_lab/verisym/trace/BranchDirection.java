// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.trace;

import java.util.Optional;

/** Branch of a conditional that an execution took. */
public enum BranchDirection {
  THEN("then", "condition-true"),
  ELSE("else", "condition-false"),
  ;

  private final String traceName;
  private final String witnessValue;

  BranchDirection(String pTraceName, String pWitnessValue) {
    traceName = pTraceName;
    witnessValue = pWitnessValue;
  }

  /** Spelling in execution trace files. */
  public String getTraceName() {
    return traceName;
  }

  /** Value of the {@code control} attribute of witness edges. */
  public String getWitnessValue() {
    return witnessValue;
  }

  public static Optional<BranchDirection> fromTraceName(String pName) {
    for (BranchDirection direction : values()) {
      if (direction.traceName.equals(pName)) {
        return Optional.of(direction);
      }
    }
    return Optional.empty();
  }

  public static Optional<BranchDirection> fromWitnessValue(String pValue) {
    for (BranchDirection direction : values()) {
      if (direction.witnessValue.equals(pValue)) {
        return Optional.of(direction);
      }
    }
    return Optional.empty();
  }
}
