// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import java.util.Optional;

public enum WitnessType {
  /** Describes a path to a property violation. */
  VIOLATION("violation_witness"),
  /** States that the properties of the run hold. */
  CORRECTNESS("correctness_witness");

  private final String graphMlName;

  WitnessType(String pGraphMlName) {
    graphMlName = pGraphMlName;
  }

  public String getGraphMlName() {
    return graphMlName;
  }

  public static Optional<WitnessType> fromGraphMlName(String pName) {
    for (WitnessType type : values()) {
      if (type.graphMlName.equals(pName)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
