// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.base.Ascii;

/** Precision of the points-to analysis the slicer uses. */
public enum PointsToMode {
  /** flow-sensitive */
  FS,
  /** flow-insensitive */
  FI,
  /** the slicer's legacy flow-insensitive analysis */
  OLD,
  ;

  /** Value of the slicer's {@code -pta} argument. */
  public String getSlicerArgument() {
    return Ascii.toLowerCase(name());
  }
}
