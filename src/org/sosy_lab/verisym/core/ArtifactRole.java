// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

/** Logical role of an intermediate file of a run. */
public enum ArtifactRole {
  SOURCE("c"),
  NORMALIZED_SOURCE("c"),
  COMPILED_BITCODE("bc"),
  SLICED_BITCODE("bc"),
  INSTRUMENTED_BITCODE("bc"),
  LINKED_BITCODE("bc"),
  OPTIMIZED_BITCODE("bc"),
  ;

  private final String fileExtension;

  ArtifactRole(String pFileExtension) {
    fileExtension = pFileExtension;
  }

  public String getFileExtension() {
    return fileExtension;
  }

  public boolean isBitcode() {
    return fileExtension.equals("bc");
  }
}
