// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.stages.transform.SourceText;

/** A source file given by the user together with its normalized version. */
public final class NormalizedSource {

  private final Path original;
  private final ImmutableList<String> originalLines;
  private final SourceText normalized;
  private final PipelineArtifact artifact;

  public NormalizedSource(
      Path pOriginal,
      ImmutableList<String> pOriginalLines,
      SourceText pNormalized,
      PipelineArtifact pArtifact) {
    original = pOriginal;
    originalLines = pOriginalLines;
    normalized = pNormalized;
    artifact = pArtifact;
  }

  public Path getOriginal() {
    return original;
  }

  /** Lines of the original file, without line terminators. */
  public ImmutableList<String> getOriginalLines() {
    return originalLines;
  }

  public SourceText getNormalized() {
    return normalized;
  }

  /** The normalized file in the working directory. */
  public PipelineArtifact getArtifact() {
    return artifact;
  }
}
