// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.nio.file.Path;

/**
 * A file produced by one stage of the pipeline. Artifacts are never modified after they were
 * produced; a stage that changes the program writes a new artifact.
 */
@Immutable
public final class PipelineArtifact {

  @SuppressWarnings("Immutable") // Path is immutable
  private final Path path;

  private final ArtifactRole role;
  private final String producer;

  public PipelineArtifact(Path pPath, ArtifactRole pRole, String pProducer) {
    path = Preconditions.checkNotNull(pPath);
    role = Preconditions.checkNotNull(pRole);
    producer = Preconditions.checkNotNull(pProducer);
  }

  /** Artifact for an input file given by the user. */
  public static PipelineArtifact source(Path pPath) {
    return new PipelineArtifact(pPath, ArtifactRole.SOURCE, "user");
  }

  public Path getPath() {
    return path;
  }

  public ArtifactRole getRole() {
    return role;
  }

  /** Name of the stage or step that wrote this artifact. */
  public String getProducer() {
    return producer;
  }

  @Override
  public boolean equals(Object pObj) {
    if (!(pObj instanceof PipelineArtifact)) {
      return false;
    }
    PipelineArtifact other = (PipelineArtifact) pObj;
    return path.equals(other.path) && role == other.role && producer.equals(other.producer);
  }

  @Override
  public int hashCode() {
    return path.hashCode() * 31 + role.hashCode();
  }

  @Override
  public String toString() {
    return role + " " + path + " (by " + producer + ")";
  }
}
