// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.exceptions.PipelineStageException;

/** Links the runtime libraries to the program and optimizes the result. */
public final class LinkStage {

  public static final String NAME = "link";

  private final RunConfig config;
  private final ToolStep toolStep;

  public LinkStage(RunConfig pConfig, ToolStep pToolStep) {
    config = pConfig;
    toolStep = pToolStep;
  }

  public PipelineArtifact run(PipelineArtifact pInput)
      throws PipelineStageException, InterruptedException {
    Path linked = TransformStage.withSuffix(pInput.getPath(), ".linked.bc");
    toolStep.run(
        NAME,
        ImmutableList.<String>builder()
            .add(config.getToolchain().getLlvmLink())
            .addAll(config.getLinkFlags())
            .add("-o", linked.toString(), pInput.getPath().toString())
            .addAll(config.getToolchain().getLibraries().stream().map(Path::toString).iterator())
            .build(),
        linked);
    PipelineArtifact result = new PipelineArtifact(linked, ArtifactRole.LINKED_BITCODE, NAME);

    if (config.isOptimizationEnabled()) {
      Path optimized = TransformStage.withSuffix(pInput.getPath(), ".opt.bc");
      toolStep.run(
          NAME,
          ImmutableList.<String>builder()
              .add(config.getToolchain().getOpt())
              .addAll(config.getOptimizeFlags())
              .add("-o", optimized.toString(), linked.toString())
              .build(),
          optimized);
      result = new PipelineArtifact(optimized, ArtifactRole.OPTIMIZED_BITCODE, NAME);
    }
    return result;
  }
}
