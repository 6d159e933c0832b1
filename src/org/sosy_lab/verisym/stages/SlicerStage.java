// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.exceptions.PipelineStageException;

/**
 * Removes the parts of the program that cannot influence reaching the slicing criteria.
 *
 * <p>The slicer runs up to {@code pipeline.slicing.repeat} times on its own output, because code
 * that became dead in one iteration may allow further cuts in the next. It stops as soon as an
 * iteration does not change the bitcode anymore.
 *
 * <p>If the slicer fails, the unsliced program is verified instead, unless {@code
 * pipeline.requireSlicer} is set, which makes the failure fatal.
 */
public final class SlicerStage {

  public static final String NAME = "slice";

  private final RunConfig config;
  private final LogManager logger;
  private final ToolStep toolStep;

  private int iterations = 0;
  private boolean fellBack = false;

  public SlicerStage(RunConfig pConfig, LogManager pLogger, ToolStep pToolStep) {
    config = pConfig;
    logger = pLogger;
    toolStep = pToolStep;
  }

  public PipelineArtifact run(PipelineArtifact pInput)
      throws PipelineStageException, InterruptedException {
    try {
      return slice(pInput);
    } catch (PipelineStageException e) {
      if (config.isSlicerRequired()) {
        throw e;
      }
      fellBack = true;
      logger.logUserException(
          Level.WARNING, e, "Slicing failed, verifying the unsliced program instead");
      return pInput;
    }
  }

  private PipelineArtifact slice(PipelineArtifact pInput)
      throws PipelineStageException, InterruptedException {
    PipelineArtifact current = pInput;
    String criteria = Joiner.on(',').join(config.getSlicingCriteria());

    for (int i = 1; i <= config.getSlicingRepeat(); i++) {
      Path output = TransformStage.withSuffix(pInput.getPath(), ".sliced" + i + ".bc");
      toolStep.run(
          NAME,
          ImmutableList.<String>builder()
              .add(config.getToolchain().getSlicer())
              .add("-c=" + criteria)
              .add("-pta=" + config.getPointsToMode().getSlicerArgument())
              .addAll(config.getSlicerFlags())
              .add("-o", output.toString(), current.getPath().toString())
              .build(),
          output);
      iterations = i;

      boolean fixedPoint = sameContent(current.getPath(), output);
      current = new PipelineArtifact(output, ArtifactRole.SLICED_BITCODE, NAME);
      if (fixedPoint) {
        logger.logf(Level.FINE, "Slicing reached a fixed point in iteration %d", i);
        break;
      }
      logger.logf(Level.FINE, "Slicing iteration %d changed the program", i);
    }
    return current;
  }

  private static boolean sameContent(Path pBefore, Path pAfter) throws PipelineStageException {
    try {
      return MoreFiles.asByteSource(pBefore).contentEquals(MoreFiles.asByteSource(pAfter));
    } catch (IOException e) {
      throw new PipelineStageException(NAME, "Cannot compare slicer results", e);
    }
  }

  /** Number of slicer runs that succeeded. */
  public int getIterations() {
    return iterations;
  }

  /** Whether the slicer failed and the unsliced program was forwarded. */
  public boolean hasFallenBack() {
    return fellBack;
  }
}
