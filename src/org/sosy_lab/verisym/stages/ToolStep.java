// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;
import org.sosy_lab.verisym.exceptions.PipelineStageException;
import org.sosy_lab.verisym.tools.ToolEnvironment;
import org.sosy_lab.verisym.tools.ToolExecution;
import org.sosy_lab.verisym.tools.ToolOutput;

/**
 * Runs the external tools of the pipeline stages (compiler, optimizer, linker, slicer,
 * instrumenter) in the working directory of a run. A step succeeds if the tool exits with code 0
 * and writes a non-empty output file.
 */
public final class ToolStep {

  private static final int REPORTED_ERROR_LINES = 5;

  private final ToolExecution execution;
  private final ToolEnvironment environment;
  private final Path workingDirectory;
  private final RunDeadline deadline;

  public ToolStep(
      RunConfig pConfig,
      LogManager pLogger,
      ShutdownNotifier pShutdownNotifier,
      Path pWorkingDirectory,
      RunDeadline pDeadline) {
    execution = new ToolExecution(pLogger, pShutdownNotifier, pConfig.isDebug());
    workingDirectory = pWorkingDirectory;
    deadline = pDeadline;
    environment =
        pConfig
            .getToolchain()
            .getInstallDirectory()
            .map(
                base ->
                    ToolEnvironment.builder()
                        .addExecutableDirectory(base.resolve("bin"))
                        .addLibraryDirectory(base.resolve("lib"))
                        .build())
            .orElse(ToolEnvironment.empty());
  }

  public Path getWorkingDirectory() {
    return workingDirectory;
  }

  /**
   * Run a tool that has to produce the given output file.
   *
   * @throws PipelineStageException if the tool cannot be run, fails, or writes no output
   * @throws InterruptedException if the run was cancelled
   */
  public Path run(String pStage, List<String> pCommand, Path pOutput)
      throws PipelineStageException, InterruptedException {
    String tool = Path.of(pCommand.get(0)).getFileName().toString();
    ToolOutput output;
    try {
      output = execution.execute(pCommand, workingDirectory, environment, deadline);
    } catch (IOException e) {
      throw new PipelineStageException(pStage, "Cannot run " + tool + ": " + e.getMessage(), e);
    }

    if (output.getExitCode() != 0) {
      List<String> errors = output.getStderr();
      throw new PipelineStageException(
          pStage,
          String.format(
              "%s failed with exit code %d%s",
              tool,
              output.getExitCode(),
              errors.isEmpty()
                  ? ""
                  : ": "
                      + Joiner.on(" | ")
                          .join(
                              Iterables.skip(
                                  errors, Math.max(0, errors.size() - REPORTED_ERROR_LINES)))));
    }
    try {
      if (!Files.isRegularFile(pOutput) || Files.size(pOutput) == 0) {
        throw new PipelineStageException(pStage, tool + " did not write " + pOutput.getFileName());
      }
    } catch (IOException e) {
      throw new PipelineStageException(pStage, "Cannot access output of " + tool, e);
    }
    return pOutput;
  }
}
