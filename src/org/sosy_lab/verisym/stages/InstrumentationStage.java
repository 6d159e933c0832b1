// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.specification.Property;
import org.sosy_lab.verisym.exceptions.PipelineStageException;

/**
 * Weaves the monitors of the checked properties into the program. Each property with a monitor is
 * instrumented in its own run of the instrumenter with its own monitor definition, so the monitors
 * of different properties do not share state. Properties without a monitor (e.g. reachability) are
 * checked by the back end directly.
 */
public final class InstrumentationStage {

  public static final String NAME = "instrument";

  private final RunConfig config;
  private final LogManager logger;
  private final ToolStep toolStep;

  public InstrumentationStage(RunConfig pConfig, LogManager pLogger, ToolStep pToolStep) {
    config = pConfig;
    logger = pLogger;
    toolStep = pToolStep;
  }

  public PipelineArtifact run(PipelineArtifact pInput)
      throws PipelineStageException, InterruptedException {
    PipelineArtifact current = pInput;

    for (Property property : config.getSpecification().getProperties()) {
      Optional<String> monitor = property.getMonitorName();
      if (!monitor.isPresent()) {
        continue;
      }
      String monitorName = monitor.orElseThrow();
      Path definition = config.getToolchain().getMonitorDefinition(monitorName);
      // checked when the configuration was created
      Preconditions.checkState(Files.isRegularFile(definition), "missing monitor %s", definition);

      Path output = TransformStage.withSuffix(current.getPath(), "." + monitorName + ".bc");
      toolStep.run(
          NAME,
          ImmutableList.<String>builder()
              .add(config.getToolchain().getInstrumenter())
              .add("--config=" + definition)
              .addAll(config.getInstrumentationFlags())
              .add("-o", output.toString(), current.getPath().toString())
              .build(),
          output);
      logger.logf(Level.FINE, "Instrumented monitor for %s", property);
      current =
          new PipelineArtifact(output, ArtifactRole.INSTRUMENTED_BITCODE, NAME + ":" + monitorName);
    }

    if (current == pInput) {
      logger.log(Level.FINE, "No property needs a monitor");
    }
    return current;
  }
}
