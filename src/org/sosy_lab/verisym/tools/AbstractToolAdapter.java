// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.specification.Property;
import org.sosy_lab.verisym.core.specification.PropertySpecification;
import org.sosy_lab.verisym.exceptions.TraceFormatException;
import org.sosy_lab.verisym.trace.ExecutionTrace;

/**
 * Base class for back ends that are a single executable: builds the command line, runs it, and
 * classifies the output with the grammar of the back end.
 */
abstract class AbstractToolAdapter implements ToolAdapter {

  protected final LogManager logger;
  private final ShutdownNotifier shutdownNotifier;

  protected AbstractToolAdapter(LogManager pLogger, ShutdownNotifier pShutdownNotifier) {
    logger = pLogger;
    shutdownNotifier = pShutdownNotifier;
  }

  /** Command line for verifying the given bitcode, starting with the executable. */
  protected abstract ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline);

  /**
   * Read the trace the back end wrote for a violation. The default implementation reports that
   * this back end does not write traces.
   */
  protected Optional<ExecutionTrace> readTrace(Path pWorkingDirectory)
      throws IOException, TraceFormatException {
    return Optional.empty();
  }

  @Override
  public final ToolRunResult run(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline)
      throws InterruptedException {
    Path workingDirectory = pBitcode.getPath().toAbsolutePath().getParent();
    ImmutableList<String> command = commandLine(pBitcode, pConfig, pDeadline);
    ToolEnvironment environment =
        prepareEnvironment(pConfig.getToolchain().getInstallDirectory(), pConfig);

    ToolOutput output;
    try {
      output =
          new ToolExecution(logger, shutdownNotifier, pConfig.isDebug())
              .execute(command, workingDirectory, environment, pDeadline);
    } catch (IOException e) {
      logger.logUserException(Level.WARNING, e, "Running " + name() + " failed");
      return new ToolRunResult(
          Verdict.error("cannot run " + name() + ": " + e.getMessage()), null, null);
    }

    Verdict verdict =
        checkViolatedProperty(verdictGrammar().classify(output), pConfig.getSpecification());
    logger.logf(Level.FINE, "Output of %s classified as %s", name(), verdict);

    ExecutionTrace trace = null;
    if (verdict.getKind() == Verdict.Kind.FALSE
        || verdict.getKind() == Verdict.Kind.ASSERTION_FAILED) {
      try {
        trace = readTrace(workingDirectory).orElse(null);
        if (trace == null) {
          logger.logf(Level.INFO, "%s did not produce an execution trace", name());
        }
      } catch (IOException | TraceFormatException e) {
        logger.logUserException(Level.WARNING, e, "Cannot read execution trace of " + name());
      }
    }
    return new ToolRunResult(verdict, output, trace);
  }

  /**
   * A violation counts only for a property that is checked in this run. A violation of an unknown
   * or unchecked property is reported as unknown. A violation of a property that implies a checked
   * one is reported for the checked property.
   */
  static Verdict checkViolatedProperty(Verdict pVerdict, PropertySpecification pSpecification) {
    if (pVerdict.getKind() != Verdict.Kind.FALSE) {
      return pVerdict;
    }
    String label = pVerdict.getViolatedProperty().orElseThrow();
    Optional<Property> property = Property.forCanonicalName(label);
    if (!property.isPresent()) {
      return Verdict.unknown("violation of unknown property " + label);
    }
    if (pSpecification.contains(property.orElseThrow())) {
      return Verdict.violated(property.orElseThrow().getCanonicalName());
    }
    Optional<Property> implied = property.orElseThrow().getImpliedProperty();
    if (implied.isPresent() && pSpecification.contains(implied.orElseThrow())) {
      return Verdict.violated(implied.orElseThrow().getCanonicalName());
    }
    return Verdict.unknown("violation of unchecked property " + label);
  }

  @Override
  public String toString() {
    return name();
  }
}
