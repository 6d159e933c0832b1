// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.time.TimeSpan;
import org.sosy_lab.verisym.exceptions.PipelineStageException;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.sosy_lab.verisym.stages.InstrumentationStage;
import org.sosy_lab.verisym.stages.LinkStage;
import org.sosy_lab.verisym.stages.SlicerStage;
import org.sosy_lab.verisym.stages.ToolStep;
import org.sosy_lab.verisym.stages.TransformStage;
import org.sosy_lab.verisym.tools.ToolAdapter;
import org.sosy_lab.verisym.tools.ToolAdapters;
import org.sosy_lab.verisym.tools.ToolRunResult;
import org.sosy_lab.verisym.witness.WitnessExporter;

/**
 * Runs the stages of one verification run in sequence and classifies its outcome.
 *
 * <p>The run moves through the states of {@link PipelineState}. Configuration errors and fatal
 * stage errors end it in {@link PipelineState#ABORTED} with a failure message. If the time limit
 * passes or a shutdown is requested by the parent notifier, the running tool is killed and the run
 * ends in {@link PipelineState#ABORTED} with a TIMEOUT verdict. All other outcomes of the back end,
 * including crashes, end in {@link PipelineState#DONE}.
 *
 * <p>Each instance performs a single run in its own temporary working directory. Runs in separate
 * instances are independent.
 */
public final class VerificationPipeline {

  private final Configuration config;
  private final LogManager logger;
  private final ShutdownManager shutdownManager;

  private final PipelineStatistics stats = new PipelineStatistics();
  private final List<PipelineState> history = new ArrayList<>();
  private PipelineState state = PipelineState.INIT;
  private boolean used = false;

  public VerificationPipeline(
      Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier) {
    config = pConfig;
    logger = pLogger;
    shutdownManager = ShutdownManager.createWithParent(pShutdownNotifier);
  }

  public PipelineResult run(List<String> pPrograms) {
    checkState(!used, "a pipeline can only be run once");
    used = true;
    history.add(state);
    stats.enter(state);

    RunConfig runConfig;
    ToolAdapter adapter;
    try {
      runConfig = new RunConfig(config, pPrograms);
      adapter =
          ToolAdapters.create(
              runConfig.getVerifier(), config, logger, shutdownManager.getNotifier());
    } catch (InvalidConfigurationException e) {
      logger.logUserException(Level.SEVERE, e, "Invalid configuration");
      return abort(null, e.getMessage(), null);
    }

    Path workingDirectory;
    try {
      workingDirectory = Files.createTempDirectory("verisym-");
    } catch (IOException e) {
      logger.logUserException(Level.SEVERE, e, "Cannot create working directory");
      return abort(null, "cannot create working directory: " + e.getMessage(), null);
    }
    logger.log(Level.FINE, "Working directory is", workingDirectory);

    RunDeadline deadline = RunDeadline.after(runConfig.getTimeout());
    @Nullable ScheduledExecutorService deadlineTimer = startDeadlineTimer(deadline);
    try {
      return execute(runConfig, adapter, workingDirectory, deadline);
    } finally {
      if (deadlineTimer != null) {
        deadlineTimer.shutdownNow();
      }
      cleanUp(runConfig, workingDirectory);
      logStatistics();
    }
  }

  private PipelineResult execute(
      RunConfig pRunConfig, ToolAdapter pAdapter, Path pWorkingDirectory, RunDeadline pDeadline) {
    ShutdownNotifier notifier = shutdownManager.getNotifier();
    ToolStep toolStep = new ToolStep(pRunConfig, logger, notifier, pWorkingDirectory, pDeadline);
    @Nullable PipelineArtifact bitcode = null;

    try {
      enter(PipelineState.TRANSFORM);
      TransformStage.Result transformed = new TransformStage(pRunConfig, logger, toolStep).run();
      PipelineArtifact current = transformed.getBitcode();

      if (pRunConfig.isSlicingEnabled()) {
        enter(PipelineState.SLICE);
        SlicerStage slicer = new SlicerStage(pRunConfig, logger, toolStep);
        current = slicer.run(current);
        stats.setSlicing(slicer.getIterations(), slicer.hasFallenBack());
      }

      enter(PipelineState.INSTRUMENT);
      current = new InstrumentationStage(pRunConfig, logger, toolStep).run(current);

      enter(PipelineState.LINK);
      bitcode = new LinkStage(pRunConfig, toolStep).run(current);

      if (!pRunConfig.isVerificationEnabled()) {
        logger.log(Level.INFO, "Verification disabled, final bitcode is", bitcode.getPath());
        moveTo(PipelineState.DONE);
        return result(null, null, bitcode, null);
      }

      enter(PipelineState.EXECUTE);
      logger.logf(Level.INFO, "Running %s on %s", pAdapter.name(), bitcode.getPath());
      ToolRunResult run;
      try {
        run = pAdapter.run(bitcode, pRunConfig, pDeadline);
      } catch (IOException e) {
        logger.logUserException(Level.WARNING, e, "Back end " + pAdapter.name() + " failed");
        run =
            new ToolRunResult(Verdict.error("cannot run back end: " + e.getMessage()), null, null);
      }
      // output of a killed back end is never a verdict
      notifier.shutdownIfNecessary();

      enter(PipelineState.CLASSIFY);
      Verdict verdict = run.getVerdict();
      logger.log(Level.INFO, "Verification result:", verdict.getResultString());

      @Nullable Path witness = null;
      if (verdict.getKind().hasWitness() && pRunConfig.getWitnessFile().isPresent()) {
        enter(PipelineState.WITNESS);
        witness = writeWitness(pRunConfig, verdict, run, transformed);
      }

      moveTo(PipelineState.DONE);
      return result(verdict, null, bitcode, witness);

    } catch (PipelineStageException e) {
      logger.logUserException(Level.SEVERE, e, "Stage " + e.getStageName() + " failed");
      return abort(Verdict.error(e.getMessage()), e.getMessage(), bitcode);

    } catch (InterruptedException e) {
      String reason = cancellationReason(pRunConfig, pDeadline);
      logger.log(Level.WARNING, "Run cancelled in state", state, "(" + reason + ")");
      return abort(Verdict.timeout(reason), null, bitcode);
    }
  }

  private @Nullable Path writeWitness(
      RunConfig pRunConfig,
      Verdict pVerdict,
      ToolRunResult pRun,
      TransformStage.Result pTransformed) {
    try {
      // traces refer to the first source file
      Optional<Path> file =
          new WitnessExporter(pRunConfig, logger)
              .export(pVerdict, pRun.getTrace(), pTransformed.getSources().get(0));
      return file.orElse(null);
    } catch (WitnessEncodingException e) {
      logger.logUserException(Level.WARNING, e, "Could not write witness");
      return null;
    }
  }

  private @Nullable ScheduledExecutorService startDeadlineTimer(RunDeadline pDeadline) {
    Optional<TimeSpan> remaining = pDeadline.getRemaining();
    if (!remaining.isPresent()) {
      return null;
    }
    ScheduledExecutorService timer =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("verisym-deadline-%d")
                .build());
    timer.schedule(
        () -> shutdownManager.requestShutdown("time limit reached"),
        remaining.orElseThrow().asMillis(),
        TimeUnit.MILLISECONDS);
    return timer;
  }

  private String cancellationReason(RunConfig pRunConfig, RunDeadline pDeadline) {
    if (pDeadline.isExpired()) {
      return "time limit of " + pRunConfig.getTimeout().formatAs(TimeUnit.SECONDS) + " reached";
    }
    ShutdownNotifier notifier = shutdownManager.getNotifier();
    return notifier.shouldShutdown() ? notifier.getReason() : "cancelled";
  }

  /** Check for cancellation and move to the next working state. */
  private void enter(PipelineState pNext) throws InterruptedException {
    shutdownManager.getNotifier().shutdownIfNecessary();
    moveTo(pNext);
  }

  private void moveTo(PipelineState pNext) {
    checkState(
        state.getSuccessors().contains(pNext), "illegal transition from %s to %s", state, pNext);
    logger.log(Level.INFO, "Pipeline state", pNext);
    state = pNext;
    history.add(pNext);
    stats.enter(pNext);
  }

  private PipelineResult abort(
      @Nullable Verdict pVerdict, @Nullable String pFailure, @Nullable PipelineArtifact pBitcode) {
    moveTo(PipelineState.ABORTED);
    return result(pVerdict, pFailure, pBitcode, null);
  }

  private PipelineResult result(
      @Nullable Verdict pVerdict,
      @Nullable String pFailure,
      @Nullable PipelineArtifact pBitcode,
      @Nullable Path pWitness) {
    return new PipelineResult(
        ImmutableList.copyOf(history), pVerdict, pFailure, pBitcode, pWitness, stats);
  }

  private void cleanUp(RunConfig pRunConfig, Path pWorkingDirectory) {
    if (pRunConfig.isSaveFiles()) {
      logger.log(Level.INFO, "Intermediate files are kept in", pWorkingDirectory);
      return;
    }
    try {
      MoreFiles.deleteRecursively(pWorkingDirectory, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      logger.logUserException(
          Level.WARNING, e, "Could not delete working directory " + pWorkingDirectory);
    }
  }

  private void logStatistics() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
      stats.printStatistics(out);
    }
    logger.log(Level.FINE, "Statistics of the run:\n" + buffer.toString(StandardCharsets.UTF_8));
  }
}
