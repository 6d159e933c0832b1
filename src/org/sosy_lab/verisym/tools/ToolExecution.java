// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.ShutdownNotifier.ShutdownRequestListener;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.time.TimeSpan;
import org.sosy_lab.verisym.core.RunDeadline;

/**
 * Runs one external tool as a child process and collects its output.
 *
 * <p>The child is killed together with all its descendants as soon as a shutdown is requested on
 * the given {@link ShutdownNotifier} or the given deadline passes. In both cases the output of the
 * child is dropped and {@link InterruptedException} is thrown, so that incomplete output is never
 * interpreted as a result.
 */
public final class ToolExecution {

  private static final long OUTPUT_DRAIN_MILLIS = 5000;
  private static final long REAP_MILLIS = 2000;

  private final LogManager logger;
  private final ShutdownNotifier shutdownNotifier;
  private final Level outputLevel;

  /**
   * @param pLogOutput whether the output lines of the tools are logged at INFO instead of ALL
   */
  public ToolExecution(LogManager pLogger, ShutdownNotifier pShutdownNotifier, boolean pLogOutput) {
    logger = pLogger;
    shutdownNotifier = pShutdownNotifier;
    outputLevel = pLogOutput ? Level.INFO : Level.ALL;
  }

  /**
   * Run a command and wait until it terminates.
   *
   * @param pCommand the executable followed by its arguments
   * @param pWorkingDirectory working directory of the child process
   * @throws IOException if the process cannot be started or its output cannot be read
   * @throws InterruptedException if the run was cancelled or the deadline passed
   */
  public ToolOutput execute(
      List<String> pCommand,
      Path pWorkingDirectory,
      ToolEnvironment pEnvironment,
      RunDeadline pDeadline)
      throws IOException, InterruptedException {
    shutdownNotifier.shutdownIfNecessary();
    String name = Path.of(pCommand.get(0)).getFileName().toString();
    logger.log(Level.FINE, "Executing", Joiner.on(' ').join(pCommand));

    ProcessBuilder builder = new ProcessBuilder(pCommand).directory(pWorkingDirectory.toFile());
    pEnvironment.applyTo(builder.environment());
    Process process = builder.start();
    process.getOutputStream().close();

    ExecutorService readers =
        Executors.newFixedThreadPool(
            2,
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat(name + "-output-%d").build());
    ShutdownRequestListener killer = reason -> destroyProcessTree(process);
    try {
      Future<List<String>> stdout =
          readers.submit(() -> readLines(name, process.getInputStream()));
      Future<List<String>> stderr =
          readers.submit(() -> readLines(name, process.getErrorStream()));

      shutdownNotifier.registerAndCheckImmediately(killer);
      boolean terminated;
      try {
        terminated = waitFor(process, pDeadline);
      } catch (InterruptedException e) {
        if (!shutdownNotifier.shouldShutdown()) {
          // keep the interrupt visible to the caller
          Thread.currentThread().interrupt();
        }
        throw e;
      }
      shutdownNotifier.unregister(killer);

      if (!terminated) {
        destroyProcessTree(process);
        logger.logf(Level.INFO, "%s killed after reaching the time limit", name);
        throw new InterruptedException(name + " did not terminate before the time limit");
      }
      if (shutdownNotifier.shouldShutdown()) {
        logger.logf(Level.INFO, "%s killed on request", name);
        shutdownNotifier.shutdownIfNecessary();
      }

      ToolOutput output =
          new ToolOutput(process.exitValue(), drain(name, stdout), drain(name, stderr));
      logger.logf(Level.FINE, "%s terminated with %s", name, output);
      return output;

    } finally {
      shutdownNotifier.unregister(killer);
      if (process.isAlive()) {
        destroyProcessTree(process);
      }
      readers.shutdownNow();
    }
  }

  private static boolean waitFor(Process pProcess, RunDeadline pDeadline)
      throws InterruptedException {
    Optional<TimeSpan> remaining = pDeadline.getRemaining();
    if (remaining.isPresent()) {
      return pProcess.waitFor(remaining.orElseThrow().asNanos(), TimeUnit.NANOSECONDS);
    }
    pProcess.waitFor();
    return true;
  }

  private List<String> readLines(String pName, InputStream pStream) throws IOException {
    List<String> lines = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(pStream, Charset.defaultCharset()))) {
      String line;
      while ((line = reader.readLine()) != null) {
        logger.log(outputLevel, pName + ":", line);
        lines.add(line);
      }
    }
    return Collections.unmodifiableList(lines);
  }

  private static List<String> drain(String pName, Future<List<String>> pLines)
      throws IOException, InterruptedException {
    try {
      return pLines.get(OUTPUT_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new IOException("Reading the output of " + pName + " failed", e.getCause());
    } catch (TimeoutException e) {
      // a descendant of the tool still holds the output stream open
      throw new IOException("Output of " + pName + " was not closed after it terminated", e);
    }
  }

  /** Forcibly terminate the process and everything it started. */
  static void destroyProcessTree(Process pProcess) {
    // collected first, descendants are re-parented once the process is gone
    ImmutableList<ProcessHandle> descendants =
        pProcess.descendants().collect(ImmutableList.toImmutableList());
    descendants.forEach(ProcessHandle::destroyForcibly);
    pProcess.destroyForcibly();
    try {
      pProcess.waitFor(REAP_MILLIS, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
