// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;
import org.sosy_lab.verisym.core.Verdict.Kind;
import org.sosy_lab.verisym.exceptions.TraceFormatException;
import org.sosy_lab.verisym.trace.ExecutionTrace;
import org.sosy_lab.verisym.trace.ExecutionTraceParser;

/**
 * The symbolic executor KLEE, the primary back end. KLEE writes one test case per explored error
 * into its output directory; the trace of the first error is used for the witness.
 */
@Options(prefix = "verifier.klee")
public final class KleeAdapter extends AbstractToolAdapter {

  static final String NAME = "klee";

  private static final Pattern ERROR_TEST = Pattern.compile("(test\\d+)\\.(?:[\\w.]+\\.)?err");

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .violation("KLEE: ERROR: .*ASSERTION FAIL: verifier assertion failed", "REACHCALL")
          .violation("KLEE: ERROR: .*memory error: out of bound pointer", "VALID-DEREF")
          .violation("KLEE: ERROR: .*memory error: null pointer exception", "NULL-DEREF")
          .violation(
              "KLEE: ERROR: .*(?:memory error: invalid pointer: free|double free|free of)",
              "VALID-FREE")
          .violation("KLEE: ERROR: .*memory error: memory leak", "MEM-TRACK")
          .violation("KLEE: ERROR: .*overflow", "SIGNED-OVERFLOW")
          .rule("KLEE: ERROR: .*ASSERTION FAIL", Kind.ASSERTION_FAILED)
          .rule("KLEE: ERROR: .*abort failure", Kind.ASSERTION_FAILED)
          .rule("KLEE: HaltTimer invoked", Kind.UNKNOWN)
          .rule("KLEE: ERROR: ", Kind.UNKNOWN)
          .rule("KLEE: done: total instructions", Kind.TRUE)
          .build();

  @Option(secure = true, description = "KLEE executable")
  private String executable = "klee";

  @Option(secure = true, description = "C library model linked by KLEE")
  private String libc = "klee";

  @Option(
      secure = true,
      description = "directory for the test cases of KLEE, relative to the working directory")
  private String outputDirectory = "klee-out";

  KleeAdapter(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    super(pLogger, pShutdownNotifier);
    pConfig.inject(this);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String requiredToolVersion() {
    return "3.4";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    if (!pBaseDir.isPresent()) {
      return ToolEnvironment.empty();
    }
    Path base = pBaseDir.orElseThrow();
    return ToolEnvironment.builder()
        .addExecutableDirectory(base.resolve("bin"))
        .addLibraryDirectory(base.resolve("lib"))
        .setVariable(
            "KLEE_RUNTIME_LIBRARY_PATH",
            base.resolve("lib").resolve("klee").resolve("runtime").toString())
        .build();
  }

  @Override
  public VerdictGrammar verdictGrammar() {
    return GRAMMAR;
  }

  @Override
  protected ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline) {
    ImmutableList.Builder<String> cmd = ImmutableList.builder();
    cmd.add(executable);
    cmd.add("-output-dir=" + outputDirectory);
    cmd.add("-libc=" + libc);
    cmd.add("-exit-on-error");
    pDeadline.getRemainingSeconds().ifPresent(s -> cmd.add("-max-time=" + s));
    cmd.addAll(pConfig.getVerifierFlags());
    cmd.add(pBitcode.getPath().getFileName().toString());
    return cmd.build();
  }

  @Override
  protected Optional<ExecutionTrace> readTrace(Path pWorkingDirectory)
      throws IOException, TraceFormatException {
    Path testDirectory = pWorkingDirectory.resolve(outputDirectory);
    if (!Files.isDirectory(testDirectory)) {
      return Optional.empty();
    }
    Optional<Path> trace;
    try (Stream<Path> files = Files.list(testDirectory)) {
      trace =
          files
              .map(p -> ERROR_TEST.matcher(p.getFileName().toString()))
              .filter(m -> m.matches())
              .map(m -> m.group(1))
              .sorted()
              .map(test -> testDirectory.resolve(test + ".trace"))
              .filter(Files::isRegularFile)
              .findFirst();
    }
    if (!trace.isPresent()) {
      return Optional.empty();
    }
    return Optional.of(ExecutionTraceParser.parse(trace.orElseThrow()));
  }
}
