// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import static com.google.common.collect.FluentIterable.from;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
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
import org.sosy_lab.verisym.core.specification.Property;
import org.sosy_lab.verisym.exceptions.TraceFormatException;
import org.sosy_lab.verisym.trace.ExecutionTrace;
import org.sosy_lab.verisym.trace.ExecutionTraceParser;

/**
 * Wrapper for any executable that speaks the plain result dialect: a line {@code true}, {@code
 * false(<property>)}, or {@code unknown}. The executable gets the checked properties in the
 * environment variable {@code VERISYM_PROPERTIES} and may write an execution trace to the file
 * named by {@code VERISYM_TRACE_FILE}.
 */
@Options(prefix = "verifier.script")
public final class ScriptVerifierAdapter extends AbstractToolAdapter {

  static final String NAME = "script";

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .rule(VerdictRule.violationWithLabelGroup("^\\s*false\\((.+)\\)\\s*$"))
          .rule("^\\s*true\\s*$", Kind.TRUE)
          .rule("^\\s*assertion[- ]failed\\b", Kind.ASSERTION_FAILED)
          .rule("^\\s*unknown\\b", Kind.UNKNOWN)
          .rule("^\\s*error\\b", Kind.ERROR)
          .build();

  @Option(secure = true, description = "executable that verifies the bitcode file it is given")
  private String executable = "";

  @Option(
      secure = true,
      description = "file the executable writes its execution trace to, relative to its working"
          + " directory")
  private String traceFile = "trace.txt";

  ScriptVerifierAdapter(
      Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    super(pLogger, pShutdownNotifier);
    pConfig.inject(this);
    if (executable.isEmpty()) {
      throw new InvalidConfigurationException(
          "Verifier 'script' needs an executable in option verifier.script.executable");
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String requiredToolVersion() {
    return "any";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    ToolEnvironment.Builder env =
        ToolEnvironment.builder()
            .setVariable(
                "VERISYM_PROPERTIES",
                Joiner.on(',')
                    .join(
                        from(pConfig.getSpecification().getProperties())
                            .transform(Property::getCanonicalName)))
            .setVariable("VERISYM_TRACE_FILE", traceFile);
    pBaseDir.ifPresent(base -> env.addExecutableDirectory(base.resolve("bin")));
    return env.build();
  }

  @Override
  public VerdictGrammar verdictGrammar() {
    return GRAMMAR;
  }

  @Override
  protected ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline) {
    return ImmutableList.<String>builder()
        .add(executable)
        .addAll(pConfig.getVerifierFlags())
        .add(pBitcode.getPath().getFileName().toString())
        .build();
  }

  @Override
  protected Optional<ExecutionTrace> readTrace(Path pWorkingDirectory)
      throws IOException, TraceFormatException {
    Path file = pWorkingDirectory.resolve(traceFile);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.of(ExecutionTraceParser.parse(file));
  }
}
