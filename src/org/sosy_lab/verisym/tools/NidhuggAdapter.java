// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableList;
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

/** The stateless model checker Nidhugg for concurrent programs. */
@Options(prefix = "verifier.nidhugg")
public final class NidhuggAdapter extends AbstractToolAdapter {

  static final String NAME = "nidhugg";

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .violation("Error detected", "REACHCALL")
          .rule("No errors were detected", Kind.TRUE)
          .rule("Assertion violation", Kind.ASSERTION_FAILED)
          .build();

  @Option(secure = true, description = "Nidhugg executable")
  private String executable = "nidhugg";

  @Option(secure = true, description = "memory model to explore, e.g. sc or tso")
  private String memoryModel = "sc";

  NidhuggAdapter(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
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
    return "3.8";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    return pBaseDir
        .map(base -> ToolEnvironment.builder().addExecutableDirectory(base.resolve("bin")).build())
        .orElse(ToolEnvironment.empty());
  }

  @Override
  public VerdictGrammar verdictGrammar() {
    return GRAMMAR;
  }

  @Override
  protected ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline) {
    return ImmutableList.<String>builder()
        .add(executable, "--" + memoryModel, "--unroll=10")
        .addAll(pConfig.getVerifierFlags())
        .add(pBitcode.getPath().getFileName().toString())
        .build();
  }
}
