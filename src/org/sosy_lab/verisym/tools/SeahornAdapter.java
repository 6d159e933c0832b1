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

/** The model checker SeaHorn, which answers with sat (violation) or unsat (safe). */
@Options(prefix = "verifier.seahorn")
public final class SeahornAdapter extends AbstractToolAdapter {

  static final String NAME = "seahorn";

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .violation("^\\s*sat\\s*$", "REACHCALL")
          .rule("^\\s*unsat\\s*$", Kind.TRUE)
          .rule("^\\s*unknown\\s*$", Kind.UNKNOWN)
          .build();

  @Option(secure = true, description = "SeaHorn driver executable")
  private String executable = "sea";

  @Option(secure = true, description = "SeaHorn pipeline to run")
  private String pipeline = "pf";

  SeahornAdapter(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
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
    return "3.6";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    if (!pBaseDir.isPresent()) {
      return ToolEnvironment.empty();
    }
    return ToolEnvironment.builder()
        .addExecutableDirectory(pBaseDir.orElseThrow().resolve("seahorn").resolve("bin"))
        .addLibraryDirectory(pBaseDir.orElseThrow().resolve("seahorn").resolve("lib"))
        .build();
  }

  @Override
  public VerdictGrammar verdictGrammar() {
    return GRAMMAR;
  }

  @Override
  protected ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline) {
    return ImmutableList.<String>builder()
        .add(executable, pipeline, "--inline")
        .addAll(pConfig.getVerifierFlags())
        .add(pBitcode.getPath().getFileName().toString())
        .build();
  }
}
