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

/** The explicit-state model checker DIVINE. */
@Options(prefix = "verifier.divine")
public final class DivineAdapter extends AbstractToolAdapter {

  static final String NAME = "divine";

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .violation("FAULT: .*(?:invalid pointer dereference|out of bounds)", "VALID-DEREF")
          .violation("FAULT: .*(?:invalid free|double free)", "VALID-FREE")
          .violation("FAULT: .*leak", "MEM-TRACK")
          .violation("^error found: yes", "REACHCALL")
          .rule("^error found: no", Kind.TRUE)
          .rule("^error found: boot", Kind.ERROR)
          .build();

  @Option(secure = true, description = "DIVINE executable")
  private String executable = "divine";

  DivineAdapter(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
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
    return "4.0";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    return pBaseDir
        .map(
            base ->
                ToolEnvironment.builder()
                    .addExecutableDirectory(base.resolve("divine").resolve("bin"))
                    .build())
        .orElse(ToolEnvironment.empty());
  }

  @Override
  public VerdictGrammar verdictGrammar() {
    return GRAMMAR;
  }

  @Override
  protected ImmutableList<String> commandLine(
      PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline) {
    ImmutableList.Builder<String> cmd = ImmutableList.builder();
    cmd.add(executable, "check");
    pDeadline.getRemainingSeconds().ifPresent(s -> cmd.add("--max-time=" + s));
    if (pConfig.getSpecification().coversMemorySafety()) {
      cmd.add("--leakcheck=exit");
    }
    cmd.addAll(pConfig.getVerifierFlags());
    cmd.add(pBitcode.getPath().getFileName().toString());
    return cmd.build();
  }
}
