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
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;
import org.sosy_lab.verisym.core.Verdict.Kind;
import org.sosy_lab.verisym.core.specification.Property;

/** The bounded model checker SMACK. */
@Options(prefix = "verifier.smack")
public final class SmackAdapter extends AbstractToolAdapter {

  static final String NAME = "smack";

  static final VerdictGrammar GRAMMAR =
      VerdictGrammar.builder(NAME)
          .violation("SMACK found an error: invalid pointer dereference", "VALID-DEREF")
          .violation("SMACK found an error: invalid memory deallocation", "VALID-FREE")
          .violation("SMACK found an error: memory leak", "MEM-TRACK")
          .violation("SMACK found an error: integer overflow", "SIGNED-OVERFLOW")
          .violation("SMACK found an error", "REACHCALL")
          .rule("SMACK found no errors", Kind.TRUE)
          .rule("SMACK timed out", Kind.UNKNOWN)
          .build();

  @Option(secure = true, description = "SMACK executable")
  private String executable = "smack";

  @Option(secure = true, description = "loop unrolling bound")
  @IntegerOption(min = 1)
  private int unroll = 8;

  SmackAdapter(Configuration pConfig, LogManager pLogger, ShutdownNotifier pShutdownNotifier)
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
    return "3.9.1";
  }

  @Override
  public ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig) {
    if (!pBaseDir.isPresent()) {
      return ToolEnvironment.empty();
    }
    return ToolEnvironment.builder()
        .addExecutableDirectory(pBaseDir.orElseThrow().resolve("smack").resolve("bin"))
        .addExecutableDirectory(pBaseDir.orElseThrow().resolve("bin"))
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
    cmd.add(executable, "--unroll=" + unroll);
    pDeadline.getRemainingSeconds().ifPresent(s -> cmd.add("--time-limit=" + s));
    for (Property property : pConfig.getSpecification().getProperties()) {
      checkFor(property).ifPresent(c -> cmd.add("--check=" + c));
    }
    cmd.addAll(pConfig.getVerifierFlags());
    cmd.add(pBitcode.getPath().getFileName().toString());
    return cmd.build();
  }

  private static Optional<String> checkFor(Property pProperty) {
    switch (pProperty) {
      case VALID_DEREF:
      case NULL_DEREF:
        return Optional.of("valid-deref");
      case VALID_FREE:
        return Optional.of("valid-free");
      case MEM_TRACK:
        return Optional.of("memleak");
      case SIGNED_OVERFLOW:
        return Optional.of("integer-overflow");
      case REACHCALL:
        return Optional.of("assertions");
      case UNDEF_BEHAVIOR:
        return Optional.empty();
      default:
        throw new AssertionError("unhandled property " + pProperty);
    }
  }
}
