// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;

/**
 * A verification back end. Implementations are selected by name through {@link ToolAdapters}.
 */
public interface ToolAdapter {

  /** Stable identifier of the back end, also the name of its output dialect. */
  String name();

  /** Version of the LLVM toolchain this back end was validated against. */
  String requiredToolVersion();

  /**
   * Describe the environment the back end process needs. This has no side effects.
   *
   * @param pBaseDir installation directory of the toolchain, if known
   */
  ToolEnvironment prepareEnvironment(Optional<Path> pBaseDir, RunConfig pConfig);

  /** Rules for classifying the output of this back end. */
  VerdictGrammar verdictGrammar();

  /**
   * Verify the given bitcode. Runs in the directory of the bitcode file.
   *
   * @throws InterruptedException if the run was cancelled or the deadline passed
   * @throws IOException if the output of the back end cannot be read
   */
  ToolRunResult run(PipelineArtifact pBitcode, RunConfig pConfig, RunDeadline pDeadline)
      throws IOException, InterruptedException;
}
