// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of one run of a {@link VerificationPipeline}. */
public final class PipelineResult {

  private final ImmutableList<PipelineState> history;
  private final @Nullable Verdict verdict;
  private final @Nullable String failure;
  private final @Nullable PipelineArtifact bitcode;
  private final @Nullable Path witness;
  private final PipelineStatistics statistics;

  PipelineResult(
      ImmutableList<PipelineState> pHistory,
      @Nullable Verdict pVerdict,
      @Nullable String pFailure,
      @Nullable PipelineArtifact pBitcode,
      @Nullable Path pWitness,
      PipelineStatistics pStatistics) {
    Preconditions.checkArgument(
        !pHistory.isEmpty() && pHistory.get(pHistory.size() - 1).isTerminal(),
        "run did not terminate: %s",
        pHistory);
    history = pHistory;
    verdict = pVerdict;
    failure = pFailure;
    bitcode = pBitcode;
    witness = pWitness;
    statistics = pStatistics;
  }

  public PipelineState getFinalState() {
    return history.get(history.size() - 1);
  }

  /** All states the run passed through, starting with INIT. */
  public ImmutableList<PipelineState> getHistory() {
    return history;
  }

  /** The verdict, absent if the run failed before verification or verification was disabled. */
  public Optional<Verdict> getVerdict() {
    return Optional.ofNullable(verdict);
  }

  /** Message of the configuration or stage error that stopped the run. */
  public Optional<String> getFailure() {
    return Optional.ofNullable(failure);
  }

  /** The bitcode that was (or would have been) handed to the back end. */
  public Optional<PipelineArtifact> getBitcode() {
    return Optional.ofNullable(bitcode);
  }

  public Optional<Path> getWitness() {
    return Optional.ofNullable(witness);
  }

  public PipelineStatistics getStatistics() {
    return statistics;
  }

  /** Text for the final result line. */
  public String getResultString() {
    if (verdict != null) {
      return verdict.getResultString();
    } else if (failure != null) {
      return "error (" + failure + ")";
    } else {
      return "none";
    }
  }

  /** 0 if the run completed, 1 if a configuration error or a fatal stage error stopped it. */
  public int getExitCode() {
    return failure == null ? 0 : 1;
  }

  @Override
  public String toString() {
    return getFinalState() + ": " + getResultString();
  }
}
