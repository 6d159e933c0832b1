// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.sosy_lab.verisym.stages.NormalizedSource;
import org.sosy_lab.verisym.trace.ExecutionTrace;

/** Encodes the witness for the verdict of a run and writes it to the configured file. */
public final class WitnessExporter {

  static final String PRODUCER = "Verisym";

  private final RunConfig config;
  private final LogManager logger;
  private final WitnessEncoder encoder;
  private final GraphMlWitnessWriter writer = new GraphMlWitnessWriter();

  public WitnessExporter(RunConfig pConfig, LogManager pLogger) {
    config = pConfig;
    logger = pLogger;
    encoder =
        new WitnessEncoder(
            pConfig.getSpecification(),
            PRODUCER + " (" + pConfig.getVerifier() + ")",
            pConfig.getCflags().contains("-m32") ? "32bit" : "64bit",
            pConfig.isWitnessWithSourceLines());
  }

  /**
   * Write the witness for the given verdict.
   *
   * @param pSource the source file the line numbers of the trace refer to
   * @return the written file, or empty if no witness is requested for this verdict
   */
  public Optional<Path> export(
      Verdict pVerdict, Optional<ExecutionTrace> pTrace, NormalizedSource pSource)
      throws WitnessEncodingException {
    Optional<Path> file = config.getWitnessFile();
    if (!file.isPresent() || !pVerdict.getKind().hasWitness()) {
      return Optional.empty();
    }

    Witness witness;
    switch (pVerdict.getKind()) {
      case TRUE:
        witness = encoder.encodeCorrectness(pVerdict, pSource);
        break;
      case FALSE:
      case ASSERTION_FAILED:
        witness = encoder.encodeViolation(pVerdict, pTrace.orElse(null), pSource);
        break;
      default:
        throw new AssertionError("no witness for " + pVerdict);
    }

    writer.write(witness, file.orElseThrow());
    logger.logf(
        Level.INFO,
        "Wrote %s with %d nodes to %s",
        witness.getType().getGraphMlName(),
        witness.getGraph().nodes().size(),
        file.orElseThrow());
    return file;
  }
}
