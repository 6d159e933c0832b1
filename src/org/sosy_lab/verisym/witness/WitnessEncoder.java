// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.specification.PropertySpecification;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.sosy_lab.verisym.stages.NormalizedSource;
import org.sosy_lab.verisym.stages.transform.LineMapping;
import org.sosy_lab.verisym.trace.ExecutionTrace;
import org.sosy_lab.verisym.trace.TraceRecord;

/**
 * Builds witnesses from the result of a run.
 *
 * <p>A violation witness has one node per trace record. The first node is the entry node, the node
 * of the last record is the violation node. The edge into the node of a record carries the line of
 * that record, mapped back to the original source. A trace with a single record gets an extra
 * entry node. A correctness witness consists of the entry node only.
 */
public final class WitnessEncoder {

  private final PropertySpecification specification;
  private final String producer;
  private final String architecture;
  private final boolean withSourceLines;
  private final Clock clock;

  public WitnessEncoder(
      PropertySpecification pSpecification,
      String pProducer,
      String pArchitecture,
      boolean pWithSourceLines) {
    this(pSpecification, pProducer, pArchitecture, pWithSourceLines, Clock.systemDefaultZone());
  }

  WitnessEncoder(
      PropertySpecification pSpecification,
      String pProducer,
      String pArchitecture,
      boolean pWithSourceLines,
      Clock pClock) {
    specification = pSpecification;
    producer = pProducer;
    architecture = pArchitecture;
    withSourceLines = pWithSourceLines;
    clock = pClock;
  }

  /**
   * Build the witness for a violation found along the given trace.
   *
   * @param pVerdict a verdict of kind FALSE or ASSERTION_FAILED
   * @param pTrace the trace of the back end, whose lines refer to the normalized source
   * @throws WitnessEncodingException if the trace is missing or does not fit the source
   */
  public Witness encodeViolation(
      Verdict pVerdict, @Nullable ExecutionTrace pTrace, NormalizedSource pSource)
      throws WitnessEncodingException {
    checkArgument(
        pVerdict.getKind() == Verdict.Kind.FALSE
            || pVerdict.getKind() == Verdict.Kind.ASSERTION_FAILED,
        "violation witness for verdict %s",
        pVerdict);
    if (pTrace == null) {
      throw new WitnessEncodingException(
          "Back end reported " + pVerdict.getResultString() + " but no execution trace");
    }

    ImmutableList<TraceRecord> records = pTrace.getRecords();
    // a single record would make the entry node the violation node
    int offset = records.size() == 1 ? 1 : 0;
    int nodeCount = records.size() + offset;

    MutableValueGraph<WitnessNode, WitnessEdge> graph = ValueGraphBuilder.directed().build();
    @Nullable WitnessNode previous = null;
    for (int i = 0; i < nodeCount; i++) {
      boolean last = i == nodeCount - 1;
      WitnessNode node = new WitnessNode(WitnessNode.idFor(i), i == 0, last, last);
      graph.addNode(node);
      if (previous != null) {
        graph.putEdgeValue(previous, node, toEdge(records.get(i - offset), pSource));
      }
      previous = node;
    }
    return new Witness(WitnessType.VIOLATION, graph, attributes(pSource));
  }

  /**
   * Build the witness that the properties of the run hold.
   *
   * @param pVerdict a verdict of kind TRUE
   */
  public Witness encodeCorrectness(Verdict pVerdict, NormalizedSource pSource)
      throws WitnessEncodingException {
    checkArgument(
        pVerdict.getKind() == Verdict.Kind.TRUE, "correctness witness for verdict %s", pVerdict);
    MutableValueGraph<WitnessNode, WitnessEdge> graph = ValueGraphBuilder.directed().build();
    graph.addNode(new WitnessNode(WitnessNode.idFor(0), true, false, false));
    return new Witness(WitnessType.CORRECTNESS, graph, attributes(pSource));
  }

  private WitnessEdge toEdge(TraceRecord pRecord, NormalizedSource pSource)
      throws WitnessEncodingException {
    LineMapping mapping = pSource.getNormalized().getLineMapping();
    if (pRecord.getLine() > mapping.getLineCount()) {
      throw new WitnessEncodingException(
          String.format(
              "Trace refers to line %d, but %s has only %d lines",
              pRecord.getLine(), pSource.getNormalized().getName(), mapping.getLineCount()));
    }
    int line = mapping.toOrigin(pRecord.getLine());

    @Nullable String sourceCode = null;
    if (withSourceLines && line <= pSource.getOriginalLines().size()) {
      sourceCode = pSource.getOriginalLines().get(line - 1).trim();
    }
    return new WitnessEdge(
        line, pRecord.getAssumption().orElse(null), pRecord.getControl().orElse(null), sourceCode);
  }

  private ImmutableMap<String, String> attributes(NormalizedSource pSource)
      throws WitnessEncodingException {
    String hash;
    try {
      hash = MoreFiles.asByteSource(pSource.getOriginal()).hash(Hashing.sha256()).toString();
    } catch (IOException e) {
      throw new WitnessEncodingException(
          "Cannot hash " + pSource.getOriginal() + ": " + e.getMessage(), e);
    }

    return ImmutableMap.<String, String>builder()
        .put(Witness.SOURCECODE_LANGUAGE, "C")
        .put(Witness.PRODUCER, producer)
        .put(Witness.SPECIFICATION, specification.getOriginalText())
        .put(Witness.PROGRAM_FILE, pSource.getOriginal().toString())
        .put(Witness.PROGRAM_HASH, hash)
        .put(Witness.ARCHITECTURE, architecture)
        .put(
            Witness.CREATION_TIME,
            ZonedDateTime.now(clock)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME))
        .build();
  }
}
