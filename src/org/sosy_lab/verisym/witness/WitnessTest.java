// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.EndpointPair;
import com.google.common.graph.ValueGraphBuilder;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.specification.PropertyParser;
import org.sosy_lab.verisym.exceptions.WitnessEncodingException;
import org.sosy_lab.verisym.stages.NormalizedSource;
import org.sosy_lab.verisym.stages.transform.LineMapping;
import org.sosy_lab.verisym.stages.transform.SourceText;
import org.sosy_lab.verisym.trace.BranchDirection;
import org.sosy_lab.verisym.trace.ExecutionTrace;
import org.sosy_lab.verisym.trace.TraceRecord;

public class WitnessTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2023-05-04T10:15:30Z"), ZoneOffset.UTC);

  private WitnessEncoder encoder;
  private NormalizedSource source;

  @Before
  public void setUp() throws Exception {
    encoder =
        new WitnessEncoder(
            PropertyParser.parseSpecification("REACHCALL"), "Verisym (test)", "64bit", true, CLOCK);
    source = identitySource(14);
  }

  private NormalizedSource identitySource(int pLines) throws IOException {
    List<String> lines = new ArrayList<>();
    for (int i = 1; i <= pLines; i++) {
      lines.add("  stmt" + i + ";");
    }
    return source(lines, null);
  }

  private NormalizedSource source(List<String> pLines, @Nullable LineMapping pMapping)
      throws IOException {
    Path file = tmp.getRoot().toPath().resolve("program.c");
    String content = Joiner.on('\n').join(pLines) + "\n";
    Files.writeString(file, content, StandardCharsets.UTF_8);
    SourceText original = SourceText.original("program.c", content);
    SourceText normalized = original;
    if (pMapping != null) {
      List<String> normalizedLines = new ArrayList<>();
      for (int line = 1; line <= pMapping.getLineCount(); line++) {
        normalizedLines.add(pLines.get(pMapping.toOrigin(line) - 1));
      }
      normalized = original.derive(Joiner.on('\n').join(normalizedLines) + "\n", pMapping);
    }
    return new NormalizedSource(
        file,
        ImmutableList.copyOf(pLines),
        normalized,
        new PipelineArtifact(file, ArtifactRole.NORMALIZED_SOURCE, "test"));
  }

  private static ExecutionTrace trace(int... pLines) {
    ImmutableList.Builder<TraceRecord> records = ImmutableList.builder();
    for (int line : pLines) {
      records.add(TraceRecord.atLine(line));
    }
    return new ExecutionTrace(records.build());
  }

  private Witness roundTrip(Witness pWitness) throws Exception {
    Path file = tmp.getRoot().toPath().resolve("out").resolve("witness.graphml");
    new GraphMlWitnessWriter().write(pWitness, file);
    return new GraphMlWitnessParser().parse(file);
  }

  @Test
  public void testViolationRoundTrip() throws Exception {
    Witness witness =
        encoder.encodeViolation(Verdict.violated("REACHCALL"), trace(10, 12), source);

    Witness parsed = roundTrip(witness);

    assertThat(parsed).isEqualTo(witness);
    assertThat(parsed.getType()).isEqualTo(WitnessType.VIOLATION);
    assertThat(parsed.getGraph().nodes()).hasSize(2);
    assertThat(parsed.getGraph().edges()).hasSize(1);

    EndpointPair<WitnessNode> edge = parsed.getGraph().edges().iterator().next();
    assertThat(parsed.getGraph().edgeValue(edge).orElseThrow().getStartLine()).isEqualTo(12);
    assertThat(edge.source().isEntry()).isTrue();
    assertThat(edge.source().isViolation()).isFalse();
    assertThat(edge.source().isSink()).isFalse();
    assertThat(edge.target().isEntry()).isFalse();
    assertThat(edge.target().isViolation()).isTrue();
    assertThat(edge.target().isSink()).isTrue();
  }

  @Test
  public void testCorrectnessRoundTrip() throws Exception {
    Witness witness = encoder.encodeCorrectness(Verdict.holds(), source);

    Witness parsed = roundTrip(witness);

    assertThat(parsed).isEqualTo(witness);
    assertThat(parsed.getType()).isEqualTo(WitnessType.CORRECTNESS);
    assertThat(parsed.getGraph().nodes()).containsExactly(parsed.getEntryNode());
    assertThat(parsed.getGraph().edges()).isEmpty();
    assertThat(parsed.getViolationNodes()).isEmpty();
  }

  @Test
  public void testAttributes() throws Exception {
    Witness witness = encoder.encodeCorrectness(Verdict.holds(), source);

    assertThat(witness.getAttributes())
        .containsAtLeast(
            Witness.SOURCECODE_LANGUAGE, "C",
            Witness.PRODUCER, "Verisym (test)",
            Witness.SPECIFICATION, "REACHCALL",
            Witness.ARCHITECTURE, "64bit",
            Witness.CREATION_TIME, "2023-05-04T10:15:30Z");
    assertThat(witness.getAttributes().get(Witness.PROGRAM_HASH)).matches("[0-9a-f]{64}");
  }

  @Test
  public void testEdgeAnnotations() throws Exception {
    ExecutionTrace trace =
        new ExecutionTrace(
            ImmutableList.of(
                TraceRecord.atLine(2),
                new TraceRecord(4, "x == 0", BranchDirection.THEN),
                new TraceRecord(7, "y < 2 && x > 1", BranchDirection.ELSE),
                TraceRecord.atLine(9)));

    Witness witness = encoder.encodeViolation(Verdict.violated("REACHCALL"), trace, source);

    assertThat(witness.getGraph().nodes()).hasSize(4);
    WitnessEdge branch =
        witness
            .getGraph()
            .edgeValue(
                new WitnessNode("N1", false, false, false),
                new WitnessNode("N2", false, false, false))
            .orElseThrow();
    assertThat(branch.getStartLine()).isEqualTo(7);
    assertThat(branch.getAssumption()).hasValue("y < 2 && x > 1");
    assertThat(branch.getControl()).hasValue(BranchDirection.ELSE);
    assertThat(branch.getSourceCode()).hasValue("stmt7;");
    assertThat(roundTrip(witness)).isEqualTo(witness);
  }

  @Test
  public void testLinesAreMappedToOriginalSource() throws Exception {
    ImmutableList<String> lines =
        ImmutableList.of("int main(void) {", "  while (1) {", "  }", "  return 0;", "}");
    // normalized line 3 was inserted before the original line 3
    NormalizedSource mapped = source(lines, LineMapping.of(1, 2, 3, 3, 4, 5));

    Witness witness =
        encoder.encodeViolation(Verdict.violated("REACHCALL"), trace(1, 3, 5), mapped);

    List<Integer> startLines = new ArrayList<>();
    for (EndpointPair<WitnessNode> edge : witness.getGraph().edges()) {
      startLines.add(witness.getGraph().edgeValue(edge).orElseThrow().getStartLine());
    }
    assertThat(startLines).containsExactly(3, 4);
  }

  @Test
  public void testSingleRecordTraceHasSeparateEntry() throws Exception {
    Witness witness = encoder.encodeViolation(Verdict.assertionFailed(null), trace(5), source);

    assertThat(witness.getGraph().nodes()).hasSize(2);
    assertThat(witness.getEntryNode().isViolation()).isFalse();
    assertThat(witness.getViolationNodes()).hasSize(1);
  }

  @Test
  public void testMissingTrace() {
    assertThrows(
        WitnessEncodingException.class,
        () -> encoder.encodeViolation(Verdict.violated("REACHCALL"), null, source));
  }

  @Test
  public void testTraceBeyondSource() {
    assertThrows(
        WitnessEncodingException.class,
        () -> encoder.encodeViolation(Verdict.violated("REACHCALL"), trace(3, 99), source));
  }

  @Test
  public void testWrongVerdictIsProgrammingError() {
    assertThrows(
        IllegalArgumentException.class,
        () -> encoder.encodeViolation(Verdict.holds(), trace(1), source));
    assertThrows(
        IllegalArgumentException.class,
        () -> encoder.encodeCorrectness(Verdict.violated("REACHCALL"), source));
    assertThrows(
        IllegalArgumentException.class,
        () -> encoder.encodeCorrectness(Verdict.unknown(null), source));
  }

  @Test
  public void testParserRejectsUndeclaredKey() {
    String document =
        "<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\">"
            + "<key id=\"witness-type\" for=\"graph\" attr.name=\"witness-type\""
            + " attr.type=\"string\"/>"
            + "<graph edgedefault=\"directed\">"
            + "<data key=\"witness-type\">correctness_witness</data>"
            + "<node id=\"N0\"><data key=\"entry\">true</data></node>"
            + "</graph></graphml>";

    assertThrows(
        WitnessEncodingException.class,
        () ->
            new GraphMlWitnessParser()
                .parse(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  public void testParserRejectsDoctype() {
    String document =
        "<?xml version=\"1.0\"?><!DOCTYPE graphml [<!ENTITY x \"y\">]>"
            + "<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\"/>";

    assertThrows(
        WitnessEncodingException.class,
        () ->
            new GraphMlWitnessParser()
                .parse(new ByteArrayInputStream(document.getBytes(StandardCharsets.UTF_8))));
  }

  @Test
  public void testWitnessNeedsEntryNode() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new Witness(
                WitnessType.CORRECTNESS,
                ValueGraphBuilder.directed()
                    .<WitnessNode, WitnessEdge>immutable()
                    .addNode(new WitnessNode("N0", false, false, false))
                    .build(),
                ImmutableMap.of()));
  }
}
