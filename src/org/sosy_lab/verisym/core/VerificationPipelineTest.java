// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Stopwatch;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.graph.EndpointPair;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.ConfigurationBuilder;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.test.FakeToolchain;
import org.sosy_lab.verisym.witness.GraphMlWitnessParser;
import org.sosy_lab.verisym.witness.Witness;
import org.sosy_lab.verisym.witness.WitnessNode;
import org.sosy_lab.verisym.witness.WitnessType;

public class VerificationPipelineTest {

  private static final ImmutableList<PipelineState> FULL_RUN =
      ImmutableList.of(
          PipelineState.INIT,
          PipelineState.TRANSFORM,
          PipelineState.SLICE,
          PipelineState.INSTRUMENT,
          PipelineState.LINK,
          PipelineState.EXECUTE,
          PipelineState.CLASSIFY,
          PipelineState.WITNESS,
          PipelineState.DONE);

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private FakeToolchain tools;
  private Path program;
  private Path verifier;

  @Before
  public void setUp() throws IOException {
    tools = FakeToolchain.create(tmp.newFolder("tools").toPath());
    program =
        tools.writeProgram(
            "reach.c",
            "int main(void) {",
            "  int x = nondet_int();",
            "  if (x == 1) {",
            "    reach_error();",
            "  }",
            "  return 0;",
            "}");
    verifier = tools.getDirectory().resolve("verifier");
  }

  private PipelineResult run(String... pOptions) throws InvalidConfigurationException {
    return run(ShutdownNotifier.createDummy(), pOptions);
  }

  private PipelineResult run(ShutdownNotifier pNotifier, String... pOptions)
      throws InvalidConfigurationException {
    ConfigurationBuilder builder =
        tools
            .configurationBuilder()
            .setOption("pipeline.verifier", "script")
            .setOption("verifier.script.executable", verifier.toString());
    for (int i = 0; i < pOptions.length; i += 2) {
      builder.setOption(pOptions[i], pOptions[i + 1]);
    }
    VerificationPipeline pipeline =
        new VerificationPipeline(
            FakeToolchain.build(builder), LogManager.createTestLogManager(), pNotifier);
    return pipeline.run(ImmutableList.of(program.toString()));
  }

  private Witness readWitness(PipelineResult pResult) throws Exception {
    assertThat(pResult.getWitness()).isPresent();
    return new GraphMlWitnessParser().parse(pResult.getWitness().orElseThrow());
  }

  @Test
  public void testProvenPropertyGivesCorrectnessWitness() throws Exception {
    tools.writeTool("verifier", "echo true\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getHistory()).containsExactlyElementsIn(FULL_RUN).inOrder();
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.TRUE);
    assertThat(result.getResultString()).isEqualTo("true");
    assertThat(result.getExitCode()).isEqualTo(0);

    Witness witness = readWitness(result);
    assertThat(witness.getType()).isEqualTo(WitnessType.CORRECTNESS);
    assertThat(witness.getGraph().nodes()).hasSize(1);
    assertThat(witness.getGraph().edges()).isEmpty();
    assertThat(witness.getEntryNode().isEntry()).isTrue();
    assertThat(witness.getAttributes()).containsEntry(Witness.SPECIFICATION, "REACHCALL");
  }

  @Test
  public void testViolationGivesViolationWitness() throws Exception {
    tools.writeTool(
        "verifier",
        "printf '2\\n3 assumption=x == 1 control=then\\n4\\n' > \"$VERISYM_TRACE_FILE\"\n"
            + "echo 'false(REACHCALL)'\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    Verdict verdict = result.getVerdict().orElseThrow();
    assertThat(verdict.getKind()).isEqualTo(Verdict.Kind.FALSE);
    assertThat(verdict.getViolatedProperty()).hasValue("REACHCALL");

    Witness witness = readWitness(result);
    assertThat(witness.getType()).isEqualTo(WitnessType.VIOLATION);
    assertThat(witness.getGraph().nodes()).hasSize(3);
    WitnessNode last = FluentIterable.from(witness.getGraph().nodes()).last().get();
    assertThat(last.isViolation()).isTrue();
    assertThat(last.isSink()).isTrue();
    assertThat(witness.getViolationNodes()).containsExactly(last);

    ImmutableList.Builder<Integer> lines = ImmutableList.builder();
    for (EndpointPair<WitnessNode> edge : witness.getGraph().edges()) {
      lines.add(witness.getGraph().edgeValue(edge).orElseThrow().getStartLine());
    }
    assertThat(lines.build()).containsExactly(3, 4);
  }

  @Test
  public void testDeadlineKillsBackEnd() throws Exception {
    Path pidFile = tmp.getRoot().toPath().resolve("sleep.pid");
    tools.writeTool("verifier", "sleep 60 &\necho $! > '" + pidFile + "'\nwait\n");

    Stopwatch stopwatch = Stopwatch.createStarted();
    PipelineResult result = run("pipeline.timeout", "2");
    stopwatch.stop();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.ABORTED);
    assertThat(result.getHistory()).contains(PipelineState.EXECUTE);
    assertThat(result.getHistory()).doesNotContain(PipelineState.CLASSIFY);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.TIMEOUT);
    assertThat(result.getResultString()).isEqualTo("timeout");
    assertThat(result.getExitCode()).isEqualTo(0);
    assertThat(result.getWitness()).isEmpty();
    assertThat(stopwatch.elapsed(TimeUnit.MILLISECONDS)).isLessThan(3500L);

    long pid = Long.parseLong(Files.readString(pidFile, StandardCharsets.UTF_8).trim());
    for (int i = 0; i < 10 && isRunning(pid); i++) {
      Thread.sleep(100);
    }
    assertThat(isRunning(pid)).isFalse();
  }

  @Test
  public void testExternalShutdownAbortsRun() throws Exception {
    tools.writeTool("verifier", "sleep 60\n");
    ShutdownManager shutdownManager = ShutdownManager.create();
    Thread requester =
        new Thread(
            () -> {
              try {
                Thread.sleep(500);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              shutdownManager.requestShutdown("user request");
            });
    requester.start();

    PipelineResult result = run(shutdownManager.getNotifier());
    requester.join();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.ABORTED);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.TIMEOUT);
  }

  @Test
  public void testBackEndCrashIsError() throws Exception {
    tools.writeTool("verifier", "echo 'Segmentation fault' >&2\nexit 139\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.ERROR);
    assertThat(result.getHistory()).doesNotContain(PipelineState.WITNESS);
    assertThat(result.getExitCode()).isEqualTo(0);
  }

  @Test
  public void testUnrecognizedOutputIsUnknown() throws Exception {
    tools.writeTool("verifier", "echo 'the program is probably fine'\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.UNKNOWN);
    assertThat(result.getWitness()).isEmpty();
  }

  @Test
  public void testMissingTraceKeepsVerdict() throws Exception {
    tools.writeTool("verifier", "echo 'false(REACHCALL)'\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getHistory()).contains(PipelineState.WITNESS);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.FALSE);
    assertThat(result.getWitness()).isEmpty();
    assertThat(result.getExitCode()).isEqualTo(0);
  }

  @Test
  public void testViolationOfUncheckedPropertyIsUnknown() throws Exception {
    tools.writeTool("verifier", "echo 'false(VALID-FREE)'\n");

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.UNKNOWN);
    assertThat(result.getHistory()).doesNotContain(PipelineState.WITNESS);
    assertThat(result.getWitness()).isEmpty();
  }

  @Test
  public void testViolationOfUnknownPropertyIsUnknown() throws Exception {
    tools.writeTool("verifier", "echo 'false(no-such-property)'\n");

    PipelineResult result = run();

    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.UNKNOWN);
    assertThat(result.getResultString()).isEqualTo("unknown");
    assertThat(result.getWitness()).isEmpty();
  }

  @Test
  public void testUnknownVerifierIsConfigurationError() throws Exception {
    PipelineResult result = run("pipeline.verifier", "cbmc");

    assertThat(result.getHistory())
        .containsExactly(PipelineState.INIT, PipelineState.ABORTED)
        .inOrder();
    assertThat(result.getVerdict()).isEmpty();
    assertThat(result.getFailure()).isPresent();
    assertThat(result.getExitCode()).isEqualTo(1);
    assertThat(tools.getCalls("clang")).isEmpty();
  }

  @Test
  public void testUnknownPropertyIsConfigurationError() throws Exception {
    PipelineResult result = run("pipeline.property", "NO-OVERFLOW-PLEASE");

    assertThat(result.getFinalState()).isEqualTo(PipelineState.ABORTED);
    assertThat(result.getExitCode()).isEqualTo(1);
  }

  @Test
  public void testCompileFailureIsFatal() throws Exception {
    tools.writeTool("verifier", "echo true\n");
    tools.writeTool("clang", FakeToolchain.FAILING_TOOL);

    PipelineResult result = run();

    assertThat(result.getHistory())
        .containsExactly(PipelineState.INIT, PipelineState.TRANSFORM, PipelineState.ABORTED)
        .inOrder();
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.ERROR);
    assertThat(result.getExitCode()).isEqualTo(1);
    assertThat(tools.getCalls("verifier")).isEmpty();
  }

  @Test
  public void testSlicerFailureFallsBack() throws Exception {
    tools.writeTool("verifier", "echo true\n");
    tools.writeTool("slicer", FakeToolchain.FAILING_TOOL);

    PipelineResult result = run();

    assertThat(result.getFinalState()).isEqualTo(PipelineState.DONE);
    assertThat(result.getStatistics().hasSlicerFallenBack()).isTrue();
    assertThat(result.getVerdict().orElseThrow().getKind()).isEqualTo(Verdict.Kind.TRUE);
  }

  @Test
  public void testRequiredSlicerFailureAborts() throws Exception {
    tools.writeTool("verifier", "echo true\n");
    tools.writeTool("slicer", FakeToolchain.FAILING_TOOL);

    PipelineResult result = run("pipeline.requireSlicer", "true");

    assertThat(result.getFinalState()).isEqualTo(PipelineState.ABORTED);
    assertThat(result.getHistory()).contains(PipelineState.SLICE);
    assertThat(result.getHistory()).doesNotContain(PipelineState.INSTRUMENT);
  }

  @Test
  public void testWithoutSlicingAndWitness() throws Exception {
    tools.writeTool("verifier", "echo true\n");

    PipelineResult result = run("pipeline.slicing", "false", "pipeline.witness", "false");

    assertThat(result.getHistory())
        .containsExactly(
            PipelineState.INIT,
            PipelineState.TRANSFORM,
            PipelineState.INSTRUMENT,
            PipelineState.LINK,
            PipelineState.EXECUTE,
            PipelineState.CLASSIFY,
            PipelineState.DONE)
        .inOrder();
    assertThat(tools.getCalls("slicer")).isEmpty();
    assertThat(result.getWitness()).isEmpty();
  }

  @Test
  public void testVerificationDisabled() throws Exception {
    PipelineResult result = run("pipeline.verification", "false", "pipeline.saveFiles", "true");

    ImmutableList<PipelineState> history = result.getHistory();
    assertThat(history.subList(history.size() - 2, history.size()))
        .containsExactly(PipelineState.LINK, PipelineState.DONE)
        .inOrder();
    assertThat(result.getVerdict()).isEmpty();
    assertThat(result.getResultString()).isEqualTo("none");
    assertThat(result.getExitCode()).isEqualTo(0);
    Path bitcode = result.getBitcode().orElseThrow().getPath();
    assertThat(Files.exists(bitcode)).isTrue();
    MoreFiles.deleteRecursively(bitcode.getParent(), RecursiveDeleteOption.ALLOW_INSECURE);
  }

  @Test
  public void testWorkingDirectoryIsRemoved() throws Exception {
    tools.writeTool("verifier", "echo true\n");

    PipelineResult result = run();

    Path bitcode = result.getBitcode().orElseThrow().getPath();
    assertThat(Files.exists(bitcode.getParent())).isFalse();
  }

  @Test
  public void testPipelineIsSingleUse() throws Exception {
    tools.writeTool("verifier", "echo true\n");
    VerificationPipeline pipeline =
        new VerificationPipeline(
            FakeToolchain.build(
                tools
                    .configurationBuilder()
                    .setOption("pipeline.verifier", "script")
                    .setOption("verifier.script.executable", verifier.toString())),
            LogManager.createTestLogManager(),
            ShutdownNotifier.createDummy());
    pipeline.run(ImmutableList.of(program.toString()));

    assertThrows(
        IllegalStateException.class, () -> pipeline.run(ImmutableList.of(program.toString())));
  }

  /** Killed processes may remain as zombies if nobody reaps them, these do not count. */
  private static boolean isRunning(long pPid) throws IOException {
    if (!ProcessHandle.of(pPid).map(ProcessHandle::isAlive).orElse(false)) {
      return false;
    }
    String content;
    try {
      content = Files.readString(Path.of("/proc", Long.toString(pPid), "stat"));
    } catch (NoSuchFileException e) {
      return false;
    }
    return !content.substring(content.lastIndexOf(')') + 1).trim().startsWith("Z");
  }
}
