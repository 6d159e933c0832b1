// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.ConfigurationBuilder;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.core.RunDeadline;
import org.sosy_lab.verisym.exceptions.PipelineStageException;
import org.sosy_lab.verisym.test.FakeToolchain;

public class SlicerStageTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private FakeToolchain tools;
  private Path program;
  private Path workingDirectory;
  private PipelineArtifact input;

  @Before
  public void setUp() throws IOException {
    tools = FakeToolchain.create(tmp.newFolder("tools").toPath());
    program = tools.writeProgram("test.c", "int main(void) { return 0; }");
    workingDirectory = tmp.newFolder("work").toPath();
    Path bitcode = workingDirectory.resolve("test.bc");
    Files.writeString(bitcode, "first\nsecond\nthird\n", StandardCharsets.UTF_8);
    input = new PipelineArtifact(bitcode, ArtifactRole.COMPILED_BITCODE, TransformStage.NAME);
  }

  private SlicerStage slicer(String... pOptions) throws InvalidConfigurationException {
    ConfigurationBuilder builder = tools.configurationBuilder();
    for (int i = 0; i < pOptions.length; i += 2) {
      builder.setOption(pOptions[i], pOptions[i + 1]);
    }
    RunConfig config =
        new RunConfig(FakeToolchain.build(builder), ImmutableList.of(program.toString()));
    LogManager logger = LogManager.createTestLogManager();
    return new SlicerStage(
        config,
        logger,
        new ToolStep(
            config,
            logger,
            ShutdownNotifier.createDummy(),
            workingDirectory,
            RunDeadline.unbounded()));
  }

  @Test
  public void testStopsAtFixedPoint() throws Exception {
    tools.writeTool("slicer", FakeToolchain.SHRINKING_SLICER);
    SlicerStage slicer = slicer("pipeline.slicing.repeat", "10");

    PipelineArtifact result = slicer.run(input);

    // two iterations shrink the program, the third one does not change it anymore
    assertThat(slicer.getIterations()).isEqualTo(3);
    assertThat(tools.getCalls("slicer")).hasSize(3);
    assertThat(result.getRole()).isEqualTo(ArtifactRole.SLICED_BITCODE);
    assertThat(Files.readString(result.getPath())).isEqualTo("third\n");
    assertThat(slicer.hasFallenBack()).isFalse();
  }

  @Test
  public void testRespectsRepeatCount() throws Exception {
    tools.writeTool("slicer", FakeToolchain.SHRINKING_SLICER);
    SlicerStage slicer = slicer("pipeline.slicing.repeat", "1");

    PipelineArtifact result = slicer.run(input);

    assertThat(slicer.getIterations()).isEqualTo(1);
    assertThat(Files.readString(result.getPath())).isEqualTo("second\nthird\n");
    assertThat(Files.readString(input.getPath())).isEqualTo("first\nsecond\nthird\n");
  }

  @Test
  public void testArguments() throws Exception {
    SlicerStage slicer =
        slicer("pipeline.slicing.pta", "fi", "pipeline.slicing.criteria", "reach_error");

    slicer.run(input);

    assertThat(tools.getCalls("slicer").get(0)).startsWith("-c=reach_error -pta=fi -o ");
  }

  @Test
  public void testFailureFallsBackToUnslicedProgram() throws Exception {
    tools.writeTool("slicer", FakeToolchain.FAILING_TOOL);
    SlicerStage slicer = slicer();

    assertThat(slicer.run(input)).isSameInstanceAs(input);
    assertThat(slicer.hasFallenBack()).isTrue();
  }

  @Test
  public void testFailureInLaterIterationFallsBackToUnslicedProgram() throws Exception {
    String calls = tools.getDirectory().resolve("slicer.calls").toString();
    tools.writeTool(
        "slicer",
        "[ \"$(wc -l < '" + calls + "')\" -gt 1 ] && exit 1\n" + FakeToolchain.SHRINKING_SLICER);
    SlicerStage slicer = slicer("pipeline.slicing.repeat", "3");

    assertThat(slicer.run(input)).isSameInstanceAs(input);
    assertThat(slicer.getIterations()).isEqualTo(1);
  }

  @Test
  public void testRequiredSlicerFailureIsFatal() throws Exception {
    tools.writeTool("slicer", FakeToolchain.FAILING_TOOL);
    SlicerStage slicer = slicer("pipeline.requireSlicer", "true");

    PipelineStageException e = assertThrows(PipelineStageException.class, () -> slicer.run(input));
    assertThat(e.getStageName()).isEqualTo(SlicerStage.NAME);
  }

  @Test
  public void testRequiredSlicerWithoutSlicingIsInvalid() {
    assertThrows(
        InvalidConfigurationException.class,
        () -> slicer("pipeline.requireSlicer", "true", "pipeline.slicing", "false"));
  }
}
