// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.cmdline;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.nio.file.Path;
import org.junit.Test;

public class CmdLineArgumentsTest {

  @Test
  public void testFlagsAndValues() throws InvalidCmdlineArgumentException {
    CmdLineArguments.Arguments args =
        CmdLineArguments.parse(
            new String[] {
              "--prp=MEMSAFETY",
              "--pta",
              "fi",
              "--repeat-slicing=3",
              "--timeout=30",
              "--verifier=smack",
              "--no-optimize",
              "--witness-with-source-lines",
              "--witness=out.graphml",
              "test.c"
            });

    assertThat(args.getPrograms()).containsExactly("test.c");
    assertThat(args.getOptions())
        .containsExactly(
            "pipeline.property", "MEMSAFETY",
            "pipeline.slicing.pta", "fi",
            "pipeline.slicing.repeat", "3",
            "pipeline.timeout", "30",
            "pipeline.verifier", "smack",
            "pipeline.optimize", "false",
            "pipeline.witness.sourceLines", "true",
            "pipeline.witness.file", "out.graphml")
        .inOrder();
    assertThat(args.isHelp()).isFalse();
  }

  @Test
  public void testDisablingFlags() throws InvalidCmdlineArgumentException {
    CmdLineArguments.Arguments args =
        CmdLineArguments.parse(
            new String[] {"--no-slice", "--no-witness", "--no-verification", "a.c", "b.c"});

    assertThat(args.getPrograms()).containsExactly("a.c", "b.c").inOrder();
    assertThat(args.getOptions()).containsEntry("pipeline.slicing", "false");
    assertThat(args.getOptions()).containsEntry("pipeline.witness", "false");
    assertThat(args.getOptions()).containsEntry("pipeline.verification", "false");
  }

  @Test
  public void testGenericOptionAndConfigFile() throws InvalidCmdlineArgumentException {
    CmdLineArguments.Arguments args =
        CmdLineArguments.parse(
            new String[] {
              "--option", "verifier.klee.libc = uclibc", "--config=verisym.properties", "x.c"
            });

    assertThat(args.getOptions()).containsExactly("verifier.klee.libc", "uclibc");
    assertThat(args.getConfigFile()).hasValue(Path.of("verisym.properties"));
  }

  @Test
  public void testHelpNeedsNoSource() throws InvalidCmdlineArgumentException {
    assertThat(CmdLineArguments.parse(new String[] {"--help"}).isHelp()).isTrue();
    assertThat(CmdLineArguments.parse(new String[] {"--version"}).isVersion()).isTrue();
  }

  @Test
  public void testInvalidArguments() {
    assertThrows(InvalidCmdlineArgumentException.class, () -> parse());
    assertThrows(InvalidCmdlineArgumentException.class, () -> parse("--frobnicate", "a.c"));
    assertThrows(InvalidCmdlineArgumentException.class, () -> parse("--pta=precise", "a.c"));
    assertThrows(InvalidCmdlineArgumentException.class, () -> parse("--option", "novalue", "a.c"));
    assertThrows(InvalidCmdlineArgumentException.class, () -> parse("a.c", "--timeout"));
  }

  private static CmdLineArguments.Arguments parse(String... pArgs)
      throws InvalidCmdlineArgumentException {
    return CmdLineArguments.parse(pArgs);
  }
}
