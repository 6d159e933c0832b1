// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.test;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.ConfigurationBuilder;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.converters.FileTypeConverter;

/**
 * A toolchain made of small shell scripts for tests. The build tools copy their inputs to the file
 * given with {@code -o}, and every tool appends its arguments to {@code <name>.calls} in the
 * toolchain directory.
 */
public final class FakeToolchain {

  private static final String PARSE_ARGUMENTS =
      String.join(
          "\n",
          "out=''",
          "inputs=''",
          "while [ $# -gt 0 ]; do",
          "  case \"$1\" in",
          "    -o) out=\"$2\"; shift 2 ;;",
          "    -*) shift ;;",
          "    *) inputs=\"$inputs $1\"; shift ;;",
          "  esac",
          "done",
          "[ -n \"$out\" ] || exit 3",
          "");

  /** Copies all inputs into the output file. */
  public static final String COPYING_TOOL = PARSE_ARGUMENTS + "cat $inputs > \"$out\"\n";

  /** Drops the first line of its input as long as there is more than one line. */
  public static final String SHRINKING_SLICER =
      PARSE_ARGUMENTS
          + "set -- $inputs\n"
          + "if [ \"$(wc -l < \"$1\")\" -gt 1 ]; then\n"
          + "  tail -n +2 \"$1\" > \"$out\"\n"
          + "else\n"
          + "  cat \"$1\" > \"$out\"\n"
          + "fi\n";

  public static final String FAILING_TOOL = "echo 'segmentation fault' >&2\nexit 139\n";

  public static final ImmutableList<String> MONITORS =
      ImmutableList.of("valid-deref", "valid-free", "valid-memtrack", "null-deref");

  private final Path directory;

  private FakeToolchain(Path pDirectory) {
    directory = pDirectory;
  }

  /** Create a working toolchain in the given (empty) directory. */
  public static FakeToolchain create(Path pDirectory) throws IOException {
    FakeToolchain toolchain = new FakeToolchain(pDirectory);
    for (String tool : ImmutableList.of("clang", "opt", "llvm-link", "slicer", "instrumenter")) {
      toolchain.writeTool(tool, COPYING_TOOL);
    }
    for (String monitor : MONITORS) {
      Path definition = pDirectory.resolve("share").resolve("instrumentation").resolve(monitor);
      Files.createDirectories(definition);
      Files.writeString(definition.resolve("config.json"), "{}\n", StandardCharsets.UTF_8);
    }
    Files.createDirectories(pDirectory.resolve("lib"));
    Files.writeString(pDirectory.resolve("lib").resolve("LLVMsvc.so"), "", StandardCharsets.UTF_8);
    Files.writeString(pDirectory.resolve("LLVM_VERSION"), "3.4\n", StandardCharsets.UTF_8);
    return toolchain;
  }

  public Path getDirectory() {
    return directory;
  }

  /** Write an executable shell script with the given body and return its path. */
  public Path writeTool(String pName, String pBody) throws IOException {
    Path script = directory.resolve(pName);
    String callLog = directory.resolve(pName + ".calls").toString();
    Files.writeString(
        script,
        "#!/bin/sh\necho \"$@\" >> '" + callLog + "'\n" + pBody,
        StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    return script;
  }

  /** Arguments of all calls of the given tool so far, one entry per call. */
  public List<String> getCalls(String pName) throws IOException {
    Path callLog = directory.resolve(pName + ".calls");
    if (!Files.exists(callLog)) {
      return ImmutableList.of();
    }
    return Files.readAllLines(callLog, StandardCharsets.UTF_8);
  }

  /** Options that point the pipeline to this toolchain and write output into its directory. */
  public ConfigurationBuilder configurationBuilder() {
    return Configuration.builder()
        .setOption("tools.clang", directory.resolve("clang").toString())
        .setOption("tools.opt", directory.resolve("opt").toString())
        .setOption("tools.llvmLink", directory.resolve("llvm-link").toString())
        .setOption("tools.slicer", directory.resolve("slicer").toString())
        .setOption("tools.instrumenter", directory.resolve("instrumenter").toString())
        .setOption("tools.installDirectory", directory.toString())
        .setOption("output.path", directory.resolve("output").toString());
  }

  /** Build the configuration such that output files are resolved against the output path. */
  public static Configuration build(ConfigurationBuilder pBuilder)
      throws InvalidConfigurationException {
    Configuration config = pBuilder.build();
    FileTypeConverter fileTypeConverter = FileTypeConverter.create(config);
    return Configuration.builder()
        .copyFrom(config)
        .addConverter(FileOption.class, fileTypeConverter)
        .build();
  }

  /** Write a C source file into the toolchain directory. */
  public Path writeProgram(String pName, String... pLines) throws IOException {
    Path program = directory.resolve(pName);
    Files.write(program, ImmutableList.copyOf(pLines), StandardCharsets.UTF_8);
    return program;
  }
}
