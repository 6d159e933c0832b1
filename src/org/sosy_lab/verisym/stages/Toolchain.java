// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.collect.ImmutableList;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;

/**
 * Locations of the external tools the pipeline stages call. Executables may be given as plain
 * command names, which are looked up on the PATH of the child process, or as paths.
 */
@Options(prefix = "tools")
public final class Toolchain {

  @Option(
      secure = true,
      description =
          "installation directory of the toolchain, containing bin/, lib/, and the"
              + " *_VERSION files")
  private @Nullable String installDirectory = null;

  @Option(secure = true, description = "C compiler that can emit LLVM bitcode")
  private String clang = "clang";

  @Option(secure = true, description = "LLVM optimizer, also used for running passes")
  private String opt = "opt";

  @Option(secure = true, description = "LLVM bitcode linker")
  private String llvmLink = "llvm-link";

  @Option(secure = true, description = "program slicer for LLVM bitcode")
  private String slicer = "sbt-slicer";

  @Option(secure = true, description = "instrumentation tool that weaves property monitors")
  private String instrumenter = "sbt-instr";

  @Option(
      secure = true,
      description =
          "shared library with the LLVM passes of the pipeline"
              + " (default: lib/LLVMsvc.so in the installation directory)")
  @FileOption(FileOption.Type.OPTIONAL_INPUT_FILE)
  private @Nullable Path passesLibrary = null;

  @Option(
      secure = true,
      description =
          "directory with one sub-directory with a config.json per property monitor"
              + " (default: share/instrumentation in the installation directory)")
  private @Nullable String instrumentationDirectory = null;

  @Option(
      secure = true,
      description = "bitcode libraries linked to the program, e.g. definitions of __VERIFIER_*")
  @FileOption(FileOption.Type.OPTIONAL_INPUT_FILE)
  private List<Path> libraries = ImmutableList.of();

  private final @Nullable Path installPath;
  private final @Nullable Path instrumentationPath;

  public Toolchain(Configuration pConfig) throws InvalidConfigurationException {
    pConfig.inject(this);
    installPath = toDirectory("tools.installDirectory", installDirectory);
    instrumentationPath =
        toDirectory("tools.instrumentationDirectory", instrumentationDirectory);
  }

  /** File options cannot name directories, so directory options are checked here. */
  private static @Nullable Path toDirectory(String pOption, @Nullable String pValue)
      throws InvalidConfigurationException {
    if (pValue == null) {
      return null;
    }
    Path directory = Path.of(pValue);
    if (!Files.isDirectory(directory)) {
      throw new InvalidConfigurationException(
          "Option " + pOption + " does not specify an existing directory: " + pValue);
    }
    return directory;
  }

  public Optional<Path> getInstallDirectory() {
    return Optional.ofNullable(installPath);
  }

  public String getClang() {
    return resolve(clang);
  }

  public String getOpt() {
    return resolve(opt);
  }

  public String getLlvmLink() {
    return resolve(llvmLink);
  }

  public String getSlicer() {
    return resolve(slicer);
  }

  public String getInstrumenter() {
    return resolve(instrumenter);
  }

  public Path getPassesLibrary() {
    if (passesLibrary != null) {
      return passesLibrary;
    }
    return getInstallDirectory().orElse(Path.of(".")).resolve("lib").resolve("LLVMsvc.so");
  }

  public Path getInstrumentationDirectory() {
    if (instrumentationPath != null) {
      return instrumentationPath;
    }
    return getInstallDirectory()
        .orElse(Path.of("."))
        .resolve("share")
        .resolve("instrumentation");
  }

  /** Monitor definition file for the monitor with the given name. */
  public Path getMonitorDefinition(String pMonitorName) {
    return getInstrumentationDirectory().resolve(pMonitorName).resolve("config.json");
  }

  public ImmutableList<Path> getLibraries() {
    return ImmutableList.copyOf(libraries);
  }

  /**
   * A command name is taken from the bin directory of the installation if it exists there, and
   * left for lookup on the PATH otherwise.
   */
  private String resolve(String pCommand) {
    if (installPath == null || pCommand.indexOf('/') >= 0) {
      return pCommand;
    }
    Path candidate = installPath.resolve("bin").resolve(pCommand);
    return Files.isExecutable(candidate) ? candidate.toString() : pCommand;
  }
}
