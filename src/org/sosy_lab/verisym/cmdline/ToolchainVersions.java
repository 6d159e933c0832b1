// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.cmdline;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSortedMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;

/**
 * Versions of the toolchain components as recorded in the {@code <COMPONENT>_VERSION} files of the
 * installation directory.
 */
final class ToolchainVersions {

  static final String LLVM = "LLVM";
  private static final String SUFFIX = "_VERSION";

  private final ImmutableSortedMap<String, String> versions;

  private ToolchainVersions(ImmutableSortedMap<String, String> pVersions) {
    versions = pVersions;
  }

  static ToolchainVersions read(Path pInstallDirectory) throws IOException {
    ImmutableSortedMap.Builder<String, String> versions = ImmutableSortedMap.naturalOrder();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(pInstallDirectory, "*" + SUFFIX)) {
      for (Path file : files) {
        if (Files.isRegularFile(file)) {
          String name = file.getFileName().toString();
          versions.put(
              name.substring(0, name.length() - SUFFIX.length()),
              CharMatcher.whitespace().trimFrom(Files.readString(file, StandardCharsets.UTF_8)));
        }
      }
    }
    return new ToolchainVersions(versions.buildOrThrow());
  }

  ImmutableSortedMap<String, String> asMap() {
    return versions;
  }

  Optional<String> get(String pComponent) {
    return Optional.ofNullable(versions.get(pComponent));
  }

  /**
   * Warn if the installed LLVM differs from the version the back end was validated against.
   *
   * @return whether the versions are known to match or the back end accepts any version
   */
  boolean checkLlvm(String pVerifier, String pRequiredVersion, LogManager pLogger) {
    if (pRequiredVersion.equals("any")) {
      return true;
    }
    Optional<String> installed = get(LLVM);
    if (!installed.isPresent()) {
      pLogger.log(Level.INFO, "Version of LLVM is unknown, cannot check compatibility");
      return false;
    }
    if (!installed.orElseThrow().equals(pRequiredVersion)) {
      pLogger.logf(
          Level.WARNING,
          "%s was validated with LLVM %s, but LLVM %s is installed",
          pVerifier,
          pRequiredVersion,
          installed.orElseThrow());
      return false;
    }
    return true;
  }
}
