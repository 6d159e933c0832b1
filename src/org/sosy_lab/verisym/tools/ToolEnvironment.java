// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Description of what a child process needs in its environment: additional directories in front of
 * {@code PATH} and {@code LD_LIBRARY_PATH}, and additional variables. Creating a description has
 * no effect, it is applied to the environment of a single child process by {@link
 * ToolExecution}.
 */
@Immutable
public final class ToolEnvironment {

  private static final ToolEnvironment EMPTY =
      new ToolEnvironment(ImmutableList.of(), ImmutableList.of(), ImmutableMap.of());

  @SuppressWarnings("Immutable") // Path is immutable
  private final ImmutableList<Path> executablePath;

  @SuppressWarnings("Immutable") // Path is immutable
  private final ImmutableList<Path> libraryPath;

  private final ImmutableMap<String, String> variables;

  private ToolEnvironment(
      ImmutableList<Path> pExecutablePath,
      ImmutableList<Path> pLibraryPath,
      ImmutableMap<String, String> pVariables) {
    executablePath = pExecutablePath;
    libraryPath = pLibraryPath;
    variables = pVariables;
  }

  public static ToolEnvironment empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableList<Path> getExecutablePath() {
    return executablePath;
  }

  public ImmutableList<Path> getLibraryPath() {
    return libraryPath;
  }

  public ImmutableMap<String, String> getVariables() {
    return variables;
  }

  /** Apply this description to the environment of a process that is about to be started. */
  void applyTo(Map<String, String> pEnvironment) {
    prepend(pEnvironment, "PATH", executablePath);
    prepend(pEnvironment, "LD_LIBRARY_PATH", libraryPath);
    pEnvironment.putAll(variables);
  }

  private static void prepend(Map<String, String> pEnvironment, String pName, List<Path> pDirs) {
    if (pDirs.isEmpty()) {
      return;
    }
    List<Object> entries = new ArrayList<>(pDirs);
    String existing = pEnvironment.get(pName);
    if (existing != null && !existing.isEmpty()) {
      entries.add(existing);
    }
    pEnvironment.put(pName, Joiner.on(File.pathSeparatorChar).join(entries));
  }

  @Override
  public String toString() {
    return "PATH+=" + executablePath + ", LD_LIBRARY_PATH+=" + libraryPath + ", " + variables;
  }

  public static final class Builder {

    private final ImmutableList.Builder<Path> executablePath = ImmutableList.builder();
    private final ImmutableList.Builder<Path> libraryPath = ImmutableList.builder();
    private final ImmutableMap.Builder<String, String> variables = ImmutableMap.builder();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addExecutableDirectory(Path pDir) {
      executablePath.add(pDir);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addLibraryDirectory(Path pDir) {
      libraryPath.add(pDir);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setVariable(String pName, String pValue) {
      variables.put(pName, pValue);
      return this;
    }

    public ToolEnvironment build() {
      return new ToolEnvironment(
          executablePath.build(), libraryPath.build(), variables.buildOrThrow());
    }
  }
}
