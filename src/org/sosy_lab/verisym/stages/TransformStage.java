// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.core.ArtifactRole;
import org.sosy_lab.verisym.core.PipelineArtifact;
import org.sosy_lab.verisym.core.RunConfig;
import org.sosy_lab.verisym.exceptions.PipelineStageException;
import org.sosy_lab.verisym.stages.transform.SourceText;
import org.sosy_lab.verisym.stages.transform.SourceTransformChain;

/**
 * Turns the source files into one bitcode module: normalizes every source file with the {@link
 * SourceTransformChain}, compiles each normalized file with debug information, links them, and
 * optionally makes uninitialized memory nondeterministic.
 */
public final class TransformStage {

  public static final String NAME = "transform";

  /** Name of the pass in the passes library that symbolizes uninitialized memory. */
  static final String SYMBOLIZE_PASS = "-initialize-uninitialized";

  /** Normalized sources and the bitcode compiled from them. */
  public static final class Result {
    private final ImmutableList<NormalizedSource> sources;
    private final PipelineArtifact bitcode;

    private Result(ImmutableList<NormalizedSource> pSources, PipelineArtifact pBitcode) {
      sources = pSources;
      bitcode = pBitcode;
    }

    public ImmutableList<NormalizedSource> getSources() {
      return sources;
    }

    public PipelineArtifact getBitcode() {
      return bitcode;
    }
  }

  private final RunConfig config;
  private final LogManager logger;
  private final ToolStep toolStep;
  private final SourceTransformChain transforms;

  public TransformStage(RunConfig pConfig, LogManager pLogger, ToolStep pToolStep) {
    config = pConfig;
    logger = pLogger;
    toolStep = pToolStep;
    transforms = new SourceTransformChain(pLogger);
  }

  public Result run() throws PipelineStageException, InterruptedException {
    ImmutableList<Path> programs = config.getPrograms();
    ImmutableList.Builder<NormalizedSource> sources = ImmutableList.builder();
    ImmutableList.Builder<Path> compiled = ImmutableList.builder();

    for (int i = 0; i < programs.size(); i++) {
      // separate directories keep files with equal names apart
      Path directory = toolStep.getWorkingDirectory();
      if (programs.size() > 1) {
        directory = directory.resolve(Integer.toString(i));
      }
      NormalizedSource source = normalize(programs.get(i), directory);
      sources.add(source);
      compiled.add(compile(source));
    }

    ImmutableList<Path> modules = compiled.build();
    Path bitcode;
    if (modules.size() == 1) {
      bitcode = modules.get(0);
    } else {
      bitcode = toolStep.getWorkingDirectory().resolve("program.bc");
      toolStep.run(
          NAME,
          ImmutableList.<String>builder()
              .add(config.getToolchain().getLlvmLink(), "-o", bitcode.toString())
              .addAll(modules.stream().map(Path::toString).iterator())
              .build(),
          bitcode);
    }

    if (config.isSymbolizeUninitialized()) {
      Path symbolized = withSuffix(bitcode, ".init.bc");
      toolStep.run(
          NAME,
          ImmutableList.of(
              config.getToolchain().getOpt(),
              "-load=" + config.getToolchain().getPassesLibrary(),
              SYMBOLIZE_PASS,
              "-o",
              symbolized.toString(),
              bitcode.toString()),
          symbolized);
      bitcode = symbolized;
    }

    logger.logf(Level.FINE, "Compiled %d source file(s) into %s", programs.size(), bitcode);
    return new Result(
        sources.build(), new PipelineArtifact(bitcode, ArtifactRole.COMPILED_BITCODE, NAME));
  }

  private NormalizedSource normalize(Path pProgram, Path pDirectory)
      throws PipelineStageException {
    String content;
    try {
      content = Files.readString(pProgram, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PipelineStageException(NAME, "Cannot read " + pProgram + ": " + e.getMessage(), e);
    }

    String fileName = pProgram.getFileName().toString();
    SourceText normalized = transforms.apply(SourceText.original(fileName, content));

    Path target = pDirectory.resolve(fileName);
    try {
      Files.createDirectories(pDirectory);
      Files.writeString(target, normalized.getContent(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PipelineStageException(NAME, "Cannot write " + target + ": " + e.getMessage(), e);
    }

    return new NormalizedSource(
        pProgram,
        ImmutableList.copyOf(Splitter.onPattern("\\r?\\n").split(content)),
        normalized,
        new PipelineArtifact(target, ArtifactRole.NORMALIZED_SOURCE, NAME));
  }

  private Path compile(NormalizedSource pSource)
      throws PipelineStageException, InterruptedException {
    Path source = pSource.getArtifact().getPath();
    Path output = withSuffix(source, ".bc");
    toolStep.run(
        NAME,
        ImmutableList.<String>builder()
            .add(config.getToolchain().getClang(), "-c", "-emit-llvm", "-g", "-O0")
            .addAll(config.getPropertyCompilerFlags())
            .add("-o", output.toString(), source.toString())
            .build(),
        output);
    return output;
  }

  /** Replace the extension of the file name with the given suffix. */
  static Path withSuffix(Path pFile, String pSuffix) {
    return pFile.resolveSibling(MoreFiles.getNameWithoutExtension(pFile) + pSuffix);
  }
}
