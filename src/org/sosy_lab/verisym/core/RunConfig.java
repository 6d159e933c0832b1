// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import static com.google.common.collect.FluentIterable.from;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.IntegerOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.Option;
import org.sosy_lab.common.configuration.Options;
import org.sosy_lab.common.configuration.TimeSpanOption;
import org.sosy_lab.common.time.TimeSpan;
import org.sosy_lab.verisym.core.specification.Property;
import org.sosy_lab.verisym.core.specification.PropertyParser;
import org.sosy_lab.verisym.core.specification.PropertySpecification;
import org.sosy_lab.verisym.stages.PointsToMode;
import org.sosy_lab.verisym.stages.Toolchain;
import org.sosy_lab.verisym.tools.ToolAdapters;

/**
 * Settings of one verification run. An instance is created and validated once when the run
 * starts and is not changed afterwards; stages only read it.
 */
@Options(prefix = "pipeline")
public final class RunConfig {

  private static final Splitter FLAG_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  @Option(
      secure = true,
      name = "property",
      description =
          "property to check: a shortcut like MEMSAFETY or VALID-DEREF, an SV-COMP LTL formula,"
              + " or a property file with one entry per line")
  private String propertyOption = "REACHCALL";

  @Option(secure = true, description = "verification back end to run")
  private String verifier = "klee";

  @Option(secure = true, name = "slicing", description = "slice the program before verifying it")
  private boolean slicing = true;

  @Option(
      secure = true,
      description = "abort the run if slicing fails instead of verifying the unsliced program")
  private boolean requireSlicer = false;

  @Option(
      secure = true,
      name = "slicing.repeat",
      description = "maximal number of slicer iterations, slicing stops earlier at a fixed point")
  @IntegerOption(min = 1)
  private int slicingRepeat = 1;

  @Option(
      secure = true,
      name = "slicing.pta",
      toUppercase = true,
      description = "points-to analysis of the slicer: FS, FI, or OLD")
  private PointsToMode pointsToMode = PointsToMode.FS;

  @Option(
      secure = true,
      name = "slicing.criteria",
      description = "functions whose call sites are the slicing criterion")
  private List<String> slicingCriteria =
      ImmutableList.of("__assert_fail", "__VERIFIER_error", "reach_error");

  @Option(secure = true, description = "optimize the bitcode after linking")
  private boolean optimize = true;

  @Option(secure = true, name = "optimize.flags", description = "flags for the optimizer")
  private String optimizeFlags = "-O2";

  @Option(
      secure = true,
      name = "witness",
      description = "write a witness for true and false verdicts")
  private boolean witness = true;

  @Option(secure = true, name = "witness.file", description = "file the witness is written to")
  @FileOption(FileOption.Type.OUTPUT_FILE)
  private @Nullable Path witnessFile = Path.of("witness.graphml");

  @Option(
      secure = true,
      name = "witness.sourceLines",
      description = "annotate witness edges with the text of their source line")
  private boolean witnessSourceLines = false;

  @Option(
      secure = true,
      description = "run the verification back end (otherwise stop after building the bitcode)")
  private boolean verification = true;

  @Option(
      secure = true,
      description = "time limit for the whole run, 0 for no limit (use suffix s, min, h)")
  @TimeSpanOption(codeUnit = TimeUnit.SECONDS, defaultUserUnit = TimeUnit.SECONDS, min = 0)
  private TimeSpan timeout = TimeSpan.ofSeconds(0);

  @Option(secure = true, description = "keep the working directory with all intermediate files")
  private boolean saveFiles = false;

  @Option(secure = true, description = "log the output of all external tools")
  private boolean debug = false;

  @Option(
      secure = true,
      description = "make possibly uninitialized stack memory nondeterministic before verifying")
  private boolean symbolizeUninitialized = true;

  @Option(secure = true, description = "additional compiler flags, separated by spaces")
  private String cflags = "";

  @Option(secure = true, description = "additional slicer flags, separated by spaces")
  private String slicerFlags = "";

  @Option(secure = true, description = "additional instrumentation flags, separated by spaces")
  private String instrumentationFlags = "";

  @Option(secure = true, description = "additional linker flags, separated by spaces")
  private String linkFlags = "";

  @Option(secure = true, description = "additional flags for the verifier, separated by spaces")
  private String verifierFlags = "";

  private final ImmutableList<Path> programs;
  private final PropertySpecification specification;
  private final Toolchain toolchain;

  public RunConfig(Configuration pConfig, List<String> pPrograms)
      throws InvalidConfigurationException {
    pConfig.inject(this);
    toolchain = new Toolchain(pConfig);
    specification = PropertyParser.parseSpecification(propertyOption);
    programs = checkPrograms(pPrograms);

    if (!ToolAdapters.isKnown(verifier)) {
      throw new InvalidConfigurationException(
          "Unknown verifier '" + verifier + "', known verifiers are " + ToolAdapters.knownNames());
    }
    if (requireSlicer && !slicing) {
      throw new InvalidConfigurationException(
          "Slicing is disabled, but pipeline.requireSlicer demands a successful slicer run");
    }
    if (witness && witnessFile == null) {
      witness = false;
    }
    for (Property property : specification.getProperties()) {
      Optional<String> monitor = property.getMonitorName();
      if (!monitor.isPresent()) {
        continue;
      }
      Path definition = toolchain.getMonitorDefinition(monitor.orElseThrow());
      if (!Files.isRegularFile(definition)) {
        throw new InvalidConfigurationException(
            "Property " + property + " needs the monitor definition " + definition
                + ", which does not exist");
      }
    }
    if (symbolizeUninitialized && !Files.isRegularFile(toolchain.getPassesLibrary())) {
      throw new InvalidConfigurationException(
          "Symbolizing uninitialized memory needs the pass library "
              + toolchain.getPassesLibrary()
              + ", which does not exist (set pipeline.symbolizeUninitialized=false to skip it)");
    }
  }

  private static ImmutableList<Path> checkPrograms(List<String> pPrograms)
      throws InvalidConfigurationException {
    if (pPrograms.isEmpty()) {
      throw new InvalidConfigurationException("No program given");
    }
    ImmutableList.Builder<Path> result = ImmutableList.builder();
    for (String program : pPrograms) {
      Path path;
      try {
        path = Path.of(program);
      } catch (InvalidPathException e) {
        throw new InvalidConfigurationException("Invalid program path '" + program + "'", e);
      }
      if (!Files.isRegularFile(path)) {
        throw new InvalidConfigurationException("Program file " + path + " does not exist");
      }
      result.add(path);
    }
    return result.build();
  }

  public ImmutableList<Path> getPrograms() {
    return programs;
  }

  public PropertySpecification getSpecification() {
    return specification;
  }

  public Toolchain getToolchain() {
    return toolchain;
  }

  public String getVerifier() {
    return verifier;
  }

  public boolean isSlicingEnabled() {
    return slicing;
  }

  public boolean isSlicerRequired() {
    return requireSlicer;
  }

  public int getSlicingRepeat() {
    return slicingRepeat;
  }

  public PointsToMode getPointsToMode() {
    return pointsToMode;
  }

  public ImmutableList<String> getSlicingCriteria() {
    return ImmutableList.copyOf(slicingCriteria);
  }

  public boolean isOptimizationEnabled() {
    return optimize;
  }

  public ImmutableList<String> getOptimizeFlags() {
    return splitFlags(optimizeFlags);
  }

  public boolean isWitnessEnabled() {
    return witness;
  }

  /** Witness output file, present if witnesses are enabled. */
  public Optional<Path> getWitnessFile() {
    return witness ? Optional.ofNullable(witnessFile) : Optional.empty();
  }

  public boolean isWitnessWithSourceLines() {
    return witnessSourceLines;
  }

  public boolean isVerificationEnabled() {
    return verification;
  }

  public TimeSpan getTimeout() {
    return timeout;
  }

  public boolean isSaveFiles() {
    return saveFiles;
  }

  public boolean isDebug() {
    return debug;
  }

  public boolean isSymbolizeUninitialized() {
    return symbolizeUninitialized;
  }

  public ImmutableList<String> getCflags() {
    return splitFlags(cflags);
  }

  public ImmutableList<String> getSlicerFlags() {
    return splitFlags(slicerFlags);
  }

  public ImmutableList<String> getInstrumentationFlags() {
    return splitFlags(instrumentationFlags);
  }

  public ImmutableList<String> getLinkFlags() {
    return splitFlags(linkFlags);
  }

  public ImmutableList<String> getVerifierFlags() {
    return splitFlags(verifierFlags);
  }

  /** Compiler flags needed by the checked properties followed by the user's flags. */
  public ImmutableList<String> getPropertyCompilerFlags() {
    return from(specification.getProperties())
        .transformAndConcat(Property::getCompilerFlags)
        .append(getCflags())
        .toList();
  }

  private static ImmutableList<String> splitFlags(String pFlags) {
    return ImmutableList.copyOf(FLAG_SPLITTER.split(pFlags));
  }
}
