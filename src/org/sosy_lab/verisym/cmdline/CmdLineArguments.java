// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.cmdline;

import com.google.common.base.Ascii;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Translates command-line arguments into configuration options. Every argument except the source
 * files, {@code --config}, {@code --help}, and {@code --version} ends up as an option value.
 */
final class CmdLineArguments {

  private static final Splitter KEY_VALUE = Splitter.on('=').trimResults().limit(2);

  private static final ImmutableSet<String> POINTS_TO_MODES = ImmutableSet.of("fs", "fi", "old");

  /** Result of parsing the command line. */
  static final class Arguments {
    private final ImmutableMap<String, String> options;
    private final ImmutableList<String> programs;
    private final @Nullable Path configFile;
    private final boolean help;
    private final boolean version;

    private Arguments(
        ImmutableMap<String, String> pOptions,
        ImmutableList<String> pPrograms,
        @Nullable Path pConfigFile,
        boolean pHelp,
        boolean pVersion) {
      options = pOptions;
      programs = pPrograms;
      configFile = pConfigFile;
      help = pHelp;
      version = pVersion;
    }

    ImmutableMap<String, String> getOptions() {
      return options;
    }

    ImmutableList<String> getPrograms() {
      return programs;
    }

    Optional<Path> getConfigFile() {
      return Optional.ofNullable(configFile);
    }

    boolean isHelp() {
      return help;
    }

    boolean isVersion() {
      return version;
    }
  }

  /** An argument that sets an option to a fixed value. */
  private static final class Flag {
    private final String name;
    private final String option;
    private final String value;

    Flag(String pName, String pOption, String pValue) {
      name = pName;
      option = pOption;
      value = pValue;
    }
  }

  /** An argument with a value that is copied into an option. */
  private static final class ValueArgument {
    private final String name;
    private final String option;
    private final String description;

    ValueArgument(String pName, String pOption, String pDescription) {
      name = pName;
      option = pOption;
      description = pDescription;
    }
  }

  private static final ImmutableList<Flag> FLAGS =
      ImmutableList.of(
          new Flag("--no-slice", "pipeline.slicing", "false"),
          new Flag("--require-slicer", "pipeline.requireSlicer", "true"),
          new Flag("--no-optimize", "pipeline.optimize", "false"),
          new Flag("--no-witness", "pipeline.witness", "false"),
          new Flag("--no-verification", "pipeline.verification", "false"),
          new Flag("--witness-with-source-lines", "pipeline.witness.sourceLines", "true"),
          new Flag("--save-files", "pipeline.saveFiles", "true"),
          new Flag("--debug", "pipeline.debug", "true"));

  private static final ImmutableList<ValueArgument> VALUE_ARGUMENTS =
      ImmutableList.of(
          new ValueArgument("--prp", "pipeline.property", "property or property file"),
          new ValueArgument("--pta", "pipeline.slicing.pta", "points-to analysis: fs, fi, old"),
          new ValueArgument("--repeat-slicing", "pipeline.slicing.repeat", "slicer iterations"),
          new ValueArgument("--timeout", "pipeline.timeout", "time limit in seconds, 0 for none"),
          new ValueArgument("--verifier", "pipeline.verifier", "back end to run"),
          new ValueArgument("--witness", "pipeline.witness.file", "file for the witness"),
          new ValueArgument("--install-dir", "tools.installDirectory", "toolchain directory"));

  private CmdLineArguments() {}

  static Arguments parse(String[] pArgs) throws InvalidCmdlineArgumentException {
    Map<String, String> options = new LinkedHashMap<>();
    ImmutableList.Builder<String> programs = ImmutableList.builder();
    @Nullable Path configFile = null;
    boolean help = false;
    boolean version = false;

    Iterator<String> args = ImmutableList.copyOf(pArgs).iterator();
    nextArgument:
    while (args.hasNext()) {
      String arg = args.next();

      if (arg.equals("-h") || arg.equals("--help")) {
        help = true;
        continue;
      }
      if (arg.equals("--version")) {
        version = true;
        continue;
      }

      for (Flag flag : FLAGS) {
        if (arg.equals(flag.name)) {
          options.put(flag.option, flag.value);
          continue nextArgument;
        }
      }
      for (ValueArgument argument : VALUE_ARGUMENTS) {
        String value = valueOf(argument.name, arg, args);
        if (value != null) {
          if (argument.name.equals("--pta")) {
            checkPointsToMode(value);
          }
          options.put(argument.option, value);
          continue nextArgument;
        }
      }

      String configValue = valueOf("--config", arg, args);
      if (configValue != null) {
        configFile = Path.of(configValue);
        continue;
      }

      String option = valueOf("--option", arg, args);
      if (option != null) {
        List<String> keyValue = KEY_VALUE.splitToList(option);
        if (keyValue.size() != 2 || keyValue.get(0).isEmpty()) {
          throw new InvalidCmdlineArgumentException(
              "--option expects an argument of the form key=value, got '" + option + "'");
        }
        options.put(keyValue.get(0), keyValue.get(1));
        continue;
      }

      if (arg.startsWith("-")) {
        throw new InvalidCmdlineArgumentException("Unknown argument " + arg);
      }
      programs.add(arg);
    }

    ImmutableList<String> programList = programs.build();
    if (programList.isEmpty() && !help && !version) {
      throw new InvalidCmdlineArgumentException("No source file given");
    }
    return new Arguments(ImmutableMap.copyOf(options), programList, configFile, help, version);
  }

  /**
   * Value of an argument given either as {@code --name=value} or as {@code --name value}, or null
   * if the current argument is a different one.
   */
  private static @Nullable String valueOf(String pName, String pArg, Iterator<String> pArgs)
      throws InvalidCmdlineArgumentException {
    if (pArg.startsWith(pName + "=")) {
      return pArg.substring(pName.length() + 1);
    }
    if (pArg.equals(pName)) {
      if (!pArgs.hasNext()) {
        throw new InvalidCmdlineArgumentException(pName + " needs an argument");
      }
      return pArgs.next();
    }
    return null;
  }

  private static void checkPointsToMode(String pValue) throws InvalidCmdlineArgumentException {
    if (!POINTS_TO_MODES.contains(Ascii.toLowerCase(pValue))) {
      throw new InvalidCmdlineArgumentException(
          "Invalid points-to analysis '" + pValue + "', use one of " + POINTS_TO_MODES);
    }
  }

  static void printHelp(PrintStream pOut) {
    pOut.println("Usage: verisym [OPTION]... FILE.c...");
    pOut.println();
    for (ValueArgument argument : VALUE_ARGUMENTS) {
      pOut.printf("  %-28s %s%n", argument.name + "=VALUE", argument.description);
    }
    for (Flag flag : FLAGS) {
      pOut.printf("  %-28s sets %s=%s%n", flag.name, flag.option, flag.value);
    }
    pOut.printf("  %-28s %s%n", "--config=FILE", "read options from a properties file");
    pOut.printf("  %-28s %s%n", "--option KEY=VALUE", "set any configuration option");
    pOut.printf("  %-28s %s%n", "--version", "print the versions of the toolchain");
    pOut.printf("  %-28s %s%n", "--help", "print this help");
  }
}
