// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.cmdline;

import com.google.common.base.MoreObjects;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import org.sosy_lab.common.ShutdownManager;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.ConfigurationBuilder;
import org.sosy_lab.common.configuration.FileOption;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.configuration.converters.FileTypeConverter;
import org.sosy_lab.common.log.BasicLogManager;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.common.time.Timer;
import org.sosy_lab.verisym.core.PipelineResult;
import org.sosy_lab.verisym.core.VerificationPipeline;
import org.sosy_lab.verisym.stages.Toolchain;
import org.sosy_lab.verisym.tools.ToolAdapter;
import org.sosy_lab.verisym.tools.ToolAdapters;

public final class VerisymMain {

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1;
  static final int EXIT_USAGE = 2;

  private static final String DEFAULT_VERIFIER = "klee";

  private VerisymMain() {}

  public static void main(String[] args) {
    ShutdownManager shutdownManager = ShutdownManager.create();
    Thread interruptHook =
        new Thread(() -> shutdownManager.requestShutdown("The JVM is shutting down."));
    Runtime.getRuntime().addShutdownHook(interruptHook);

    int exitCode = run(args, System.out, shutdownManager);

    Runtime.getRuntime().removeShutdownHook(interruptHook);
    System.out.flush();
    System.exit(exitCode);
  }

  static int run(String[] pArgs, PrintStream pOut, ShutdownManager pShutdownManager) {
    Timer timer = new Timer();
    timer.start();

    CmdLineArguments.Arguments arguments;
    try {
      arguments = CmdLineArguments.parse(pArgs);
    } catch (InvalidCmdlineArgumentException e) {
      pOut.println("Error: " + e.getMessage() + " (use --help for usage)");
      return EXIT_USAGE;
    }
    if (arguments.isHelp()) {
      CmdLineArguments.printHelp(pOut);
      return EXIT_OK;
    }

    Configuration config;
    LogManager logger;
    try {
      config = createConfiguration(arguments.getConfigFile(), arguments.getOptions());
      logger = BasicLogManager.create(config);
    } catch (InvalidConfigurationException e) {
      pOut.println("Invalid configuration: " + e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      pOut.println("Could not read configuration file: " + e.getMessage());
      return EXIT_ERROR;
    }

    if (arguments.isVersion()) {
      return printVersion(config, logger, pOut);
    }

    checkToolchainVersion(config, logger, pShutdownManager);

    PipelineResult result =
        new VerificationPipeline(config, logger, pShutdownManager.getNotifier())
            .run(arguments.getPrograms());

    timer.stop();
    pOut.println(
        String.format(
            Locale.ROOT, "Elapsed time: %.3f s", timer.getSumTime().asMillis() / 1000.0));
    pOut.println("RESULT: " + result.getResultString());
    return result.getExitCode();
  }

  private static Configuration createConfiguration(
      Optional<Path> pConfigFile, Map<String, String> pOptions)
      throws InvalidConfigurationException, IOException {
    ConfigurationBuilder builder = Configuration.builder();
    if (pConfigFile.isPresent()) {
      builder.loadFromFile(pConfigFile.orElseThrow());
    }
    builder.setOptions(pOptions);
    Configuration config = builder.build();

    // output files are relative to output.path
    FileTypeConverter fileTypeConverter = FileTypeConverter.create(config);
    return Configuration.builder()
        .copyFrom(config)
        .addConverter(FileOption.class, fileTypeConverter)
        .build();
  }

  private static int printVersion(Configuration pConfig, LogManager pLogger, PrintStream pOut) {
    pOut.println(
        "Verisym "
            + MoreObjects.firstNonNull(
                VerisymMain.class.getPackage().getImplementationVersion(), "(development)"));
    Optional<Path> installDirectory;
    try {
      installDirectory = new Toolchain(pConfig).getInstallDirectory();
    } catch (InvalidConfigurationException e) {
      pOut.println("Invalid configuration: " + e.getMessage());
      return EXIT_ERROR;
    }
    if (!installDirectory.isPresent()) {
      pOut.println("No toolchain directory configured (use --install-dir)");
      return EXIT_OK;
    }
    try {
      ToolchainVersions.read(installDirectory.orElseThrow())
          .asMap()
          .forEach((component, version) -> pOut.println(component + ": " + version));
    } catch (IOException e) {
      pLogger.logUserException(Level.WARNING, e, "Cannot read toolchain versions");
      return EXIT_ERROR;
    }
    return EXIT_OK;
  }

  /** Warn about a toolchain that the selected back end was not validated with. */
  private static void checkToolchainVersion(
      Configuration pConfig, LogManager pLogger, ShutdownManager pShutdownManager) {
    String verifier =
        MoreObjects.firstNonNull(pConfig.getProperty("pipeline.verifier"), DEFAULT_VERIFIER);
    Optional<Path> installDirectory;
    ToolAdapter adapter;
    try {
      installDirectory = new Toolchain(pConfig).getInstallDirectory();
      adapter = ToolAdapters.create(verifier, pConfig, pLogger, pShutdownManager.getNotifier());
    } catch (InvalidConfigurationException e) {
      // reported by the pipeline
      pLogger.logDebugException(e, "Skipping toolchain version check");
      return;
    }
    if (!installDirectory.isPresent()) {
      return;
    }
    try {
      ToolchainVersions.read(installDirectory.orElseThrow())
          .checkLlvm(adapter.name(), adapter.requiredToolVersion(), pLogger);
    } catch (IOException e) {
      pLogger.logUserException(Level.INFO, e, "Cannot read toolchain versions");
    }
  }
}
