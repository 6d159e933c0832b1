// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableSortedSet;
import org.sosy_lab.common.ShutdownNotifier;
import org.sosy_lab.common.configuration.Configuration;
import org.sosy_lab.common.configuration.InvalidConfigurationException;
import org.sosy_lab.common.log.LogManager;

/** Creates the {@link ToolAdapter} for a back end name. */
public final class ToolAdapters {

  private static final ImmutableSortedSet<String> KNOWN_NAMES =
      ImmutableSortedSet.of(
          KleeAdapter.NAME,
          SmackAdapter.NAME,
          SeahornAdapter.NAME,
          DivineAdapter.NAME,
          NidhuggAdapter.NAME,
          ScriptVerifierAdapter.NAME);

  private ToolAdapters() {}

  public static ImmutableSortedSet<String> knownNames() {
    return KNOWN_NAMES;
  }

  public static boolean isKnown(String pName) {
    return KNOWN_NAMES.contains(pName);
  }

  /**
   * Create the adapter for the given back end, configured from the options with prefix {@code
   * verifier.<name>}.
   *
   * @throws InvalidConfigurationException if the name is unknown or the adapter's options are
   *     invalid
   */
  public static ToolAdapter create(
      String pName,
      Configuration pConfig,
      LogManager pLogger,
      ShutdownNotifier pShutdownNotifier)
      throws InvalidConfigurationException {
    switch (pName) {
      case KleeAdapter.NAME:
        return new KleeAdapter(pConfig, pLogger, pShutdownNotifier);
      case SmackAdapter.NAME:
        return new SmackAdapter(pConfig, pLogger, pShutdownNotifier);
      case SeahornAdapter.NAME:
        return new SeahornAdapter(pConfig, pLogger, pShutdownNotifier);
      case DivineAdapter.NAME:
        return new DivineAdapter(pConfig, pLogger, pShutdownNotifier);
      case NidhuggAdapter.NAME:
        return new NidhuggAdapter(pConfig, pLogger, pShutdownNotifier);
      case ScriptVerifierAdapter.NAME:
        return new ScriptVerifierAdapter(pConfig, pLogger, pShutdownNotifier);
      default:
        throw new InvalidConfigurationException(
            "Unknown verifier '" + pName + "', known verifiers are " + KNOWN_NAMES);
    }
  }
}
