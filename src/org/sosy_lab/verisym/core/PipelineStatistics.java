// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.base.Ascii;
import com.google.common.base.Strings;
import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.time.Timer;

/** Time spent in each state of a run and the work done by the slicer. */
public final class PipelineStatistics {

  private static final int NAME_WIDTH = 40;

  private final Timer totalTimer = new Timer();
  private final Map<PipelineState, Timer> stateTimers = new EnumMap<>(PipelineState.class);
  private @Nullable Timer currentTimer = null;

  private int slicingIterations = 0;
  private boolean slicerFellBack = false;

  /** Account all time from now on to the given state, until the next call. */
  void enter(PipelineState pState) {
    if (currentTimer != null) {
      currentTimer.stop();
      currentTimer = null;
    }
    if (pState.isTerminal()) {
      if (totalTimer.isRunning()) {
        totalTimer.stop();
      }
      return;
    }
    if (!totalTimer.isRunning()) {
      totalTimer.start();
    }
    currentTimer = stateTimers.computeIfAbsent(pState, s -> new Timer());
    currentTimer.start();
  }

  void setSlicing(int pIterations, boolean pFellBack) {
    slicingIterations = pIterations;
    slicerFellBack = pFellBack;
  }

  public int getSlicingIterations() {
    return slicingIterations;
  }

  public boolean hasSlicerFallenBack() {
    return slicerFellBack;
  }

  public void printStatistics(PrintStream pOut) {
    put(pOut, 0, "Total time for run", totalTimer.getSumTime().formatAs(TimeUnit.SECONDS));
    for (Map.Entry<PipelineState, Timer> entry : stateTimers.entrySet()) {
      put(
          pOut,
          1,
          "Time for " + Ascii.toLowerCase(entry.getKey().name()),
          entry.getValue().getSumTime().formatAs(TimeUnit.SECONDS));
    }
    if (stateTimers.containsKey(PipelineState.SLICE)) {
      put(pOut, 0, "Slicer iterations", slicingIterations);
      put(pOut, 0, "Slicer fell back to unsliced program", slicerFellBack ? "yes" : "no");
    }
  }

  private static void put(PrintStream pOut, int pLevel, String pName, Object pValue) {
    String name = Strings.repeat("  ", pLevel) + pName + ":";
    pOut.println(Strings.padEnd(name, NAME_WIDTH, ' ') + pValue);
  }
}
