// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.base.Preconditions;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.sosy_lab.common.time.TimeSpan;

/** The point in time at which a run has to stop, if there is one. */
public final class RunDeadline {

  private static final RunDeadline UNBOUNDED = new RunDeadline(Long.MAX_VALUE, false);

  private final long endNanos;
  private final boolean bounded;

  private RunDeadline(long pEndNanos, boolean pBounded) {
    endNanos = pEndNanos;
    bounded = pBounded;
  }

  public static RunDeadline unbounded() {
    return UNBOUNDED;
  }

  /** Deadline that expires after the given time from now. A zero time span means no deadline. */
  public static RunDeadline after(TimeSpan pTimeout) {
    Preconditions.checkArgument(pTimeout.asNanos() >= 0, "negative timeout %s", pTimeout);
    if (pTimeout.asNanos() == 0) {
      return UNBOUNDED;
    }
    return new RunDeadline(System.nanoTime() + pTimeout.asNanos(), true);
  }

  public boolean isBounded() {
    return bounded;
  }

  public boolean isExpired() {
    return bounded && System.nanoTime() - endNanos >= 0;
  }

  /** Time left until the deadline, empty for unbounded deadlines. Never negative. */
  public Optional<TimeSpan> getRemaining() {
    if (!bounded) {
      return Optional.empty();
    }
    long remaining = Math.max(0, endNanos - System.nanoTime());
    return Optional.of(TimeSpan.of(remaining, TimeUnit.NANOSECONDS));
  }

  /** Remaining time in whole seconds, rounded up, for tools that take a time limit argument. */
  public Optional<Long> getRemainingSeconds() {
    return getRemaining()
        .map(t -> (t.asNanos() + TimeUnit.SECONDS.toNanos(1) - 1) / TimeUnit.SECONDS.toNanos(1));
  }

  @Override
  public String toString() {
    return getRemaining().map(t -> "deadline in " + t).orElse("no deadline");
  }
}
