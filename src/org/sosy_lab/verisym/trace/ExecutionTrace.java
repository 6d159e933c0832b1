// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.trace;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Immutable;
import java.util.List;

/**
 * Sequence of program points of an execution that violates the checked property. The last record
 * is the point of the violation. A trace is never empty.
 */
@Immutable
public final class ExecutionTrace {

  private final ImmutableList<TraceRecord> records;

  public ExecutionTrace(List<TraceRecord> pRecords) {
    Preconditions.checkArgument(!pRecords.isEmpty(), "execution trace must not be empty");
    records = ImmutableList.copyOf(pRecords);
  }

  public ImmutableList<TraceRecord> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public TraceRecord getViolationPoint() {
    return Iterables.getLast(records);
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof ExecutionTrace && records.equals(((ExecutionTrace) pObj).records);
  }

  @Override
  public int hashCode() {
    return records.hashCode();
  }

  @Override
  public String toString() {
    return "ExecutionTrace" + records;
  }
}
