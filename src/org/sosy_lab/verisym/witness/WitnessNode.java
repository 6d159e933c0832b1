// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.witness;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/** A node of a witness automaton, identified by its id. */
@Immutable
public final class WitnessNode {

  private final String id;
  private final boolean entry;
  private final boolean violation;
  private final boolean sink;

  public WitnessNode(String pId, boolean pEntry, boolean pViolation, boolean pSink) {
    Preconditions.checkArgument(!pId.isEmpty(), "node id must not be empty");
    id = pId;
    entry = pEntry;
    violation = pViolation;
    sink = pSink;
  }

  /** Node id in the form used by the written witnesses. */
  static String idFor(int pIndex) {
    return "N" + pIndex;
  }

  public String getId() {
    return id;
  }

  public boolean isEntry() {
    return entry;
  }

  public boolean isViolation() {
    return violation;
  }

  public boolean isSink() {
    return sink;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof WitnessNode)) {
      return false;
    }
    WitnessNode other = (WitnessNode) pObj;
    return id.equals(other.id)
        && entry == other.entry
        && violation == other.violation
        && sink == other.sink;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, entry, violation, sink);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(id);
    if (entry) {
      sb.append("[entry]");
    }
    if (violation) {
      sb.append("[violation]");
    }
    if (sink) {
      sb.append("[sink]");
    }
    return sb.toString();
  }
}
