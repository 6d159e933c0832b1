// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core.specification;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A safety property a verification run can check. Composite shortcuts such as MEMSAFETY are not
 * properties themselves; {@link PropertyParser} expands them into their components.
 */
public enum Property {
  VALID_DEREF("VALID-DEREF", "valid-deref", ImmutableList.of()),
  VALID_FREE("VALID-FREE", "valid-free", ImmutableList.of()),
  MEM_TRACK("MEM-TRACK", "valid-memtrack", ImmutableList.of()),
  NULL_DEREF("NULL-DEREF", "null-deref", ImmutableList.of()),
  UNDEF_BEHAVIOR("UNDEF-BEHAVIOR", null, ImmutableList.of("-fsanitize=undefined")),
  SIGNED_OVERFLOW(
      "SIGNED-OVERFLOW", null, ImmutableList.of("-fsanitize=signed-integer-overflow")),
  REACHCALL("REACHCALL", null, ImmutableList.of());

  private final String canonicalName;
  private final @Nullable String monitorName;
  private final ImmutableList<String> compilerFlags;

  Property(
      String pCanonicalName, @Nullable String pMonitorName, ImmutableList<String> pCompilerFlags) {
    canonicalName = pCanonicalName;
    monitorName = pMonitorName;
    compilerFlags = pCompilerFlags;
  }

  /** Identifier used in logs, option values, and verdict labels, e.g. {@code VALID-DEREF}. */
  public String getCanonicalName() {
    return canonicalName;
  }

  /**
   * Name of the monitor definition (a directory below the instrumentation directory) that
   * implements this property, or empty if the property is checked without instrumentation.
   */
  public Optional<String> getMonitorName() {
    return Optional.ofNullable(monitorName);
  }

  /** Compiler flags needed to check this property (e.g. sanitizer checks). */
  public ImmutableList<String> getCompilerFlags() {
    return compilerFlags;
  }

  /** Label used in the result line, e.g. {@code valid-deref} in {@code false(valid-deref)}. */
  public String getResultLabel() {
    return Ascii.toLowerCase(canonicalName);
  }

  /**
   * The broader property that is violated whenever this one is, e.g. every null dereference is an
   * invalid dereference.
   */
  public Optional<Property> getImpliedProperty() {
    return this == NULL_DEREF ? Optional.of(VALID_DEREF) : Optional.empty();
  }

  /** Lookup by canonical name, case-insensitive. */
  public static Optional<Property> forCanonicalName(String pName) {
    for (Property p : values()) {
      if (Ascii.equalsIgnoreCase(p.canonicalName, pName)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return canonicalName;
  }
}
