// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core.specification;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/** The set of properties a run checks, together with the user input they were parsed from. */
@Immutable
public final class PropertySpecification {

  private static final ImmutableSet<Property> MEMORY_SAFETY =
      Sets.immutableEnumSet(Property.VALID_DEREF, Property.VALID_FREE, Property.MEM_TRACK);

  private final ImmutableSet<Property> properties;
  private final ImmutableList<String> originalEntries;

  PropertySpecification(ImmutableSet<Property> pProperties, ImmutableList<String> pOriginal) {
    Preconditions.checkArgument(!pProperties.isEmpty(), "empty property specification");
    properties = pProperties;
    originalEntries = pOriginal;
  }

  /** The canonical properties, in declaration order of {@link Property}. */
  public ImmutableSet<Property> getProperties() {
    return properties;
  }

  /** The entries (LTL formulas or shortcuts) given by the user, in input order. */
  public ImmutableList<String> getOriginalEntries() {
    return originalEntries;
  }

  /** The user input as one string, one entry per line. */
  public String getOriginalText() {
    return Joiner.on('\n').join(originalEntries);
  }

  public boolean contains(Property pProperty) {
    return properties.contains(pProperty);
  }

  /** Whether all three memory-safety sub-properties are checked. */
  public boolean coversMemorySafety() {
    return properties.containsAll(MEMORY_SAFETY);
  }

  public static ImmutableSet<Property> memorySafety() {
    return MEMORY_SAFETY;
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof PropertySpecification)) {
      return false;
    }
    PropertySpecification other = (PropertySpecification) pObj;
    return properties.equals(other.properties) && originalEntries.equals(other.originalEntries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(properties, originalEntries);
  }

  @Override
  public String toString() {
    return Joiner.on(", ").join(properties);
  }
}
