// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core.specification;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.common.configuration.InvalidConfigurationException;

/**
 * Maps user-facing property strings (SV-COMP LTL formulas or shortcuts) to canonical {@link
 * Property} sets. The mapping is a fixed table; anything not in it is rejected.
 */
public final class PropertyParser {

  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  // keys without any whitespace
  private static final ImmutableMap<String, ImmutableSet<Property>> LTL_FORMULAS =
      ImmutableMap.<String, ImmutableSet<Property>>builder()
          .put("CHECK(init(main()),LTL(G!call(__VERIFIER_error())))", of(Property.REACHCALL))
          .put("CHECK(init(main()),LTL(G!call(reach_error())))", of(Property.REACHCALL))
          .put("CHECK(init(main()),LTL(Gvalid-deref))", of(Property.VALID_DEREF))
          .put("CHECK(init(main()),LTL(Gvalid-free))", of(Property.VALID_FREE))
          .put("CHECK(init(main()),LTL(Gvalid-memtrack))", of(Property.MEM_TRACK))
          .put("CHECK(init(main()),LTL(G!overflow))", of(Property.SIGNED_OVERFLOW))
          .put("CHECK(init(main()),LTL(Gdefined-behavior))", of(Property.UNDEF_BEHAVIOR))
          .buildOrThrow();

  // keys in upper case with '-' as separator
  private static final ImmutableMap<String, ImmutableSet<Property>> SHORTCUTS =
      ImmutableMap.<String, ImmutableSet<Property>>builder()
          .put("VALID-DEREF", of(Property.VALID_DEREF))
          .put("VALID-FREE", of(Property.VALID_FREE))
          .put("MEM-TRACK", of(Property.MEM_TRACK))
          .put("VALID-MEMTRACK", of(Property.MEM_TRACK))
          .put("MEMTRACK", of(Property.MEM_TRACK))
          .put("NULL-DEREF", of(Property.NULL_DEREF))
          .put("UNDEF-BEHAVIOR", of(Property.UNDEF_BEHAVIOR))
          .put("UNDEFINED-BEHAVIOR", of(Property.UNDEF_BEHAVIOR))
          .put("SIGNED-OVERFLOW", of(Property.SIGNED_OVERFLOW))
          .put("NO-OVERFLOW", of(Property.SIGNED_OVERFLOW))
          .put("REACHCALL", of(Property.REACHCALL))
          .put("UNREACH-CALL", of(Property.REACHCALL))
          .put("MEMSAFETY", PropertySpecification.memorySafety())
          .put("MEMORY-SAFETY", PropertySpecification.memorySafety())
          .buildOrThrow();

  private PropertyParser() {}

  private static ImmutableSet<Property> of(Property pProperty) {
    return Sets.immutableEnumSet(pProperty);
  }

  /**
   * Parse one property entry.
   *
   * @throws InvalidConfigurationException if the entry is not in the mapping table
   */
  public static ImmutableSet<Property> parseProperty(String pEntry)
      throws InvalidConfigurationException {
    String compact = WHITESPACE.removeFrom(pEntry);
    ImmutableSet<Property> result = LTL_FORMULAS.get(compact);
    if (result == null) {
      result = SHORTCUTS.get(Ascii.toUpperCase(compact).replace('_', '-'));
    }
    if (result == null) {
      throw new InvalidConfigurationException(
          "Unknown property '"
              + pEntry
              + "', supported shortcuts are "
              + SHORTCUTS.keySet()
              + " and the SV-COMP LTL formulas for them");
    }
    return result;
  }

  /**
   * Parse the value of the property option. If it names an existing file, the file is read and
   * every non-empty line is one entry. Otherwise the value itself is split at whitespace.
   */
  public static PropertySpecification parseSpecification(String pSpec)
      throws InvalidConfigurationException {
    if (Strings.isNullOrEmpty(pSpec) || WHITESPACE.matchesAllOf(pSpec)) {
      throw new InvalidConfigurationException("No property given");
    }

    List<String> entries;
    Path file = asExistingFile(pSpec);
    if (file != null) {
      try {
        entries =
            Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(l -> !l.isEmpty() && !l.startsWith("//"))
                .collect(ImmutableList.toImmutableList());
      } catch (IOException e) {
        throw new InvalidConfigurationException(
            "Cannot read property file " + file + ": " + e.getMessage(), e);
      }
      if (entries.isEmpty()) {
        throw new InvalidConfigurationException("Property file " + file + " is empty");
      }
    } else {
      entries = Splitter.on(WHITESPACE).omitEmptyStrings().splitToList(pSpec);
    }

    EnumSet<Property> properties = EnumSet.noneOf(Property.class);
    for (String entry : entries) {
      properties.addAll(parseProperty(entry));
    }
    return new PropertySpecification(
        Sets.immutableEnumSet(properties), ImmutableList.copyOf(entries));
  }

  private static @Nullable Path asExistingFile(String pSpec) {
    try {
      Path path = Path.of(pSpec.trim());
      return Files.isRegularFile(path) ? path : null;
    } catch (InvalidPathException e) {
      // LTL formulas may contain characters that are not valid in paths
      return null;
    }
  }
}
