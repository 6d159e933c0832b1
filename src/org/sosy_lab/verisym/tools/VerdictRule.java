// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.Verdict.Kind;
import org.sosy_lab.verisym.core.specification.Property;

/**
 * One rule of a {@link VerdictGrammar}: an output line matching the pattern (anywhere in the line,
 * unless the pattern is anchored) yields the given verdict.
 */
@Immutable
public final class VerdictRule {

  @SuppressWarnings("Immutable") // Pattern is immutable
  private final Pattern marker;

  private final Kind kind;
  // fixed property label for FALSE, null if the label is taken from the first group
  private final @Nullable String label;

  private VerdictRule(Pattern pMarker, Kind pKind, @Nullable String pLabel) {
    marker = pMarker;
    kind = pKind;
    label = pLabel;
  }

  /** Rule for a verdict other than FALSE. */
  public static VerdictRule of(String pRegex, Kind pKind) {
    Preconditions.checkArgument(pKind != Kind.FALSE, "FALSE needs a property label");
    return new VerdictRule(Pattern.compile(pRegex), pKind, null);
  }

  /** Rule for a violation of the property with the given label. */
  public static VerdictRule violation(String pRegex, String pPropertyLabel) {
    Preconditions.checkArgument(
        Property.forCanonicalName(pPropertyLabel).isPresent(),
        "unknown property %s",
        pPropertyLabel);
    return new VerdictRule(Pattern.compile(pRegex), Kind.FALSE, pPropertyLabel);
  }

  /** Rule for a violation whose property label is the first group of the pattern. */
  public static VerdictRule violationWithLabelGroup(String pRegex) {
    Pattern pattern = Pattern.compile(pRegex);
    Preconditions.checkArgument(
        pattern.matcher("").groupCount() >= 1, "pattern %s has no group for the label", pRegex);
    return new VerdictRule(pattern, Kind.FALSE, null);
  }

  public Pattern getMarker() {
    return marker;
  }

  public Kind getKind() {
    return kind;
  }

  /** The verdict for the given output line, if the line matches this rule. */
  public Optional<Verdict> apply(String pLine) {
    Matcher matcher = marker.matcher(pLine);
    if (!matcher.find()) {
      return Optional.empty();
    }
    switch (kind) {
      case TRUE:
        return Optional.of(Verdict.holds());
      case FALSE:
        String property = label != null ? label : matcher.group(1);
        if (property == null || property.isBlank()) {
          return Optional.empty();
        }
        return Optional.of(Verdict.violated(property.strip()));
      case ASSERTION_FAILED:
        return Optional.of(Verdict.assertionFailed(pLine.strip()));
      case UNKNOWN:
        return Optional.of(Verdict.unknown(pLine.strip()));
      case ERROR:
        return Optional.of(Verdict.error(pLine.strip()));
      case TIMEOUT:
        return Optional.of(Verdict.timeout(pLine.strip()));
      default:
        throw new AssertionError("unhandled verdict kind " + kind);
    }
  }

  @Override
  public String toString() {
    return marker.pattern() + " -> " + kind + (label == null ? "" : "(" + label + ")");
  }
}
