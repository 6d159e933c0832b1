// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.base.Preconditions;
import com.google.common.primitives.ImmutableIntArray;
import com.google.errorprone.annotations.Immutable;

/**
 * Maps every line of a transformed source file back to a line of the file it was derived from.
 * Lines are numbered from 1. Every transform that changes the line structure of its input must
 * produce such a mapping; {@link SourceText} composes them along the transform chain, so that the
 * mapping of the final text always points into the original file.
 */
@Immutable
public final class LineMapping {

  // origin.get(i) is the origin of line i + 1
  private final ImmutableIntArray origin;

  private LineMapping(ImmutableIntArray pOrigin) {
    origin = pOrigin;
  }

  public static LineMapping identity(int pLineCount) {
    Preconditions.checkArgument(pLineCount >= 0);
    ImmutableIntArray.Builder builder = ImmutableIntArray.builder(pLineCount);
    for (int line = 1; line <= pLineCount; line++) {
      builder.add(line);
    }
    return new LineMapping(builder.build());
  }

  /**
   * Create a mapping from explicit origins. {@code pOrigins[i]} is the line of the input that line
   * {@code i + 1} of the output stems from. Origins must be positive and must not decrease.
   */
  public static LineMapping of(int... pOrigins) {
    int previous = 1;
    for (int o : pOrigins) {
      Preconditions.checkArgument(o >= previous, "line origins must be positive and ordered");
      previous = o;
    }
    return new LineMapping(ImmutableIntArray.copyOf(pOrigins));
  }

  /** Number of lines of the text this mapping belongs to. */
  public int getLineCount() {
    return origin.length();
  }

  /**
   * Line in the origin text for the given line of this text.
   *
   * @throws IndexOutOfBoundsException if the line does not exist
   */
  public int toOrigin(int pLine) {
    Preconditions.checkElementIndex(pLine - 1, origin.length(), "line");
    return origin.get(pLine - 1);
  }

  public boolean isIdentity() {
    for (int i = 0; i < origin.length(); i++) {
      if (origin.get(i) != i + 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * Compose with a mapping of a text derived from the text of this mapping. The result maps lines
   * of the derived text directly to the origin of this mapping.
   */
  public LineMapping followedBy(LineMapping pDerived) {
    ImmutableIntArray.Builder builder = ImmutableIntArray.builder(pDerived.getLineCount());
    for (int line = 1; line <= pDerived.getLineCount(); line++) {
      builder.add(toOrigin(pDerived.toOrigin(line)));
    }
    return new LineMapping(builder.build());
  }

  @Override
  public boolean equals(Object pObj) {
    return pObj instanceof LineMapping && origin.equals(((LineMapping) pObj).origin);
  }

  @Override
  public int hashCode() {
    return origin.hashCode();
  }

  @Override
  public String toString() {
    return "LineMapping" + origin;
  }
}
