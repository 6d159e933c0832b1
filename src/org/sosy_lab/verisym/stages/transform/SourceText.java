// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;

/**
 * Content of one C source file at some point of the transform chain, together with the mapping of
 * its lines to the lines of the original file.
 */
@Immutable
public final class SourceText {

  private final String name;
  private final String content;
  private final LineMapping toOriginal;

  private SourceText(String pName, String pContent, LineMapping pToOriginal) {
    name = Preconditions.checkNotNull(pName);
    content = Preconditions.checkNotNull(pContent);
    toOriginal = Preconditions.checkNotNull(pToOriginal);
    Preconditions.checkArgument(
        countLines(content) == toOriginal.getLineCount(),
        "line mapping of %s has %s lines, but the text has %s",
        name,
        toOriginal.getLineCount(),
        countLines(content));
  }

  /** Text as read from the original file. */
  public static SourceText original(String pName, String pContent) {
    return new SourceText(pName, pContent, LineMapping.identity(countLines(pContent)));
  }

  /**
   * Derive a new text from this one.
   *
   * @param pContent the transformed content
   * @param pLocalMapping maps lines of the new content to lines of this text
   */
  public SourceText derive(String pContent, LineMapping pLocalMapping) {
    return new SourceText(name, pContent, toOriginal.followedBy(pLocalMapping));
  }

  /** Derive a new text that has exactly the line structure of this one. */
  public SourceText deriveLinePreserving(String pContent) {
    Preconditions.checkArgument(
        countLines(pContent) == getLineCount(), "transform changed the number of lines");
    return new SourceText(name, pContent, toOriginal);
  }

  public String getName() {
    return name;
  }

  public String getContent() {
    return content;
  }

  public int getLineCount() {
    return toOriginal.getLineCount();
  }

  /** Mapping from lines of this text to lines of the original file. */
  public LineMapping getLineMapping() {
    return toOriginal;
  }

  /**
   * Number of lines of a text. A final line break does not start a new line, and the empty text
   * has no lines.
   */
  public static int countLines(String pContent) {
    if (pContent.isEmpty()) {
      return 0;
    }
    int breaks = CharMatcher.is('\n').countIn(pContent);
    return pContent.endsWith("\n") ? breaks : breaks + 1;
  }

  @Override
  public String toString() {
    return name + " (" + getLineCount() + " lines)";
  }
}
