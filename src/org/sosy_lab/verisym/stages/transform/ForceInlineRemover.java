// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.collect.ImmutableList;
import java.util.regex.Pattern;
import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * Removes annotations that force the compiler to inline a function, such that the call sites are
 * still visible to the slicer and the instrumentation. Plain {@code inline} is left alone, it does
 * not force anything.
 */
public final class ForceInlineRemover implements SourceTransform {

  private static final ImmutableList<Pattern> FORCE_INLINE =
      ImmutableList.of(
          Pattern.compile(
              "__attribute__[ \\t]*\\([ \\t]*\\([ \\t]*(?:__)?always_inline(?:__)?"
                  + "[ \\t]*\\)[ \\t]*\\)[ \\t]*"),
          Pattern.compile("\\b__forceinline\\b[ \\t]*"),
          Pattern.compile("\\b__always_inline\\b[ \\t]*"));

  @Override
  public String getName() {
    return "remove-force-inline";
  }

  @Override
  public SourceText apply(SourceText pInput) throws SourceParseException {
    String content = pInput.getContent();
    for (Pattern pattern : FORCE_INLINE) {
      content = CodeMask.of(getName(), content).replaceInCode(pattern, match -> "");
    }
    return pInput.deriveLinePreserving(content);
  }
}
