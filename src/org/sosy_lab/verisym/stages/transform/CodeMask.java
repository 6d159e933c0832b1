// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.base.Preconditions;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * A view of C source code in which comments, the contents of string and character literals, and
 * preprocessor directives are blanked out. The masked text has exactly the same length and the
 * same line breaks as the original, so offsets and line numbers found in the mask are valid for
 * the original, while patterns matched against the mask never see text that is not code.
 *
 * <p>Creating a mask also checks the coarse lexical structure of the input: comments and literals
 * must be terminated, and braces and parentheses must be balanced.
 */
final class CodeMask {

  private final String original;
  private final String masked;

  private CodeMask(String pOriginal, String pMasked) {
    original = pOriginal;
    masked = pMasked;
  }

  static CodeMask of(String pTransformName, String pContent) throws SourceParseException {
    return new CodeMask(pContent, mask(pTransformName, pContent));
  }

  String getOriginal() {
    return original;
  }

  String getMasked() {
    return masked;
  }

  /** 1-based line number of the given offset. */
  int lineOf(int pOffset) {
    int line = 1;
    for (int i = 0; i < pOffset; i++) {
      if (original.charAt(i) == '\n') {
        line++;
      }
    }
    return line;
  }

  /**
   * Replace every match of the pattern in the masked text. The replacement text is computed from
   * the match on the masked text and inserted into the original text.
   */
  String replaceInCode(Pattern pPattern, Function<MatchResult, String> pReplacement) {
    Matcher matcher = pPattern.matcher(masked);
    StringBuilder result = new StringBuilder(original.length());
    int last = 0;
    while (matcher.find()) {
      String replacement = pReplacement.apply(matcher.toMatchResult());
      Preconditions.checkState(
          replacement.indexOf('\n') < 0
              && original.substring(matcher.start(), matcher.end()).indexOf('\n') < 0,
          "rewrite must stay within one line");
      result.append(original, last, matcher.start()).append(replacement);
      last = matcher.end();
    }
    result.append(original, last, original.length());
    return result.toString();
  }

  /**
   * Offset of the brace that closes the brace at the given offset.
   *
   * @throws IllegalArgumentException if there is no opening brace at the offset
   */
  int findClosingBrace(int pOpening) {
    return findClosing(pOpening, '{', '}');
  }

  /**
   * Offset of the parenthesis that closes the parenthesis at the given offset.
   *
   * @throws IllegalArgumentException if there is no opening parenthesis at the offset
   */
  int findClosingParenthesis(int pOpening) {
    return findClosing(pOpening, '(', ')');
  }

  private int findClosing(int pOpening, char pOpen, char pClose) {
    Preconditions.checkArgument(masked.charAt(pOpening) == pOpen);
    int depth = 0;
    for (int i = pOpening; i < masked.length(); i++) {
      char c = masked.charAt(i);
      if (c == pOpen) {
        depth++;
      } else if (c == pClose) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    // braces and parentheses are balanced, checked on creation
    throw new AssertionError("unbalanced " + pOpen + " in checked source");
  }

  private static String mask(String pTransformName, String pContent)
      throws SourceParseException {
    StringBuilder out = new StringBuilder(pContent.length());
    int line = 1;
    int braces = 0;
    int parens = 0;
    boolean lineStart = true;
    int i = 0;
    final int n = pContent.length();

    while (i < n) {
      char c = pContent.charAt(i);
      char next = i + 1 < n ? pContent.charAt(i + 1) : '\0';

      if (c == '/' && next == '*') {
        int startLine = line;
        int end = pContent.indexOf("*/", i + 2);
        if (end < 0) {
          throw new SourceParseException(pTransformName, startLine, "unterminated comment");
        }
        line += blank(pContent, i, end + 2, out);
        i = end + 2;
        continue;
      }

      if (c == '/' && next == '/') {
        int end = endOfLogicalLine(pContent, i);
        line += blank(pContent, i, end, out);
        i = end;
        continue;
      }

      if (c == '#' && lineStart) {
        int end = endOfLogicalLine(pContent, i);
        line += blank(pContent, i, end, out);
        i = end;
        continue;
      }

      if (c == '"' || c == '\'') {
        int startLine = line;
        out.append(c);
        i++;
        while (true) {
          if (i >= n || pContent.charAt(i) == '\n') {
            throw new SourceParseException(
                pTransformName,
                startLine,
                c == '"' ? "unterminated string literal" : "unterminated character literal");
          }
          char d = pContent.charAt(i);
          if (d == '\\' && i + 1 < n) {
            if (pContent.charAt(i + 1) == '\n') {
              line++;
              out.append(' ').append('\n');
            } else {
              out.append("  ");
            }
            i += 2;
            continue;
          }
          if (d == c) {
            out.append(c);
            i++;
            break;
          }
          out.append(' ');
          i++;
        }
        lineStart = false;
        continue;
      }

      switch (c) {
        case '{':
          braces++;
          break;
        case '}':
          braces--;
          break;
        case '(':
          parens++;
          break;
        case ')':
          parens--;
          break;
        default:
          break;
      }
      if (braces < 0) {
        throw new SourceParseException(pTransformName, line, "unmatched '}'");
      }
      if (parens < 0) {
        throw new SourceParseException(pTransformName, line, "unmatched ')'");
      }

      out.append(c);
      if (c == '\n') {
        line++;
        lineStart = true;
      } else if (!Character.isWhitespace(c)) {
        lineStart = false;
      }
      i++;
    }

    if (braces != 0) {
      throw new SourceParseException(pTransformName, line, "unbalanced braces at end of file");
    }
    if (parens != 0) {
      throw new SourceParseException(
          pTransformName, line, "unbalanced parentheses at end of file");
    }
    return out.toString();
  }

  /** End of the line containing the offset, following backslash line continuations. */
  private static int endOfLogicalLine(String pContent, int pFrom) {
    int i = pFrom;
    while (i < pContent.length()) {
      char c = pContent.charAt(i);
      if (c == '\n' && (i == 0 || pContent.charAt(i - 1) != '\\')) {
        return i;
      }
      i++;
    }
    return i;
  }

  /** Append blanks for the given range, keeping line breaks. Returns the number of breaks. */
  private static int blank(String pContent, int pFrom, int pTo, StringBuilder pOut) {
    int breaks = 0;
    for (int i = pFrom; i < pTo; i++) {
      if (pContent.charAt(i) == '\n') {
        pOut.append('\n');
        breaks++;
      } else {
        pOut.append(' ');
      }
    }
    return breaks;
  }
}
