// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * Gives syntactically infinite loops without any exit a nondeterministic way out.
 *
 * <p>A loop {@code while (1) { ... }} or {@code for (;;) { ... }} whose body contains no
 * {@code return}, no {@code goto}, no call to a function that terminates the program, and no
 * {@code break} outside of nested loops and switch statements gets an additional statement
 * {@code if (__VERIFIER_nondet_int()) __VERIFIER_silent_exit(0);} at the end of its body. The new
 * exit terminates the program without reporting an error, so it does not change which existing
 * errors are reachable, but it lets back ends finish paths through the loop. Loops that already
 * have an exit are not touched, which also makes the transform idempotent.
 *
 * <p>If the closing brace of the loop body is the first token on its line, the statement is put on
 * a new line in front of it, and the new line is mapped to the line of the brace. Otherwise the
 * statement is inserted in front of the brace on the same line.
 */
public final class InfiniteLoopBounder implements SourceTransform {

  static final String EXIT_STATEMENT = "if (__VERIFIER_nondet_int()) __VERIFIER_silent_exit(0);";

  private static final ImmutableList<Pattern> INFINITE_LOOP_HEADS =
      ImmutableList.of(
          Pattern.compile("\\bwhile\\s*\\(\\s*(?:1|true|!0)\\s*\\)\\s*\\{"),
          Pattern.compile("\\bfor\\s*\\(\\s*;\\s*;\\s*\\)\\s*\\{"));

  // exits that leave the loop from any nesting depth
  private static final Pattern LOOP_EXIT =
      Pattern.compile(
          "\\b(?:return|goto|longjmp|siglongjmp|__VERIFIER_silent_exit)\\b"
              + "|\\b(?:exit|_Exit|abort|pthread_exit)\\s*\\(");

  private static final Pattern BREAK = Pattern.compile("\\bbreak\\b");

  // statements that are the target of a break in their body
  private static final Pattern BREAK_TARGET =
      Pattern.compile("\\b(?:switch|while|for)\\s*\\(|\\bdo\\b");

  private static final CharMatcher INDENTATION = CharMatcher.anyOf(" \t");

  /** Where to put one new exit statement. */
  private static final class Insertion {
    private final int offset;
    private final String text;
    // input line in front of which a complete new line is inserted, 0 for inline insertions
    private final int lineBefore;

    private Insertion(int pOffset, String pText, int pLineBefore) {
      offset = pOffset;
      text = pText;
      lineBefore = pLineBefore;
    }
  }

  @Override
  public String getName() {
    return "bound-infinite-loops";
  }

  @Override
  public SourceText apply(SourceText pInput) throws SourceParseException {
    CodeMask mask = CodeMask.of(getName(), pInput.getContent());
    String masked = mask.getMasked();

    List<Insertion> insertions = new ArrayList<>();
    for (Pattern head : INFINITE_LOOP_HEADS) {
      Matcher matcher = head.matcher(masked);
      while (matcher.find()) {
        int open = matcher.end() - 1;
        int close = mask.findClosingBrace(open);
        if (!hasExit(mask, open, close)) {
          insertions.add(insertionFor(mask, close));
        }
      }
    }
    if (insertions.isEmpty()) {
      return pInput;
    }

    // apply from the end, so that earlier offsets stay valid
    insertions.sort((a, b) -> Integer.compare(b.offset, a.offset));
    StringBuilder content = new StringBuilder(pInput.getContent());
    for (Insertion insertion : insertions) {
      content.insert(insertion.offset, insertion.text);
    }

    int[] newLinesBefore = new int[pInput.getLineCount() + 1];
    for (Insertion insertion : insertions) {
      if (insertion.lineBefore > 0) {
        newLinesBefore[insertion.lineBefore]++;
      }
    }
    ImmutableIntArray.Builder origins = ImmutableIntArray.builder();
    for (int line = 1; line <= pInput.getLineCount(); line++) {
      origins.addAll(Collections.nCopies(newLinesBefore[line] + 1, line));
    }

    return pInput.derive(content.toString(), LineMapping.of(origins.build().toArray()));
  }

  /** Whether the loop body between the given braces can leave the loop. */
  private static boolean hasExit(CodeMask pMask, int pOpen, int pClose) {
    if (LOOP_EXIT.matcher(pMask.getMasked().substring(pOpen + 1, pClose)).find()) {
      return true;
    }
    return BREAK.matcher(withoutNestedBreakTargets(pMask, pOpen + 1, pClose)).find();
  }

  /**
   * The masked code between the offsets, with the bodies of nested loops and switch statements
   * blanked. A break in such a body leaves only the nested statement.
   */
  private static String withoutNestedBreakTargets(CodeMask pMask, int pFrom, int pTo) {
    String masked = pMask.getMasked();
    StringBuilder result = new StringBuilder(masked.substring(pFrom, pTo));
    Matcher matcher = BREAK_TARGET.matcher(masked);
    matcher.useTransparentBounds(true).region(pFrom, pTo);
    while (matcher.find()) {
      int bodyStart = matcher.end();
      if (masked.charAt(bodyStart - 1) == '(') {
        bodyStart = pMask.findClosingParenthesis(bodyStart - 1) + 1;
      }
      int bodyEnd = Math.min(endOfStatement(pMask, bodyStart), pTo);
      for (int i = bodyStart; i < bodyEnd; i++) {
        result.setCharAt(i - pFrom, ' ');
      }
      matcher.region(bodyEnd, pTo);
    }
    return result.toString();
  }

  /** End (exclusive) of the statement starting at the given offset. */
  private static int endOfStatement(CodeMask pMask, int pFrom) {
    String masked = pMask.getMasked();
    int start = CharMatcher.whitespace().negate().indexIn(masked, pFrom);
    if (start < 0) {
      return masked.length();
    }
    if (masked.charAt(start) == '{') {
      return pMask.findClosingBrace(start) + 1;
    }
    int semicolon = masked.indexOf(';', start);
    return semicolon < 0 ? masked.length() : semicolon + 1;
  }

  private static Insertion insertionFor(CodeMask pMask, int pClosingBrace) {
    String content = pMask.getOriginal();
    int lineStart = content.lastIndexOf('\n', pClosingBrace - 1) + 1;
    String indentation = content.substring(lineStart, pClosingBrace);
    if (INDENTATION.matchesAllOf(indentation)) {
      return new Insertion(
          lineStart,
          indentation + "  " + EXIT_STATEMENT + "\n",
          pMask.lineOf(pClosingBrace));
    }
    return new Insertion(pClosingBrace, " " + EXIT_STATEMENT + " ", 0);
  }
}
