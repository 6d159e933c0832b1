// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.collect.ImmutableMap;
import java.util.regex.Pattern;
import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * Rewrites the various spellings of "unknown value" functions into the canonical
 * {@code __VERIFIER_nondet_<type>} calls that the back ends and the runtime library understand.
 *
 * <ul>
 *   <li>{@code nondet_int()}, {@code __nondet_int()} become {@code __VERIFIER_nondet_int()},
 *   <li>{@code nondet()} becomes {@code __VERIFIER_nondet_int()},
 *   <li>long type spellings like {@code unsigned_int} are shortened to the canonical suffix, e.g.
 *       {@code __VERIFIER_nondet_uint()}.
 * </ul>
 */
public final class NondetCallNormalizer implements SourceTransform {

  private static final String CANONICAL_PREFIX = "__VERIFIER_nondet_";

  private static final ImmutableMap<String, String> TYPE_ALIASES =
      ImmutableMap.<String, String>builder()
          .put("unsigned", "uint")
          .put("unsigned_int", "uint")
          .put("unsigned_char", "uchar")
          .put("unsigned_short", "ushort")
          .put("unsigned_long", "ulong")
          .put("unsigned_long_long", "ulonglong")
          .put("long_long", "longlong")
          .put("ptr", "pointer")
          .put("bool", "bool")
          .put("_Bool", "bool")
          .buildOrThrow();

  private static final Pattern ADHOC_NONDET_CALL =
      Pattern.compile("\\b(?:__)?nondet_(\\w+)([ \\t]*)\\(");

  private static final Pattern BARE_NONDET_CALL = Pattern.compile("\\bnondet([ \\t]*)\\(");

  private static final Pattern LONG_CANONICAL_NAME =
      Pattern.compile(
          "\\b__VERIFIER_nondet_(unsigned_long_long|unsigned_long|unsigned_short"
              + "|unsigned_char|unsigned_int|unsigned|long_long|ptr|_Bool)\\b");

  @Override
  public String getName() {
    return "normalize-nondet";
  }

  @Override
  public SourceText apply(SourceText pInput) throws SourceParseException {
    String content = pInput.getContent();
    content =
        CodeMask.of(getName(), content)
            .replaceInCode(
                ADHOC_NONDET_CALL,
                match -> CANONICAL_PREFIX + canonicalType(match.group(1)) + match.group(2) + "(");
    content =
        CodeMask.of(getName(), content)
            .replaceInCode(
                BARE_NONDET_CALL, match -> CANONICAL_PREFIX + "int" + match.group(1) + "(");
    content =
        CodeMask.of(getName(), content)
            .replaceInCode(
                LONG_CANONICAL_NAME, match -> CANONICAL_PREFIX + canonicalType(match.group(1)));
    return pInput.deriveLinePreserving(content);
  }

  static String canonicalType(String pType) {
    return TYPE_ALIASES.getOrDefault(pType, pType);
  }
}
