// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * A rewrite of C source code. Transforms are pure and idempotent: applying a transform to its own
 * output yields the same text again. A transform that changes the number of lines must describe
 * the change with a {@link LineMapping}.
 */
public interface SourceTransform {

  /** Name used for logging and for naming intermediate files. */
  String getName();

  /**
   * Rewrite the given text.
   *
   * @throws SourceParseException if the text is not well-formed enough to be rewritten
   */
  SourceText apply(SourceText pInput) throws SourceParseException;
}
