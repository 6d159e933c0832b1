// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.stages.transform;

import com.google.common.collect.ImmutableList;
import java.util.logging.Level;
import org.sosy_lab.common.log.LogManager;
import org.sosy_lab.verisym.exceptions.SourceParseException;

/**
 * The source transforms in the order in which they are applied. Later transforms rely on the
 * normal form produced by earlier ones: loop bounding inserts calls in the canonical nondet
 * convention, and it must see functions without forced inlining.
 */
public final class SourceTransformChain {

  private final ImmutableList<SourceTransform> transforms;
  private final LogManager logger;

  public SourceTransformChain(LogManager pLogger) {
    this(
        pLogger,
        ImmutableList.of(
            new ForceInlineRemover(), new NondetCallNormalizer(), new InfiniteLoopBounder()));
  }

  SourceTransformChain(LogManager pLogger, ImmutableList<SourceTransform> pTransforms) {
    logger = pLogger;
    transforms = pTransforms;
  }

  public ImmutableList<SourceTransform> getTransforms() {
    return transforms;
  }

  public SourceText apply(SourceText pSource) throws SourceParseException {
    SourceText current = pSource;
    for (SourceTransform transform : transforms) {
      SourceText next = transform.apply(current);
      if (next.getContent().equals(current.getContent())) {
        logger.logf(Level.FINE, "Transform %s left %s unchanged", transform.getName(), pSource);
      } else {
        logger.logf(
            Level.FINE,
            "Transform %s rewrote %s (%d -> %d lines)",
            transform.getName(),
            pSource.getName(),
            current.getLineCount(),
            next.getLineCount());
      }
      current = next;
    }
    return current;
  }
}
