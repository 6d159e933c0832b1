// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core;

import com.google.common.base.Ascii;
import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of one verification run. */
@Immutable
public final class Verdict {

  public enum Kind {
    /** The property holds. */
    TRUE,
    /** The property is violated. */
    FALSE,
    /** A crash or failing assertion was found that is not tied to the checked property. */
    ASSERTION_FAILED,
    UNKNOWN,
    ERROR,
    TIMEOUT;

    /** Whether a witness can be produced for a verdict of this kind. */
    public boolean hasWitness() {
      return this == TRUE || this == FALSE || this == ASSERTION_FAILED;
    }
  }

  private final Kind kind;
  // property label for FALSE, free-text detail for all other kinds
  private final @Nullable String detail;

  private Verdict(Kind pKind, @Nullable String pDetail) {
    kind = Preconditions.checkNotNull(pKind);
    detail = pDetail;
  }

  public static Verdict holds() {
    return new Verdict(Kind.TRUE, null);
  }

  /** Property violation, with the label of the violated property as reported by the back end. */
  public static Verdict violated(String pPropertyLabel) {
    Preconditions.checkArgument(!pPropertyLabel.isEmpty());
    return new Verdict(Kind.FALSE, pPropertyLabel);
  }

  public static Verdict assertionFailed(@Nullable String pDetail) {
    return new Verdict(Kind.ASSERTION_FAILED, pDetail);
  }

  public static Verdict unknown(@Nullable String pReason) {
    return new Verdict(Kind.UNKNOWN, pReason);
  }

  public static Verdict error(String pMessage) {
    return new Verdict(Kind.ERROR, Preconditions.checkNotNull(pMessage));
  }

  public static Verdict timeout(@Nullable String pReason) {
    return new Verdict(Kind.TIMEOUT, pReason);
  }

  public Kind getKind() {
    return kind;
  }

  /** Label of the violated property, present only for {@link Kind#FALSE}. */
  public Optional<String> getViolatedProperty() {
    return kind == Kind.FALSE ? Optional.ofNullable(detail) : Optional.empty();
  }

  /** Reason or message, present for verdicts other than {@link Kind#FALSE} if known. */
  public Optional<String> getDetail() {
    return kind == Kind.FALSE ? Optional.empty() : Optional.ofNullable(detail);
  }

  /**
   * The verdict as printed on the result line: {@code true}, {@code false(<property>)}, {@code
   * assertion-failed}, {@code unknown}, {@code timeout}, or {@code error (<message>)}.
   */
  public String getResultString() {
    switch (kind) {
      case TRUE:
        return "true";
      case FALSE:
        return "false(" + Ascii.toLowerCase(Objects.requireNonNull(detail)) + ")";
      case ASSERTION_FAILED:
        return "assertion-failed";
      case UNKNOWN:
        return "unknown";
      case TIMEOUT:
        return "timeout";
      case ERROR:
        return "error (" + detail + ")";
      default:
        throw new AssertionError("unhandled verdict kind " + kind);
    }
  }

  @Override
  public boolean equals(Object pObj) {
    if (this == pObj) {
      return true;
    }
    if (!(pObj instanceof Verdict)) {
      return false;
    }
    Verdict other = (Verdict) pObj;
    return kind == other.kind && Objects.equals(detail, other.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, detail);
  }

  @Override
  public String toString() {
    String result = getResultString();
    if (kind != Kind.FALSE && kind != Kind.ERROR && detail != null) {
      result += " (" + detail + ")";
    }
    return result;
  }
}
