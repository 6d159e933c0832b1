// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.util.Optional;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.Verdict.Kind;

/**
 * Classifies the output of a back end into a {@link Verdict} by an ordered list of rules. The first
 * rule that matches any output line decides; earlier rules take precedence over later ones
 * regardless of where in the output their lines appear.
 *
 * <p>If no rule matches, the verdict is ERROR for a non-zero exit code and UNKNOWN otherwise.
 * Output without a marker is never taken as TRUE or FALSE.
 */
@Immutable
public final class VerdictGrammar {

  private final String dialect;
  private final ImmutableList<VerdictRule> rules;

  private VerdictGrammar(String pDialect, ImmutableList<VerdictRule> pRules) {
    dialect = pDialect;
    rules = pRules;
  }

  public static Builder builder(String pDialect) {
    return new Builder(pDialect);
  }

  public String getDialect() {
    return dialect;
  }

  public ImmutableList<VerdictRule> getRules() {
    return rules;
  }

  public Verdict classify(ToolOutput pOutput) {
    for (VerdictRule rule : rules) {
      for (String line : pOutput.getAllLines()) {
        Optional<Verdict> verdict = rule.apply(line);
        if (verdict.isPresent()) {
          return verdict.orElseThrow();
        }
      }
    }
    if (pOutput.getExitCode() != 0) {
      return Verdict.error(
          dialect + " exited with code " + pOutput.getExitCode() + " without a verdict");
    }
    return Verdict.unknown("no verdict in the output of " + dialect);
  }

  @Override
  public String toString() {
    return dialect + rules;
  }

  public static final class Builder {

    private final String dialect;
    private final ImmutableList.Builder<VerdictRule> rules = ImmutableList.builder();

    private Builder(String pDialect) {
      dialect = pDialect;
    }

    @CanIgnoreReturnValue
    public Builder rule(VerdictRule pRule) {
      rules.add(pRule);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder rule(String pRegex, Kind pKind) {
      return rule(VerdictRule.of(pRegex, pKind));
    }

    @CanIgnoreReturnValue
    public Builder violation(String pRegex, String pPropertyLabel) {
      return rule(VerdictRule.violation(pRegex, pPropertyLabel));
    }

    public VerdictGrammar build() {
      return new VerdictGrammar(dialect, rules.build());
    }
  }
}
