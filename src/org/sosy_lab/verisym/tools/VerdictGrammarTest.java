// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.tools;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.sosy_lab.verisym.core.Verdict;
import org.sosy_lab.verisym.core.Verdict.Kind;
import org.sosy_lab.verisym.core.specification.PropertyParser;
import org.sosy_lab.verisym.core.specification.PropertySpecification;

public class VerdictGrammarTest {

  private static ToolOutput output(int pExitCode, String... pStdout) {
    return new ToolOutput(pExitCode, ImmutableList.copyOf(pStdout), ImmutableList.of());
  }

  private static ToolOutput errors(int pExitCode, String... pStderr) {
    return new ToolOutput(pExitCode, ImmutableList.of(), ImmutableList.copyOf(pStderr));
  }

  @Test
  public void testScriptDialect() {
    VerdictGrammar grammar = ScriptVerifierAdapter.GRAMMAR;

    assertThat(grammar.classify(output(0, "true"))).isEqualTo(Verdict.holds());
    assertThat(grammar.classify(output(0, "false(REACHCALL)")).getResultString())
        .isEqualTo("false(reachcall)");
    assertThat(grammar.classify(output(0, "checking", "false(valid-deref)", "done")))
        .isEqualTo(Verdict.violated("valid-deref"));
    assertThat(grammar.classify(output(0, "unknown")).getKind()).isEqualTo(Kind.UNKNOWN);
  }

  @Test
  public void testRuleOrderDecides() {
    // a violation marker wins over a later rule even if its line comes last
    Verdict verdict = ScriptVerifierAdapter.GRAMMAR.classify(output(0, "true", "false(x)"));

    assertThat(verdict.getKind()).isEqualTo(Kind.FALSE);
  }

  @Test
  public void testNoMarkerIsNeverTrueOrFalse() {
    VerdictGrammar grammar = ScriptVerifierAdapter.GRAMMAR;

    assertThat(grammar.classify(output(0, "the property is true")).getKind())
        .isEqualTo(Kind.UNKNOWN);
    assertThat(grammar.classify(output(0)).getKind()).isEqualTo(Kind.UNKNOWN);
    assertThat(grammar.classify(output(0, "false()")).getKind()).isEqualTo(Kind.UNKNOWN);
  }

  @Test
  public void testCrashWithoutMarkerIsError() {
    Verdict verdict = KleeAdapter.GRAMMAR.classify(errors(139, "Segmentation fault"));

    assertThat(verdict.getKind()).isEqualTo(Kind.ERROR);
    assertThat(verdict.getResultString()).startsWith("error (klee exited with code 139");
  }

  @Test
  public void testKleeDialect() {
    VerdictGrammar grammar = KleeAdapter.GRAMMAR;

    assertThat(
            grammar.classify(
                errors(
                    0,
                    "KLEE: output directory is \"klee-out\"",
                    "KLEE: ERROR: test.c:12: ASSERTION FAIL: verifier assertion failed",
                    "KLEE: done: total instructions = 1234")))
        .isEqualTo(Verdict.violated("REACHCALL"));
    assertThat(
            grammar.classify(
                errors(0, "KLEE: ERROR: test.c:7: memory error: out of bound pointer")))
        .isEqualTo(Verdict.violated("VALID-DEREF"));
    assertThat(
            grammar.classify(
                errors(0, "KLEE: ERROR: test.c:8: memory error: null pointer exception")))
        .isEqualTo(Verdict.violated("NULL-DEREF"));
    assertThat(
            grammar.classify(
                errors(0, "KLEE: ERROR: test.c:9: memory error: invalid pointer: free")))
        .isEqualTo(Verdict.violated("VALID-FREE"));
    assertThat(
            grammar.classify(errors(0, "KLEE: ERROR: test.c:3: ASSERTION FAIL: x > 0")).getKind())
        .isEqualTo(Kind.ASSERTION_FAILED);
    assertThat(grammar.classify(errors(0, "KLEE: HaltTimer invoked")).getKind())
        .isEqualTo(Kind.UNKNOWN);
    assertThat(grammar.classify(errors(0, "KLEE: done: total instructions = 10")))
        .isEqualTo(Verdict.holds());
  }

  @Test
  public void testModelCheckerDialects() {
    assertThat(SeahornAdapter.GRAMMAR.classify(output(0, "unsat"))).isEqualTo(Verdict.holds());
    assertThat(SeahornAdapter.GRAMMAR.classify(output(0, "sat")).getKind()).isEqualTo(Kind.FALSE);
    assertThat(
            SmackAdapter.GRAMMAR.classify(output(0, "SMACK found no errors with unroll bound 8")))
        .isEqualTo(Verdict.holds());
    assertThat(
            SmackAdapter.GRAMMAR.classify(
                output(1, "SMACK found an error: invalid pointer dereference")))
        .isEqualTo(Verdict.violated("VALID-DEREF"));
    assertThat(DivineAdapter.GRAMMAR.classify(output(0, "error found: no")))
        .isEqualTo(Verdict.holds());
    assertThat(NidhuggAdapter.GRAMMAR.classify(output(0, "Error detected:")).getKind())
        .isEqualTo(Kind.FALSE);
  }

  @Test
  public void testViolationOfCheckedProperty() throws Exception {
    PropertySpecification memSafety = PropertyParser.parseSpecification("MEMSAFETY");

    assertThat(
            AbstractToolAdapter.checkViolatedProperty(Verdict.violated("valid-free"), memSafety))
        .isEqualTo(Verdict.violated("VALID-FREE"));
    assertThat(AbstractToolAdapter.checkViolatedProperty(Verdict.holds(), memSafety))
        .isEqualTo(Verdict.holds());
  }

  @Test
  public void testViolationOfUncheckedPropertyIsUnknown() throws Exception {
    PropertySpecification reachCall = PropertyParser.parseSpecification("REACHCALL");

    assertThat(
            AbstractToolAdapter.checkViolatedProperty(Verdict.violated("VALID-FREE"), reachCall)
                .getKind())
        .isEqualTo(Kind.UNKNOWN);
    assertThat(
            AbstractToolAdapter.checkViolatedProperty(
                    Verdict.violated("no-such-property"), reachCall)
                .getKind())
        .isEqualTo(Kind.UNKNOWN);
  }

  @Test
  public void testNullDereference() throws Exception {
    Verdict nullDeref =
        KleeAdapter.GRAMMAR.classify(
            errors(0, "KLEE: ERROR: test.c:8: memory error: null pointer exception"));

    assertThat(
            AbstractToolAdapter.checkViolatedProperty(
                nullDeref, PropertyParser.parseSpecification("NULL-DEREF")))
        .isEqualTo(Verdict.violated("NULL-DEREF"));
    assertThat(
            AbstractToolAdapter.checkViolatedProperty(
                nullDeref, PropertyParser.parseSpecification("MEMSAFETY")))
        .isEqualTo(Verdict.violated("VALID-DEREF"));
    assertThat(
            AbstractToolAdapter.checkViolatedProperty(
                    nullDeref, PropertyParser.parseSpecification("REACHCALL"))
                .getKind())
        .isEqualTo(Kind.UNKNOWN);
  }

  @Test
  public void testFixedLabelMustBeProperty() {
    assertThrows(
        IllegalArgumentException.class, () -> VerdictRule.violation("oops", "no-such-property"));
  }

  @Test
  public void testResultStrings() {
    assertThat(Verdict.holds().getResultString()).isEqualTo("true");
    assertThat(Verdict.violated("MEM-TRACK").getResultString()).isEqualTo("false(mem-track)");
    assertThat(Verdict.unknown("no idea").getResultString()).isEqualTo("unknown");
    assertThat(Verdict.timeout(null).getResultString()).isEqualTo("timeout");
    assertThat(Verdict.error("boom").getResultString()).isEqualTo("error (boom)");
  }
}
