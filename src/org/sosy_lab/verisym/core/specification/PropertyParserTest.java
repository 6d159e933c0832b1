// This file is part of Verisym,
// a verification pipeline for C programs.
//
// SPDX-FileCopyrightText: 2023 Dirk Beyer <https://www.sosy-lab.org>
//
// SPDX-License-Identifier: Apache-2.0

package org.sosy_lab.verisym.core.specification;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.sosy_lab.common.configuration.InvalidConfigurationException;

public class PropertyParserTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final ImmutableList<String> SHORTCUTS =
      ImmutableList.of(
          "VALID-DEREF",
          "valid-free",
          "MEM-TRACK",
          "null-deref",
          "UNDEF-BEHAVIOR",
          "signed_overflow",
          "REACHCALL",
          "MEMSAFETY",
          "CHECK( init(main()), LTL(G ! call(__VERIFIER_error())) )",
          "CHECK( init(main()), LTL(G valid-deref) )");

  @Test
  public void testDeterminism() throws InvalidConfigurationException {
    for (String shortcut : SHORTCUTS) {
      assertThat(PropertyParser.parseProperty(shortcut))
          .isEqualTo(PropertyParser.parseProperty(shortcut));
      assertThat(PropertyParser.parseProperty(shortcut)).isNotEmpty();
    }
  }

  @Test
  public void testMemorySafetyExpansion() throws InvalidConfigurationException {
    assertThat(PropertyParser.parseProperty("MEMSAFETY"))
        .containsExactly(Property.VALID_DEREF, Property.VALID_FREE, Property.MEM_TRACK);
    for (Property p : PropertyParser.parseProperty("MEMSAFETY")) {
      assertThat(p.getMonitorName().isPresent()).isTrue();
    }
  }

  @Test
  public void testReachabilityFormulas() throws InvalidConfigurationException {
    assertThat(PropertyParser.parseProperty("CHECK( init(main()), LTL(G ! call(reach_error())) )"))
        .containsExactly(Property.REACHCALL);
  }

  @Test
  public void testUnknownPropertyRejected() {
    assertThrows(
        InvalidConfigurationException.class, () -> PropertyParser.parseProperty("TERMINATION"));
    assertThrows(
        InvalidConfigurationException.class,
        () -> PropertyParser.parseSpecification("VALID-DEREF no-such-property"));
    assertThrows(InvalidConfigurationException.class, () -> PropertyParser.parseSpecification(" "));
  }

  @Test
  public void testInlineSpecification() throws InvalidConfigurationException {
    PropertySpecification spec = PropertyParser.parseSpecification("valid-deref  SIGNED-OVERFLOW");

    assertThat(spec.getProperties())
        .containsExactly(Property.VALID_DEREF, Property.SIGNED_OVERFLOW);
    assertThat(spec.getOriginalEntries()).containsExactly("valid-deref", "SIGNED-OVERFLOW");
  }

  @Test
  public void testSpecificationFile() throws IOException, InvalidConfigurationException {
    Path file = tmp.newFile("memsafety.prp").toPath();
    Files.write(
        file,
        ImmutableList.of(
            "// memory safety",
            "CHECK( init(main()), LTL(G valid-free) )",
            "",
            "CHECK( init(main()), LTL(G valid-deref) )",
            "CHECK( init(main()), LTL(G valid-memtrack) )"),
        StandardCharsets.UTF_8);

    PropertySpecification spec = PropertyParser.parseSpecification(file.toString());

    assertThat(spec.coversMemorySafety()).isTrue();
    assertThat(spec.getOriginalEntries()).hasSize(3);
    assertThat(spec).isEqualTo(PropertyParser.parseSpecification(file.toString()));
  }
}
