// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Data written with an older record layout read back with a newer one, and the reverse. The binary format carries
/// no names, so two records with the same leading components stand in for two versions of one class.
class CompatibilityTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// The empty first version.
  record PortV0() {
  }

  record PortV1(String name) {
  }

  /// Appends two fields that both have defaults.
  record PortV2(String name, @FieldDefault("1") int berths, Optional<String> country) {
  }

  private final Adapter adapter = Adapter.builder().build();
  private String originalCompatibilityValue;

  @BeforeEach
  void setUp() {
    originalCompatibilityValue = System.getProperty(CompatibilityMode.PROPERTY);
    System.setProperty(CompatibilityMode.PROPERTY, "ENABLED");
  }

  @AfterEach
  void tearDown() {
    if (originalCompatibilityValue != null) {
      System.setProperty(CompatibilityMode.PROPERTY, originalCompatibilityValue);
    } else {
      System.clearProperty(CompatibilityMode.PROPERTY);
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "binary"})
  void olderDataTakesDefaultsForAppendedFields(String format) {
    final var bytes = adapter.dump(new PortV1("Leith"), format);
    assertThat(adapter.load(bytes, PortV2.class, format)).isEqualTo(new PortV2("Leith", 1, Optional.empty()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "binary"})
  void appendedFieldWithoutDefaultCannotBeRead(String format) {
    final var bytes = adapter.dump(new PortV0(), format);
    assertThatThrownBy(() -> adapter.load(bytes, PortV1.class, format))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("'name'");
  }

  @Test
  void newerJsonDropsMembersTheOlderRecordLacks() {
    final var bytes = adapter.dump(new PortV2("Leith", 4, Optional.of("Scotland")), "json");
    assertThat(adapter.load(bytes, PortV1.class, "json")).isEqualTo(new PortV1("Leith"));
  }

  @Test
  void newerBinaryCannotBeReadByAnOlderSchema() {
    final var bytes = adapter.dump(new PortV2("Leith", 4, Optional.of("Scotland")), "binary");
    assertThatThrownBy(() -> adapter.load(bytes, PortV1.class, "binary")).isInstanceOf(DecodeException.class);
  }

  @Test
  void newerBinaryIsReadWithTheWriterSchema() {
    final var bytes = adapter.dump(new PortV2("Leith", 4, Optional.of("Scotland")), "binary");
    assertThat(adapter.load(bytes, PortV1.class, "binary", adapter.schema(PortV2.class))).isEqualTo(new PortV1("Leith"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "binary", "csv"})
  void newerRecordIsWrittenForAnOlderReader(String format) {
    final var bytes = adapter.dump(new PortV2("Leith", 4, Optional.of("Scotland")), PortV2.class, format,
        adapter.schema(PortV1.class));
    assertThat(adapter.load(bytes, PortV1.class, format)).isEqualTo(new PortV1("Leith"));
    assertThat(adapter.load(bytes, PortV2.class, format)).isEqualTo(new PortV2("Leith", 1, Optional.empty()));
  }

  @Test
  void writerSchemaFollowsTheMode() {
    System.setProperty(CompatibilityMode.PROPERTY, "DISABLED");
    assertThatThrownBy(() -> adapter.dump(new PortV2("Leith", 4, Optional.empty()), PortV2.class, "binary",
        adapter.schema(PortV1.class)))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("unknown field");
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "binary"})
  void disabledModeRequiresEveryField(String format) {
    System.setProperty(CompatibilityMode.PROPERTY, "DISABLED");
    final var bytes = adapter.dump(new PortV1("Leith"), format);
    assertThatThrownBy(() -> adapter.load(bytes, PortV2.class, format))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("'berths'")
        .hasMessageContaining("disabled");
    assertThat(adapter.load(bytes, PortV1.class, format)).isEqualTo(new PortV1("Leith"));
  }

  @Test
  void disabledModeRejectsUnknownMembers() {
    System.setProperty(CompatibilityMode.PROPERTY, "DISABLED");
    final var json = "{\"name\":\"Leith\",\"berths\":4}".getBytes(StandardCharsets.UTF_8);
    assertThatThrownBy(() -> adapter.load(json, PortV1.class, "json"))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("unknown field 'berths'");
    assertThatThrownBy(() -> Schemas.conform(Value.map("name", Value.of("Leith"), "berths", Value.of(4)),
        adapter.schema(PortV1.class)))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("unknown field 'berths'");
  }

  @Test
  void modeIsReadOnEveryCall() {
    final var bytes = adapter.dump(new PortV1("Leith"), "binary");
    assertThat(adapter.load(bytes, PortV2.class, "binary")).isEqualTo(new PortV2("Leith", 1, Optional.empty()));
    System.setProperty(CompatibilityMode.PROPERTY, "disabled");
    assertThat(CompatibilityMode.current()).isEqualTo(CompatibilityMode.DISABLED);
    assertThatThrownBy(() -> adapter.load(bytes, PortV2.class, "binary")).isInstanceOf(SchemaMismatchException.class);
    System.clearProperty(CompatibilityMode.PROPERTY);
    assertThat(CompatibilityMode.current()).isEqualTo(CompatibilityMode.ENABLED);
    assertThat(adapter.load(bytes, PortV2.class, "binary")).isEqualTo(new PortV2("Leith", 1, Optional.empty()));
  }

  @Test
  void invalidModeIsRejected() {
    System.setProperty(CompatibilityMode.PROPERTY, "SOMETIMES");
    assertThatThrownBy(CompatibilityMode::current)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("SOMETIMES");
  }
}
