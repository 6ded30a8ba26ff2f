// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import io.github.simbo1905.no.adapter.Schema.PrimitiveKind;
import io.github.simbo1905.no.adapter.model.Engine;
import io.github.simbo1905.no.adapter.model.Ship;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaDeriverTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  record Widths(byte b, short s, int i, long l, char c, float f, double d, String text, byte[] raw) {
  }

  record WithThread(Thread worker) {
  }

  record WrongDefault(@FieldDefault("\"seven\"") int count) {
  }

  record Counters(@FieldDefault("{\"a\": 1}") Map<String, Integer> counts, Optional<Integer> spare) {
  }

  private final Adapter adapter = Adapter.builder().build();

  @Test
  void scalarsMapToPrimitiveNodes() {
    final var schema = (Schema.RecordNode) adapter.schema(Widths.class);
    assertThat(schema.fields()).extracting(f -> f.schema()).containsExactly(
        Schema.primitive(PrimitiveKind.INT),
        Schema.primitive(PrimitiveKind.INT),
        Schema.primitive(PrimitiveKind.INT),
        Schema.primitive(PrimitiveKind.LONG),
        Schema.logical(PrimitiveKind.STRING, "char"),
        Schema.primitive(PrimitiveKind.FLOAT),
        Schema.primitive(PrimitiveKind.DOUBLE),
        Schema.primitive(PrimitiveKind.STRING),
        Schema.primitive(PrimitiveKind.BYTES));
  }

  @Test
  void shipSchemaKeepsOrderDefaultsAndLogicalTypes() {
    final var schema = (Schema.RecordNode) adapter.schema(Ship.class);
    assertThat(schema.name()).isEqualTo(Ship.class.getName());
    assertThat(schema.fields()).extracting(Schema.RecordNode.Field::name).containsExactly(
        "name", "id", "type", "crew", "cargo", "departedAt", "buildOn", "engine", "sails");
    assertThat(schema.fields().get(1).schema()).isEqualTo(Schema.logical(PrimitiveKind.STRING, "uuid"));
    assertThat(schema.fields().get(2).schema()).isInstanceOf(Schema.EnumNode.class)
        .satisfies(s -> assertThat(s.nullable()).isTrue());
    assertThat(schema.fields().get(3).defaultValue()).contains(Value.seq());
    assertThat(schema.fields().get(3).schema()).isInstanceOf(Schema.ArrayNode.class);
    assertThat(schema.fields().get(5).schema())
        .isEqualTo(Schema.logical(PrimitiveKind.STRING, "timestamp").withNullable(true));
    assertThat(schema.fields().get(8).schema())
        .isEqualTo(Schema.logical(PrimitiveKind.STRING, "json").withNullable(true));
    assertThat(schema.fields().get(0).defaultValue()).isEmpty();
    assertThat(schema.fields().get(4).defaultValue()).contains(Value.NULL);
  }

  @Test
  void unionBranchesFollowPermittedOrder() {
    final var union = (Schema.UnionNode) adapter.schema(Engine.class);
    assertThat(union.branches()).extracting(Schema.UnionNode.Branch::name)
        .containsExactly("DieselEngine", "ElectricEngine");
    assertThat(union.indexOf("ElectricEngine")).contains(1);
    assertThat(union.indexOf("SteamEngine")).isEmpty();
  }

  @Test
  void opaqueTypeWithoutSchemaHookFails() {
    assertThatThrownBy(() -> adapter.schema(WithThread.class))
        .isInstanceOf(SchemaException.class)
        .hasMessageContaining("java.lang.Thread");
  }

  @Test
  void schemaHookSuppliesOpaqueSchemaAndResetsMemo() {
    assertThatThrownBy(() -> adapter.schema(WithThread.class)).isInstanceOf(SchemaException.class);
    adapter.registerHook(HookPoint.DERIVE_SCHEMA, (TypeDescriptor descriptor, Schema partial) ->
        descriptor.equals(TypeDescriptor.opaque(Thread.class))
            ? HookResult.applied(Schema.logical(PrimitiveKind.STRING, "thread-name"))
            : HookResult.notApplicable());
    final var schema = (Schema.RecordNode) adapter.schema(WithThread.class);
    assertThat(schema.fields().get(0).schema()).isEqualTo(Schema.logical(PrimitiveKind.STRING, "thread-name"));
  }

  @Test
  void defaultThatDoesNotFitIsASchemaError() {
    assertThatThrownBy(() -> adapter.schema(WrongDefault.class))
        .isInstanceOf(SchemaException.class)
        .hasMessageContaining("WrongDefault.count");
  }

  @Test
  void derivationIsDeterministic() {
    final var first = adapter.schema(Counters.class);
    assertThat(adapter.schema(Counters.class)).isSameAs(first);
    assertThat(Adapter.builder().build().schema(Counters.class)).isEqualTo(first);
    final var record = (Schema.RecordNode) first;
    assertThat(record.fields().get(0).defaultValue()).contains(Value.map("a", Value.of(1)));
    assertThat(record.fields().get(1).schema().nullable()).isTrue();
    assertThat(first.toTreeString()).contains("counts = {\"a\": 1}").contains("int?");
  }
}
