// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.codec;

import io.github.simbo1905.no.adapter.Adapter;
import io.github.simbo1905.no.adapter.DecodeException;
import io.github.simbo1905.no.adapter.LoggingControl;
import io.github.simbo1905.no.adapter.Schema;
import io.github.simbo1905.no.adapter.Schema.PrimitiveKind;
import io.github.simbo1905.no.adapter.SchemaMismatchException;
import io.github.simbo1905.no.adapter.Value;
import io.github.simbo1905.no.adapter.ValueRangeException;
import io.github.simbo1905.no.adapter.model.Ship;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BinaryCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private final BinaryCodec codec = new BinaryCodec();

  private static Schema.RecordNode.Field field(String name, Schema schema) {
    return new Schema.RecordNode.Field(name, schema, Optional.empty());
  }

  private static final Schema.RecordNode AB = new Schema.RecordNode("AB", List.of(
      field("a", Schema.primitive(PrimitiveKind.INT)),
      field("b", Schema.primitive(PrimitiveKind.STRING))), false);

  private static final Schema.RecordNode ABC = new Schema.RecordNode("AB", List.of(
      field("a", Schema.primitive(PrimitiveKind.INT)),
      field("b", Schema.primitive(PrimitiveKind.STRING)),
      new Schema.RecordNode.Field("c", Schema.primitive(PrimitiveKind.LONG), Optional.of(Value.of(5)))), false);

  @Test
  void shipRoundTrip() {
    final var adapter = Adapter.standard();
    final var ship = Ship.example();
    final var bytes = adapter.dump(ship, "binary");
    assertThat(adapter.load(bytes, Ship.class, "binary")).isEqualTo(ship);
    final var minimal = Ship.minimal("Dinghy");
    assertThat(adapter.load(adapter.dump(minimal, "binary"), Ship.class, "binary")).isEqualTo(minimal);
  }

  @Test
  void zigzagKeepsSmallMagnitudesShort() {
    final var schema = Schema.primitive(PrimitiveKind.LONG);
    assertThat(codec.encode(Value.of(0), schema)).containsExactly(0x00);
    assertThat(codec.encode(Value.of(-1), schema)).containsExactly(0x01);
    assertThat(codec.encode(Value.of(1), schema)).containsExactly(0x02);
    assertThat(codec.encode(Value.of(63), schema)).containsExactly(0x7e);
    assertThat(codec.encode(Value.of(64), schema)).containsExactly(0x80, 0x01);
    assertThat(codec.encode(Value.of(Long.MIN_VALUE), schema)).hasSize(10);
    assertThat(codec.decode(codec.encode(Value.of(Long.MAX_VALUE), schema), schema)).isEqualTo(Value.of(Long.MAX_VALUE));
  }

  @Test
  void recordWritesFieldCountThenFields() {
    final var bytes = codec.encode(Value.map("a", Value.of(1), "b", Value.of("hi")), AB);
    assertThat(bytes).containsExactly(0x04, 0x02, 0x04, 'h', 'i');
  }

  @Test
  void fewerFieldsOnTheWireTakeDefaults() {
    final var bytes = codec.encode(Value.map("a", Value.of(1), "b", Value.of("x")), AB);
    assertThat(codec.decode(bytes, ABC)).isEqualTo(Value.map("a", Value.of(1), "b", Value.of("x"), "c", Value.of(5)));
  }

  @Test
  void missingFieldWithoutDefaultIsAMismatch() {
    final var bytes = codec.encode(Value.map("a", Value.of(1)),
        new Schema.RecordNode("A", List.of(field("a", Schema.primitive(PrimitiveKind.INT))), false));
    assertThatThrownBy(() -> codec.decode(bytes, AB))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("'b'");
  }

  @Test
  void moreFieldsThanTheSchemaIsMalformed() {
    final var bytes = codec.encode(Value.map("a", Value.of(1), "b", Value.of("x"), "c", Value.of(2)), ABC);
    assertThatThrownBy(() -> codec.decode(bytes, AB)).isInstanceOf(DecodeException.class);
  }

  @Test
  void unpairedSurrogatesCannotBeWritten() {
    final var label = new Schema.RecordNode("Label", List.of(field("text", Schema.primitive(PrimitiveKind.STRING))),
        false);
    assertThatThrownBy(() -> codec.encode(Value.map("text", Value.of("a\uD800b")), label))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("unpaired surrogate at index 1");
    final var counts = new Schema.MapNode(Schema.primitive(PrimitiveKind.INT), false);
    assertThatThrownBy(() -> codec.encode(Value.map("\uDC00", Value.of(1)), counts))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageContaining("index 0");
    final var emoji = Value.map("text", Value.of("a\uD83D\uDE00b"));
    assertThat(codec.decode(codec.encode(emoji, label), label)).isEqualTo(emoji);
  }

  @Test
  void malformedInput() {
    final var bytes = codec.encode(Value.map("a", Value.of(1), "b", Value.of("hello")), AB);
    assertThatThrownBy(() -> codec.decode(Arrays.copyOf(bytes, bytes.length - 2), AB))
        .isInstanceOf(DecodeException.class);
    assertThatThrownBy(() -> codec.decode(Arrays.copyOf(bytes, bytes.length + 1), AB))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("trailing");

    final var colours = new Schema.EnumNode("Colour", List.of("RED", "GREEN"), false);
    assertThatThrownBy(() -> codec.decode(new byte[]{0x04}, colours))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Enum index 2");

    final var text = Schema.primitive(PrimitiveKind.STRING);
    assertThatThrownBy(() -> codec.decode(new byte[]{0x04, (byte) 0xC3, (byte) 0x28}, text))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("UTF-8");
    assertThatThrownBy(() -> codec.decode(new byte[]{0x7f}, text))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Invalid length");

    assertThatThrownBy(() -> codec.decode(new byte[]{0x04}, text.withNullable(true)))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("null marker");

    final var unterminated = new byte[11];
    Arrays.fill(unterminated, (byte) 0xff);
    assertThatThrownBy(() -> codec.decode(unterminated, Schema.primitive(PrimitiveKind.LONG)))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void integersBeyondThirtyTwoBitsDoNotFitAnIntNode() {
    final var schema = Schema.primitive(PrimitiveKind.INT);
    assertThatThrownBy(() -> codec.encode(Value.of(1L << 40), schema)).isInstanceOf(ValueRangeException.class);
    final var wide = codec.encode(Value.of(1L << 40), Schema.primitive(PrimitiveKind.LONG));
    assertThatThrownBy(() -> codec.decode(wide, schema)).isInstanceOf(ValueRangeException.class);
  }

  @Test
  void floatNodeRejectsDoublesItCannotHoldExactly() {
    final var schema = Schema.primitive(PrimitiveKind.FLOAT);
    assertThatThrownBy(() -> codec.encode(Value.of(0.1), schema)).isInstanceOf(ValueRangeException.class);
    assertThat(codec.decode(codec.encode(Value.of(0.5), schema), schema)).isEqualTo(Value.of(0.5));
    assertThat(codec.decode(codec.encode(Value.of(Double.NaN), schema), schema)).isEqualTo(Value.of(Double.NaN));
    assertThat(codec.decode(codec.encode(Value.of(-0.0), schema), schema)).isEqualTo(Value.of(-0.0));
  }

  @Test
  void doublesRoundTripExactly() {
    final var schema = Schema.primitive(PrimitiveKind.DOUBLE);
    for (double d : new double[]{0.1, -0.0, Double.MIN_VALUE, Double.MAX_VALUE, Double.NEGATIVE_INFINITY, Double.NaN}) {
      assertThat(codec.decode(codec.encode(Value.of(d), schema), schema)).isEqualTo(Value.of(d));
    }
  }

  @Test
  void nullNeedsANullableNode() {
    assertThatThrownBy(() -> codec.encode(Value.NULL, Schema.primitive(PrimitiveKind.STRING)))
        .isInstanceOf(SchemaMismatchException.class);
    final var nullable = Schema.primitive(PrimitiveKind.STRING).withNullable(true);
    assertThat(codec.encode(Value.NULL, nullable)).containsExactly(0x00);
    assertThat(codec.decode(codec.encode(Value.of("x"), nullable), nullable)).isEqualTo(Value.of("x"));
  }

  @Test
  void unionsWriteTheBranchIndex() {
    final var union = new Schema.UnionNode("Shape", List.of(
        new Schema.UnionNode.Branch("Circle", Schema.primitive(PrimitiveKind.DOUBLE)),
        new Schema.UnionNode.Branch("Label", Schema.primitive(PrimitiveKind.STRING))), false);
    final var label = Value.map("Label", Value.of("x"));
    assertThat(codec.encode(label, union)).containsExactly(0x02, 0x02, 'x');
    assertThat(codec.decode(codec.encode(label, union), union)).isEqualTo(label);
    assertThatThrownBy(() -> codec.decode(new byte[]{0x06, 0x00}, union))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Union index 3");
    assertThatThrownBy(() -> codec.encode(Value.map("Square", Value.of(1.0)), union))
        .isInstanceOf(SchemaMismatchException.class);
  }

  @Test
  void manyValuesAreCountPrefixed() {
    final var values = List.<Value>of(
        Value.map("a", Value.of(1), "b", Value.of("x")),
        Value.map("a", Value.of(2), "b", Value.of("y")));
    final var bytes = codec.encodeMany(values, AB);
    assertThat(bytes[0]).isEqualTo((byte) 0x04);
    assertThat(codec.decodeMany(bytes, AB)).isEqualTo(values);
    assertThat(codec.decodeMany(codec.encodeMany(List.of(), AB), AB)).isEmpty();
    assertThatThrownBy(() -> codec.decodeMany(new byte[]{0x10}, AB)).isInstanceOf(DecodeException.class);
  }

  @Test
  void mapsAndArrays() {
    final var schema = new Schema.ArrayNode(new Schema.MapNode(Schema.primitive(PrimitiveKind.INT).withNullable(true),
        false), false);
    final var value = Value.seq(Value.map("x", Value.of(1), "y", Value.NULL), Value.map());
    assertThat(codec.decode(codec.encode(value, schema), schema)).isEqualTo(value);
  }
}
