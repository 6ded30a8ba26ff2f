// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.codec;

import io.github.simbo1905.no.adapter.Codec;
import io.github.simbo1905.no.adapter.CompatibilityMode;
import io.github.simbo1905.no.adapter.DecodeException;
import io.github.simbo1905.no.adapter.Schema;
import io.github.simbo1905.no.adapter.SchemaMismatchException;
import io.github.simbo1905.no.adapter.Schemas;
import io.github.simbo1905.no.adapter.Value;
import io.github.simbo1905.no.adapter.ValueRangeException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Compact schema driven binary format. Nothing self describing is written; the reader must hold the writer's schema
/// or a schema that only appends fields with defaults to its records.
///
/// Wire grammar per schema node:
/// - nullable node: varint 0 for null, else varint 1 then the value
/// - boolean: one byte 0 or 1
/// - int and long: zigzag varint
/// - float and double: IEEE 754 little endian, 4 and 8 bytes
/// - string and bytes: varint length then the UTF-8 or raw bytes
/// - array: varint count then the items; map: varint count then key string and value pairs
/// - record: varint field count then the fields in schema order
/// - enum: varint symbol index; union: varint branch index then the branch value
///
/// Like the record pickler this sizes a value first with a worst case bound, writes into a [ByteBuffer] and returns
/// the written prefix.
public final class BinaryCodec implements Codec {

  public static final String NAME = "binary";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean requiresSchema() {
    return true;
  }

  @Override
  public byte[] encode(Value value, Schema schema) {
    requireSchema(schema);
    final var conformed = Schemas.conform(value, schema);
    final var buffer = ByteBuffer.allocate(maxSizeOf(conformed, schema)).order(ByteOrder.LITTLE_ENDIAN);
    write(buffer, conformed, schema);
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  @Override
  public Value decode(byte[] bytes, Schema schema) {
    requireSchema(schema);
    final var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    final var mode = CompatibilityMode.current();
    try {
      final var value = read(buffer, schema, mode);
      if (buffer.hasRemaining()) {
        throw new DecodeException(buffer.remaining() + " trailing bytes after value at position " + buffer.position());
      }
      return value;
    } catch (BufferUnderflowException e) {
      throw new DecodeException("Truncated input of " + bytes.length + " bytes", e);
    }
  }

  @Override
  public byte[] encodeMany(List<Value> values, Schema schema) {
    requireSchema(schema);
    final var mode = CompatibilityMode.current();
    final var conformed = new ArrayList<Value>(values.size());
    int size = ZigZagEncoding.MAX_LONG_BYTES;
    for (int i = 0; i < values.size(); i++) {
      final var value = Schemas.conform(values.get(i), schema, mode, "$[" + i + "]");
      conformed.add(value);
      size = Math.addExact(size, maxSizeOf(value, schema));
    }
    final var buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    ZigZagEncoding.putInt(buffer, conformed.size());
    conformed.forEach(value -> write(buffer, value, schema));
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  @Override
  public List<Value> decodeMany(byte[] bytes, Schema schema) {
    requireSchema(schema);
    final var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    final var mode = CompatibilityMode.current();
    try {
      final int count = readCount(buffer);
      final var values = new ArrayList<Value>(count);
      for (int i = 0; i < count; i++) {
        values.add(read(buffer, schema, mode));
      }
      if (buffer.hasRemaining()) {
        throw new DecodeException(buffer.remaining() + " trailing bytes after " + count + " values");
      }
      return values;
    } catch (BufferUnderflowException e) {
      throw new DecodeException("Truncated input of " + bytes.length + " bytes", e);
    }
  }

  private static void requireSchema(Schema schema) {
    Objects.requireNonNull(schema, "the binary format requires a schema");
  }

  /// Worst case encoded size. Strings are bounded at three bytes per UTF-16 unit.
  static int maxSizeOf(Value value, Schema schema) {
    int size = 0;
    if (schema.nullable()) {
      size += 1;
      if (value instanceof Value.NullValue) {
        return size;
      }
    }
    if (schema instanceof Schema.PrimitiveNode primitive) {
      return size + switch (primitive.kind()) {
        case BOOLEAN -> 1;
        case INT, LONG -> ZigZagEncoding.sizeOf(((Value.IntValue) value).value());
        case FLOAT -> Float.BYTES;
        case DOUBLE -> Double.BYTES;
        case STRING -> ZigZagEncoding.MAX_LONG_BYTES + 3 * ((Value.TextValue) value).value().length();
        case BYTES -> ZigZagEncoding.MAX_LONG_BYTES + ((Value.BytesValue) value).length();
      };
    }
    if (schema instanceof Schema.ArrayNode array) {
      size += ZigZagEncoding.MAX_LONG_BYTES;
      for (Value item : ((Value.SeqValue) value).values()) {
        size = Math.addExact(size, maxSizeOf(item, array.items()));
      }
      return size;
    }
    if (schema instanceof Schema.MapNode map) {
      size += ZigZagEncoding.MAX_LONG_BYTES;
      for (Map.Entry<String, Value> entry : ((Value.MapValue) value).entries().entrySet()) {
        size = Math.addExact(size, ZigZagEncoding.MAX_LONG_BYTES + 3 * entry.getKey().length());
        size = Math.addExact(size, maxSizeOf(entry.getValue(), map.values()));
      }
      return size;
    }
    if (schema instanceof Schema.RecordNode record) {
      size += ZigZagEncoding.MAX_LONG_BYTES;
      final var entries = ((Value.MapValue) value).entries();
      for (Schema.RecordNode.Field field : record.fields()) {
        size = Math.addExact(size, maxSizeOf(entries.get(field.name()), field.schema()));
      }
      return size;
    }
    if (schema instanceof Schema.EnumNode) {
      return size + ZigZagEncoding.MAX_LONG_BYTES;
    }
    if (schema instanceof Schema.UnionNode union) {
      final var tagged = (Value.MapValue) value;
      final var name = tagged.keys().get(0);
      final var branch = union.branches().get(union.indexOf(name).orElseThrow());
      return size + ZigZagEncoding.MAX_LONG_BYTES + maxSizeOf(tagged.entries().get(name), branch.schema());
    }
    throw new IllegalStateException("Unknown schema node " + schema);
  }

  /// Writes a value already conformed to the schema.
  static void write(ByteBuffer buffer, Value value, Schema schema) {
    if (schema.nullable()) {
      if (value instanceof Value.NullValue) {
        ZigZagEncoding.putInt(buffer, 0);
        return;
      }
      ZigZagEncoding.putInt(buffer, 1);
    }
    if (schema instanceof Schema.PrimitiveNode primitive) {
      switch (primitive.kind()) {
        case BOOLEAN -> buffer.put((byte) (((Value.BoolValue) value).value() ? 1 : 0));
        case INT, LONG -> ZigZagEncoding.putLong(buffer, ((Value.IntValue) value).value());
        case FLOAT -> {
          final double d = ((Value.FloatValue) value).value();
          final float f = (float) d;
          if (!Double.isNaN(d) && (double) f != d) {
            throw new ValueRangeException(d + " is not exactly representable in a 32 bit float node");
          }
          buffer.putFloat(f);
        }
        case DOUBLE -> buffer.putDouble(((Value.FloatValue) value).value());
        case STRING -> putBytes(buffer, utf8(((Value.TextValue) value).value()));
        case BYTES -> putBytes(buffer, ((Value.BytesValue) value).value());
      }
      return;
    }
    if (schema instanceof Schema.ArrayNode array) {
      final var items = ((Value.SeqValue) value).values();
      ZigZagEncoding.putInt(buffer, items.size());
      items.forEach(item -> write(buffer, item, array.items()));
      return;
    }
    if (schema instanceof Schema.MapNode map) {
      final var entries = ((Value.MapValue) value).entries();
      ZigZagEncoding.putInt(buffer, entries.size());
      entries.forEach((key, entry) -> {
        putBytes(buffer, utf8(key));
        write(buffer, entry, map.values());
      });
      return;
    }
    if (schema instanceof Schema.RecordNode record) {
      final var entries = ((Value.MapValue) value).entries();
      ZigZagEncoding.putInt(buffer, record.fields().size());
      for (Schema.RecordNode.Field field : record.fields()) {
        write(buffer, entries.get(field.name()), field.schema());
      }
      return;
    }
    if (schema instanceof Schema.EnumNode enumNode) {
      ZigZagEncoding.putInt(buffer, enumNode.symbols().indexOf(((Value.TextValue) value).value()));
      return;
    }
    if (schema instanceof Schema.UnionNode union) {
      final var tagged = (Value.MapValue) value;
      final var name = tagged.keys().get(0);
      final int index = union.indexOf(name).orElseThrow();
      ZigZagEncoding.putInt(buffer, index);
      write(buffer, tagged.entries().get(name), union.branches().get(index).schema());
      return;
    }
    throw new IllegalStateException("Unknown schema node " + schema);
  }

  static Value read(ByteBuffer buffer, Schema schema, CompatibilityMode mode) {
    if (schema.nullable()) {
      final int position = buffer.position();
      final int marker = ZigZagEncoding.getInt(buffer);
      if (marker == 0) {
        return Value.NULL;
      }
      if (marker != 1) {
        throw new DecodeException("Invalid null marker " + marker + " at position " + position);
      }
    }
    if (schema instanceof Schema.PrimitiveNode primitive) {
      return switch (primitive.kind()) {
        case BOOLEAN -> {
          final int position = buffer.position();
          final byte b = buffer.get();
          if (b != 0 && b != 1) {
            throw new DecodeException("Invalid boolean byte " + b + " at position " + position);
          }
          yield Value.of(b == 1);
        }
        case INT -> {
          final long l = ZigZagEncoding.getLong(buffer);
          if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new ValueRangeException(l + " read from a 32 bit int node");
          }
          yield Value.of(l);
        }
        case LONG -> Value.of(ZigZagEncoding.getLong(buffer));
        case FLOAT -> Value.of((double) buffer.getFloat());
        case DOUBLE -> Value.of(buffer.getDouble());
        case STRING -> Value.of(utf8(getBytes(buffer)));
        case BYTES -> Value.of(getBytes(buffer));
      };
    }
    if (schema instanceof Schema.ArrayNode array) {
      final int count = readCount(buffer);
      final var items = new ArrayList<Value>(count);
      for (int i = 0; i < count; i++) {
        items.add(read(buffer, array.items(), mode));
      }
      return Value.seq(items);
    }
    if (schema instanceof Schema.MapNode map) {
      final int count = readCount(buffer);
      final var entries = new LinkedHashMap<String, Value>();
      for (int i = 0; i < count; i++) {
        final var key = utf8(getBytes(buffer));
        if (entries.put(key, read(buffer, map.values(), mode)) != null) {
          throw new DecodeException("Duplicate map key '" + key + "'");
        }
      }
      return Value.map(entries);
    }
    if (schema instanceof Schema.RecordNode record) {
      return readRecord(buffer, record, mode);
    }
    if (schema instanceof Schema.EnumNode enumNode) {
      final int index = ZigZagEncoding.getInt(buffer);
      if (index < 0 || index >= enumNode.symbols().size()) {
        throw new DecodeException("Enum index " + index + " out of range for " + enumNode.name() + " with " +
            enumNode.symbols().size() + " symbols");
      }
      return Value.of(enumNode.symbols().get(index));
    }
    if (schema instanceof Schema.UnionNode union) {
      final int index = ZigZagEncoding.getInt(buffer);
      if (index < 0 || index >= union.branches().size()) {
        throw new DecodeException("Union index " + index + " out of range for " + union.name() + " with " +
            union.branches().size() + " branches");
      }
      final var branch = union.branches().get(index);
      return Value.map(branch.name(), read(buffer, branch.schema(), mode));
    }
    throw new IllegalStateException("Unknown schema node " + schema);
  }

  /// Fields missing from the end of the data take their defaults, which is how a reader with appended fields reads
  /// data written before the fields existed.
  private static Value readRecord(ByteBuffer buffer, Schema.RecordNode record, CompatibilityMode mode) {
    final int count = ZigZagEncoding.getInt(buffer);
    final var fields = record.fields();
    if (count < 0 || count > fields.size()) {
      throw new DecodeException("Record " + record.name() + " has " + fields.size() + " fields but data has " + count);
    }
    final var entries = new LinkedHashMap<String, Value>();
    for (int i = 0; i < fields.size(); i++) {
      final var field = fields.get(i);
      if (i < count) {
        entries.put(field.name(), read(buffer, field.schema(), mode));
      } else if (mode == CompatibilityMode.ENABLED && field.defaultValue().isPresent()) {
        LOGGER.finer(() -> "Field " + record.name() + "." + field.name() + " absent from data, using its default");
        entries.put(field.name(), Schemas.conform(field.defaultValue().get(), field.schema(), mode));
      } else {
        throw new SchemaMismatchException("Field '" + field.name() + "' of record " + record.name() +
            " is absent from data written with " + count + " fields" +
            (mode == CompatibilityMode.DISABLED ? " and compatibility is disabled" : " and has no default"));
      }
    }
    return Value.map(entries);
  }

  /// Every encoded value takes at least one byte, which bounds a count by the bytes left.
  private static int readCount(ByteBuffer buffer) {
    final int position = buffer.position();
    final int count = ZigZagEncoding.getInt(buffer);
    if (count < 0 || count > buffer.remaining()) {
      throw new DecodeException("Invalid count " + count + " at position " + position + " with " +
          buffer.remaining() + " bytes remaining");
    }
    return count;
  }

  private static void putBytes(ByteBuffer buffer, byte[] bytes) {
    ZigZagEncoding.putInt(buffer, bytes.length);
    buffer.put(bytes);
  }

  private static byte[] getBytes(ByteBuffer buffer) {
    final int position = buffer.position();
    final int length = ZigZagEncoding.getInt(buffer);
    if (length < 0 || length > buffer.remaining()) {
      throw new DecodeException("Invalid length " + length + " at position " + position + " with " +
          buffer.remaining() + " bytes remaining");
    }
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /// Text with an unpaired surrogate has no UTF-8 form.
  private static byte[] utf8(String text) {
    try {
      final var encoded = StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(text));
      return Arrays.copyOf(encoded.array(), encoded.limit());
    } catch (CharacterCodingException e) {
      throw new SchemaMismatchException("Text of " + text.length() + " chars with an unpaired surrogate at index " +
          unpairedSurrogate(text) + " cannot be written as UTF-8", e);
    }
  }

  private static int unpairedSurrogate(String text) {
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
        i++;
      } else if (Character.isSurrogate(c)) {
        return i;
      }
    }
    return -1;
  }

  private static String utf8(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new DecodeException("Invalid UTF-8 in string of " + bytes.length + " bytes", e);
    }
  }

  @Override
  public String toString() {
    return "BinaryCodec";
  }
}
