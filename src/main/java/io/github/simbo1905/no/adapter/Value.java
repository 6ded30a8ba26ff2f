// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// The canonical, format agnostic form that every conversion targets. Converters produce it from Java objects and
/// codecs turn it into bytes. The set of nodes is closed.
///
/// Integers are fixed 64-bit. Types wider than a `long` (such as `BigInteger`) are carried as [TextValue] by their
/// converters. Absence is always [NullValue], never a Java `null`.
public sealed interface Value permits
    Value.NullValue, Value.BoolValue, Value.IntValue, Value.FloatValue,
    Value.TextValue, Value.BytesValue, Value.SeqValue, Value.MapValue {

  NullValue NULL = new NullValue();
  BoolValue TRUE = new BoolValue(true);
  BoolValue FALSE = new BoolValue(false);

  enum Kind {NULL, BOOLEAN, INTEGER, FLOAT, TEXT, BYTES, SEQUENCE, MAPPING}

  Kind kind();

  static BoolValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  static IntValue of(long value) {
    return new IntValue(value);
  }

  static FloatValue of(double value) {
    return new FloatValue(value);
  }

  static TextValue of(String value) {
    return new TextValue(value);
  }

  static BytesValue of(byte[] value) {
    return new BytesValue(value);
  }

  static SeqValue seq(List<? extends Value> values) {
    return new SeqValue(List.copyOf(values));
  }

  static SeqValue seq(Value... values) {
    return new SeqValue(List.of(values));
  }

  static MapValue map(Map<String, ? extends Value> entries) {
    return new MapValue(new LinkedHashMap<String, Value>(entries));
  }

  /// Builds a mapping from alternating keys and values: `Value.map("a", Value.of(1), "b", Value.NULL)`
  static MapValue map(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs but got " + keysAndValues.length + " arguments");
    }
    final var entries = new LinkedHashMap<String, Value>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      entries.put((String) keysAndValues[i], (Value) keysAndValues[i + 1]);
    }
    return new MapValue(entries);
  }

  record NullValue() implements Value {
    @Override
    public Kind kind() {
      return Kind.NULL;
    }

    @Override
    public String toString() {
      return "null";
    }
  }

  record BoolValue(boolean value) implements Value {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  record IntValue(long value) implements Value {
    @Override
    public Kind kind() {
      return Kind.INTEGER;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  /// Record equality on a `double` component follows `Double.compare`: `NaN` equals `NaN` and `0.0` is not `-0.0`.
  record FloatValue(double value) implements Value {
    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  record TextValue(String value) implements Value {
    public TextValue {
      Objects.requireNonNull(value, "text must not be null");
    }

    @Override
    public Kind kind() {
      return Kind.TEXT;
    }

    @Override
    public String toString() {
      return '"' + value + '"';
    }
  }

  record BytesValue(byte[] value) implements Value {
    public BytesValue {
      value = Objects.requireNonNull(value, "bytes must not be null").clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    public int length() {
      return value.length;
    }

    @Override
    public Kind kind() {
      return Kind.BYTES;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BytesValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "b64:" + Base64.getEncoder().encodeToString(value);
    }
  }

  record SeqValue(List<Value> values) implements Value {
    public SeqValue {
      values = List.copyOf(values);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE;
    }

    public int size() {
      return values.size();
    }

    @Override
    public String toString() {
      return values.stream().map(Value::toString).collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /// Text keyed mapping. Iteration follows insertion order; equality compares entries only.
  record MapValue(Map<String, Value> entries) implements Value {
    public MapValue {
      final var copy = new LinkedHashMap<String, Value>();
      entries.forEach((k, v) -> copy.put(
          Objects.requireNonNull(k, "mapping keys must not be null"),
          Objects.requireNonNull(v, () -> "mapping value for key '" + k + "' must not be null")));
      entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public Kind kind() {
      return Kind.MAPPING;
    }

    public int size() {
      return entries.size();
    }

    public @NotNull List<String> keys() {
      return new ArrayList<>(entries.keySet());
    }

    @Override
    public String toString() {
      return entries.entrySet().stream()
          .map(e -> '"' + e.getKey() + "\": " + e.getValue())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }
}
