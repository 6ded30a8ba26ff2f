// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Checks a [Value] against a [Schema] and returns it in the schema's canonical form: record fields in schema order
/// with missing ones filled from their defaults, integers widened where floating point is declared and base64 text
/// decoded where bytes are declared.
public final class Schemas {

  private Schemas() {
  }

  public static Value conform(Value value, Schema schema) {
    return conform(value, schema, CompatibilityMode.current());
  }

  public static Value conform(Value value, Schema schema, CompatibilityMode mode) {
    return conform(value, schema, mode, ConversionEngine.ROOT);
  }

  /// @param path value path used in failure messages, such as `$[3]` for the fourth of many values
  public static Value conform(Value value, Schema schema, CompatibilityMode mode, String path) {
    if (value instanceof Value.NullValue) {
      if (schema.nullable()) {
        return value;
      }
      throw new SchemaMismatchException(path + ": null where " + describe(schema) + " is required");
    }
    if (schema instanceof Schema.PrimitiveNode primitive) {
      return primitive(value, primitive, path);
    }
    if (schema instanceof Schema.ArrayNode array) {
      if (!(value instanceof Value.SeqValue seq)) {
        throw mismatch(path, "array", value);
      }
      final var items = new ArrayList<Value>(seq.size());
      for (int i = 0; i < seq.size(); i++) {
        items.add(conform(seq.values().get(i), array.items(), mode, path + "[" + i + "]"));
      }
      return Value.seq(items);
    }
    if (schema instanceof Schema.MapNode map) {
      if (!(value instanceof Value.MapValue mapValue)) {
        throw mismatch(path, "map", value);
      }
      final var entries = new LinkedHashMap<String, Value>();
      mapValue.entries().forEach((k, v) -> entries.put(k, conform(v, map.values(), mode, path + "{" + k + "}")));
      return Value.map(entries);
    }
    if (schema instanceof Schema.RecordNode record) {
      return record(value, record, mode, path);
    }
    if (schema instanceof Schema.EnumNode enumNode) {
      if (value instanceof Value.TextValue text && enumNode.symbols().contains(text.value())) {
        return value;
      }
      throw new SchemaMismatchException(path + ": " + value + " is not one of " + enumNode.symbols());
    }
    if (schema instanceof Schema.UnionNode union) {
      if (!(value instanceof Value.MapValue tagged) || tagged.size() != 1) {
        throw mismatch(path, "single entry mapping for union " + union.name(), value);
      }
      final var name = tagged.keys().get(0);
      final var index = union.indexOf(name)
          .orElseThrow(() -> new SchemaMismatchException(path + ": '" + name + "' is not a branch of " + union.name()));
      final var branch = union.branches().get(index);
      return Value.map(name, conform(tagged.entries().get(name), branch.schema(), mode, path + "." + name));
    }
    throw new IllegalStateException("Unknown schema node " + schema);
  }

  private static Value primitive(Value value, Schema.PrimitiveNode schema, String path) {
    final Value conformed = switch (schema.kind()) {
      case BOOLEAN -> value instanceof Value.BoolValue ? value : null;
      case INT -> {
        if (value instanceof Value.IntValue i && (i.value() < Integer.MIN_VALUE || i.value() > Integer.MAX_VALUE)) {
          throw new ValueRangeException(path + ": " + i.value() + " does not fit in a 32 bit int");
        }
        yield value instanceof Value.IntValue ? value : null;
      }
      case LONG -> value instanceof Value.IntValue ? value : null;
      case FLOAT, DOUBLE -> value instanceof Value.IntValue i
          ? Value.of((double) i.value())
          : value instanceof Value.FloatValue ? value : null;
      case STRING -> value instanceof Value.TextValue ? value : null;
      case BYTES -> value instanceof Value.TextValue text
          ? base64(text, path)
          : value instanceof Value.BytesValue ? value : null;
    };
    if (conformed == null) {
      throw mismatch(path, describe(schema), value);
    }
    return conformed;
  }

  private static Value base64(Value.TextValue text, String path) {
    try {
      return Value.of(Base64.getDecoder().decode(text.value()));
    } catch (IllegalArgumentException e) {
      throw new SchemaMismatchException(path + ": text is not base64 encoded bytes", e);
    }
  }

  private static Value record(Value value, Schema.RecordNode schema, CompatibilityMode mode, String path) {
    if (!(value instanceof Value.MapValue mapValue)) {
      throw mismatch(path, "record " + schema.name(), value);
    }
    final boolean strict = mode == CompatibilityMode.DISABLED;
    final Map<String, Value> entries = mapValue.entries();
    final var known = new HashSet<String>();
    final var conformed = new LinkedHashMap<String, Value>();
    for (Schema.RecordNode.Field field : schema.fields()) {
      known.add(field.name());
      final var present = entries.get(field.name());
      final var fieldPath = path + "." + field.name();
      if (present != null) {
        conformed.put(field.name(), conform(present, field.schema(), mode, fieldPath));
      } else if (!strict && field.defaultValue().isPresent()) {
        conformed.put(field.name(), conform(field.defaultValue().get(), field.schema(), mode, fieldPath));
      } else {
        throw new SchemaMismatchException(path + ": missing field '" + field.name() + "' of record " + schema.name() +
            (strict ? " with compatibility disabled" : " which has no default"));
      }
    }
    for (String key : entries.keySet()) {
      if (!known.contains(key)) {
        if (strict) {
          throw new SchemaMismatchException(path + ": unknown field '" + key + "' for record " + schema.name() +
              " with compatibility disabled");
        }
        LOGGER.finer(() -> path + ": dropping unknown field '" + key + "' of record " + schema.name());
      }
    }
    return Value.map(conformed);
  }

  private static SchemaMismatchException mismatch(String path, String expected, Value actual) {
    return new SchemaMismatchException(path + ": expected " + expected + " but got " +
        actual.kind().name().toLowerCase() + " " + actual);
  }

  private static String describe(Schema schema) {
    return schema.toTreeString().lines().findFirst().orElse("");
  }
}
