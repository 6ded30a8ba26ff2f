// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/// Streams [Value] trees to and from JSON with Jackson. Bytes are written as base64 strings. Non-finite doubles are
/// written as the bare tokens `NaN`, `Infinity` and `-Infinity` and read back as floats. Duplicate object keys are
/// rejected.
public final class JsonValues {

  public static final JsonFactory FACTORY = JsonFactory.builder()
      .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
      .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
      .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
      .build();

  static final String TAG_PREFIX = "$";
  static final String BYTES_TAG = "$bytes";
  static final String MAP_TAG = "$map";

  private JsonValues() {
  }

  /// Parses a complete JSON document. Anything after the first value is a [DecodeException].
  public static Value parse(byte[] json) {
    return parse(json, false);
  }

  private static Value parse(byte[] json, boolean tagged) {
    try (JsonParser parser = FACTORY.createParser(json)) {
      final var token = parser.nextToken();
      if (token == null) {
        throw new DecodeException("Empty JSON input");
      }
      final var value = read(parser, tagged);
      if (parser.nextToken() != null) {
        throw new DecodeException("Trailing content after JSON value at " + parser.currentLocation());
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new DecodeException("Malformed JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Value parse(String json) {
    return parse(json.getBytes(StandardCharsets.UTF_8));
  }

  public static byte[] toJson(Value value) {
    return toJson(value, false);
  }

  public static String toJsonString(Value value) {
    return new String(toJson(value, false), StandardCharsets.UTF_8);
  }

  /// JSON text that reads back to an equal [Value] through [#parseTagged(String)]. Plain values are written as plain
  /// JSON. Bytes become `{"$bytes": base64}` and a mapping with a key starting with `$` is wrapped as
  /// `{"$map": {...}}`, so no other object in the text has such a key.
  public static String toTaggedJsonString(Value value) {
    return new String(toJson(value, true), StandardCharsets.UTF_8);
  }

  /// Reads text written by [#toTaggedJsonString(Value)]. An object with an untagged `$` key is a [DecodeException].
  public static Value parseTagged(String json) {
    return parse(json.getBytes(StandardCharsets.UTF_8), true);
  }

  private static byte[] toJson(Value value, boolean tagged) {
    final var out = new ByteArrayOutputStream();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      write(generator, value, tagged);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  /// Reads the value starting at the parser's current token.
  public static Value read(JsonParser parser) throws IOException {
    return read(parser, false);
  }

  private static Value read(JsonParser parser, boolean tagged) throws IOException {
    final JsonToken token = parser.currentToken();
    if (token == null) {
      throw new DecodeException("Unexpected end of JSON input");
    }
    return switch (token) {
      case VALUE_NULL -> Value.NULL;
      case VALUE_TRUE -> Value.TRUE;
      case VALUE_FALSE -> Value.FALSE;
      case VALUE_NUMBER_INT -> {
        if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
          throw new ValueRangeException("JSON integer " + parser.getText() + " exceeds 64 bits at " +
              parser.currentLocation());
        }
        yield Value.of(parser.getLongValue());
      }
      case VALUE_NUMBER_FLOAT -> Value.of(parser.getDoubleValue());
      case VALUE_STRING -> Value.of(parser.getText());
      case START_ARRAY -> {
        final var values = new ArrayList<Value>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
          values.add(read(parser, tagged));
        }
        yield Value.seq(values);
      }
      case START_OBJECT -> tagged ? readTaggedObject(parser) : Value.map(readEntries(parser, false));
      default -> throw new DecodeException("Unexpected JSON token " + token + " at " + parser.currentLocation());
    };
  }

  private static Map<String, Value> readEntries(JsonParser parser, boolean tagged) throws IOException {
    final Map<String, Value> entries = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      final var key = parser.currentName();
      parser.nextToken();
      entries.put(key, read(parser, tagged));
    }
    return entries;
  }

  private static Value readTaggedObject(JsonParser parser) throws IOException {
    if (parser.nextToken() != JsonToken.FIELD_NAME) {
      return Value.map(Map.of());
    }
    final var first = parser.currentName();
    if (BYTES_TAG.equals(first)) {
      if (parser.nextToken() != JsonToken.VALUE_STRING) {
        throw new DecodeException("Expected base64 text under " + BYTES_TAG + " at " + parser.currentLocation());
      }
      final byte[] bytes;
      try {
        bytes = Base64.getDecoder().decode(parser.getText());
      } catch (IllegalArgumentException e) {
        throw new DecodeException("Invalid base64 under " + BYTES_TAG + ": " + e.getMessage(), e);
      }
      expectEndOfTag(parser, BYTES_TAG);
      return Value.of(bytes);
    }
    if (MAP_TAG.equals(first)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new DecodeException("Expected an object under " + MAP_TAG + " at " + parser.currentLocation());
      }
      final var entries = readEntries(parser, true);
      expectEndOfTag(parser, MAP_TAG);
      return Value.map(entries);
    }
    final Map<String, Value> entries = new LinkedHashMap<>();
    String key = first;
    do {
      if (key.startsWith(TAG_PREFIX)) {
        throw new DecodeException("Untagged key '" + key + "' at " + parser.currentLocation());
      }
      parser.nextToken();
      entries.put(key, read(parser, true));
      key = parser.nextToken() == JsonToken.FIELD_NAME ? parser.currentName() : null;
    } while (key != null);
    return Value.map(entries);
  }

  private static void expectEndOfTag(JsonParser parser, String tag) throws IOException {
    if (parser.nextToken() != JsonToken.END_OBJECT) {
      throw new DecodeException("Object tagged " + tag + " has more members at " + parser.currentLocation());
    }
  }

  public static void write(JsonGenerator generator, Value value) throws IOException {
    write(generator, value, false);
  }

  private static void write(JsonGenerator generator, Value value, boolean tagged) throws IOException {
    if (value instanceof Value.NullValue) {
      generator.writeNull();
    } else if (value instanceof Value.BoolValue b) {
      generator.writeBoolean(b.value());
    } else if (value instanceof Value.IntValue i) {
      generator.writeNumber(i.value());
    } else if (value instanceof Value.FloatValue f) {
      generator.writeNumber(f.value());
    } else if (value instanceof Value.TextValue t) {
      generator.writeString(t.value());
    } else if (value instanceof Value.BytesValue b) {
      if (tagged) {
        generator.writeStartObject();
        generator.writeStringField(BYTES_TAG, Base64.getEncoder().encodeToString(b.value()));
        generator.writeEndObject();
      } else {
        generator.writeBinary(b.value());
      }
    } else if (value instanceof Value.SeqValue s) {
      generator.writeStartArray();
      for (Value element : s.values()) {
        write(generator, element, tagged);
      }
      generator.writeEndArray();
    } else if (value instanceof Value.MapValue m) {
      final boolean wrap = tagged && m.entries().keySet().stream().anyMatch(k -> k.startsWith(TAG_PREFIX));
      if (wrap) {
        generator.writeStartObject();
        generator.writeFieldName(MAP_TAG);
      }
      generator.writeStartObject();
      for (Map.Entry<String, Value> entry : m.entries().entrySet()) {
        generator.writeFieldName(entry.getKey());
        write(generator, entry.getValue(), tagged);
      }
      generator.writeEndObject();
      if (wrap) {
        generator.writeEndObject();
      }
    }
  }
}
