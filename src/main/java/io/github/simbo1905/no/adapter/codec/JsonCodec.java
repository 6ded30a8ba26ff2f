// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.github.simbo1905.no.adapter.Codec;
import io.github.simbo1905.no.adapter.CompatibilityMode;
import io.github.simbo1905.no.adapter.DecodeException;
import io.github.simbo1905.no.adapter.JsonValues;
import io.github.simbo1905.no.adapter.Schema;
import io.github.simbo1905.no.adapter.Schemas;
import io.github.simbo1905.no.adapter.Value;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/// JSON through Jackson's streaming API. Records and maps are objects, sequences are arrays, bytes are base64 strings
/// and a union is an object with a single member named after the branch. No schema is needed; when one is given the
/// value is conformed to it on the way in and out, which fills defaults, drops unknown members and turns base64
/// strings back into bytes. The adapter passes one whenever the declared type has a derivable schema.
///
/// Many values are written as newline delimited JSON, one document per line.
public final class JsonCodec implements Codec {

  public static final String NAME = "json";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean requiresSchema() {
    return false;
  }

  @Override
  public byte[] encode(Value value, Schema schema) {
    return JsonValues.toJson(schema == null ? value : Schemas.conform(value, schema));
  }

  @Override
  public Value decode(byte[] bytes, Schema schema) {
    final var value = JsonValues.parse(bytes);
    return schema == null ? value : Schemas.conform(value, schema);
  }

  @Override
  public byte[] encodeMany(List<Value> values, Schema schema) {
    final var out = new ByteArrayOutputStream();
    try (JsonGenerator generator = JsonValues.FACTORY.createGenerator(out)) {
      generator.setRootValueSeparator(null);
      final var mode = CompatibilityMode.current();
      for (int i = 0; i < values.size(); i++) {
        final var value = values.get(i);
        JsonValues.write(generator, schema == null ? value : Schemas.conform(value, schema, mode, "$[" + i + "]"));
        generator.writeRaw('\n');
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  /// Reads whitespace separated root values, so both NDJSON and concatenated documents decode.
  @Override
  public List<Value> decodeMany(byte[] bytes, Schema schema) {
    final var values = new ArrayList<Value>();
    final var mode = CompatibilityMode.current();
    try (JsonParser parser = JsonValues.FACTORY.createParser(bytes)) {
      while (parser.nextToken() != null) {
        final var value = JsonValues.read(parser);
        values.add(schema == null ? value : Schemas.conform(value, schema, mode, "$[" + values.size() + "]"));
      }
    } catch (JsonProcessingException e) {
      throw new DecodeException("Malformed JSON after " + values.size() + " values: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return values;
  }

  @Override
  public String toString() {
    return "JsonCodec";
  }
}
