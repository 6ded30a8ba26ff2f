// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.csv.CsvFactory;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.github.simbo1905.no.adapter.Codec;
import io.github.simbo1905.no.adapter.CompatibilityMode;
import io.github.simbo1905.no.adapter.DecodeException;
import io.github.simbo1905.no.adapter.Schema;
import io.github.simbo1905.no.adapter.SchemaException;
import io.github.simbo1905.no.adapter.SchemaMismatchException;
import io.github.simbo1905.no.adapter.Schemas;
import io.github.simbo1905.no.adapter.Value;
import io.github.simbo1905.no.adapter.ValueRangeException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Comma separated values through Jackson's CSV module. A record is a header line of its field names followed by one
/// line of cells, and many records share one header. Only records whose fields are scalars or enums have a CSV form.
///
/// Every cell is text, so the schema types the cells when reading: integers, floats as Java prints them (including
/// `NaN` and `Infinity`), `true` or `false`, base64 bytes and enum symbols. An empty cell in a nullable column is null,
/// so an empty text or byte string in a nullable column is refused on write. Columns are matched by header name;
/// missing ones take their defaults and unknown ones follow the compatibility mode.
public final class CsvCodec implements Codec {

  public static final String NAME = "csv";

  /// Empty text is quoted so a row of one empty cell is not a blank line. Nulls stay unquoted.
  private static final CsvFactory FACTORY = CsvFactory.builder()
      .enable(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS)
      .build();

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
    return write(List.of(value), schema, false);
  }

  @Override
  public Value decode(byte[] bytes, Schema schema) {
    final var rows = read(bytes, schema, false);
    if (rows.size() != 1) {
      throw new DecodeException("Expected one CSV row but found " + rows.size());
    }
    return rows.get(0);
  }

  @Override
  public byte[] encodeMany(List<Value> values, Schema schema) {
    return write(values, schema, true);
  }

  @Override
  public List<Value> decodeMany(byte[] bytes, Schema schema) {
    return read(bytes, schema, true);
  }

  private static byte[] write(List<Value> values, Schema schema, boolean many) {
    final var record = columns(schema);
    final var mode = CompatibilityMode.current();
    final var header = CsvSchema.builder();
    record.fields().forEach(field -> header.addColumn(field.name()));
    final var out = new ByteArrayOutputStream();
    try (JsonGenerator generator = FACTORY.createGenerator(out)) {
      generator.setSchema(header.setUseHeader(true).build());
      for (int i = 0; i < values.size(); i++) {
        final var path = many ? "$[" + i + "]" : "$";
        final var row = Schemas.conform(values.get(i), record, mode, path);
        if (!(row instanceof Value.MapValue cells)) {
          throw new SchemaMismatchException(path + ": a CSV row cannot be null");
        }
        generator.writeStartObject();
        for (Schema.RecordNode.Field field : record.fields()) {
          generator.writeFieldName(field.name());
          final var cell = cell(cells.entries().get(field.name()), field.schema(), path + "." + field.name());
          if (cell == null) {
            generator.writeNull();
          } else {
            generator.writeString(cell);
          }
        }
        generator.writeEndObject();
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toByteArray();
  }

  private static List<Value> read(byte[] bytes, Schema schema, boolean many) {
    final var record = columns(schema);
    final var mode = CompatibilityMode.current();
    final Map<String, Schema> types = new HashMap<>();
    record.fields().forEach(field -> types.put(field.name(), field.schema()));
    final var rows = new ArrayList<Value>();
    try (JsonParser parser = FACTORY.createParser(bytes)) {
      parser.setSchema(CsvSchema.emptySchema().withHeader());
      JsonToken token;
      while ((token = parser.nextToken()) != null) {
        if (token != JsonToken.START_OBJECT) {
          throw new DecodeException("Unexpected CSV token " + token + " at " + parser.currentLocation());
        }
        final var path = many ? "$[" + rows.size() + "]" : "$";
        final var entries = new LinkedHashMap<String, Value>();
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          final var column = parser.currentName();
          parser.nextToken();
          final var text = parser.getText();
          final var type = types.get(column);
          entries.put(column, type == null ? Value.of(text) : parse(text, type, path + "." + column));
        }
        rows.add(Schemas.conform(Value.map(entries), record, mode, path));
      }
    } catch (JsonProcessingException e) {
      throw new DecodeException("Malformed CSV after " + rows.size() + " rows: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    LOGGER.finer(() -> "Read " + rows.size() + " CSV rows of " + record.name());
    return rows;
  }

  private static Schema.RecordNode columns(Schema schema) {
    Objects.requireNonNull(schema, "the csv format requires a schema");
    if (!(schema instanceof Schema.RecordNode record)) {
      throw new SchemaException("CSV rows need a record schema but got " +
          schema.toTreeString().lines().findFirst().orElse(""));
    }
    for (Schema.RecordNode.Field field : record.fields()) {
      if (!(field.schema() instanceof Schema.PrimitiveNode) && !(field.schema() instanceof Schema.EnumNode)) {
        throw new SchemaException("CSV column '" + field.name() + "' of " + record.name() +
            " must be a scalar or an enum");
      }
    }
    return record;
  }

  /// @return the cell text, or null for a null value which is written as an unquoted empty cell
  private static String cell(Value value, Schema schema, String path) {
    if (value instanceof Value.NullValue) {
      return null;
    }
    final String text;
    if (value instanceof Value.TextValue t) {
      text = t.value();
    } else if (value instanceof Value.BytesValue b) {
      text = Base64.getEncoder().encodeToString(b.value());
    } else if (value instanceof Value.IntValue i) {
      text = Long.toString(i.value());
    } else if (value instanceof Value.FloatValue f) {
      text = Double.toString(f.value());
    } else if (value instanceof Value.BoolValue b) {
      text = Boolean.toString(b.value());
    } else {
      throw new SchemaMismatchException(path + ": " + value.kind().name().toLowerCase() + " has no CSV cell form");
    }
    if (text.isEmpty() && schema.nullable()) {
      throw new SchemaMismatchException(path + ": an empty cell in a nullable column reads back as null");
    }
    return text;
  }

  private static Value parse(String text, Schema schema, String path) {
    if (text.isEmpty() && schema.nullable()) {
      return Value.NULL;
    }
    if (schema instanceof Schema.EnumNode) {
      return Value.of(text);
    }
    final var kind = ((Schema.PrimitiveNode) schema).kind();
    try {
      return switch (kind) {
        case BOOLEAN -> switch (text) {
          case "true" -> Value.TRUE;
          case "false" -> Value.FALSE;
          default -> throw new DecodeException(path + ": invalid boolean cell '" + text + "'");
        };
        case INT, LONG -> integer(text, path);
        case FLOAT, DOUBLE -> Value.of(Double.parseDouble(text));
        case STRING -> Value.of(text);
        case BYTES -> Value.of(Base64.getDecoder().decode(text));
      };
    } catch (IllegalArgumentException e) {
      throw new DecodeException(path + ": invalid " + kind.name().toLowerCase() + " cell '" + text + "'", e);
    }
  }

  private static Value integer(String text, String path) {
    try {
      return Value.of(Long.parseLong(text));
    } catch (NumberFormatException e) {
      if (text.matches("[+-]?\\d+")) {
        throw new ValueRangeException(path + ": CSV integer " + text + " exceeds 64 bits", e);
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return "CsvCodec";
  }
}
