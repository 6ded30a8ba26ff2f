// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Structural description of a type for schema aware codecs. Mirrors [TypeDescriptor] but keeps only what a codec
/// needs: node kind, children, nullability, declared defaults, enum symbols and union branch names.
public sealed interface Schema permits
    Schema.PrimitiveNode, Schema.ArrayNode, Schema.MapNode, Schema.RecordNode, Schema.EnumNode, Schema.UnionNode {

  enum PrimitiveKind {BOOLEAN, INT, LONG, FLOAT, DOUBLE, STRING, BYTES}

  boolean nullable();

  /// The same node with the given nullability.
  Schema withNullable(boolean nullable);

  /// Multi line indented rendering for logs and failure messages.
  default String toTreeString() {
    return toTreeString(0);
  }

  String toTreeString(int indent);

  static PrimitiveNode primitive(PrimitiveKind kind) {
    return new PrimitiveNode(kind, Optional.empty(), false);
  }

  /// A primitive tagged with the name of the domain type it carries, e.g. `STRING` tagged `uuid`.
  static PrimitiveNode logical(PrimitiveKind kind, String logicalType) {
    return new PrimitiveNode(kind, Optional.of(logicalType), false);
  }

  private static String suffix(boolean nullable) {
    return nullable ? "?" : "";
  }

  record PrimitiveNode(PrimitiveKind kind, Optional<String> logicalType, boolean nullable) implements Schema {
    public PrimitiveNode {
      Objects.requireNonNull(kind);
      Objects.requireNonNull(logicalType);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new PrimitiveNode(kind, logicalType, nullable);
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + kind.name().toLowerCase() + logicalType.map(l -> "(" + l + ")").orElse("") +
          suffix(nullable);
    }
  }

  record ArrayNode(Schema items, boolean nullable) implements Schema {
    public ArrayNode {
      Objects.requireNonNull(items);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new ArrayNode(items, nullable);
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + "array" + suffix(nullable) + "\n" + items.toTreeString(indent + 2);
    }
  }

  /// Keys are always text.
  record MapNode(Schema values, boolean nullable) implements Schema {
    public MapNode {
      Objects.requireNonNull(values);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new MapNode(values, nullable);
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + "map" + suffix(nullable) + "\n" + values.toTreeString(indent + 2);
    }
  }

  record RecordNode(String name, List<Field> fields, boolean nullable) implements Schema {
    public RecordNode {
      Objects.requireNonNull(name);
      fields = List.copyOf(fields);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new RecordNode(name, fields, nullable);
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + "record " + name + suffix(nullable) + fields.stream()
          .map(f -> "\n" + " ".repeat(indent + 2) + f.name() + f.defaultValue().map(d -> " = " + d).orElse("") +
              ":\n" + f.schema().toTreeString(indent + 4))
          .collect(Collectors.joining());
    }

    /// A field, with the value a decoder must use when the field is missing from the data.
    public record Field(String name, Schema schema, Optional<Value> defaultValue) {
      public Field {
        Objects.requireNonNull(name);
        Objects.requireNonNull(schema);
        Objects.requireNonNull(defaultValue);
      }
    }
  }

  record EnumNode(String name, List<String> symbols, boolean nullable) implements Schema {
    public EnumNode {
      Objects.requireNonNull(name);
      symbols = List.copyOf(symbols);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new EnumNode(name, symbols, nullable);
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + "enum " + name + symbols + suffix(nullable);
    }
  }

  /// The value of a union is a single entry mapping from branch name to the branch value.
  record UnionNode(String name, List<Branch> branches, boolean nullable) implements Schema {
    public UnionNode {
      Objects.requireNonNull(name);
      branches = List.copyOf(branches);
    }

    @Override
    public Schema withNullable(boolean nullable) {
      return new UnionNode(name, branches, nullable);
    }

    public Optional<Integer> indexOf(String branchName) {
      for (int i = 0; i < branches.size(); i++) {
        if (branches.get(i).name().equals(branchName)) {
          return Optional.of(i);
        }
      }
      return Optional.empty();
    }

    @Override
    public String toTreeString(int indent) {
      return " ".repeat(indent) + "union " + name + suffix(nullable) + branches.stream()
          .map(b -> "\n" + " ".repeat(indent + 2) + b.name() + ":\n" + b.schema().toTreeString(indent + 4))
          .collect(Collectors.joining());
    }

    public record Branch(String name, Schema schema) {
      public Branch {
        Objects.requireNonNull(name);
        Objects.requireNonNull(schema);
      }
    }
  }
}
