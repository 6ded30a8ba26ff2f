// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/// Stable, hashable dispatch key derived from a Java type declaration by [TypeResolver]. Equal declarations always
/// produce equal descriptors, which is what makes the converter lookup cache sound.
public sealed interface TypeDescriptor permits
    TypeDescriptor.ScalarType, TypeDescriptor.OptionalType, TypeDescriptor.SequenceType,
    TypeDescriptor.MapType, TypeDescriptor.Nominal {

  enum Kind {SCALAR, OPTIONAL, SEQUENCE, MAP, RECORD, ENUM, UNION, OPAQUE}

  enum ScalarKind {BOOLEAN, BYTE, SHORT, INT, LONG, CHAR, FLOAT, DOUBLE, STRING, BYTES}

  /// The Java box an optional value travels in. Not part of descriptor identity.
  enum Carrier {NULLABLE, OPTIONAL}

  enum Container {LIST, SET}

  Kind kind();

  /// Human readable form used in error messages.
  String describe();

  /// Whether a Java `null` (or empty `Optional`) is a legal value of this type.
  default boolean acceptsAbsent() {
    return false;
  }

  /// Registry lookup keys from most to least specific.
  default List<DispatchKey> dispatchChain() {
    final var chain = new ArrayList<DispatchKey>(4);
    chain.add(new DispatchKey.Exact(this));
    if (this instanceof RecordType record) {
      chain.add(new DispatchKey.Shape(record.fields()));
    }
    chain.add(new DispatchKey.OfKind(kind()));
    chain.add(DispatchKey.ANY);
    return List.copyOf(chain);
  }

  static ScalarType scalar(ScalarKind kind) {
    return new ScalarType(kind);
  }

  static OpaqueType opaque(Class<?> type) {
    return new OpaqueType(type);
  }

  /// The single normalization rule for optional spellings: making an already optional type nullable returns it
  /// unchanged, otherwise the type is wrapped once.
  static OptionalType optional(TypeDescriptor inner, Carrier carrier) {
    if (inner instanceof OptionalType existing) {
      return existing;
    }
    return new OptionalType(inner, carrier);
  }

  /// Types that carry a Java class as their identity component.
  sealed interface Nominal extends TypeDescriptor permits RecordType, EnumType, UnionType, OpaqueType {
    Class<?> type();
  }

  record ScalarType(ScalarKind scalarKind) implements TypeDescriptor {
    public ScalarType {
      Objects.requireNonNull(scalarKind);
    }

    @Override
    public Kind kind() {
      return Kind.SCALAR;
    }

    @Override
    public String describe() {
      return scalarKind.name().toLowerCase();
    }
  }

  /// A value that may be absent. `Optional<T>` and `@Nullable T` both resolve here; [#carrier()] only remembers which
  /// Java box to rebuild on the way out, so it is excluded from equality.
  record OptionalType(TypeDescriptor inner, Carrier carrier) implements TypeDescriptor {
    public OptionalType {
      Objects.requireNonNull(inner);
      Objects.requireNonNull(carrier);
      if (inner instanceof OptionalType) {
        throw new IllegalArgumentException("Optional of optional collapses: " + inner.describe());
      }
    }

    @Override
    public Kind kind() {
      return Kind.OPTIONAL;
    }

    @Override
    public boolean acceptsAbsent() {
      return true;
    }

    @Override
    public String describe() {
      return "optional<" + inner.describe() + ">";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof OptionalType other && inner.equals(other.inner);
    }

    @Override
    public int hashCode() {
      return 31 * Kind.OPTIONAL.hashCode() + inner.hashCode();
    }
  }

  record SequenceType(TypeDescriptor element, Container container) implements TypeDescriptor {
    public SequenceType {
      Objects.requireNonNull(element);
      Objects.requireNonNull(container);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE;
    }

    @Override
    public String describe() {
      return container.name().toLowerCase() + "<" + element.describe() + ">";
    }
  }

  record MapType(TypeDescriptor key, TypeDescriptor value) implements TypeDescriptor {
    public MapType {
      Objects.requireNonNull(key);
      Objects.requireNonNull(value);
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    @Override
    public String describe() {
      return "map<" + key.describe() + ", " + value.describe() + ">";
    }
  }

  record RecordType(Class<?> type, List<Field> fields) implements Nominal {
    public RecordType {
      Objects.requireNonNull(type);
      fields = List.copyOf(fields);
    }

    @Override
    public Kind kind() {
      return Kind.RECORD;
    }

    @Override
    public String describe() {
      return "record " + type.getName() + fields.stream()
          .map(f -> f.name() + ": " + f.type().describe())
          .collect(Collectors.joining(", ", "{", "}"));
    }

    public Optional<Field> field(String name) {
      return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    /// A record component. `defaultValue` is present when the declaration supplies one, and for every optional field.
    public record Field(String name, TypeDescriptor type, Optional<Value> defaultValue) {
      public Field {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        Objects.requireNonNull(defaultValue);
      }

      public boolean optional() {
        return type.acceptsAbsent();
      }
    }
  }

  record EnumType(Class<?> type, List<String> symbols) implements Nominal {
    public EnumType {
      Objects.requireNonNull(type);
      symbols = List.copyOf(symbols);
    }

    @Override
    public Kind kind() {
      return Kind.ENUM;
    }

    @Override
    public String describe() {
      return "enum " + type.getName();
    }
  }

  /// A sealed interface. Branches follow the permitted subclass declaration order.
  record UnionType(Class<?> type, List<Branch> branches) implements Nominal {
    public UnionType {
      Objects.requireNonNull(type);
      branches = List.copyOf(branches);
    }

    @Override
    public Kind kind() {
      return Kind.UNION;
    }

    @Override
    public String describe() {
      return "union " + type.getName() + branches.stream()
          .map(Branch::name)
          .collect(Collectors.joining(" | ", "<", ">"));
    }

    public record Branch(String name, Nominal type) {
      public Branch {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
      }
    }
  }

  /// A class with no structure the resolver can introspect. It needs a registered converter.
  record OpaqueType(Class<?> type) implements Nominal {
    public OpaqueType {
      Objects.requireNonNull(type);
    }

    @Override
    public Kind kind() {
      return Kind.OPAQUE;
    }

    @Override
    public String describe() {
      return "opaque " + type.getName();
    }
  }
}
