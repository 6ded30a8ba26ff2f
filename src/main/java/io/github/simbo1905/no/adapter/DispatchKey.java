// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.List;
import java.util.Objects;

/// What a converter is registered against. A descriptor's [TypeDescriptor#dispatchChain()] lists the keys it matches,
/// most specific first: the exact descriptor, the structural shape of a record, the descriptor kind, then anything.
public sealed interface DispatchKey permits DispatchKey.Exact, DispatchKey.Shape, DispatchKey.OfKind, DispatchKey.Any {

  Any ANY = new Any();

  enum Level {EXACT, SHAPE, KIND, ANY}

  Level level();

  static DispatchKey exact(TypeDescriptor descriptor) {
    return new Exact(descriptor);
  }

  static DispatchKey kind(TypeDescriptor.Kind kind) {
    return new OfKind(kind);
  }

  record Exact(TypeDescriptor descriptor) implements DispatchKey {
    public Exact {
      Objects.requireNonNull(descriptor);
    }

    @Override
    public Level level() {
      return Level.EXACT;
    }

    @Override
    public String toString() {
      return "exact " + descriptor.describe();
    }
  }

  /// Any record with exactly this field layout, whatever the record is named.
  record Shape(List<TypeDescriptor.RecordType.Field> fields) implements DispatchKey {
    public Shape {
      fields = List.copyOf(fields);
    }

    @Override
    public Level level() {
      return Level.SHAPE;
    }

    @Override
    public String toString() {
      return "shape " + fields.stream().map(f -> f.name() + ": " + f.type().describe()).toList();
    }
  }

  record OfKind(TypeDescriptor.Kind kind) implements DispatchKey {
    public OfKind {
      Objects.requireNonNull(kind);
    }

    @Override
    public Level level() {
      return Level.KIND;
    }

    @Override
    public String toString() {
      return "kind " + kind;
    }
  }

  record Any() implements DispatchKey {
    @Override
    public Level level() {
      return Level.ANY;
    }

    @Override
    public String toString() {
      return "any";
    }
  }
}
