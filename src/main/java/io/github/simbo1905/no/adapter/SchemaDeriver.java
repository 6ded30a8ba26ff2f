// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Derives a [Schema] from a [TypeDescriptor]. [HookPoint#DERIVE_SCHEMA] hooks are asked first for every node, which
/// is how opaque and logical types get a schema. Derived schemas are memoized per descriptor until a schema hook is
/// registered.
public final class SchemaDeriver {

  private final HookRegistry hooks;
  private final AtomicReference<ConcurrentHashMap<TypeDescriptor, Schema>> memo =
      new AtomicReference<>(new ConcurrentHashMap<>());

  SchemaDeriver(HookRegistry hooks) {
    this.hooks = Objects.requireNonNull(hooks);
    hooks.onRegistration(point -> {
      if (point == HookPoint.DERIVE_SCHEMA) {
        memo.set(new ConcurrentHashMap<>());
      }
    });
  }

  /// Drops memoized schemas. Called when a converter registration may change which converter answers for a type.
  void invalidate() {
    memo.set(new ConcurrentHashMap<>());
  }

  public Schema derive(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    final var cache = memo.get();
    final var cached = cache.get(descriptor);
    if (cached != null) {
      return cached;
    }
    final var schema = build(descriptor);
    LOGGER.fine(() -> "Derived schema for " + descriptor.describe() + ":\n" + schema.toTreeString());
    final var raced = cache.putIfAbsent(descriptor, schema);
    return raced != null ? raced : schema;
  }

  private Schema build(TypeDescriptor descriptor) {
    final var supplied = hooks.firstSuccess(HookPoint.DERIVE_SCHEMA, descriptor);
    if (supplied.isPresent()) {
      return supplied.get();
    }
    if (descriptor instanceof TypeDescriptor.ScalarType scalar) {
      return scalar(scalar.scalarKind());
    }
    if (descriptor instanceof TypeDescriptor.OptionalType optional) {
      return build(optional.inner()).withNullable(true);
    }
    if (descriptor instanceof TypeDescriptor.SequenceType sequence) {
      return new Schema.ArrayNode(build(sequence.element()), false);
    }
    if (descriptor instanceof TypeDescriptor.MapType map) {
      return new Schema.MapNode(build(map.value()), false);
    }
    if (descriptor instanceof TypeDescriptor.RecordType record) {
      return new Schema.RecordNode(record.type().getName(), record.fields().stream()
          .map(field -> field(record, field))
          .toList(), false);
    }
    if (descriptor instanceof TypeDescriptor.EnumType enumType) {
      return new Schema.EnumNode(enumType.type().getName(), enumType.symbols(), false);
    }
    if (descriptor instanceof TypeDescriptor.UnionType union) {
      return new Schema.UnionNode(union.type().getName(), union.branches().stream()
          .map(b -> new Schema.UnionNode.Branch(b.name(), build(b.type())))
          .toList(), false);
    }
    if (descriptor instanceof TypeDescriptor.OpaqueType opaque) {
      throw new SchemaException("No schema for " + opaque.describe() + "; register a derive schema hook for it " +
          "or register it with Adapter.registerOpaque and a schema");
    }
    throw new IllegalStateException("Unknown descriptor " + descriptor);
  }

  private Schema.RecordNode.Field field(TypeDescriptor.RecordType record, TypeDescriptor.RecordType.Field field) {
    final var schema = build(field.type());
    field.defaultValue().ifPresent(defaultValue -> {
      try {
        Schemas.conform(defaultValue, schema, CompatibilityMode.ENABLED);
      } catch (SchemaMismatchException | ValueRangeException e) {
        throw new SchemaException("Default " + defaultValue + " of " + record.type().getName() + "." +
            field.name() + " does not fit its schema: " + e.getMessage(), e);
      }
    });
    return new Schema.RecordNode.Field(field.name(), schema, field.defaultValue());
  }

  static Schema scalar(TypeDescriptor.ScalarKind kind) {
    return switch (kind) {
      case BOOLEAN -> Schema.primitive(Schema.PrimitiveKind.BOOLEAN);
      case BYTE, SHORT, INT -> Schema.primitive(Schema.PrimitiveKind.INT);
      case LONG -> Schema.primitive(Schema.PrimitiveKind.LONG);
      case CHAR -> Schema.logical(Schema.PrimitiveKind.STRING, "char");
      case FLOAT -> Schema.primitive(Schema.PrimitiveKind.FLOAT);
      case DOUBLE -> Schema.primitive(Schema.PrimitiveKind.DOUBLE);
      case STRING -> Schema.primitive(Schema.PrimitiveKind.STRING);
      case BYTES -> Schema.primitive(Schema.PrimitiveKind.BYTES);
    };
  }
}
