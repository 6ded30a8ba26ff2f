// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Drives a conversion through the registry. Every nested value goes through here, so dispatch, the null check and
/// the intermediate hooks apply at each level and failures carry the path of the offending value.
final class ConversionEngine {

  static final String ROOT = "$";

  private final ConverterRegistry registry;
  private final HookRegistry hooks;

  ConversionEngine(ConverterRegistry registry, HookRegistry hooks) {
    this.registry = registry;
    this.hooks = hooks;
  }

  Value toValue(Object object, TypeDescriptor type, CompatibilityMode mode) {
    return toValue(object, type, mode, ROOT);
  }

  /// @param root the path reported for the top level value, e.g. `$[3]` for the fourth of many
  Value toValue(Object object, TypeDescriptor type, CompatibilityMode mode, String root) {
    return new Frame(root, mode).toValue(object, type);
  }

  Object fromValue(Value value, TypeDescriptor type, CompatibilityMode mode) {
    return fromValue(value, type, mode, ROOT);
  }

  Object fromValue(Value value, TypeDescriptor type, CompatibilityMode mode, String root) {
    return new Frame(root, mode).fromValue(value, type);
  }

  /// The context handed to converters. One frame per position in the value tree.
  private final class Frame implements ConversionContext {
    private final String path;
    private final CompatibilityMode mode;

    private Frame(String path, CompatibilityMode mode) {
      this.path = path;
      this.mode = mode;
    }

    Value toValue(Object object, TypeDescriptor type) {
      Objects.requireNonNull(type, "type must not be null");
      if (object == null) {
        if (type.acceptsAbsent()) {
          return Value.NULL;
        }
        throw mismatch("null where " + type.describe() + " is required");
      }
      final var entry = registry.lookup(type);
      final Value converted = entry.converter().toValue(object, type, this);
      if (converted == null) {
        throw new IllegalStateException("Converter " + entry.converter() + " returned null at " + path);
      }
      if (!type.acceptsAbsent() && converted instanceof Value.NullValue) {
        throw mismatch("converter " + entry.converter() + " produced null for non optional " + type.describe());
      }
      return hooks.chain(HookPoint.TO_INTERMEDIATE, type, converted);
    }

    Object fromValue(Value value, TypeDescriptor type) {
      Objects.requireNonNull(type, "type must not be null");
      final var entry = registry.lookup(type);
      final var prepared = hooks.chain(HookPoint.FROM_INTERMEDIATE, type, Objects.requireNonNull(value, "value"));
      if (prepared instanceof Value.NullValue && !type.acceptsAbsent()) {
        throw mismatch("null where " + type.describe() + " is required");
      }
      final var result = entry.converter().fromValue(prepared, type, this);
      if (result == null && !type.acceptsAbsent()) {
        throw mismatch("converter " + entry.converter() + " produced null for non optional " + type.describe());
      }
      return result;
    }

    @Override
    public Value toValue(Object object, TypeDescriptor type, String segment) {
      return new Frame(path + segment, mode).toValue(object, type);
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, String segment) {
      return new Frame(path + segment, mode).fromValue(value, type);
    }

    @Override
    public String path() {
      return path;
    }

    @Override
    public CompatibilityMode compatibility() {
      return mode;
    }

    @Override
    public SchemaMismatchException mismatch(String message) {
      LOGGER.finer(() -> "Conversion mismatch at " + path + ": " + message);
      return ConversionContext.super.mismatch(message);
    }

    @Override
    public String toString() {
      return "Frame[" + path + ", " + mode + "]";
    }
  }

  /// Unwraps the Java carriers of an optional value.
  static Optional<Object> present(Object object) {
    if (object instanceof Optional<?> optional) {
      return optional.map(o -> o);
    }
    return Optional.ofNullable(object);
  }
}
