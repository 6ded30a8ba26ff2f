// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import io.github.simbo1905.no.adapter.TypeDescriptor.Carrier;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// The converters every adapter starts with, one per descriptor kind, registered at
/// [ConverterRegistry#BUILTIN_SPECIFICITY] so that any user registration for the same kind takes precedence.
final class StandardConverters {

  private StandardConverters() {
  }

  static void install(ConverterRegistry registry) {
    register(registry, TypeDescriptor.Kind.SCALAR, new ScalarConverter());
    register(registry, TypeDescriptor.Kind.OPTIONAL, new OptionalConverter());
    register(registry, TypeDescriptor.Kind.SEQUENCE, new SequenceConverter());
    register(registry, TypeDescriptor.Kind.MAP, new MapConverter());
    register(registry, TypeDescriptor.Kind.RECORD, new RecordConverter());
    register(registry, TypeDescriptor.Kind.ENUM, new EnumConverter());
    register(registry, TypeDescriptor.Kind.UNION, new UnionConverter());
  }

  private static void register(ConverterRegistry registry, TypeDescriptor.Kind kind, Converter converter) {
    registry.register(DispatchKey.kind(kind), converter, ConverterRegistry.BUILTIN_SPECIFICITY, false);
  }

  /// Booleans, integers of every width, characters, floating point, strings and byte arrays.
  static final class ScalarConverter implements Converter {
    /// 2^63 as a float or double. Values at or above it saturate when cast back to long.
    private static final double TWO_POW_63 = 0x1p63;

    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var scalar = ((TypeDescriptor.ScalarType) type).scalarKind();
      return switch (scalar) {
        case BOOLEAN -> Value.of(cast(object, Boolean.class, context));
        case BYTE -> Value.of(cast(object, Byte.class, context).longValue());
        case SHORT -> Value.of(cast(object, Short.class, context).longValue());
        case INT -> Value.of(cast(object, Integer.class, context).longValue());
        case LONG -> Value.of(cast(object, Long.class, context));
        case CHAR -> Value.of(String.valueOf(cast(object, Character.class, context).charValue()));
        case FLOAT -> Value.of(cast(object, Float.class, context).doubleValue());
        case DOUBLE -> Value.of(cast(object, Double.class, context));
        case STRING -> Value.of(cast(object, String.class, context));
        case BYTES -> Value.of(cast(object, byte[].class, context));
      };
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var scalar = ((TypeDescriptor.ScalarType) type).scalarKind();
      return switch (scalar) {
        case BOOLEAN -> {
          if (value instanceof Value.BoolValue b) {
            yield b.value();
          }
          throw expected("boolean", value, context);
        }
        case BYTE -> (byte) integer(value, Byte.MIN_VALUE, Byte.MAX_VALUE, "byte", context);
        case SHORT -> (short) integer(value, Short.MIN_VALUE, Short.MAX_VALUE, "short", context);
        case INT -> (int) integer(value, Integer.MIN_VALUE, Integer.MAX_VALUE, "int", context);
        case LONG -> integer(value, Long.MIN_VALUE, Long.MAX_VALUE, "long", context);
        case CHAR -> {
          if (value instanceof Value.TextValue t && t.value().length() == 1) {
            yield t.value().charAt(0);
          }
          throw expected("single character text", value, context);
        }
        case FLOAT -> {
          final double d = floating(value, context);
          final float f = (float) d;
          if (!Double.isNaN(d) && (double) f != d) {
            throw context.outOfRange(d + " is not exactly representable as a float");
          }
          yield f;
        }
        case DOUBLE -> floating(value, context);
        case STRING -> {
          if (value instanceof Value.TextValue t) {
            yield t.value();
          }
          throw expected("text", value, context);
        }
        case BYTES -> bytes(value, context);
      };
    }

    private static byte[] bytes(Value value, ConversionContext context) {
      if (value instanceof Value.BytesValue b) {
        return b.value();
      }
      if (value instanceof Value.TextValue t) {
        try {
          return Base64.getDecoder().decode(t.value());
        } catch (IllegalArgumentException e) {
          throw context.mismatch("text is not base64 encoded bytes: " + e.getMessage());
        }
      }
      throw expected("bytes", value, context);
    }

    private static long integer(Value value, long min, long max, String javaType, ConversionContext context) {
      if (!(value instanceof Value.IntValue i)) {
        throw expected("integer", value, context);
      }
      if (i.value() < min || i.value() > max) {
        throw context.outOfRange(i.value() + " does not fit in a " + javaType);
      }
      return i.value();
    }

    /// Integers are accepted where floating point is declared as long as the conversion is exact.
    private static double floating(Value value, ConversionContext context) {
      if (value instanceof Value.FloatValue f) {
        return f.value();
      }
      if (value instanceof Value.IntValue i) {
        final double d = (double) i.value();
        if (d >= TWO_POW_63 || (long) d != i.value()) {
          throw context.outOfRange(i.value() + " is not exactly representable as floating point");
        }
        return d;
      }
      throw expected("number", value, context);
    }

    private static <T> T cast(Object object, Class<T> type, ConversionContext context) {
      if (!type.isInstance(object)) {
        throw context.mismatch("expected " + type.getSimpleName() + " but got " + object.getClass().getName());
      }
      return type.cast(object);
    }

    @Override
    public String toString() {
      return "ScalarConverter";
    }
  }

  /// `Optional<T>` and `@Nullable T`. Absence is always [Value#NULL]; the descriptor's carrier picks the Java form.
  static final class OptionalConverter implements Converter {
    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var optional = (TypeDescriptor.OptionalType) type;
      final var present = ConversionEngine.present(object);
      if (present.isEmpty()) {
        return Value.NULL;
      }
      return context.toValue(present.get(), optional.inner(), "");
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var optional = (TypeDescriptor.OptionalType) type;
      if (value instanceof Value.NullValue) {
        return optional.carrier() == Carrier.OPTIONAL ? Optional.empty() : null;
      }
      final var inner = context.fromValue(value, optional.inner(), "");
      return optional.carrier() == Carrier.OPTIONAL ? Optional.of(inner) : inner;
    }

    @Override
    public String toString() {
      return "OptionalConverter";
    }
  }

  /// Lists, collections and sets. Decoded collections are unmodifiable and may hold nulls when the element type is
  /// optional.
  static final class SequenceConverter implements Converter {
    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var sequence = (TypeDescriptor.SequenceType) type;
      if (!(object instanceof Collection<?> collection)) {
        throw context.mismatch("expected a collection but got " + object.getClass().getName());
      }
      final var values = new ArrayList<Value>(collection.size());
      int index = 0;
      for (Object element : collection) {
        values.add(context.toValue(element, sequence.element(), "[" + index++ + "]"));
      }
      return Value.seq(values);
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var sequence = (TypeDescriptor.SequenceType) type;
      if (!(value instanceof Value.SeqValue seq)) {
        throw expected("sequence", value, context);
      }
      final List<Value> values = seq.values();
      if (sequence.container() == TypeDescriptor.Container.SET) {
        final Set<Object> set = new LinkedHashSet<>();
        for (int i = 0; i < values.size(); i++) {
          if (!set.add(context.fromValue(values.get(i), sequence.element(), "[" + i + "]"))) {
            throw context.mismatch("duplicate set element at index " + i);
          }
        }
        return Collections.unmodifiableSet(set);
      }
      final List<Object> list = new ArrayList<>(values.size());
      for (int i = 0; i < values.size(); i++) {
        list.add(context.fromValue(values.get(i), sequence.element(), "[" + i + "]"));
      }
      return Collections.unmodifiableList(list);
    }

    @Override
    public String toString() {
      return "SequenceConverter";
    }
  }

  /// Maps with text like keys. Keys go through the converter for the key type and must come out as text.
  static final class MapConverter implements Converter {
    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var mapType = (TypeDescriptor.MapType) type;
      if (!(object instanceof Map<?, ?> map)) {
        throw context.mismatch("expected a map but got " + object.getClass().getName());
      }
      final var entries = new LinkedHashMap<String, Value>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw context.mismatch("null map key");
        }
        final var key = context.toValue(entry.getKey(), mapType.key(), "{" + entry.getKey() + "}");
        if (!(key instanceof Value.TextValue text)) {
          throw context.mismatch("map key " + entry.getKey() + " did not convert to text but to " + key);
        }
        entries.put(text.value(), context.toValue(entry.getValue(), mapType.value(), "{" + text.value() + "}"));
      }
      return Value.map(entries);
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var mapType = (TypeDescriptor.MapType) type;
      if (!(value instanceof Value.MapValue mapValue)) {
        throw expected("mapping", value, context);
      }
      final Map<Object, Object> map = new LinkedHashMap<>();
      for (Map.Entry<String, Value> entry : mapValue.entries().entrySet()) {
        final var segment = "{" + entry.getKey() + "}";
        final var key = context.fromValue(Value.of(entry.getKey()), mapType.key(), segment);
        map.put(key, context.fromValue(entry.getValue(), mapType.value(), segment));
      }
      return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
      return "MapConverter";
    }
  }

  /// Records become mappings keyed by component name in declaration order. Reading fills missing fields from their
  /// declared defaults unless compatibility is disabled.
  static final class RecordConverter implements Converter {
    private static final ClassValue<RecordAccess> ACCESS = new ClassValue<>() {
      @Override
      protected RecordAccess computeValue(Class<?> type) {
        return RecordAccess.of(type);
      }
    };

    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var record = (TypeDescriptor.RecordType) type;
      if (!record.type().isInstance(object)) {
        throw context.mismatch("expected " + record.type().getName() + " but got " + object.getClass().getName());
      }
      final var access = ACCESS.get(record.type());
      final var entries = new LinkedHashMap<String, Value>();
      final var fields = record.fields();
      for (int i = 0; i < fields.size(); i++) {
        final var field = fields.get(i);
        entries.put(field.name(), context.toValue(access.get(object, i), field.type(), "." + field.name()));
      }
      return Value.map(entries);
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var record = (TypeDescriptor.RecordType) type;
      if (!(value instanceof Value.MapValue mapValue)) {
        throw expected("mapping for " + record.type().getSimpleName(), value, context);
      }
      final var entries = mapValue.entries();
      final boolean strict = context.compatibility() == CompatibilityMode.DISABLED;
      if (strict) {
        final var unknown = new HashSet<>(entries.keySet());
        record.fields().forEach(f -> unknown.remove(f.name()));
        if (!unknown.isEmpty()) {
          throw context.mismatch("unknown fields " + unknown + " for " + record.type().getSimpleName() +
              " with compatibility disabled");
        }
      }
      final var fields = record.fields();
      final Object[] arguments = new Object[fields.size()];
      for (int i = 0; i < fields.size(); i++) {
        final var field = fields.get(i);
        final var segment = "." + field.name();
        final var present = entries.get(field.name());
        if (present != null) {
          arguments[i] = context.fromValue(present, field.type(), segment);
        } else if (!strict && field.defaultValue().isPresent()) {
          LOGGER.finer(() -> context.path() + segment + " missing, using default " + field.defaultValue().get());
          arguments[i] = context.fromValue(field.defaultValue().get(), field.type(), segment);
        } else {
          throw context.mismatch("missing field '" + field.name() + "' of " + record.type().getSimpleName() +
              (strict ? " with compatibility disabled" : " which has no default"));
        }
      }
      return ACCESS.get(record.type()).construct(arguments, context);
    }

    @Override
    public String toString() {
      return "RecordConverter";
    }
  }

  /// Canonical constructor and component accessors of a record class as method handles.
  record RecordAccess(Class<?> type, MethodHandle constructor, MethodHandle[] accessors) {

    static RecordAccess of(Class<?> type) {
      final RecordComponent[] components = type.getRecordComponents();
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final MethodHandles.Lookup lookup = MethodHandles.lookup();
      try {
        final Constructor<?> constructor = type.getDeclaredConstructor(parameterTypes);
        constructor.setAccessible(true);
        final MethodHandle[] accessors = IntStream.range(0, components.length)
            .mapToObj(i -> {
              try {
                final var accessor = components[i].getAccessor();
                accessor.setAccessible(true);
                return lookup.unreflect(accessor);
              } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot access component " + i + " of " + type, e);
              }
            })
            .toArray(MethodHandle[]::new);
        return new RecordAccess(type, lookup.unreflectConstructor(constructor), accessors);
      } catch (NoSuchMethodException | IllegalAccessException | RuntimeException e) {
        throw new UnsupportedTypeException("Cannot access canonical constructor of record " + type.getName() +
            ": " + e.getMessage(), e);
      }
    }

    Object get(Object record, int index) {
      try {
        return accessors[index].invoke(record);
      } catch (RuntimeException | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new IllegalStateException("Accessor " + index + " of " + type.getName() + " failed", t);
      }
    }

    Object construct(Object[] arguments, ConversionContext context) {
      try {
        return constructor.invokeWithArguments(arguments);
      } catch (AdapterException | Error e) {
        throw e;
      } catch (Throwable t) {
        throw new SchemaMismatchException(context.path() + ": constructor of " + type.getName() +
            " rejected " + Arrays.toString(arguments) + ": " + t.getMessage(), t);
      }
    }
  }

  static final class EnumConverter implements Converter {
    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var enumType = (TypeDescriptor.EnumType) type;
      if (!enumType.type().isInstance(object)) {
        throw context.mismatch("expected " + enumType.type().getName() + " but got " + object.getClass().getName());
      }
      return Value.of(((Enum<?>) object).name());
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var enumType = (TypeDescriptor.EnumType) type;
      if (!(value instanceof Value.TextValue text)) {
        throw expected("enum symbol", value, context);
      }
      return Arrays.stream(enumType.type().getEnumConstants())
          .filter(c -> ((Enum<?>) c).name().equals(text.value()))
          .findFirst()
          .orElseThrow(() -> context.mismatch("'" + text.value() + "' is not one of " + enumType.symbols()));
    }

    @Override
    public String toString() {
      return "EnumConverter";
    }
  }

  /// Sealed types. The value is a single entry mapping from the branch's simple name to the branch value.
  static final class UnionConverter implements Converter {
    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      final var union = (TypeDescriptor.UnionType) type;
      for (TypeDescriptor.UnionType.Branch branch : union.branches()) {
        if (branch.type().type().isInstance(object)) {
          return Value.map(branch.name(), context.toValue(object, branch.type(), "." + branch.name()));
        }
      }
      throw context.mismatch(object.getClass().getName() + " is not a branch of " + union.describe());
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      final var union = (TypeDescriptor.UnionType) type;
      if (!(value instanceof Value.MapValue tagged) || tagged.size() != 1) {
        throw expected("single entry mapping naming a branch of " + union.type().getSimpleName(), value, context);
      }
      final var name = tagged.keys().get(0);
      final var branch = union.branches().stream()
          .filter(b -> b.name().equals(name))
          .findFirst()
          .orElseThrow(() -> context.mismatch("'" + name + "' is not a branch of " + union.describe()));
      return context.fromValue(tagged.entries().get(name), branch.type(), "." + name);
    }

    @Override
    public String toString() {
      return "UnionConverter";
    }
  }

  static SchemaMismatchException expected(String what, Value value, ConversionContext context) {
    return context.mismatch("expected " + what + " but got " + value.kind().name().toLowerCase() + " " + value);
  }
}
