// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Objects;
import java.util.function.Function;

/// A pair of functions between Java objects and [Value] for the descriptors it is registered against. The descriptor
/// is passed in so one converter can serve a whole kind (every record, every list); nested values are converted
/// through the [ConversionContext].
public interface Converter {

  Value toValue(Object object, TypeDescriptor type, ConversionContext context);

  Object fromValue(Value value, TypeDescriptor type, ConversionContext context);

  /// Adapts a plain pair of functions for a single Java type. Runtime failures of `from` other than adapter failures
  /// are reported as a [SchemaMismatchException] at the current path.
  static <T> Converter of(Class<T> javaType,
                          Function<? super T, ? extends Value> to,
                          Function<? super Value, ? extends T> from) {
    Objects.requireNonNull(javaType, "javaType must not be null");
    Objects.requireNonNull(to, "to must not be null");
    Objects.requireNonNull(from, "from must not be null");
    return new Converter() {
      @Override
      public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
        if (!javaType.isInstance(object)) {
          throw context.mismatch("expected " + javaType.getName() + " but got " + object.getClass().getName());
        }
        return Objects.requireNonNull(to.apply(javaType.cast(object)),
            () -> "converter for " + javaType.getName() + " returned null at " + context.path());
      }

      @Override
      public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
        try {
          return from.apply(value);
        } catch (AdapterException e) {
          throw e;
        } catch (RuntimeException e) {
          throw new SchemaMismatchException(context.path() + ": cannot build " + javaType.getName() + " from " +
              value + ": " + e.getMessage(), e);
        }
      }

      @Override
      public String toString() {
        return "Converter[" + javaType.getName() + "]";
      }
    };
  }
}
