// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// Callback handed to every [Converter] so that composite converters can delegate nested values back through the
/// registry and hooks. Each nested call extends the value path used in error messages.
public interface ConversionContext {

  /// Converts a nested object. `segment` is appended to the path, e.g. `.name`, `[2]` or `{key}`.
  Value toValue(Object object, TypeDescriptor type, String segment);

  Object fromValue(Value value, TypeDescriptor type, String segment);

  /// Location of the value being converted, `$` for the root.
  String path();

  CompatibilityMode compatibility();

  default SchemaMismatchException mismatch(String message) {
    return new SchemaMismatchException(path() + ": " + message);
  }

  default ValueRangeException outOfRange(String message) {
    return new ValueRangeException(path() + ": " + message);
  }
}
