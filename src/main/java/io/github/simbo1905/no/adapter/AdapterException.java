// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// Root of every failure raised by the adapter. Each subclass names one failure kind so callers can branch on it;
/// components never wrap one kind inside another.
public abstract sealed class AdapterException extends RuntimeException permits
    UnsupportedTypeException, NoConverterException, AmbiguousConverterException, SchemaException,
    DecodeException, ValueRangeException, SchemaMismatchException {

  AdapterException(String message) {
    super(message);
  }

  AdapterException(String message, Throwable cause) {
    super(message, cause);
  }
}
