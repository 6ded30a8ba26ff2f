// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// A numeric value does not fit the representable range of a codec or of the target Java type.
public final class ValueRangeException extends AdapterException {

  public ValueRangeException(String message) {
    super(message);
  }

  public ValueRangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
