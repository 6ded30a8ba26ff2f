// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// More than one converter matched a descriptor at the same dispatch level and specificity.
public final class AmbiguousConverterException extends AdapterException {

  public AmbiguousConverterException(String message) {
    super(message);
  }

  public AmbiguousConverterException(String message, Throwable cause) {
    super(message, cause);
  }
}
