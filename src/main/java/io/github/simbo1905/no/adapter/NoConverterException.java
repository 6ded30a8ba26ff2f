// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// The type is representable but nothing is registered to convert it. The message names the descriptor so that an
/// extension author can register a converter for it.
public final class NoConverterException extends AdapterException {
  private final transient TypeDescriptor descriptor;

  public NoConverterException(TypeDescriptor descriptor) {
    super("No converter registered for " + descriptor.describe());
    this.descriptor = descriptor;
  }

  public TypeDescriptor descriptor() {
    return descriptor;
  }
}
