// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Objects;

/// A registered converter. `sequence` is the registration order and only serves diagnostics; it never breaks ties.
public record ConverterEntry(DispatchKey key, Converter converter, int specificity, long sequence) {
  public ConverterEntry {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(converter, "converter must not be null");
  }
}
