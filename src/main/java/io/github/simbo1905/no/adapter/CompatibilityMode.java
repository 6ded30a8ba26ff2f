// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Arrays;

/// Compatibility mode. Set via system property `no.adapter.Compatibility`. The default is ENABLED.
///
/// If set to ENABLED (our default) then when reading a record:
/// - a field that is missing from the decoded data takes the default declared for it
/// (`@FieldDefault`, or null for optional fields);
/// - a missing field without a default is an error.
///
/// If set to DISABLED then every field declared on the reading side must be present in the decoded data and
/// defaults are never used.
///
/// Fields may be appended to a record. They may not be reordered in the binary format, which carries no field
/// names, only a field count.
public enum CompatibilityMode {
  /// Strict mode: every declared field must be present.
  DISABLED,

  /// Lenient mode: missing fields take their declared defaults.
  ENABLED;

  public static final String PROPERTY = "no.adapter.Compatibility";

  public static CompatibilityMode current() {
    final String mode = System.getProperty(PROPERTY, "ENABLED").toUpperCase();
    try {
      return CompatibilityMode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid compatibility mode: " + mode + ". Must be one of: " + Arrays.toString(CompatibilityMode.values()));
    }
  }
}
