// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.model;

/// A ship's engine. Branch names on the wire are the simple record names.
public sealed interface Engine permits Engine.DieselEngine, Engine.ElectricEngine {

  int powerKw();

  record DieselEngine(int powerKw, String fuelType) implements Engine {
  }

  record ElectricEngine(int powerKw, int voltage) implements Engine {
  }
}
