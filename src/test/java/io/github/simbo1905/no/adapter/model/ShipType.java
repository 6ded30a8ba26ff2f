// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.model;

public enum ShipType {
  SAILING_VESSEL,
  MOTOR_VESSEL
}
