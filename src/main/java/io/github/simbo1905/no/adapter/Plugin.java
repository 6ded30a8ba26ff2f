// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

/// A named bundle of converter, hook and codec registrations. Plugins on the class path are found with
/// [java.util.ServiceLoader] by [Adapter.Builder#discoverPlugins()] when listed in
/// `META-INF/services/io.github.simbo1905.no.adapter.Plugin`; service implementations need a public no-argument
/// constructor.
public interface Plugin {

  String name();

  void install(Adapter.Builder builder);
}
