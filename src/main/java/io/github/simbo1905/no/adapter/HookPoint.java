// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.lang.reflect.Type;
import java.util.List;
import java.util.Objects;

/// A named extension point together with the policy used to combine the hooks registered at it.
public final class HookPoint<I, O> {

  public enum Policy {
    /// Stop at the first hook that returns an applied result.
    FIRST_SUCCESS,
    /// Feed every hook the result of the previous one.
    CHAINED
  }

  /// Claims a Java type and returns the descriptor for it.
  public static final HookPoint<Type, TypeDescriptor> RESOLVE_TYPE =
      new HookPoint<>("resolve type", Policy.FIRST_SUCCESS);
  /// Post-processes the value a converter produced.
  public static final HookPoint<TypeDescriptor, Value> TO_INTERMEDIATE =
      new HookPoint<>("convert to intermediate", Policy.CHAINED);
  /// Pre-processes a value before a converter consumes it.
  public static final HookPoint<TypeDescriptor, Value> FROM_INTERMEDIATE =
      new HookPoint<>("convert from intermediate", Policy.CHAINED);
  /// Supplies the codec for a format name.
  public static final HookPoint<String, Codec> SELECT_CODEC =
      new HookPoint<>("select codec for format name", Policy.FIRST_SUCCESS);
  /// Supplies a schema fragment for a descriptor the deriver cannot introspect.
  public static final HookPoint<TypeDescriptor, Schema> DERIVE_SCHEMA =
      new HookPoint<>("derive schema", Policy.FIRST_SUCCESS);

  private static final List<HookPoint<?, ?>> ALL =
      List.of(RESOLVE_TYPE, TO_INTERMEDIATE, FROM_INTERMEDIATE, SELECT_CODEC, DERIVE_SCHEMA);

  private final String name;
  private final Policy policy;

  private HookPoint(String name, Policy policy) {
    this.name = name;
    this.policy = policy;
  }

  public String name() {
    return name;
  }

  public Policy policy() {
    return policy;
  }

  public static List<HookPoint<?, ?>> values() {
    return ALL;
  }

  /// Looks a hook point up by its name, e.g. `"derive schema"`.
  public static HookPoint<?, ?> named(String name) {
    Objects.requireNonNull(name, "name must not be null");
    return ALL.stream()
        .filter(p -> p.name.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown hook point '" + name + "', expected one of " +
            ALL.stream().map(HookPoint::name).toList()));
  }

  @Override
  public String toString() {
    return name + " (" + policy + ")";
  }
}
