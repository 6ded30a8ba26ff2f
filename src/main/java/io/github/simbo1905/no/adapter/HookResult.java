// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.Objects;

/// Outcome of one [Hook] invocation. [NotApplicable] tells the registry to move on to the next hook; it is not a
/// failure. A hook that fails throws, which aborts the whole chain.
public sealed interface HookResult<O> permits HookResult.Applied, HookResult.NotApplicable {

  static <O> HookResult<O> applied(O value) {
    return new Applied<>(value);
  }

  @SuppressWarnings("unchecked")
  static <O> HookResult<O> notApplicable() {
    return (HookResult<O>) NotApplicable.INSTANCE;
  }

  record Applied<O>(O value) implements HookResult<O> {
    public Applied {
      Objects.requireNonNull(value, "an applied hook result must carry a value");
    }
  }

  record NotApplicable<O>() implements HookResult<O> {
    static final NotApplicable<?> INSTANCE = new NotApplicable<>();
  }
}
