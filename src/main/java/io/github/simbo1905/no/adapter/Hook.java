// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import org.jetbrains.annotations.NotNull;

/// An extension registered at a [HookPoint].
///
/// For a [HookPoint.Policy#FIRST_SUCCESS] point `partial` is always null. For a [HookPoint.Policy#CHAINED] point it
/// is the result so far, and returning [HookResult#notApplicable()] passes it on unchanged.
@FunctionalInterface
public interface Hook<I, O> {
  @NotNull HookResult<O> invoke(I input, O partial);
}
