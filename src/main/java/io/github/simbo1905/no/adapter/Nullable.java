// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Marks a record component or a type argument as allowed to be null. Resolves to the same descriptor as wrapping the
/// type in `Optional`, e.g. `@Nullable Integer` and `Optional<Integer>`, and
/// `Map<String, @Nullable Integer>` and `Map<String, Optional<Integer>>`.
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE_USE, ElementType.RECORD_COMPONENT})
public @interface Nullable {
}
