// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/// Declares the value a record component takes when it is missing from decoded data. The value is a JSON literal
/// read into a [Value]: `@FieldDefault("0")`, `@FieldDefault("\"unknown\"")`, `@FieldDefault("[]")`.
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.RECORD_COMPONENT)
public @interface FieldDefault {
  String value();
}
