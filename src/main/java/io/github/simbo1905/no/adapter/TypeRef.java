// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/// Captures a generic type declaration, including type use annotations, through an anonymous subclass:
/// `new TypeRef<List<Map<String, @Nullable Integer>>>() {}`.
public abstract class TypeRef<T> {
  private final AnnotatedType annotatedType;

  protected TypeRef() {
    final AnnotatedType superclass = getClass().getAnnotatedSuperclass();
    if (!(superclass instanceof AnnotatedParameterizedType parameterized)
        || !(superclass.getType() instanceof ParameterizedType)) {
      throw new IllegalArgumentException("TypeRef must be created as an anonymous subclass with a type argument");
    }
    this.annotatedType = parameterized.getAnnotatedActualTypeArguments()[0];
  }

  public Type type() {
    return annotatedType.getType();
  }

  public AnnotatedType annotatedType() {
    return annotatedType;
  }

  @Override
  public String toString() {
    return "TypeRef<" + annotatedType.getType().getTypeName() + ">";
  }
}
