// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import io.github.simbo1905.no.adapter.TypeDescriptor.Carrier;
import io.github.simbo1905.no.adapter.TypeDescriptor.Container;
import io.github.simbo1905.no.adapter.TypeDescriptor.ScalarKind;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.AnnotatedParameterizedType;
import java.lang.reflect.AnnotatedType;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Recursive descent over Java type declarations producing [TypeDescriptor] trees.
///
/// [HookPoint#RESOLVE_TYPE] hooks see every type first. Otherwise:
/// - primitives, their boxes, `String` and `byte[]` are scalars;
/// - `Optional<T>`, `@Nullable T` and `T` annotated `@Nullable` as a type argument are all [TypeDescriptor.OptionalType];
/// - `List<T>`, `Collection<T>` and `Set<T>` are sequences, `Map<K, V>` is a map with a text like key;
/// - records (generic ones with their type arguments bound), enums and sealed types are nominal structures;
/// - [Value] itself and any other class are opaque and need a registered converter.
///
/// Results are memoized per declaration. Registering a resolve hook drops the memo.
public final class TypeResolver {

  public static final String MAX_UNION_BRANCHES_PROPERTY = "no.adapter.MaxUnionBranches";
  public static final int DEFAULT_MAX_UNION_BRANCHES = 64;

  static final Map<Class<?>, ScalarKind> SCALARS = Map.ofEntries(
      Map.entry(boolean.class, ScalarKind.BOOLEAN), Map.entry(Boolean.class, ScalarKind.BOOLEAN),
      Map.entry(byte.class, ScalarKind.BYTE), Map.entry(Byte.class, ScalarKind.BYTE),
      Map.entry(short.class, ScalarKind.SHORT), Map.entry(Short.class, ScalarKind.SHORT),
      Map.entry(int.class, ScalarKind.INT), Map.entry(Integer.class, ScalarKind.INT),
      Map.entry(long.class, ScalarKind.LONG), Map.entry(Long.class, ScalarKind.LONG),
      Map.entry(char.class, ScalarKind.CHAR), Map.entry(Character.class, ScalarKind.CHAR),
      Map.entry(float.class, ScalarKind.FLOAT), Map.entry(Float.class, ScalarKind.FLOAT),
      Map.entry(double.class, ScalarKind.DOUBLE), Map.entry(Double.class, ScalarKind.DOUBLE),
      Map.entry(String.class, ScalarKind.STRING),
      Map.entry(byte[].class, ScalarKind.BYTES)
  );

  private static final Set<Class<?>> CONTAINERS = Set.of(Optional.class, List.class, Collection.class, Set.class, Map.class);

  private final HookRegistry hooks;
  private final int maxUnionBranches;
  private final AtomicReference<ConcurrentHashMap<Object, TypeDescriptor>> memo =
      new AtomicReference<>(new ConcurrentHashMap<>());

  /// The memo a top level resolution started with and the records it is inside.
  private record Resolution(ConcurrentHashMap<Object, TypeDescriptor> memo, Set<Class<?>> inProgress) {
  }

  TypeResolver(HookRegistry hooks, int maxUnionBranches) {
    this.hooks = Objects.requireNonNull(hooks);
    if (maxUnionBranches < 1) {
      throw new IllegalArgumentException("maxUnionBranches must be positive: " + maxUnionBranches);
    }
    this.maxUnionBranches = maxUnionBranches;
    hooks.onRegistration(point -> {
      if (point == HookPoint.RESOLVE_TYPE) {
        memo.set(new ConcurrentHashMap<>());
        LOGGER.fine("Type resolution memo dropped after resolve hook registration");
      }
    });
  }

  static int configuredMaxUnionBranches() {
    return Integer.getInteger(MAX_UNION_BRANCHES_PROPERTY, DEFAULT_MAX_UNION_BRANCHES);
  }

  public @NotNull TypeDescriptor resolve(Type type) {
    Objects.requireNonNull(type, "type must not be null");
    return memoized(type, resolution -> resolveType(type, Map.of(), resolution));
  }

  /// Resolves a declaration carrying type use annotations, such as the type captured by a [TypeRef].
  public @NotNull TypeDescriptor resolve(AnnotatedType annotatedType) {
    Objects.requireNonNull(annotatedType, "annotatedType must not be null");
    if (!hasNullableAnnotation(annotatedType)) {
      return resolve(annotatedType.getType());
    }
    return memoized(annotatedType, resolution -> resolveAnnotated(annotatedType, Map.of(), resolution));
  }

  /// One top level resolution reads and fills the memo it started with, so a resolve hook registered meanwhile never
  /// mixes its answers with ones made before it.
  private TypeDescriptor memoized(Object key, Function<Resolution, TypeDescriptor> resolve) {
    final var cache = memo.get();
    final var cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    final var resolved = resolve.apply(new Resolution(cache, new LinkedHashSet<>()));
    LOGGER.finer(() -> "Resolved " + key + " to " + resolved.describe());
    final var raced = cache.putIfAbsent(key, resolved);
    return raced != null ? raced : resolved;
  }

  private TypeDescriptor resolveAnnotated(AnnotatedType annotated, Map<TypeVariable<?>, AnnotatedType> bindings,
                                          Resolution resolution) {
    final Type type = annotated.getType();
    final var claimed = hooks.firstSuccess(HookPoint.RESOLVE_TYPE, type);
    final TypeDescriptor bare;
    if (claimed.isPresent()) {
      bare = claimed.get();
    } else if (annotated instanceof AnnotatedParameterizedType parameterized && type instanceof ParameterizedType pt) {
      bare = resolveParameterized(pt, Arrays.asList(parameterized.getAnnotatedActualTypeArguments()), bindings,
          resolution);
    } else {
      bare = resolveUnclaimed(type, bindings, resolution);
    }
    if (annotated.isAnnotationPresent(Nullable.class)) {
      if (type instanceof Class<?> cls && cls.isPrimitive()) {
        throw new UnsupportedTypeException("Primitive " + cls + " cannot be @Nullable, use its box");
      }
      return TypeDescriptor.optional(bare, Carrier.NULLABLE);
    }
    return bare;
  }

  private TypeDescriptor resolveType(Type type, Map<TypeVariable<?>, AnnotatedType> bindings, Resolution resolution) {
    final var claimed = hooks.firstSuccess(HookPoint.RESOLVE_TYPE, type);
    if (claimed.isPresent()) {
      return claimed.get();
    }
    return resolveUnclaimed(type, bindings, resolution);
  }

  private TypeDescriptor resolveUnclaimed(Type type, Map<TypeVariable<?>, AnnotatedType> bindings,
                                          Resolution resolution) {
    if (type instanceof Class<?> cls) {
      return resolveClass(cls, resolution);
    }
    if (type instanceof ParameterizedType pt) {
      final var arguments = Arrays.stream(pt.getActualTypeArguments())
          .map(TypeResolver::unannotated)
          .toList();
      return resolveParameterized(pt, arguments, bindings, resolution);
    }
    if (type instanceof TypeVariable<?> variable) {
      final var bound = bindings.get(variable);
      if (bound == null) {
        throw new UnsupportedTypeException("Type variables are not supported in serialization: " + type);
      }
      return resolveAnnotated(bound, Map.of(), resolution);
    }
    if (type instanceof WildcardType) {
      throw new UnsupportedTypeException("Wildcard types are not supported in serialization: " + type);
    }
    if (type instanceof GenericArrayType) {
      throw new UnsupportedTypeException("Generic arrays are not supported in serialization: " + type);
    }
    throw new UnsupportedTypeException("Unsupported type: " + type + " of class " + type.getClass());
  }

  private TypeDescriptor resolveParameterized(ParameterizedType type, List<AnnotatedType> arguments,
                                              Map<TypeVariable<?>, AnnotatedType> bindings, Resolution resolution) {
    final Class<?> raw = (Class<?>) type.getRawType();
    if (raw == Optional.class) {
      final var inner = resolveAnnotated(arguments.get(0), bindings, resolution);
      if (inner.acceptsAbsent()) {
        throw new UnsupportedTypeException("Nested optional collapses to a single optional and cannot round trip: " +
            type.getTypeName());
      }
      return new TypeDescriptor.OptionalType(inner, Carrier.OPTIONAL);
    }
    if (raw == List.class || raw == Collection.class) {
      return new TypeDescriptor.SequenceType(resolveAnnotated(arguments.get(0), bindings, resolution), Container.LIST);
    }
    if (raw == Set.class) {
      return new TypeDescriptor.SequenceType(resolveAnnotated(arguments.get(0), bindings, resolution), Container.SET);
    }
    if (raw == Map.class) {
      final var key = resolveAnnotated(arguments.get(0), bindings, resolution);
      if (!isTextLikeKey(key)) {
        throw new UnsupportedTypeException("Map keys must be String, an enum or an opaque text type but got " +
            key.describe() + " in " + type.getTypeName());
      }
      return new TypeDescriptor.MapType(key, resolveAnnotated(arguments.get(1), bindings, resolution));
    }
    if (raw.isRecord()) {
      final TypeVariable<?>[] parameters = raw.getTypeParameters();
      final var bound = new HashMap<TypeVariable<?>, AnnotatedType>();
      for (int i = 0; i < parameters.length; i++) {
        bound.put(parameters[i], substitute(arguments.get(i), bindings));
      }
      return resolveRecord(raw, bound, resolution);
    }
    throw new UnsupportedTypeException("Unsupported generic type " + type.getTypeName() +
        ": only Optional, List, Collection, Set, Map and generic records are supported");
  }

  private TypeDescriptor resolveClass(Class<?> cls, Resolution resolution) {
    final var scalar = SCALARS.get(cls);
    if (scalar != null) {
      return TypeDescriptor.scalar(scalar);
    }
    if (CONTAINERS.contains(cls)) {
      throw new UnsupportedTypeException("Raw container type " + cls.getName() + " has no element type; " +
          "declare its type arguments, for example with a TypeRef");
    }
    if (cls.isArray()) {
      throw new UnsupportedTypeException("Arrays other than byte[] are not supported, use List: " + cls.getTypeName());
    }
    if (cls.isEnum()) {
      final var symbols = Arrays.stream(cls.getEnumConstants())
          .map(c -> ((Enum<?>) c).name())
          .toList();
      return new TypeDescriptor.EnumType(cls, symbols);
    }
    if (cls.isRecord()) {
      if (cls.getTypeParameters().length > 0) {
        throw new UnsupportedTypeException("Generic record " + cls.getName() + " needs type arguments; " +
            "declare them, for example with a TypeRef");
      }
      return resolveRecord(cls, Map.of(), resolution);
    }
    if (cls == Value.class) {
      return TypeDescriptor.opaque(cls);
    }
    if (cls.isSealed()) {
      return resolveUnion(cls, resolution);
    }
    return TypeDescriptor.opaque(cls);
  }

  private TypeDescriptor resolveRecord(Class<?> cls, Map<TypeVariable<?>, AnnotatedType> bindings,
                                       Resolution resolution) {
    final boolean plain = bindings.isEmpty();
    if (plain) {
      final var cached = resolution.memo().get(cls);
      if (cached != null) {
        return cached;
      }
    }
    enter(cls, resolution);
    try {
      final var fields = new ArrayList<TypeDescriptor.RecordType.Field>();
      for (RecordComponent component : cls.getRecordComponents()) {
        TypeDescriptor type = resolveAnnotated(component.getAnnotatedType(), bindings, resolution);
        if (component.isAnnotationPresent(Nullable.class)) {
          if (component.getType().isPrimitive()) {
            throw new UnsupportedTypeException("Primitive component " + cls.getName() + "." + component.getName() +
                " cannot be @Nullable, use its box");
          }
          type = TypeDescriptor.optional(type, Carrier.NULLABLE);
        }
        fields.add(new TypeDescriptor.RecordType.Field(component.getName(), type, defaultOf(cls, component, type)));
      }
      final var record = new TypeDescriptor.RecordType(cls, fields);
      if (plain) {
        resolution.memo().putIfAbsent(cls, record);
      }
      return record;
    } finally {
      resolution.inProgress().remove(cls);
    }
  }

  private TypeDescriptor resolveUnion(Class<?> cls, Resolution resolution) {
    final Class<?>[] permitted = cls.getPermittedSubclasses();
    if (permitted.length > maxUnionBranches) {
      throw new UnsupportedTypeException("Sealed type " + cls.getName() + " has " + permitted.length +
          " permitted subclasses, more than the limit of " + maxUnionBranches);
    }
    enter(cls, resolution);
    try {
      final var branches = new ArrayList<TypeDescriptor.UnionType.Branch>();
      final var names = new HashSet<String>();
      for (Class<?> subclass : permitted) {
        final var resolved = resolveType(subclass, Map.of(), resolution);
        if (!(resolved instanceof TypeDescriptor.Nominal nominal)) {
          throw new UnsupportedTypeException("Permitted subclass " + subclass.getName() + " of " + cls.getName() +
              " resolved to non nominal " + resolved.describe());
        }
        final var name = subclass.getSimpleName();
        if (!names.add(name)) {
          throw new UnsupportedTypeException("Sealed type " + cls.getName() + " has two branches named " + name);
        }
        branches.add(new TypeDescriptor.UnionType.Branch(name, nominal));
      }
      return new TypeDescriptor.UnionType(cls, branches);
    } finally {
      resolution.inProgress().remove(cls);
    }
  }

  private static void enter(Class<?> cls, Resolution resolution) {
    if (!resolution.inProgress().add(cls)) {
      throw new UnsupportedTypeException("Recursive type " + cls.getName() + " (via " +
          resolution.inProgress().stream().map(Class::getSimpleName).collect(Collectors.joining(" -> ")) +
          ") has no registered resolution; claim it with Adapter.registerOpaque or a resolve type hook");
    }
  }

  private static Optional<Value> defaultOf(Class<?> owner, RecordComponent component, TypeDescriptor type) {
    final var declared = component.getAnnotation(FieldDefault.class);
    if (declared != null) {
      try {
        return Optional.of(JsonValues.parse(declared.value()));
      } catch (DecodeException | ValueRangeException e) {
        throw new UnsupportedTypeException("Invalid @FieldDefault on " + owner.getName() + "." +
            component.getName() + ": " + e.getMessage(), e);
      }
    }
    return type.acceptsAbsent() ? Optional.of(Value.NULL) : Optional.empty();
  }

  private static boolean isTextLikeKey(TypeDescriptor key) {
    return key.equals(TypeDescriptor.scalar(ScalarKind.STRING))
        || key instanceof TypeDescriptor.EnumType
        || key instanceof TypeDescriptor.OpaqueType;
  }

  private static boolean hasNullableAnnotation(AnnotatedType annotated) {
    if (annotated.isAnnotationPresent(Nullable.class)) {
      return true;
    }
    if (annotated instanceof AnnotatedParameterizedType parameterized) {
      return Arrays.stream(parameterized.getAnnotatedActualTypeArguments()).anyMatch(TypeResolver::hasNullableAnnotation);
    }
    return false;
  }

  /// Replaces a type variable argument by its binding so nested generic records see concrete types.
  private static AnnotatedType substitute(AnnotatedType argument, Map<TypeVariable<?>, AnnotatedType> bindings) {
    if (argument.getType() instanceof TypeVariable<?> variable && bindings.containsKey(variable)) {
      return bindings.get(variable);
    }
    return argument;
  }

  /// Wraps a plain type so that the annotated and plain resolution paths share one implementation.
  private static AnnotatedType unannotated(Type type) {
    return new PlainAnnotatedType(type);
  }

  private record PlainAnnotatedType(Type type) implements AnnotatedType {
    @Override
    public Type getType() {
      return type;
    }

    @Override
    public AnnotatedType getAnnotatedOwnerType() {
      return null;
    }

    @Override
    public <T extends java.lang.annotation.Annotation> T getAnnotation(Class<T> annotationClass) {
      return null;
    }

    @Override
    public java.lang.annotation.Annotation[] getAnnotations() {
      return new java.lang.annotation.Annotation[0];
    }

    @Override
    public java.lang.annotation.Annotation[] getDeclaredAnnotations() {
      return new java.lang.annotation.Annotation[0];
    }
  }
}
