// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/// JDK value types carried as text, each tagged in the derived schema with a logical type name. A [Value] declared as
/// a field is carried under the logical type `json` as the tagged JSON text of [JsonValues#toTaggedJsonString(Value)],
/// which keeps bytes apart from text.
final class LogicalTypes {

  /// Hook order of the library's own hooks. Hooks registered with a lower order run first.
  static final int BUILTIN_HOOK_ORDER = 1_000_000;

  record LogicalType<T>(Class<T> type, String name, Function<T, String> format, Function<String, T> parse) {
    Converter converter() {
      return Converter.of(type, t -> Value.of(format.apply(t)), v -> parse.apply(text(v)));
    }
  }

  static final List<LogicalType<?>> TYPES = List.of(
      new LogicalType<>(UUID.class, "uuid", UUID::toString, UUID::fromString),
      new LogicalType<>(BigDecimal.class, "decimal", BigDecimal::toString, BigDecimal::new),
      new LogicalType<>(BigInteger.class, "big-integer", BigInteger::toString, BigInteger::new),
      new LogicalType<>(Instant.class, "timestamp", Instant::toString, Instant::parse),
      new LogicalType<>(LocalDate.class, "date", LocalDate::toString, LocalDate::parse),
      new LogicalType<>(LocalDateTime.class, "local-timestamp", LocalDateTime::toString, LocalDateTime::parse),
      new LogicalType<>(LocalTime.class, "time", LocalTime::toString, LocalTime::parse),
      new LogicalType<>(OffsetDateTime.class, "offset-timestamp", OffsetDateTime::toString, OffsetDateTime::parse),
      new LogicalType<>(Duration.class, "duration", Duration::toString, Duration::parse),
      new LogicalType<>(Value.class, "json", JsonValues::toTaggedJsonString, JsonValues::parseTagged)
  );

  private static final Map<TypeDescriptor, Schema> SCHEMAS = TYPES.stream()
      .collect(Collectors.toUnmodifiableMap(
          t -> TypeDescriptor.opaque(t.type()),
          t -> Schema.logical(Schema.PrimitiveKind.STRING, t.name())));

  private LogicalTypes() {
  }

  static void install(ConverterRegistry registry, HookRegistry hooks) {
    for (LogicalType<?> type : TYPES) {
      registry.register(DispatchKey.exact(TypeDescriptor.opaque(type.type())), type.converter(),
          ConverterRegistry.BUILTIN_SPECIFICITY, false);
    }
    hooks.register(HookPoint.DERIVE_SCHEMA, new Hook<>() {
      @Override
      public HookResult<Schema> invoke(TypeDescriptor descriptor, Schema partial) {
        final var schema = SCHEMAS.get(descriptor);
        return schema == null ? HookResult.notApplicable() : HookResult.applied(schema);
      }

      @Override
      public String toString() {
        return "logical type schemas";
      }
    }, BUILTIN_HOOK_ORDER);
  }

  private static String text(Value value) {
    if (value instanceof Value.TextValue t) {
      return t.value();
    }
    throw new IllegalArgumentException("expected text but got " + value.kind().name().toLowerCase());
  }
}
