// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import io.github.simbo1905.no.adapter.model.Person;
import io.github.simbo1905.no.adapter.model.Point;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConverterRegistryTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  /// Same layout as [Point] under another name.
  record Coordinate(int x, int y) {
  }

  record Money(long cents) {
  }

  /// Counts calls and delegates to the record converter of a fresh adapter.
  static final class SpyConverter implements Converter {
    final AtomicInteger toCalls = new AtomicInteger();
    final AtomicInteger fromCalls = new AtomicInteger();
    private final String name;
    private final Converter delegate;

    SpyConverter(String name) {
      this.name = name;
      this.delegate = new StandardConverters.RecordConverter();
    }

    @Override
    public Value toValue(Object object, TypeDescriptor type, ConversionContext context) {
      toCalls.incrementAndGet();
      return delegate.toValue(object, type, context);
    }

    @Override
    public Object fromValue(Value value, TypeDescriptor type, ConversionContext context) {
      fromCalls.incrementAndGet();
      return delegate.fromValue(value, type, context);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  @ParameterizedTest
  @ValueSource(strings = {"json", "binary"})
  void specificConverterBeatsGenericRecordConverter(String format) {
    final var adapter = Adapter.builder().build();
    final var anyRecord = new SpyConverter("any record");
    final var pointCalls = new AtomicInteger();
    adapter.register(DispatchKey.kind(TypeDescriptor.Kind.RECORD), anyRecord, ConverterRegistry.DEFAULT_SPECIFICITY, false);
    adapter.register(Point.class,
        p -> {
          pointCalls.incrementAndGet();
          return Value.of(p.x() + "," + p.y());
        },
        v -> {
          pointCalls.incrementAndGet();
          final var parts = ((Value.TextValue) v).value().split(",");
          return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        },
        ConverterRegistry.DEFAULT_SPECIFICITY,
        Schema.logical(Schema.PrimitiveKind.STRING, "point"));

    assertThat(adapter.schema(Point.class)).isEqualTo(Schema.logical(Schema.PrimitiveKind.STRING, "point"));
    final var bytes = adapter.dump(new Point(3, 4), format);
    assertThat(adapter.load(bytes, Point.class, format)).isEqualTo(new Point(3, 4));
    adapter.dump(new Person("Ada"), format);

    assertThat(pointCalls).hasValue(2);
    assertThat(anyRecord.toCalls).hasValue(1);
    assertThat(anyRecord.fromCalls).hasValue(0);
  }

  @Test
  void converterWithoutSchemaOnlyServesSchemaLessCodecs() {
    final var adapter = Adapter.builder()
        .register(Point.class, p -> Value.of(p.x() + "," + p.y()), v -> {
          final var parts = ((Value.TextValue) v).value().split(",");
          return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        })
        .build();
    final var json = adapter.dump(new Point(3, 4), "json");
    assertThat(new String(json, StandardCharsets.UTF_8)).isEqualTo("\"3,4\"");
    assertThat(adapter.load(json, Point.class, "json")).isEqualTo(new Point(3, 4));
    assertThatThrownBy(() -> adapter.dump(new Point(3, 4), "binary"))
        .isInstanceOf(SchemaException.class)
        .hasMessageContaining("registered without one");
  }

  @Test
  void equalSpecificityAtOneKeyIsAmbiguous() {
    final var adapter = Adapter.builder().build();
    final var key = DispatchKey.exact(adapter.resolve(Point.class));
    adapter.register(key, new SpyConverter("first"), 5, false);
    adapter.register(key, new SpyConverter("second"), 5, false);
    assertThatThrownBy(() -> adapter.dump(new Point(1, 2), "json"))
        .isInstanceOf(AmbiguousConverterException.class)
        .hasMessageContaining("first")
        .hasMessageContaining("second");
  }

  @Test
  void higherSpecificityResolvesTheTie() {
    final var adapter = Adapter.builder().build();
    final var key = DispatchKey.exact(adapter.resolve(Point.class));
    final var low = new SpyConverter("low");
    final var high = new SpyConverter("high");
    adapter.register(key, low, 1, false);
    adapter.register(key, high, 2, false);
    adapter.toValue(new Point(1, 2));
    assertThat(high.toCalls).hasValue(1);
    assertThat(low.toCalls).hasValue(0);
  }

  @Test
  void replaceRemovesEarlierEntries() {
    final var adapter = Adapter.builder().build();
    final var key = DispatchKey.exact(adapter.resolve(Point.class));
    adapter.register(key, new SpyConverter("first"), 0, false);
    final var replacement = new SpyConverter("replacement");
    adapter.register(key, replacement, 0, true);
    adapter.toValue(new Point(1, 2));
    assertThat(replacement.toCalls).hasValue(1);
    assertThat(adapter.converters().entriesAt(key)).hasSize(1);
  }

  @Test
  void shapeKeyMatchesRecordsWithTheSameLayout() {
    final var adapter = Adapter.builder().build();
    final var point = (TypeDescriptor.RecordType) adapter.resolve(Point.class);
    final var shaped = new SpyConverter("shape x,y");
    adapter.register(new DispatchKey.Shape(point.fields()), shaped, 0, false);
    adapter.toValue(new Coordinate(5, 6));
    adapter.toValue(new Point(7, 8));
    adapter.toValue(new Person("Ada"));
    assertThat(shaped.toCalls).hasValue(2);
  }

  @Test
  void userKindConverterOutranksBuiltIn() {
    final var adapter = Adapter.builder().build();
    final var spy = new SpyConverter("user records");
    adapter.register(DispatchKey.kind(TypeDescriptor.Kind.RECORD), spy, ConverterRegistry.DEFAULT_SPECIFICITY, false);
    adapter.toValue(new Point(1, 1));
    assertThat(spy.toCalls).hasValue(1);
  }

  @Test
  void exactMatchFirstThenFallbackChain() {
    final var registry = new ConverterRegistry();
    final var anything = Converter.of(Object.class, o -> Value.of("any"), v -> "any");
    registry.register(DispatchKey.ANY, anything, 0, false);
    final var descriptor = TypeDescriptor.opaque(Thread.class);
    assertThat(registry.lookup(descriptor).converter()).isSameAs(anything);
    assertThat(registry.lookup(descriptor).key()).isEqualTo(DispatchKey.ANY);
  }

  @Test
  void unregisteredOpaqueTypeNamesTheDescriptor() {
    final var registry = new ConverterRegistry();
    assertThatThrownBy(() -> registry.lookup(TypeDescriptor.opaque(Thread.class)))
        .isInstanceOf(NoConverterException.class)
        .hasMessageContaining("opaque java.lang.Thread")
        .satisfies(e -> assertThat(((NoConverterException) e).descriptor())
            .isEqualTo(TypeDescriptor.opaque(Thread.class)));
  }

  @Test
  void registrationEvictsOnlyAffectedCachedLookups() {
    final var registry = new ConverterRegistry();
    StandardConverters.install(registry);
    final var string = TypeDescriptor.scalar(TypeDescriptor.ScalarKind.STRING);
    final var list = new TypeDescriptor.SequenceType(string, TypeDescriptor.Container.LIST);
    final var money = new TypeDescriptor.RecordType(Money.class,
        List.of(new TypeDescriptor.RecordType.Field("cents", TypeDescriptor.scalar(TypeDescriptor.ScalarKind.LONG),
            java.util.Optional.empty())));
    registry.lookup(string);
    registry.lookup(list);
    registry.lookup(money);
    assertThat(registry.cachedLookups()).isEqualTo(3);

    final var moneyConverter = Converter.of(Money.class, m -> Value.of(m.cents()),
        v -> new Money(((Value.IntValue) v).value()));
    registry.register(DispatchKey.exact(money), moneyConverter, 0, false);
    assertThat(registry.cachedLookups()).isEqualTo(2);
    assertThat(registry.lookup(money).converter()).isSameAs(moneyConverter);

    registry.register(DispatchKey.ANY, moneyConverter, 0, false);
    assertThat(registry.cachedLookups()).isZero();
  }

  @Test
  void registeredFunctionsConvertExactType() {
    final var adapter = Adapter.builder()
        .register(Money.class, m -> Value.of(m.cents()), v -> new Money(((Value.IntValue) v).value()))
        .build();
    final var value = adapter.toValue(Map.of("price", new Money(250)), new TypeRef<Map<String, Money>>() {
    }.type());
    assertThat(value).isEqualTo(Value.map("price", Value.of(250)));
    assertThat(adapter.fromValue(Value.of(99), Money.class)).isEqualTo(new Money(99));
  }

  @Test
  void functionFailuresBecomeSchemaMismatchWithPath() {
    final var adapter = Adapter.builder()
        .register(Money.class, m -> Value.of(m.cents()), v -> new Money(((Value.IntValue) v).value()))
        .build();
    assertThatThrownBy(() -> adapter.fromValue(Value.seq(Value.of("ten")), new TypeRef<List<Money>>() {
    }))
        .isInstanceOf(SchemaMismatchException.class)
        .hasMessageStartingWith("$[0]");
  }
}
