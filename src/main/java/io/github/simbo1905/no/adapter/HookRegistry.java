// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Hooks per [HookPoint], kept sorted by `order` ascending then registration order. The table is an immutable
/// snapshot swapped atomically on registration.
public final class HookRegistry {

  private final AtomicReference<Map<HookPoint<?, ?>, List<Registration<?, ?>>>> table = new AtomicReference<>(Map.of());
  private final AtomicLong sequence = new AtomicLong();
  private final List<Consumer<HookPoint<?, ?>>> listeners = new CopyOnWriteArrayList<>();

  record Registration<I, O>(HookPoint<I, O> point, Hook<I, O> hook, int order, long sequence) {
  }

  private static final Comparator<Registration<?, ?>> INVOCATION_ORDER =
      Comparator.<Registration<?, ?>>comparingInt(Registration::order).thenComparingLong(Registration::sequence);

  public <I, O> void register(HookPoint<I, O> point, Hook<I, O> hook, int order) {
    Objects.requireNonNull(point, "point must not be null");
    Objects.requireNonNull(hook, "hook must not be null");
    final var registration = new Registration<>(point, hook, order, sequence.incrementAndGet());
    table.updateAndGet(current -> {
      final var copy = new HashMap<>(current);
      final var hooks = new ArrayList<>(copy.getOrDefault(point, List.of()));
      hooks.add(registration);
      hooks.sort(INVOCATION_ORDER);
      copy.put(point, List.copyOf(hooks));
      return Map.copyOf(copy);
    });
    LOGGER.fine(() -> "Registered hook " + hook + " at " + point + " order " + order);
    listeners.forEach(listener -> listener.accept(point));
  }

  /// Called synchronously after every registration. Used to drop caches that depend on a hook point.
  void onRegistration(Consumer<HookPoint<?, ?>> listener) {
    listeners.add(Objects.requireNonNull(listener));
  }

  /// Runs the hooks at a first-success point until one applies.
  public <I, O> Optional<O> firstSuccess(HookPoint<I, O> point, I input) {
    if (point.policy() != HookPoint.Policy.FIRST_SUCCESS) {
      throw new IllegalArgumentException("Hook point " + point + " is not first-success");
    }
    for (Registration<I, O> registration : hooksAt(point)) {
      final var result = registration.hook().invoke(input, null);
      if (result instanceof HookResult.Applied<O> applied) {
        LOGGER.finer(() -> point.name() + " for " + input + " answered by " + registration.hook());
        return Optional.of(applied.value());
      }
    }
    return Optional.empty();
  }

  /// Runs every hook at a chained point, each seeing the previous result.
  public <I, O> O chain(HookPoint<I, O> point, I input, O seed) {
    if (point.policy() != HookPoint.Policy.CHAINED) {
      throw new IllegalArgumentException("Hook point " + point + " is not chained");
    }
    O partial = seed;
    for (Registration<I, O> registration : hooksAt(point)) {
      final var result = registration.hook().invoke(input, partial);
      if (result instanceof HookResult.Applied<O> applied) {
        partial = applied.value();
      }
    }
    return partial;
  }

  public boolean isEmpty(HookPoint<?, ?> point) {
    return table.get().getOrDefault(point, List.of()).isEmpty();
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private <I, O> List<Registration<I, O>> hooksAt(HookPoint<I, O> point) {
    return (List) table.get().getOrDefault(point, List.of());
  }
}
