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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.adapter.Adapter.LOGGER;

/// Maps dispatch keys to converters. The table is an immutable snapshot that registration replaces atomically, so a
/// concurrent lookup sees either the old or the new table. Each snapshot owns its lookup cache; registration copies
/// the cache into the new snapshot minus the descriptors whose dispatch chain contains the registered key.
public final class ConverterRegistry {

  /// Rank of the converters installed by the library. Below the default so user registrations at the same dispatch
  /// level always win.
  public static final int BUILTIN_SPECIFICITY = -100;
  public static final int DEFAULT_SPECIFICITY = 0;

  private final AtomicReference<Table> table = new AtomicReference<>(Table.EMPTY);
  private final AtomicLong sequence = new AtomicLong();

  /// Immutable registration table plus its lookup cache.
  private record Table(Map<DispatchKey, List<ConverterEntry>> entries,
                       ConcurrentHashMap<TypeDescriptor, ConverterEntry> cache) {
    static final Table EMPTY = new Table(Map.of(), new ConcurrentHashMap<>());
  }

  /// Adds a converter. With `replace` set, entries already registered at `key` are removed first. Without it an
  /// existing entry is kept; two entries of equal specificity at one key make lookups through that key ambiguous.
  public ConverterEntry register(DispatchKey key, Converter converter, int specificity, boolean replace) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(converter, "converter must not be null");
    final var entry = new ConverterEntry(key, converter, specificity, sequence.incrementAndGet());
    final var updated = table.updateAndGet(current -> {
      final var entries = new HashMap<>(current.entries());
      final var atKey = replace ? new ArrayList<ConverterEntry>() : new ArrayList<>(entries.getOrDefault(key, List.of()));
      atKey.add(entry);
      entries.put(key, List.copyOf(atKey));
      final var cache = new ConcurrentHashMap<TypeDescriptor, ConverterEntry>();
      current.cache().forEach((descriptor, cached) -> {
        if (!descriptor.dispatchChain().contains(key)) {
          cache.put(descriptor, cached);
        }
      });
      return new Table(Map.copyOf(entries), cache);
    });
    LOGGER.fine(() -> "Registered " + converter + " at " + key + " specificity " + specificity +
        (replace ? " (replace)" : "") + "; " + updated.cache().size() + " cached lookups kept");
    return entry;
  }

  /// Exact match first, then the fallback chain. The first dispatch level holding any entry decides: its highest
  /// specificity wins and a tie at that specificity is an [AmbiguousConverterException].
  public ConverterEntry lookup(TypeDescriptor descriptor) {
    Objects.requireNonNull(descriptor, "descriptor must not be null");
    final var snapshot = table.get();
    final var cached = snapshot.cache().get(descriptor);
    if (cached != null) {
      return cached;
    }
    final var found = search(snapshot, descriptor);
    snapshot.cache().putIfAbsent(descriptor, found);
    return found;
  }

  private static ConverterEntry search(Table snapshot, TypeDescriptor descriptor) {
    for (DispatchKey key : descriptor.dispatchChain()) {
      final var candidates = snapshot.entries().getOrDefault(key, List.of());
      if (candidates.isEmpty()) {
        continue;
      }
      final int best = candidates.stream().mapToInt(ConverterEntry::specificity).max().orElseThrow();
      final var winners = candidates.stream().filter(e -> e.specificity() == best).toList();
      if (winners.size() > 1) {
        throw new AmbiguousConverterException("Ambiguous converters for " + descriptor.describe() + " at " + key +
            " with specificity " + best + ": " + winners.stream()
            .sorted(Comparator.comparingLong(ConverterEntry::sequence))
            .map(e -> e.converter().toString())
            .collect(Collectors.joining(", ")));
      }
      final var winner = winners.get(0);
      LOGGER.finer(() -> "Dispatch " + descriptor.describe() + " -> " + winner.converter() + " via " + key);
      return winner;
    }
    throw new NoConverterException(descriptor);
  }

  /// Entries registered at `key`, in registration order.
  public List<ConverterEntry> entriesAt(DispatchKey key) {
    return table.get().entries().getOrDefault(key, List.of());
  }

  int cachedLookups() {
    return table.get().cache().size();
  }
}
