// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import io.github.simbo1905.no.adapter.codec.BinaryCodec;
import io.github.simbo1905.no.adapter.codec.CsvCodec;
import io.github.simbo1905.no.adapter.codec.JsonCodec;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/// Main entry point of the No Framework Adapter library.
/// Converts typed Java values to and from wire formats through a format neutral [Value] model.
///
/// ```java
/// final var adapter = Adapter.standard();
/// final byte[] json = adapter.dump(ship, "json");
/// final Ship back = adapter.load(json, Ship.class, "json");
/// ```
///
/// An adapter owns its converter table, hook table and caches. It is safe to use from many threads, including while
/// registrations are made.
public final class Adapter {

  public static final Logger LOGGER = Logger.getLogger(Adapter.class.getName());

  /// Hook order used when registering without one.
  public static final int DEFAULT_HOOK_ORDER = 0;

  private final HookRegistry hooks = new HookRegistry();
  private final ConverterRegistry converters = new ConverterRegistry();
  private final TypeResolver resolver;
  private final SchemaDeriver deriver;
  private final ConversionEngine engine;

  private Adapter(int maxUnionBranches) {
    this.resolver = new TypeResolver(hooks, maxUnionBranches);
    this.deriver = new SchemaDeriver(hooks);
    this.engine = new ConversionEngine(converters, hooks);
    StandardConverters.install(converters);
    LogicalTypes.install(converters, hooks);
    hooks.register(HookPoint.SELECT_CODEC, new JsonCodec().asHook(), LogicalTypes.BUILTIN_HOOK_ORDER);
    hooks.register(HookPoint.SELECT_CODEC, new BinaryCodec().asHook(), LogicalTypes.BUILTIN_HOOK_ORDER);
    hooks.register(HookPoint.SELECT_CODEC, new CsvCodec().asHook(), LogicalTypes.BUILTIN_HOOK_ORDER);
  }

  /// Lazily created shared instance with only the built in converters and codecs.
  public static Adapter standard() {
    return Standard.INSTANCE;
  }

  private static final class Standard {
    static final Adapter INSTANCE = builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Serialize an object using its runtime class as the declared type
  /// @param object a record, enum or other resolvable value; not null
  /// @param format a registered codec name such as `json` or `binary`
  public byte[] dump(Object object, String format) {
    Objects.requireNonNull(object, "object must not be null, declare its type to dump an absent value");
    return dump(object, object.getClass(), format);
  }

  public byte[] dump(Object object, Type type, String format) {
    return encode(object, resolver.resolve(type), format);
  }

  /// Serialize with a generic declared type, e.g. `new TypeRef<List<Ship>>() {}`
  public <T> byte[] dump(T object, TypeRef<T> type, String format) {
    return encode(object, resolver.resolve(type.annotatedType()), format);
  }

  /// Serialize with a caller supplied writer schema in place of the derived one. The value is first conformed to it,
  /// so fields the schema lacks are dropped and fields only the schema has take their defaults. This is how data is
  /// written for a reader that still holds an older version of a record.
  public byte[] dump(Object object, Type type, String format, Schema writerSchema) {
    return encode(object, resolver.resolve(type), format, writerSchema);
  }

  public <T> byte[] dump(T object, TypeRef<T> type, String format, Schema writerSchema) {
    return encode(object, resolver.resolve(type.annotatedType()), format, writerSchema);
  }

  public <T> T load(byte[] bytes, Class<T> type, String format) {
    return uncheckedCast(decode(bytes, resolver.resolve(type), format));
  }

  public <T> T load(byte[] bytes, TypeRef<T> type, String format) {
    return uncheckedCast(decode(bytes, resolver.resolve(type.annotatedType()), format));
  }

  public Object load(byte[] bytes, Type type, String format) {
    return decode(bytes, resolver.resolve(type), format);
  }

  /// Deserialize data written with the given writer schema. The bytes are read with the writer schema and the result
  /// is conformed to the declared type's schema, so a reader can drop fields a newer writer appended.
  public <T> T load(byte[] bytes, Class<T> type, String format, Schema writerSchema) {
    return uncheckedCast(decode(bytes, resolver.resolve(type), format, writerSchema));
  }

  public <T> T load(byte[] bytes, TypeRef<T> type, String format, Schema writerSchema) {
    return uncheckedCast(decode(bytes, resolver.resolve(type.annotatedType()), format, writerSchema));
  }

  /// Serialize several values of one declared type as a single payload
  /// @return NDJSON for `json`, a count prefixed sequence for `binary`, one header and many rows for `csv`
  public byte[] dumpMany(List<?> objects, Type elementType, String format) {
    return encodeMany(objects, resolver.resolve(elementType), format);
  }

  public <T> byte[] dumpMany(List<? extends T> objects, TypeRef<T> elementType, String format) {
    return encodeMany(objects, resolver.resolve(elementType.annotatedType()), format);
  }

  public <T> List<T> loadMany(byte[] bytes, Class<T> elementType, String format) {
    return uncheckedCast(decodeMany(bytes, resolver.resolve(elementType), format));
  }

  public <T> List<T> loadMany(byte[] bytes, TypeRef<T> elementType, String format) {
    return uncheckedCast(decodeMany(bytes, resolver.resolve(elementType.annotatedType()), format));
  }

  public List<Object> loadMany(byte[] bytes, Type elementType, String format) {
    return decodeMany(bytes, resolver.resolve(elementType), format);
  }

  /// Convert to the intermediate model without encoding
  public Value toValue(Object object) {
    Objects.requireNonNull(object, "object must not be null, declare its type to convert an absent value");
    return toValue(object, object.getClass());
  }

  public Value toValue(Object object, Type type) {
    return engine.toValue(object, resolver.resolve(type), CompatibilityMode.current());
  }

  public <T> Value toValue(T object, TypeRef<T> type) {
    return engine.toValue(object, resolver.resolve(type.annotatedType()), CompatibilityMode.current());
  }

  public <T> T fromValue(Value value, Class<T> type) {
    return uncheckedCast(fromValue(value, (Type) type));
  }

  public Object fromValue(Value value, Type type) {
    return engine.fromValue(value, resolver.resolve(type), CompatibilityMode.current());
  }

  public <T> T fromValue(Value value, TypeRef<T> type) {
    return uncheckedCast(engine.fromValue(value, resolver.resolve(type.annotatedType()), CompatibilityMode.current()));
  }

  public @NotNull TypeDescriptor resolve(Type type) {
    return resolver.resolve(type);
  }

  public @NotNull TypeDescriptor resolve(TypeRef<?> type) {
    return resolver.resolve(type.annotatedType());
  }

  public @NotNull Schema schema(Type type) {
    return deriver.derive(resolver.resolve(type));
  }

  public @NotNull Schema schema(TypeRef<?> type) {
    return deriver.derive(resolver.resolve(type.annotatedType()));
  }

  /// The codec registered for a format name
  /// @throws IllegalArgumentException when no codec answers to the name
  public @NotNull Codec codec(String format) {
    Objects.requireNonNull(format, "format must not be null");
    return hooks.firstSuccess(HookPoint.SELECT_CODEC, format)
        .orElseThrow(() -> new IllegalArgumentException("Unknown format '" + format + "'"));
  }

  /// Register a converter for exactly the given declared type.
  /// @param specificity rank among converters at the same key, higher wins
  /// @param schema what schema aware codecs see while this converter is the one dispatched to, or null if it is
  ///               only used with codecs that need no schema
  public <T> Adapter register(Class<T> type,
                              Function<? super T, ? extends Value> to,
                              Function<? super Value, ? extends T> from,
                              int specificity,
                              Schema schema) {
    return registerExact(resolver.resolve(type), Converter.of(type, to, from), specificity, schema);
  }

  /// Register a converter for exactly the given generic declaration, e.g. `new TypeRef<List<Money>>() {}`. The
  /// converter only accepts instances of the declaration's raw class.
  public <T> Adapter register(TypeRef<T> type,
                              Function<? super T, ? extends Value> to,
                              Function<? super Value, ? extends T> from,
                              int specificity,
                              Schema schema) {
    final Class<T> raw = uncheckedCast(rawClass(type.type()));
    return registerExact(resolver.resolve(type.annotatedType()), Converter.of(raw, to, from), specificity, schema);
  }

  public <T> Adapter register(Class<T> type,
                              Function<? super T, ? extends Value> to,
                              Function<? super Value, ? extends T> from,
                              int specificity) {
    return register(type, to, from, specificity, null);
  }

  public <T> Adapter register(TypeRef<T> type,
                              Function<? super T, ? extends Value> to,
                              Function<? super Value, ? extends T> from,
                              int specificity) {
    return register(type, to, from, specificity, null);
  }

  public <T> Adapter register(Class<T> type,
                              Function<? super T, ? extends Value> to,
                              Function<? super Value, ? extends T> from) {
    return register(type, to, from, ConverterRegistry.DEFAULT_SPECIFICITY, null);
  }

  /// Registers the converter and a [HookPoint#DERIVE_SCHEMA] hook that answers for the descriptor while the converter
  /// wins dispatch for it. Without a schema the hook reports that there is none, which schema aware codecs turn into
  /// a [SchemaException] and the json codec into schema-less output. A hook without a schema runs after every hook
  /// registered at a default order, so a later schema hook can still supply one.
  private Adapter registerExact(TypeDescriptor descriptor, Converter converter, int specificity, Schema schema) {
    final var entry = converters.register(DispatchKey.exact(descriptor), converter, specificity, false);
    hooks.register(HookPoint.DERIVE_SCHEMA, new Hook<>() {
      @Override
      public HookResult<Schema> invoke(TypeDescriptor candidate, Schema partial) {
        if (!descriptor.equals(candidate) || converters.lookup(candidate) != entry) {
          return HookResult.notApplicable();
        }
        if (schema == null) {
          throw new SchemaException("No schema for " + descriptor.describe() + ": " + converter +
              " was registered without one");
        }
        return HookResult.applied(schema);
      }

      @Override
      public String toString() {
        return "schema of " + converter + " for " + descriptor.describe();
      }
    }, schema == null ? LogicalTypes.BUILTIN_HOOK_ORDER - 1 : DEFAULT_HOOK_ORDER);
    return this;
  }

  /// Register a converter at any dispatch key: an exact descriptor, a record shape, a kind, or anything.
  public ConverterEntry register(DispatchKey key, Converter converter, int specificity, boolean replace) {
    final var entry = converters.register(key, converter, specificity, replace);
    deriver.invalidate();
    return entry;
  }

  /// Claim a class as opaque so the resolver never looks inside it, then convert it with the given functions. This
  /// is how recursive records and third party classes are handled.
  /// @param schema what schema aware codecs see for the class, or null if it is only used with schema-less codecs
  public <T> Adapter registerOpaque(Class<T> type,
                                    Function<? super T, ? extends Value> to,
                                    Function<? super Value, ? extends T> from,
                                    Schema schema) {
    Objects.requireNonNull(type, "type must not be null");
    final var descriptor = TypeDescriptor.opaque(type);
    hooks.register(HookPoint.RESOLVE_TYPE, new Hook<>() {
      @Override
      public HookResult<TypeDescriptor> invoke(Type candidate, TypeDescriptor partial) {
        return candidate == type ? HookResult.applied(descriptor) : HookResult.notApplicable();
      }

      @Override
      public String toString() {
        return "opaque " + type.getName();
      }
    }, DEFAULT_HOOK_ORDER);
    converters.register(DispatchKey.exact(descriptor), Converter.of(type, to, from),
        ConverterRegistry.DEFAULT_SPECIFICITY, true);
    if (schema != null) {
      hooks.register(HookPoint.DERIVE_SCHEMA, new Hook<>() {
        @Override
        public HookResult<Schema> invoke(TypeDescriptor candidate, Schema partial) {
          return descriptor.equals(candidate) ? HookResult.applied(schema) : HookResult.notApplicable();
        }

        @Override
        public String toString() {
          return "schema of opaque " + type.getName();
        }
      }, DEFAULT_HOOK_ORDER);
    }
    return this;
  }

  public <I, O> Adapter registerHook(HookPoint<I, O> point, Hook<I, O> hook, int order) {
    hooks.register(point, hook, order);
    return this;
  }

  public <I, O> Adapter registerHook(HookPoint<I, O> point, Hook<I, O> hook) {
    return registerHook(point, hook, DEFAULT_HOOK_ORDER);
  }

  /// Register a codec. It is found by its name ahead of any built in codec of the same name.
  public Adapter registerCodec(Codec codec) {
    Objects.requireNonNull(codec, "codec must not be null");
    hooks.register(HookPoint.SELECT_CODEC, codec.asHook(), DEFAULT_HOOK_ORDER);
    return this;
  }

  ConverterRegistry converters() {
    return converters;
  }

  HookRegistry hooks() {
    return hooks;
  }

  private byte[] encode(Object object, TypeDescriptor descriptor, String format) {
    final var codec = codec(format);
    final var value = engine.toValue(object, descriptor, CompatibilityMode.current());
    return codec.encode(value, schemaFor(codec, descriptor));
  }

  private byte[] encode(Object object, TypeDescriptor descriptor, String format, Schema writerSchema) {
    Objects.requireNonNull(writerSchema, "writerSchema must not be null");
    final var codec = codec(format);
    final var mode = CompatibilityMode.current();
    final var value = engine.toValue(object, descriptor, mode);
    return codec.encode(Schemas.conform(value, writerSchema, mode), writerSchema);
  }

  private Object decode(byte[] bytes, TypeDescriptor descriptor, String format, Schema writerSchema) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    Objects.requireNonNull(writerSchema, "writerSchema must not be null");
    final var codec = codec(format);
    final var mode = CompatibilityMode.current();
    final var written = codec.decode(bytes, writerSchema);
    final var readerSchema = derivedOrNull(descriptor);
    final var value = readerSchema == null ? written : Schemas.conform(written, readerSchema, mode);
    LOGGER.finer(() -> "Read " + descriptor.describe() + " with writer schema\n" + writerSchema.toTreeString());
    return engine.fromValue(value, descriptor, mode);
  }

  private Object decode(byte[] bytes, TypeDescriptor descriptor, String format) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    final var codec = codec(format);
    final var value = codec.decode(bytes, schemaFor(codec, descriptor));
    return engine.fromValue(value, descriptor, CompatibilityMode.current());
  }

  private byte[] encodeMany(List<?> objects, TypeDescriptor descriptor, String format) {
    Objects.requireNonNull(objects, "objects must not be null");
    final var codec = codec(format);
    final var mode = CompatibilityMode.current();
    final var values = new ArrayList<Value>(objects.size());
    for (int i = 0; i < objects.size(); i++) {
      values.add(engine.toValue(objects.get(i), descriptor, mode, ConversionEngine.ROOT + "[" + i + "]"));
    }
    return codec.encodeMany(values, schemaFor(codec, descriptor));
  }

  private List<Object> decodeMany(byte[] bytes, TypeDescriptor descriptor, String format) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    final var codec = codec(format);
    final var mode = CompatibilityMode.current();
    final var values = codec.decodeMany(bytes, schemaFor(codec, descriptor));
    final var objects = new ArrayList<Object>(values.size());
    for (int i = 0; i < values.size(); i++) {
      objects.add(engine.fromValue(values.get(i), descriptor, mode, ConversionEngine.ROOT + "[" + i + "]"));
    }
    return objects;
  }

  /// A codec that requires a schema always gets the derived one. Any other codec gets it when it can be derived, which
  /// lets json restore bytes and fill defaults; types with no schema, such as opaque ones registered without one, go
  /// to it schema-less.
  private Schema schemaFor(Codec codec, TypeDescriptor descriptor) {
    return codec.requiresSchema() ? deriver.derive(descriptor) : derivedOrNull(descriptor);
  }

  private Schema derivedOrNull(TypeDescriptor descriptor) {
    try {
      return deriver.derive(descriptor);
    } catch (SchemaException e) {
      LOGGER.finer(() -> "No schema for " + descriptor.describe() + ", continuing without one: " + e.getMessage());
      return null;
    }
  }

  static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType parameterized) {
      return (Class<?>) parameterized.getRawType();
    }
    throw new IllegalArgumentException("Cannot register a converter for " + type.getTypeName());
  }

  @SuppressWarnings("unchecked")
  private static <T> T uncheckedCast(Object object) {
    return (T) object;
  }

  /// Collects plugins and registrations, which are applied in order to the adapter that [#build()] creates.
  public static final class Builder {
    private final List<Consumer<Adapter>> registrations = new ArrayList<>();
    private final Set<String> plugins = new LinkedHashSet<>();
    private int maxUnionBranches = TypeResolver.configuredMaxUnionBranches();

    private Builder() {
    }

    /// Overrides the `no.adapter.MaxUnionBranches` system property.
    public Builder maxUnionBranches(int maxUnionBranches) {
      if (maxUnionBranches < 1) {
        throw new IllegalArgumentException("maxUnionBranches must be positive: " + maxUnionBranches);
      }
      this.maxUnionBranches = maxUnionBranches;
      return this;
    }

    /// Installs a plugin unless one with the same name is already installed.
    public Builder install(Plugin plugin) {
      Objects.requireNonNull(plugin, "plugin must not be null");
      if (!plugins.add(plugin.name())) {
        LOGGER.fine(() -> "Plugin " + plugin.name() + " already installed, skipping " + plugin);
        return this;
      }
      plugin.install(this);
      LOGGER.fine(() -> "Installed plugin " + plugin.name());
      return this;
    }

    public Builder discoverPlugins() {
      return discoverPlugins(Thread.currentThread().getContextClassLoader());
    }

    /// Installs every [Plugin] service visible to the class loader. Entries that fail to load are logged and skipped.
    public Builder discoverPlugins(ClassLoader loader) {
      final Iterator<Plugin> services = ServiceLoader.load(Plugin.class, loader).iterator();
      while (true) {
        try {
          if (!services.hasNext()) {
            break;
          }
          final var plugin = services.next();
          LOGGER.info(() -> "Discovered plugin " + plugin.name() + " (" + plugin.getClass().getName() + ")");
          install(plugin);
        } catch (ServiceConfigurationError e) {
          LOGGER.warning(() -> "Ignoring plugin service that failed to load: " + e.getMessage());
        }
      }
      return this;
    }

    public <T> Builder register(Class<T> type,
                                Function<? super T, ? extends Value> to,
                                Function<? super Value, ? extends T> from,
                                int specificity) {
      registrations.add(adapter -> adapter.register(type, to, from, specificity));
      return this;
    }

    public <T> Builder register(TypeRef<T> type,
                                Function<? super T, ? extends Value> to,
                                Function<? super Value, ? extends T> from,
                                int specificity) {
      registrations.add(adapter -> adapter.register(type, to, from, specificity));
      return this;
    }

    public <T> Builder register(Class<T> type,
                                Function<? super T, ? extends Value> to,
                                Function<? super Value, ? extends T> from) {
      return register(type, to, from, ConverterRegistry.DEFAULT_SPECIFICITY);
    }

    public <T> Builder register(Class<T> type,
                                Function<? super T, ? extends Value> to,
                                Function<? super Value, ? extends T> from,
                                int specificity,
                                Schema schema) {
      registrations.add(adapter -> adapter.register(type, to, from, specificity, schema));
      return this;
    }

    public <T> Builder register(TypeRef<T> type,
                                Function<? super T, ? extends Value> to,
                                Function<? super Value, ? extends T> from,
                                int specificity,
                                Schema schema) {
      registrations.add(adapter -> adapter.register(type, to, from, specificity, schema));
      return this;
    }

    public Builder register(DispatchKey key, Converter converter, int specificity, boolean replace) {
      registrations.add(adapter -> adapter.register(key, converter, specificity, replace));
      return this;
    }

    public <T> Builder registerOpaque(Class<T> type,
                                      Function<? super T, ? extends Value> to,
                                      Function<? super Value, ? extends T> from,
                                      Schema schema) {
      registrations.add(adapter -> adapter.registerOpaque(type, to, from, schema));
      return this;
    }

    public <I, O> Builder registerHook(HookPoint<I, O> point, Hook<I, O> hook, int order) {
      registrations.add(adapter -> adapter.registerHook(point, hook, order));
      return this;
    }

    public <I, O> Builder registerHook(HookPoint<I, O> point, Hook<I, O> hook) {
      return registerHook(point, hook, DEFAULT_HOOK_ORDER);
    }

    public Builder registerCodec(Codec codec) {
      registrations.add(adapter -> adapter.registerCodec(codec));
      return this;
    }

    public Adapter build() {
      final var adapter = new Adapter(maxUnionBranches);
      registrations.forEach(registration -> registration.accept(adapter));
      LOGGER.fine(() -> "Built adapter with plugins " + plugins + " and " + registrations.size() + " registrations");
      return adapter;
    }
  }
}
