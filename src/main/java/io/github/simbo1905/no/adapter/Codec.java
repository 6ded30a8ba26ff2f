// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter;

import java.util.List;

/// The contract a wire format plugin implements. The adapter never knows a byte grammar; it hands a codec a [Value]
/// and, when [#requiresSchema()] is true, the [Schema] derived for the declared type.
///
/// A codec must satisfy `decode(encode(v, s), s).equals(v)` for every value a registered converter can produce.
/// Integers beyond the codec's native width raise [ValueRangeException]; malformed input raises [DecodeException];
/// a value that does not fit the schema raises [SchemaMismatchException].
public interface Codec {

  /// Format name used to select this codec, matched case insensitively.
  String name();

  boolean requiresSchema();

  /// @param schema null when the codec does not require one and the caller has none
  byte[] encode(Value value, Schema schema);

  Value decode(byte[] bytes, Schema schema);

  /// Encodes several values of the same type as one payload. By default the values are encoded as one sequence.
  default byte[] encodeMany(List<Value> values, Schema schema) {
    return encode(Value.seq(values), schema == null ? null : new Schema.ArrayNode(schema, false));
  }

  /// Reads what [#encodeMany(List, Schema)] wrote. By default the payload must decode to one sequence.
  default List<Value> decodeMany(byte[] bytes, Schema schema) {
    final var decoded = decode(bytes, schema == null ? null : new Schema.ArrayNode(schema, false));
    if (decoded instanceof Value.SeqValue seq) {
      return seq.values();
    }
    throw new DecodeException("Codec " + name() + " decoded " + decoded.kind().name().toLowerCase() +
        " where a sequence of values was written");
  }

  /// A [HookPoint#SELECT_CODEC] hook answering for this codec's name.
  default Hook<String, Codec> asHook() {
    final Codec self = this;
    return new Hook<>() {
      @Override
      public HookResult<Codec> invoke(String format, Codec partial) {
        return self.name().equalsIgnoreCase(format) ? HookResult.applied(self) : HookResult.notApplicable();
      }

      @Override
      public String toString() {
        return "codec " + self.name();
      }
    };
  }
}
