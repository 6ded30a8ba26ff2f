// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.adapter.codec;

import io.github.simbo1905.no.adapter.DecodeException;

import java.nio.ByteBuffer;

/// Variable length zigzag integers: small magnitudes of either sign take few bytes. A long takes at most ten.
final class ZigZagEncoding {

  static final int MAX_LONG_BYTES = 10;

  private ZigZagEncoding() {
  }

  static void putLong(ByteBuffer buffer, long value) {
    long zigzag = (value << 1) ^ (value >> 63);
    while ((zigzag & ~0x7FL) != 0) {
      buffer.put((byte) ((zigzag & 0x7F) | 0x80));
      zigzag >>>= 7;
    }
    buffer.put((byte) zigzag);
  }

  static long getLong(ByteBuffer buffer) {
    long zigzag = 0;
    for (int shift = 0; ; shift += 7) {
      if (shift >= 7 * MAX_LONG_BYTES) {
        throw new DecodeException("Varint longer than " + MAX_LONG_BYTES + " bytes at position " + buffer.position());
      }
      final byte b = buffer.get();
      zigzag |= (long) (b & 0x7F) << shift;
      if ((b & 0x80) == 0) {
        break;
      }
    }
    return (zigzag >>> 1) ^ -(zigzag & 1);
  }

  static void putInt(ByteBuffer buffer, int value) {
    putLong(buffer, value);
  }

  static int getInt(ByteBuffer buffer) {
    final int position = buffer.position();
    final long value = getLong(buffer);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new DecodeException("Varint " + value + " at position " + position + " exceeds 32 bits");
    }
    return (int) value;
  }

  static int sizeOf(long value) {
    long zigzag = (value << 1) ^ (value >> 63);
    int size = 1;
    while ((zigzag & ~0x7FL) != 0) {
      size++;
      zigzag >>>= 7;
    }
    return size;
  }
}
