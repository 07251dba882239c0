// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Objects;
import java.util.Optional;
import java.util.function.LongFunction;
import java.util.function.ToLongFunction;

/// Variable-length integers in little-endian groups of 7 bits.
///
/// Each byte carries 7 bits of the value, least significant group first. The most significant bit of a byte is
/// set when more bytes follow and clear on the last byte. Encodings are minimal, so zero is the single byte
/// `0x00`, 127 is `0x7F`, 128 is `0x80 0x01` and 300 is `0xAC 0x02`.
///
/// The value's bit pattern is read as an unsigned integer of the coder's width. A negative `int` therefore
/// occupies five bytes and a negative `long` ten: there is no zigzag mapping here, see `ZigZagCoder` for that.
///
/// Decoding accepts encodings longer than the minimal form. Bits beyond the coder's width are discarded, the
/// same way a narrowing cast would, and the full byte run up to the terminating byte is consumed.
///
/// References:
/// 1. https://protobuf.dev/programming-guides/encoding/#varints
/// 2. https://en.wikipedia.org/wiki/LEB128
public final class VarintCoder<T extends Number> implements Coder<T> {

  public static final VarintCoder<Byte> BYTE =
      new VarintCoder<>(Byte.SIZE, v -> v & 0xFFL, n -> (byte) n);
  public static final VarintCoder<Short> SHORT =
      new VarintCoder<>(Short.SIZE, v -> v & 0xFFFFL, n -> (short) n);
  public static final VarintCoder<Integer> INT =
      new VarintCoder<>(Integer.SIZE, Integer::toUnsignedLong, n -> (int) n);
  public static final VarintCoder<Long> LONG =
      new VarintCoder<>(Long.SIZE, Long::longValue, n -> n);

  static final int CONTINUATION = 0x80;
  static final int PAYLOAD = 0x7F;

  private final int bits;
  private final ToLongFunction<T> toBits;
  private final LongFunction<T> fromBits;

  private VarintCoder(int bits, ToLongFunction<T> toBits, LongFunction<T> fromBits) {
    this.bits = bits;
    this.toBits = Objects.requireNonNull(toBits);
    this.fromBits = Objects.requireNonNull(fromBits);
  }

  /// The width in bits of the values this coder carries.
  public int bits() {
    return bits;
  }

  /// The most bytes a minimal encoding of this coder's values can take.
  public int maxBytes() {
    return (bits + 6) / 7;
  }

  /// The number of 7-bit groups needed for an unsigned 64-bit pattern. Zero needs one group.
  static int sizeOf(long unsigned) {
    final int significant = Long.SIZE - Long.numberOfLeadingZeros(unsigned);
    return significant == 0 ? 1 : (significant + 6) / 7;
  }

  @Override
  public Optional<Bytes> encode(T value, Bytes out) {
    long n = toBits.applyAsLong(value);
    final int size = out.size();
    int i = 0;
    while ((n & ~PAYLOAD) != 0) {
      if (i == size) {
        return Optional.empty();
      }
      out.put(i++, (byte) ((n & PAYLOAD) | CONTINUATION));
      n >>>= 7;
    }
    if (i == size) {
      return Optional.empty();
    }
    out.put(i++, (byte) n);
    return Optional.of(out.subspan(i));
  }

  @Override
  public Bytes encodeUnchecked(T value, Bytes out) {
    long n = toBits.applyAsLong(value);
    int i = 0;
    while ((n & ~PAYLOAD) != 0) {
      out.put(i++, (byte) ((n & PAYLOAD) | CONTINUATION));
      n >>>= 7;
    }
    out.put(i++, (byte) n);
    return out.subspan(i);
  }

  @Override
  public Optional<Decoded<T>> decode(Bytes in) {
    final int size = in.size();
    long n = 0;
    int shift = 0;
    int i = 0;
    byte b;
    do {
      if (i == size) {
        return Optional.empty();
      }
      b = in.get(i++);
      if (shift < Long.SIZE) {
        n |= (long) (b & PAYLOAD) << shift;
        shift += 7;
      }
    } while ((b & CONTINUATION) != 0);
    return Optional.of(new Decoded<>(fromBits.apply(n), in.subspan(i)));
  }

  @Override
  public Decoded<T> decodeUnchecked(Bytes in) {
    long n = 0;
    int shift = 0;
    int i = 0;
    byte b;
    do {
      b = in.get(i++);
      if (shift < Long.SIZE) {
        n |= (long) (b & PAYLOAD) << shift;
        shift += 7;
      }
    } while ((b & CONTINUATION) != 0);
    return new Decoded<>(fromBits.apply(n), in.subspan(i));
  }

  @Override
  public int encodeSkip(T value) {
    return sizeOf(toBits.applyAsLong(value));
  }

  @Override
  public Optional<Bytes> decodeSkip(Bytes in) {
    final int size = in.size();
    int i = 0;
    byte b;
    do {
      if (i == size) {
        return Optional.empty();
      }
      b = in.get(i++);
    } while ((b & CONTINUATION) != 0);
    return Optional.of(in.subspan(i));
  }

  @Override
  public Bytes decodeSkipUnchecked(Bytes in) {
    int i = 0;
    //noinspection StatementWithEmptyBody
    while ((in.get(i++) & CONTINUATION) != 0) {
    }
    return in.subspan(i);
  }

  @Override
  public String toString() {
    return "VarintCoder{bits=" + bits + "}";
  }
}
