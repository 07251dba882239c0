// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Objects;
import java.util.Optional;

/// Copies a value's fixed-width representation verbatim.
///
/// Multi-byte values use the platform's native byte order; producer and consumer must agree on it.
/// Java has no unsigned primitives, so an unsigned N-bit value travels in the signed type of the same width.
public final class FixedWidthCoder<T> implements Coder<T> {

  public static final FixedWidthCoder<Byte> BYTE =
      new FixedWidthCoder<>("BYTE", Byte.BYTES, (out, v) -> out.put(0, v), in -> in.get(0));
  public static final FixedWidthCoder<Short> SHORT =
      new FixedWidthCoder<>("SHORT", Short.BYTES, (out, v) -> out.putShort(0, v), in -> in.getShort(0));
  public static final FixedWidthCoder<Character> CHAR =
      new FixedWidthCoder<>("CHAR", Character.BYTES, (out, v) -> out.putChar(0, v), in -> in.getChar(0));
  public static final FixedWidthCoder<Integer> INT =
      new FixedWidthCoder<>("INT", Integer.BYTES, (out, v) -> out.putInt(0, v), in -> in.getInt(0));
  public static final FixedWidthCoder<Long> LONG =
      new FixedWidthCoder<>("LONG", Long.BYTES, (out, v) -> out.putLong(0, v), in -> in.getLong(0));
  public static final FixedWidthCoder<Float> FLOAT =
      new FixedWidthCoder<>("FLOAT", Float.BYTES, (out, v) -> out.putFloat(0, v), in -> in.getFloat(0));
  public static final FixedWidthCoder<Double> DOUBLE =
      new FixedWidthCoder<>("DOUBLE", Double.BYTES, (out, v) -> out.putDouble(0, v), in -> in.getDouble(0));

  private final String name;
  private final int width;
  private final Writer<T> writer;
  private final Reader<T> reader;

  private FixedWidthCoder(String name, int width, Writer<T> writer, Reader<T> reader) {
    this.name = name;
    this.width = width;
    this.writer = Objects.requireNonNull(writer);
    this.reader = Objects.requireNonNull(reader);
  }

  /// The number of bytes every value of this coder occupies.
  public int width() {
    return width;
  }

  @Override
  public Optional<Bytes> encode(T value, Bytes out) {
    if (out.size() < width) {
      return Optional.empty();
    }
    writer.write(out, value);
    return Optional.of(out.subspan(width));
  }

  @Override
  public Bytes encodeUnchecked(T value, Bytes out) {
    writer.write(out, value);
    return out.subspan(width);
  }

  @Override
  public Optional<Decoded<T>> decode(Bytes in) {
    if (in.size() < width) {
      return Optional.empty();
    }
    return Optional.of(new Decoded<>(reader.read(in), in.subspan(width)));
  }

  @Override
  public Decoded<T> decodeUnchecked(Bytes in) {
    return new Decoded<>(reader.read(in), in.subspan(width));
  }

  @Override
  public int encodeSkip(T value) {
    return width;
  }

  @Override
  public Optional<Bytes> decodeSkip(Bytes in) {
    if (in.size() < width) {
      return Optional.empty();
    }
    return Optional.of(in.subspan(width));
  }

  @Override
  public Bytes decodeSkipUnchecked(Bytes in) {
    return in.subspan(width);
  }

  @Override
  public String toString() {
    return "FixedWidthCoder{" + name + ", width=" + width + "}";
  }
}
