// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Signed integers as zigzag-mapped varints, the wire form of `sint32` and `sint64`.
///
/// The wrapper's zigzag form is handed to the unsigned varint coder of the same width; decode applies the
/// inverse map once the varint is complete.
///
/// @param <Z> the wrapper type holding the signed value
/// @param <N> the boxed primitive carrying the zigzag bit pattern
public final class ZigZagCoder<Z, N extends Number> implements Coder<Z> {

  public static final ZigZagCoder<ZigZagInt, Integer> INT =
      new ZigZagCoder<>(VarintCoder.INT, ZigZagInt::zigzag, ZigZagInt::fromZigzag);
  public static final ZigZagCoder<ZigZagLong, Long> LONG =
      new ZigZagCoder<>(VarintCoder.LONG, ZigZagLong::zigzag, ZigZagLong::fromZigzag);

  private final VarintCoder<N> varint;
  private final Function<Z, N> toZigzag;
  private final Function<N, Z> fromZigzag;

  private ZigZagCoder(VarintCoder<N> varint, Function<Z, N> toZigzag, Function<N, Z> fromZigzag) {
    this.varint = Objects.requireNonNull(varint);
    this.toZigzag = Objects.requireNonNull(toZigzag);
    this.fromZigzag = Objects.requireNonNull(fromZigzag);
  }

  @Override
  public Optional<Bytes> encode(Z value, Bytes out) {
    return varint.encode(toZigzag.apply(value), out);
  }

  @Override
  public Bytes encodeUnchecked(Z value, Bytes out) {
    return varint.encodeUnchecked(toZigzag.apply(value), out);
  }

  @Override
  public Optional<Decoded<Z>> decode(Bytes in) {
    return varint.decode(in).map(d -> new Decoded<>(fromZigzag.apply(d.value()), d.rest()));
  }

  @Override
  public Decoded<Z> decodeUnchecked(Bytes in) {
    final Decoded<N> d = varint.decodeUnchecked(in);
    return new Decoded<>(fromZigzag.apply(d.value()), d.rest());
  }

  @Override
  public int encodeSkip(Z value) {
    return varint.encodeSkip(toZigzag.apply(value));
  }

  @Override
  public Optional<Bytes> decodeSkip(Bytes in) {
    return varint.decodeSkip(in);
  }

  @Override
  public Bytes decodeSkipUnchecked(Bytes in) {
    return varint.decodeSkipUnchecked(in);
  }

  @Override
  public String toString() {
    return "ZigZagCoder{" + varint + "}";
  }
}
