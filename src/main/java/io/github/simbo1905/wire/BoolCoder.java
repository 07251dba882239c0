// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

/// A boolean as a single byte: `0x01` for true, `0x00` for false. Any nonzero byte decodes as true.
public final class BoolCoder implements Coder<Boolean> {

  public static final BoolCoder INSTANCE = new BoolCoder();

  private static final FixedWidthCoder<Byte> BYTE = FixedWidthCoder.BYTE;
  private static final Byte TRUE = (byte) 1;
  private static final Byte FALSE = (byte) 0;

  private BoolCoder() {
  }

  private static Byte toByte(boolean value) {
    return value ? TRUE : FALSE;
  }

  @Override
  public Optional<Bytes> encode(Boolean value, Bytes out) {
    return BYTE.encode(toByte(value), out);
  }

  @Override
  public Bytes encodeUnchecked(Boolean value, Bytes out) {
    return BYTE.encodeUnchecked(toByte(value), out);
  }

  @Override
  public Optional<Decoded<Boolean>> decode(Bytes in) {
    return BYTE.decode(in).map(d -> new Decoded<>(d.value() != 0, d.rest()));
  }

  @Override
  public Decoded<Boolean> decodeUnchecked(Bytes in) {
    final Decoded<Byte> d = BYTE.decodeUnchecked(in);
    return new Decoded<>(d.value() != 0, d.rest());
  }

  @Override
  public int encodeSkip(Boolean value) {
    return BYTE.encodeSkip(toByte(value));
  }

  @Override
  public Optional<Bytes> decodeSkip(Bytes in) {
    return BYTE.decodeSkip(in);
  }

  @Override
  public Bytes decodeSkipUnchecked(Bytes in) {
    return BYTE.decodeSkipUnchecked(in);
  }

  @Override
  public String toString() {
    return "BoolCoder";
  }
}
