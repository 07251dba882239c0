// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

/// A byte string as a length prefix followed by its bytes, one byte per element.
public final class BytesCoder extends LengthPrefixedCoder<byte[]> {

  public static final BytesCoder INSTANCE = new BytesCoder();

  private BytesCoder() {
  }

  @Override
  int payloadLength(byte[] value) {
    return value.length;
  }

  @Override
  Optional<Bytes> encodePayload(byte[] value, Bytes out) {
    if (out.size() < value.length) {
      return Optional.empty();
    }
    return Optional.of(encodePayloadUnchecked(value, out));
  }

  @Override
  Bytes encodePayloadUnchecked(byte[] value, Bytes out) {
    out.put(0, value);
    return out.subspan(value.length);
  }

  @Override
  Optional<byte[]> decodePayload(Bytes payload) {
    return Optional.of(payload.toByteArray());
  }

  @Override
  byte[] decodePayloadUnchecked(Bytes payload) {
    return payload.toByteArray();
  }

  @Override
  public String toString() {
    return "BytesCoder";
  }
}
