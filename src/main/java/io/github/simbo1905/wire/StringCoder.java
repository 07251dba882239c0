// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/// A string as a length prefix followed by its UTF-8 code units.
///
/// Encoding matches `String.getBytes(UTF_8)`, so an unpaired surrogate is written as `'?'`. Decoding replaces
/// malformed input with U+FFFD rather than failing.
public final class StringCoder extends LengthPrefixedCoder<String> {

  public static final StringCoder INSTANCE = new StringCoder();

  private StringCoder() {
  }

  /// The number of bytes `String.getBytes(UTF_8)` would produce, without producing them.
  public static int encodedLength(CharSequence value) {
    final int chars = value.length();
    int length = 0;
    for (int i = 0; i < chars; i++) {
      final char c = value.charAt(i);
      if (c < 0x80) {
        length += 1;
      } else if (c < 0x800) {
        length += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < chars && Character.isLowSurrogate(value.charAt(i + 1))) {
        length += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        // unpaired, replaced by '?'
        length += 1;
      } else {
        length += 3;
      }
    }
    return length;
  }

  @Override
  int payloadLength(String value) {
    return encodedLength(value);
  }

  @Override
  Optional<Bytes> encodePayload(String value, Bytes out) {
    if (out.size() < encodedLength(value)) {
      return Optional.empty();
    }
    return Optional.of(encodePayloadUnchecked(value, out));
  }

  @Override
  Bytes encodePayloadUnchecked(String value, Bytes out) {
    final byte[] utf8 = value.getBytes(UTF_8);
    out.put(0, utf8);
    return out.subspan(utf8.length);
  }

  @Override
  Optional<String> decodePayload(Bytes payload) {
    return Optional.of(decodePayloadUnchecked(payload));
  }

  @Override
  String decodePayloadUnchecked(Bytes payload) {
    return new String(payload.toByteArray(), UTF_8);
  }

  @Override
  public String toString() {
    return "StringCoder";
  }
}
