// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

/// A signed 32-bit value that is put on the wire in zigzag form.
///
/// @param value the signed value
public record ZigZagInt(int value) {

  /// Wrap a value read off the wire in its zigzag form.
  public static ZigZagInt fromZigzag(int zigzag) {
    return new ZigZagInt(ZigZag.decodeInt(zigzag));
  }

  /// The zigzag-mapped unsigned bit pattern of `value`.
  public int zigzag() {
    return ZigZag.encodeInt(value);
  }
}
