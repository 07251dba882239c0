// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

/// A signed 64-bit value that is put on the wire in zigzag form.
///
/// @param value the signed value
public record ZigZagLong(long value) {

  public static ZigZagLong fromZigzag(long zigzag) {
    return new ZigZagLong(ZigZag.decodeLong(zigzag));
  }

  public long zigzag() {
    return ZigZag.encodeLong(value);
  }
}
