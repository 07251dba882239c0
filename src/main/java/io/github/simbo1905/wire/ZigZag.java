// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

/// The zigzag map between signed integers and unsigned bit patterns.
///
/// Non-negative `v` maps to `2v` and negative `v` to `-2v - 1`, so 0, -1, 1, -2, 2 become 0, 1, 2, 3, 4 and
/// values of small magnitude of either sign stay short once varint encoded.
///
/// - `encode(v) = (v << 1) ^ (v >> (N - 1))`
/// - `decode(u) = (u >>> 1) ^ -(u & 1)`
public final class ZigZag {

  private ZigZag() {
  }

  public static int encodeInt(int value) {
    return (value << 1) ^ (value >> 31);
  }

  public static int decodeInt(int zigzag) {
    return (zigzag >>> 1) ^ -(zigzag & 1);
  }

  public static long encodeLong(long value) {
    return (value << 1) ^ (value >> 63);
  }

  public static long decodeLong(long zigzag) {
    return (zigzag >>> 1) ^ -(zigzag & 1);
  }
}
