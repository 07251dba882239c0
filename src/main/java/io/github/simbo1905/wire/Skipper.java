// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

/// Length computation and fast-forward over encoded values, without writing bytes or building values.
///
/// For every well-formed encoding `encodeSkip(v)` equals the number of bytes `Encoder.encode` writes for `v`,
/// which in turn equals the number of bytes `decodeSkip` and `Decoder.decode` consume.
public interface Skipper<T> {

  /// The exact number of bytes the encoding of `value` occupies.
  int encodeSkip(T value);

  /// Advance past one encoded value.
  /// @return the suffix of `in` after the value, or empty if `in` is truncated or malformed
  Optional<Bytes> decodeSkip(Bytes in);

  /// Advance past one encoded value without bounds checks.
  Bytes decodeSkipUnchecked(Bytes in);
}
