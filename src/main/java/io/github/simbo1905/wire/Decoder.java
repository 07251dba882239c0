// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

/// Reads one complete value from the start of a span.
///
/// `decode` reports input that ends before a complete value as `Optional.empty()`. `decodeUnchecked` assumes a
/// well-formed, complete encoding is present; given anything else its behaviour is unspecified.
public interface Decoder<T> {

  /// Decode one value from the front of `in`.
  /// @return the value and the unread suffix of `in`, or empty if `in` is truncated or malformed
  Optional<Decoded<T>> decode(Bytes in);

  /// Decode one value from the front of `in` without bounds checks.
  Decoded<T> decodeUnchecked(Bytes in);
}
