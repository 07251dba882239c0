// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

/// Writes the binary form of a value at the start of a span.
///
/// There are two paths. `encode` checks the span bounds and reports a span that is too small as
/// `Optional.empty()`. Bytes may already have been written when that happens and must not be treated as a
/// valid encoding. `encodeUnchecked` performs no bounds checks: the caller guarantees the span holds at least
/// `Skipper.encodeSkip(value)` bytes. Both paths produce identical bytes for the same value.
public interface Encoder<T> {

  /// Encode `value` into `out`.
  /// @return the unwritten suffix of `out`, or empty if `out` is too small
  Optional<Bytes> encode(T value, Bytes out);

  /// Encode `value` into `out` without bounds checks.
  /// @return the unwritten suffix of `out`
  Bytes encodeUnchecked(T value, Bytes out);
}
