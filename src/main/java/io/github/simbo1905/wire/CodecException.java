// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Objects;

/// Thrown by `WireCodec` when a bounds-checked coder path reports failure.
///
/// The coders themselves never throw this; they return an empty result and let the caller decide. After
/// an encode failure the target buffer may hold partial output that must not be read as a value.
public class CodecException extends RuntimeException {

  /// What went wrong.
  public enum Reason {
    /// The output buffer cannot hold the encoding.
    INSUFFICIENT_SPACE,
    /// The input ends before a complete encoding, or a length prefix does not fit the input.
    MALFORMED_INPUT,
    /// A complete value was decoded but input that should have been consumed remains.
    TRAILING_BYTES
  }

  private final Reason reason;

  public CodecException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason must not be null");
  }

  public Reason reason() {
    return reason;
  }
}
