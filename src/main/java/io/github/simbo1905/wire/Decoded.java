// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Objects;

/// A decoded value together with the bytes that remain after it.
///
/// @param value the decoded value
/// @param rest  the suffix of the input span that was not consumed
public record Decoded<T>(T value, Bytes rest) {
  public Decoded {
    Objects.requireNonNull(rest, "rest must not be null");
  }
}
