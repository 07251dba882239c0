// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.function.Function;

/// Reads a fixed-width value from the start of a span that is known to be large enough.
@FunctionalInterface
interface Reader<T> extends Function<Bytes, T> {

  default T read(Bytes in) {
    return apply(in);
  }
}
