// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.function.BiConsumer;

/// Writes a fixed-width value at the start of a span that is known to be large enough.
@FunctionalInterface
interface Writer<T> extends BiConsumer<Bytes, T> {

  default void write(Bytes out, T value) {
    accept(out, value);
  }
}
