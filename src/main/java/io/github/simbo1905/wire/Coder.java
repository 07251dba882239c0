// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.logging.Logger;

/// A codec for values of type `T`: an encoder, a decoder and the matching skip operations.
///
/// Implementations are stateless and thread safe. Composite coders are built by delegating to the
/// encode, decode and skip operations of their component coders.
public interface Coder<T> extends Encoder<T>, Decoder<T>, Skipper<T> {

  Logger LOGGER = Logger.getLogger(Coder.class.getName());
}
