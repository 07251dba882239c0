// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Arrays;

/// Which coder paths `WireCodec` drives. Set via system property `wire.codec.Mode`. The default is SAFE.
///
/// The coders themselves never consult this setting: each exposes both paths as separate methods, so a caller
/// working directly with a `Coder` picks the path at the call site.
public enum Mode {
  /// Bounds-checked paths. A buffer that is too small, or input that is truncated, is reported as a
  /// `CodecException`.
  SAFE,

  /// Unchecked paths. The caller guarantees well-formed input and large enough buffers. Violations surface as
  /// whatever the underlying `ByteBuffer` throws, or as wrong results.
  UNCHECKED;

  static final String PROPERTY = "wire.codec.Mode";

  static Mode current() {
    final String mode = System.getProperty(PROPERTY, "SAFE").toUpperCase();
    try {
      return Mode.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid codec mode: " + mode + ". Must be one of: " + Arrays.toString(Mode.values()), e);
    }
  }
}
