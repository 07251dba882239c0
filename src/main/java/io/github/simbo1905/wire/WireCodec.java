// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.wire.Coder.LOGGER;

/// Buffer-oriented convenience over a `Coder`: reads and writes advance a `ByteBuffer`'s position, empty
/// results from the bounds-checked paths become `CodecException`, and `toByteArray` sizes its own array.
///
/// This is the only place a `Mode` is consulted. A codec built with `Mode.UNCHECKED` calls the unchecked coder
/// paths and so does no bounds checking beyond what the `ByteBuffer` itself does.
public final class WireCodec<T> {
  private final Coder<T> coder;
  private final Mode mode;

  private WireCodec(Coder<T> coder, Mode mode) {
    this.coder = coder;
    this.mode = mode;
  }

  /// Wrap `coder` using the mode given by the `wire.codec.Mode` system property.
  public static <T> WireCodec<T> of(@NotNull Coder<T> coder) {
    return of(coder, Mode.current());
  }

  public static <T> WireCodec<T> of(@NotNull Coder<T> coder, @NotNull Mode mode) {
    Objects.requireNonNull(coder, "coder must not be null");
    Objects.requireNonNull(mode, "mode must not be null");
    LOGGER.fine(() -> "WireCodec for " + coder + " in mode " + mode);
    return new WireCodec<>(coder, mode);
  }

  public Coder<T> coder() {
    return coder;
  }

  public Mode mode() {
    return mode;
  }

  /// Write `value` at the buffer's position and advance the position past it.
  /// @return the number of bytes written
  /// @throws CodecException with `INSUFFICIENT_SPACE` in safe mode if the remaining buffer is too small, in
  ///                        which case the position is unchanged
  public int serialize(@NotNull ByteBuffer buffer, @NotNull T value) {
    Objects.requireNonNull(buffer);
    Objects.requireNonNull(value);
    final Bytes out = Bytes.of(buffer);
    final Bytes rest;
    if (mode == Mode.SAFE) {
      rest = coder.encode(value, out).orElseThrow(() -> {
        LOGGER.fine(() -> coder + " cannot encode " + value + " into " + buffer.remaining() + " bytes at position " +
            buffer.position());
        return new CodecException(CodecException.Reason.INSUFFICIENT_SPACE,
            "Cannot encode value needing " + coder.encodeSkip(value) + " bytes into " + buffer.remaining() +
                " remaining bytes");
      });
    } else {
      rest = coder.encodeUnchecked(value, out);
    }
    final int written = rest.offsetFrom(out);
    LOGGER.finer(() -> coder + " wrote " + written + " bytes at position " + buffer.position());
    buffer.position(buffer.position() + written);
    return written;
  }

  /// Read one value at the buffer's position and advance the position past it.
  /// @throws CodecException with `MALFORMED_INPUT` in safe mode if the buffer ends before a complete value,
  ///                        in which case the position is unchanged
  public T deserialize(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer);
    final Bytes in = Bytes.of(buffer);
    final Decoded<T> decoded = decode(in, buffer.position());
    final int read = decoded.rest().offsetFrom(in);
    LOGGER.finer(() -> coder + " read " + read + " bytes at position " + buffer.position());
    buffer.position(buffer.position() + read);
    return decoded.value();
  }

  /// Advance the buffer's position past one encoded value without decoding it.
  /// @return the number of bytes skipped
  public int skip(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer);
    final Bytes in = Bytes.of(buffer);
    final Bytes rest;
    if (mode == Mode.SAFE) {
      rest = coder.decodeSkip(in).orElseThrow(() -> malformed(in, buffer.position()));
    } else {
      rest = coder.decodeSkipUnchecked(in);
    }
    final int skipped = rest.offsetFrom(in);
    buffer.position(buffer.position() + skipped);
    return skipped;
  }

  /// The exact number of bytes `serialize` writes for `value`.
  public int sizeOf(@NotNull T value) {
    Objects.requireNonNull(value);
    return coder.encodeSkip(value);
  }

  /// Encode into an array of exactly the encoded length. The array is sized first, so the unchecked path is
  /// used whatever the mode.
  public byte[] toByteArray(@NotNull T value) {
    Objects.requireNonNull(value);
    final byte[] array = new byte[coder.encodeSkip(value)];
    final Bytes rest = coder.encodeUnchecked(value, Bytes.wrap(array));
    assert rest.isEmpty() : coder + " wrote " + (array.length - rest.size()) + " bytes but sized " + array.length;
    return array;
  }

  /// Decode a value that must occupy the whole array.
  /// @throws CodecException with `TRAILING_BYTES` if bytes remain after the value
  public T fromByteArray(byte @NotNull [] array) {
    Objects.requireNonNull(array);
    final Decoded<T> decoded = decode(Bytes.wrap(array), 0);
    if (!decoded.rest().isEmpty()) {
      throw new CodecException(CodecException.Reason.TRAILING_BYTES,
          decoded.rest().size() + " trailing bytes after decoding " + (array.length - decoded.rest().size()) +
              " of " + array.length + " bytes");
    }
    return decoded.value();
  }

  private Decoded<T> decode(Bytes in, int position) {
    if (mode == Mode.SAFE) {
      final Optional<Decoded<T>> decoded = coder.decode(in);
      return decoded.orElseThrow(() -> malformed(in, position));
    }
    return coder.decodeUnchecked(in);
  }

  private CodecException malformed(Bytes in, int position) {
    LOGGER.fine(() -> coder + " found no complete value in " + in.size() + " bytes at position " + position);
    return new CodecException(CodecException.Reason.MALFORMED_INPUT,
        "Truncated or malformed input for " + coder + " in " + in.size() + " bytes at position " + position);
  }

  @Override
  public String toString() {
    return "WireCodec{coder=" + coder + ", mode=" + mode + "}";
  }
}
