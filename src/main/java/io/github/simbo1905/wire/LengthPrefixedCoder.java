// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import java.util.Optional;

import static io.github.simbo1905.wire.Coder.LOGGER;

/// The wire form shared by repeated fields, strings and byte strings:
/// `varint(payload length) || payload`.
///
/// The prefix counts payload bytes only, never itself. The payload length is worked out by subclasses without
/// writing anything, so the prefix can go out before the payload. On decode the payload is sliced to exactly
/// the declared length before subclasses see it, so a payload can neither stop short of the declared length
/// nor run past it.
public abstract sealed class LengthPrefixedCoder<R> implements Coder<R>
    permits ArrayCoder, StringCoder, BytesCoder {

  private static final VarintCoder<Long> LENGTH = VarintCoder.LONG;

  LengthPrefixedCoder() {
  }

  /// The number of payload bytes `value` encodes to, excluding the length prefix.
  abstract int payloadLength(R value);

  abstract Optional<Bytes> encodePayload(R value, Bytes out);

  abstract Bytes encodePayloadUnchecked(R value, Bytes out);

  /// Decode a value from a span holding exactly its payload.
  abstract Optional<R> decodePayload(Bytes payload);

  abstract R decodePayloadUnchecked(Bytes payload);

  @Override
  public final Optional<Bytes> encode(R value, Bytes out) {
    final long length = payloadLength(value);
    return LENGTH.encode(length, out).flatMap(rest -> encodePayload(value, rest));
  }

  @Override
  public final Bytes encodeUnchecked(R value, Bytes out) {
    final long length = payloadLength(value);
    return encodePayloadUnchecked(value, LENGTH.encodeUnchecked(length, out));
  }

  @Override
  public final Optional<Decoded<R>> decode(Bytes in) {
    final Optional<Decoded<Long>> prefix = LENGTH.decode(in);
    if (prefix.isEmpty()) {
      LOGGER.finer(() -> this + " length prefix truncated in " + in);
      return Optional.empty();
    }
    final long declared = prefix.get().value();
    final Bytes rest = prefix.get().rest();
    if (declared < 0 || declared > rest.size()) {
      LOGGER.finer(() -> this + " declared length " + Long.toUnsignedString(declared) + " exceeds the " +
          rest.size() + " bytes remaining");
      return Optional.empty();
    }
    final int length = (int) declared;
    final Optional<R> value = decodePayload(rest.first(length));
    if (value.isEmpty()) {
      LOGGER.finer(() -> this + " payload of " + length + " bytes is malformed");
    }
    return value.map(v -> new Decoded<>(v, rest.subspan(length)));
  }

  @Override
  public final Decoded<R> decodeUnchecked(Bytes in) {
    final Decoded<Long> prefix = LENGTH.decodeUnchecked(in);
    final int length = (int) (long) prefix.value();
    final Bytes rest = prefix.rest();
    return new Decoded<>(decodePayloadUnchecked(rest.first(length)), rest.subspan(length));
  }

  @Override
  public final int encodeSkip(R value) {
    final int length = payloadLength(value);
    return Math.addExact(length, LENGTH.encodeSkip((long) length));
  }

  @Override
  public final Optional<Bytes> decodeSkip(Bytes in) {
    final Optional<Decoded<Long>> prefix = LENGTH.decode(in);
    if (prefix.isEmpty()) {
      return Optional.empty();
    }
    final long declared = prefix.get().value();
    final Bytes rest = prefix.get().rest();
    if (declared < 0 || declared > rest.size()) {
      return Optional.empty();
    }
    return Optional.of(rest.subspan((int) declared));
  }

  @Override
  public final Bytes decodeSkipUnchecked(Bytes in) {
    final Decoded<Long> prefix = LENGTH.decodeUnchecked(in);
    return prefix.rest().subspan((int) (long) prefix.value());
  }
}
