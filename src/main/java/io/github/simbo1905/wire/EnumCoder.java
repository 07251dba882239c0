// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.github.simbo1905.wire.Coder.LOGGER;

/// Enumerations as varints of their underlying `int` representation.
///
/// Decoding never validates the number: a number with no declared constant decodes to an `EnumValue` whose
/// constant is empty, leaving it to the caller to decide what an unknown value means.
public final class EnumCoder<E extends Enum<E>> implements Coder<EnumValue<E>> {

  private static final VarintCoder<Integer> UNDERLYING = VarintCoder.INT;

  private final Class<E> enumType;
  private final Map<Integer, E> byNumber;

  private EnumCoder(Class<E> enumType) {
    assert enumType.isEnum() : "User type must be an enum: " + enumType;
    this.enumType = enumType;
    final E[] constants = enumType.getEnumConstants();
    final Map<Integer, E> map = new HashMap<>();
    for (E constant : constants) {
      final E previous = map.putIfAbsent(EnumValue.numberOf(constant), constant);
      if (previous != null) {
        throw new IllegalArgumentException("Enum " + enumType.getName() + " constants " + previous + " and " +
            constant + " share the number " + EnumValue.numberOf(constant));
      }
    }
    this.byNumber = Map.copyOf(map);
    LOGGER.fine(() -> "EnumCoder " + enumType.getName() + " maps numbers " +
        Arrays.toString(Arrays.stream(constants).mapToInt(EnumValue::numberOf).toArray()));
  }

  public static <E extends Enum<E>> EnumCoder<E> of(@NotNull Class<E> enumType) {
    Objects.requireNonNull(enumType, "enumType must not be null");
    if (!enumType.isEnum()) {
      throw new IllegalArgumentException("Class must be an enum: " + enumType);
    }
    return new EnumCoder<>(enumType);
  }

  public Class<E> enumType() {
    return enumType;
  }

  /// The value for a raw number, resolved to its constant when one is declared.
  public EnumValue<E> forNumber(int number) {
    return EnumValue.resolved(number, byNumber.get(number));
  }

  @Override
  public Optional<Bytes> encode(EnumValue<E> value, Bytes out) {
    return UNDERLYING.encode(value.number(), out);
  }

  @Override
  public Bytes encodeUnchecked(EnumValue<E> value, Bytes out) {
    return UNDERLYING.encodeUnchecked(value.number(), out);
  }

  @Override
  public Optional<Decoded<EnumValue<E>>> decode(Bytes in) {
    return UNDERLYING.decode(in).map(d -> new Decoded<>(forNumber(d.value()), d.rest()));
  }

  @Override
  public Decoded<EnumValue<E>> decodeUnchecked(Bytes in) {
    final Decoded<Integer> d = UNDERLYING.decodeUnchecked(in);
    return new Decoded<>(forNumber(d.value()), d.rest());
  }

  @Override
  public int encodeSkip(EnumValue<E> value) {
    return UNDERLYING.encodeSkip(value.number());
  }

  @Override
  public Optional<Bytes> decodeSkip(Bytes in) {
    return UNDERLYING.decodeSkip(in);
  }

  @Override
  public Bytes decodeSkipUnchecked(Bytes in) {
    return UNDERLYING.decodeSkipUnchecked(in);
  }

  @Override
  public String toString() {
    return "EnumCoder{enumType=" + enumType.getName() + "}";
  }
}
