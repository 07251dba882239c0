// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;

/// An enumeration value as it exists on the wire: its number, and the constant with that number if one is
/// declared. Numbers with no declared constant are kept so that they survive a decode and re-encode.
///
/// Values come from `EnumValue.of` for a declared constant or from `EnumCoder.forNumber` for a raw number, so
/// the constant is always the one the coder resolves the number to and a decoded value equals the value that
/// was encoded.
public final class EnumValue<E extends Enum<E>> {
  private final int number;
  private final E constant;

  private EnumValue(int number, E constant) {
    this.number = number;
    this.constant = constant;
  }

  /// The value of a declared constant.
  public static <E extends Enum<E>> EnumValue<E> of(@NotNull E constant) {
    Objects.requireNonNull(constant, "constant must not be null");
    return new EnumValue<>(numberOf(constant), constant);
  }

  /// A number as resolved by an `EnumCoder`, with `constant` null when no constant carries it.
  static <E extends Enum<E>> EnumValue<E> resolved(int number, E constant) {
    if (constant != null && numberOf(constant) != number) {
      throw new IllegalArgumentException("Constant " + constant + " carries number " + numberOf(constant) +
          " not " + number);
    }
    return new EnumValue<>(number, constant);
  }

  /// The underlying number of a constant: `WireEnum.number()` where the enum declares it, otherwise its
  /// ordinal.
  public static int numberOf(@NotNull Enum<?> constant) {
    return constant instanceof WireEnum wireEnum ? wireEnum.number() : constant.ordinal();
  }

  /// The underlying integral representation.
  public int number() {
    return number;
  }

  /// The declared constant with this number, or empty for an unknown number.
  public Optional<E> constant() {
    return Optional.ofNullable(constant);
  }

  public boolean isKnown() {
    return constant != null;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EnumValue<?> that)) return false;
    return number == that.number && Objects.equals(constant, that.constant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(number, constant);
  }

  @Override
  public String toString() {
    return "EnumValue[number=" + number + ", constant=" + constant() + "]";
  }
}
