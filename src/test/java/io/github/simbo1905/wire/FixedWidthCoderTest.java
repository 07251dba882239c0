// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static io.github.simbo1905.wire.CoderFixture.assertSafeDecodeFailsWhenShort;
import static io.github.simbo1905.wire.CoderFixture.assertSafeEncodeFailsWhenShort;
import static io.github.simbo1905.wire.CoderFixture.decode;
import static io.github.simbo1905.wire.CoderFixture.decodeSkip;
import static io.github.simbo1905.wire.CoderFixture.encode;
import static io.github.simbo1905.wire.CoderFixture.encodeExact;
import static org.assertj.core.api.Assertions.assertThat;

class FixedWidthCoderTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void intIsCopiedInNativeOrder(Mode mode) {
    final byte[] encoded = encodeExact(mode, FixedWidthCoder.INT, 0x01020304);
    assertThat(encoded).hasSize(Integer.BYTES);
    assertThat(ByteBuffer.wrap(encoded).order(ByteOrder.nativeOrder()).getInt()).isEqualTo(0x01020304);
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void everyWidthRoundTrips(Mode mode) {
    assertRoundTrip(mode, FixedWidthCoder.BYTE, (byte) -7);
    assertRoundTrip(mode, FixedWidthCoder.SHORT, (short) -300);
    assertRoundTrip(mode, FixedWidthCoder.CHAR, '€');
    assertRoundTrip(mode, FixedWidthCoder.INT, Integer.MIN_VALUE);
    assertRoundTrip(mode, FixedWidthCoder.LONG, 0x0102030405060708L);
    assertRoundTrip(mode, FixedWidthCoder.FLOAT, 3.25f);
    assertRoundTrip(mode, FixedWidthCoder.DOUBLE, -1.0e300);
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void specialFloatingPointValuesKeepTheirBits(Mode mode) {
    final byte[] nan = encodeExact(mode, FixedWidthCoder.DOUBLE, Double.NaN);
    final double decoded = decode(mode, FixedWidthCoder.DOUBLE, Bytes.wrap(nan)).orElseThrow().value();
    assertThat(decoded).isNaN();
    final byte[] negativeZero = encodeExact(mode, FixedWidthCoder.FLOAT, -0.0f);
    final float zero = decode(mode, FixedWidthCoder.FLOAT, Bytes.wrap(negativeZero)).orElseThrow().value();
    assertThat(Float.floatToRawIntBits(zero)).isEqualTo(Float.floatToRawIntBits(-0.0f));
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void decodeLeavesRemainder(Mode mode) {
    final byte[] array = new byte[Long.BYTES + 3];
    final Bytes out = Bytes.wrap(array);
    final Bytes rest = encode(mode, FixedWidthCoder.LONG, 42L, out).orElseThrow();
    assertThat(rest.offsetFrom(out)).isEqualTo(Long.BYTES);
    final Decoded<Long> decoded = decode(mode, FixedWidthCoder.LONG, Bytes.wrap(array)).orElseThrow();
    assertThat(decoded.value()).isEqualTo(42L);
    assertThat(decoded.rest().size()).isEqualTo(3);
    assertThat(decodeSkip(mode, FixedWidthCoder.LONG, Bytes.wrap(array)).orElseThrow().size()).isEqualTo(3);
  }

  @Test
  void skipLengthIsTheWidth() {
    assertThat(FixedWidthCoder.BYTE.encodeSkip((byte) 0)).isEqualTo(1);
    assertThat(FixedWidthCoder.SHORT.encodeSkip((short) 0)).isEqualTo(2);
    assertThat(FixedWidthCoder.CHAR.encodeSkip('a')).isEqualTo(2);
    assertThat(FixedWidthCoder.INT.encodeSkip(-1)).isEqualTo(4);
    assertThat(FixedWidthCoder.LONG.encodeSkip(Long.MAX_VALUE)).isEqualTo(8);
    assertThat(FixedWidthCoder.FLOAT.encodeSkip(1f)).isEqualTo(4);
    assertThat(FixedWidthCoder.DOUBLE.encodeSkip(1d)).isEqualTo(FixedWidthCoder.DOUBLE.width());
  }

  @Test
  void safePathsFailOnShortBuffers() {
    assertSafeEncodeFailsWhenShort(FixedWidthCoder.LONG, -1L);
    assertSafeEncodeFailsWhenShort(FixedWidthCoder.DOUBLE, 2.5);
    assertSafeEncodeFailsWhenShort(FixedWidthCoder.SHORT, (short) 1);
    assertSafeDecodeFailsWhenShort(FixedWidthCoder.INT, new byte[]{1, 2, 3, 4});
    assertSafeDecodeFailsWhenShort(FixedWidthCoder.FLOAT, new byte[]{1, 2, 3, 4});
  }

  private static <T> void assertRoundTrip(Mode mode, FixedWidthCoder<T> coder, T value) {
    final byte[] encoded = encodeExact(mode, coder, value);
    assertThat(encoded).hasSize(coder.width());
    final Decoded<T> decoded = decode(mode, coder, Bytes.wrap(encoded)).orElseThrow();
    assertThat(decoded.value()).isEqualTo(value);
    assertThat(decoded.rest().isEmpty()).isTrue();
  }
}
