// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.ByteBuffer;
import java.util.List;

import static io.github.simbo1905.wire.CoderFixture.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireCodecTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  private static final ArrayCoder<String, List<String>> STRINGS = ArrayCoder.listOf(StringCoder.INSTANCE);

  @ParameterizedTest
  @EnumSource(Mode.class)
  void serializeAdvancesPositionBySizeOf(Mode mode) {
    final WireCodec<List<String>> codec = WireCodec.of(STRINGS, mode);
    assertThat(codec.coder()).isSameAs(STRINGS);
    assertThat(codec.mode()).isEqualTo(mode);
    final List<String> value = List.of("alpha", "beta");
    final ByteBuffer buffer = ByteBuffer.allocate(64);
    buffer.position(5);

    final int written = codec.serialize(buffer, value);

    assertThat(written).isEqualTo(codec.sizeOf(value));
    assertThat(buffer.position()).isEqualTo(5 + written);
    buffer.flip().position(5);
    assertThat(codec.deserialize(buffer)).isEqualTo(value);
    assertThat(buffer.hasRemaining()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void valuesFollowOneAnotherInABuffer(Mode mode) {
    final WireCodec<ZigZagLong> longs = WireCodec.of(ZigZagCoder.LONG, mode);
    final WireCodec<String> strings = WireCodec.of(StringCoder.INSTANCE, mode);
    final ByteBuffer buffer = ByteBuffer.allocate(64);
    longs.serialize(buffer, new ZigZagLong(-3));
    strings.serialize(buffer, "skipped");
    longs.serialize(buffer, new ZigZagLong(99));
    buffer.flip();

    assertThat(longs.deserialize(buffer)).isEqualTo(new ZigZagLong(-3));
    assertThat(strings.skip(buffer)).isEqualTo(8);
    assertThat(longs.deserialize(buffer)).isEqualTo(new ZigZagLong(99));
    assertThat(buffer.hasRemaining()).isFalse();
  }

  @ParameterizedTest
  @EnumSource(Mode.class)
  void byteArraysAreExactlySized(Mode mode) {
    final WireCodec<List<Integer>> codec = WireCodec.of(ArrayCoder.listOf(VarintCoder.INT), mode);
    final byte[] encoded = codec.toByteArray(List.of(1, 300));
    assertThat(encoded).containsExactly(0x03, 0x01, 0xAC, 0x02);
    assertThat(codec.fromByteArray(encoded)).containsExactly(1, 300);
  }

  @Test
  void directBuffersWork() {
    final WireCodec<Long> codec = WireCodec.of(VarintCoder.LONG, Mode.SAFE);
    final ByteBuffer buffer = ByteBuffer.allocateDirect(16);
    codec.serialize(buffer, 1L << 40);
    buffer.flip();
    assertThat(codec.deserialize(buffer)).isEqualTo(1L << 40);
  }

  @Nested
  @DisplayName("safe mode failures")
  class SafeFailures {

    private final WireCodec<String> codec = WireCodec.of(StringCoder.INSTANCE, Mode.SAFE);

    @Test
    @DisplayName("too small a buffer is INSUFFICIENT_SPACE and leaves the position alone")
    void insufficientSpace() {
      final ByteBuffer buffer = ByteBuffer.allocate(4);
      buffer.position(1);
      assertThatThrownBy(() -> codec.serialize(buffer, "four"))
          .isInstanceOfSatisfying(CodecException.class,
              e -> assertThat(e.reason()).isEqualTo(CodecException.Reason.INSUFFICIENT_SPACE));
      assertThat(buffer.position()).isEqualTo(1);
    }

    @Test
    @DisplayName("truncated input is MALFORMED_INPUT and leaves the position alone")
    void truncatedInput() {
      final ByteBuffer buffer = ByteBuffer.wrap(bytes(0x05, 'a', 'b'));
      assertThatThrownBy(() -> codec.deserialize(buffer))
          .isInstanceOfSatisfying(CodecException.class,
              e -> assertThat(e.reason()).isEqualTo(CodecException.Reason.MALFORMED_INPUT));
      assertThatThrownBy(() -> codec.skip(buffer)).isInstanceOf(CodecException.class);
      assertThat(buffer.position()).isZero();
    }

    @Test
    @DisplayName("leftover bytes after a whole-array decode are TRAILING_BYTES")
    void trailingBytes() {
      assertThatThrownBy(() -> codec.fromByteArray(bytes(0x01, 'a', 0x00)))
          .isInstanceOfSatisfying(CodecException.class,
              e -> assertThat(e.reason()).isEqualTo(CodecException.Reason.TRAILING_BYTES))
          .hasMessageContaining("1 trailing bytes");
    }
  }

  @Test
  void defaultsToModeFromSystemProperty() {
    final String previous = System.getProperty(Mode.PROPERTY);
    try {
      System.clearProperty(Mode.PROPERTY);
      assertThat(WireCodec.of(BoolCoder.INSTANCE).mode()).isEqualTo(Mode.SAFE);
      System.setProperty(Mode.PROPERTY, "unchecked");
      assertThat(WireCodec.of(BoolCoder.INSTANCE).mode()).isEqualTo(Mode.UNCHECKED);
    } finally {
      if (previous == null) {
        System.clearProperty(Mode.PROPERTY);
      } else {
        System.setProperty(Mode.PROPERTY, previous);
      }
    }
  }

  @Test
  void rejectsUnknownMode() {
    final String previous = System.getProperty(Mode.PROPERTY);
    try {
      System.setProperty(Mode.PROPERTY, "reckless");
      assertThatThrownBy(Mode::current)
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("RECKLESS")
          .hasMessageContaining("[SAFE, UNCHECKED]");
    } finally {
      if (previous == null) {
        System.clearProperty(Mode.PROPERTY);
      } else {
        System.setProperty(Mode.PROPERTY, previous);
      }
    }
  }
}
