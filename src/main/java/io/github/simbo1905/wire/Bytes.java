// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/// A non-owning, bounded view `[start, end)` over a `ByteBuffer`.
///
/// A span never moves the position or limit of the buffer it views. Slicing yields a new span over the
/// same storage, so writes through one span are visible through any other that overlaps it. All indexes
/// taken by the accessors are relative to the start of the span. The get and put accessors do not check the
/// span bounds; the safe coder paths check `size()` before touching the span, the unchecked paths rely on
/// the caller. Slicing is checked, so a slice never reaches past the span it was taken from.
///
/// Multi-byte values are read and written in the platform's native byte order.
public final class Bytes {
  private static final Bytes EMPTY = new Bytes(ByteBuffer.allocate(0).order(ByteOrder.nativeOrder()), 0, 0);

  private final ByteBuffer buffer;
  private final int start;
  private final int end;

  private Bytes(ByteBuffer buffer, int start, int end) {
    this.buffer = buffer;
    this.start = start;
    this.end = end;
  }

  /// View the whole of a heap array.
  public static Bytes wrap(byte @NotNull [] array) {
    return wrap(array, 0, array.length);
  }

  /// View `length` bytes of a heap array starting at `offset`.
  public static Bytes wrap(byte @NotNull [] array, int offset, int length) {
    Objects.requireNonNull(array, "array must not be null");
    Objects.checkFromIndexSize(offset, length, array.length);
    return new Bytes(ByteBuffer.wrap(array).order(ByteOrder.nativeOrder()), offset, offset + length);
  }

  /// View the remaining bytes of a buffer, from its position to its limit. The buffer's own
  /// position, limit and byte order are left untouched.
  public static Bytes of(@NotNull ByteBuffer buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    final ByteBuffer view = buffer.duplicate().order(ByteOrder.nativeOrder());
    return new Bytes(view, buffer.position(), buffer.limit());
  }

  public static Bytes empty() {
    return EMPTY;
  }

  public int size() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  /// Absolute index of the first byte of this span within the viewed buffer.
  public int start() {
    return start;
  }

  /// Absolute index one past the last byte of this span within the viewed buffer.
  public int end() {
    return end;
  }

  /// The suffix of this span starting `offset` bytes in.
  /// @throws IndexOutOfBoundsException if `offset` is negative or past the end of this span
  public Bytes subspan(int offset) {
    Objects.checkFromToIndex(offset, size(), size());
    return new Bytes(buffer, start + offset, end);
  }

  /// The prefix of this span holding its first `count` bytes.
  /// @throws IndexOutOfBoundsException if `count` is negative or larger than this span
  public Bytes first(int count) {
    Objects.checkFromIndexSize(0, count, size());
    return new Bytes(buffer, start, start + count);
  }

  /// The number of bytes between the start of `origin` and the start of this span. Both spans must view
  /// the same buffer; typically `origin` is the span handed to an encode or decode call and this span is
  /// the remainder it returned.
  public int offsetFrom(@NotNull Bytes origin) {
    assert origin.buffer == buffer : "spans view different buffers";
    return start - origin.start;
  }

  public byte get(int index) {
    return buffer.get(start + index);
  }

  public void put(int index, byte value) {
    buffer.put(start + index, value);
  }

  public char getChar(int index) {
    return buffer.getChar(start + index);
  }

  public void putChar(int index, char value) {
    buffer.putChar(start + index, value);
  }

  public short getShort(int index) {
    return buffer.getShort(start + index);
  }

  public void putShort(int index, short value) {
    buffer.putShort(start + index, value);
  }

  public int getInt(int index) {
    return buffer.getInt(start + index);
  }

  public void putInt(int index, int value) {
    buffer.putInt(start + index, value);
  }

  public long getLong(int index) {
    return buffer.getLong(start + index);
  }

  public void putLong(int index, long value) {
    buffer.putLong(start + index, value);
  }

  public float getFloat(int index) {
    return buffer.getFloat(start + index);
  }

  public void putFloat(int index, float value) {
    buffer.putFloat(start + index, value);
  }

  public double getDouble(int index) {
    return buffer.getDouble(start + index);
  }

  public void putDouble(int index, double value) {
    buffer.putDouble(start + index, value);
  }

  /// Copy `dst.length` bytes starting at `index` into `dst`.
  public void get(int index, byte[] dst) {
    buffer.get(start + index, dst);
  }

  /// Copy all of `src` into this span starting at `index`.
  public void put(int index, byte[] src) {
    buffer.put(start + index, src);
  }

  /// Copy the content of this span into a fresh array.
  public byte[] toByteArray() {
    final byte[] copy = new byte[size()];
    buffer.get(start, copy);
    return copy;
  }

  @Override
  public String toString() {
    return "Bytes{start=" + start + ", end=" + end + ", size=" + size() + "}";
  }
}
