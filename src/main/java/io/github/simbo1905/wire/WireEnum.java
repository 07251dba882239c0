// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

/// Implemented by enums that declare their own wire numbers rather than relying on declaration order.
///
/// ```java
/// enum Color implements WireEnum {
///   RED(0), GREEN(1), BLUE(128);
///   private final int number;
///   Color(int number) { this.number = number; }
///   public int number() { return number; }
/// }
/// ```
public interface WireEnum {

  /// The integral value that represents this constant on the wire.
  int number();
}
