// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.wire;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/// An ordered collection as a length prefix followed by its elements, each in its own coder's encoding.
///
/// The prefix is the sum of the elements' `encodeSkip` lengths, so no trial encoding takes place. Decoding
/// appends elements with `Collection.add` in wire order until the declared length is used up. The container
/// must keep insertion order and must not drop duplicates for a round trip to give back an equal value; a
/// `List` does both.
///
/// @param <E> the element type
/// @param <R> the container type
public final class ArrayCoder<E, R extends Collection<E>> extends LengthPrefixedCoder<R> {

  private final Coder<E> element;
  private final Supplier<R> containerFactory;

  private ArrayCoder(Coder<E> element, Supplier<R> containerFactory) {
    this.element = element;
    this.containerFactory = containerFactory;
  }

  /// A coder for containers of `element` values, created empty by `containerFactory` when decoding.
  public static <E, R extends Collection<E>> ArrayCoder<E, R> of(@NotNull Coder<E> element,
                                                                 @NotNull Supplier<R> containerFactory) {
    Objects.requireNonNull(element, "element coder must not be null");
    Objects.requireNonNull(containerFactory, "containerFactory must not be null");
    return new ArrayCoder<>(element, containerFactory);
  }

  /// A coder that decodes into an `ArrayList`.
  public static <E> ArrayCoder<E, List<E>> listOf(@NotNull Coder<E> element) {
    return of(element, ArrayList::new);
  }

  public Coder<E> element() {
    return element;
  }

  @Override
  int payloadLength(R value) {
    int length = 0;
    for (E e : value) {
      length = Math.addExact(length, element.encodeSkip(e));
    }
    return length;
  }

  @Override
  Optional<Bytes> encodePayload(R value, Bytes out) {
    Bytes rest = out;
    for (E e : value) {
      final Optional<Bytes> next = element.encode(e, rest);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      rest = next.get();
    }
    return Optional.of(rest);
  }

  @Override
  Bytes encodePayloadUnchecked(R value, Bytes out) {
    Bytes rest = out;
    for (E e : value) {
      rest = element.encodeUnchecked(e, rest);
    }
    return rest;
  }

  @Override
  Optional<R> decodePayload(Bytes payload) {
    final R container = containerFactory.get();
    Bytes rest = payload;
    while (!rest.isEmpty()) {
      final Optional<Decoded<E>> next = element.decode(rest);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      container.add(next.get().value());
      rest = next.get().rest();
    }
    return Optional.of(container);
  }

  @Override
  R decodePayloadUnchecked(Bytes payload) {
    final R container = containerFactory.get();
    Bytes rest = payload;
    while (!rest.isEmpty()) {
      final Decoded<E> next = element.decodeUnchecked(rest);
      container.add(next.value());
      rest = next.rest();
    }
    return container;
  }

  @Override
  public String toString() {
    return "ArrayCoder{element=" + element + "}";
  }
}
