// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import java.lang.reflect.Array;
import java.util.*;
import java.util.stream.IntStream;

/// Uniform element access over collections, iterables and Java arrays, primitive arrays included.
final class Sequences {

  private Sequences() {
  }

  /// Values that may become an array of tables. Other iterables such as `Path` are left to the dispatcher.
  static boolean isSequence(Object value) {
    return value instanceof Collection<?> || value instanceof Object[];
  }

  static boolean isArray(Object value) {
    return value != null && value.getClass().isArray();
  }

  static Iterable<?> elements(Object sequence) {
    if (sequence instanceof Iterable<?> iterable) {
      return iterable;
    }
    if (isArray(sequence)) {
      return IntStream.range(0, Array.getLength(sequence))
          .mapToObj(i -> Array.get(sequence, i))
          .toList();
    }
    throw new IllegalArgumentException("Not a sequence: " + sequence.getClass().getName());
  }

  /// A sequence with at least one map in it is written as an array of tables.
  static boolean containsTable(Object value) {
    if (!isSequence(value)) {
      return false;
    }
    for (Object element : elements(value)) {
      if (element instanceof Map<?, ?>) {
        return true;
      }
    }
    return false;
  }
}
