// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.util.*;
import java.util.function.Supplier;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// State for one render. Created per call and thrown away afterwards, so an encoder can be shared
/// between threads while each render keeps its own bookkeeping.
///
/// Two identity based guards stop cyclic input:
/// - the in-progress set holds every container currently being flattened or formatted, re-entering one is a cycle,
/// - layer histories hold every table already expanded by a layering loop, seeing one again in a later layer is a cycle.
public final class EncodingSession {

  /// Where the value being formatted will sit in the output.
  public enum Position {
    /// Right hand side of a `key = value` line.
    LINE,
    /// Element of an array, which may span lines.
    ARRAY,
    /// Value inside `{ ... }`, which must stay on one line.
    INLINE_TABLE
  }

  private final TomlEncoder encoder;
  private final Set<Object> inProgress = identitySet();
  private final Deque<Position> positions = new ArrayDeque<>();

  EncodingSession(@NotNull TomlEncoder encoder) {
    this.encoder = Objects.requireNonNull(encoder);
  }

  public @NotNull TomlEncoder encoder() {
    return encoder;
  }

  /// Formats a value with the encoder's dispatcher.
  public @NotNull String dumpValue(@Nullable Object value) {
    return encoder.dispatcher().format(value, this);
  }

  /// Runs `body` with `container` marked as in progress.
  /// @throws CircularReferenceException if the container is already being written further up
  public <T> T visit(@NotNull Object container, @NotNull Supplier<T> body) {
    if (!inProgress.add(container)) {
      throw circular("a " + container.getClass().getSimpleName() + " contains itself");
    }
    try {
      return body.get();
    } finally {
      inProgress.remove(container);
    }
  }

  /// Runs `body` with values written at `position` until it returns.
  public <T> T within(@NotNull Position position, @NotNull Supplier<T> body) {
    positions.push(Objects.requireNonNull(position));
    try {
      return body.get();
    } finally {
      positions.pop();
    }
  }

  /// Innermost position, [Position#LINE] outside any array or inline table.
  public @NotNull Position position() {
    final var innermost = positions.peek();
    return innermost == null ? Position.LINE : innermost;
  }

  /// A fresh history for a layering loop, seeded with the container the loop starts from.
  Set<Object> history(Object origin) {
    final var history = identitySet();
    history.add(origin);
    return history;
  }

  /// Checks the tables of the next layer against everything expanded in earlier layers, then records them.
  /// Tables repeated within the same layer are allowed.
  void checkLayer(Collection<?> tables, Set<Object> history) {
    for (Object table : tables) {
      if (history.contains(table)) {
        throw circular("a table is reachable from one of its own sub-tables");
      }
    }
    history.addAll(tables);
  }

  @TestOnly
  int depth() {
    return inProgress.size();
  }

  private static CircularReferenceException circular(String detail) {
    final var msg = "Circular reference detected: " + detail;
    LOGGER.severe(() -> msg);
    return new CircularReferenceException(msg);
  }

  private static Set<Object> identitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }
}
