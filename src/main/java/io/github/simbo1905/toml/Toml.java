// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// Entry points for writing TOML.
///
/// ```java
/// var config = new LinkedHashMap<String, Object>();
/// config.put("title", "example");
/// config.put("owner", Map.of("name", "Tom"));
/// String text = Toml.dumps(config);
/// // title = "example"
/// //
/// // [owner]
/// // name = "Tom"
/// ```
public final class Toml {

  private Toml() {
  }

  /// Renders with an encoder whose intermediate tables have the same class as `table`.
  public static @NotNull String dumps(@NotNull Map<?, ?> table) {
    return dumps(table, null);
  }

  public static @NotNull String dumps(@NotNull Map<?, ?> table, @Nullable TomlEncoder encoder) {
    Objects.requireNonNull(table, "table must not be null");
    final var effective = encoder != null ? encoder : TomlEncoder.forContainer(table.getClass());
    return effective.encode(table);
  }

  /// Renders `table` and writes it to `out`.
  ///
  /// `out` may be a path given as `byte[]` (UTF-8), `String`, [Path] or [File], which is written as UTF-8,
  /// or an [Appendable] such as a `Writer`, or an [OutputStream] which receives UTF-8 bytes and is flushed
  /// but not closed. The document is rendered completely before anything is written.
  ///
  /// @return the text that was written
  /// @throws IllegalArgumentException if `out` is none of the above
  /// @throws UncheckedIOException if the write fails
  public static @NotNull String dump(@NotNull Map<?, ?> table, Object out) {
    return dump(table, out, null);
  }

  public static @NotNull String dump(@NotNull Map<?, ?> table, Object out, @Nullable TomlEncoder encoder) {
    final Object destination = resolve(out);
    final String text = dumps(table, encoder);
    try {
      if (destination instanceof Path path) {
        Files.writeString(path, text, StandardCharsets.UTF_8);
      } else if (destination instanceof Appendable appendable) {
        appendable.append(text);
      } else {
        final var stream = (OutputStream) destination;
        stream.write(text.getBytes(StandardCharsets.UTF_8));
        stream.flush();
      }
    } catch (IOException e) {
      final var msg = "Failed to write TOML to " + destination + ": " + e.getMessage();
      LOGGER.severe(() -> msg);
      throw new UncheckedIOException(msg, e);
    }
    return text;
  }

  /// Normalises the destination to a [Path], an [Appendable] or an [OutputStream].
  static Object resolve(Object out) {
    Object destination = out;
    if (destination instanceof byte[] bytes) {
      destination = new String(bytes, StandardCharsets.UTF_8);
    }
    if (destination instanceof String name) {
      destination = Path.of(name);
    }
    if (destination instanceof File file) {
      destination = file.toPath();
    }
    if (destination instanceof Path || destination instanceof Appendable || destination instanceof OutputStream) {
      final var resolved = destination;
      LOGGER.fine(() -> "Writing TOML to " + resolved.getClass().getSimpleName() + " " + resolved);
      return destination;
    }
    final var msg = "'out' must be a path, file, writer or output stream but was "
        + (out == null ? "null" : out.getClass().getName());
    LOGGER.severe(() -> msg);
    throw new IllegalArgumentException(msg);
  }
}
