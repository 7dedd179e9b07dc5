// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// A value together with the comment text that followed it in the source document, for example
/// `" # Hello World"`. The comment is kept verbatim, including its leading whitespace and `#`.
///
/// @param value   the wrapped value, formatted by the dispatcher like any other value
/// @param comment the text written straight after the value
public record CommentedValue(Object value, @NotNull String comment) {
  public CommentedValue {
    Objects.requireNonNull(comment, "comment must not be null");
  }

  /// The wrapped value formatted by `session`, followed by the comment.
  ///
  /// Inside an array the comment is closed with a newline so the separator that follows stays outside it.
  /// Inline tables must fit on one line, so there the comment is left out.
  public String dump(EncodingSession session) {
    final String text = session.dumpValue(value);
    return switch (session.position()) {
      case LINE -> text + comment;
      case ARRAY -> text + comment + "\n";
      case INLINE_TABLE -> {
        LOGGER.finer(() -> "Leaving out comment '" + comment + "' inside an inline table");
        yield text;
      }
    };
  }
}
