// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

/// Writes [CommentedValue] wrappers as their value followed by the stored comment, so a document read with
/// its comments retained comes back out with the comments where they were.
public class PreserveCommentEncoder extends TomlEncoder {

  public PreserveCommentEncoder() {
    this(Options.defaults());
  }

  public PreserveCommentEncoder(@NotNull Options options) {
    super(options.withExtension(PreserveCommentEncoder::registerComments));
  }

  public static void registerComments(ValueDispatcher.Builder builder) {
    builder.byType(CommentedValue.class, (value, session) -> value.dump(session));
  }
}
