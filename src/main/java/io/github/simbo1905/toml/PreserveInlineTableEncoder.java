// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

/// Writes [InlineTable] values as `key = { ... }` instead of giving them their own `[key]` section.
public class PreserveInlineTableEncoder extends TomlEncoder {

  public PreserveInlineTableEncoder() {
    this(Options.defaults());
  }

  public PreserveInlineTableEncoder(@NotNull Options options) {
    super(options.withPreserveInlineTables(true));
  }
}
