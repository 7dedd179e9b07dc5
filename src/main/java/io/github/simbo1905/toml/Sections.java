// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import java.util.Map;
import java.util.Objects;

/// Result of flattening one table: the assignment text written at this level, and the sub-tables
/// (keyed by their quoted key relative to this table) that still need a header of their own.
record Sections(String text, Map<String, Object> residual) {
  Sections {
    Objects.requireNonNull(text);
    Objects.requireNonNull(residual);
  }

  boolean hasText() {
    return !text.isEmpty();
  }
}
