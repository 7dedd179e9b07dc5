// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import java.util.LinkedHashMap;
import java.util.Map;

/// An insertion ordered table that asks to be written as `{ k = v, ... }` on the line of its key instead of
/// under a header of its own. Only encoders with inline table preservation switched on honour the request,
/// the default encoder writes it like any other map.
public class InlineTable extends LinkedHashMap<String, Object> {

  public InlineTable() {
  }

  public InlineTable(Map<String, ?> entries) {
    super(entries);
  }

  /// Copies the entries of any map, converting keys with `String.valueOf`.
  public static InlineTable of(Map<?, ?> entries) {
    final var table = new InlineTable();
    entries.forEach((key, value) -> table.put(String.valueOf(key), value));
    return table;
  }
}
