// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import java.util.Map;
import java.util.Set;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// Flattens a tree of maps into TOML sections.
///
/// [#dumpSections] handles a single table: it writes the assignments that belong directly to the table,
/// expands arrays of tables in place, and hands back the sub-tables it did not write. [#render] drives that
/// layer by layer, so all headers at one depth are written before any header below them and the depth of
/// the document never turns into call stack depth.
final class TableFlattener {

  private final TomlEncoder encoder;

  TableFlattener(TomlEncoder encoder) {
    this.encoder = encoder;
  }

  String render(Map<?, ?> root, EncodingSession session) {
    final var out = new StringBuilder();
    final var top = dumpSections(root, "", session);
    out.append(top.text());

    final Set<Object> history = session.history(root);
    Map<String, Object> sections = top.residual();
    int layer = 0;
    while (!sections.isEmpty()) {
      session.checkLayer(sections.values(), history);
      final int depth = ++layer;
      final int width = sections.size();
      LOGGER.finer(() -> "Expanding layer " + depth + " with " + width + " tables");

      final Map<String, Object> next = encoder.emptyTable();
      for (var entry : sections.entrySet()) {
        final String path = entry.getKey();
        final var sub = dumpSections((Map<?, ?>) entry.getValue(), path, session);
        // a table that only holds sub-tables is implied by their headers
        if (sub.hasText() || sub.residual().isEmpty()) {
          if (out.length() > 0 && !endsWithBlankLine(out)) {
            out.append('\n');
          }
          out.append('[').append(path).append("]\n").append(sub.text());
        }
        sub.residual().forEach((child, table) -> next.put(path + "." + child, table));
      }
      sections = next;
    }
    return out.toString();
  }

  Sections dumpSections(Map<?, ?> table, String sup, EncodingSession session) {
    return session.visit(table, () -> {
      final String prefix = sup.isEmpty() || sup.endsWith(".") ? sup : sup + ".";
      final var text = new StringBuilder();
      final var arrays = new StringBuilder();
      final Map<String, Object> residual = encoder.emptyTable();

      for (var entry : table.entrySet()) {
        final String key = Scalars.key(entry.getKey());
        final Object value = entry.getValue();
        if (value instanceof Map<?, ?> child) {
          if (encoder.preserveInlineTables() && child instanceof InlineTable) {
            text.append(key).append(" = ").append(encoder.formatInlineTable(child, session)).append('\n');
          } else {
            residual.put(key, child);
          }
        } else if (Sequences.containsTable(value)) {
          arrays.append(dumpArrayOfTables(prefix + key, value, session));
        } else if (value != null) {
          text.append(key).append(" = ").append(session.dumpValue(value)).append('\n');
        }
      }
      text.append(arrays);
      return new Sections(text.toString(), residual);
    });
  }

  /// Writes `[[path]]` for every element followed by its own assignments. The element's sub-tables are
  /// expanded with the same layering as [#render], then a blank line closes the element.
  private String dumpArrayOfTables(String path, Object sequence, EncodingSession session) {
    return session.visit(sequence, () -> {
      LOGGER.finer(() -> "Expanding array of tables " + path);
      final var out = new StringBuilder();
      for (Object element : Sequences.elements(sequence)) {
        if (!(element instanceof Map<?, ?> table)) {
          final var msg = "Array of tables '" + path + "' mixes tables with a "
              + (element == null ? "null" : element.getClass().getName()) + " element";
          LOGGER.severe(() -> msg);
          throw new IllegalArgumentException(msg);
        }
        final var trailer = new StringBuilder("\n");
        out.append("[[").append(path).append("]]\n");
        final var own = dumpSections(table, path, session);
        if (own.hasText()) {
          // text that opens with a header holds only nested arrays of tables
          if (own.text().charAt(0) == '[') {
            trailer.append(own.text());
          } else {
            out.append(own.text());
          }
        }

        final Set<Object> history = session.history(table);
        Map<String, Object> sections = own.residual();
        while (!sections.isEmpty()) {
          session.checkLayer(sections.values(), history);
          final Map<String, Object> next = encoder.emptyTable();
          for (var entry : sections.entrySet()) {
            final String relative = entry.getKey();
            final String qualified = path + "." + relative;
            final var sub = dumpSections((Map<?, ?>) entry.getValue(), qualified, session);
            if (sub.hasText()) {
              trailer.append('[').append(qualified).append("]\n").append(sub.text());
            }
            sub.residual().forEach((child, nested) -> next.put(relative + "." + child, nested));
          }
          sections = next;
        }
        out.append(trailer);
      }
      return out.toString();
    });
  }

  private static boolean endsWithBlankLine(CharSequence text) {
    final int n = text.length();
    return n >= 2 && text.charAt(n - 1) == '\n' && text.charAt(n - 2) == '\n';
  }
}
