// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// Joins array elements with a custom separator, for example `",\t"` or `",\n"`.
/// The separator is one comma with optional whitespace around it. A separator that is only whitespace gets a
/// comma put in front of it. The no-argument constructor reads the separator from the system property
/// `io.github.simbo1905.toml.ArraySeparator` and defaults to `","`.
public class ArraySeparatorEncoder extends TomlEncoder {

  public static final String SEPARATOR_PROPERTY = "io.github.simbo1905.toml.ArraySeparator";

  private final String separator;

  public ArraySeparatorEncoder() {
    this(System.getProperty(SEPARATOR_PROPERTY, ","));
  }

  public ArraySeparatorEncoder(@NotNull String separator) {
    this(separator, Options.defaults());
  }

  /// @throws IllegalArgumentException if the separator is anything other than a comma and whitespace
  public ArraySeparatorEncoder(@NotNull String separator, @NotNull Options options) {
    super(options);
    this.separator = normalize(separator);
  }

  static String normalize(String separator) {
    Objects.requireNonNull(separator, "separator must not be null");
    if (separator.isBlank()) {
      return "," + separator;
    }
    if (!separator.strip().equals(",")) {
      final var msg = "Invalid separator for arrays: '" + separator + "'";
      LOGGER.severe(() -> msg);
      throw new IllegalArgumentException(msg);
    }
    return separator;
  }

  public String separator() {
    return separator;
  }

  @Override
  protected String formatList(Object sequence, EncodingSession session) {
    return session.visit(sequence, () -> session.within(EncodingSession.Position.ARRAY, () -> {
      final var out = new StringBuilder("[");
      for (Object element : Sequences.elements(sequence)) {
        out.append(' ').append(session.dumpValue(element)).append(separator);
      }
      return out.append(']').toString();
    }));
  }
}
