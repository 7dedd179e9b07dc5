// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

/// Turns one value into TOML text. Formatters for containers re-enter the dispatcher through
/// [EncodingSession#dumpValue(Object)] so that nested values get the same treatment.
@FunctionalInterface
public interface ValueFormatter<T> {
  String format(T value, EncodingSession session);
}
