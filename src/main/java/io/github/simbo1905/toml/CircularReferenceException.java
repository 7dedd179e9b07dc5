// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

/// Thrown when a table, array or inline table is reachable from itself.
public class CircularReferenceException extends IllegalArgumentException {
  public CircularReferenceException(String message) {
    super(message);
  }
}
