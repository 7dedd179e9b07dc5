// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/// Adds the narrow and mutable number types to the exact type table. Without this encoder they have no
/// formatter and are written as quoted strings.
public class NumericTypesEncoder extends TomlEncoder {

  public NumericTypesEncoder() {
    this(Options.defaults());
  }

  public NumericTypesEncoder(@NotNull Options options) {
    super(options.withExtension(NumericTypesEncoder::registerNumericTypes));
  }

  public static void registerNumericTypes(ValueDispatcher.Builder builder) {
    builder
        .byType(Byte.class, (value, session) -> Scalars.integer(value))
        .byType(Short.class, (value, session) -> Scalars.integer(value))
        .byType(AtomicInteger.class, (value, session) -> Scalars.integer(value))
        .byType(AtomicLong.class, (value, session) -> Scalars.integer(value))
        .byType(LongAdder.class, (value, session) -> Scalars.integer(value))
        .byType(Float.class, (value, session) -> Scalars.floating(value))
        .byType(DoubleAdder.class, (value, session) -> Scalars.floating(value));
  }
}
