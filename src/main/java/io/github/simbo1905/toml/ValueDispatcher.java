// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.TestOnly;

import java.util.*;
import java.util.function.Predicate;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// Picks the formatter for a runtime value:
/// 1. exact class lookup,
/// 2. the capability checks in the order they were registered, first match wins,
/// 3. the fallback, which writes `String.valueOf(value)` as a TOML string.
///
/// Instances are immutable. New kinds of values are added through a [Builder] before the dispatcher is built.
public final class ValueDispatcher {

  /// An instance test paired with the formatter to use when it passes
  record Capability(String name, Predicate<Object> test, ValueFormatter<Object> formatter) {
    Capability {
      Objects.requireNonNull(name);
      Objects.requireNonNull(test);
      Objects.requireNonNull(formatter);
    }
  }

  static final ValueFormatter<Object> STRING_FALLBACK = (value, session) -> Scalars.string(String.valueOf(value));

  private final Map<Class<?>, ValueFormatter<Object>> byType;
  private final List<Capability> byCapability;
  private final ValueFormatter<Object> fallback;

  private ValueDispatcher(Map<Class<?>, ValueFormatter<Object>> byType,
                          List<Capability> byCapability,
                          ValueFormatter<Object> fallback) {
    this.byType = Map.copyOf(byType);
    this.byCapability = List.copyOf(byCapability);
    this.fallback = fallback;
  }

  public static Builder builder() {
    return new Builder();
  }

  /// Formatter for the value. Never null, unknown values resolve to the string fallback.
  public @NotNull ValueFormatter<Object> resolve(@Nullable Object value) {
    if (value == null) {
      return fallback;
    }
    final var exact = byType.get(value.getClass());
    if (exact != null) {
      return exact;
    }
    for (Capability capability : byCapability) {
      if (capability.test().test(value)) {
        LOGGER.finest(() -> value.getClass().getName() + " matched capability " + capability.name());
        return capability.formatter();
      }
    }
    LOGGER.finest(() -> value.getClass().getName() + " has no formatter, writing it as a string");
    return fallback;
  }

  public String format(@Nullable Object value, @NotNull EncodingSession session) {
    return resolve(value).format(value, session);
  }

  @TestOnly
  boolean handlesExactly(Class<?> type) {
    return byType.containsKey(type);
  }

  @TestOnly
  List<String> capabilityNames() {
    return byCapability.stream().map(Capability::name).toList();
  }

  public static final class Builder {
    private final Map<Class<?>, ValueFormatter<Object>> byType = new HashMap<>();
    private final List<Capability> byCapability = new ArrayList<>();
    private ValueFormatter<Object> fallback = STRING_FALLBACK;

    private Builder() {
    }

    /// Registers a formatter for exactly this class, subclasses are not matched. A later registration
    /// for the same class replaces the earlier one.
    public <T> Builder byType(@NotNull Class<T> type, @NotNull ValueFormatter<? super T> formatter) {
      Objects.requireNonNull(type, "type must not be null");
      byType.put(type, erase(Objects.requireNonNull(formatter, "formatter must not be null")));
      return this;
    }

    /// Appends an `instanceof` check. Checks run in registration order after the exact lookup missed.
    public <T> Builder byCapability(@NotNull Class<T> type, @NotNull ValueFormatter<? super T> formatter) {
      Objects.requireNonNull(type, "type must not be null");
      return byCapability(type.getName(), type::isInstance, erase(formatter));
    }

    /// Appends an arbitrary check, for the cases `instanceof` cannot express such as arrays of any component type.
    public Builder byCapability(@NotNull String name, @NotNull Predicate<Object> test, @NotNull ValueFormatter<Object> formatter) {
      byCapability.add(new Capability(name, test, formatter));
      return this;
    }

    public Builder fallback(@NotNull ValueFormatter<Object> formatter) {
      this.fallback = Objects.requireNonNull(formatter, "formatter must not be null");
      return this;
    }

    public ValueDispatcher build() {
      return new ValueDispatcher(byType, byCapability, fallback);
    }

    @SuppressWarnings("unchecked")
    private static ValueFormatter<Object> erase(ValueFormatter<?> formatter) {
      return (ValueFormatter<Object>) formatter;
    }
  }
}
