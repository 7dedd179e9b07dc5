// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

import java.io.File;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.InetAddress;
import java.nio.file.Path;
import java.time.*;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Extendable TOML encoder.
///
/// An encoder is a container factory, the inline table switch and a [ValueDispatcher] built once in the
/// constructor. Variants change behaviour by passing [Options] to this constructor or by overriding
/// [#formatList] and [#formatInlineTable]; the flattening itself is never touched.
public class TomlEncoder {

  public static final Logger LOGGER = Logger.getLogger(TomlEncoder.class.getName());

  /// Container factory, inline table switch and extra dispatcher registrations.
  public record Options(
      @NotNull Supplier<? extends Map<String, Object>> containerFactory,
      boolean preserveInlineTables,
      @NotNull List<Consumer<ValueDispatcher.Builder>> extensions) {

    public Options {
      Objects.requireNonNull(containerFactory, "containerFactory must not be null");
      extensions = List.copyOf(extensions);
    }

    public static Options defaults() {
      return new Options(LinkedHashMap::new, false, List.of());
    }

    public Options withContainerFactory(@NotNull Supplier<? extends Map<String, Object>> factory) {
      return new Options(factory, preserveInlineTables, extensions);
    }

    public Options withPreserveInlineTables(boolean preserve) {
      return new Options(containerFactory, preserve, extensions);
    }

    /// Adds registrations applied after the built-in ones, so an extension may replace a built-in exact type.
    public Options withExtension(@NotNull Consumer<ValueDispatcher.Builder> extension) {
      final var all = new ArrayList<>(extensions);
      all.add(Objects.requireNonNull(extension, "extension must not be null"));
      return new Options(containerFactory, preserveInlineTables, all);
    }
  }

  private final Supplier<? extends Map<String, Object>> containerFactory;
  private final boolean preserveInlineTables;
  private final ValueDispatcher dispatcher;
  private final TableFlattener flattener = new TableFlattener(this);

  public TomlEncoder() {
    this(Options.defaults());
  }

  public TomlEncoder(@NotNull Supplier<? extends Map<String, Object>> containerFactory) {
    this(Options.defaults().withContainerFactory(containerFactory));
  }

  public TomlEncoder(@NotNull Options options) {
    Objects.requireNonNull(options, "options must not be null");
    this.containerFactory = options.containerFactory();
    this.preserveInlineTables = options.preserveInlineTables();
    final var builder = ValueDispatcher.builder()
        .byType(String.class, (value, session) -> Scalars.string(value))
        .byType(Character.class, (value, session) -> Scalars.string(String.valueOf(value)))
        .byType(Boolean.class, (value, session) -> Scalars.bool(value))
        .byType(Integer.class, (value, session) -> Scalars.integer(value))
        .byType(Long.class, (value, session) -> Scalars.integer(value))
        .byType(BigInteger.class, (value, session) -> Scalars.integer(value))
        .byType(Double.class, (value, session) -> Scalars.floating(value))
        .byType(BigDecimal.class, (value, session) -> Scalars.floating(value))
        .byType(OffsetDateTime.class, (value, session) -> Scalars.dateTime(value))
        .byType(ZonedDateTime.class, (value, session) -> Scalars.dateTime(value))
        .byType(Instant.class, (value, session) -> Scalars.dateTime(value))
        .byType(LocalDateTime.class, (value, session) -> Scalars.dateTime(value))
        .byType(LocalDate.class, (value, session) -> Scalars.date(value))
        .byType(LocalTime.class, (value, session) -> Scalars.time(value))
        .byType(OffsetTime.class, (value, session) -> Scalars.time(value))
        .byType(ArrayList.class, this::formatList)
        .byCapability(Path.class, (value, session) -> Scalars.string(value.toString()))
        .byCapability(File.class, (value, session) -> Scalars.string(value.getPath()))
        .byCapability(Enum.class, (value, session) -> Scalars.string(value.name()))
        .byCapability(InetAddress.class, (value, session) -> Scalars.string(value.getHostAddress()))
        .byCapability(Map.class, this::formatInlineTable)
        .byCapability(Iterable.class, this::formatList)
        .byCapability("array", Sequences::isArray, this::formatList);
    options.extensions().forEach(extension -> extension.accept(builder));
    this.dispatcher = builder.build();
  }

  /// Encoder whose layer maps are instances of the given map class, falling back to [LinkedHashMap]
  /// when the class has no public no-argument constructor.
  public static TomlEncoder forContainer(@NotNull Class<?> mapType) {
    return new TomlEncoder(containerFactory(mapType));
  }

  @SuppressWarnings("unchecked")
  static Supplier<? extends Map<String, Object>> containerFactory(Class<?> mapType) {
    if (!Map.class.isAssignableFrom(mapType)) {
      final var msg = "Container type must be a java.util.Map but was " + mapType.getName();
      LOGGER.severe(() -> msg);
      throw new IllegalArgumentException(msg);
    }
    final MethodHandle constructor;
    try {
      constructor = MethodHandles.publicLookup().findConstructor(mapType, MethodType.methodType(void.class));
    } catch (NoSuchMethodException | IllegalAccessException e) {
      LOGGER.finer(() -> mapType.getName() + " cannot be constructed (" + e.getClass().getSimpleName()
          + "), using LinkedHashMap for intermediate tables");
      return LinkedHashMap::new;
    }
    return () -> {
      try {
        return (Map<String, Object>) constructor.invoke();
      } catch (Throwable e) {
        final var msg = "Failed to create an empty " + mapType.getName() + ": " + e.getMessage();
        LOGGER.severe(() -> msg);
        throw new IllegalStateException(msg, e);
      }
    };
  }

  /// Renders a whole document.
  /// @throws CircularReferenceException when a container is reachable from itself
  public @NotNull String encode(@NotNull Map<?, ?> table) {
    Objects.requireNonNull(table, "table must not be null");
    LOGGER.fine(() -> "Encoding table with " + table.size() + " keys using " + getClass().getSimpleName());
    final String text = flattener.render(table, new EncodingSession(this));
    LOGGER.fine(() -> "Encoded " + text.length() + " characters");
    return text;
  }

  /// Formats a single value the way it would appear on the right hand side of an assignment.
  public @NotNull String dumpValue(Object value) {
    return new EncodingSession(this).dumpValue(value);
  }

  /// A new, empty intermediate table from the container factory.
  public @NotNull Map<String, Object> emptyTable() {
    return containerFactory.get();
  }

  public boolean preserveInlineTables() {
    return preserveInlineTables;
  }

  public @NotNull ValueDispatcher dispatcher() {
    return dispatcher;
  }

  /// `[ a, b, c,]`, the trailing comma is valid TOML. An empty sequence is `[]`.
  protected String formatList(Object sequence, EncodingSession session) {
    return session.visit(sequence, () -> session.within(EncodingSession.Position.ARRAY, () -> {
      final var out = new StringBuilder("[");
      for (Object element : Sequences.elements(sequence)) {
        out.append(' ').append(session.dumpValue(element)).append(',');
      }
      return out.append(']').toString();
    }));
  }

  /// `{ k = v, ... }` on one line. Nested maps come back through the dispatcher and are inlined too.
  protected String formatInlineTable(Map<?, ?> table, EncodingSession session) {
    return session.visit(table, () -> session.within(EncodingSession.Position.INLINE_TABLE, () -> {
      final var pairs = new StringJoiner(", ", "{ ", " }");
      table.forEach((key, value) -> {
        if (value != null) {
          pairs.add(Scalars.key(key) + " = " + session.dumpValue(value));
        }
      });
      return pairs.toString();
    }));
  }
}
