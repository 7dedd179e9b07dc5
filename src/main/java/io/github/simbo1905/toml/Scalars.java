// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

import static io.github.simbo1905.toml.TomlEncoder.LOGGER;

/// Pure functions that turn one scalar into its TOML text.
/// Nothing in here knows about tables or arrays.
public final class Scalars {

  static final Pattern BARE_KEY = Pattern.compile("^[A-Za-z0-9_-]+$");

  private static final Pattern UNSIGNED_EXPONENT = Pattern.compile("e(\\d)");
  private static final Pattern EXPONENT_LEADING_ZEROS = Pattern.compile("e([+-])0+(\\d)");
  private static final String BYTE_ESCAPE = "\\x";

  private Scalars() {
  }

  /// Keys matching `[A-Za-z0-9_-]+` are written bare, everything else goes through [#string(String)].
  public static @NotNull String key(Object key) {
    final var text = String.valueOf(key);
    return BARE_KEY.matcher(text).matches() ? text : string(text);
  }

  /// Double-quoted basic string.
  ///
  /// The text is first escaped with byte escapes for control characters (see [#representation(String)]),
  /// then every `\x` is classified by [#rewriteByteEscapes(String)] as either a genuine byte escape
  /// (rewritten to a four digit unicode escape, TOML has no `\x`) or an escaped backslash that is followed
  /// by a literal `x`.
  public static @NotNull String string(@NotNull String value) {
    return '"' + rewriteByteEscapes(representation(value)) + '"';
  }

  /// Escaped form of a string without the surrounding quotes. Backslash, double quote, newline, carriage
  /// return and tab get their two character escapes. Non printable code points below U+0100 become `\xNN`,
  /// above that four or eight digit unicode escapes.
  ///
  /// @throws IllegalArgumentException for a surrogate without its other half, which no TOML escape can carry
  static String representation(String value) {
    final var out = new StringBuilder(value.length() + 8);
    value.codePoints().forEach(cp -> {
      switch (cp) {
        case '\\' -> out.append("\\\\");
        case '"' -> out.append("\\\"");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> {
          if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
            final var msg = String.format("Unpaired surrogate U+%04X cannot be written as TOML", cp);
            LOGGER.severe(() -> msg);
            throw new IllegalArgumentException(msg);
          }
          if (isPrintable(cp)) {
            out.appendCodePoint(cp);
          } else if (cp < 0x100) {
            out.append(String.format("\\x%02x", cp));
          } else if (cp <= 0xFFFF) {
            out.append(String.format("\\u%04x", cp));
          } else {
            out.append(String.format("\\U%08x", cp));
          }
        }
      }
    });
    return out.toString();
  }

  /// Splits on every `\x` and decides for each split point how to join the pieces back together.
  /// Counting the backslashes that run up to the split point: an even count means the backslash of
  /// the `\x` starts an escape, so it is a byte escape and becomes the unicode escape prefix. An odd count
  /// means that backslash is the second half of an escaped backslash and the `x` is literal text.
  static String rewriteByteEscapes(String escaped) {
    final var pieces = escaped.split(Pattern.quote(BYTE_ESCAPE), -1);
    if (pieces.length == 1) {
      return escaped;
    }
    final var out = new StringBuilder(escaped.length() + 2 * pieces.length);
    out.append(pieces[0]);
    for (int i = 1; i < pieces.length; i++) {
      out.append(trailingBackslashes(out) % 2 == 0 ? "\\u00" : BYTE_ESCAPE);
      out.append(pieces[i]);
    }
    return out.toString();
  }

  private static int trailingBackslashes(CharSequence text) {
    int count = 0;
    for (int i = text.length() - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
      count++;
    }
    return count;
  }

  private static boolean isPrintable(int cp) {
    if (cp == ' ') {
      return true;
    }
    return switch (Character.getType(cp)) {
      case Character.CONTROL, Character.FORMAT, Character.PRIVATE_USE, Character.SURROGATE,
          Character.UNASSIGNED, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
          Character.SPACE_SEPARATOR -> false;
      default -> true;
    };
  }

  public static @NotNull String bool(boolean value) {
    return Boolean.toString(value);
  }

  public static @NotNull String integer(@NotNull Number value) {
    if (value instanceof BigInteger || value instanceof BigDecimal) {
      return value.toString();
    }
    return Long.toString(value.longValue());
  }

  /// Floats and decimals. `inf` and `nan` for the non finite doubles, lower case exponent with an explicit
  /// sign and no leading zeros, and `.0` where the text would otherwise parse back as an integer.
  public static @NotNull String floating(@NotNull Number value) {
    if (value instanceof BigDecimal decimal) {
      return normalizeExponent(decimal.toString());
    }
    final double d = value.doubleValue();
    if (Double.isNaN(d)) {
      return "nan";
    }
    if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    }
    final String text = value instanceof Float f ? Float.toString(f) : Double.toString(d);
    return normalizeExponent(text);
  }

  /// `1e+05` becomes `1e+5`, `1.5E-07` becomes `1.5e-7`, `1.0E10` becomes `1.0e+10`.
  static String normalizeExponent(String text) {
    var normalized = text.replace('E', 'e');
    normalized = UNSIGNED_EXPONENT.matcher(normalized).replaceAll("e+$1");
    normalized = EXPONENT_LEADING_ZEROS.matcher(normalized).replaceAll("e$1$2");
    if (normalized.indexOf('.') < 0 && normalized.indexOf('e') < 0) {
      normalized = normalized + ".0";
    }
    return normalized;
  }

  /// Offset date-time, `Z` when the offset is zero.
  public static @NotNull String dateTime(@NotNull OffsetDateTime value) {
    final var offset = value.getOffset();
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value.toLocalDateTime())
        + (offset.getTotalSeconds() == 0 ? "Z" : offset.getId());
  }

  public static @NotNull String dateTime(@NotNull ZonedDateTime value) {
    return dateTime(value.toOffsetDateTime());
  }

  public static @NotNull String dateTime(@NotNull Instant value) {
    return dateTime(value.atOffset(ZoneOffset.UTC));
  }

  public static @NotNull String dateTime(@NotNull LocalDateTime value) {
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
  }

  public static @NotNull String date(@NotNull LocalDate value) {
    return DateTimeFormatter.ISO_LOCAL_DATE.format(value);
  }

  public static @NotNull String time(@NotNull LocalTime value) {
    return DateTimeFormatter.ISO_LOCAL_TIME.format(value);
  }

  /// TOML has no offset times, only local times, so the offset is dropped.
  public static @NotNull String time(@NotNull OffsetTime value) {
    return time(value.toLocalTime());
  }
}
