// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.toml;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.toml.TableFlattenerTests.table;
import static org.assertj.core.api.Assertions.assertThat;

/// Output is read back with tomlj and compared with what went in.
public class RoundTripTests {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  static Map<String, Object> roundTrip(Map<String, Object> doc, TomlEncoder encoder) {
    return TomljSupport.decode(Toml.dumps(doc, encoder));
  }

  static Map<String, Object> roundTrip(Map<String, Object> doc) {
    return TomljSupport.decode(Toml.dumps(doc));
  }

  @Test
  void nestedTablesAndArraysOfTables() {
    final var doc = table(
        "title", "TOML Example",
        "owner", table("name", "Tom", "bio", table("born", "1979")),
        "servers", List.of(
            table("ip", "10.0.0.1", "role", "frontend"),
            table("ip", "10.0.0.2", "meta", table("dc", "eqdc10", "rack", table("row", 4L)))),
        "deep", table("a", table("b", table("c", 1L))),
        "empty", table(),
        "groups", List.of(table("inner", List.of(table("k", 1L), table("k", 2L)))));
    assertThat(roundTrip(doc)).isEqualTo(doc);
  }

  @Test
  @DisplayName("Encoding the decoded document gives the same text")
  void secondPassIsByteIdentical() {
    final var doc = table("arr", List.of(table("x", 1), table("x", 2, "y", table("z", 3))));
    final String first = Toml.dumps(doc);
    assertThat(Toml.dumps(TomljSupport.decode(first))).isEqualTo(first);
  }

  @Test
  void secondPassIsByteIdenticalForMixedNesting() {
    final var doc = table(
        "title", "x",
        "a", List.of(table("x", 1L), table("x", 2L, "y", table("z", 3L))),
        "b", table("c", List.of(1L, 2L), "d", table("e", "f", "g", List.of(table("h", true)))),
        "deep", table("p", table("q", table("r", 0.5))));
    final String first = Toml.dumps(doc);
    assertThat(Toml.dumps(TomljSupport.decode(first))).isEqualTo(first);
  }

  @Test
  void strings() {
    final List<String> samples = List.of(
        "plain", "",
        "\\x64", "\\\\x64", "\\\u0001",
        "a\u0001b", "\u001f", "\u007f", " ", "\u00a0", "\u2028",
        "tab\there", "line\nbreak", "cr\rlf",
        "quote \" inside", "back\\slash", "I'm",
        "café", "😀");
    for (String sample : samples) {
      assertThat(roundTrip(table("s", sample)).get("s")).as("round trip of %s", Scalars.string(sample))
          .isEqualTo(sample);
    }
  }

  @Test
  void keysThatNeedQuoting() {
    final var doc = table("a b", 1L, "a.b", table("c d", "x"), "ok-key_1", true);
    assertThat(roundTrip(doc)).isEqualTo(doc);
  }

  @Test
  void numbers() {
    final var decoded = roundTrip(table(
        "int", 42,
        "long", Long.MAX_VALUE,
        "half", 0.5,
        "small", 1.0e-5,
        "large", 1.0e22,
        "tenth", new BigDecimal("0.1"),
        "whole", new BigDecimal("10"),
        "nan", Double.NaN,
        "inf", Double.POSITIVE_INFINITY,
        "ninf", Double.NEGATIVE_INFINITY));
    assertThat(decoded).containsEntry("int", 42L)
        .containsEntry("long", Long.MAX_VALUE)
        .containsEntry("half", 0.5)
        .containsEntry("small", 1.0e-5)
        .containsEntry("large", 1.0e22)
        .containsEntry("tenth", 0.1)
        .containsEntry("whole", 10.0)
        .containsEntry("inf", Double.POSITIVE_INFINITY)
        .containsEntry("ninf", Double.NEGATIVE_INFINITY);
    assertThat((Double) decoded.get("nan")).isNaN();
  }

  @Test
  void datesAndTimes() {
    final var utc = OffsetDateTime.of(2024, 1, 2, 3, 4, 5, 0, ZoneOffset.UTC);
    final var pacific = OffsetDateTime.of(1979, 5, 27, 7, 32, 0, 0, ZoneOffset.ofHours(-8));
    final var local = LocalDateTime.of(1979, 5, 27, 0, 32, 0, 999_000_000);
    final var doc = table(
        "utc", utc,
        "pacific", pacific,
        "local", local,
        "date", LocalDate.of(1979, 5, 27),
        "time", LocalTime.of(7, 32));
    assertThat(roundTrip(doc)).isEqualTo(doc);
    assertThat(roundTrip(table("instant", utc.toInstant()))).containsEntry("instant", utc);
  }

  @Test
  void arraysOfScalars() {
    final var doc = table(
        "ints", List.of(1L, 2L, 3L),
        "empty", List.of(),
        "nested", List.of(List.of(1L, 2L), List.of(3L)));
    assertThat(roundTrip(doc)).isEqualTo(doc);
  }

  @Test
  void inlineTables() {
    final var inline = new InlineTable();
    inline.put("x", "abc");
    inline.put("nested", new InlineTable(Map.of("y", 2L)));
    final var doc = table("a", table("b", 1L), "d", inline);
    assertThat(roundTrip(doc, new PreserveInlineTableEncoder())).isEqualTo(doc);
  }

  @Test
  void customSeparators() {
    final var doc = table("a", List.of(1L, 2L), "b", table("c", List.of("x", "y")));
    assertThat(roundTrip(doc, new ArraySeparatorEncoder(",\t"))).isEqualTo(doc);
    assertThat(roundTrip(doc, new ArraySeparatorEncoder(",\n"))).isEqualTo(doc);
  }

  @Test
  void commentsInsideArrays() {
    final var doc = table(
        "a", List.of(new CommentedValue(1L, " # one"), 2L),
        "b", List.of(new CommentedValue("x", " # last")));
    assertThat(roundTrip(doc, new PreserveCommentEncoder())).isEqualTo(table("a", List.of(1L, 2L), "b", List.of("x")));
    assertThat(roundTrip(doc, new ArraySeparatorEncoder(",\n",
        TomlEncoder.Options.defaults().withExtension(PreserveCommentEncoder::registerComments))))
        .isEqualTo(table("a", List.of(1L, 2L), "b", List.of("x")));
  }

  @Test
  void commentsInsideInlineTables() {
    final var inline = new InlineTable();
    inline.put("x", new CommentedValue(1L, " # dropped"));
    final var encoder = new PreserveCommentEncoder(TomlEncoder.Options.defaults().withPreserveInlineTables(true));
    assertThat(roundTrip(table("t", inline), encoder)).isEqualTo(table("t", table("x", 1L)));
  }

  @Test
  @DisplayName("Comments are ignored by the reader")
  void comments() {
    final var doc = table("animals", table("color", new CommentedValue("gray", " # col"), "a", 3L));
    assertThat(roundTrip(doc, new PreserveCommentEncoder()))
        .isEqualTo(table("animals", table("color", "gray", "a", 3L)));
  }
}
