package io.intellixity.tessera.persistence.field;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class FieldTypesTest {

  enum Colour { RED, GREEN }

  @Test
  void integerAcceptsIntegralValuesAndStrings() {
    FieldType<Integer> t = FieldTypes.integer();
    assertEquals(42, t.convert("42"));
    assertEquals(5, t.convert(5L));
    assertEquals(7, t.convert(new BigDecimal("7")));
  }

  @Test
  void integerRejectsOutOfRangeAndFractions() {
    FieldType<Integer> t = FieldTypes.integer();
    assertThrows(ValidationException.class, () -> t.convert(Long.MAX_VALUE));
    assertThrows(ValidationException.class, () -> t.convert(1.5));
    assertThrows(ValidationException.class, () -> t.convert(new BigDecimal("1.5")));
    assertThrows(ValidationException.class, () -> t.convert("abc"));
  }

  @Test
  void smallIntChecksItsRange() {
    assertEquals((short) 12, FieldTypes.smallInt().convert(12));
    assertThrows(ValidationException.class, () -> FieldTypes.smallInt().convert(40_000));
  }

  @Test
  void numericQuantizesToScale() {
    NumericType t = FieldTypes.numeric(5, 2);
    assertEquals(new BigDecimal("12.30"), t.convert("12.3"));
    assertEquals(new BigDecimal("7.00"), t.convert(7));
  }

  @Test
  void numericRejectsInexactValuesUnlessAllowed() {
    NumericType t = FieldTypes.numeric(5, 2);
    assertThrows(ValidationException.class, () -> t.convert("1.234"));
    assertEquals(new BigDecimal("1.23"), t.inexactQuantize().convert("1.234"));
    assertEquals(new BigDecimal("1.24"), t.inexactQuantize().convert("1.235"));
  }

  @Test
  void numericRejectsFloatsUnlessAllowed() {
    NumericType t = FieldTypes.numeric(5, 2);
    assertThrows(ValidationException.class, () -> t.convert(1.5d));
    assertEquals(new BigDecimal("1.50"), t.allowFloats().convert(1.5d));
  }

  @Test
  void numericChecksPrecision() {
    NumericType t = FieldTypes.numeric(5, 2);
    assertEquals(new BigDecimal("999.99"), t.convert("999.99"));
    assertThrows(ValidationException.class, () -> t.convert("1234.5"));
  }

  @Test
  void numericDefinitionIsChecked() {
    assertThrows(IllegalArgumentException.class, () -> FieldTypes.numeric(0, 0));
    assertThrows(IllegalArgumentException.class, () -> FieldTypes.numeric(3, 4));
  }

  @Test
  void varCharRejectsOrTruncatesLongValues() {
    TextType t = FieldTypes.varChar(3);
    assertEquals("abc", t.convert("abc"));
    assertThrows(ValidationException.class, () -> t.convert("abcd"));
    assertEquals("abc", t.silentTruncate().convert("abcd"));
    assertThrows(IllegalStateException.class, () -> FieldTypes.text().silentTruncate());
  }

  @Test
  void textRejectsNonText() {
    assertThrows(ValidationException.class, () -> FieldTypes.text().convert(12));
  }

  @Test
  void booleanAcceptsCommonSpellings() {
    FieldType<Boolean> t = FieldTypes.bool();
    assertTrue(t.convert("t"));
    assertTrue(t.convert(1));
    assertFalse(t.convert("FALSE"));
    assertFalse(t.convert(0L));
    assertThrows(ValidationException.class, () -> t.convert(2));
    assertThrows(ValidationException.class, () -> t.convert("maybe"));
  }

  @Test
  void temporalTypesParseIsoText() {
    assertEquals(Instant.parse("2024-01-02T03:04:05Z"), FieldTypes.timestampTz().convert("2024-01-02T03:04:05Z"));
    assertEquals(Instant.parse("2024-01-02T01:04:05Z"), FieldTypes.timestampTz().convert("2024-01-02T03:04:05+02:00"));
    assertEquals(LocalDateTime.of(2024, 1, 2, 3, 4, 5), FieldTypes.timestamp().convert("2024-01-02 03:04:05"));
    assertEquals(LocalDate.of(2024, 2, 29), FieldTypes.date().convert("2024-02-29"));
    assertThrows(ValidationException.class, () -> FieldTypes.date().convert("2024-02-30"));
  }

  @Test
  void uuidAndEnumParseText() {
    UUID u = UUID.randomUUID();
    assertEquals(u, FieldTypes.uuid().convert(u.toString()));
    assertThrows(ValidationException.class, () -> FieldTypes.uuid().convert("not-a-uuid"));

    FieldType<Colour> c = FieldTypes.enumOf(Colour.class);
    assertEquals(Colour.GREEN, c.convert("GREEN"));
    assertEquals(Colour.RED, c.convert(Colour.RED));
    assertThrows(ValidationException.class, () -> c.convert("BLUE"));
    assertEquals(FieldTypes.enumOf(Colour.class), c);
  }

  @Test
  void jsonAcceptsJsonCompatibleValuesOnly() {
    FieldType<Object> t = FieldTypes.json();
    assertEquals(java.util.Map.of("a", 1), t.convert(java.util.Map.of("a", 1)));
    assertEquals("[1,2]", t.convert("[1,2]"));
    assertThrows(ValidationException.class, () -> t.convert(new Object()));
  }
}
