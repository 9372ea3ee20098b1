package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.SqliteDialect;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.FieldTypes;
import io.intellixity.tessera.persistence.field.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class RecordTest {
  private static final Field<Integer> A = Field.of("a", FieldTypes.integer());
  private static final Field<String> B = Field.of("b", FieldTypes.text());
  private static final Field<Integer> C = Field.of("c", FieldTypes.integer()).withContextKey("c_key");

  private static final RecordType ABC = RecordType.recordBuilder("abc").fields(A, B, C).build();

  @Test
  void positionalConstructionRoundTrips() {
    Record r = ABC.newRecord(1, "x", 2);
    assertEquals(1, r.get(A));
    assertEquals("x", r.get("b"));
    assertEquals(Arrays.asList(1, "x", 2), r.values());
  }

  @Test
  void trailingFieldsStayNull() {
    Record r = ABC.newRecord(1);
    assertNull(r.get(B));
    assertNull(r.get(C));
  }

  @Test
  void namedConstruction() {
    Record r = ABC.newRecord(Map.of("b", "y", "c", "3"));
    assertNull(r.get(A));
    assertEquals(3, r.get(C));
  }

  @Test
  void unknownFieldIsASchemaViolation() {
    Record r = ABC.newRecord();
    assertThrows(SchemaViolationException.class, () -> r.set("d", 1));
    assertThrows(SchemaViolationException.class, () -> r.get("d"));
    assertThrows(SchemaViolationException.class, () -> ABC.newRecord(1, "x", 2, 3));
  }

  @Test
  void assignmentsAreValidated() {
    Record r = ABC.newRecord();
    assertThrows(ValidationException.class, () -> r.set("a", "not a number"));
    r.set("a", "12");
    assertEquals(12, r.get(A));
  }

  @Test
  void copyIsIndependent() {
    Record r = ABC.newRecord(1, "x", 2);
    Record copy = r.copy();
    assertEquals(r, copy);
    copy.set(B, "y");
    assertEquals("x", r.get(B));
    assertNotEquals(r, copy);
  }

  @Test
  void clearResetsEveryValue() {
    Record r = ABC.newRecord(1, "x", 2);
    r.clear();
    assertEquals(Arrays.asList(null, null, null), r.values());
  }

  @Test
  void propagateTakesContextValues() {
    Record r = ABC.newRecord(1, "x", 2);
    r.propagate(Context.of("c_key", 9));
    assertEquals(9, r.get(C));
    r.propagate(new Context());
    assertEquals(9, r.get(C));
  }

  @Test
  void valueForContextKeyFindsBoundFields() {
    Record r = ABC.newRecord(1, "x", 2);
    assertEquals(2, r.valueForContextKey("c_key"));
    assertNull(r.valueForContextKey("other"));
  }

  @Test
  void fromRowAdaptsDriverValues() {
    RecordType priced = RecordType.recordBuilder("priced")
        .fields(Field.of("id", FieldTypes.bigInt()), Field.of("price", FieldTypes.numeric(8, 2)))
        .build();
    Record r = priced.fromRow(new Object[]{5, "12.5"}, new SqliteDialect());
    assertEquals(5L, r.get("id"));
    assertEquals(new BigDecimal("12.50"), r.get("price"));
    assertThrows(SchemaViolationException.class, () -> priced.fromRow(new Object[]{5}, new SqliteDialect()));
  }

  @Test
  void duplicateNamesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RecordType.recordBuilder("dup").fields(A, A).build());
    assertThrows(IllegalArgumentException.class,
        () -> RecordType.recordBuilder("dup").fields(A, Field.of("other", FieldTypes.text()).withSqlName("a")).build());
    assertThrows(IllegalArgumentException.class, () -> RecordType.recordBuilder("empty").build());
  }

  @Test
  void valuesViewIsASnapshot() {
    Record r = ABC.newRecord(1, "x", 2);
    List<Object> before = r.values();
    r.set(A, 5);
    assertEquals(1, before.get(0));
  }
}
