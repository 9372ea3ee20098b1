package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.SqliteDialect;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.exec.IsolationLevel;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.FieldTypes;
import io.intellixity.tessera.persistence.field.GenerationException;
import io.intellixity.tessera.persistence.field.GeneratorSource;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.model.SchemaViolationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryTest {
  private static final SqliteDialect SQLITE = new SqliteDialect();

  private static final Field<String> CUSTOMER = Field.of("customer", FieldTypes.text()).withContextKey("customer");
  private static final Field<Integer> MIN_QTY = Field.of("min_qty", FieldTypes.integer());

  private static final RecordType TOTAL = RecordType.recordBuilder("total")
      .fields(Field.of("id", FieldTypes.bigInt()), Field.of("total", FieldTypes.numeric(10, 2)))
      .build();

  private static final QueryType TOTALS = QueryType.builder("totals")
      .text("SELECT id, total FROM orders WHERE customer = {customer} AND qty >= {min_qty}")
      .resultType(TOTAL)
      .parameters(CUSTOMER, MIN_QTY)
      .build();

  /** Returns canned rows and remembers what it was asked to run. */
  static final class CannedCursor implements Cursor {
    final List<String> sql = new ArrayList<>();
    final List<List<?>> params = new ArrayList<>();
    List<Object[]> rows = List.of();

    @Override
    public List<Object[]> execute(String s, List<?> p) {
      sql.add(s);
      params.add(p);
      return rows;
    }

    @Override public void begin(IsolationLevel level) { throw new UnsupportedOperationException(); }
    @Override public void commit() { throw new UnsupportedOperationException(); }
    @Override public void rollback() { throw new UnsupportedOperationException(); }
  }

  @Test
  void contextFillsBoundParameters() {
    Query q = TOTALS.newQuery().set(MIN_QTY, 2);
    q.setContext(Context.of("customer", "acme"));
    assertEquals("acme", q.get(CUSTOMER));
    assertEquals(2, q.get("min_qty"));
  }

  @Test
  void statementBindsInPlaceholderOrder() {
    Query q = TOTALS.newQuery().set(CUSTOMER, "acme").set(MIN_QTY, 2);
    var ss = q.statement(SQLITE);
    assertEquals("SELECT id, total FROM orders WHERE customer = ? AND qty >= ?", ss.sql());
    assertEquals(List.of("acme", 2), ss.params());
  }

  @Test
  void resultRowsBecomeTypedRecords() {
    CannedCursor cursor = new CannedCursor();
    cursor.rows = List.of(new Object[]{1, "12.5"}, new Object[]{2, "3"});
    List<Record> out = TOTALS.newQuery().set(CUSTOMER, "acme").resultRecords(cursor, SQLITE);
    assertEquals(2, out.size());
    assertEquals(1L, out.get(0).get("id"));
    assertEquals(new BigDecimal("3.00"), out.get(1).get("total"));
    assertEquals(1, cursor.sql.size());
  }

  @Test
  void resultRecordIsNullWithoutRows() {
    assertNull(TOTALS.newQuery().resultRecord(new CannedCursor(), SQLITE));
  }

  @Test
  void unknownParameterIsASchemaViolation() {
    Query q = TOTALS.newQuery();
    assertThrows(SchemaViolationException.class, () -> q.set("nope", 1));
    assertEquals(-1, TOTALS.indexOf("nope"));
  }

  @Test
  void placeholdersWithoutParameterFailAtCompileTime() {
    QueryType broken = QueryType.builder("broken").text("SELECT {missing}").build();
    assertThrows(QueryParameterException.class, () -> broken.newQuery().statement(SQLITE));
    assertEquals(List.of("missing"), broken.placeholders());
  }

  @Test
  void queryResultRefreshReplacesContents() {
    CannedCursor cursor = new CannedCursor();
    QueryResult result = TOTALS.newResult();
    result.query().set(CUSTOMER, "acme");

    cursor.rows = List.of(new Object[]{1, "1"}, new Object[]{2, "2"});
    result.refresh(cursor, SQLITE);
    assertEquals(2, result.size());

    cursor.rows = List.<Object[]>of(new Object[]{3, "3"});
    result.refresh(cursor, SQLITE);
    assertEquals(1, result.size());
    assertEquals(3L, result.get(0).get("id"));
  }

  @Test
  void queryResultCopyOwnsItsQuery() {
    QueryResult result = TOTALS.newResult();
    result.query().set(CUSTOMER, "acme");
    QueryResult copy = result.copy();
    copy.query().set(CUSTOMER, "other");
    assertEquals("acme", result.query().get(CUSTOMER));
  }

  @Test
  void queriesWithoutResultTypeCanNotBackAResult() {
    QueryType scalar = QueryType.builder("count").text("SELECT count(*) FROM orders").build();
    assertThrows(IllegalArgumentException.class, scalar::newResult);
  }

  @Test
  void queryValueGeneratorReadsFirstColumn() {
    QueryType next = QueryType.builder("next_no")
        .text("SELECT max(no) + 1 FROM orders WHERE customer = {customer}")
        .parameter(CUSTOMER)
        .build();
    CannedCursor cursor = new CannedCursor();
    cursor.rows = List.<Object[]>of(new Object[]{17});

    QueryValueGenerator g = new QueryValueGenerator(next);
    assertEquals(17, g.next(new GeneratorSource(cursor, SQLITE), Context.of("customer", "acme")));
    assertEquals(List.of("acme"), cursor.params.get(0));

    cursor.rows = List.of();
    assertThrows(GenerationException.class, () -> g.next(new GeneratorSource(cursor, SQLITE), new Context()));
    assertThrows(GenerationException.class, () -> g.next(new GeneratorSource(null, SQLITE), new Context()));
  }
}
