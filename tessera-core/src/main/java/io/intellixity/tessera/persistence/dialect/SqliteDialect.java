package io.intellixity.tessera.persistence.dialect;

import io.intellixity.tessera.persistence.field.FieldType;
import io.intellixity.tessera.persistence.sequence.Sequence;

import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.UUID;

/**
 * Default dialect for the embedded SQLite engine.\n
 *
 * - '?' positional markers, no schemas (schema becomes a name prefix)\n
 * - decimals, temporal values, UUIDs and JSON stored as TEXT; booleans as 0/1\n
 * - sequences emulated by a one-row table holding the last value handed out\n
 */
public final class SqliteDialect extends AbstractSqlDialect {
  private static final String SEQ_COLUMN = "value";

  @Override public String id() { return "sqlite"; }
  @Override public String bindMarker(int position, String name) { return "?"; }
  @Override public boolean schemaSupport() { return false; }
  @Override public String autoIncrementPrimaryKey() { return "INTEGER PRIMARY KEY AUTOINCREMENT"; }

  @Override
  public String columnType(FieldType<?> type) {
    return switch (type.kind()) {
      case SMALLINT -> "SMALLINT";
      case INTEGER -> "INTEGER";
      case BIGINT -> "BIGINT";
      case REAL -> "REAL";
      case BOOLEAN -> "INTEGER";
      case VARCHAR -> "VARCHAR(" + type.precision() + ")";
      case CHAR -> "CHARACTER(" + type.precision() + ")";
      case BLOB -> "BLOB";
      case NUMERIC, TEXT, TIMESTAMP, TIMESTAMPTZ, DATE, TIME, UUID, JSON, ENUM -> "TEXT";
    };
  }

  @Override
  public Object toBackend(FieldType<?> type, Object value) {
    if (value == null) return null;
    if (value instanceof BigDecimal bd) return bd.toPlainString();
    if (value instanceof Boolean b) return b ? 1 : 0;
    if (value instanceof Short s) return s.intValue();
    if (value instanceof TemporalAccessor || value instanceof UUID) return value.toString();
    return super.toBackend(type, value);
  }

  @Override
  public List<SqlStatement> createSequence(Sequence seq) {
    String table = seq.qualifiedName(this);
    String col = quoteIdent(SEQ_COLUMN);
    return List.of(
        SqlStatement.of("CREATE TABLE IF NOT EXISTS " + table + " (" + col + " BIGINT NOT NULL)"),
        SqlStatement.of("INSERT INTO " + table + " (" + col + ") SELECT ? WHERE NOT EXISTS (SELECT 1 FROM " + table + ")",
            seq.start() - seq.interval()));
  }

  @Override
  public List<SqlStatement> nextSequenceValue(Sequence seq) {
    String table = seq.qualifiedName(this);
    String col = quoteIdent(SEQ_COLUMN);
    return List.of(
        SqlStatement.of("UPDATE " + table + " SET " + col + " = " + col + " + ?", seq.interval()),
        SqlStatement.of("SELECT " + col + " FROM " + table));
  }

  @Override
  public List<SqlStatement> resetSequence(Sequence seq) {
    String table = seq.qualifiedName(this);
    return List.of(SqlStatement.of("UPDATE " + table + " SET " + quoteIdent(SEQ_COLUMN) + " = ?",
        seq.start() - seq.interval()));
  }
}
