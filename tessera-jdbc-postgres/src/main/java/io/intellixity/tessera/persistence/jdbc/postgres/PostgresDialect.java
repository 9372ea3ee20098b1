package io.intellixity.tessera.persistence.jdbc.postgres;

import io.intellixity.tessera.persistence.dialect.AbstractSqlDialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.field.FieldType;
import io.intellixity.tessera.persistence.field.SqlKind;
import io.intellixity.tessera.persistence.sequence.Sequence;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * PostgreSQL dialect (id "postgres").\n
 *
 * - '?' markers, schema-qualified names\n
 * - native decimals, booleans, timestamps, UUIDs\n
 * - JSON bound as {@code jsonb} through {@link PGobject}\n
 * - native sequences\n
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }
  @Override public String bindMarker(int position, String name) { return "?"; }
  @Override public boolean schemaSupport() { return true; }
  @Override public String autoIncrementPrimaryKey() { return "BIGSERIAL PRIMARY KEY"; }

  @Override
  public String columnType(FieldType<?> type) {
    return switch (type.kind()) {
      case SMALLINT -> "SMALLINT";
      case INTEGER -> "INTEGER";
      case BIGINT -> "BIGINT";
      case NUMERIC -> "NUMERIC(" + type.precision() + "," + type.scale() + ")";
      case REAL -> "DOUBLE PRECISION";
      case BOOLEAN -> "BOOLEAN";
      case TEXT, ENUM -> "TEXT";
      case VARCHAR -> "VARCHAR(" + type.precision() + ")";
      case CHAR -> "CHAR(" + type.precision() + ")";
      case TIMESTAMP -> "TIMESTAMP";
      case TIMESTAMPTZ -> "TIMESTAMPTZ";
      case DATE -> "DATE";
      case TIME -> "TIME";
      case UUID -> "UUID";
      case JSON -> "JSONB";
      case BLOB -> "BYTEA";
    };
  }

  @Override
  public Object toBackend(FieldType<?> type, Object value) {
    if (value == null) return null;
    if (type.kind() == SqlKind.JSON) return jsonb(String.valueOf(encodeJson(value)));
    if (value instanceof Instant i) return i.atOffset(ZoneOffset.UTC);
    return super.toBackend(type, value);
  }

  @Override
  public Object fromBackend(FieldType<?> type, Object raw) {
    if (raw == null) return null;
    if (raw instanceof PGobject pg) return type.kind() == SqlKind.JSON ? decodeJson(pg.getValue()) : pg.getValue();
    if (raw instanceof Timestamp ts) return type.kind() == SqlKind.TIMESTAMPTZ ? ts.toInstant() : ts.toLocalDateTime();
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof Time t) return t.toLocalTime();
    return super.fromBackend(type, raw);
  }

  @Override
  public List<SqlStatement> createSequence(Sequence seq) {
    return List.of(SqlStatement.of("CREATE SEQUENCE IF NOT EXISTS " + seq.qualifiedName(this)
        + " START WITH " + seq.start() + " INCREMENT BY " + seq.interval()));
  }

  @Override
  public List<SqlStatement> nextSequenceValue(Sequence seq) {
    return List.of(SqlStatement.of("SELECT nextval(CAST(? AS regclass))", seq.qualifiedName(this)));
  }

  @Override
  public List<SqlStatement> resetSequence(Sequence seq) {
    return List.of(SqlStatement.of("ALTER SEQUENCE " + seq.qualifiedName(this) + " RESTART"));
  }

  private static PGobject jsonb(String json) {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    try {
      obj.setValue(json);
    } catch (SQLException e) {
      throw new IllegalArgumentException("Failed to wrap JSON as jsonb", e);
    }
    return obj;
  }
}
