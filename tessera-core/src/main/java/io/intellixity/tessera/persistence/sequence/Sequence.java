package io.intellixity.tessera.persistence.sequence;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.field.GenerationException;
import io.intellixity.tessera.persistence.field.GeneratorSource;
import io.intellixity.tessera.persistence.field.ValueGenerator;
import io.intellixity.tessera.persistence.table.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Named database sequence handing out {@code start, start + interval, ...}.\n
 *
 * How the sequence is stored is up to the dialect (native sequence or an emulation table).\n
 * Allocated values are never given back, even when the operation that drew them fails later.\n
 */
public final class Sequence implements ValueGenerator<Long> {
  private static final Logger log = LoggerFactory.getLogger(Sequence.class);

  private final String name;
  private final Schema schema;
  private final long start;
  private final long interval;

  public Sequence(String name) {
    this(name, null, 1, 1);
  }

  public Sequence(String name, Schema schema, long start, long interval) {
    this.name = Objects.requireNonNull(name, "name");
    if (interval == 0) throw new IllegalArgumentException("Sequence interval must not be 0");
    this.schema = schema;
    this.start = start;
    this.interval = interval;
  }

  public Sequence startingAt(long value) {
    return new Sequence(name, schema, value, interval);
  }

  public Sequence inSchema(Schema s) {
    return new Sequence(name, s, start, interval);
  }

  public String name() { return name; }
  public Schema schema() { return schema; }
  public String schemaName() { return schema == null ? null : schema.name(); }
  public long start() { return start; }
  public long interval() { return interval; }

  public String qualifiedName(Dialect dialect) {
    return dialect.qualify(schemaName(), name);
  }

  public void create(Cursor cursor, Dialect dialect) {
    for (SqlStatement ss : dialect.createSequence(this)) cursor.execute(ss.sql(), ss.params());
  }

  public void reset(Cursor cursor, Dialect dialect) {
    for (SqlStatement ss : dialect.resetSequence(this)) cursor.execute(ss.sql(), ss.params());
  }

  public long nextValue(Cursor cursor, Dialect dialect) {
    if (cursor == null) throw new GenerationException("Sequence '" + name + "' needs a cursor to allocate a value");
    List<SqlStatement> statements = dialect.nextSequenceValue(this);
    List<Object[]> rows = List.of();
    for (SqlStatement ss : statements) rows = cursor.execute(ss.sql(), ss.params());

    if (rows == null || rows.isEmpty() || rows.get(0).length == 0 || !(rows.get(0)[0] instanceof Number n)) {
      throw new GenerationException("Sequence '" + name + "' returned no value");
    }
    long v = n.longValue();
    log.debug("tessera.sequence name={} dialect={} value={}", name, dialect.id(), v);
    return v;
  }

  @Override
  public Long next(GeneratorSource source, Context context) {
    return nextValue(source.cursor(), source.dialect());
  }

  @Override
  public String toString() {
    return "Sequence(" + (schema == null ? "" : schema.name() + ".") + name
        + " start=" + start + " interval=" + interval + ")";
  }
}
