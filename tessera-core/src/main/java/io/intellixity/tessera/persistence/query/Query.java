package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.dmlast.Bind;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.model.SchemaViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Instance of a {@link QueryType} holding its parameter values. */
public final class Query {
  private static final Logger log = LoggerFactory.getLogger(Query.class);

  private final QueryType type;
  private final Object[] values;

  Query(QueryType type) {
    this.type = type;
    this.values = new Object[type.parameters().size()];
  }

  public QueryType type() { return type; }

  public Object get(String parameterName) {
    return values[indexOf(parameterName)];
  }

  public <T> T get(Field<T> field) {
    return field.cast(values[indexOf(field.name())]);
  }

  public Query set(String parameterName, Object value) {
    int i = indexOf(parameterName);
    values[i] = type.parameters().get(i).validate(value);
    return this;
  }

  public <T> Query set(Field<T> field, T value) {
    return set(field.name(), value);
  }

  /** Adopts context values for every parameter bound to a context key (refresh semantics). */
  public Query setContext(Context context) {
    List<Field<?>> ps = type.parameters();
    for (int i = 0; i < values.length; i++) values[i] = refresh(ps.get(i), values[i], context);
    return this;
  }

  public SqlStatement statement(Dialect dialect) {
    return PlaceholderCompiler.compile(type.name(), type.text(), this::bindFor, dialect);
  }

  public List<Object[]> execute(Cursor cursor, Dialect dialect) {
    Objects.requireNonNull(cursor, "cursor");
    SqlStatement ss = statement(dialect);
    if (log.isDebugEnabled()) {
      log.debug("tessera.query name={} dialect={} paramCount={} sql={}",
          type.name(), dialect.id(), ss.params().size(), ss.sql());
    }
    List<Object[]> rows = cursor.execute(ss.sql(), ss.params());
    return rows == null ? List.of() : rows;
  }

  public List<Record> resultRecords(Cursor cursor, Dialect dialect) {
    RecordType rt = requireResultType();
    List<Record> out = new ArrayList<>();
    for (Object[] row : execute(cursor, dialect)) out.add(rt.fromRow(row, dialect));
    return out;
  }

  /** First result row, or null when the query returns nothing. */
  public Record resultRecord(Cursor cursor, Dialect dialect) {
    RecordType rt = requireResultType();
    List<Object[]> rows = execute(cursor, dialect);
    return rows.isEmpty() ? null : rt.fromRow(rows.get(0), dialect);
  }

  /** First column of the first row, or null. */
  public Object singleValue(Cursor cursor, Dialect dialect) {
    List<Object[]> rows = execute(cursor, dialect);
    if (rows.isEmpty() || rows.get(0).length == 0) return null;
    return rows.get(0)[0];
  }

  public Query copy() {
    Query q = new Query(type);
    System.arraycopy(values, 0, q.values, 0, values.length);
    return q;
  }

  private Bind bindFor(String name) {
    int i = type.indexOf(name);
    if (i < 0) return null;
    return new Bind(values[i], type.parameters().get(i).type());
  }

  private int indexOf(String name) {
    int i = type.indexOf(name);
    if (i < 0) throw new SchemaViolationException("Query '" + type.name() + "' has no parameter named '" + name + "'");
    return i;
  }

  private RecordType requireResultType() {
    RecordType rt = type.resultType();
    if (rt == null) throw new IllegalStateException("Query '" + type.name() + "' declares no result type");
    return rt;
  }

  private static <T> T refresh(Field<T> field, Object stored, Context context) {
    return field.refresh(field.cast(stored), context);
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "Query(" + type.name() + ": ", ")");
    List<Field<?>> ps = type.parameters();
    for (int i = 0; i < values.length; i++) sj.add(ps.get(i).name() + "=" + values[i]);
    return sj.toString();
  }
}
