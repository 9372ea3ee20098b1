package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.model.RecordList;
import io.intellixity.tessera.persistence.model.RecordType;

import java.util.Objects;

/** Record list owned by one {@link Query}; {@link #refresh} replaces the contents with a fresh execution. */
public final class QueryResult extends RecordList {
  private final Query query;

  public QueryResult(Query query) {
    super(requireResultType(query));
    this.query = query;
  }

  public Query query() { return query; }

  public QueryResult refresh(Cursor cursor, Dialect dialect) {
    clear();
    addAll(query.resultRecords(cursor, dialect));
    return this;
  }

  /** Deep copy with its own copy of the query. */
  @Override
  public QueryResult copy() {
    QueryResult out = new QueryResult(query.copy());
    out.addAll(super.copy());
    return out;
  }

  private static RecordType requireResultType(Query query) {
    Objects.requireNonNull(query, "query");
    if (query.type().resultType() == null) {
      throw new IllegalArgumentException("Query '" + query.type().name() + "' declares no result type");
    }
    return query.type().resultType();
  }
}
