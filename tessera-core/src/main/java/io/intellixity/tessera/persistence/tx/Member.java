package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.query.QueryType;

import java.util.Objects;

/** Non-field attribute of a transaction type: a record, a record list or a query result. */
public record Member(String name, Kind kind, RecordType recordType, QueryType queryType) {
  public enum Kind { RECORD, RECORD_LIST, QUERY_RESULT }

  public Member {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.QUERY_RESULT) {
      Objects.requireNonNull(queryType, "queryType");
      if (queryType.resultType() == null) {
        throw new IllegalArgumentException("Query result member '" + name + "' needs a query with a result type");
      }
      recordType = queryType.resultType();
    } else {
      Objects.requireNonNull(recordType, "recordType");
    }
  }

  public static Member record(String name, RecordType type) {
    return new Member(name, Kind.RECORD, type, null);
  }

  public static Member recordList(String name, RecordType type) {
    return new Member(name, Kind.RECORD_LIST, type, null);
  }

  public static Member queryResult(String name, QueryType type) {
    return new Member(name, Kind.QUERY_RESULT, null, type);
  }
}
