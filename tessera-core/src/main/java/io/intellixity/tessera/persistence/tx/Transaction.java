package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.field.GeneratorSource;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordList;
import io.intellixity.tessera.persistence.model.SchemaViolationException;
import io.intellixity.tessera.persistence.query.QueryResult;

import java.util.*;

/**
 * Instance of a {@link TransactionType}: values of its context fields and the members it owns.\n
 *
 * Record members start out null; record lists and query results start out empty.\n
 * The orchestrated operations delegate to the type's {@link TransactionOrchestrator}; passing a null\n
 * dialect selects the type's default.\n
 */
public final class Transaction {
  private final TransactionType type;
  private final Object[] fieldValues;
  private final Map<String, Object> members = new LinkedHashMap<>();
  private TxStage stage = TxStage.IDLE;

  Transaction(TransactionType type) {
    this.type = type;
    this.fieldValues = new Object[type.contextFields().size()];
    for (Member m : type.members()) {
      switch (m.kind()) {
        case RECORD -> members.put(m.name(), null);
        case RECORD_LIST -> members.put(m.name(), new RecordList(m.recordType()));
        case QUERY_RESULT -> members.put(m.name(), m.queryType().newResult());
      }
    }
  }

  public TransactionType type() { return type; }
  public TxStage stage() { return stage; }

  void stage(TxStage s) {
    this.stage = s;
  }

  // ---- context fields ----

  public Object get(String fieldName) {
    return fieldValues[fieldIndex(fieldName)];
  }

  public <T> T get(Field<T> field) {
    return field.cast(fieldValues[fieldIndex(field.name())]);
  }

  public Transaction set(String fieldName, Object value) {
    int i = fieldIndex(fieldName);
    fieldValues[i] = type.contextFields().get(i).validate(value);
    return this;
  }

  public <T> Transaction set(Field<T> field, T value) {
    return set(field.name(), value);
  }

  // ---- members ----

  public Record record(String memberName) {
    return (Record) members.get(member(memberName, Member.Kind.RECORD).name());
  }

  public Transaction setRecord(String memberName, Record r) {
    Member m = member(memberName, Member.Kind.RECORD);
    if (r != null && r.type() != m.recordType()) {
      throw new SchemaViolationException("Member '" + memberName + "' of transaction '" + type.name()
          + "' holds '" + m.recordType().name() + "', not '" + r.type().name() + "'");
    }
    members.put(memberName, r);
    return this;
  }

  public RecordList recordList(String memberName) {
    return (RecordList) members.get(member(memberName, Member.Kind.RECORD_LIST).name());
  }

  /** Replaces the list's contents with {@code records}. */
  public Transaction setRecordList(String memberName, Iterable<Record> records) {
    RecordList list = recordList(memberName);
    list.clear();
    list.addAll(records);
    return this;
  }

  public QueryResult queryResult(String memberName) {
    return (QueryResult) members.get(member(memberName, Member.Kind.QUERY_RESULT).name());
  }

  // ---- contexts ----

  /** Stored values of the context fields, keyed by context name, in declaration order. */
  public Context context() {
    Context ctx = new Context();
    List<Field<?>> fields = type.contextFields();
    for (int i = 0; i < fieldValues.length; i++) ctx.put(fields.get(i).contextName(), fieldValues[i]);
    return ctx;
  }

  /** Context built with {@link Field#refresh}; no side effects beyond storing the resolved values. */
  public Context refreshedContext() {
    Context ctx = new Context();
    List<Field<?>> fields = type.contextFields();
    for (int i = 0; i < fieldValues.length; i++) {
      Field<?> f = fields.get(i);
      fieldValues[i] = refresh(f, fieldValues[i], ctx);
      ctx.put(f.contextName(), fieldValues[i]);
    }
    return ctx;
  }

  /** Context built with {@link Field#update}: generators run in declaration order and their values are stored. */
  public Context updatedContext(Cursor cursor, Dialect dialect) {
    GeneratorSource source = new GeneratorSource(cursor, dialect == null ? type.defaultDialect() : dialect);
    Context ctx = new Context();
    List<Field<?>> fields = type.contextFields();
    for (int i = 0; i < fieldValues.length; i++) {
      Field<?> f = fields.get(i);
      fieldValues[i] = update(f, fieldValues[i], ctx, source);
      ctx.put(f.contextName(), fieldValues[i]);
    }
    return ctx;
  }

  /**
   * Fills every context key that is still null with the first non-null value found in the members\n
   * (declaration order) under a field bound to that key, then copies resolved values into this\n
   * transaction's own fields.\n
   */
  public void backPropagate(Context context) {
    for (String key : context.keys()) {
      if (context.hasValue(key)) continue;
      Object found = findMemberValue(key);
      if (found != null) context.put(key, found);
    }
    List<Field<?>> fields = type.contextFields();
    for (int i = 0; i < fieldValues.length; i++) {
      Field<?> f = fields.get(i);
      if (context.hasValue(f.contextName())) fieldValues[i] = f.validate(context.get(f.contextName()));
    }
  }

  private Object findMemberValue(String key) {
    for (Object v : members.values()) {
      if (v instanceof Record r) {
        Object found = r.valueForContextKey(key);
        if (found != null) return found;
      } else if (v instanceof RecordList list) {
        for (Record r : list) {
          Object found = r.valueForContextKey(key);
          if (found != null) return found;
        }
      }
    }
    return null;
  }

  // ---- orchestrated operations ----

  public Context insertNew(Cursor cursor) { return insertNew(cursor, null); }

  public Context insertNew(Cursor cursor, Dialect dialect) {
    return type.orchestrator().insertNew(this, cursor, dialect);
  }

  public Context insertExisting(Cursor cursor) { return insertExisting(cursor, null); }

  public Context insertExisting(Cursor cursor, Dialect dialect) {
    return type.orchestrator().insertExisting(this, cursor, dialect);
  }

  public Context update(Cursor cursor) { return update(cursor, null); }

  public Context update(Cursor cursor, Dialect dialect) {
    return type.orchestrator().update(this, cursor, dialect);
  }

  public Context delete(Cursor cursor) { return delete(cursor, null); }

  public Context delete(Cursor cursor, Dialect dialect) {
    return type.orchestrator().delete(this, cursor, dialect);
  }

  public Context contextSelect(Cursor cursor) { return contextSelect(cursor, null, false); }

  public Context contextSelect(Cursor cursor, boolean allowUnlimited) {
    return contextSelect(cursor, null, allowUnlimited);
  }

  public Context contextSelect(Cursor cursor, Dialect dialect, boolean allowUnlimited) {
    return type.orchestrator().contextSelect(this, cursor, dialect, allowUnlimited);
  }

  // ---- misc ----

  /** Member value by name (Record, RecordList or QueryResult); used by the orchestrator. */
  Object memberValue(String memberName) {
    return members.get(memberName);
  }

  void replaceRecord(String memberName, Record r) {
    members.put(memberName, r);
  }

  /** Deep copy: field values, records, lists and query parameters are copied. */
  public Transaction copy() {
    Transaction t = new Transaction(type);
    System.arraycopy(fieldValues, 0, t.fieldValues, 0, fieldValues.length);
    for (var e : members.entrySet()) {
      Object v = e.getValue();
      if (v instanceof Record r) t.members.put(e.getKey(), r.copy());
      else if (v instanceof RecordList list) t.members.put(e.getKey(), list.copy());
      else if (v instanceof QueryResult qr) t.members.put(e.getKey(), qr.copy());
    }
    return t;
  }

  private int fieldIndex(String fieldName) {
    int i = type.indexOfField(fieldName);
    if (i < 0) {
      throw new SchemaViolationException("Transaction '" + type.name() + "' has no context field named '" + fieldName + "'");
    }
    return i;
  }

  private Member member(String memberName, Member.Kind kind) {
    Member m = type.member(memberName);
    if (m == null || m.kind() != kind) {
      throw new SchemaViolationException("Transaction '" + type.name() + "' has no "
          + kind.name().toLowerCase(Locale.ROOT).replace('_', ' ') + " member named '" + memberName + "'");
    }
    return m;
  }

  private static <T> T refresh(Field<T> field, Object stored, Context context) {
    return field.refresh(field.cast(stored), context);
  }

  private static <T> T update(Field<T> field, Object stored, Context context, GeneratorSource source) {
    return field.update(field.cast(stored), context, source);
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", type.name() + "(", ")");
    List<Field<?>> fields = type.contextFields();
    for (int i = 0; i < fieldValues.length; i++) sj.add(fields.get(i).name() + "=" + fieldValues[i]);
    for (var e : members.entrySet()) sj.add(e.getKey() + "=" + e.getValue());
    return sj.toString();
  }
}
