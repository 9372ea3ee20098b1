package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.field.Field;

import java.util.*;

/**
 * Ordered, named set of fields describing the shape of a record.\n
 *
 * Type definitions are immutable and shared; {@link Record} instances hold the values.\n
 */
public class RecordType {
  private final String name;
  private final List<Field<?>> fields;
  private final Map<String, Integer> index;

  protected RecordType(String name, List<Field<?>> fields) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(fields, "fields");
    if (fields.isEmpty()) throw new IllegalArgumentException("Record type '" + name + "' declares no fields");

    Map<String, Integer> idx = new HashMap<>();
    Set<String> columns = new HashSet<>();
    for (int i = 0; i < fields.size(); i++) {
      Field<?> f = Objects.requireNonNull(fields.get(i), "field");
      if (idx.put(f.name(), i) != null) {
        throw new IllegalArgumentException("Duplicate field '" + f.name() + "' in record type '" + name + "'");
      }
      if (!columns.add(f.sqlName())) {
        throw new IllegalArgumentException("Duplicate column '" + f.sqlName() + "' in record type '" + name + "'");
      }
    }
    this.name = name;
    this.fields = List.copyOf(fields);
    this.index = Map.copyOf(idx);
  }

  public static Builder recordBuilder(String name) {
    return new Builder(name);
  }

  public String name() { return name; }
  public List<Field<?>> fields() { return fields; }
  public int size() { return fields.size(); }
  public boolean hasField(String fieldName) { return index.containsKey(fieldName); }

  public int indexOf(String fieldName) {
    Integer i = index.get(fieldName);
    if (i == null) {
      throw new SchemaViolationException("Record type '" + name + "' has no field named '" + fieldName + "'");
    }
    return i;
  }

  public Field<?> field(String fieldName) {
    return fields.get(indexOf(fieldName));
  }

  public Record newRecord() {
    return new Record(this);
  }

  /** Positional construction; trailing fields not given stay null. */
  public Record newRecord(Object... values) {
    if (values.length > fields.size()) {
      throw new SchemaViolationException("Record type '" + name + "' has " + fields.size()
          + " fields but " + values.length + " values were given");
    }
    Record r = new Record(this);
    for (int i = 0; i < values.length; i++) r.setAt(i, values[i]);
    return r;
  }

  public Record newRecord(Map<String, ?> values) {
    Record r = new Record(this);
    if (values != null) {
      for (var e : values.entrySet()) r.set(e.getKey(), e.getValue());
    }
    return r;
  }

  /** Materializes one fetched row; columns are expected in field declaration order. */
  public Record fromRow(Object[] row, Dialect dialect) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(dialect, "dialect");
    if (row.length != fields.size()) {
      throw new SchemaViolationException("Record type '" + name + "' expects " + fields.size()
          + " columns but the row has " + row.length);
    }
    Record r = new Record(this);
    for (int i = 0; i < row.length; i++) {
      r.setAt(i, dialect.fromBackend(fields.get(i).type(), row[i]));
    }
    return r;
  }

  public RecordList newList() {
    return new RecordList(this);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }

  public static final class Builder {
    private final String name;
    private final List<Field<?>> fields = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder field(Field<?> field) {
      fields.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder fields(Field<?>... fs) {
      for (Field<?> f : fs) field(f);
      return this;
    }

    public RecordType build() {
      return new RecordType(name, fields);
    }
  }
}
