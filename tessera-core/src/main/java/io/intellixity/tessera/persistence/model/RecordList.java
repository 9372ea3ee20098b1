package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.field.Field;

import java.util.*;

/**
 * Ordered, growable list of records of one type.\n
 *
 * {@link #column} projects a single field across the list lazily; every iteration re-reads the current contents.\n
 */
public class RecordList implements Iterable<Record> {
  private final RecordType recordType;
  private final List<Record> records = new ArrayList<>();

  public RecordList(RecordType recordType) {
    this.recordType = Objects.requireNonNull(recordType, "recordType");
  }

  public RecordList(RecordType recordType, Iterable<Record> initial) {
    this(recordType);
    addAll(initial);
  }

  public RecordType recordType() { return recordType; }
  public int size() { return records.size(); }
  public boolean isEmpty() { return records.isEmpty(); }
  public Record get(int index) { return records.get(index); }

  public RecordList add(Record r) {
    records.add(check(r));
    return this;
  }

  public RecordList add(int index, Record r) {
    records.add(index, check(r));
    return this;
  }

  public RecordList addAll(Iterable<Record> rs) {
    if (rs == null) return this;
    for (Record r : rs) add(r);
    return this;
  }

  public Record set(int index, Record r) {
    return records.set(index, check(r));
  }

  public Record remove(int index) {
    return records.remove(index);
  }

  public void clear() {
    records.clear();
  }

  /** Deep copy: the records are copied as well. */
  public RecordList copy() {
    RecordList out = new RecordList(recordType);
    for (Record r : records) out.records.add(r.copy());
    return out;
  }

  public List<Record> asList() {
    return Collections.unmodifiableList(records);
  }

  @Override
  public Iterator<Record> iterator() {
    return asList().iterator();
  }

  public Iterable<Record> reversed() {
    return () -> new Iterator<>() {
      private final ListIterator<Record> it = records.listIterator(records.size());
      @Override public boolean hasNext() { return it.hasPrevious(); }
      @Override public Record next() { return it.previous(); }
    };
  }

  public Iterable<Object> column(String fieldName) {
    int idx = recordType.indexOf(fieldName);
    return () -> records.stream().map(r -> r.valueAt(idx)).iterator();
  }

  public <T> Iterable<T> column(Field<T> field) {
    int idx = recordType.indexOf(field.name());
    return () -> records.stream().map(r -> field.cast(r.valueAt(idx))).iterator();
  }

  private Record check(Record r) {
    Objects.requireNonNull(r, "record");
    if (r.type() != recordType) {
      throw new SchemaViolationException("Record list of '" + recordType.name()
          + "' can not hold a record of type '" + r.type().name() + "'");
    }
    return r;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    RecordList other = (RecordList) o;
    return recordType == other.recordType && records.equals(other.records);
  }

  @Override
  public int hashCode() {
    return 31 * recordType.name().hashCode() + records.hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "<" + recordType.name() + ">" + records;
  }
}
