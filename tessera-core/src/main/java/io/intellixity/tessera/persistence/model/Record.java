package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.field.Field;

import java.util.*;

/**
 * Fixed-shape instance of a {@link RecordType}.\n
 *
 * Only declared field names are settable and every assignment is validated by the field.\n
 */
public final class Record {
  private final RecordType type;
  private final Object[] values;

  Record(RecordType type) {
    this.type = type;
    this.values = new Object[type.size()];
  }

  public RecordType type() { return type; }

  public Object get(String fieldName) {
    return values[type.indexOf(fieldName)];
  }

  public <T> T get(Field<T> field) {
    return field.cast(values[type.indexOf(field.name())]);
  }

  public Record set(String fieldName, Object value) {
    setAt(type.indexOf(fieldName), value);
    return this;
  }

  public <T> Record set(Field<T> field, T value) {
    return set(field.name(), value);
  }

  void setAt(int i, Object value) {
    values[i] = type.fields().get(i).validate(value);
  }

  Object valueAt(int i) {
    return values[i];
  }

  /** Values in field declaration order. */
  public List<Object> values() {
    return Collections.unmodifiableList(Arrays.asList(values.clone()));
  }

  public void clear() {
    Arrays.fill(values, null);
  }

  public Record copy() {
    Record r = new Record(type);
    System.arraycopy(values, 0, r.values, 0, values.length);
    return r;
  }

  /** Re-resolves every field against the context; context values override stored ones. */
  public Record propagate(Context context) {
    List<Field<?>> fields = type.fields();
    for (int i = 0; i < values.length; i++) {
      values[i] = refresh(fields.get(i), values[i], context);
    }
    return this;
  }

  /** First non-null value held by a field bound to {@code contextKey}, or null. */
  public Object valueForContextKey(String contextKey) {
    List<Field<?>> fields = type.fields();
    for (int i = 0; i < values.length; i++) {
      if (contextKey.equals(fields.get(i).contextKey()) && values[i] != null) return values[i];
    }
    return null;
  }

  private static <T> T refresh(Field<T> field, Object stored, Context context) {
    return field.refresh(field.cast(stored), context);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Record other)) return false;
    return type == other.type && Arrays.deepEquals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * type.name().hashCode() + Arrays.deepHashCode(values);
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", type.name() + "(", ")");
    List<Field<?>> fields = type.fields();
    for (int i = 0; i < values.length; i++) {
      Object v = values[i];
      sj.add(fields.get(i).name() + "=" + (v instanceof byte[] b ? "<" + b.length + " bytes>" : v));
    }
    return sj.toString();
  }
}
