package io.intellixity.tessera.persistence.context;

import java.util.*;

/**
 * Ordered mapping shared by the members of a transaction.\n
 *
 * Keys keep their first insertion position; {@link #put} on an existing key replaces the value in place.\n
 * A key may be present with a null value, which means "declared but not resolved yet".\n
 */
public final class Context implements Iterable<Map.Entry<String, Object>> {
  private final LinkedHashMap<String, Object> values;

  public Context() {
    this.values = new LinkedHashMap<>();
  }

  public Context(Map<String, ?> initial) {
    this.values = new LinkedHashMap<>();
    if (initial != null) {
      for (var e : initial.entrySet()) put(e.getKey(), e.getValue());
    }
  }

  public static Context of(String key, Object value) {
    Context c = new Context();
    c.put(key, value);
    return c;
  }

  public Object get(String key) { return values.get(key); }
  public boolean containsKey(String key) { return values.containsKey(key); }
  public boolean hasValue(String key) { return values.get(key) != null; }
  public int size() { return values.size(); }
  public boolean isEmpty() { return values.isEmpty(); }

  public Context put(String key, Object value) {
    Objects.requireNonNull(key, "key");
    values.put(key, value);
    return this;
  }

  /** Keys in insertion order. */
  public List<String> keys() {
    return List.copyOf(values.keySet());
  }

  public Map<String, Object> asMap() {
    return Collections.unmodifiableMap(values);
  }

  public Context copy() {
    return new Context(values);
  }

  @Override
  public Iterator<Map.Entry<String, Object>> iterator() {
    return asMap().entrySet().iterator();
  }

  /** Order-sensitive: two contexts are equal only when keys appear in the same order. */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Context other)) return false;
    return values.equals(other.values) && keys().equals(other.keys());
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Context" + values;
  }
}
