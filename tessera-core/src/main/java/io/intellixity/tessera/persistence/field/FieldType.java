package io.intellixity.tessera.persistence.field;

/**
 * Semantic value type of a field.\n
 *
 * {@link #convert} is the single validation point for assignments: it receives a non-null value and either\n
 * returns the canonical Java representation or throws {@link ValidationException}.\n
 */
public interface FieldType<T> {
  String id();

  SqlKind kind();

  Class<T> javaType();

  T convert(Object value);

  /** Total digits for numerics, maximum length for sized text; 0 when not applicable. */
  default int precision() { return 0; }

  default int scale() { return 0; }
}
