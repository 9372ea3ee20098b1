package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.context.Context;

import java.util.Objects;

/**
 * Immutable description of one typed slot: name, column name, value type, nullability,\n
 * optional context key, optional value generator.\n
 *
 * Fields carry no value themselves; records, queries and transactions hold the values and call\n
 * {@link #validate}, {@link #refresh} and {@link #update} on them.\n
 */
public final class Field<T> {
  private final String name;
  private final String sqlName;
  private final FieldType<T> type;
  private final boolean nullable;
  private final String contextKey;
  private final ValueGenerator<?> generator;
  private final FieldResolver resolver;

  private Field(String name, String sqlName, FieldType<T> type, boolean nullable,
                String contextKey, ValueGenerator<?> generator, FieldResolver resolver) {
    this.name = name;
    this.sqlName = sqlName;
    this.type = type;
    this.nullable = nullable;
    this.contextKey = contextKey;
    this.generator = generator;
    this.resolver = resolver;
  }

  public static <T> Field<T> of(String name, FieldType<T> type) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("Field name must not be blank");
    return new Field<>(name, name, type, true, null, null, FieldResolver.CONTEXT);
  }

  public Field<T> withSqlName(String sqlName) {
    Objects.requireNonNull(sqlName, "sqlName");
    return new Field<>(name, sqlName, type, nullable, contextKey, generator, resolver);
  }

  public Field<T> notNull() {
    return new Field<>(name, sqlName, type, false, contextKey, generator, resolver);
  }

  public Field<T> withContextKey(String key) {
    Objects.requireNonNull(key, "key");
    return new Field<>(name, sqlName, type, nullable, key, generator, resolver);
  }

  public Field<T> generatedBy(ValueGenerator<?> g) {
    Objects.requireNonNull(g, "generator");
    return new Field<>(name, sqlName, type, nullable, contextKey, g, resolver);
  }

  /** Row number taken from (and advanced in) the context counter {@code counterKey}, starting at 1. */
  public Field<T> rowEnumerated(String counterKey) {
    return rowEnumerated(counterKey, 1);
  }

  public Field<T> rowEnumerated(String counterKey, int start) {
    Objects.requireNonNull(counterKey, "counterKey");
    return new Field<>(name, sqlName, type, nullable, contextKey, generator,
        FieldResolver.rowEnumeration(counterKey, start));
  }

  public String name() { return name; }
  public String sqlName() { return sqlName; }
  public FieldType<T> type() { return type; }
  public boolean nullable() { return nullable; }
  public String contextKey() { return contextKey; }
  public ValueGenerator<?> generator() { return generator; }

  /** Key this field occupies when it is a transaction's own context field. */
  public String contextName() {
    return contextKey != null ? contextKey : name;
  }

  public T validate(Object value) {
    if (value == null) {
      if (nullable) return null;
      throw new ValidationException("Field '" + name + "' can not be null");
    }
    try {
      return type.convert(value);
    } catch (ValidationException e) {
      throw new ValidationException("Invalid value for field '" + name + "': " + e.getMessage(), e);
    }
  }

  /** Idempotent: same stored value and context give the same result. */
  public T refresh(T stored, Context context) {
    Object resolved = resolver.resolve(this, stored, context);
    if (resolved == stored || resolved == null) return stored;
    return validate(resolved);
  }

  /**
   * Asks the generator for a new value and records it under the context key when there is one.\n
   * Without a generator this is {@link #refresh}.\n
   */
  public T update(T stored, Context context, GeneratorSource source) {
    if (generator == null) return refresh(stored, context);
    Object raw;
    try {
      raw = generator.next(source, context);
    } catch (GenerationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GenerationException("Failed to generate a value for field '" + name + "'", e);
    }
    if (raw == null) throw new GenerationException("Generator for field '" + name + "' produced no value");

    T value;
    try {
      value = validate(raw);
    } catch (ValidationException e) {
      throw new GenerationException("Generated value for field '" + name + "' is invalid", e);
    }
    if (contextKey != null && context != null) context.put(contextKey, value);
    return value;
  }

  /** Casts a value that already went through {@link #validate}. */
  public T cast(Object value) {
    return value == null ? null : type.javaType().cast(value);
  }

  @Override
  public String toString() {
    return "Field(" + name + (sqlName.equals(name) ? "" : " as " + sqlName) + " " + type.id()
        + (nullable ? "" : " not null")
        + (contextKey == null ? "" : " context=" + contextKey) + ")";
  }
}
