package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.dialect.Dialect;

import java.util.Objects;

/** Namespace grouping for tables, views and sequences. */
public record Schema(String name) {
  public Schema {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Schema name must not be blank");
  }

  public String qualify(String object, Dialect dialect) {
    return dialect.qualify(name, object);
  }
}
