package io.intellixity.tessera.persistence.table;

import java.util.List;
import java.util.Objects;

public record PrimaryKey(String name, List<String> columns) implements Constraint {
  public PrimaryKey {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    if (columns.isEmpty()) throw new IllegalArgumentException("Primary key '" + name + "' has no columns");
  }
}
