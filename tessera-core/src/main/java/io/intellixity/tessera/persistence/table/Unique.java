package io.intellixity.tessera.persistence.table;

import java.util.List;
import java.util.Objects;

public record Unique(String name, List<String> columns) implements Constraint {
  public Unique {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    if (columns.isEmpty()) throw new IllegalArgumentException("Unique constraint '" + name + "' has no columns");
  }
}
