package io.intellixity.tessera.persistence.table;

import java.util.List;
import java.util.Objects;

/** {@code columns} reference {@code referencedColumns} of {@code referencedTable}, position by position. */
public record ForeignKey(String name, List<String> columns, String referencedTable, List<String> referencedColumns)
    implements Constraint {
  public ForeignKey {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(referencedTable, "referencedTable");
    columns = List.copyOf(columns);
    referencedColumns = referencedColumns == null || referencedColumns.isEmpty() ? columns : List.copyOf(referencedColumns);
    if (columns.isEmpty()) throw new IllegalArgumentException("Foreign key '" + name + "' has no columns");
    if (columns.size() != referencedColumns.size()) {
      throw new IllegalArgumentException("Foreign key '" + name + "' maps " + columns.size()
          + " columns onto " + referencedColumns.size());
    }
  }
}
