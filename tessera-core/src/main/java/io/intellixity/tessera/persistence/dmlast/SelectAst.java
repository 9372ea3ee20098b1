package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

/** SELECT of {@code columns}; an empty {@code where} renders no WHERE clause at all. */
public record SelectAst(
    String schema,
    String table,
    List<String> columns,
    List<ColumnBind> where
) implements DmlAst {
  public SelectAst {
    columns = columns == null ? List.of() : List.copyOf(columns);
    where = where == null ? List.of() : List.copyOf(where);
  }
}
