package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

public record InsertAst(
    String schema,
    String table,
    List<ColumnBind> columns
) implements DmlAst {
  public InsertAst {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
