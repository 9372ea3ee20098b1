package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

public record DeleteAst(
    String schema,
    String table,
    List<ColumnBind> where
) implements DmlAst {
  public DeleteAst {
    where = where == null ? List.of() : List.copyOf(where);
  }
}
