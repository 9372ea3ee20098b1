package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

/** UPDATE with {@code where} conjoined by AND. */
public record UpdateAst(
    String schema,
    String table,
    List<ColumnBind> sets,
    List<ColumnBind> where
) implements DmlAst {
  public UpdateAst {
    sets = sets == null ? List.of() : List.copyOf(sets);
    where = where == null ? List.of() : List.copyOf(where);
  }
}
