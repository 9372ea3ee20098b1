package io.intellixity.tessera.persistence.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Rendered SQL text plus parameter values in placeholder order (values may be null). */
public record SqlStatement(String sql, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlStatement of(String sql, Object... params) {
    List<Object> ps = new ArrayList<>(params.length);
    Collections.addAll(ps, params);
    return new SqlStatement(sql, ps);
  }
}
