package io.intellixity.tessera.persistence.dmlast;

import java.util.Objects;

public record ColumnBind(String column, Bind bind) {
  public ColumnBind {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(bind, "bind");
  }
}
