package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.exec.Cursor;

import java.util.Objects;

/** What a generator may use to produce a value: the operation's cursor and dialect. */
public record GeneratorSource(Cursor cursor, Dialect dialect) {
  public GeneratorSource {
    Objects.requireNonNull(dialect, "dialect");
  }
}
