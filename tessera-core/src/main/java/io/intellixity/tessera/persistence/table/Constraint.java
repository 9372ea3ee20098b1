package io.intellixity.tessera.persistence.table;

import java.util.List;

/** Structural rule on a table. Columns are given as field names of the table. */
public interface Constraint {
  String name();

  List<String> columns();
}
