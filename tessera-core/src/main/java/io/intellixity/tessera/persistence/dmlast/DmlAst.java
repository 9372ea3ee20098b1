package io.intellixity.tessera.persistence.dmlast;

/** Backend-neutral statement plan rendered to SQL by a dialect. */
public interface DmlAst {
  /** Schema grouping of the target relation, or null. */
  String schema();

  String table();
}
