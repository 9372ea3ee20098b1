package io.intellixity.tessera.persistence.dialect;

import io.intellixity.tessera.persistence.dmlast.DmlAst;
import io.intellixity.tessera.persistence.field.FieldType;
import io.intellixity.tessera.persistence.sequence.Sequence;

import java.util.List;

/**
 * Backend-specific SQL rules: identifier quoting, bind markers, column types, value adaptation and\n
 * statement quirks.\n
 *
 * Dialects are stateless and passed explicitly to whatever renders SQL.\n
 */
public interface Dialect {
  String id();

  String quoteIdent(String ident);

  /**
   * Marker for the bind parameter at 1-based {@code position}. Named-binding dialects use {@code name};\n
   * positional ones ignore it.\n
   */
  String bindMarker(int position, String name);

  /** True when repeated markers with the same name share one bound value. */
  default boolean namedBinding() { return false; }

  boolean schemaSupport();

  /**
   * Quoted relation name. Without schema support the schema becomes a prefix: {@code schema_name}.\n
   */
  default String qualify(String schema, String name) {
    if (schema == null || schema.isBlank()) return quoteIdent(name);
    if (schemaSupport()) return quoteIdent(schema) + "." + quoteIdent(name);
    return quoteIdent(schema + "_" + name);
  }

  String columnType(FieldType<?> type);

  /** Column definition of a backend-generated integer primary key. */
  String autoIncrementPrimaryKey();

  /** Stored Java value to the representation handed to the driver. */
  Object toBackend(FieldType<?> type, Object value);

  /** Driver value to something {@link FieldType#convert} accepts. */
  Object fromBackend(FieldType<?> type, Object raw);

  SqlStatement render(DmlAst ast);

  List<SqlStatement> createSequence(Sequence sequence);

  /** Statements to run in order; the last one returns the new value in its first column. */
  List<SqlStatement> nextSequenceValue(Sequence sequence);

  List<SqlStatement> resetSequence(Sequence sequence);
}
