package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.TesseraException;

/** A table definition lacks (or duplicates) a constraint an operation depends on. */
public final class SchemaException extends TesseraException {
  public SchemaException(String message) {
    super(message);
  }
}
