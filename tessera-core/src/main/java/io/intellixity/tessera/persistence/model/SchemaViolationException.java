package io.intellixity.tessera.persistence.model;

import io.intellixity.tessera.persistence.TesseraException;

/** An instance was asked to hold something its schema does not declare. */
public final class SchemaViolationException extends TesseraException {
  public SchemaViolationException(String message) {
    super(message);
  }
}
