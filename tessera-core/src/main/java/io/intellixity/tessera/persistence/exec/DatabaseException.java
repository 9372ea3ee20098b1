package io.intellixity.tessera.persistence.exec;

import io.intellixity.tessera.persistence.TesseraException;

/** Failure reported by the underlying driver, passed through with the original cause. */
public final class DatabaseException extends TesseraException {
  public DatabaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
