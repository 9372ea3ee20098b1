package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.TesseraException;

/** A statement would run without a restricting WHERE clause. */
public final class UnboundQueryException extends TesseraException {
  public UnboundQueryException(String message) {
    super(message);
  }
}
