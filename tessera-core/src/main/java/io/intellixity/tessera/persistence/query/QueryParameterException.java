package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.TesseraException;

/** A placeholder in query text has no matching parameter field. */
public final class QueryParameterException extends TesseraException {
  public QueryParameterException(String message) {
    super(message);
  }
}
