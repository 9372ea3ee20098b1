package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.TesseraException;

/** A value generator (sequence, clock, query) failed while a field was being updated. */
public final class GenerationException extends TesseraException {
  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
