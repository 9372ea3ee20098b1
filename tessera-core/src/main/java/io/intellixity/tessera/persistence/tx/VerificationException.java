package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.TesseraException;

/** The verify hook rejected the transaction's context or data. */
public final class VerificationException extends TesseraException {
  public VerificationException(String message) {
    super(message);
  }
}
