package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.TesseraException;

/** A value failed the type or format check of the field it was assigned to. */
public final class ValidationException extends TesseraException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  static ValidationException mismatch(FieldType<?> type, Object value) {
    return new ValidationException("expected " + type.id() + " but got "
        + value.getClass().getSimpleName() + " '" + value + "'");
  }
}
