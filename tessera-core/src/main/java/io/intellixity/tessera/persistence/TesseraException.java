package io.intellixity.tessera.persistence;

/** Root of every failure raised by tessera itself. Driver failures arrive wrapped in a subclass. */
public class TesseraException extends RuntimeException {
  public TesseraException(String message) {
    super(message);
  }

  public TesseraException(String message, Throwable cause) {
    super(message, cause);
  }
}
