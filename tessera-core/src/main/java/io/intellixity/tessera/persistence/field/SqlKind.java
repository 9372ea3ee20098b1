package io.intellixity.tessera.persistence.field;

/** Backend-neutral column families a dialect maps to concrete column types. */
public enum SqlKind {
  SMALLINT,
  INTEGER,
  BIGINT,
  NUMERIC,
  REAL,
  BOOLEAN,
  TEXT,
  VARCHAR,
  CHAR,
  TIMESTAMP,
  TIMESTAMPTZ,
  DATE,
  TIME,
  UUID,
  JSON,
  BLOB,
  ENUM
}
