package io.intellixity.tessera.persistence.exec;

public enum IsolationLevel {
  /** The caller owns begin/commit/rollback; orchestrated operations run inside whatever scope is open. */
  MANUAL_TRANSACTIONS,
  /** Begin a transaction without touching the connection's isolation setting. */
  DEFAULT,
  READ_UNCOMMITTED,
  READ_COMMITTED,
  REPEATABLE_READ,
  SERIALIZABLE
}
