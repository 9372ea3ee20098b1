package io.intellixity.tessera.persistence.tx;

/** Progress of the last orchestrated operation on a transaction. */
public enum TxStage {
  IDLE,
  CONTEXT_BUILT,
  HOOK_RUN,
  VERIFIED,
  EXECUTING,
  COMMITTED,
  ABORTED
}
