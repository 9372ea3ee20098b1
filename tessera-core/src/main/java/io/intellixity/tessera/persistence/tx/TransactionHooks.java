package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.exec.Cursor;

/**
 * Extension points invoked at fixed stages of orchestrated operations.\n
 *
 * Hooks run inside the operation's database scope; throwing from any of them aborts and rolls back.\n
 * Implementations may read and write the transaction and the context.\n
 */
public interface TransactionHooks {
  TransactionHooks DEFAULT = new TransactionHooks() {};

  default void preInsert(Transaction tx, Context context, Cursor cursor, Dialect dialect) {}

  default void preUpdate(Transaction tx, Context context, Cursor cursor, Dialect dialect) {}

  default void preDelete(Transaction tx, Context context, Cursor cursor, Dialect dialect) {}

  /** Default: fill still-null context keys from the fetched members, see {@link Transaction#backPropagate}. */
  default void postSelect(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
    tx.backPropagate(context);
  }

  /** Return false (or throw {@link VerificationException} with a message) to reject the operation. */
  default boolean verify(Transaction tx, Context context) {
    return true;
  }
}
