package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.exec.Cursor;

import java.util.Objects;

/**
 * Hooks that forward to a parent set; override single methods to specialise an existing transaction type\n
 * and call {@code super} to keep the parent's behaviour.\n
 */
public abstract class ForwardingTransactionHooks implements TransactionHooks {
  private final TransactionHooks parent;

  protected ForwardingTransactionHooks(TransactionHooks parent) {
    this.parent = Objects.requireNonNull(parent, "parent");
  }

  protected TransactionHooks parent() { return parent; }

  @Override
  public void preInsert(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
    parent.preInsert(tx, context, cursor, dialect);
  }

  @Override
  public void preUpdate(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
    parent.preUpdate(tx, context, cursor, dialect);
  }

  @Override
  public void preDelete(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
    parent.preDelete(tx, context, cursor, dialect);
  }

  @Override
  public void postSelect(Transaction tx, Context context, Cursor cursor, Dialect dialect) {
    parent.postSelect(tx, context, cursor, dialect);
  }

  @Override
  public boolean verify(Transaction tx, Context context) {
    return parent.verify(tx, context);
  }
}
