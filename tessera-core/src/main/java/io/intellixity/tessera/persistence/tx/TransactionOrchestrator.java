package io.intellixity.tessera.persistence.tx;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.dialect.SqliteDialect;
import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.exec.IsolationLevel;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordList;
import io.intellixity.tessera.persistence.query.QueryResult;
import io.intellixity.tessera.persistence.table.RelationType;
import io.intellixity.tessera.persistence.table.SchemaException;
import io.intellixity.tessera.persistence.table.TableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs the coordinated operations of a {@link Transaction}.\n
 *
 * Every operation goes CONTEXT_BUILT -> HOOK_RUN -> VERIFIED -> EXECUTING -> COMMITTED inside one\n
 * cursor scope (context_select executes before its hook). Any exception moves the transaction to ABORTED,\n
 * rolls the scope back and is rethrown unchanged. With {@link IsolationLevel#MANUAL_TRANSACTIONS}\n
 * the caller owns begin/commit/rollback.\n
 */
public final class TransactionOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(TransactionOrchestrator.class);

  private final Dialect defaultDialect;

  public TransactionOrchestrator() {
    this(new SqliteDialect());
  }

  public TransactionOrchestrator(Dialect defaultDialect) {
    this.defaultDialect = Objects.requireNonNull(defaultDialect, "defaultDialect");
  }

  public Dialect defaultDialect() { return defaultDialect; }

  /** Context from {@code update()} on every own field (generators run before the scope opens), then INSERT. */
  public Context insertNew(Transaction tx, Cursor cursor, Dialect dialect) {
    Dialect d = dialectOrDefault(dialect);
    return run("insert_new", tx, cursor, () -> tx.updatedContext(cursor, d), null, ctx -> {
      tx.type().hooks().preInsert(tx, ctx, cursor, d);
      stage(tx, "insert_new", TxStage.HOOK_RUN);
      verify(tx, ctx);
      stage(tx, "insert_new", TxStage.VERIFIED);
      stage(tx, "insert_new", TxStage.EXECUTING);
      insertMembers(tx, ctx, cursor, d);
    });
  }

  /** As {@link #insertNew} but the context comes from {@code refresh()}. */
  public Context insertExisting(Transaction tx, Cursor cursor, Dialect dialect) {
    Dialect d = dialectOrDefault(dialect);
    return run("insert_existing", tx, cursor, tx::refreshedContext, null, ctx -> {
      tx.type().hooks().preInsert(tx, ctx, cursor, d);
      stage(tx, "insert_existing", TxStage.HOOK_RUN);
      verify(tx, ctx);
      stage(tx, "insert_existing", TxStage.VERIFIED);
      stage(tx, "insert_existing", TxStage.EXECUTING);
      insertMembers(tx, ctx, cursor, d);
    });
  }

  /** UPDATE of every table record by primary key; tables without a primary key fail before the scope opens. */
  public Context update(Transaction tx, Cursor cursor, Dialect dialect) {
    Dialect d = dialectOrDefault(dialect);
    return run("update", tx, cursor, tx::refreshedContext, () -> requirePrimaryKeys(tx), ctx -> {
      tx.type().hooks().preUpdate(tx, ctx, cursor, d);
      stage(tx, "update", TxStage.HOOK_RUN);
      verify(tx, ctx);
      stage(tx, "update", TxStage.VERIFIED);
      stage(tx, "update", TxStage.EXECUTING);
      updateMembers(tx, ctx, cursor, d);
    });
  }

  /** DELETE of every table record by primary key, members last to first. */
  public Context delete(Transaction tx, Cursor cursor, Dialect dialect) {
    Dialect d = dialectOrDefault(dialect);
    return run("delete", tx, cursor, tx::refreshedContext, () -> requirePrimaryKeys(tx), ctx -> {
      tx.type().hooks().preDelete(tx, ctx, cursor, d);
      stage(tx, "delete", TxStage.HOOK_RUN);
      verify(tx, ctx);
      stage(tx, "delete", TxStage.VERIFIED);
      stage(tx, "delete", TxStage.EXECUTING);
      deleteMembers(tx, ctx, cursor, d);
    });
  }

  /**
   * Replaces every member with what the database holds for the current context. A relation with no\n
   * context-bound field fails with UnboundQueryException unless {@code allowUnlimited} is set.\n
   */
  public Context contextSelect(Transaction tx, Cursor cursor, Dialect dialect, boolean allowUnlimited) {
    Dialect d = dialectOrDefault(dialect);
    return run("context_select", tx, cursor, tx::refreshedContext, null, ctx -> {
      stage(tx, "context_select", TxStage.EXECUTING);
      selectMembers(tx, ctx, cursor, d, allowUnlimited);
      tx.type().hooks().postSelect(tx, ctx, cursor, d);
      stage(tx, "context_select", TxStage.HOOK_RUN);
      verify(tx, ctx);
      stage(tx, "context_select", TxStage.VERIFIED);
    });
  }

  @FunctionalInterface
  private interface Body {
    void run(Context ctx);
  }

  private Context run(String op, Transaction tx, Cursor cursor, Supplier<Context> contextBuilder,
                      Runnable precondition, Body body) {
    Objects.requireNonNull(tx, "tx");
    Objects.requireNonNull(cursor, "cursor");
    stage(tx, op, TxStage.IDLE);

    Context ctx;
    try {
      ctx = contextBuilder.get();
      stage(tx, op, TxStage.CONTEXT_BUILT);
      if (precondition != null) precondition.run();
    } catch (RuntimeException e) {
      stage(tx, op, TxStage.ABORTED);
      throw e;
    }

    boolean managed = tx.type().isolationLevel() != IsolationLevel.MANUAL_TRANSACTIONS;
    if (managed) {
      try {
        cursor.begin(tx.type().isolationLevel());
      } catch (RuntimeException e) {
        stage(tx, op, TxStage.ABORTED);
        throw e;
      }
    }

    try {
      body.run(ctx);
      if (managed) cursor.commit();
      stage(tx, op, TxStage.COMMITTED);
      return ctx;
    } catch (RuntimeException e) {
      stage(tx, op, TxStage.ABORTED);
      if (managed) rollback(op, tx, cursor, e);
      throw e;
    }
  }

  private void rollback(String op, Transaction tx, Cursor cursor, RuntimeException cause) {
    try {
      cursor.rollback();
    } catch (RuntimeException re) {
      cause.addSuppressed(re);
      log.warn("tessera.tx op={} transaction={} rollback failed", op, tx.type().name(), re);
    }
  }

  // ---- per-member execution ----

  private void insertMembers(Transaction tx, Context ctx, Cursor cursor, Dialect d) {
    // Row enumerators advance counters; keep them out of the caller's context.
    Context working = ctx.copy();
    for (Member m : tx.type().members()) {
      if (!(m.recordType() instanceof TableType table) || m.kind() == Member.Kind.QUERY_RESULT) continue;
      for (Record r : records(tx, m)) {
        r.propagate(working);
        execute(cursor, "INSERT", tx, m, table.insertStatement(r, d));
      }
    }
  }

  private void updateMembers(Transaction tx, Context ctx, Cursor cursor, Dialect d) {
    Context working = ctx.copy();
    for (Member m : tx.type().members()) {
      if (!(m.recordType() instanceof TableType table) || m.kind() == Member.Kind.QUERY_RESULT) continue;
      if (!table.hasUpdatableColumns()) {
        log.debug("tessera.tx op=update transaction={} member={} skipped: every column is a key", tx.type().name(), m.name());
        continue;
      }
      for (Record r : records(tx, m)) {
        r.propagate(working);
        execute(cursor, "UPDATE", tx, m, table.updateStatement(r, d));
      }
    }
  }

  private void deleteMembers(Transaction tx, Context ctx, Cursor cursor, Dialect d) {
    // Propagate in declaration order so row numbers match the ones written on insert.
    Context working = ctx.copy();
    for (Member m : tx.type().members()) {
      if (!(m.recordType() instanceof TableType) || m.kind() == Member.Kind.QUERY_RESULT) continue;
      for (Record r : records(tx, m)) r.propagate(working);
    }
    List<Member> members = tx.type().members();
    for (ListIterator<Member> it = members.listIterator(members.size()); it.hasPrevious(); ) {
      Member m = it.previous();
      if (!(m.recordType() instanceof TableType table) || m.kind() == Member.Kind.QUERY_RESULT) continue;
      Object v = tx.memberValue(m.name());
      Iterable<Record> rs = v instanceof RecordList list ? list.reversed() : records(tx, m);
      for (Record r : rs) execute(cursor, "DELETE", tx, m, table.deleteStatement(r, d));
    }
  }

  private void selectMembers(Transaction tx, Context ctx, Cursor cursor, Dialect d, boolean allowUnlimited) {
    for (Member m : tx.type().members()) {
      Object v = tx.memberValue(m.name());
      switch (m.kind()) {
        case RECORD -> {
          if (m.recordType() instanceof RelationType rel) {
            List<Object[]> rows = execute(cursor, "SELECT", tx, m, rel.contextSelectStatement(ctx, d, allowUnlimited));
            tx.replaceRecord(m.name(), rows.isEmpty() ? null : rel.fromRow(rows.get(0), d));
          } else {
            tx.replaceRecord(m.name(), null);
          }
        }
        case RECORD_LIST -> {
          RecordList list = (RecordList) v;
          list.clear();
          if (m.recordType() instanceof RelationType rel) {
            List<Object[]> rows = execute(cursor, "SELECT", tx, m, rel.contextSelectStatement(ctx, d, allowUnlimited));
            for (Object[] row : rows) list.add(rel.fromRow(row, d));
          }
        }
        case QUERY_RESULT -> {
          QueryResult qr = (QueryResult) v;
          qr.query().setContext(ctx);
          qr.refresh(cursor, d);
        }
      }
    }
  }

  private static Iterable<Record> records(Transaction tx, Member m) {
    Object v = tx.memberValue(m.name());
    if (v instanceof RecordList list) return list;
    if (v instanceof Record r) return List.of(r);
    return List.of();
  }

  private List<Object[]> execute(Cursor cursor, String op, Transaction tx, Member m, SqlStatement ss) {
    if (log.isDebugEnabled()) {
      log.debug("tessera.tx op={} transaction={} member={} paramCount={} sql={}",
          op, tx.type().name(), m.name(), ss.params().size(), ss.sql());
    }
    List<Object[]> rows = cursor.execute(ss.sql(), ss.params());
    return rows == null ? List.of() : rows;
  }

  // ---- checks ----

  private static void requirePrimaryKeys(Transaction tx) {
    for (Member m : tx.type().members()) {
      if (m.kind() == Member.Kind.QUERY_RESULT) continue;
      if (m.recordType() instanceof TableType table && table.primaryKey().isEmpty()) {
        throw new SchemaException("Table '" + table.name() + "' (member '" + m.name() + "' of transaction '"
            + tx.type().name() + "') has no primary key");
      }
    }
  }

  private static void verify(Transaction tx, Context ctx) {
    if (!tx.type().hooks().verify(tx, ctx)) {
      throw new VerificationException("Transaction '" + tx.type().name() + "' failed verification");
    }
  }

  private Dialect dialectOrDefault(Dialect dialect) {
    return dialect == null ? defaultDialect : dialect;
  }

  private static void stage(Transaction tx, String op, TxStage s) {
    tx.stage(s);
    if (log.isDebugEnabled()) log.debug("tessera.tx op={} transaction={} stage={}", op, tx.type().name(), s);
  }
}
