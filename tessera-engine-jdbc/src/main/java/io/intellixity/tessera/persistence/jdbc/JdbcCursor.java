package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.exec.Cursor;
import io.intellixity.tessera.persistence.exec.DatabaseException;
import io.intellixity.tessera.persistence.exec.IsolationLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * {@link Cursor} over one JDBC {@link Connection}.\n
 *
 * The connection is owned by the caller: it is never opened, pooled or closed here. {@link #begin} switches\n
 * auto-commit off; a successful commit or any rollback puts back the auto-commit mode and isolation the\n
 * connection had before.\n
 */
public final class JdbcCursor implements Cursor {
  private static final Logger log = LoggerFactory.getLogger(JdbcCursor.class);

  private final String id;
  private final Connection conn;
  private Boolean previousAutoCommit;
  private Integer previousIsolation;

  public JdbcCursor(Connection conn) {
    this("jdbc", conn);
  }

  public JdbcCursor(String id, Connection conn) {
    this.id = Objects.requireNonNull(id, "id");
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  public String id() { return id; }
  public Connection connection() { return conn; }

  @Override
  public List<Object[]> execute(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    List<?> ps = params == null ? List.of() : params;
    long start = System.nanoTime();
    debugSql(sql, ps);
    try (PreparedStatement st = conn.prepareStatement(sql)) {
      for (int i = 0; i < ps.size(); i++) bind(st, i + 1, ps.get(i));
      if (!st.execute()) {
        int n = st.getUpdateCount();
        debugDone(sql, "updated=" + n, System.nanoTime() - start);
        return List.of();
      }
      try (ResultSet rs = st.getResultSet()) {
        List<Object[]> out = JdbcRows.readAll(rs);
        debugDone(sql, "rows=" + out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new DatabaseException("Statement failed on cursor '" + id + "': " + e.getMessage(), e);
    }
  }

  @Override
  public void begin(IsolationLevel level) {
    Objects.requireNonNull(level, "level");
    if (level == IsolationLevel.MANUAL_TRANSACTIONS) return;
    try {
      previousAutoCommit = conn.getAutoCommit();
      if (level != IsolationLevel.DEFAULT) {
        previousIsolation = conn.getTransactionIsolation();
        conn.setTransactionIsolation(jdbcIsolation(level));
      }
      conn.setAutoCommit(false);
      log.debug("tessera.jdbc op=BEGIN cursor={} isolation={}", id, level);
    } catch (SQLException e) {
      throw endScopeAfter(new DatabaseException("Failed to begin a transaction on cursor '" + id + "'", e));
    }
  }

  /**
   * Commits the open scope. A failed commit leaves the scope open so that the caller's {@link #rollback()}
   * still runs inside it.
   */
  @Override
  public void commit() {
    try {
      conn.commit();
    } catch (SQLException e) {
      throw new DatabaseException("Commit failed on cursor '" + id + "': " + e.getMessage(), e);
    }
    log.debug("tessera.jdbc op=COMMIT cursor={}", id);
    endScope();
  }

  @Override
  public void rollback() {
    try {
      conn.rollback();
    } catch (SQLException e) {
      throw endScopeAfter(new DatabaseException("Rollback failed on cursor '" + id + "'", e));
    }
    log.debug("tessera.jdbc op=ROLLBACK cursor={}", id);
    endScope();
  }

  boolean inScope() {
    return previousAutoCommit != null;
  }

  private void endScope() {
    Boolean autoCommit = previousAutoCommit;
    Integer isolation = previousIsolation;
    previousAutoCommit = null;
    previousIsolation = null;
    try {
      if (autoCommit != null) conn.setAutoCommit(autoCommit);
      if (isolation != null) conn.setTransactionIsolation(isolation);
    } catch (SQLException e) {
      throw new DatabaseException("Failed to restore connection state on cursor '" + id + "'", e);
    }
  }

  private DatabaseException endScopeAfter(DatabaseException failure) {
    try {
      endScope();
    } catch (DatabaseException restore) {
      failure.addSuppressed(restore);
    }
    return failure;
  }

  private static void bind(PreparedStatement st, int index, Object value) throws SQLException {
    if (value == null) st.setNull(index, Types.NULL);
    else st.setObject(index, value);
  }

  static int jdbcIsolation(IsolationLevel level) {
    return switch (level) {
      case READ_UNCOMMITTED -> Connection.TRANSACTION_READ_UNCOMMITTED;
      case READ_COMMITTED -> Connection.TRANSACTION_READ_COMMITTED;
      case REPEATABLE_READ -> Connection.TRANSACTION_REPEATABLE_READ;
      case SERIALIZABLE -> Connection.TRANSACTION_SERIALIZABLE;
      case DEFAULT, MANUAL_TRANSACTIONS -> throw new IllegalArgumentException("No JDBC isolation for " + level);
    };
  }

  private void debugSql(String sql, List<?> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc op={} cursor={} paramCount={} sql={}", verb(sql), id, params.size(), sql);

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : params) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof byte[] b) ? b.length : -1;
        log.trace("tessera.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String sql, String result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessera.jdbc_done op={} cursor={} durationMs={} result={}",
        verb(sql), id, durationNanos / 1_000_000.0, result);
  }

  private static String verb(String sql) {
    String s = sql.stripLeading();
    int sp = 0;
    while (sp < s.length() && !Character.isWhitespace(s.charAt(sp))) sp++;
    return s.substring(0, sp).toUpperCase(Locale.ROOT);
  }
}
