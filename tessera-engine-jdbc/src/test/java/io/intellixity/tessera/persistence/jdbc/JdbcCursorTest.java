package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.exec.DatabaseException;
import io.intellixity.tessera.persistence.exec.IsolationLevel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcCursorTest {
  private Connection conn;
  private JdbcCursor cursor;

  @BeforeEach
  void open() throws SQLException {
    conn = DriverManager.getConnection("jdbc:sqlite::memory:");
    cursor = new JdbcCursor("memory", conn);
    cursor.execute("CREATE TABLE t (id INTEGER PRIMARY KEY, name TEXT)", List.of());
  }

  @AfterEach
  void close() throws SQLException {
    conn.close();
  }

  private int count() {
    return ((Number) cursor.execute("SELECT count(*) FROM t", List.of()).get(0)[0]).intValue();
  }

  @Test
  void statementsWithoutResultSetReturnNoRows() {
    assertTrue(cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(1, "a")).isEmpty());
    assertEquals(1, count());
  }

  @Test
  void rowsComeBackPositionally() {
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(1, "a"));
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", Arrays.asList(2, null));

    List<Object[]> rows = cursor.execute("SELECT id, name FROM t ORDER BY id", null);
    assertEquals(2, rows.size());
    assertEquals(1, ((Number) rows.get(0)[0]).intValue());
    assertEquals("a", rows.get(0)[1]);
    assertNull(rows.get(1)[1]);
  }

  @Test
  void rollbackDiscardsTheScope() throws SQLException {
    cursor.begin(IsolationLevel.DEFAULT);
    assertFalse(conn.getAutoCommit());
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(1, "a"));
    cursor.rollback();

    assertEquals(0, count());
    assertTrue(conn.getAutoCommit());
  }

  @Test
  void commitKeepsTheScope() throws SQLException {
    cursor.begin(IsolationLevel.SERIALIZABLE);
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(1, "a"));
    cursor.commit();

    assertEquals(1, count());
    assertTrue(conn.getAutoCommit());
  }

  @Test
  void failedCommitLeavesTheScopeOpenForRollback() throws SQLException {
    cursor.execute("PRAGMA foreign_keys = ON", List.of());
    cursor.execute("CREATE TABLE child (id INTEGER PRIMARY KEY, "
        + "t_id INTEGER REFERENCES t(id) DEFERRABLE INITIALLY DEFERRED)", List.of());

    cursor.begin(IsolationLevel.DEFAULT);
    cursor.execute("INSERT INTO child (id, t_id) VALUES (?, ?)", List.of(1, 99));
    DatabaseException e = assertThrows(DatabaseException.class, cursor::commit);
    assertTrue(e.getMessage().startsWith("Commit failed on cursor 'memory'"), e.getMessage());
    assertInstanceOf(SQLException.class, e.getCause());
    assertTrue(cursor.inScope());
    assertFalse(conn.getAutoCommit());

    cursor.rollback();
    assertFalse(cursor.inScope());
    assertTrue(conn.getAutoCommit());
    assertEquals(0, ((Number) cursor.execute("SELECT count(*) FROM child", List.of()).get(0)[0]).intValue());
  }

  @Test
  void previousAutoCommitModeIsRestored() throws SQLException {
    conn.setAutoCommit(false);
    cursor.begin(IsolationLevel.DEFAULT);
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(1, "a"));
    cursor.commit();
    assertFalse(conn.getAutoCommit());

    cursor.begin(IsolationLevel.DEFAULT);
    cursor.execute("INSERT INTO t (id, name) VALUES (?, ?)", List.of(2, "b"));
    cursor.rollback();
    assertFalse(conn.getAutoCommit());
    assertEquals(1, count());
  }

  @Test
  void manualTransactionsLeaveTheConnectionAlone() throws SQLException {
    cursor.begin(IsolationLevel.MANUAL_TRANSACTIONS);
    assertTrue(conn.getAutoCommit());
  }

  @Test
  void driverErrorsBecomeDatabaseExceptions() {
    DatabaseException e = assertThrows(DatabaseException.class,
        () -> cursor.execute("SELECT * FROM missing_table", List.of()));
    assertInstanceOf(SQLException.class, e.getCause());
    assertTrue(e.getMessage().contains("'memory'"));
  }

  @Test
  void isolationLevelsMapToJdbcConstants() {
    assertEquals(Connection.TRANSACTION_READ_COMMITTED, JdbcCursor.jdbcIsolation(IsolationLevel.READ_COMMITTED));
    assertEquals(Connection.TRANSACTION_SERIALIZABLE, JdbcCursor.jdbcIsolation(IsolationLevel.SERIALIZABLE));
    assertThrows(IllegalArgumentException.class, () -> JdbcCursor.jdbcIsolation(IsolationLevel.DEFAULT));
  }
}
