package io.intellixity.tessera.persistence.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Cursor decorator that logs every statement and scope transition at INFO.\n
 *
 * Parameter values are not logged, only their count.\n
 */
public final class LoggingCursor implements Cursor {
  private static final Logger log = LoggerFactory.getLogger(LoggingCursor.class);

  private final Cursor delegate;
  private final String label;

  public LoggingCursor(Cursor delegate) {
    this(delegate, "cursor");
  }

  public LoggingCursor(Cursor delegate, String label) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.label = label == null ? "cursor" : label;
  }

  @Override
  public List<Object[]> execute(String sql, List<?> params) {
    log.info("tessera.cursor label={} paramCount={} sql={}", label, params == null ? 0 : params.size(), sql);
    List<Object[]> rows = delegate.execute(sql, params);
    log.info("tessera.cursor_done label={} rows={}", label, rows == null ? 0 : rows.size());
    return rows;
  }

  @Override
  public void begin(IsolationLevel level) {
    log.info("tessera.cursor label={} begin isolation={}", label, level);
    delegate.begin(level);
  }

  @Override
  public void commit() {
    log.info("tessera.cursor label={} commit", label);
    delegate.commit();
  }

  @Override
  public void rollback() {
    log.info("tessera.cursor label={} rollback", label);
    delegate.rollback();
  }
}
