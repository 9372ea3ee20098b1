package io.intellixity.tessera.persistence.exec;

import java.util.List;

/**
 * Minimal database capability the orchestrator needs.\n
 *
 * Implementations wrap one connection; tessera never opens or pools connections itself.\n
 */
public interface Cursor {
  /**
   * Execute one statement with positional parameters.\n
   * Returns the fetched rows (empty for statements that produce no result set).\n
   */
  List<Object[]> execute(String sql, List<?> params);

  void begin(IsolationLevel level);

  void commit();

  void rollback();
}
