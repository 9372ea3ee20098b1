package io.intellixity.tessera.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Reads result sets into positional rows; column values come straight from {@code getObject}. */
final class JdbcRows {
  private JdbcRows() {}

  static List<Object[]> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int width = md.getColumnCount();
    List<Object[]> out = new ArrayList<>();
    while (rs.next()) {
      Object[] row = new Object[width];
      for (int i = 0; i < width; i++) row[i] = rs.getObject(i + 1);
      out.add(row);
    }
    return out;
  }
}
