package io.intellixity.tessera.persistence.dialect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessera.persistence.dmlast.*;
import io.intellixity.tessera.persistence.field.FieldType;
import io.intellixity.tessera.persistence.field.SqlKind;

import java.util.ArrayList;
import java.util.List;

/**
 * SQL dialect base.\n
 *
 * Renders INSERT/UPDATE/DELETE/SELECT from {@link DmlAst} plans with ANSI double-quoted identifiers.\n
 * Backend specifics (bind markers, column types, value adaptation, sequences) are left to subclasses.\n
 */
public abstract class AbstractSqlDialect implements Dialect {
  protected static final ObjectMapper JSON = new ObjectMapper();

  protected final class RenderCtx {
    private int n = 1;
    private final List<Object> params = new ArrayList<>();

    public String add(Bind b) {
      params.add(toBackend(b.type(), b.value()));
      int pos = n++;
      return bindMarker(pos, "p" + pos);
    }

    public SqlStatement statement(String sql) {
      return new SqlStatement(sql, params);
    }
  }

  @Override
  public final SqlStatement render(DmlAst dml) {
    if (dml instanceof InsertAst ins) return renderInsert(ins);
    if (dml instanceof UpdateAst upd) return renderUpdate(upd);
    if (dml instanceof DeleteAst del) return renderDelete(del);
    if (dml instanceof SelectAst sel) return renderSelect(sel);
    throw new IllegalArgumentException("Unknown DmlAst: " + dml);
  }

  @Override
  public String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  protected SqlStatement renderInsert(InsertAst ins) {
    if (ins.columns().isEmpty()) throw new IllegalArgumentException("INSERT into " + ins.table() + " has no columns");
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> markers = new ArrayList<>();
    for (ColumnBind cb : ins.columns()) {
      cols.add(quoteIdent(cb.column()));
      markers.add(ctx.add(cb.bind()));
    }
    String sql = "INSERT INTO " + qualify(ins.schema(), ins.table())
        + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", markers) + ")";
    return ctx.statement(sql);
  }

  protected SqlStatement renderUpdate(UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("UPDATE of " + upd.table() + " has nothing to set");
    if (upd.where().isEmpty()) throw new IllegalArgumentException("UPDATE of " + upd.table() + " has no WHERE clause");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) sets.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.bind()));
    String sql = "UPDATE " + qualify(upd.schema(), upd.table())
        + " SET " + String.join(", ", sets)
        + renderWhere(upd.where(), ctx);
    return ctx.statement(sql);
  }

  protected SqlStatement renderDelete(DeleteAst del) {
    if (del.where().isEmpty()) throw new IllegalArgumentException("DELETE from " + del.table() + " has no WHERE clause");
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + qualify(del.schema(), del.table()) + renderWhere(del.where(), ctx);
    return ctx.statement(sql);
  }

  protected SqlStatement renderSelect(SelectAst sel) {
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    for (String c : sel.columns()) cols.add(quoteIdent(c));
    String projection = cols.isEmpty() ? "*" : String.join(", ", cols);
    String sql = "SELECT " + projection + " FROM " + qualify(sel.schema(), sel.table()) + renderWhere(sel.where(), ctx);
    return ctx.statement(sql);
  }

  private String renderWhere(List<ColumnBind> where, RenderCtx ctx) {
    if (where.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (ColumnBind cb : where) parts.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.bind()));
    return " WHERE " + String.join(" AND ", parts);
  }

  @Override
  public Object toBackend(FieldType<?> type, Object value) {
    if (value == null) return null;
    if (type.kind() == SqlKind.ENUM && value instanceof Enum<?> e) return e.name();
    if (type.kind() == SqlKind.JSON) return encodeJson(value);
    return value;
  }

  @Override
  public Object fromBackend(FieldType<?> type, Object raw) {
    if (raw == null) return null;
    if (type.kind() == SqlKind.JSON) return decodeJson(raw);
    return raw;
  }

  /** Strings are taken as JSON text already; anything else is serialized. */
  protected static Object encodeJson(Object value) {
    if (value instanceof String) return value;
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-encode value", e);
    }
  }

  protected static Object decodeJson(Object raw) {
    if (!(raw instanceof String s)) return raw;
    try {
      return JSON.readValue(s, Object.class);
    } catch (JsonProcessingException e) {
      // Not JSON text; keep the string as stored.
      return s;
    }
  }
}
