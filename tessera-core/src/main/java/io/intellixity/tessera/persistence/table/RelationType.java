package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.dmlast.Bind;
import io.intellixity.tessera.persistence.dmlast.ColumnBind;
import io.intellixity.tessera.persistence.dmlast.SelectAst;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.model.Record;
import io.intellixity.tessera.persistence.model.RecordType;
import io.intellixity.tessera.persistence.model.SchemaViolationException;

import java.util.*;

/**
 * Record type backed by a named relation (table or view) that can be selected from.\n
 */
public abstract class RelationType extends RecordType {
  private final Schema schema;

  protected RelationType(String name, Schema schema, List<Field<?>> fields) {
    super(name, fields);
    this.schema = schema;
  }

  public Schema schema() { return schema; }
  public String schemaName() { return schema == null ? null : schema.name(); }

  public String qualifiedName(Dialect dialect) {
    return dialect.qualify(schemaName(), name());
  }

  /**
   * SELECT of every column; {@code predicates} maps field names to required values (conjoined with AND).\n
   * An empty map selects the whole relation.\n
   */
  public SqlStatement selectStatement(Map<String, ?> predicates, Dialect dialect) {
    List<ColumnBind> where = new ArrayList<>();
    if (predicates != null) {
      for (var e : predicates.entrySet()) {
        Field<?> f = field(e.getKey());
        where.add(new ColumnBind(f.sqlName(), new Bind(f.validate(e.getValue()), f.type())));
      }
    }
    return dialect.render(new SelectAst(schemaName(), name(), columns(), where));
  }

  /** Fields whose context key currently has a value in {@code context}, in declaration order. */
  public List<Field<?>> contextBoundFields(Context context) {
    List<Field<?>> out = new ArrayList<>();
    for (Field<?> f : fields()) {
      if (f.contextKey() != null && context.hasValue(f.contextKey())) out.add(f);
    }
    return out;
  }

  /**
   * SELECT restricted by every field bound to a context key that has a value.\n
   * With no such field the statement is rejected unless {@code allowUnlimited} is set.\n
   */
  public SqlStatement contextSelectStatement(Context context, Dialect dialect, boolean allowUnlimited) {
    Objects.requireNonNull(context, "context");
    List<Field<?>> bound = contextBoundFields(context);
    if (bound.isEmpty() && !allowUnlimited) {
      throw new UnboundQueryException("No context value restricts the select from '" + name()
          + "'; pass allowUnlimited to read the whole relation");
    }
    Map<String, Object> predicates = new LinkedHashMap<>();
    for (Field<?> f : bound) predicates.put(f.name(), context.get(f.contextKey()));
    return selectStatement(predicates, dialect);
  }

  protected List<String> columns() {
    List<String> cols = new ArrayList<>(size());
    for (Field<?> f : fields()) cols.add(f.sqlName());
    return cols;
  }

  protected void checkOwn(Record r) {
    Objects.requireNonNull(r, "record");
    if (r.type() != this) {
      throw new SchemaViolationException("Record of type '" + r.type().name() + "' passed to '" + name() + "'");
    }
  }
}
