package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.dmlast.*;
import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.model.Record;

import java.util.*;

/**
 * Relation that can be written: fields plus constraints.\n
 *
 * Statement shapes:\n
 * - INSERT: every declared column, in declaration order\n
 * - UPDATE: non-key columns in SET, primary-key columns in WHERE\n
 * - DELETE: primary-key columns in WHERE\n
 */
public final class TableType extends RelationType {
  private final PrimaryKey primaryKey;
  private final List<Constraint> constraints;

  private TableType(String name, Schema schema, List<Field<?>> fields, List<Constraint> constraints) {
    super(name, schema, fields);
    PrimaryKey pk = null;
    for (Constraint c : constraints) {
      for (String col : c.columns()) {
        if (!hasField(col)) {
          throw new SchemaException("Constraint '" + c.name() + "' of table '" + name + "' names unknown field '" + col + "'");
        }
      }
      if (c instanceof PrimaryKey p) {
        if (pk != null) throw new SchemaException("Table '" + name + "' declares more than one primary key");
        pk = p;
      }
    }
    this.primaryKey = pk;
    this.constraints = List.copyOf(constraints);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public Optional<PrimaryKey> primaryKey() { return Optional.ofNullable(primaryKey); }
  public List<Constraint> constraints() { return constraints; }

  public List<ForeignKey> foreignKeys() {
    List<ForeignKey> out = new ArrayList<>();
    for (Constraint c : constraints) if (c instanceof ForeignKey fk) out.add(fk);
    return out;
  }

  public PrimaryKey requirePrimaryKey() {
    if (primaryKey == null) throw new SchemaException("Table '" + name() + "' has no primary key");
    return primaryKey;
  }

  public boolean isKeyField(String fieldName) {
    return primaryKey != null && primaryKey.columns().contains(fieldName);
  }

  /** False when every column belongs to the primary key, leaving nothing for an UPDATE to set. */
  public boolean hasUpdatableColumns() {
    for (Field<?> f : fields()) if (!isKeyField(f.name())) return true;
    return false;
  }

  public SqlStatement insertStatement(Record r, Dialect dialect) {
    checkOwn(r);
    List<ColumnBind> cols = new ArrayList<>(size());
    for (Field<?> f : fields()) cols.add(bind(f, r));
    return dialect.render(new InsertAst(schemaName(), name(), cols));
  }

  public SqlStatement updateStatement(Record r, Dialect dialect) {
    checkOwn(r);
    requirePrimaryKey();
    List<ColumnBind> sets = new ArrayList<>();
    for (Field<?> f : fields()) {
      if (!isKeyField(f.name())) sets.add(bind(f, r));
    }
    if (sets.isEmpty()) throw new SchemaException("Table '" + name() + "' has no non-key columns to update");
    return dialect.render(new UpdateAst(schemaName(), name(), sets, keyWhere(r)));
  }

  public SqlStatement deleteStatement(Record r, Dialect dialect) {
    checkOwn(r);
    return dialect.render(new DeleteAst(schemaName(), name(), keyWhere(r)));
  }

  public SqlStatement selectByPrimaryKey(Record r, Dialect dialect) {
    checkOwn(r);
    return dialect.render(new SelectAst(schemaName(), name(), columns(), keyWhere(r)));
  }

  private List<ColumnBind> keyWhere(Record r) {
    PrimaryKey pk = requirePrimaryKey();
    List<ColumnBind> where = new ArrayList<>(pk.columns().size());
    for (String col : pk.columns()) {
      Field<?> f = field(col);
      if (r.get(col) == null) {
        throw new UnboundQueryException("Primary key field '" + col + "' of '" + name() + "' is null");
      }
      where.add(bind(f, r));
    }
    return where;
  }

  private static ColumnBind bind(Field<?> f, Record r) {
    return new ColumnBind(f.sqlName(), new Bind(r.get(f.name()), f.type()));
  }

  public static final class Builder {
    private final String name;
    private Schema schema;
    private final List<Field<?>> fields = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder schema(Schema s) {
      this.schema = s;
      return this;
    }

    public Builder field(Field<?> field) {
      fields.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder fields(Field<?>... fs) {
      for (Field<?> f : fs) field(f);
      return this;
    }

    public Builder primaryKey(String... columns) {
      return constraint(new PrimaryKey("pk_" + name, List.of(columns)));
    }

    public Builder foreignKey(List<String> columns, String referencedTable, List<String> referencedColumns) {
      String fkName = "fk_" + name + "_" + (foreignKeyCount() + 1);
      return constraint(new ForeignKey(fkName, columns, referencedTable, referencedColumns));
    }

    public Builder unique(String... columns) {
      return constraint(new Unique("uq_" + name + "_" + String.join("_", columns), List.of(columns)));
    }

    public Builder constraint(Constraint c) {
      constraints.add(Objects.requireNonNull(c, "constraint"));
      return this;
    }

    private int foreignKeyCount() {
      int n = 0;
      for (Constraint c : constraints) if (c instanceof ForeignKey) n++;
      return n;
    }

    public TableType build() {
      return new TableType(name, schema, fields, constraints);
    }
  }
}
