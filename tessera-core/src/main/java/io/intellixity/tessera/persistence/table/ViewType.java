package io.intellixity.tessera.persistence.table;

import io.intellixity.tessera.persistence.field.Field;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Read-only relation: selectable, never written by the orchestrator. */
public final class ViewType extends RelationType {
  private ViewType(String name, Schema schema, List<Field<?>> fields) {
    super(name, schema, fields);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private Schema schema;
    private final List<Field<?>> fields = new ArrayList<>();

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

    public ViewType build() {
      return new ViewType(name, schema, fields);
    }
  }
}
