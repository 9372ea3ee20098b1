package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.field.Field;
import io.intellixity.tessera.persistence.model.RecordType;

import java.util.*;

/**
 * Parametrized statement text, the record type its rows materialize into, and its parameter fields.\n
 *
 * The result type may be absent for queries that only produce a single value.\n
 */
public final class QueryType {
  private final String name;
  private final String text;
  private final RecordType resultType;
  private final List<Field<?>> parameters;
  private final Map<String, Integer> index;

  private QueryType(String name, String text, RecordType resultType, List<Field<?>> parameters) {
    this.name = Objects.requireNonNull(name, "name");
    this.text = Objects.requireNonNull(text, "text");
    this.resultType = resultType;
    Map<String, Integer> idx = new HashMap<>();
    for (int i = 0; i < parameters.size(); i++) {
      if (idx.put(parameters.get(i).name(), i) != null) {
        throw new IllegalArgumentException("Duplicate parameter '" + parameters.get(i).name() + "' in query '" + name + "'");
      }
    }
    this.parameters = List.copyOf(parameters);
    this.index = Map.copyOf(idx);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() { return name; }
  public String text() { return text; }
  public RecordType resultType() { return resultType; }
  public List<Field<?>> parameters() { return parameters; }

  /** Index of the named parameter, or -1. */
  public int indexOf(String parameterName) {
    Integer i = index.get(parameterName);
    return i == null ? -1 : i;
  }

  /** Parameter names referenced by the text, in first-occurrence order. */
  public List<String> placeholders() {
    return PlaceholderCompiler.placeholders(text);
  }

  public Query newQuery() {
    return new Query(this);
  }

  public QueryResult newResult() {
    return new QueryResult(newQuery());
  }

  @Override
  public String toString() {
    return "QueryType(" + name + ")";
  }

  public static final class Builder {
    private final String name;
    private String text;
    private RecordType resultType;
    private final List<Field<?>> parameters = new ArrayList<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name");
    }

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder resultType(RecordType type) {
      this.resultType = type;
      return this;
    }

    public Builder parameter(Field<?> field) {
      parameters.add(Objects.requireNonNull(field, "field"));
      return this;
    }

    public Builder parameters(Field<?>... fs) {
      for (Field<?> f : fs) parameter(f);
      return this;
    }

    public QueryType build() {
      if (text == null || text.isBlank()) throw new IllegalArgumentException("Query '" + name + "' has no text");
      return new QueryType(name, text, resultType, parameters);
    }
  }
}
