package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.context.Context;
import io.intellixity.tessera.persistence.field.GenerationException;
import io.intellixity.tessera.persistence.field.GeneratorSource;
import io.intellixity.tessera.persistence.field.ValueGenerator;

import java.util.Objects;

/**
 * Value taken from the first column of the first row of a query run with the current context,\n
 * e.g. a running total that depends on an earlier context field.\n
 */
public final class QueryValueGenerator implements ValueGenerator<Object> {
  private final QueryType queryType;

  public QueryValueGenerator(QueryType queryType) {
    this.queryType = Objects.requireNonNull(queryType, "queryType");
  }

  @Override
  public Object next(GeneratorSource source, Context context) {
    if (source.cursor() == null) {
      throw new GenerationException("Query '" + queryType.name() + "' needs a cursor to produce a value");
    }
    Query q = queryType.newQuery();
    if (context != null) q.setContext(context);
    Object v = q.singleValue(source.cursor(), source.dialect());
    if (v == null) throw new GenerationException("Query '" + queryType.name() + "' produced no value");
    return v;
  }
}
