package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.context.Context;

/**
 * Decides the value a field takes for one statement-generation pass, given its stored value and the context.\n
 */
@FunctionalInterface
public interface FieldResolver {
  Object resolve(Field<?> field, Object stored, Context context);

  /** Context value under the field's context key wins over the stored value when present and non-null. */
  FieldResolver CONTEXT = (field, stored, context) -> {
    String key = field.contextKey();
    if (key != null && context != null && context.hasValue(key)) return context.get(key);
    return stored;
  };

  /**
   * Numbers rows in the order they are resolved: the counter lives in the context under {@code counterKey}\n
   * and is advanced on every call.\n
   */
  static FieldResolver rowEnumeration(String counterKey, int start) {
    return (field, stored, context) -> {
      if (context == null) return stored;
      Object current = context.get(counterKey);
      if (current != null && !(current instanceof Number)) {
        throw new IllegalArgumentException("Row counter '" + counterKey + "' of field '" + field.name()
            + "' collides with a non-numeric context value: " + current.getClass().getSimpleName());
      }
      int next = current == null ? start : ((Number) current).intValue() + 1;
      context.put(counterKey, next);
      return next;
    };
  }
}
