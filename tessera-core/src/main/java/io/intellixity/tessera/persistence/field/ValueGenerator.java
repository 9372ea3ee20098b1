package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.context.Context;

/**
 * Source of fresh values for {@link Field#update}.\n
 *
 * Generators may have side effects (advance a sequence, read a clock). The context passed in holds the\n
 * values resolved so far, in declaration order.\n
 */
@FunctionalInterface
public interface ValueGenerator<T> {
  T next(GeneratorSource source, Context context);
}
