package io.intellixity.tessera.persistence.dmlast;

import io.intellixity.tessera.persistence.field.FieldType;

import java.util.Objects;

/** A value to bind together with the field type that drives its backend adaptation. */
public record Bind(Object value, FieldType<?> type) {
  public Bind {
    Objects.requireNonNull(type, "type");
  }
}
