package io.intellixity.tessera.persistence.dialect;

import io.intellixity.tessera.persistence.util.TesseraFactoriesLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Looks up dialects registered under {@code META-INF/tessera.factories}. */
public final class Dialects {
  private Dialects() {}

  public static List<Dialect> available() {
    return TesseraFactoriesLoader.load(Dialect.class);
  }

  public static Dialect byId(String id) {
    Objects.requireNonNull(id, "id");
    List<String> seen = new ArrayList<>();
    for (Dialect d : available()) {
      if (d.id().equalsIgnoreCase(id)) return d;
      seen.add(d.id());
    }
    throw new IllegalArgumentException("No dialect registered with id '" + id + "'; available: " + seen);
  }
}
