package io.intellixity.tessera.persistence.field;

import io.intellixity.tessera.persistence.context.Context;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/** Current instant from a {@link Clock}; {@link #utc()} reads the system UTC clock. */
public final class ClockGenerator implements ValueGenerator<Instant> {
  private final Clock clock;

  public ClockGenerator(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static ClockGenerator utc() {
    return new ClockGenerator(Clock.systemUTC());
  }

  @Override
  public Instant next(GeneratorSource source, Context context) {
    return clock.instant();
  }
}
