package io.intellixity.tessera.persistence.field;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.LongFunction;

/** Built-in field types. */
public final class FieldTypes {
  private FieldTypes() {}

  private static final FieldType<Short> SMALLINT =
      new IntegralType<>("smallint", SqlKind.SMALLINT, Short.class, Short.MIN_VALUE, Short.MAX_VALUE, v -> (short) v);
  private static final FieldType<Integer> INTEGER =
      new IntegralType<>("integer", SqlKind.INTEGER, Integer.class, Integer.MIN_VALUE, Integer.MAX_VALUE, v -> (int) v);
  private static final FieldType<Long> BIGINT =
      new IntegralType<>("bigint", SqlKind.BIGINT, Long.class, Long.MIN_VALUE, Long.MAX_VALUE, v -> v);
  private static final TextType TEXT = new TextType(SqlKind.TEXT, 0, false);

  public static FieldType<Short> smallInt() { return SMALLINT; }
  public static FieldType<Integer> integer() { return INTEGER; }
  public static FieldType<Long> bigInt() { return BIGINT; }

  public static NumericType numeric(int precision, int scale) {
    return new NumericType(precision, scale, false, false);
  }

  public static FieldType<Double> real() { return RealType.INSTANCE; }
  public static FieldType<Boolean> bool() { return BooleanType.INSTANCE; }

  public static TextType text() { return TEXT; }
  public static TextType varChar(int maxLength) { return new TextType(SqlKind.VARCHAR, maxLength, false); }
  public static TextType character(int length) { return new TextType(SqlKind.CHAR, length, false); }

  public static FieldType<LocalDateTime> timestamp() { return TimestampType.INSTANCE; }
  public static FieldType<Instant> timestampTz() { return TimestampTzType.INSTANCE; }
  public static FieldType<LocalDate> date() { return DateType.INSTANCE; }
  public static FieldType<LocalTime> time() { return TimeType.INSTANCE; }
  public static FieldType<UUID> uuid() { return UuidType.INSTANCE; }
  public static FieldType<Object> json() { return JsonType.INSTANCE; }
  public static FieldType<byte[]> blob() { return BlobType.INSTANCE; }

  public static <E extends Enum<E>> FieldType<E> enumOf(Class<E> enumType) {
    return new EnumType<>(Objects.requireNonNull(enumType, "enumType"));
  }

  static final class IntegralType<T extends Number> implements FieldType<T> {
    private final String id;
    private final SqlKind kind;
    private final Class<T> javaType;
    private final long min;
    private final long max;
    private final LongFunction<T> box;

    IntegralType(String id, SqlKind kind, Class<T> javaType, long min, long max, LongFunction<T> box) {
      this.id = id;
      this.kind = kind;
      this.javaType = javaType;
      this.min = min;
      this.max = max;
      this.box = box;
    }

    @Override public String id() { return id; }
    @Override public SqlKind kind() { return kind; }
    @Override public Class<T> javaType() { return javaType; }

    @Override
    public T convert(Object value) {
      long v;
      if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
        v = ((Number) value).longValue();
      } else if (value instanceof BigInteger bi) {
        v = exact(() -> bi.longValueExact(), value);
      } else if (value instanceof BigDecimal bd) {
        v = exact(() -> bd.longValueExact(), value);
      } else if (value instanceof CharSequence cs) {
        try {
          v = Long.parseLong(cs.toString().trim());
        } catch (NumberFormatException e) {
          throw new ValidationException("'" + cs + "' is not an integer", e);
        }
      } else {
        throw ValidationException.mismatch(this, value);
      }
      if (v < min || v > max) throw new ValidationException(v + " is out of range for " + id);
      return box.apply(v);
    }

    private long exact(java.util.function.LongSupplier s, Object value) {
      try {
        return s.getAsLong();
      } catch (ArithmeticException e) {
        throw new ValidationException(value + " is not an integral " + id, e);
      }
    }
  }

  static final class RealType implements FieldType<Double> {
    static final RealType INSTANCE = new RealType();
    @Override public String id() { return "real"; }
    @Override public SqlKind kind() { return SqlKind.REAL; }
    @Override public Class<Double> javaType() { return Double.class; }

    @Override
    public Double convert(Object value) {
      if (value instanceof Number n) return n.doubleValue();
      if (value instanceof CharSequence cs) {
        try {
          return Double.parseDouble(cs.toString().trim());
        } catch (NumberFormatException e) {
          throw new ValidationException("'" + cs + "' is not a number", e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class BooleanType implements FieldType<Boolean> {
    static final BooleanType INSTANCE = new BooleanType();
    @Override public String id() { return "boolean"; }
    @Override public SqlKind kind() { return SqlKind.BOOLEAN; }
    @Override public Class<Boolean> javaType() { return Boolean.class; }

    @Override
    public Boolean convert(Object value) {
      if (value instanceof Boolean b) return b;
      if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
        long v = ((Number) value).longValue();
        if (v == 0) return Boolean.FALSE;
        if (v == 1) return Boolean.TRUE;
      }
      if (value instanceof CharSequence cs) {
        switch (cs.toString().trim().toLowerCase(Locale.ROOT)) {
          case "true", "t", "1" -> { return Boolean.TRUE; }
          case "false", "f", "0" -> { return Boolean.FALSE; }
          default -> { }
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class TimestampType implements FieldType<LocalDateTime> {
    static final TimestampType INSTANCE = new TimestampType();
    @Override public String id() { return "timestamp"; }
    @Override public SqlKind kind() { return SqlKind.TIMESTAMP; }
    @Override public Class<LocalDateTime> javaType() { return LocalDateTime.class; }

    @Override
    public LocalDateTime convert(Object value) {
      if (value instanceof LocalDateTime ldt) return ldt;
      if (value instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
      if (value instanceof OffsetDateTime odt) return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      if (value instanceof ZonedDateTime zdt) return LocalDateTime.ofInstant(zdt.toInstant(), ZoneOffset.UTC);
      if (value instanceof CharSequence cs) {
        try {
          return LocalDateTime.parse(cs.toString().trim().replace(' ', 'T'));
        } catch (DateTimeParseException e) {
          throw new ValidationException("'" + cs + "' is not an ISO timestamp", e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class TimestampTzType implements FieldType<Instant> {
    static final TimestampTzType INSTANCE = new TimestampTzType();
    @Override public String id() { return "timestamptz"; }
    @Override public SqlKind kind() { return SqlKind.TIMESTAMPTZ; }
    @Override public Class<Instant> javaType() { return Instant.class; }

    @Override
    public Instant convert(Object value) {
      if (value instanceof Instant i) return i;
      if (value instanceof OffsetDateTime odt) return odt.toInstant();
      if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
      if (value instanceof CharSequence cs) {
        String s = cs.toString().trim().replace(' ', 'T');
        try {
          return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
          try {
            return Instant.parse(s);
          } catch (DateTimeParseException e2) {
            throw new ValidationException("'" + cs + "' is not an ISO timestamp with offset", e2);
          }
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class DateType implements FieldType<LocalDate> {
    static final DateType INSTANCE = new DateType();
    @Override public String id() { return "date"; }
    @Override public SqlKind kind() { return SqlKind.DATE; }
    @Override public Class<LocalDate> javaType() { return LocalDate.class; }

    @Override
    public LocalDate convert(Object value) {
      if (value instanceof LocalDate d) return d;
      if (value instanceof CharSequence cs) {
        try {
          return LocalDate.parse(cs.toString().trim());
        } catch (DateTimeParseException e) {
          throw new ValidationException("'" + cs + "' is not an ISO date", e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class TimeType implements FieldType<LocalTime> {
    static final TimeType INSTANCE = new TimeType();
    @Override public String id() { return "time"; }
    @Override public SqlKind kind() { return SqlKind.TIME; }
    @Override public Class<LocalTime> javaType() { return LocalTime.class; }

    @Override
    public LocalTime convert(Object value) {
      if (value instanceof LocalTime t) return t;
      if (value instanceof CharSequence cs) {
        try {
          return LocalTime.parse(cs.toString().trim());
        } catch (DateTimeParseException e) {
          throw new ValidationException("'" + cs + "' is not an ISO time", e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class UuidType implements FieldType<UUID> {
    static final UuidType INSTANCE = new UuidType();
    @Override public String id() { return "uuid"; }
    @Override public SqlKind kind() { return SqlKind.UUID; }
    @Override public Class<UUID> javaType() { return UUID.class; }

    @Override
    public UUID convert(Object value) {
      if (value instanceof UUID u) return u;
      if (value instanceof CharSequence cs) {
        try {
          return UUID.fromString(cs.toString().trim());
        } catch (IllegalArgumentException e) {
          throw new ValidationException("'" + cs + "' is not a UUID", e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  /** Any JSON-compatible value: maps, lists, strings, numbers, booleans. Dialects encode it. */
  static final class JsonType implements FieldType<Object> {
    static final JsonType INSTANCE = new JsonType();
    @Override public String id() { return "json"; }
    @Override public SqlKind kind() { return SqlKind.JSON; }
    @Override public Class<Object> javaType() { return Object.class; }

    @Override
    public Object convert(Object value) {
      if (value instanceof Map<?, ?> || value instanceof List<?> || value instanceof CharSequence
          || value instanceof Number || value instanceof Boolean) {
        return value;
      }
      throw ValidationException.mismatch(this, value);
    }
  }

  static final class BlobType implements FieldType<byte[]> {
    static final BlobType INSTANCE = new BlobType();
    @Override public String id() { return "blob"; }
    @Override public SqlKind kind() { return SqlKind.BLOB; }
    @Override public Class<byte[]> javaType() { return byte[].class; }

    @Override
    public byte[] convert(Object value) {
      if (value instanceof byte[] b) return b;
      throw ValidationException.mismatch(this, value);
    }
  }

  /** Enum constants, persisted by name. */
  static final class EnumType<E extends Enum<E>> implements FieldType<E> {
    private final Class<E> enumType;

    EnumType(Class<E> enumType) {
      this.enumType = enumType;
    }

    @Override public String id() { return "enum:" + enumType.getSimpleName(); }
    @Override public SqlKind kind() { return SqlKind.ENUM; }
    @Override public Class<E> javaType() { return enumType; }

    @Override
    public E convert(Object value) {
      if (enumType.isInstance(value)) return enumType.cast(value);
      if (value instanceof CharSequence cs) {
        try {
          return Enum.valueOf(enumType, cs.toString().trim());
        } catch (IllegalArgumentException e) {
          throw new ValidationException("'" + cs + "' is not a constant of " + enumType.getSimpleName(), e);
        }
      }
      throw ValidationException.mismatch(this, value);
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof EnumType<?> other && other.enumType.equals(enumType);
    }

    @Override
    public int hashCode() {
      return enumType.hashCode();
    }
  }
}
