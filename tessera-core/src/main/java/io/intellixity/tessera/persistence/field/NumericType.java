package io.intellixity.tessera.persistence.field;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point decimal with a declared precision and scale.\n
 *
 * Values are quantized to {@code scale} digits. Quantization that would lose digits is rejected unless\n
 * {@link #inexactQuantize()} was requested, in which case HALF_EVEN rounding applies. Binary floating point\n
 * input is rejected unless {@link #allowFloats()} was requested.\n
 */
public final class NumericType implements FieldType<BigDecimal> {
  private final int precision;
  private final int scale;
  private final boolean allowFloats;
  private final boolean inexactQuantize;

  NumericType(int precision, int scale, boolean allowFloats, boolean inexactQuantize) {
    if (precision <= 0) throw new IllegalArgumentException("precision must be positive: " + precision);
    if (scale < 0 || scale > precision) throw new IllegalArgumentException("scale must be within 0.." + precision + ": " + scale);
    this.precision = precision;
    this.scale = scale;
    this.allowFloats = allowFloats;
    this.inexactQuantize = inexactQuantize;
  }

  public NumericType allowFloats() {
    return new NumericType(precision, scale, true, inexactQuantize);
  }

  public NumericType inexactQuantize() {
    return new NumericType(precision, scale, allowFloats, true);
  }

  @Override public String id() { return "numeric(" + precision + "," + scale + ")"; }
  @Override public SqlKind kind() { return SqlKind.NUMERIC; }
  @Override public Class<BigDecimal> javaType() { return BigDecimal.class; }
  @Override public int precision() { return precision; }
  @Override public int scale() { return scale; }

  public boolean floatsAllowed() { return allowFloats; }
  public boolean quantizesInexactly() { return inexactQuantize; }

  @Override
  public BigDecimal convert(Object value) {
    BigDecimal d = toDecimal(value);
    BigDecimal q;
    try {
      q = d.setScale(scale, RoundingMode.UNNECESSARY);
    } catch (ArithmeticException e) {
      if (!inexactQuantize) {
        throw new ValidationException(d.toPlainString() + " cannot be stored exactly in " + id(), e);
      }
      q = d.setScale(scale, RoundingMode.HALF_EVEN);
    }
    int digits = q.unscaledValue().abs().toString().length();
    if (q.signum() != 0 && digits > precision) {
      throw new ValidationException(q.toPlainString() + " exceeds the precision of " + id());
    }
    return q;
  }

  private BigDecimal toDecimal(Object value) {
    if (value instanceof BigDecimal bd) return bd;
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return BigDecimal.valueOf(((Number) value).longValue());
    }
    if (value instanceof BigInteger bi) return new BigDecimal(bi);
    if (value instanceof Double || value instanceof Float) {
      if (!allowFloats) {
        throw new ValidationException("floating point value " + value + " is not accepted by " + id());
      }
      double x = ((Number) value).doubleValue();
      if (Double.isNaN(x) || Double.isInfinite(x)) throw ValidationException.mismatch(this, value);
      return BigDecimal.valueOf(x);
    }
    if (value instanceof CharSequence cs) {
      try {
        return new BigDecimal(cs.toString().trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("'" + cs + "' is not a decimal number", e);
      }
    }
    throw ValidationException.mismatch(this, value);
  }
}
