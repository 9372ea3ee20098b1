package io.intellixity.tessera.persistence.field;

/** Character data: unbounded TEXT, VARCHAR(n) or CHAR(n). */
public final class TextType implements FieldType<String> {
  private final SqlKind kind;
  private final int maxLength;
  private final boolean silentTruncate;

  TextType(SqlKind kind, int maxLength, boolean silentTruncate) {
    if (kind != SqlKind.TEXT && maxLength <= 0) {
      throw new IllegalArgumentException("length must be positive for " + kind + ": " + maxLength);
    }
    this.kind = kind;
    this.maxLength = maxLength;
    this.silentTruncate = silentTruncate;
  }

  /** Over-long values are cut to the maximum length instead of being rejected. */
  public TextType silentTruncate() {
    if (kind == SqlKind.TEXT) throw new IllegalStateException("text() has no maximum length to truncate to");
    return new TextType(kind, maxLength, true);
  }

  @Override
  public String id() {
    return switch (kind) {
      case VARCHAR -> "varchar(" + maxLength + ")";
      case CHAR -> "char(" + maxLength + ")";
      default -> "text";
    };
  }

  @Override public SqlKind kind() { return kind; }
  @Override public Class<String> javaType() { return String.class; }
  @Override public int precision() { return maxLength; }

  @Override
  public String convert(Object value) {
    String s;
    if (value instanceof CharSequence cs) s = cs.toString();
    else if (value instanceof Character c) s = String.valueOf(c);
    else throw ValidationException.mismatch(this, value);

    if (kind == SqlKind.TEXT || s.length() <= maxLength) return s;
    if (silentTruncate) return s.substring(0, maxLength);
    throw new ValidationException("value of length " + s.length() + " is too long for " + id());
  }
}
