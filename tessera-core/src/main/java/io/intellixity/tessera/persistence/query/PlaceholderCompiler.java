package io.intellixity.tessera.persistence.query;

import io.intellixity.tessera.persistence.dialect.Dialect;
import io.intellixity.tessera.persistence.dialect.SqlStatement;
import io.intellixity.tessera.persistence.dmlast.Bind;

import java.util.*;
import java.util.function.Function;

/**
 * Compiles query text containing {@code {identifier}} placeholders into dialect SQL plus bound values.\n
 *
 * Rules:\n
 * - identifiers match [A-Za-z_][A-Za-z0-9_]*\n
 * - every occurrence becomes the dialect's bind marker; values follow first-occurrence order\n
 * - named-binding dialects get one value per distinct name\n
 * - {@code {schema.object}} is replaced by the dialect's qualified name, nothing is bound\n
 * - text inside single quotes is copied verbatim\n
 * - a '{' that does not open a well-formed token is copied verbatim\n
 *
 * Values are never spliced into the SQL text.\n
 */
public final class PlaceholderCompiler {
  private PlaceholderCompiler() {}

  /**
   * @param lookup returns the bind for a parameter name, or null when the query has no such parameter
   */
  public static SqlStatement compile(String queryName, String text, Function<String, Bind> lookup, Dialect dialect) {
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(lookup, "lookup");
    Objects.requireNonNull(dialect, "dialect");

    StringBuilder out = new StringBuilder(text.length() + 16);
    List<Object> params = new ArrayList<>();
    Map<String, Integer> namedPositions = new HashMap<>();
    boolean inSingleQuote = false;

    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);

      if (ch == '\'') {
        if (inSingleQuote && i + 1 < text.length() && text.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && ch == '{') {
        Token t = token(text, i);
        if (t != null) {
          if (t.qualifier() != null) {
            out.append(dialect.qualify(t.qualifier(), t.name()));
          } else {
            Bind b = lookup.apply(t.name());
            if (b == null) {
              throw new QueryParameterException("Query '" + queryName + "' has no parameter named '" + t.name() + "'");
            }
            if (dialect.namedBinding()) {
              Integer pos = namedPositions.get(t.name());
              if (pos == null) {
                params.add(dialect.toBackend(b.type(), b.value()));
                pos = params.size();
                namedPositions.put(t.name(), pos);
              }
              out.append(dialect.bindMarker(pos, t.name()));
            } else {
              params.add(dialect.toBackend(b.type(), b.value()));
              out.append(dialect.bindMarker(params.size(), t.name()));
            }
          }
          i = t.end();
          continue;
        }
      }

      out.append(ch);
    }

    return new SqlStatement(out.toString(), params);
  }

  /** Distinct parameter names in first-occurrence order (qualified object references excluded). */
  public static List<String> placeholders(String text) {
    LinkedHashSet<String> names = new LinkedHashSet<>();
    boolean inSingleQuote = false;
    for (int i = 0; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (ch == '\'') {
        inSingleQuote = !inSingleQuote;
        continue;
      }
      if (!inSingleQuote && ch == '{') {
        Token t = token(text, i);
        if (t != null) {
          if (t.qualifier() == null) names.add(t.name());
          i = t.end();
        }
      }
    }
    return List.copyOf(names);
  }

  private record Token(String qualifier, String name, int end) {}

  /** Parses a token opening at {@code open}; {@code end} is the index of the closing brace. */
  private static Token token(String text, int open) {
    int start = open + 1;
    int end = identEnd(text, start);
    if (end < 0) return null;
    String first = text.substring(start, end);
    if (end < text.length() && text.charAt(end) == '}') return new Token(null, first, end);
    if (end < text.length() && text.charAt(end) == '.') {
      int secondEnd = identEnd(text, end + 1);
      if (secondEnd < 0 || secondEnd >= text.length() || text.charAt(secondEnd) != '}') return null;
      return new Token(first, text.substring(end + 1, secondEnd), secondEnd);
    }
    return null;
  }

  private static int identEnd(String text, int start) {
    if (start >= text.length() || !isIdentStart(text.charAt(start))) return -1;
    int end = start + 1;
    while (end < text.length() && isIdentPart(text.charAt(end))) end++;
    return end;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
