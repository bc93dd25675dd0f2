package wiretx.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites PostgreSQL positional parameters ({@code $1}, {@code $2}, ...) to JDBC {@code ?}
 * markers, reordering the bound values to match. Quoted literals and identifiers are copied
 * untouched.
 */
final class Placeholders {

  record Rewritten(String sql, List<Object> params) {
  }

  static Rewritten rewrite(String sql, List<?> params) {
    StringBuilder out = new StringBuilder(sql.length());
    List<Object> ordered = new ArrayList<>();
    int i = 0;
    while (i < sql.length()) {
      char c = sql.charAt(i);
      if (c == '\'' || c == '"') {
        int end = closingQuote(sql, i, c);
        out.append(sql, i, end);
        i = end;
      } else if (c == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
        int j = i + 1;
        while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
          j++;
        }
        int index = Integer.parseInt(sql.substring(i + 1, j));
        if (index < 1 || index > params.size()) {
          throw new IllegalArgumentException("No value bound for parameter $" + index
              + " (" + params.size() + " given)");
        }
        ordered.add(params.get(index - 1));
        out.append('?');
        i = j;
      } else {
        out.append(c);
        i++;
      }
    }
    return new Rewritten(out.toString(), ordered);
  }

  // doubled quotes escape themselves, so they simply reopen the literal
  private static int closingQuote(String sql, int start, char quote) {
    int end = sql.indexOf(quote, start + 1);
    return end < 0 ? sql.length() : end + 1;
  }

  private Placeholders() {}
}
