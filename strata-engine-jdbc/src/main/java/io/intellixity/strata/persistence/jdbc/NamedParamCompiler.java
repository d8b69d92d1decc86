package io.intellixity.strata.persistence.jdbc;

/**
 * Rewrites SQL containing named params (e.g. :b1) into JDBC SQL with '?' binds.\n
 *
 * Rules:\n
 * - Params are recognized as ':' followed by [A-Za-z_][A-Za-z0-9_]*\n
 * - '::' is treated as a SQL cast and not a param, so {@code :b1::uuid[]} becomes {@code ?::uuid[]}.\n
 * - Params inside single quotes or double-quoted identifiers are ignored.\n
 */
public final class NamedParamCompiler {
  private NamedParamCompiler() {}

  /** Purely lexical rewrite of every named param to '?'. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /** Number of named params {@link #toJdbcSql(String)} would replace. */
  public static int countParams(String sql) {
    String jdbc = toJdbcSql(sql);
    String original = (sql == null) ? "" : sql;
    int n = 0;
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (ch == '\'' && !inDoubleQuote) inSingleQuote = !inSingleQuote;
      else if (ch == '"' && !inSingleQuote) inDoubleQuote = !inDoubleQuote;
      else if (ch == '?' && !inSingleQuote && !inDoubleQuote) n++;
    }
    // '?' already present in the source text is not a named param
    for (int i = 0; i < original.length(); i++) if (original.charAt(i) == '?') n--;
    return Math.max(n, 0);
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
