package net.fabricspark.client.jdbc;

import java.util.regex.Pattern;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

public class LivyUtil {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyUtil.class);

  // a block comment together with the whitespace around it
  private static final Pattern BLOCK_COMMENT_PATTERN =
      Pattern.compile("\\s*/\\*.*?\\*/\\s*", Pattern.DOTALL);

  private static final Pattern WHITESPACE_ONLY_LINE = Pattern.compile("[ \\t]+");

  private LivyUtil() {}

  public static boolean isNullOrEmpty(String str) {
    return str == null || str.isEmpty();
  }

  /**
   * System.getProperty wrapper. If System.getProperty raises a SecurityException, it is ignored
   * and returns null.
   *
   * @param property the property name
   * @return the property value if set, otherwise null.
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      if (logger != null) {
        logger.debug("Security exception raised: {}", ex.getMessage());
      }
      return null;
    }
  }

  /**
   * System.getenv wrapper. If System.getenv raises a SecurityException, it is ignored and returns
   * null.
   *
   * @param env the environment variable name.
   * @return the environment variable value if set, otherwise null.
   */
  public static String systemGetEnv(String env) {
    try {
      return System.getenv(env);
    } catch (SecurityException ex) {
      logger.debug(
          "Failed to get environment variable {}. Security exception raised: {}",
          env,
          ex.getMessage());
    }
    return null;
  }

  /**
   * Replaces every block comment, together with its surrounding whitespace, by a single newline
   * and trims the result. The remote engine receives the text as is, so nothing else is touched.
   *
   * @param sql sql text
   * @return sql text without block comments
   */
  public static String stripBlockComments(String sql) {
    return BLOCK_COMMENT_PATTERN.matcher(sql).replaceAll("\n").trim();
  }

  /**
   * Removes the whitespace prefix common to all non-blank lines. Lines made of spaces and tabs
   * only are emptied and do not take part in computing the prefix.
   *
   * @param code source text
   * @return dedented text
   */
  public static String dedent(String code) {
    String[] lines = code.split("\n", -1);
    String margin = null;
    for (int i = 0; i < lines.length; i++) {
      if (WHITESPACE_ONLY_LINE.matcher(lines[i]).matches()) {
        lines[i] = "";
      }
      if (lines[i].isEmpty()) {
        continue;
      }
      String indent = leadingWhitespace(lines[i]);
      if (margin == null) {
        margin = indent;
      } else {
        margin = commonPrefix(margin, indent);
      }
    }

    StringBuilder sb = new StringBuilder(code.length());
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        sb.append('\n');
      }
      String line = lines[i];
      if (!isNullOrEmpty(margin) && line.startsWith(margin)) {
        line = line.substring(margin.length());
      }
      sb.append(line);
    }
    return sb.toString();
  }

  /**
   * Substitutes <code>%s</code> placeholders with the literal text of the parameters, <code>%%
   * </code> becomes a single percent sign. The remote channel only accepts source text, so this
   * is plain string interpolation without any escaping.
   *
   * @param code code containing placeholders
   * @param parameters values, in placeholder order
   * @return interpolated code
   * @throws LivySQLException if the number of placeholders and parameters differ
   */
  public static String interpolate(String code, Object... parameters) throws LivySQLException {
    StringBuilder sb = new StringBuilder(code.length());
    int next = 0;
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == '%' && i + 1 < code.length()) {
        char n = code.charAt(i + 1);
        if (n == '%') {
          sb.append('%');
          i++;
          continue;
        }
        if (n == 's') {
          if (next >= parameters.length) {
            throw new LivySQLException(
                ErrorCode.INVALID_PARAMETER_BINDING,
                "not enough parameters, got " + parameters.length);
          }
          sb.append(parameters[next++]);
          i++;
          continue;
        }
      }
      sb.append(c);
    }
    if (next != parameters.length) {
      throw new LivySQLException(
          ErrorCode.INVALID_PARAMETER_BINDING,
          "expected " + next + " parameters, got " + parameters.length);
    }
    return sb.toString();
  }

  private static String leadingWhitespace(String line) {
    int i = 0;
    while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
      i++;
    }
    return line.substring(0, i);
  }

  private static String commonPrefix(String a, String b) {
    int i = 0;
    int max = Math.min(a.length(), b.length());
    while (i < max && a.charAt(i) == b.charAt(i)) {
      i++;
    }
    return a.substring(0, i);
  }
}
