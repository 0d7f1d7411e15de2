package net.fabricspark.client.jdbc;

import java.sql.Timestamp;
import java.text.SimpleDateFormat;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import net.fabricspark.client.core.StatementKind;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/**
 * Adapts a {@link LivyConnection} to the connection and cursor calls of a query engine: picks the
 * statement kind, tidies the statement text and turns bindings into literals.
 */
public class LivyConnectionWrapper {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyConnectionWrapper.class);

  static final String PYTHON_MODEL_MARKER = "def model(dbt, session):";

  private static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";
  private static final DateTimeFormatter TIMESTAMP_FORMATTER =
      DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);
  private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

  private final LivyConnection handle;
  private LivyCursor cursor;

  public LivyConnectionWrapper(LivyConnection handle) {
    this.handle = handle;
  }

  /** Binds the handle's cursor to this wrapper. */
  public LivyConnectionWrapper cursor() {
    cursor = handle.cursor();
    return this;
  }

  public void cancel() {
    logger.debug("NotImplemented: cancel");
  }

  public void close() {
    handle.close();
  }

  public void rollback() {
    logger.debug("NotImplemented: rollback");
  }

  public List<List<Object>> fetchAll() {
    return boundCursor().fetchAll();
  }

  public List<Object> fetchOne() {
    return boundCursor().fetchOne();
  }

  public List<ColumnDescription> getDescription() {
    return boundCursor().getDescription();
  }

  /**
   * Executes a statement.
   *
   * @param sql statement text, SQL or a python model
   * @param language sql or pyspark, anything else is treated as sql
   * @param bindings values for the <code>%s</code> placeholders, may be null
   * @throws LivySQLException if the statement fails
   */
  public void execute(String sql, String language, List<?> bindings) throws LivySQLException {
    StatementKind kind = StatementKind.fromLanguage(language);
    if (kind == null) {
      kind = StatementKind.SQL;
    }
    if (sql.contains(PYTHON_MODEL_MARKER)) {
      kind = StatementKind.PYSPARK;
    }
    String trimmed = sql.trim();
    if (trimmed.endsWith(";")) {
      sql = trimmed.substring(0, trimmed.length() - 1);
    }

    if (bindings == null) {
      boundCursor().execute(sql, kind);
    } else {
      Object[] fixed = new Object[bindings.size()];
      for (int i = 0; i < fixed.length; i++) {
        fixed[i] = fixBinding(bindings.get(i));
      }
      boundCursor().execute(sql, kind, fixed);
    }
  }

  /**
   * Converts a binding to a value the Spark SQL text can take: numbers become doubles, timestamps
   * become quoted millisecond timestamps, date-only values become quoted <code>yyyy-MM-dd</code>
   * dates, null becomes an empty string literal and anything else is quoted.
   */
  public static Object fixBinding(Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof Timestamp) {
      return "'" + TIMESTAMP_FORMATTER.format(((Timestamp) value).toLocalDateTime()) + "'";
    }
    if (value instanceof LocalDateTime) {
      return "'" + TIMESTAMP_FORMATTER.format((LocalDateTime) value) + "'";
    }
    if (value instanceof java.sql.Date) {
      return "'" + DATE_FORMATTER.format(((java.sql.Date) value).toLocalDate()) + "'";
    }
    if (value instanceof LocalDate) {
      return "'" + DATE_FORMATTER.format((LocalDate) value) + "'";
    }
    if (value instanceof Date) {
      return "'" + new SimpleDateFormat(TIMESTAMP_PATTERN).format((Date) value) + "'";
    }
    if (value == null) {
      return "''";
    }
    return "'" + value + "'";
  }

  private LivyCursor boundCursor() {
    if (cursor == null) {
      cursor = handle.cursor();
    }
    return cursor;
  }
}
