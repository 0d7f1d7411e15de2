package net.fabricspark.client.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.core.LivyResult;
import net.fabricspark.client.core.LivyStatementExecutor;
import net.fabricspark.client.core.StatementKind;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/** Cursor that runs each statement through a {@link LivyStatementExecutor}. */
public class LivyCursorV1 implements LivyCursor {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyCursorV1.class);

  private final LivyStatementExecutor executor;

  // null until a statement succeeds, and again after a failure or close
  private LinkedList<List<Object>> rows;
  private List<LivyColumnMetadata> schema;

  public LivyCursorV1(LivyStatementExecutor executor) {
    this.executor = executor;
  }

  @Override
  public synchronized void execute(String code, StatementKind kind, Object... parameters)
      throws LivySQLException {
    if (parameters != null && parameters.length > 0) {
      logger.warn(
          "Parameters are interpolated into the statement text as is, do not bind untrusted"
              + " values");
      code = LivyUtil.interpolate(code, parameters);
    }
    String finalCode =
        kind == StatementKind.PYSPARK ? LivyUtil.dedent(code) : LivyUtil.stripBlockComments(code);
    try {
      LivyResult result = executor.execute(finalCode, kind);
      rows = new LinkedList<>(result.getRows());
      schema = result.getSchema();
    } catch (LivyException ex) {
      rows = null;
      schema = null;
      throw new LivySQLException(ex);
    }
  }

  @Override
  public synchronized List<List<Object>> fetchAll() {
    return rows == null ? null : new ArrayList<>(rows);
  }

  @Override
  public synchronized List<Object> fetchOne() {
    if (rows == null || rows.isEmpty()) {
      return null;
    }
    return rows.removeFirst();
  }

  @Override
  public synchronized List<ColumnDescription> getDescription() {
    if (schema == null) {
      return Collections.emptyList();
    }
    List<ColumnDescription> description = new ArrayList<>(schema.size());
    for (LivyColumnMetadata column : schema) {
      description.add(ColumnDescription.of(column));
    }
    return description;
  }

  @Override
  public synchronized void close() {
    rows = null;
  }
}
