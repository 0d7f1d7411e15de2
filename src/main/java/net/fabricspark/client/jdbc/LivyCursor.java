package net.fabricspark.client.jdbc;

import java.util.List;
import net.fabricspark.client.core.StatementKind;

/** Synchronous cursor over a Livy session: execute code, then read back all of its rows. */
public interface LivyCursor extends AutoCloseable {
  /**
   * Runs code on the session and buffers its result, replacing the previous one.
   *
   * @param code SQL text or pyspark code
   * @param kind kind of the code
   * @param parameters values substituted for <code>%s</code> placeholders, if any
   * @throws LivySQLException if the statement fails or the session can not be reached
   */
  void execute(String code, StatementKind kind, Object... parameters) throws LivySQLException;

  /** @return all buffered rows, or null if nothing has been executed */
  List<List<Object>> fetchAll();

  /** @return the next buffered row, or null when there is none */
  List<Object> fetchOne();

  /** @return one description per result column, empty without a result */
  List<ColumnDescription> getDescription();

  /** Drops the buffered rows. Closing a closed cursor has no effect. */
  @Override
  void close();
}
