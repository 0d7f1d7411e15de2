package net.fabricspark.client.log;

/**
 * Logger facade for the Livy client. Implementations are obtained from {@link LivyLoggerFactory}
 * and route either to java.util.logging or to SLF4J.
 *
 * <p>Message templates use <code>{}</code> placeholders. Every rendered message goes through
 * {@link net.fabricspark.client.util.SecretDetector} first, so bearer tokens and client secrets do
 * not reach the log output. An argument that is costly to render can be passed as an {@link
 * ArgSupplier}; it is only evaluated when the level is enabled.
 */
public interface LivyLogger {
  boolean isTraceEnabled();

  void trace(String msg, Object... arguments);

  void trace(String msg, Throwable t);

  boolean isDebugEnabled();

  void debug(String msg, Object... arguments);

  void debug(String msg, Throwable t);

  boolean isInfoEnabled();

  void info(String msg, Object... arguments);

  void info(String msg, Throwable t);

  boolean isWarnEnabled();

  void warn(String msg, Object... arguments);

  void warn(String msg, Throwable t);

  boolean isErrorEnabled();

  void error(String msg, Object... arguments);

  void error(String msg, Throwable t);
}
