package net.fabricspark.client.log;

import net.fabricspark.client.util.SecretDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;

/**
 * {@link LivyLogger} that forwards to SLF4J. When the bound backend is location aware, this class
 * is reported as the logging boundary so that the caller, not this adapter, shows up as the source.
 */
public class SLF4JLogger implements LivyLogger {
  private static final String ADAPTER_CLASS = SLF4JLogger.class.getName();

  private final Logger target;

  public SLF4JLogger(String name) {
    this.target = LoggerFactory.getLogger(name);
  }

  @Override
  public boolean isTraceEnabled() {
    return target.isTraceEnabled();
  }

  @Override
  public void trace(String msg, Object... arguments) {
    if (isTraceEnabled()) {
      emit(LocationAwareLogger.TRACE_INT, render(msg, arguments), null);
    }
  }

  @Override
  public void trace(String msg, Throwable t) {
    if (isTraceEnabled()) {
      emit(LocationAwareLogger.TRACE_INT, SecretDetector.maskSecrets(msg), t);
    }
  }

  @Override
  public boolean isDebugEnabled() {
    return target.isDebugEnabled();
  }

  @Override
  public void debug(String msg, Object... arguments) {
    if (isDebugEnabled()) {
      emit(LocationAwareLogger.DEBUG_INT, render(msg, arguments), null);
    }
  }

  @Override
  public void debug(String msg, Throwable t) {
    if (isDebugEnabled()) {
      emit(LocationAwareLogger.DEBUG_INT, SecretDetector.maskSecrets(msg), t);
    }
  }

  @Override
  public boolean isInfoEnabled() {
    return target.isInfoEnabled();
  }

  @Override
  public void info(String msg, Object... arguments) {
    if (isInfoEnabled()) {
      emit(LocationAwareLogger.INFO_INT, render(msg, arguments), null);
    }
  }

  @Override
  public void info(String msg, Throwable t) {
    if (isInfoEnabled()) {
      emit(LocationAwareLogger.INFO_INT, SecretDetector.maskSecrets(msg), t);
    }
  }

  @Override
  public boolean isWarnEnabled() {
    return target.isWarnEnabled();
  }

  @Override
  public void warn(String msg, Object... arguments) {
    if (isWarnEnabled()) {
      emit(LocationAwareLogger.WARN_INT, render(msg, arguments), null);
    }
  }

  @Override
  public void warn(String msg, Throwable t) {
    if (isWarnEnabled()) {
      emit(LocationAwareLogger.WARN_INT, SecretDetector.maskSecrets(msg), t);
    }
  }

  @Override
  public boolean isErrorEnabled() {
    return target.isErrorEnabled();
  }

  @Override
  public void error(String msg, Object... arguments) {
    if (isErrorEnabled()) {
      emit(LocationAwareLogger.ERROR_INT, render(msg, arguments), null);
    }
  }

  @Override
  public void error(String msg, Throwable t) {
    if (isErrorEnabled()) {
      emit(LocationAwareLogger.ERROR_INT, SecretDetector.maskSecrets(msg), t);
    }
  }

  private void emit(int level, String text, Throwable t) {
    if (target instanceof LocationAwareLogger) {
      ((LocationAwareLogger) target).log(null, ADAPTER_CLASS, level, text, null, t);
    } else if (level == LocationAwareLogger.ERROR_INT) {
      target.error(text, t);
    } else if (level == LocationAwareLogger.WARN_INT) {
      target.warn(text, t);
    } else if (level == LocationAwareLogger.INFO_INT) {
      target.info(text, t);
    } else if (level == LocationAwareLogger.DEBUG_INT) {
      target.debug(text, t);
    } else {
      target.trace(text, t);
    }
  }

  private static String render(String msg, Object[] arguments) {
    String text =
        MessageFormatter.arrayFormat(msg, ArgSupplier.resolveAll(arguments)).getMessage();
    return SecretDetector.maskSecrets(text);
  }
}
