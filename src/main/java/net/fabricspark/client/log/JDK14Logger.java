package net.fabricspark.client.log;

import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.fabricspark.client.util.SecretDetector;

/**
 * {@link LivyLogger} on top of java.util.logging. Levels map as trace=FINEST, debug=FINE,
 * info=INFO, warn=WARNING and error=SEVERE.
 */
public class JDK14Logger implements LivyLogger {
  private static final String LOG_PACKAGE = JDK14Logger.class.getPackage().getName() + ".";

  private final Logger delegate;

  public JDK14Logger(String name) {
    this.delegate = Logger.getLogger(name);
  }

  @Override
  public boolean isTraceEnabled() {
    return delegate.isLoggable(Level.FINEST);
  }

  @Override
  public void trace(String msg, Object... arguments) {
    publish(Level.FINEST, msg, arguments);
  }

  @Override
  public void trace(String msg, Throwable t) {
    publish(Level.FINEST, msg, t);
  }

  @Override
  public boolean isDebugEnabled() {
    return delegate.isLoggable(Level.FINE);
  }

  @Override
  public void debug(String msg, Object... arguments) {
    publish(Level.FINE, msg, arguments);
  }

  @Override
  public void debug(String msg, Throwable t) {
    publish(Level.FINE, msg, t);
  }

  @Override
  public boolean isInfoEnabled() {
    return delegate.isLoggable(Level.INFO);
  }

  @Override
  public void info(String msg, Object... arguments) {
    publish(Level.INFO, msg, arguments);
  }

  @Override
  public void info(String msg, Throwable t) {
    publish(Level.INFO, msg, t);
  }

  @Override
  public boolean isWarnEnabled() {
    return delegate.isLoggable(Level.WARNING);
  }

  @Override
  public void warn(String msg, Object... arguments) {
    publish(Level.WARNING, msg, arguments);
  }

  @Override
  public void warn(String msg, Throwable t) {
    publish(Level.WARNING, msg, t);
  }

  @Override
  public boolean isErrorEnabled() {
    return delegate.isLoggable(Level.SEVERE);
  }

  @Override
  public void error(String msg, Object... arguments) {
    publish(Level.SEVERE, msg, arguments);
  }

  @Override
  public void error(String msg, Throwable t) {
    publish(Level.SEVERE, msg, t);
  }

  private void publish(Level level, String msg, Object[] arguments) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    String text;
    try {
      text = MessageFormat.format(refactorString(msg), ArgSupplier.resolveAll(arguments));
    } catch (IllegalArgumentException e) {
      text = "Unable to format msg: " + msg;
    }
    StackTraceElement caller = caller();
    delegate.logp(
        level, caller.getClassName(), caller.getMethodName(), SecretDetector.maskSecrets(text));
  }

  private void publish(Level level, String msg, Throwable t) {
    if (!delegate.isLoggable(level)) {
      return;
    }
    StackTraceElement caller = caller();
    delegate.logp(
        level, caller.getClassName(), caller.getMethodName(), SecretDetector.maskSecrets(msg), t);
  }

  /**
   * Rewrites <code>{}</code> placeholders into MessageFormat indexes ({@code "a {} b {}"} becomes
   * {@code "a {0} b {1}"}) and doubles single quotes, which MessageFormat would otherwise drop.
   */
  static String refactorString(String template) {
    StringBuilder out = new StringBuilder(template.length() + 8);
    int index = 0;
    int pos = 0;
    while (pos < template.length()) {
      char c = template.charAt(pos);
      if (c == '\'') {
        out.append("''");
        pos++;
      } else if (template.startsWith("{}", pos)) {
        out.append('{').append(index++).append('}');
        pos += 2;
      } else {
        out.append(c);
        pos++;
      }
    }
    return out.toString();
  }

  /** First stack frame outside the logging package and the JDK thread machinery. */
  private static StackTraceElement caller() {
    for (StackTraceElement frame : new Throwable().getStackTrace()) {
      if (!frame.getClassName().startsWith(LOG_PACKAGE)) {
        return frame;
      }
    }
    return new StackTraceElement("unknown", "unknown", null, -1);
  }
}
