package net.fabricspark.client.log;

import static net.fabricspark.client.jdbc.LivyUtil.systemGetProperty;

import java.util.function.Function;

/**
 * Hands out {@link LivyLogger} instances. The backend is picked once, from the system property
 * {@value #LOGGER_IMPL_PROPERTY}: {@code slf4j} (or the {@link SLF4JLogger} class name) selects
 * SLF4J, anything else selects java.util.logging.
 */
public final class LivyLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.fabricspark.client.loggerImpl";

  private static volatile Function<String, LivyLogger> backend;

  private LivyLoggerFactory() {}

  public static LivyLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  public static LivyLogger getLogger(String name) {
    Function<String, LivyLogger> current = backend;
    if (current == null) {
      current = selectBackend(systemGetProperty(LOGGER_IMPL_PROPERTY));
      backend = current;
    }
    return current.apply(name);
  }

  static Function<String, LivyLogger> selectBackend(String configured) {
    if (configured != null
        && ("slf4j".equalsIgnoreCase(configured.trim())
            || SLF4JLogger.class.getName().equals(configured.trim()))) {
      return SLF4JLogger::new;
    }
    return JDK14Logger::new;
  }
}
