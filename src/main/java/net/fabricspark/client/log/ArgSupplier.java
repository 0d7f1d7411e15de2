package net.fabricspark.client.log;

/**
 * Deferred log argument, e.g. {@code logger.trace("Body: {}", (ArgSupplier) body::toPrettyString)}.
 */
@FunctionalInterface
public interface ArgSupplier {
  Object get();

  /** Replaces every {@link ArgSupplier} in {@code arguments} by the value it supplies. */
  static Object[] resolveAll(Object[] arguments) {
    if (arguments == null) {
      return new Object[0];
    }
    Object[] resolved = arguments.clone();
    for (int i = 0; i < resolved.length; i++) {
      if (resolved[i] instanceof ArgSupplier) {
        resolved[i] = ((ArgSupplier) resolved[i]).get();
      }
    }
    return resolved;
  }
}
