package net.fabricspark.client.core;

import java.util.Collection;
import java.util.Map;

/** Connection properties accepted for opening a Livy session. */
public enum LivySessionProperty {
  ENDPOINT("endpoint", false, String.class),
  LAKEHOUSE_ENDPOINT("lakehouseEndpoint", false, String.class),
  WORKSPACE_ID("workspaceId", false, String.class),
  LAKEHOUSE_ID("lakehouseId", false, String.class),
  AUTHENTICATION("authentication", false, String.class),
  TENANT_ID("tenantId", false, String.class),
  CLIENT_ID("clientId", false, String.class),
  CLIENT_SECRET("clientSecret", false, String.class),
  LIVY_SESSION_NAME("livySessionName", false, String.class),
  LIVY_SESSION_PARAMETERS("livySessionParameters", false, Map.class),
  KEEP_SESSION("keepSession", false, Boolean.class),
  SHORTCUTS_JSON_PATH("shortcutsJsonPath", false, String.class),

  // timings, all in seconds
  SESSION_POLL_WAIT("sessionPollWait", false, Integer.class),
  STATEMENT_POLL_WAIT("statementPollWait", false, Integer.class),
  EXECUTE_RETRY_WAIT("executeRetryWait", false, Integer.class),
  POLL_TIMEOUT("pollTimeout", false, Integer.class),
  CONNECT_TIMEOUT("connectTimeout", false, Integer.class),
  SOCKET_TIMEOUT("socketTimeout", false, Integer.class),

  EXECUTE_RETRIES("executeRetries", false, Integer.class),
  EXECUTE_RETRY_PATTERNS("executeRetryPatterns", false, Collection.class);

  private final String propertyKey;
  private final boolean required;
  private final Class<?> valueType;

  LivySessionProperty(String propertyKey, boolean required, Class<?> valueType) {
    this.propertyKey = propertyKey;
    this.required = required;
    this.valueType = valueType;
  }

  public String getPropertyKey() {
    return propertyKey;
  }

  public boolean isRequired() {
    return required;
  }

  public Class<?> getValueType() {
    return valueType;
  }

  /**
   * Case-insensitive lookup of a property by its key.
   *
   * @param propertyKey property key
   * @return the matching property, or null
   */
  public static LivySessionProperty lookupByKey(String propertyKey) {
    for (LivySessionProperty property : LivySessionProperty.values()) {
      if (property.propertyKey.equalsIgnoreCase(propertyKey)) {
        return property;
      }
    }
    return null;
  }
}
