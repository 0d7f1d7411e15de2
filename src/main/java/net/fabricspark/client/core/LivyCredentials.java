package net.fabricspark.client.core;

import static net.fabricspark.client.jdbc.LivyUtil.isNullOrEmpty;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import net.fabricspark.client.util.SecretDetector;

/**
 * Immutable connection settings: where the lakehouse Livy API lives, how to authenticate against
 * it and how the session should be managed.
 */
public class LivyCredentials {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyCredentials.class);

  private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  public static final String DEFAULT_ENDPOINT = "https://api.fabric.microsoft.com/v1";
  public static final String LIVY_API_VERSION = "2023-12-01";
  public static final String CLI_AUTHENTICATION = "cli";

  public static final Duration DEFAULT_SESSION_POLL_WAIT = Duration.ofSeconds(45);
  public static final Duration DEFAULT_STATEMENT_POLL_WAIT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_EXECUTE_RETRY_WAIT = Duration.ofSeconds(10);
  public static final int DEFAULT_EXECUTE_RETRIES = 5;
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(300);
  public static final List<String> DEFAULT_EXECUTE_RETRY_PATTERNS =
      Collections.singletonList("Request failed: HTTP/1.1 403 Forbidden ClientRequestId");

  private final String endpoint;
  private final String workspaceId;
  private final String lakehouseId;
  private final String lakehouseEndpoint;
  private final String authentication;
  private final String tenantId;
  private final String clientId;
  private final String clientSecret;
  private final String livySessionName;
  private final Map<String, Object> livySessionParameters;
  private final boolean keepSession;
  private final String shortcutsJsonPath;
  private final Duration sessionPollWait;
  private final Duration statementPollWait;
  private final Duration executeRetryWait;
  private final int executeRetries;
  private final Duration pollTimeout;
  private final Duration connectTimeout;
  private final Duration socketTimeout;
  private final List<String> executeRetryPatterns;

  private LivyCredentials(Builder builder) {
    this.endpoint = builder.endpoint;
    this.workspaceId = builder.workspaceId;
    this.lakehouseId = builder.lakehouseId;
    this.lakehouseEndpoint =
        !isNullOrEmpty(builder.lakehouseEndpoint)
            ? builder.lakehouseEndpoint
            : buildLakehouseEndpoint(builder.endpoint, builder.workspaceId, builder.lakehouseId);
    this.authentication = builder.authentication;
    this.tenantId = builder.tenantId;
    this.clientId = builder.clientId;
    this.clientSecret = builder.clientSecret;
    this.livySessionName = builder.livySessionName;
    this.livySessionParameters =
        Collections.unmodifiableMap(new LinkedHashMap<>(builder.livySessionParameters));
    this.keepSession = builder.keepSession;
    this.shortcutsJsonPath = builder.shortcutsJsonPath;
    this.sessionPollWait = builder.sessionPollWait;
    this.statementPollWait = builder.statementPollWait;
    this.executeRetryWait = builder.executeRetryWait;
    this.executeRetries = builder.executeRetries;
    this.pollTimeout = builder.pollTimeout;
    this.connectTimeout = builder.connectTimeout;
    this.socketTimeout = builder.socketTimeout;
    this.executeRetryPatterns =
        Collections.unmodifiableList(new ArrayList<>(builder.executeRetryPatterns));
  }

  static String buildLakehouseEndpoint(String endpoint, String workspaceId, String lakehouseId) {
    String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    return base
        + "/workspaces/"
        + workspaceId
        + "/lakehouses/"
        + lakehouseId
        + "/livyapi/versions/"
        + LIVY_API_VERSION;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Build credentials from connection properties, see {@link LivySessionProperty} for the keys.
   * Values may be typed objects or their string form.
   *
   * @param properties connection properties
   * @return credentials
   * @throws LivyException if a required property is missing or a value has the wrong type
   */
  public static LivyCredentials fromProperties(Properties properties) throws LivyException {
    Builder builder = builder();
    for (Object key : properties.keySet()) {
      if (LivySessionProperty.lookupByKey(String.valueOf(key)) == null) {
        logger.warn("Unknown connection property: {}", key);
      }
    }
    for (Map.Entry<Object, Object> entry : properties.entrySet()) {
      LivySessionProperty property =
          LivySessionProperty.lookupByKey(String.valueOf(entry.getKey()));
      if (property == null || entry.getValue() == null) {
        continue;
      }
      Object value = entry.getValue();
      logger.debug(
          "Connection property {}: {}",
          property.getPropertyKey(),
          SecretDetector.maskParameterValue(property.getPropertyKey(), String.valueOf(value)));
      switch (property) {
        case ENDPOINT:
          builder.setEndpoint(value.toString());
          break;
        case LAKEHOUSE_ENDPOINT:
          builder.setLakehouseEndpoint(value.toString());
          break;
        case WORKSPACE_ID:
          builder.setWorkspaceId(value.toString());
          break;
        case LAKEHOUSE_ID:
          builder.setLakehouseId(value.toString());
          break;
        case AUTHENTICATION:
          builder.setAuthentication(value.toString());
          break;
        case TENANT_ID:
          builder.setTenantId(value.toString());
          break;
        case CLIENT_ID:
          builder.setClientId(value.toString());
          break;
        case CLIENT_SECRET:
          builder.setClientSecret(value.toString());
          break;
        case LIVY_SESSION_NAME:
          builder.setLivySessionName(value.toString());
          break;
        case LIVY_SESSION_PARAMETERS:
          builder.setLivySessionParameters(toMap(property, value));
          break;
        case KEEP_SESSION:
          builder.setKeepSession(toBoolean(property, value));
          break;
        case SHORTCUTS_JSON_PATH:
          builder.setShortcutsJsonPath(value.toString());
          break;
        case SESSION_POLL_WAIT:
          builder.setSessionPollWait(Duration.ofSeconds(toInt(property, value)));
          break;
        case STATEMENT_POLL_WAIT:
          builder.setStatementPollWait(Duration.ofSeconds(toInt(property, value)));
          break;
        case EXECUTE_RETRY_WAIT:
          builder.setExecuteRetryWait(Duration.ofSeconds(toInt(property, value)));
          break;
        case POLL_TIMEOUT:
          builder.setPollTimeout(Duration.ofSeconds(toInt(property, value)));
          break;
        case CONNECT_TIMEOUT:
          builder.setConnectTimeout(Duration.ofSeconds(toInt(property, value)));
          break;
        case SOCKET_TIMEOUT:
          builder.setSocketTimeout(Duration.ofSeconds(toInt(property, value)));
          break;
        case EXECUTE_RETRIES:
          builder.setExecuteRetries(toInt(property, value));
          break;
        case EXECUTE_RETRY_PATTERNS:
          builder.setExecuteRetryPatterns(toStringList(value));
          break;
        default:
          break;
      }
    }
    return builder.build();
  }

  private static boolean toBoolean(LivySessionProperty property, Object value)
      throws LivyException {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new LivyException(
        ErrorCode.INVALID_CONNECTION_PROPERTY, property.getPropertyKey(), value);
  }

  private static int toInt(LivySessionProperty property, Object value) throws LivyException {
    if (value instanceof Number) {
      return ((Number) value).intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new LivyException(
          ex, ErrorCode.INVALID_CONNECTION_PROPERTY, property.getPropertyKey(), value);
    }
  }

  private static Map<String, Object> toMap(LivySessionProperty property, Object value)
      throws LivyException {
    if (value instanceof Map) {
      Map<String, Object> result = new LinkedHashMap<>();
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        result.put(String.valueOf(e.getKey()), e.getValue());
      }
      return result;
    }
    try {
      return OBJECT_MAPPER.readValue(
          value.toString(), new TypeReference<LinkedHashMap<String, Object>>() {});
    } catch (IOException ex) {
      throw new LivyException(
          ex, ErrorCode.INVALID_CONNECTION_PROPERTY, property.getPropertyKey(), value);
    }
  }

  private static List<String> toStringList(Object value) {
    List<String> result = new ArrayList<>();
    if (value instanceof Collection) {
      for (Object o : (Collection<?>) value) {
        result.add(String.valueOf(o));
      }
    } else {
      result.add(value.toString());
    }
    return result;
  }

  public boolean isCliAuthentication() {
    return authentication != null && CLI_AUTHENTICATION.equalsIgnoreCase(authentication.trim());
  }

  /** @return the session creation payload: {kind, conf, name} */
  public Map<String, Object> getSessionRequestBody() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("kind", StatementKind.SQL.getKind());
    body.put("conf", livySessionParameters);
    body.put("name", livySessionName);
    return body;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public String getWorkspaceId() {
    return workspaceId;
  }

  public String getLakehouseId() {
    return lakehouseId;
  }

  public String getLakehouseEndpoint() {
    return lakehouseEndpoint;
  }

  public String getAuthentication() {
    return authentication;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getClientId() {
    return clientId;
  }

  public String getClientSecret() {
    return clientSecret;
  }

  public String getLivySessionName() {
    return livySessionName;
  }

  public Map<String, Object> getLivySessionParameters() {
    return livySessionParameters;
  }

  public boolean isKeepSession() {
    return keepSession;
  }

  public String getShortcutsJsonPath() {
    return shortcutsJsonPath;
  }

  public Duration getSessionPollWait() {
    return sessionPollWait;
  }

  public Duration getStatementPollWait() {
    return statementPollWait;
  }

  public Duration getExecuteRetryWait() {
    return executeRetryWait;
  }

  public int getExecuteRetries() {
    return executeRetries;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public Duration getSocketTimeout() {
    return socketTimeout;
  }

  public List<String> getExecuteRetryPatterns() {
    return executeRetryPatterns;
  }

  @Override
  public String toString() {
    return "LivyCredentials{"
        + "lakehouseEndpoint='"
        + lakehouseEndpoint
        + '\''
        + ", authentication='"
        + authentication
        + '\''
        + ", livySessionName='"
        + livySessionName
        + '\''
        + ", keepSession="
        + keepSession
        + '}';
  }

  public static class Builder {
    private String endpoint = DEFAULT_ENDPOINT;
    private String workspaceId;
    private String lakehouseId;
    private String lakehouseEndpoint;
    private String authentication;
    private String tenantId;
    private String clientId;
    private String clientSecret;
    private String livySessionName;
    private Map<String, Object> livySessionParameters = new LinkedHashMap<>();
    private boolean keepSession;
    private String shortcutsJsonPath;
    private Duration sessionPollWait = DEFAULT_SESSION_POLL_WAIT;
    private Duration statementPollWait = DEFAULT_STATEMENT_POLL_WAIT;
    private Duration executeRetryWait = DEFAULT_EXECUTE_RETRY_WAIT;
    private int executeRetries = DEFAULT_EXECUTE_RETRIES;
    private Duration pollTimeout = Duration.ZERO;
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
    private List<String> executeRetryPatterns = DEFAULT_EXECUTE_RETRY_PATTERNS;

    public Builder setEndpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder setWorkspaceId(String workspaceId) {
      this.workspaceId = workspaceId;
      return this;
    }

    public Builder setLakehouseId(String lakehouseId) {
      this.lakehouseId = lakehouseId;
      return this;
    }

    public Builder setLakehouseEndpoint(String lakehouseEndpoint) {
      this.lakehouseEndpoint = lakehouseEndpoint;
      return this;
    }

    public Builder setAuthentication(String authentication) {
      this.authentication = authentication;
      return this;
    }

    public Builder setTenantId(String tenantId) {
      this.tenantId = tenantId;
      return this;
    }

    public Builder setClientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public Builder setLivySessionName(String livySessionName) {
      this.livySessionName = livySessionName;
      return this;
    }

    public Builder setLivySessionParameters(Map<String, Object> livySessionParameters) {
      this.livySessionParameters = livySessionParameters;
      return this;
    }

    public Builder setKeepSession(boolean keepSession) {
      this.keepSession = keepSession;
      return this;
    }

    public Builder setShortcutsJsonPath(String shortcutsJsonPath) {
      this.shortcutsJsonPath = shortcutsJsonPath;
      return this;
    }

    public Builder setSessionPollWait(Duration sessionPollWait) {
      this.sessionPollWait = sessionPollWait;
      return this;
    }

    public Builder setStatementPollWait(Duration statementPollWait) {
      this.statementPollWait = statementPollWait;
      return this;
    }

    public Builder setExecuteRetryWait(Duration executeRetryWait) {
      this.executeRetryWait = executeRetryWait;
      return this;
    }

    public Builder setExecuteRetries(int executeRetries) {
      this.executeRetries = executeRetries;
      return this;
    }

    public Builder setPollTimeout(Duration pollTimeout) {
      this.pollTimeout = pollTimeout;
      return this;
    }

    public Builder setConnectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder setSocketTimeout(Duration socketTimeout) {
      this.socketTimeout = socketTimeout;
      return this;
    }

    public Builder setExecuteRetryPatterns(List<String> executeRetryPatterns) {
      this.executeRetryPatterns = executeRetryPatterns;
      return this;
    }

    /**
     * @return the credentials
     * @throws LivyException if the endpoint can not be determined, or service principal
     *     authentication is used without tenant, client id and secret
     */
    public LivyCredentials build() throws LivyException {
      if (isNullOrEmpty(lakehouseEndpoint)) {
        if (isNullOrEmpty(workspaceId)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY,
              LivySessionProperty.WORKSPACE_ID.getPropertyKey());
        }
        if (isNullOrEmpty(lakehouseId)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY,
              LivySessionProperty.LAKEHOUSE_ID.getPropertyKey());
        }
        if (isNullOrEmpty(endpoint)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY, LivySessionProperty.ENDPOINT.getPropertyKey());
        }
      }
      boolean cli =
          authentication != null && CLI_AUTHENTICATION.equalsIgnoreCase(authentication.trim());
      if (!cli) {
        if (isNullOrEmpty(tenantId)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY,
              LivySessionProperty.TENANT_ID.getPropertyKey());
        }
        if (isNullOrEmpty(clientId)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY,
              LivySessionProperty.CLIENT_ID.getPropertyKey());
        }
        if (isNullOrEmpty(clientSecret)) {
          throw new LivyException(
              ErrorCode.MISSING_CONNECTION_PROPERTY,
              LivySessionProperty.CLIENT_SECRET.getPropertyKey());
        }
      }
      if (executeRetries < 0) {
        throw new LivyException(
            ErrorCode.INVALID_CONNECTION_PROPERTY,
            LivySessionProperty.EXECUTE_RETRIES.getPropertyKey(),
            executeRetries);
      }
      if (livySessionParameters == null) {
        livySessionParameters = new LinkedHashMap<>();
      }
      if (executeRetryPatterns == null) {
        executeRetryPatterns = Collections.emptyList();
      }
      return new LivyCredentials(this);
    }
  }
}
