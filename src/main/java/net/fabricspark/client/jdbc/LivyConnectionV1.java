package net.fabricspark.client.jdbc;

import java.util.Map;
import net.fabricspark.client.core.LivyCredentials;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.core.LivySession;
import net.fabricspark.client.core.LivySessionManager;
import net.fabricspark.client.core.LivyStatementExecutor;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

public class LivyConnectionV1 implements LivyConnection {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyConnectionV1.class);

  private final LivyCredentials credentials;
  private final LivySessionManager sessionManager;
  private final String sessionId;
  private final LivyCursor cursor;

  public LivyConnectionV1(LivyCredentials credentials, LivySessionManager sessionManager) {
    this.credentials = credentials;
    this.sessionManager = sessionManager;
    LivySession session = sessionManager.getSession();
    this.sessionId = session == null ? null : session.getSessionId();
    this.cursor = new LivyCursorV1(new LivyStatementExecutor(sessionManager, credentials));
  }

  @Override
  public LivyCursor cursor() {
    return cursor;
  }

  @Override
  public String getSessionId() {
    return sessionId;
  }

  @Override
  public String getConnectUrl() {
    return credentials.getLakehouseEndpoint();
  }

  @Override
  public Map<String, String> getHeaders() throws LivySQLException {
    try {
      return sessionManager.getTokenCache().getHeaders(credentials);
    } catch (LivyException ex) {
      throw new LivySQLException(ex);
    }
  }

  @Override
  public void close() {
    logger.debug("Connection.close()");
    cursor.close();
  }
}
