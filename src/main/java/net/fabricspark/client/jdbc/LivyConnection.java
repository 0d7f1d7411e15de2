package net.fabricspark.client.jdbc;

import java.util.Map;

/** Connection to a Livy session, handing out the cursor bound to it. */
public interface LivyConnection extends AutoCloseable {
  LivyCursor cursor();

  String getSessionId();

  /** @return the lakehouse Livy endpoint statements are sent to */
  String getConnectUrl();

  /**
   * @return request headers carrying a current access token
   * @throws LivySQLException if no token can be acquired
   */
  Map<String, String> getHeaders() throws LivySQLException;

  /** Closes the cursor. The session itself stays up. */
  @Override
  void close();
}
