package net.fabricspark.client.core;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import net.fabricspark.client.jdbc.LivyConnection;
import net.fabricspark.client.jdbc.LivyConnectionV1;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import net.fabricspark.client.shortcut.ShortcutProvisioner;

/**
 * Owns the single remote session shared by every connection handed out by this manager.
 *
 * <p>The first {@link #connect(LivyCredentials)} adopts or creates the session and provisions the
 * configured shortcuts. Later calls reuse it, replacing it when it became invalid or after {@link
 * #disconnect()} deleted it.
 */
public class LivySessionManager implements Closeable {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivySessionManager.class);

  private final Function<LivyCredentials, LivySession> sessionFactory;
  private final AccessTokenCache tokenCache;
  private final ShortcutProvisioner shortcutProvisioner;
  private final Sleeper sleeper;
  private final Clock clock;

  // serializes statements of all connections on the shared session
  private final ReentrantLock statementLock = new ReentrantLock();

  // guarded by this
  private LivySession session;

  public LivySessionManager() {
    this(new AccessTokenCache(), Sleeper.THREAD_SLEEPER, Clock.systemUTC());
  }

  LivySessionManager(AccessTokenCache tokenCache, Sleeper sleeper, Clock clock) {
    this(
        credentials ->
            new LivySession(
                credentials,
                new LivyRestClient(
                    credentials,
                    tokenCache,
                    HttpUtil.buildHttpClient(
                        credentials.getConnectTimeout(), credentials.getSocketTimeout())),
                sleeper,
                clock),
        tokenCache,
        ShortcutProvisioner.FABRIC_API,
        sleeper,
        clock);
  }

  LivySessionManager(
      Function<LivyCredentials, LivySession> sessionFactory,
      AccessTokenCache tokenCache,
      ShortcutProvisioner shortcutProvisioner,
      Sleeper sleeper,
      Clock clock) {
    this.sessionFactory = sessionFactory;
    this.tokenCache = tokenCache;
    this.shortcutProvisioner = shortcutProvisioner;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  /**
   * Makes sure a usable session exists and returns a connection bound to it.
   *
   * @param credentials connection settings
   * @return a new connection sharing this manager's session
   * @throws LivyException if no session could be found or created
   */
  public LivyConnection connect(LivyCredentials credentials) throws LivyException {
    connectSession(credentials);
    return new LivyConnectionV1(credentials, this);
  }

  synchronized LivySession connectSession(LivyCredentials credentials) throws LivyException {
    if (session == null) {
      LivySession newSession = sessionFactory.apply(credentials);
      newSession.getOrCreate();
      newSession.setNewSessionRequired(false);
      session = newSession;
      provisionShortcuts(credentials);
    } else if (!session.isValid()) {
      session.delete();
      session.create();
      session.setNewSessionRequired(false);
    } else if (session.isNewSessionRequired()) {
      session.create();
      session.setNewSessionRequired(false);
    } else {
      logger.debug("Reusing session: {}", session.getSessionId());
    }
    return session;
  }

  private void provisionShortcuts(LivyCredentials credentials) {
    String shortcutsJsonPath = credentials.getShortcutsJsonPath();
    if (shortcutsJsonPath == null || shortcutsJsonPath.isEmpty()) {
      return;
    }
    try {
      String token = tokenCache.getAccessToken(credentials).getToken();
      shortcutProvisioner.provision(
          token, credentials.getWorkspaceId(), credentials.getLakehouseId(), shortcutsJsonPath);
    } catch (LivyException | RuntimeException ex) {
      logger.error("Unable to create shortcuts from {}: {}", shortcutsJsonPath, ex.getMessage());
    }
  }

  /** Deletes the session unless it is configured to be kept or is no longer valid. */
  public synchronized void disconnect() {
    if (session != null && session.isValid() && !session.isKeepingSession()) {
      session.delete();
      session.setNewSessionRequired(true);
    }
  }

  /** Disconnects and releases the HTTP client of the session. */
  @Override
  public synchronized void close() throws IOException {
    disconnect();
    if (session != null) {
      session.getRestClient().close();
    }
  }

  public synchronized LivySession getSession() {
    return session;
  }

  public AccessTokenCache getTokenCache() {
    return tokenCache;
  }

  ReentrantLock getStatementLock() {
    return statementLock;
  }

  Sleeper getSleeper() {
    return sleeper;
  }

  Clock getClock() {
    return clock;
  }
}
