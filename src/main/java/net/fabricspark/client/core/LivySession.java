package net.fabricspark.client.core;

import static net.fabricspark.client.jdbc.LivyUtil.isNullOrEmpty;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/**
 * Client side handle of one remote Livy session: finds a reusable session by name or creates a
 * new one, checks whether it can still be used and tears it down.
 *
 * <p>Session creation provisions compute on the remote side and takes minutes, so an existing
 * idle session with the configured name is always preferred.
 */
public class LivySession {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivySession.class);

  static final String SESSIONS_PATH = "/sessions";

  private final LivyCredentials credentials;
  private final LivyRestClient restClient;
  private final Sleeper sleeper;
  private final Clock clock;

  private volatile String sessionId;
  private volatile boolean newSessionRequired = true;

  public LivySession(LivyCredentials credentials, LivyRestClient restClient) {
    this(credentials, restClient, Sleeper.THREAD_SLEEPER, Clock.systemUTC());
  }

  public LivySession(
      LivyCredentials credentials, LivyRestClient restClient, Sleeper sleeper, Clock clock) {
    this.credentials = credentials;
    this.restClient = restClient;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  /**
   * Looks for a session named after {@link LivyCredentials#getLivySessionName()} and waits for the
   * first usable match to become idle. Sessions that are dead, shutting down or killed are
   * skipped.
   *
   * @return the id of the adopted session, or null if no name is configured or nothing matched
   * @throws LivyException if the session list or a session status can not be fetched
   */
  public String findExistingByName() throws LivyException {
    String name = credentials.getLivySessionName();
    if (isNullOrEmpty(name)) {
      return null;
    }
    logger.debug("Get existing livy session with name: {}", name);
    JsonNode sessions = restClient.get(SESSIONS_PATH);
    for (JsonNode item : sessions.path("items")) {
      if (!name.equals(item.path("name").asText(null))) {
        continue;
      }
      String candidate = item.path("id").asText();
      SessionState listed = SessionState.fromString(item.path("livyState").asText(null));
      if (listed.isInvalid()) {
        logger.debug("Skipping session {} in state {}", candidate, listed.getDescription());
        continue;
      }
      SessionState reached = waitWhileStarting(candidate);
      if (reached == SessionState.IDLE) {
        logger.debug("Session already exists: {}", candidate);
        this.sessionId = candidate;
        return candidate;
      }
      logger.debug(
          "Session {} became {} while waiting, skipping", candidate, reached.getDescription());
    }
    return null;
  }

  /**
   * Creates a new session and waits until it is idle.
   *
   * @return the new session id
   * @throws LivyException {@link ErrorCode#CONNECTION_ERROR} if the create request got no valid
   *     answer or the session died while starting, {@link ErrorCode#BAD_RESPONSE} if the answer
   *     carries no session id
   */
  public String create() throws LivyException {
    logger.info("Creating Livy session (this may take a few minutes)");
    JsonNode response;
    try {
      response = restClient.post(SESSIONS_PATH, credentials.getSessionRequestBody());
    } catch (LivyException ex) {
      if (ex.getErrorCode() != ErrorCode.NETWORK_ERROR) {
        throw ex;
      }
      logger.error("Livy session create request failed: {}", ex.getMessage());
      throw new LivyException(
          ex, ErrorCode.CONNECTION_ERROR, "invalid response from livy server");
    }
    logger.debug("Initiated Livy session");

    JsonNode id = response.get("id");
    if (id == null || id.isNull() || id.isContainerNode()) {
      throw new LivyException(
          ErrorCode.BAD_RESPONSE, "no session id in create response: " + response);
    }
    this.sessionId = id.asText();

    SessionState reached = waitWhileStarting(sessionId);
    if (reached != SessionState.IDLE) {
      logger.error("Cannot create a livy session, session {} is {}", sessionId, reached);
      throw new LivyException(
          ErrorCode.CONNECTION_ERROR,
          "failed to connect, session " + sessionId + " is " + reached.getDescription());
    }
    this.newSessionRequired = false;
    logger.info("Livy session {} created successfully", sessionId);
    return sessionId;
  }

  /**
   * @return the id of an existing session with the configured name, or of a newly created one
   * @throws LivyException if neither works out
   */
  public String getOrCreate() throws LivyException {
    String existing = findExistingByName();
    if (existing == null) {
      return create();
    }
    return existing;
  }

  /**
   * A session can be reused as long as it is not dead, killed or shutting down. A session whose
   * status can not be fetched is reported invalid.
   *
   * @return true if the current session can take statements
   */
  public boolean isValid() {
    String id = sessionId;
    if (id == null) {
      return false;
    }
    try {
      JsonNode res = restClient.get(sessionPath(id));
      return !currentState(res).isInvalid();
    } catch (LivyException ex) {
      logger.warn("Unable to get the state of livy session {}: {}", id, ex.getMessage());
      return false;
    }
  }

  /** Deletes the remote session. Failures are logged and never thrown. */
  public void delete() {
    String id = sessionId;
    if (id == null) {
      logger.debug("No livy session to close");
      return;
    }
    logger.debug("Closing the livy session: {}", id);
    try {
      restClient.delete(sessionPath(id));
      logger.debug("Closed the livy session: {}", id);
    } catch (LivyException | RuntimeException ex) {
      logger.error("Unable to close the livy session {}, error: {}", id, ex.getMessage());
    }
  }

  /**
   * Polls the session until it leaves the starting states. Any state other than idle or a failed
   * one keeps the loop going.
   */
  private SessionState waitWhileStarting(String id) throws LivyException {
    PollDeadline deadline = PollDeadline.start(clock, credentials.getPollTimeout());
    String activity = "livy session " + id + " to start";
    while (true) {
      JsonNode res = restClient.get(sessionPath(id));
      SessionState state = SessionState.fromString(res.path("state").asText(null));
      if (!state.isStarting()) {
        SessionState current = currentState(res);
        if (current == SessionState.IDLE) {
          logger.debug("Livy session {} is idle", id);
          return current;
        }
        if (current.isFailed()) {
          return current;
        }
      }
      logger.trace("Livy session {} is {}, polling again", id, state.getDescription());
      deadline.check(activity);
      PollDeadline.sleep(sleeper, credentials.getSessionPollWait(), activity);
    }
  }

  private static SessionState currentState(JsonNode sessionStatus) {
    JsonNode current = sessionStatus.path("livyInfo").path("currentState");
    if (current.isMissingNode() || current.isNull()) {
      return SessionState.fromString(sessionStatus.path("state").asText(null));
    }
    return SessionState.fromString(current.asText());
  }

  static String sessionPath(String id) {
    return SESSIONS_PATH + "/" + id;
  }

  String statementsPath() {
    return sessionPath(sessionId) + "/statements";
  }

  String statementPath(String statementId) {
    return statementsPath() + "/" + statementId;
  }

  public String getSessionId() {
    return sessionId;
  }

  public boolean isNewSessionRequired() {
    return newSessionRequired;
  }

  public void setNewSessionRequired(boolean newSessionRequired) {
    this.newSessionRequired = newSessionRequired;
  }

  public boolean isKeepingSession() {
    return credentials.isKeepSession();
  }

  public LivyCredentials getCredentials() {
    return credentials;
  }

  public LivyRestClient getRestClient() {
    return restClient;
  }
}
