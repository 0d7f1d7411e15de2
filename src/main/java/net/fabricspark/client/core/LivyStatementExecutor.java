package net.fabricspark.client.core;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/**
 * Runs statements on the session of a {@link LivySessionManager}. Statements of every executor
 * bound to the same manager run one at a time, since they share the remote session.
 *
 * <p>A statement goes through a submit loop and a poll loop. Submissions answered with state
 * <code>error</code> are resent with a linearly growing wait. Results that failed with one of the
 * configured transient errors are retried by running the whole cycle again.
 */
public class LivyStatementExecutor {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyStatementExecutor.class);

  static final String STATE_AVAILABLE = "available";
  static final String STATE_ERROR = "error";
  static final String STATE_CANCELLED = "cancelled";
  static final String STATUS_OK = "ok";
  static final String STATUS_ERROR = "error";
  static final String JSON_MIME_TYPE = "application/json";

  private final LivySessionManager sessionManager;
  private final LivyCredentials credentials;
  private final Sleeper sleeper;
  private final Clock clock;

  private final ReentrantLock lock;

  public LivyStatementExecutor(LivySessionManager sessionManager, LivyCredentials credentials) {
    this(sessionManager, credentials, sessionManager.getSleeper(), sessionManager.getClock());
  }

  public LivyStatementExecutor(
      LivySessionManager sessionManager,
      LivyCredentials credentials,
      Sleeper sleeper,
      Clock clock) {
    this.sessionManager = sessionManager;
    this.credentials = credentials;
    this.sleeper = sleeper;
    this.clock = clock;
    this.lock = sessionManager.getStatementLock();
  }

  /**
   * Executes code on the remote session and waits for its result.
   *
   * @param code statement text, already prepared for its kind
   * @param kind sql or pyspark
   * @return rows and schema of the statement
   * @throws LivyException {@link ErrorCode#QUERY_EXECUTION_ERROR} if the statement failed on the
   *     server, or any protocol error raised while submitting and polling
   */
  public LivyResult execute(String code, StatementKind kind) throws LivyException {
    lock.lock();
    try {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("code", code);
      body.put("kind", kind.getKind());
      logger.info("Start to execute livy code");

      String statementId;
      JsonNode output;
      int retries = 0;
      while (true) {
        LivySession session = currentSession();
        JsonNode submitted = submit(session, body);
        statementId = statementId(submitted);
        JsonNode result = waitForResult(session, statementId);
        logger.info("Get result with available state");
        output = result.path("output");
        if (!isTransientExecuteError(output) || retries >= credentials.getExecuteRetries()) {
          break;
        }
        logger.debug("Get result is available but facing error: {}", result);
        retries++;
        logger.info("Start retries {}", retries);
        PollDeadline.sleep(sleeper, backoff(retries), "waiting to rerun statement");
      }
      return toResult(statementId, output);
    } finally {
      lock.unlock();
    }
  }

  private LivySession currentSession() throws LivyException {
    LivySession session = sessionManager.getSession();
    if (session == null || session.isNewSessionRequired()) {
      session = sessionManager.connectSession(credentials);
    }
    if (session.getSessionId() == null) {
      throw new LivyException(ErrorCode.SESSION_NOT_AVAILABLE, "session has no id");
    }
    return session;
  }

  /** Posts the statement, resending it while the server answers with state error. */
  JsonNode submit(LivySession session, Map<String, Object> body) throws LivyException {
    logger.info("Submitting livy code");
    logger.debug("Submitted: {} {}", body, session.statementsPath());
    int retries = 0;
    while (true) {
      JsonNode res = session.getRestClient().post(session.statementsPath(), body);
      if (!STATE_ERROR.equals(res.path("state").asText(null))) {
        return res;
      }
      if (retries >= credentials.getExecuteRetries()) {
        logger.error("Submit code still failing after {} retries: {}", retries, res);
        throw new LivyException(
            ErrorCode.SUBMIT_RETRIES_EXHAUSTED, retries, String.valueOf(res));
      }
      logger.debug("Submit code error: {}", res);
      retries++;
      logger.info("Start retries {}", retries);
      PollDeadline.sleep(sleeper, backoff(retries), "waiting to resubmit statement");
    }
  }

  /** Polls the statement until it is available. */
  JsonNode waitForResult(LivySession session, String statementId) throws LivyException {
    logger.info("Get livy result: {}", statementId);
    String activity = "statement " + statementId + " to finish";
    PollDeadline deadline = PollDeadline.start(clock, credentials.getPollTimeout());
    while (true) {
      JsonNode res = session.getRestClient().get(session.statementPath(statementId));
      String state = res.path("state").asText("");
      if (STATE_AVAILABLE.equals(state)) {
        return res;
      }
      if (STATE_ERROR.equals(state) || STATE_CANCELLED.equals(state)) {
        throw new LivyException(ErrorCode.STATEMENT_FAILED, statementId, state);
      }
      logger.info("Get response with state {}", state);
      deadline.check(activity);
      PollDeadline.sleep(sleeper, credentials.getStatementPollWait(), activity);
    }
  }

  private boolean isTransientExecuteError(JsonNode output) {
    if (!STATUS_ERROR.equals(output.path("status").asText(null))) {
      return false;
    }
    String evalue = output.path("evalue").asText("");
    for (String pattern : credentials.getExecuteRetryPatterns()) {
      if (evalue.contains(pattern)) {
        return true;
      }
    }
    return false;
  }

  // 10s, 20s, 30s, ... with the default wait
  private Duration backoff(int attempt) {
    return credentials.getExecuteRetryWait().multipliedBy(attempt);
  }

  private static String statementId(JsonNode submitted) throws LivyException {
    JsonNode id = submitted.get("id");
    if (id == null || id.isNull() || id.isContainerNode()) {
      throw new LivyException(
          ErrorCode.BAD_RESPONSE, "no statement id in submit response: " + submitted);
    }
    return id.asText();
  }

  private static LivyResult toResult(String statementId, JsonNode output) throws LivyException {
    String status = output.path("status").asText(null);
    if (STATUS_OK.equals(status)) {
      return LivyResult.fromPayload(output.path("data").path(JSON_MIME_TYPE));
    }
    if (STATUS_ERROR.equals(status)) {
      throw new LivyException(ErrorCode.QUERY_EXECUTION_ERROR, output.path("evalue").asText(""));
    }
    throw new LivyException(ErrorCode.UNEXPECTED_STATEMENT_STATUS, statementId, status);
  }
}
