package net.fabricspark.client.core;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/**
 * Holds the bearer token used for every request and refreshes it before it expires. A token is
 * never handed out within {@link #REFRESH_MARGIN} of its expiry.
 */
public class AccessTokenCache {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(AccessTokenCache.class);

  public static final String CREDENTIAL_SCOPE =
      "https://analysis.windows.net/powerbi/api/.default";

  static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

  private final TokenCredentialFactory credentialFactory;
  private final Clock clock;

  private AccessToken accessToken;
  private OffsetDateTime lastFetched;

  public AccessTokenCache() {
    this(TokenCredentialFactory.DEFAULT, Clock.systemUTC());
  }

  public AccessTokenCache(TokenCredentialFactory credentialFactory, Clock clock) {
    this.credentialFactory = credentialFactory;
    this.clock = clock;
  }

  /**
   * @param credentials connection credentials, deciding between cli and service principal
   * @return Authorization and Content-Type headers for a Livy request
   * @throws LivyException if a token has to be fetched and that fails
   */
  public Map<String, String> getHeaders(LivyCredentials credentials) throws LivyException {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    headers.put("Authorization", "Bearer " + getAccessToken(credentials).getToken());
    return headers;
  }

  /**
   * Returns the cached token, fetching a new one first when there is none or it expires within
   * five minutes.
   *
   * @param credentials connection credentials
   * @return a token valid for at least five more minutes, as far as the issuer is concerned
   * @throws LivyException if the identity provider fails
   */
  public synchronized AccessToken getAccessToken(LivyCredentials credentials)
      throws LivyException {
    if (accessToken == null || isRefreshNecessary(accessToken)) {
      accessToken = fetchAccessToken(credentials);
      lastFetched = OffsetDateTime.now(clock);
    }
    return accessToken;
  }

  boolean isRefreshNecessary(AccessToken token) {
    OffsetDateTime refreshAfter = OffsetDateTime.now(clock).plus(REFRESH_MARGIN);
    boolean necessary = !token.getExpiresAt().isAfter(refreshAfter);
    if (necessary) {
      logger.debug("Token refresh necessary, token expires at {}", token.getExpiresAt());
    }
    return necessary;
  }

  private AccessToken fetchAccessToken(LivyCredentials credentials) throws LivyException {
    String method = credentials.isCliAuthentication() ? "CLI" : "SPN";
    logger.debug("Using {} auth", method);
    AccessToken token;
    try {
      TokenCredential credential = credentialFactory.create(credentials);
      token = credential.getTokenSync(new TokenRequestContext().addScopes(CREDENTIAL_SCOPE));
    } catch (RuntimeException ex) {
      throw new LivyException(ex, ErrorCode.TOKEN_ACQUISITION_ERROR, ex.getMessage());
    }
    if (token == null) {
      throw new LivyException(
          ErrorCode.TOKEN_ACQUISITION_ERROR, method + " credential returned no token");
    }
    logger.info("{} - Fetched access token, expires at {}", method, token.getExpiresAt());
    return token;
  }

  public synchronized OffsetDateTime getLastFetched() {
    return lastFetched;
  }

  /** Drops the cached token so that the next request fetches a new one. */
  public synchronized void invalidate() {
    accessToken = null;
  }
}
