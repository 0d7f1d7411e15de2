package net.fabricspark.client.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import net.fabricspark.client.util.Stopwatch;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;

public class HttpUtil {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(HttpUtil.class);

  static final String USER_AGENT = "FabricSparkLivyClient/1.0";

  private static final int DEFAULT_MAX_CONNECTIONS = 50;
  private static final int DEFAULT_TTL = 60;

  private HttpUtil() {}

  /**
   * Build an http client with a pooling connection manager. JVM proxy settings are honored and
   * cookies are ignored.
   *
   * @param connectTimeout connect and connection-request timeout
   * @param socketTimeout socket read timeout
   * @return a new http client, owned by the caller
   */
  public static CloseableHttpClient buildHttpClient(
      Duration connectTimeout, Duration socketTimeout) {
    logger.debug(
        "Building http client, connect timeout: {} ms, socket timeout: {} ms",
        connectTimeout.toMillis(),
        socketTimeout.toMillis());
    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout((int) connectTimeout.toMillis())
            .setConnectionRequestTimeout((int) connectTimeout.toMillis())
            .setSocketTimeout((int) socketTimeout.toMillis())
            .build();

    PoolingHttpClientConnectionManager connectionManager =
        new PoolingHttpClientConnectionManager(DEFAULT_TTL, TimeUnit.SECONDS);
    connectionManager.setMaxTotal(DEFAULT_MAX_CONNECTIONS);
    connectionManager.setDefaultMaxPerRoute(DEFAULT_MAX_CONNECTIONS);

    return HttpClientBuilder.create()
        .setConnectionManager(connectionManager)
        // Support JVM proxy settings
        .useSystemProperties()
        .setUserAgent(USER_AGENT)
        .disableCookieManagement()
        .setDefaultRequestConfig(requestConfig)
        .build();
  }

  /**
   * Executes a request once and returns the response body.
   *
   * @param httpRequest request to send
   * @param httpClient client used to send it
   * @return response body, empty if the response has no entity
   * @throws HttpStatusException on a non 2xx status
   * @throws LivyException with {@link ErrorCode#NETWORK_ERROR} on connection or timeout failures
   */
  public static String executeRequest(HttpRequestBase httpRequest, CloseableHttpClient httpClient)
      throws LivyException {
    String requestLine = httpRequest.getMethod() + " " + httpRequest.getURI();
    Stopwatch stopwatch = Stopwatch.createStarted();
    try (CloseableHttpResponse response = httpClient.execute(httpRequest)) {
      int statusCode = response.getStatusLine().getStatusCode();
      String body =
          response.getEntity() == null
              ? ""
              : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      stopwatch.stop();
      logger.debug("{} returned {} in {} ms", requestLine, statusCode, stopwatch.elapsedMillis());
      if (statusCode < 200 || statusCode >= 300) {
        logger.debug("Error response body: {}", body);
        throw new HttpStatusException(requestLine, statusCode, body);
      }
      return body;
    } catch (IOException ex) {
      logger.debug("{} failed: {}", requestLine, ex.getMessage());
      throw new LivyException(ex, ErrorCode.NETWORK_ERROR, requestLine, ex.getMessage());
    } finally {
      httpRequest.releaseConnection();
    }
  }
}
