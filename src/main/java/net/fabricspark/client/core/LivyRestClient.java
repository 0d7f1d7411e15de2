package net.fabricspark.client.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.util.Map;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;

/**
 * JSON over HTTP channel to the lakehouse Livy API. Every request carries the headers of the
 * {@link AccessTokenCache}; a 401 answer invalidates the cached token and the request is sent
 * once more with a fresh one.
 */
public class LivyRestClient implements Closeable {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyRestClient.class);

  static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getObjectMapper();

  private final LivyCredentials credentials;
  private final AccessTokenCache tokenCache;
  private final CloseableHttpClient httpClient;
  private final String baseUrl;

  public LivyRestClient(
      LivyCredentials credentials, AccessTokenCache tokenCache, CloseableHttpClient httpClient) {
    this.credentials = credentials;
    this.tokenCache = tokenCache;
    this.httpClient = httpClient;
    String url = credentials.getLakehouseEndpoint();
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  public JsonNode get(String path) throws LivyException {
    return parse(execute(new HttpGet(baseUrl + path)), path);
  }

  public JsonNode post(String path, Object body) throws LivyException {
    HttpPost post = new HttpPost(baseUrl + path);
    try {
      post.setEntity(
          new StringEntity(OBJECT_MAPPER.writeValueAsString(body), ContentType.APPLICATION_JSON));
    } catch (JsonProcessingException ex) {
      throw new LivyException(ex, ErrorCode.INTERNAL_ERROR, "unable to serialize request body");
    }
    return parse(execute(post), path);
  }

  public void delete(String path) throws LivyException {
    execute(new HttpDelete(baseUrl + path));
  }

  private String execute(HttpRequestBase request) throws LivyException {
    setHeaders(request);
    try {
      return HttpUtil.executeRequest(request, httpClient);
    } catch (HttpStatusException ex) {
      if (ex.getStatusCode() != HttpStatus.SC_UNAUTHORIZED) {
        throw ex;
      }
      logger.warn(
          "{} {} was rejected as unauthorized, refreshing token",
          request.getMethod(),
          request.getURI());
      tokenCache.invalidate();
      setHeaders(request);
      return HttpUtil.executeRequest(request, httpClient);
    }
  }

  private void setHeaders(HttpRequestBase request) throws LivyException {
    for (Map.Entry<String, String> header : tokenCache.getHeaders(credentials).entrySet()) {
      request.setHeader(header.getKey(), header.getValue());
    }
  }

  private static JsonNode parse(String body, String path) throws LivyException {
    if (body == null || body.isEmpty()) {
      throw new LivyException(ErrorCode.BAD_RESPONSE, "empty response from " + path);
    }
    try {
      return OBJECT_MAPPER.readTree(body);
    } catch (IOException ex) {
      throw new LivyException(
          ex, ErrorCode.BAD_RESPONSE, "unable to decode response from " + path);
    }
  }

  public LivyCredentials getCredentials() {
    return credentials;
  }

  public AccessTokenCache getTokenCache() {
    return tokenCache;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
  }
}
