package net.fabricspark.client.core;

import net.fabricspark.client.jdbc.ErrorCode;

/** A request reached the server but came back with a non 2xx status. */
public class HttpStatusException extends LivyException {
  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String responseBody;

  public HttpStatusException(String requestLine, int statusCode, String responseBody) {
    super(ErrorCode.NETWORK_ERROR, requestLine, "HTTP " + statusCode + " " + responseBody);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
