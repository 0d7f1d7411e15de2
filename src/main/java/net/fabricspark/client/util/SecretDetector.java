package net.fabricspark.client.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Search for credentials in log messages, request dumps and connection parameters. */
public class SecretDetector {
  // "Authorization: Bearer eyJ..." or {"Authorization":"Bearer eyJ..."}
  private static final Pattern BEARER_TOKEN_PATTERN =
      Pattern.compile("(bearer\\s+)([a-z0-9._\\-+/=]{8,})", Pattern.CASE_INSENSITIVE);

  // Used for detecting OAuth tokens in serialized JSON
  private static final Pattern OAUTH_JSON_PATTERN =
      Pattern.compile(
          "(access_token|refresh_token|accessToken|token)\""
              + "\\s*:\\s*"
              + "\"([a-zA-Z0-9!#$%&'()*+,\\-./:;<=>?@\\[\\]^_`{|}~]{3,})\"",
          Pattern.CASE_INSENSITIVE);

  // client_secret=..., clientSecret: ..., password=...
  private static final Pattern SECRET_PATTERN =
      Pattern.compile(
          "(client_secret|clientsecret|password|pwd)"
              + "(['\"\\s:=]+)"
              + "([a-z0-9!#$%&()*+,\\-./:;<=>?@\\[\\]^_`{|}~]{6,})",
          Pattern.CASE_INSENSITIVE);

  // only attempt to find secrets in the leading 100Kb
  private static final int MAX_LENGTH = 100 * 1000;

  private static final Pattern SENSITIVE_PARAMETER_NAME =
      Pattern.compile(".*?(secret|password|pwd|token).*?", Pattern.CASE_INSENSITIVE);

  /**
   * Mask sensitive parameter values, used when connection parameters are logged.
   *
   * @param key parameter key
   * @param value parameter value
   * @return the original value, or a masked text if the key names a secret
   */
  public static String maskParameterValue(String key, String value) {
    if (key != null && SENSITIVE_PARAMETER_NAME.matcher(key).matches()) {
      return "****";
    }
    return value;
  }

  /**
   * Masks bearer tokens, OAuth tokens in JSON and client secrets / passwords.
   *
   * @param text text to mask
   * @return masked text, or the input unchanged if nothing was found
   */
  public static String maskSecrets(String text) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String head = text.length() <= MAX_LENGTH ? text : text.substring(0, MAX_LENGTH);
    String tail = text.length() <= MAX_LENGTH ? "" : text.substring(MAX_LENGTH);
    head = replace(BEARER_TOKEN_PATTERN, head, "$1****");
    head = replace(OAUTH_JSON_PATTERN, head, "$1\":\"****\"");
    head = replace(SECRET_PATTERN, head, "$1$2****");
    return head + tail;
  }

  private static String replace(Pattern pattern, String text, String replacement) {
    Matcher matcher = pattern.matcher(text);
    if (matcher.find()) {
      return matcher.replaceAll(replacement);
    }
    return text;
  }
}
